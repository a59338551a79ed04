/**
 * Read-time schema evolution of stored event payloads.
 */
package io.eventlog.upcast;
