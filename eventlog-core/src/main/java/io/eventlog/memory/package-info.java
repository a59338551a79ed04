/**
 * In-memory {@link io.eventlog.EventLog} for tests and demos.
 */
package io.eventlog.memory;
