/**
 * Internal utilities: thread factory and metadata JSON codec.
 */
package io.eventlog.util;
