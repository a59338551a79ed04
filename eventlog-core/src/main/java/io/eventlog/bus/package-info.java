/**
 * In-process distribution of committed events to live subscribers by hierarchical key
 * pattern, with bounded per-subscriber buffers.
 *
 * @see io.eventlog.bus.EventBus
 * @see io.eventlog.bus.KeyExpression
 */
package io.eventlog.bus;
