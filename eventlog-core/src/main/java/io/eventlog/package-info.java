/**
 * Core API of the event log: the {@link io.eventlog.EventLog} contract, the
 * {@link io.eventlog.EventEnvelope} written to it, the {@link io.eventlog.StoredEvent} read
 * from it, the {@link io.eventlog.EventCodec} translating domain events, and the exception
 * hierarchy rooted in {@link io.eventlog.EventLogException}.
 *
 * @see io.eventlog.runtime.AggregateRuntime
 * @see io.eventlog.bus.EventBus
 * @see io.eventlog.feed.ReplayCoordinator
 */
package io.eventlog;
