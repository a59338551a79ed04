/**
 * Command execution: the load, fold, decide, append, publish cycle of
 * {@link io.eventlog.runtime.AggregateRuntime}, conflict and retry policies, and routing
 * through the {@link io.eventlog.runtime.CommandGateway}.
 */
package io.eventlog.runtime;
