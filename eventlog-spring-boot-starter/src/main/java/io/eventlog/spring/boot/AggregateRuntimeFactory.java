package io.eventlog.spring.boot;

import io.eventlog.EventLog;
import io.eventlog.bus.EventBus;
import io.eventlog.runtime.AggregateDefinition;
import io.eventlog.runtime.AggregateRuntime;
import io.eventlog.runtime.CommandGateway;
import io.eventlog.runtime.RetryPolicy;
import io.eventlog.spi.MetricsExporter;

import java.util.Objects;

/**
 * Hands out {@link AggregateRuntime} builders pre-wired with the context's event log, bus,
 * gateway, retry policy, metrics and {@code eventlog.runtime.*} settings.
 *
 * <pre>{@code
 * @Bean
 * AggregateRuntime<TodoCommand, TodoState, TodoEvent> todoRuntime(AggregateRuntimeFactory runtimes) {
 *   return runtimes.builder(TodoAggregate.definition())
 *       .onCommitted(auditHandler)
 *       .build();
 * }
 * }</pre>
 *
 * <p>Runtime beans are registered with the {@link CommandGateway} by
 * {@link AggregateRuntimeRegistrar} once all singletons exist.
 */
public class AggregateRuntimeFactory {
  private final EventLog eventLog;
  private final EventBus eventBus;
  private final CommandGateway gateway;
  private final RetryPolicy retryPolicy;
  private final MetricsExporter metrics;
  private final EventLogProperties.Runtime settings;

  public AggregateRuntimeFactory(EventLog eventLog, EventBus eventBus, CommandGateway gateway,
      RetryPolicy retryPolicy, MetricsExporter metrics, EventLogProperties.Runtime settings) {
    this.eventLog = Objects.requireNonNull(eventLog, "eventLog");
    this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
    this.gateway = Objects.requireNonNull(gateway, "gateway");
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  public <C, S, E> AggregateRuntime.Builder<C, S, E> builder(AggregateDefinition<C, S, E> definition) {
    return AggregateRuntime.builder(definition)
        .eventLog(eventLog)
        .eventBus(eventBus)
        .gateway(gateway)
        .retryPolicy(retryPolicy)
        .metrics(metrics)
        .maxConflictAttempts(settings.getMaxConflictAttempts())
        .maxStorageAttempts(settings.getMaxStorageAttempts())
        .executorThreads(settings.getExecutorThreads());
  }
}
