package io.eventlog.runtime;

import io.eventlog.CommandRejectedException;
import io.eventlog.ConcurrencyConflictException;
import io.eventlog.EventCodec;
import io.eventlog.EventEnvelope;
import io.eventlog.EventLog;
import io.eventlog.EventLogStoreException;
import io.eventlog.StoredEvent;
import io.eventlog.bus.EventBus;
import io.eventlog.decider.Decider;
import io.eventlog.decider.Decision;
import io.eventlog.decider.Saga;
import io.eventlog.spi.MetricsExporter;
import io.eventlog.util.DaemonThreadFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Executes commands against one aggregate type.
 *
 * <p>Each command runs the cycle <em>load, fold, decide, append, publish</em>:
 * <ol>
 *   <li>load the aggregate's events and fold them into state with the decider</li>
 *   <li>capture the aggregate version as the expected version</li>
 *   <li>run the decider; a rejection is thrown as {@link CommandRejectedException}</li>
 *   <li>encode the events and append them with the expected version</li>
 *   <li>publish the stored events on the {@link EventBus}</li>
 *   <li>run post-commit handlers and saga reactions</li>
 * </ol>
 *
 * <p>Only the first four steps decide the command's outcome. Publication, handlers and sagas
 * run after the events are durable; their failures are logged and never fail the command.
 *
 * <p>A {@link ConcurrencyConflictException} is retried with fresh state when the command's
 * {@link ConflictPolicy} is {@code RETRY}, and propagated otherwise. Transient
 * {@link EventLogStoreException}s are retried up to {@code maxStorageAttempts}. Retries wait
 * according to the {@link RetryPolicy}.
 *
 * <p>Create instances via {@link #builder(AggregateDefinition)}. Thread-safe.
 *
 * @param <C> command type
 * @param <S> state type
 * @param <E> event type
 */
public final class AggregateRuntime<C, S, E> implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(AggregateRuntime.class.getName());

  private final AggregateDefinition<C, S, E> definition;
  private final EventLog eventLog;
  private final EventBus eventBus;
  private final RetryPolicy retryPolicy;
  private final int maxConflictAttempts;
  private final int maxStorageAttempts;
  private final MetricsExporter metrics;
  private final List<CommittedEventHandler<? super E>> handlers;
  private final List<Saga<? super E, ?>> sagas;
  private final CommandGateway gateway;
  private final ExecutorService executor;
  private final boolean ownsExecutor;

  private AggregateRuntime(Builder<C, S, E> builder) {
    this.definition = builder.definition;
    this.eventLog = Objects.requireNonNull(builder.eventLog, "eventLog");
    this.eventBus = Objects.requireNonNull(builder.eventBus, "eventBus");
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(50, 2_000);
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.handlers = List.copyOf(builder.handlers);
    this.sagas = List.copyOf(builder.sagas);
    this.gateway = builder.gateway;

    if (builder.maxConflictAttempts < 1) {
      throw new IllegalArgumentException("maxConflictAttempts must be >= 1");
    }
    if (builder.maxStorageAttempts < 1) {
      throw new IllegalArgumentException("maxStorageAttempts must be >= 1");
    }
    if (!sagas.isEmpty() && gateway == null) {
      throw new IllegalArgumentException("A gateway is required to dispatch saga reactions");
    }
    this.maxConflictAttempts = builder.maxConflictAttempts;
    this.maxStorageAttempts = builder.maxStorageAttempts;

    if (builder.executor != null) {
      this.executor = builder.executor;
      this.ownsExecutor = false;
    } else {
      if (builder.executorThreads < 1) {
        throw new IllegalArgumentException("executorThreads must be >= 1");
      }
      this.executor = Executors.newFixedThreadPool(builder.executorThreads,
          new DaemonThreadFactory("eventlog-" + definition.aggregateType() + "-"));
      this.ownsExecutor = true;
    }
  }

  public static <C, S, E> Builder<C, S, E> builder(AggregateDefinition<C, S, E> definition) {
    return new Builder<>(definition);
  }

  public AggregateDefinition<C, S, E> definition() {
    return definition;
  }

  /**
   * Handles a command synchronously.
   *
   * @param command the command
   * @param context request context recorded in event metadata
   * @return the appended events and new version
   * @throws CommandRejectedException     if the decider rejects the command
   * @throws ConcurrencyConflictException if a conflict is not retried or retries are exhausted
   * @throws EventLogStoreException       if storage fails permanently or retries are exhausted
   */
  public CommandResult handle(C command, CommandContext context) {
    Objects.requireNonNull(command, "command");
    Objects.requireNonNull(context, "context");
    String aggregateId = definition.aggregateIdOf(command);
    ConflictPolicy policy = definition.conflictPolicyFor(command);
    long startNanos = System.nanoTime();
    int conflicts = 0;
    int storageFailures = 0;
    while (true) {
      try {
        CommandResult result = attempt(command, aggregateId, context);
        metrics.recordCommandDurationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
        return result;
      } catch (ConcurrencyConflictException e) {
        metrics.incrementConflicts();
        conflicts++;
        if (policy == ConflictPolicy.FAIL_FAST || conflicts >= maxConflictAttempts) {
          throw e;
        }
        logger.log(Level.FINE, "Conflict on {0}/{1}, retrying (attempt {2})",
            new Object[] {definition.aggregateType(), aggregateId, conflicts});
        backoff(conflicts);
      } catch (EventLogStoreException e) {
        storageFailures++;
        if (!e.isTransient() || storageFailures >= maxStorageAttempts) {
          throw e;
        }
        logger.log(Level.WARNING, "Transient storage failure on " + definition.aggregateType() + "/"
            + aggregateId + ", retrying (attempt " + storageFailures + ")", e);
        backoff(storageFailures);
      }
    }
  }

  /**
   * Handles a command on the runtime's executor.
   *
   * @param command the command
   * @param context request context; its correlation id identifies the request before completion
   * @return a future completing with the result, or exceptionally with the same exceptions
   *     {@link #handle} throws
   */
  public CompletableFuture<CommandResult> submit(C command, CommandContext context) {
    return CompletableFuture.supplyAsync(() -> handle(command, context), executor);
  }

  /**
   * Rebuilds an aggregate's current state from the log.
   *
   * @param aggregateId the aggregate id
   * @return the folded state; the initial state when the aggregate has no events
   */
  public S state(String aggregateId) {
    return fold(eventLog.load(definition.aggregateType(), aggregateId));
  }

  /**
   * Returns the aggregate's current version.
   *
   * @param aggregateId the aggregate id
   * @return the version, {@code 0} when absent
   */
  public long version(String aggregateId) {
    return eventLog.currentVersion(definition.aggregateType(), aggregateId);
  }

  CommandResult handleUntyped(Object command, CommandContext context) {
    return handle(definition.commandType().cast(command), context);
  }

  CompletableFuture<CommandResult> submitUntyped(Object command, CommandContext context) {
    return submit(definition.commandType().cast(command), context);
  }

  private CommandResult attempt(C command, String aggregateId, CommandContext context) {
    String aggregateType = definition.aggregateType();
    List<StoredEvent> history = eventLog.load(aggregateType, aggregateId);
    S state = fold(history);
    long expectedVersion = history.isEmpty() ? 0 : history.get(history.size() - 1).aggregateSequence();

    Decision<E> decision = definition.decider().decide(command, state);
    if (decision instanceof Decision.Rejected<E> rejected) {
      metrics.incrementCommandsRejected();
      throw new CommandRejectedException(rejected.code(), rejected.message());
    }
    List<E> events = ((Decision.Accepted<E>) decision).events();
    if (events.isEmpty()) {
      return CommandResult.unchanged(context.correlationId(), aggregateId, expectedVersion);
    }
    if (definition.isTerminal(state)) {
      metrics.incrementCommandsRejected();
      throw new CommandRejectedException("stream_finalized",
          aggregateType + "/" + aggregateId + " is finalized and accepts no further events");
    }

    EventCodec<E> codec = definition.codec();
    Map<String, String> metadata = context.toMetadata(command.getClass().getSimpleName());
    List<EventEnvelope> envelopes = new ArrayList<>(events.size());
    for (E event : events) {
      envelopes.add(codec.encode(event, metadata));
    }

    List<Long> sequences = eventLog.append(aggregateType, aggregateId, expectedVersion, envelopes);
    metrics.incrementEventsAppended(envelopes.size());
    metrics.recordLatestSequence(sequences.get(sequences.size() - 1));

    List<StoredEvent> stored = new ArrayList<>(envelopes.size());
    for (int i = 0; i < envelopes.size(); i++) {
      EventEnvelope envelope = envelopes.get(i);
      stored.add(new StoredEvent(sequences.get(i), envelope.eventId(), aggregateType, aggregateId,
          expectedVersion + i + 1, envelope.eventType(), envelope.schemaVersion(),
          envelope.payload(), envelope.metadata(), envelope.occurredAt()));
    }

    publish(stored);
    afterCommit(events, stored, context);
    return new CommandResult(context.correlationId(), aggregateId,
        expectedVersion + envelopes.size(), sequences, stored);
  }

  private S fold(List<StoredEvent> history) {
    Decider<C, S, E> decider = definition.decider();
    EventCodec<E> codec = definition.codec();
    S state = decider.initialState();
    for (StoredEvent stored : history) {
      state = decider.evolve(state, codec.decode(stored));
    }
    return state;
  }

  private void publish(List<StoredEvent> stored) {
    try {
      eventBus.publishAll(stored);
    } catch (RuntimeException e) {
      metrics.incrementPublishFailures();
      logger.log(Level.WARNING, "Failed to publish " + stored.size() + " committed event(s) of "
          + definition.aggregateType() + "/" + stored.get(0).aggregateId()
          + "; subscribers will catch up by replay", e);
    }
  }

  private void afterCommit(List<E> events, List<StoredEvent> stored, CommandContext context) {
    for (int i = 0; i < events.size(); i++) {
      E event = events.get(i);
      StoredEvent record = stored.get(i);
      for (CommittedEventHandler<? super E> handler : handlers) {
        try {
          handler.onCommitted(event, record, context);
        } catch (Exception e) {
          logger.log(Level.WARNING, "Post-commit handler failed for event " + record.eventId(), e);
        }
      }
      for (Saga<? super E, ?> saga : sagas) {
        react(saga, event, record, context);
      }
    }
  }

  private void react(Saga<? super E, ?> saga, E event, StoredEvent record, CommandContext context) {
    List<?> reactions;
    try {
      reactions = saga.react(event);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Saga failed for event " + record.eventId(), e);
      return;
    }
    CommandContext caused = context.causedBy(record);
    for (Object reaction : reactions) {
      gateway.submit(reaction, caused).whenComplete((result, error) -> {
        if (error != null) {
          logger.log(Level.WARNING, "Saga command " + reaction.getClass().getSimpleName()
              + " caused by event " + record.eventId() + " failed", error);
        }
      });
    }
  }

  private void backoff(int attempts) {
    metrics.incrementCommandRetries();
    long delayMs = retryPolicy.computeDelayMs(attempts);
    if (delayMs <= 0) {
      return;
    }
    try {
      Thread.sleep(delayMs);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while backing off", e);
    }
  }

  /**
   * Shuts down the executor if the runtime created it.
   */
  @Override
  public void close() {
    if (!ownsExecutor) {
      return;
    }
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link AggregateRuntime}. */
  public static final class Builder<C, S, E> {
    private final AggregateDefinition<C, S, E> definition;
    private EventLog eventLog;
    private EventBus eventBus;
    private RetryPolicy retryPolicy;
    private int maxConflictAttempts = 5;
    private int maxStorageAttempts = 3;
    private MetricsExporter metrics;
    private final List<CommittedEventHandler<? super E>> handlers = new ArrayList<>();
    private final List<Saga<? super E, ?>> sagas = new ArrayList<>();
    private CommandGateway gateway;
    private ExecutorService executor;
    private int executorThreads = 4;

    private Builder(AggregateDefinition<C, S, E> definition) {
      this.definition = Objects.requireNonNull(definition, "definition");
    }

    /**
     * Sets the event log. <b>Required.</b>
     *
     * @param eventLog the event log
     * @return this builder
     */
    public Builder<C, S, E> eventLog(EventLog eventLog) {
      this.eventLog = eventLog;
      return this;
    }

    /**
     * Sets the bus committed events are published on. <b>Required.</b>
     *
     * @param eventBus the bus
     * @return this builder
     */
    public Builder<C, S, E> eventBus(EventBus eventBus) {
      this.eventBus = eventBus;
      return this;
    }

    /**
     * Sets the retry policy that computes the delay between attempts.
     *
     * <p>Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with
     * {@code baseDelayMs=50} and {@code maxDelayMs=2000}.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder<C, S, E> retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the total number of attempts for a {@link ConflictPolicy#RETRY} command.
     *
     * <p>Optional. Defaults to {@code 5}. Must be &ge; 1.
     *
     * @param maxConflictAttempts maximum attempts
     * @return this builder
     */
    public Builder<C, S, E> maxConflictAttempts(int maxConflictAttempts) {
      this.maxConflictAttempts = maxConflictAttempts;
      return this;
    }

    /**
     * Sets the total number of attempts when storage fails transiently.
     *
     * <p>Optional. Defaults to {@code 3}. Must be &ge; 1.
     *
     * @param maxStorageAttempts maximum attempts
     * @return this builder
     */
    public Builder<C, S, E> maxStorageAttempts(int maxStorageAttempts) {
      this.maxStorageAttempts = maxStorageAttempts;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder<C, S, E> metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Adds a post-commit handler. Handlers run in registration order.
     *
     * @param handler the handler
     * @return this builder
     */
    public Builder<C, S, E> onCommitted(CommittedEventHandler<? super E> handler) {
      this.handlers.add(Objects.requireNonNull(handler, "handler"));
      return this;
    }

    /**
     * Adds a saga whose reactions are dispatched through the {@linkplain #gateway gateway}.
     *
     * @param saga the saga
     * @return this builder
     */
    public Builder<C, S, E> saga(Saga<? super E, ?> saga) {
      this.sagas.add(Objects.requireNonNull(saga, "saga"));
      return this;
    }

    /**
     * Sets the gateway used to dispatch saga reactions. Required when sagas are registered.
     *
     * @param gateway the gateway
     * @return this builder
     */
    public Builder<C, S, E> gateway(CommandGateway gateway) {
      this.gateway = gateway;
      return this;
    }

    /**
     * Sets the executor for {@link AggregateRuntime#submit}. A caller-supplied executor is
     * not shut down by {@link AggregateRuntime#close()}.
     *
     * <p>Optional. Defaults to a fixed pool of {@code executorThreads} daemon threads.
     *
     * @param executor the executor
     * @return this builder
     */
    public Builder<C, S, E> executor(ExecutorService executor) {
      this.executor = executor;
      return this;
    }

    /**
     * Sets the size of the default executor.
     *
     * <p>Optional. Defaults to {@code 4}.
     *
     * @param executorThreads number of threads
     * @return this builder
     */
    public Builder<C, S, E> executorThreads(int executorThreads) {
      this.executorThreads = executorThreads;
      return this;
    }

    public AggregateRuntime<C, S, E> build() {
      return new AggregateRuntime<>(this);
    }
  }
}
