package io.eventlog.task;

import io.eventlog.runtime.CommandContext;
import io.eventlog.runtime.CommandGateway;
import io.eventlog.spi.MetricsExporter;
import io.eventlog.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs cancellable background work detached from the request that triggered it.
 *
 * <p>Work is keyed by correlation id. Its lifecycle is recorded as commands dispatched
 * through the {@link CommandGateway} with a {@linkplain CommandContext.Origin#SYSTEM system}
 * context continuing the same correlation: an optional start command and exactly one
 * terminal command (completed, failed or cancelled), even when the task is cancelled before
 * it started. Dispatch failures are logged; nothing is thrown back to the original caller,
 * which has long returned.
 *
 * <pre>{@code
 * registry.spawn(queryId, () -> runQuery(sql), new TaskOutcome<Integer>() {
 *   public Object onStarted() { return new BeginExecution(queryId); }
 *   public Object onSuccess(Integer rows, Duration took) { return new CompleteQuery(queryId, rows, took.toMillis()); }
 *   public Object onFailure(Exception e) { return new FailQuery(queryId, e.getMessage()); }
 *   public Object onCancelled() { return new CancelQuery(queryId, "cancelled"); }
 * });
 * }</pre>
 */
public final class DetachedTaskRegistry implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(DetachedTaskRegistry.class.getName());

  private final CommandGateway gateway;
  private final MetricsExporter metrics;
  private final ExecutorService workers;
  private final Map<String, Task<?>> active = new ConcurrentHashMap<>();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  public DetachedTaskRegistry(CommandGateway gateway, int workerCount) {
    this(gateway, workerCount, MetricsExporter.NOOP);
  }

  public DetachedTaskRegistry(CommandGateway gateway, int workerCount, MetricsExporter metrics) {
    this.gateway = Objects.requireNonNull(gateway, "gateway");
    this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
    if (workerCount < 1) {
      throw new IllegalArgumentException("workerCount must be >= 1");
    }
    this.workers = Executors.newFixedThreadPool(workerCount, new DaemonThreadFactory("eventlog-task-"));
  }

  /**
   * Starts background work.
   *
   * @param correlationId identifies the task; at most one active task per id
   * @param work          the work
   * @param outcome       maps the lifecycle to commands
   * @param <R>           result type
   * @return a handle to the task
   * @throws IllegalStateException if a task with the same correlation id is active, or the
   *                               registry is closed
   */
  public <R> TaskHandle spawn(String correlationId, DetachedWork<R> work, TaskOutcome<R> outcome) {
    Objects.requireNonNull(correlationId, "correlationId");
    Objects.requireNonNull(work, "work");
    Objects.requireNonNull(outcome, "outcome");
    if (closed.get()) {
      throw new IllegalStateException("DetachedTaskRegistry is closed");
    }
    Task<R> task = new Task<>(correlationId, work, outcome);
    if (active.putIfAbsent(correlationId, task) != null) {
      throw new IllegalStateException("Task already active for correlation id " + correlationId);
    }
    metrics.incrementTasksStarted();
    task.future = workers.submit(task::run);
    return task;
  }

  /**
   * Cancels the active task with the given correlation id.
   *
   * @param correlationId the task's correlation id
   * @return {@code true} if an active task was found and cancellation requested
   */
  public boolean cancel(String correlationId) {
    Task<?> task = active.get(correlationId);
    return task != null && task.cancel();
  }

  public boolean isActive(String correlationId) {
    return active.containsKey(correlationId);
  }

  public Set<String> activeTasks() {
    return Set.copyOf(active.keySet());
  }

  /**
   * Cancels every active task and stops the workers.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    for (Task<?> task : active.values()) {
      task.cancel();
    }
    workers.shutdown();
    try {
      if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
        logger.log(Level.WARNING, "Detached tasks did not stop in time: " + active.keySet());
        workers.shutdownNow();
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private final class Task<R> implements TaskHandle {
    private final String correlationId;
    private final DetachedWork<R> work;
    private final TaskOutcome<R> outcome;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean terminated = new AtomicBoolean(false);
    private final CompletableFuture<TaskStatus> completion = new CompletableFuture<>();
    private volatile boolean cancelRequested;
    private volatile Future<?> future;

    Task(String correlationId, DetachedWork<R> work, TaskOutcome<R> outcome) {
      this.correlationId = correlationId;
      this.work = work;
      this.outcome = outcome;
    }

    @Override
    public String correlationId() {
      return correlationId;
    }

    @Override
    public CompletableFuture<TaskStatus> completion() {
      return completion;
    }

    @Override
    public boolean cancel() {
      if (terminated.get()) {
        return false;
      }
      cancelRequested = true;
      Future<?> running = future;
      if (running != null) {
        running.cancel(true);
      }
      if (!started.get()) {
        // never ran (or never will): record the cancellation here
        finish(TaskStatus.CANCELLED, outcome::onCancelled);
      }
      return true;
    }

    void run() {
      if (!started.compareAndSet(false, true) || cancelRequested) {
        finish(TaskStatus.CANCELLED, outcome::onCancelled);
        return;
      }
      long startNanos = System.nanoTime();
      try {
        dispatch("start", outcome.onStarted());
        R result = work.execute();
        if (cancelRequested) {
          finish(TaskStatus.CANCELLED, outcome::onCancelled);
        } else {
          Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
          finish(TaskStatus.COMPLETED, () -> outcome.onSuccess(result, elapsed));
        }
      } catch (Exception e) {
        fail(e);
      } catch (Error e) {
        fail(new ExecutionException(e));
        throw e;
      }
    }

    private void fail(Exception e) {
      if (cancelRequested) {
        finish(TaskStatus.CANCELLED, outcome::onCancelled);
      } else {
        logger.log(Level.WARNING, "Detached task " + correlationId + " failed", e);
        finish(TaskStatus.FAILED, () -> outcome.onFailure(e));
      }
    }

    private void finish(TaskStatus status, Supplier<Object> terminalCommand) {
      if (!terminated.compareAndSet(false, true)) {
        return;
      }
      // clear a pending cancellation interrupt so the terminal command can reach the store
      Thread.interrupted();
      try {
        dispatch(status.name().toLowerCase(), terminalCommand.get());
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Failed to build terminal command for task " + correlationId, e);
      } finally {
        active.remove(correlationId, this);
        metrics.incrementTasksTerminated();
        completion.complete(status);
      }
    }

    private void dispatch(String phase, Object command) {
      if (command == null) {
        return;
      }
      try {
        gateway.dispatch(command, CommandContext.system(correlationId, correlationId));
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Failed to record " + phase + " of detached task " + correlationId
            + " with " + command.getClass().getSimpleName(), e);
      }
    }
  }
}
