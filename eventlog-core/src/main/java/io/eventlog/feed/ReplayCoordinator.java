package io.eventlog.feed;

import io.eventlog.EventLog;
import io.eventlog.bus.EventBus;
import io.eventlog.bus.KeyExpression;
import io.eventlog.bus.SubscriptionOptions;
import io.eventlog.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Serves resumable event feeds: stored events after the client's cursor, then live events.
 *
 * <p>{@link #open} subscribes on the bus before it returns and only then starts the replay,
 * so an event committed while the replay runs is either in the replayed pages or buffered in
 * the subscription. Subscribing after the replay would lose events committed in between.
 * While streaming, a keep-alive comment is sent whenever no event arrived within the
 * keep-alive interval; it does not move the cursor.
 *
 * <pre>{@code
 * ReplayCoordinator feeds = ReplayCoordinator.builder()
 *     .eventLog(eventLog)
 *     .eventBus(bus)
 *     .build();
 * OptionalLong lastSeen = SseFrame.parseLastEventId(request.getHeader("Last-Event-ID"));
 * FeedConnection feed = feeds.open(lastSeen.isPresent() ? lastSeen.getAsLong() : null,
 *     EventKeys.aggregateTypePattern("Todo"), frame -> writer.write(frame.render()));
 * }</pre>
 */
public final class ReplayCoordinator implements AutoCloseable {
  /** Default keep-alive interval. */
  public static final Duration DEFAULT_KEEP_ALIVE = Duration.ofSeconds(15);
  /** Default replay page size. */
  public static final int DEFAULT_REPLAY_PAGE_SIZE = 500;

  private final EventLog eventLog;
  private final EventBus eventBus;
  private final Duration keepAlive;
  private final int replayPageSize;
  private final SubscriptionOptions subscriptionOptions;
  private final FrameRenderer renderer;
  private final ExecutorService executor;
  private final boolean ownsExecutor;
  private final Set<FeedConnection> connections = ConcurrentHashMap.newKeySet();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private ReplayCoordinator(Builder builder) {
    this.eventLog = Objects.requireNonNull(builder.eventLog, "eventLog");
    this.eventBus = Objects.requireNonNull(builder.eventBus, "eventBus");
    this.keepAlive = Objects.requireNonNull(builder.keepAlive, "keepAlive");
    if (keepAlive.isNegative() || keepAlive.isZero()) {
      throw new IllegalArgumentException("keepAlive must be > 0");
    }
    if (builder.replayPageSize < 1) {
      throw new IllegalArgumentException("replayPageSize must be >= 1");
    }
    this.replayPageSize = builder.replayPageSize;
    this.subscriptionOptions = Objects.requireNonNull(builder.subscriptionOptions, "subscriptionOptions");
    this.renderer = Objects.requireNonNull(builder.renderer, "renderer");
    if (builder.executor != null) {
      this.executor = builder.executor;
      this.ownsExecutor = false;
    } else {
      this.executor = Executors.newCachedThreadPool(new DaemonThreadFactory("eventlog-feed-"));
      this.ownsExecutor = true;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Opens a feed.
   *
   * @param lastSeenSequence the client's last seen global sequence, {@code null} to start
   *                         from the beginning of the log
   * @param filter           which events to send, e.g. {@code events/Todo/**}
   * @param sink             where frames are written
   * @return the connection, already subscribed
   * @throws IllegalStateException if the coordinator or the bus is closed
   */
  public FeedConnection open(Long lastSeenSequence, KeyExpression filter, FeedSink sink) {
    Objects.requireNonNull(filter, "filter");
    Objects.requireNonNull(sink, "sink");
    if (closed.get()) {
      throw new IllegalStateException("ReplayCoordinator is closed");
    }
    long cursor = lastSeenSequence == null ? 0L : lastSeenSequence;
    if (cursor < 0) {
      throw new IllegalArgumentException("lastSeenSequence must be >= 0");
    }
    FeedConnection connection = new FeedConnection(this, cursor, filter, sink);
    connection.subscribe();
    connections.add(connection);
    connection.start(executor.submit(connection::run));
    return connection;
  }

  public int openConnections() {
    return connections.size();
  }

  /**
   * Closes every open feed and stops the executor if the coordinator created it.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    for (FeedConnection connection : connections) {
      connection.close();
    }
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

  void release(FeedConnection connection) {
    connections.remove(connection);
  }

  EventLog eventLog() {
    return eventLog;
  }

  EventBus eventBus() {
    return eventBus;
  }

  Duration keepAlive() {
    return keepAlive;
  }

  int replayPageSize() {
    return replayPageSize;
  }

  SubscriptionOptions subscriptionOptions() {
    return subscriptionOptions;
  }

  FrameRenderer renderer() {
    return renderer;
  }

  /** Builder for {@link ReplayCoordinator}. */
  public static final class Builder {
    private EventLog eventLog;
    private EventBus eventBus;
    private Duration keepAlive = DEFAULT_KEEP_ALIVE;
    private int replayPageSize = DEFAULT_REPLAY_PAGE_SIZE;
    private SubscriptionOptions subscriptionOptions = SubscriptionOptions.defaults();
    private FrameRenderer renderer = FrameRenderer.json();
    private ExecutorService executor;

    private Builder() {
    }

    /**
     * Sets the log replayed from. <b>Required.</b>
     *
     * @param eventLog the event log
     * @return this builder
     */
    public Builder eventLog(EventLog eventLog) {
      this.eventLog = eventLog;
      return this;
    }

    /**
     * Sets the bus live events come from. <b>Required.</b>
     *
     * @param eventBus the bus
     * @return this builder
     */
    public Builder eventBus(EventBus eventBus) {
      this.eventBus = eventBus;
      return this;
    }

    /**
     * Sets the idle time after which a keep-alive comment is sent.
     *
     * <p>Optional. Defaults to 15 seconds.
     *
     * @param keepAlive the keep-alive interval
     * @return this builder
     */
    public Builder keepAlive(Duration keepAlive) {
      this.keepAlive = keepAlive;
      return this;
    }

    /**
     * Sets how many stored events one replay query fetches.
     *
     * <p>Optional. Defaults to {@code 500}.
     *
     * @param replayPageSize page size
     * @return this builder
     */
    public Builder replayPageSize(int replayPageSize) {
      this.replayPageSize = replayPageSize;
      return this;
    }

    /**
     * Sets the options of each feed's bus subscription.
     *
     * <p>Optional. Defaults to {@link SubscriptionOptions#defaults()}.
     *
     * @param subscriptionOptions buffer capacity and overflow policy
     * @return this builder
     */
    public Builder subscriptionOptions(SubscriptionOptions subscriptionOptions) {
      this.subscriptionOptions = subscriptionOptions;
      return this;
    }

    /**
     * Sets the renderer turning events into frames.
     *
     * <p>Optional. Defaults to {@link FrameRenderer#json()}.
     *
     * @param renderer the renderer
     * @return this builder
     */
    public Builder renderer(FrameRenderer renderer) {
      this.renderer = renderer;
      return this;
    }

    /**
     * Sets the executor running the feeds, one task per open connection. A caller-supplied
     * executor is not shut down by {@link ReplayCoordinator#close()}.
     *
     * <p>Optional. Defaults to a cached pool of daemon threads.
     *
     * @param executor the executor
     * @return this builder
     */
    public Builder executor(ExecutorService executor) {
      this.executor = executor;
      return this;
    }

    public ReplayCoordinator build() {
      return new ReplayCoordinator(this);
    }
  }
}
