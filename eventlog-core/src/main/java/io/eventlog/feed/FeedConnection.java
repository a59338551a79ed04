package io.eventlog.feed;

import io.eventlog.EventLog;
import io.eventlog.StoredEvent;
import io.eventlog.bus.EventBus;
import io.eventlog.bus.EventKeys;
import io.eventlog.bus.KeyExpression;
import io.eventlog.bus.PublishedRange;
import io.eventlog.bus.Subscription;
import io.eventlog.bus.SubscriptionOptions;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One client's feed, created by {@link ReplayCoordinator#open}.
 *
 * <p>The connection tracks a scan cursor: the highest global sequence it has examined, sent
 * or filtered out. A live event is sent as is when it directly follows the cursor, or when the
 * {@linkplain Subscription#publishedRange() published range} it was delivered with shows that
 * the sequences in between went to the bus and so were filtered out. Any other live event
 * above the cursor, and any lag or overrun signalled by the subscription, triggers a replay
 * from the cursor. Since sequences are assigned in commit order, that replay returns
 * every committed event the live path skipped, in order. Events at or below the cursor are
 * dropped as duplicates, so the client sees each matching event exactly once and in
 * ascending sequence order.
 */
public final class FeedConnection implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(FeedConnection.class.getName());

  private final ReplayCoordinator coordinator;
  private final EventLog eventLog;
  private final EventBus eventBus;
  private final KeyExpression filter;
  private final FeedSink sink;
  private final FrameRenderer renderer;
  private final SubscriptionOptions subscriptionOptions;
  private final Duration keepAlive;
  private final int replayPageSize;
  private final CompletableFuture<Void> termination = new CompletableFuture<>();

  private volatile FeedState state = FeedState.CONNECTING;
  private volatile Subscription subscription;
  private volatile Future<?> worker;
  private volatile long cursor;
  private volatile long lastSent;

  FeedConnection(ReplayCoordinator coordinator, long cursor, KeyExpression filter, FeedSink sink) {
    this.coordinator = coordinator;
    this.eventLog = coordinator.eventLog();
    this.eventBus = coordinator.eventBus();
    this.renderer = coordinator.renderer();
    this.subscriptionOptions = coordinator.subscriptionOptions();
    this.keepAlive = coordinator.keepAlive();
    this.replayPageSize = coordinator.replayPageSize();
    this.filter = filter;
    this.sink = sink;
    this.cursor = cursor;
    this.lastSent = cursor;
  }

  public FeedState state() {
    return state;
  }

  /**
   * Returns the highest global sequence examined so far.
   *
   * @return the scan cursor
   */
  public long cursor() {
    return cursor;
  }

  /**
   * Returns the global sequence of the last frame sent, or the initial cursor.
   *
   * @return the last sent sequence
   */
  public long lastSentSequence() {
    return lastSent;
  }

  public KeyExpression filter() {
    return filter;
  }

  /**
   * Completes once the connection is {@link FeedState#CLOSED}.
   *
   * @return the termination future
   */
  public CompletableFuture<Void> termination() {
    return termination;
  }

  /**
   * Closes the feed from any state and releases its subscription. Idempotent.
   */
  @Override
  public void close() {
    if (state == FeedState.CLOSED) {
      return;
    }
    state = FeedState.CLOSED;
    Subscription current = subscription;
    if (current != null) {
      current.close();
    }
    Future<?> running = worker;
    if (running != null) {
      running.cancel(true);
    }
    coordinator.release(this);
    termination.complete(null);
  }

  void subscribe() {
    subscription = eventBus.subscribe(filter, subscriptionOptions);
    state = FeedState.SUBSCRIBED;
  }

  void start(Future<?> worker) {
    this.worker = worker;
    if (state == FeedState.CLOSED) {
      worker.cancel(true);
    }
  }

  void run() {
    try {
      replay();
      transition(FeedState.STREAMING);
      stream();
    } catch (IOException e) {
      logger.log(Level.FINE, "Feed client disconnected: " + filter, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (RuntimeException e) {
      if (state != FeedState.CLOSED) {
        logger.log(Level.SEVERE, "Feed " + filter + " failed at sequence " + cursor, e);
      }
    } finally {
      close();
      // a resubscription may race with close()
      Subscription current = subscription;
      if (current != null) {
        current.close();
      }
    }
  }

  private void stream() throws IOException, InterruptedException {
    while (state == FeedState.STREAMING) {
      Subscription current = subscription;
      StoredEvent event = current.poll(keepAlive);
      if (current.consumeLag()) {
        catchUp();
        continue;
      }
      if (event != null) {
        onLive(event, current.publishedRange());
        continue;
      }
      if (current.isOverrun()) {
        logger.log(Level.WARNING, "Feed " + filter + " overrun at sequence " + cursor + ", resubscribing");
        subscription = eventBus.subscribe(filter, subscriptionOptions);
        catchUp();
      } else if (current.isClosed()) {
        // bus closed
        return;
      } else {
        sink.send(SseFrame.keepAlive());
      }
    }
  }

  private void onLive(StoredEvent event, PublishedRange published) throws IOException {
    long sequence = event.globalSequence();
    if (sequence <= cursor) {
      return;
    }
    if (sequence == cursor + 1 || published.covers(cursor, sequence)) {
      emit(event);
      cursor = sequence;
      return;
    }
    catchUp();
  }

  private void catchUp() throws IOException {
    transition(FeedState.REPLAYING);
    replay();
    transition(FeedState.STREAMING);
  }

  private void replay() throws IOException {
    transition(FeedState.REPLAYING);
    while (state == FeedState.REPLAYING) {
      List<StoredEvent> page = eventLog.querySince(cursor, replayPageSize);
      for (StoredEvent event : page) {
        if (filter.matches(EventKeys.eventKey(event))) {
          emit(event);
        }
        cursor = event.globalSequence();
      }
      if (page.size() < replayPageSize) {
        return;
      }
    }
  }

  private void emit(StoredEvent event) throws IOException {
    sink.send(renderer.render(event));
    lastSent = event.globalSequence();
  }

  private void transition(FeedState next) {
    if (state != FeedState.CLOSED) {
      state = next;
    }
  }

  @Override
  public String toString() {
    return "FeedConnection{filter=" + filter + ", state=" + state + ", cursor=" + cursor + '}';
  }
}
