package io.eventlog.bus;

import io.eventlog.StoredEvent;
import io.eventlog.spi.MetricsExporter;
import io.eventlog.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-process publish/subscribe registry distributing committed events to live subscribers.
 *
 * <p>Create one instance at startup and pass it to the components that publish or subscribe;
 * there is no global bus. Every published event is keyed
 * {@code events/{aggregateType}/{aggregateId}} and offered only to subscriptions whose
 * {@link KeyExpression} matches the key.
 *
 * <p>Delivery is at-most-once and non-durable. Each subscription owns a bounded buffer, so a
 * slow subscriber loses events (or, under {@link OverflowPolicy#BLOCK}, is disconnected
 * after a bounded wait) instead of growing memory. Publishing never waits on a subscriber.
 * The event log stays the source of truth; consumers recover missed events by replaying it.
 *
 * <p>Every delivery carries the {@link PublishedRange} of sequences published so far, which
 * lets a consumer tell a filtered-out sequence from a missed one.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * EventBus bus = new EventBus();
 * try (Subscription sub = bus.subscribe(EventKeys.aggregateTypePattern("Todo"))) {
 *   StoredEvent next = sub.poll(Duration.ofSeconds(1));
 * }
 * bus.subscribe(EventKeys.ALL_EVENTS, SubscriptionOptions.defaults(), cache::invalidate);
 * }</pre>
 */
public final class EventBus implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(EventBus.class.getName());

  private static final Duration LISTENER_POLL_INTERVAL = Duration.ofMillis(100);

  private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
  private final PublishedSequences published = new PublishedSequences();
  private final Object publishLock = new Object();
  private final MetricsExporter metrics;
  private final ExecutorService workers;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  public EventBus() {
    this(MetricsExporter.NOOP);
  }

  public EventBus(MetricsExporter metrics) {
    this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
    this.workers = Executors.newCachedThreadPool(new DaemonThreadFactory("eventlog-bus-"));
  }

  /**
   * Subscribes with {@linkplain SubscriptionOptions#defaults() default options}.
   *
   * @param pattern the key pattern, e.g. {@code events/Todo/**}
   * @return the subscription; close it to unsubscribe
   */
  public Subscription subscribe(String pattern) {
    return subscribe(KeyExpression.parse(pattern), SubscriptionOptions.defaults());
  }

  public Subscription subscribe(KeyExpression pattern) {
    return subscribe(pattern, SubscriptionOptions.defaults());
  }

  /**
   * Subscribes for pull-style consumption via {@link Subscription#poll}.
   *
   * @param pattern the key pattern
   * @param options buffer capacity and overflow policy
   * @return the subscription; close it to unsubscribe
   * @throws IllegalStateException if the bus is closed
   */
  public Subscription subscribe(KeyExpression pattern, SubscriptionOptions options) {
    ensureOpen();
    Subscription subscription = new Subscription(this, pattern, options);
    subscriptions.add(subscription);
    metrics.recordSubscriberCount(subscriptions.size());
    if (options.overflow() == OverflowPolicy.BLOCK) {
      workers.submit(() -> backlogLoop(subscription));
    }
    return subscription;
  }

  /**
   * Subscribes a callback driven by a dedicated worker thread.
   *
   * @param pattern  the key pattern
   * @param options  buffer capacity and overflow policy
   * @param listener the callback
   * @return the underlying subscription; closing it stops the worker
   */
  public Subscription subscribe(KeyExpression pattern, SubscriptionOptions options, BusListener listener) {
    Objects.requireNonNull(listener, "listener");
    Subscription subscription = subscribe(pattern, options);
    workers.submit(() -> listenerLoop(subscription, listener));
    return subscription;
  }

  /**
   * Offers a committed event to every matching subscription. Never waits for a subscriber;
   * concurrent publishers are serialized so every subscription sees the same order.
   *
   * @param event the committed event
   * @throws IllegalStateException if the bus is closed
   */
  public void publish(StoredEvent event) {
    Objects.requireNonNull(event, "event");
    ensureOpen();
    String key = EventKeys.eventKey(event);
    synchronized (publishLock) {
      PublishedRange range = published.record(event.globalSequence());
      for (Subscription subscription : subscriptions) {
        if (subscription.pattern().matches(key)) {
          deliver(subscription, event, range);
        }
      }
    }
  }

  /**
   * Publishes a batch in order.
   *
   * @param events committed events in global sequence order
   */
  public void publishAll(List<StoredEvent> events) {
    for (StoredEvent event : events) {
      publish(event);
    }
  }

  /**
   * Returns the sequences published so far without gap.
   *
   * @return the current published range
   */
  public PublishedRange publishedRange() {
    synchronized (publishLock) {
      return published.range();
    }
  }

  public int subscriberCount() {
    return subscriptions.size();
  }

  public boolean isClosed() {
    return closed.get();
  }

  /**
   * Closes every subscription and stops listener workers.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    for (Subscription subscription : subscriptions) {
      subscription.close();
    }
    workers.shutdown();
    try {
      if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
        workers.shutdownNow();
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  void detach(Subscription subscription) {
    if (subscriptions.remove(subscription)) {
      metrics.recordSubscriberCount(subscriptions.size());
    }
  }

  private void deliver(Subscription subscription, StoredEvent event, PublishedRange range) {
    switch (subscription.offer(event, range)) {
      case DELIVERED -> metrics.incrementBusDelivered();
      case DELIVERED_WITH_DROP -> {
        metrics.incrementBusDelivered();
        metrics.incrementBusDropped();
      }
      case OVERRUN -> overrun(subscription);
      case REJECTED -> {
      }
    }
  }

  private void overrun(Subscription subscription) {
    metrics.incrementBusDropped();
    logger.log(Level.WARNING, "Subscriber overrun, disconnected: " + subscription);
  }

  private void backlogLoop(Subscription subscription) {
    try {
      if (subscription.drainBacklog()) {
        overrun(subscription);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private void listenerLoop(Subscription subscription, BusListener listener) {
    while (!Thread.currentThread().isInterrupted()) {
      try {
        StoredEvent event = subscription.poll(LISTENER_POLL_INTERVAL);
        if (subscription.consumeLag()) {
          listener.onLagged(subscription.droppedCount());
        }
        if (event == null) {
          if (subscription.isClosed()) {
            break;
          }
          continue;
        }
        listener.onEvent(event, subscription.publishedRange());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (Throwable t) {
        logger.log(Level.WARNING, "Bus listener failed for " + subscription, t);
      }
    }
  }

  private void ensureOpen() {
    if (closed.get()) {
      throw new IllegalStateException("EventBus is closed");
    }
  }
}
