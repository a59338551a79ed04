package io.eventlog.bus;

import io.eventlog.StoredEvent;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One subscriber's bounded view of the {@link EventBus}.
 *
 * <p>Events matching the subscription's {@link KeyExpression} are buffered up to
 * {@link SubscriptionOptions#capacity()}; what happens beyond that is decided by the
 * {@link OverflowPolicy}. Delivery is at-most-once: a consumer that sees
 * {@link #consumeLag()} return {@code true}, or finds the subscription {@linkplain #isOverrun()
 * overrun}, has missed events and must recover them from the event log.
 *
 * <p>Under {@link OverflowPolicy#BLOCK} the publisher never waits: events arriving while the
 * buffer is full go to a backlog of the same capacity, which a bus worker moves into the
 * buffer as the consumer frees space. The subscription is overrun when the buffer stays full
 * past the block timeout, or when the backlog fills up too.
 *
 * <p>Thread-safe. Closing is idempotent and detaches the subscription from the bus.
 */
public final class Subscription implements AutoCloseable {
  private final KeyExpression pattern;
  private final SubscriptionOptions options;
  private final EventBus bus;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();
  private final Condition notFull = lock.newCondition();
  private final Condition backlogReady = lock.newCondition();
  private final ArrayDeque<Delivery> buffer;
  private final ArrayDeque<Delivery> backlog;

  private long dropped;
  private boolean lagged;
  private boolean overrun;
  private boolean closed;
  private PublishedRange lastRange = PublishedRange.EMPTY;

  Subscription(EventBus bus, KeyExpression pattern, SubscriptionOptions options) {
    this.bus = bus;
    this.pattern = Objects.requireNonNull(pattern, "pattern");
    this.options = Objects.requireNonNull(options, "options");
    this.buffer = new ArrayDeque<>(options.capacity());
    this.backlog = new ArrayDeque<>();
  }

  public KeyExpression pattern() {
    return pattern;
  }

  public SubscriptionOptions options() {
    return options;
  }

  /**
   * Waits up to {@code timeout} for the next event.
   *
   * @param timeout maximum wait
   * @return the next event, or {@code null} on timeout or when the subscription is closed and drained
   * @throws InterruptedException if interrupted while waiting
   */
  public StoredEvent poll(Duration timeout) throws InterruptedException {
    long nanos = timeout.toNanos();
    lock.lockInterruptibly();
    try {
      while (buffer.isEmpty()) {
        if (closed || nanos <= 0) {
          return null;
        }
        nanos = notEmpty.awaitNanos(nanos);
      }
      Delivery delivery = buffer.pollFirst();
      lastRange = delivery.range();
      notFull.signal();
      return delivery.event();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the sequences the bus had published without gap when the event last returned by
   * {@link #poll} was delivered.
   *
   * @return the published range, {@link PublishedRange#EMPTY} before the first poll
   */
  public PublishedRange publishedRange() {
    lock.lock();
    try {
      return lastRange;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns whether events were dropped since the last call, and clears the flag.
   *
   * @return {@code true} if the subscriber lagged
   */
  public boolean consumeLag() {
    lock.lock();
    try {
      boolean wasLagged = lagged;
      lagged = false;
      return wasLagged;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns {@code true} if the bus closed this subscription because a
   * {@link OverflowPolicy#BLOCK} buffer stayed full past its timeout.
   *
   * @return whether the subscription was overrun
   */
  public boolean isOverrun() {
    lock.lock();
    try {
      return overrun;
    } finally {
      lock.unlock();
    }
  }

  public long droppedCount() {
    lock.lock();
    try {
      return dropped;
    } finally {
      lock.unlock();
    }
  }

  public int buffered() {
    lock.lock();
    try {
      return buffer.size();
    } finally {
      lock.unlock();
    }
  }

  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void close() {
    if (markClosed(false)) {
      bus.detach(this);
    }
  }

  /**
   * Offers an event without waiting. A full {@code DROP_OLDEST} buffer discards its oldest
   * event; a full {@code BLOCK} buffer defers the event to the backlog, and a full backlog
   * overruns the subscription.
   */
  Offer offer(StoredEvent event, PublishedRange range) {
    Delivery delivery = new Delivery(event, range);
    lock.lock();
    try {
      if (closed) {
        return Offer.REJECTED;
      }
      if (backlog.isEmpty() && buffer.size() < options.capacity()) {
        enqueue(delivery);
        return Offer.DELIVERED;
      }
      if (options.overflow() == OverflowPolicy.DROP_OLDEST) {
        buffer.pollFirst();
        dropped++;
        lagged = true;
        enqueue(delivery);
        return Offer.DELIVERED_WITH_DROP;
      }
      if (backlog.size() < options.capacity()) {
        backlog.addLast(delivery);
        backlogReady.signal();
        return Offer.DELIVERED;
      }
      dropped += 1 + backlog.size();
      backlog.clear();
      overrun = true;
    } finally {
      lock.unlock();
    }
    if (markClosed(true)) {
      bus.detach(this);
    }
    return Offer.OVERRUN;
  }

  /**
   * Moves backlogged events into the buffer as the consumer frees space, waiting at most the
   * block timeout for each. Runs on a bus worker until the subscription closes.
   *
   * @return {@code true} if the subscription was closed here because the buffer stayed full
   * @throws InterruptedException if the worker is interrupted
   */
  boolean drainBacklog() throws InterruptedException {
    lock.lockInterruptibly();
    try {
      while (true) {
        while (backlog.isEmpty() && !closed) {
          backlogReady.await();
        }
        if (closed) {
          return false;
        }
        long nanos = options.blockTimeout().toNanos();
        while (buffer.size() >= options.capacity() && !closed && nanos > 0) {
          nanos = notFull.awaitNanos(nanos);
        }
        if (closed) {
          return false;
        }
        if (buffer.size() >= options.capacity()) {
          break;
        }
        enqueue(backlog.pollFirst());
      }
      dropped += backlog.size();
      backlog.clear();
      overrun = true;
    } finally {
      lock.unlock();
    }
    if (markClosed(true)) {
      bus.detach(this);
      return true;
    }
    return false;
  }

  private void enqueue(Delivery delivery) {
    buffer.addLast(delivery);
    notEmpty.signal();
  }

  private boolean markClosed(boolean byOverrun) {
    lock.lock();
    try {
      if (closed) {
        return false;
      }
      closed = true;
      overrun |= byOverrun;
      backlog.clear();
      notEmpty.signalAll();
      notFull.signalAll();
      backlogReady.signalAll();
      return true;
    } finally {
      lock.unlock();
    }
  }

  private record Delivery(StoredEvent event, PublishedRange range) {
  }

  enum Offer {
    DELIVERED,
    DELIVERED_WITH_DROP,
    OVERRUN,
    REJECTED
  }

  @Override
  public String toString() {
    return "Subscription{pattern=" + pattern + ", overflow=" + options.overflow() + '}';
  }
}
