package io.eventlog.memory;

import io.eventlog.ConcurrencyConflictException;
import io.eventlog.EventEnvelope;
import io.eventlog.EventLog;
import io.eventlog.StoredEvent;
import io.eventlog.upcast.UpcasterChain;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Reference in-memory {@link EventLog}.
 *
 * <p>Good for unit tests and examples. Not intended for production: nothing survives a
 * restart. Appends are serialized by a single write lock, which makes the version check and
 * the sequence assignment one atomic step; readers share a read lock.
 */
public final class InMemoryEventLog implements EventLog {

  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final List<StoredEvent> events = new ArrayList<>();
  private final Map<StreamKey, List<StoredEvent>> streams = new HashMap<>();
  private final UpcasterChain upcasters;

  public InMemoryEventLog() {
    this(UpcasterChain.EMPTY);
  }

  public InMemoryEventLog(UpcasterChain upcasters) {
    this.upcasters = Objects.requireNonNull(upcasters, "upcasters");
  }

  @Override
  public List<Long> append(String aggregateType, String aggregateId, long expectedVersion,
      List<EventEnvelope> batch) {
    Objects.requireNonNull(aggregateType, "aggregateType");
    Objects.requireNonNull(aggregateId, "aggregateId");
    Objects.requireNonNull(batch, "events");
    StreamKey key = new StreamKey(aggregateType, aggregateId);
    lock.writeLock().lock();
    try {
      List<StoredEvent> stream = streams.get(key);
      long actual = stream == null ? 0 : stream.size();
      if (actual != expectedVersion) {
        throw new ConcurrencyConflictException(aggregateType, aggregateId, expectedVersion, actual);
      }
      if (batch.isEmpty()) {
        return List.of();
      }
      if (stream == null) {
        stream = new ArrayList<>();
        streams.put(key, stream);
      }
      List<Long> sequences = new ArrayList<>(batch.size());
      long version = actual;
      for (EventEnvelope envelope : batch) {
        long globalSequence = events.size() + 1L;
        StoredEvent stored = new StoredEvent(globalSequence, envelope.eventId(), aggregateType,
            aggregateId, ++version, envelope.eventType(), envelope.schemaVersion(),
            envelope.payload(), envelope.metadata(), envelope.occurredAt());
        events.add(stored);
        stream.add(stored);
        sequences.add(globalSequence);
      }
      return sequences;
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public List<StoredEvent> load(String aggregateType, String aggregateId) {
    lock.readLock().lock();
    try {
      List<StoredEvent> stream = streams.get(new StreamKey(aggregateType, aggregateId));
      return stream == null ? List.of() : upcasters.upcastAll(List.copyOf(stream));
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public List<StoredEvent> querySince(long globalSequence, int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0, got: " + limit);
    }
    lock.readLock().lock();
    try {
      // global sequence n lives at index n - 1
      int from = (int) Math.min(Math.max(globalSequence, 0), events.size());
      int to = (int) Math.min((long) from + limit, events.size());
      return upcasters.upcastAll(List.copyOf(events.subList(from, to)));
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public long currentVersion(String aggregateType, String aggregateId) {
    lock.readLock().lock();
    try {
      List<StoredEvent> stream = streams.get(new StreamKey(aggregateType, aggregateId));
      return stream == null ? 0 : stream.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public OptionalLong earliestSequence() {
    lock.readLock().lock();
    try {
      return events.isEmpty() ? OptionalLong.empty() : OptionalLong.of(events.get(0).globalSequence());
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public OptionalLong latestSequence() {
    lock.readLock().lock();
    try {
      return events.isEmpty() ? OptionalLong.empty() : OptionalLong.of(events.size());
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public int purge() {
    lock.writeLock().lock();
    try {
      int deleted = events.size();
      events.clear();
      streams.clear();
      return deleted;
    } finally {
      lock.writeLock().unlock();
    }
  }

  private record StreamKey(String aggregateType, String aggregateId) {}
}
