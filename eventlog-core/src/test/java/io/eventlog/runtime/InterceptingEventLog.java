package io.eventlog.runtime;

import io.eventlog.EventEnvelope;
import io.eventlog.EventLog;
import io.eventlog.StoredEvent;
import io.eventlog.memory.InMemoryEventLog;

import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory log running a hook before every append, to simulate races and storage failures.
 */
class InterceptingEventLog implements EventLog {

  interface BeforeAppend {
    void run(int appendCall, InMemoryEventLog delegate);
  }

  final InMemoryEventLog delegate = new InMemoryEventLog();
  final AtomicInteger appendCalls = new AtomicInteger();
  private volatile BeforeAppend beforeAppend = (call, log) -> { };

  void beforeAppend(BeforeAppend hook) {
    this.beforeAppend = hook;
  }

  @Override
  public List<Long> append(String aggregateType, String aggregateId, long expectedVersion, List<EventEnvelope> events) {
    beforeAppend.run(appendCalls.incrementAndGet(), delegate);
    return delegate.append(aggregateType, aggregateId, expectedVersion, events);
  }

  @Override
  public List<StoredEvent> load(String aggregateType, String aggregateId) {
    return delegate.load(aggregateType, aggregateId);
  }

  @Override
  public List<StoredEvent> querySince(long globalSequence, int limit) {
    return delegate.querySince(globalSequence, limit);
  }

  @Override
  public long currentVersion(String aggregateType, String aggregateId) {
    return delegate.currentVersion(aggregateType, aggregateId);
  }

  @Override
  public OptionalLong earliestSequence() {
    return delegate.earliestSequence();
  }

  @Override
  public OptionalLong latestSequence() {
    return delegate.latestSequence();
  }

  @Override
  public int purge() {
    return delegate.purge();
  }
}
