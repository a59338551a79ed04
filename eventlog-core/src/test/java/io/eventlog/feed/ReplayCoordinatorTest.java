package io.eventlog.feed;

import io.eventlog.Counters;
import io.eventlog.EventLog;
import io.eventlog.StoredEvent;
import io.eventlog.bus.EventBus;
import io.eventlog.bus.EventKeys;
import io.eventlog.bus.KeyExpression;
import io.eventlog.bus.SubscriptionOptions;
import io.eventlog.memory.InMemoryEventLog;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReplayCoordinatorTest {

  private final InMemoryEventLog log = new InMemoryEventLog();
  private final EventBus bus = new EventBus();
  private final BlockingQueue<SseFrame> frames = new LinkedBlockingQueue<>();
  private ReplayCoordinator coordinator;

  @AfterEach
  void tearDown() {
    if (coordinator != null) {
      coordinator.close();
    }
    bus.close();
  }

  private ReplayCoordinator.Builder coordinatorBuilder(EventLog eventLog) {
    return ReplayCoordinator.builder()
        .eventLog(eventLog)
        .eventBus(bus)
        .keepAlive(Duration.ofSeconds(10));
  }

  /** Appends one event without publishing it. */
  private StoredEvent append(String counterId) {
    long version = log.currentVersion(Counters.TYPE, counterId);
    long sequence = log.append(Counters.TYPE, counterId, version, List.of(Counters.incremented(counterId, 1))).get(0);
    return log.querySince(sequence - 1, 1).get(0);
  }

  /** Appends and publishes, as the aggregate runtime does. */
  private StoredEvent commit(String counterId) {
    StoredEvent stored = append(counterId);
    bus.publish(stored);
    return stored;
  }

  private List<Long> nextDataIds(int count) throws InterruptedException {
    List<Long> ids = new ArrayList<>();
    while (ids.size() < count) {
      SseFrame frame = frames.poll(5, TimeUnit.SECONDS);
      assertNotNull(frame, "timed out after " + ids);
      if (!frame.isComment()) {
        ids.add(Long.parseLong(frame.id()));
      }
    }
    return ids;
  }

  private void assertNoMoreData() throws InterruptedException {
    SseFrame frame;
    while ((frame = frames.poll(200, TimeUnit.MILLISECONDS)) != null) {
      assertTrue(frame.isComment(), "unexpected frame " + frame);
    }
  }

  private static void awaitState(FeedConnection connection, FeedState state) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (connection.state() != state && System.nanoTime() < deadline) {
      Thread.sleep(5);
    }
    assertEquals(state, connection.state());
  }

  // ── Replay then stream ──

  @Test
  void replaysAfterCursorThenStreamsLive() throws Exception {
    coordinator = coordinatorBuilder(log).build();
    commit("c-1");
    commit("c-1");
    commit("c-1");

    FeedConnection connection = coordinator.open(1L, EventKeys.ALL_EVENTS, frames::add);

    assertEquals(List.of(2L, 3L), nextDataIds(2));
    awaitState(connection, FeedState.STREAMING);
    commit("c-1");
    assertEquals(List.of(4L), nextDataIds(1));
    assertEquals(4, connection.lastSentSequence());
  }

  @Test
  void withoutCursorReplaysWholeLog() throws Exception {
    coordinator = coordinatorBuilder(log).build();
    commit("c-1");
    commit("c-2");

    coordinator.open(null, EventKeys.ALL_EVENTS, frames::add);

    assertEquals(List.of(1L, 2L), nextDataIds(2));
  }

  @Test
  void filtersByPattern() throws Exception {
    coordinator = coordinatorBuilder(log).build();
    commit("c-1");
    commit("c-2");

    FeedConnection connection = coordinator.open(null, EventKeys.aggregateInstancePattern(Counters.TYPE, "c-2"), frames::add);
    awaitState(connection, FeedState.STREAMING);
    commit("c-1");
    commit("c-2");

    assertEquals(List.of(2L, 4L), nextDataIds(2));
    assertNoMoreData();
    assertEquals(4, connection.cursor());
  }

  @Test
  void replayIsPaged() throws Exception {
    coordinator = coordinatorBuilder(log).replayPageSize(2).build();
    for (int i = 0; i < 5; i++) {
      append("c-1");
    }

    coordinator.open(0L, EventKeys.ALL_EVENTS, frames::add);

    assertEquals(List.of(1L, 2L, 3L, 4L, 5L), nextDataIds(5));
  }

  // ── Exactly once across the boundary ──

  @Test
  void eventCommittedDuringReplayIsDeliveredOnce() throws Exception {
    AtomicBoolean injected = new AtomicBoolean();
    EventLog racing = new DelegatingEventLog(log) {
      @Override
      public List<StoredEvent> querySince(long globalSequence, int limit) {
        List<StoredEvent> page = super.querySince(globalSequence, limit);
        if (injected.compareAndSet(false, true)) {
          commit("c-1");
        }
        return page;
      }
    };
    coordinator = coordinatorBuilder(racing).build();
    commit("c-1");

    coordinator.open(null, EventKeys.ALL_EVENTS, frames::add);

    assertEquals(List.of(1L, 2L), nextDataIds(2));
    assertNoMoreData();
  }

  @Test
  void livePublicationOfReplayedEventIsSkipped() throws Exception {
    coordinator = coordinatorBuilder(log).build();
    StoredEvent first = append("c-1");

    FeedConnection connection = coordinator.open(null, EventKeys.ALL_EVENTS, frames::add);
    assertEquals(List.of(1L), nextDataIds(1));
    awaitState(connection, FeedState.STREAMING);
    bus.publish(first);
    commit("c-1");

    assertEquals(List.of(2L), nextDataIds(1));
    assertNoMoreData();
  }

  @Test
  void outOfOrderPublicationIsSentInSequenceOrder() throws Exception {
    coordinator = coordinatorBuilder(log).build();
    FeedConnection connection = coordinator.open(null, EventKeys.ALL_EVENTS, frames::add);
    awaitState(connection, FeedState.STREAMING);

    StoredEvent first = append("c-1");
    StoredEvent second = append("c-2");
    bus.publish(second);
    bus.publish(first);

    assertEquals(List.of(1L, 2L), nextDataIds(2));
    assertNoMoreData();
  }

  // ── Filtered live streaming ──

  @Test
  void filteredFeedStreamsWithoutQueryingTheLog() throws Exception {
    AtomicInteger queries = new AtomicInteger();
    EventLog counting = new DelegatingEventLog(log) {
      @Override
      public List<StoredEvent> querySince(long globalSequence, int limit) {
        queries.incrementAndGet();
        return super.querySince(globalSequence, limit);
      }
    };
    coordinator = coordinatorBuilder(counting).build();
    FeedConnection connection = coordinator.open(null, EventKeys.aggregateInstancePattern(Counters.TYPE, "c-2"), frames::add);
    awaitState(connection, FeedState.STREAMING);

    List<Long> expected = new ArrayList<>();
    for (int i = 0; i < 50; i++) {
      commit("c-1");
      expected.add(commit("c-2").globalSequence());
    }

    assertEquals(expected, nextDataIds(50));
    assertEquals(1, queries.get(), "only the initial replay reads the log");
  }

  @Test
  void unpublishedEventIsRecoveredByFilteredFeed() throws Exception {
    coordinator = coordinatorBuilder(log).build();
    FeedConnection connection = coordinator.open(null, EventKeys.aggregateInstancePattern(Counters.TYPE, "c-2"), frames::add);
    awaitState(connection, FeedState.STREAMING);

    commit("c-2");
    append("c-2");
    commit("c-1");
    commit("c-2");

    assertEquals(List.of(1L, 2L, 4L), nextDataIds(3));
    assertNoMoreData();
  }

  // ── Recovery ──

  @Test
  void lagIsRecoveredFromTheLog() throws Exception {
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    coordinator = coordinatorBuilder(log).subscriptionOptions(SubscriptionOptions.dropOldest(1)).build();
    FeedConnection connection = coordinator.open(null, EventKeys.ALL_EVENTS, frame -> {
      if ("1".equals(frame.id())) {
        entered.countDown();
        awaitUninterruptibly(release);
      }
      frames.add(frame);
    });
    awaitState(connection, FeedState.STREAMING);

    commit("c-1");
    assertTrue(entered.await(5, TimeUnit.SECONDS));
    for (int i = 0; i < 5; i++) {
      commit("c-1");
    }
    release.countDown();

    assertEquals(List.of(1L, 2L, 3L, 4L, 5L, 6L), nextDataIds(6));
    assertNoMoreData();
  }

  @Test
  void overrunResubscribesAndRecovers() throws Exception {
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    coordinator = coordinatorBuilder(log)
        .subscriptionOptions(SubscriptionOptions.block(1, Duration.ofMillis(20)))
        .build();
    FeedConnection connection = coordinator.open(null, EventKeys.ALL_EVENTS, frame -> {
      if ("1".equals(frame.id())) {
        entered.countDown();
        awaitUninterruptibly(release);
      }
      frames.add(frame);
    });
    awaitState(connection, FeedState.STREAMING);

    commit("c-1");
    assertTrue(entered.await(5, TimeUnit.SECONDS));
    for (int i = 0; i < 3; i++) {
      commit("c-1");
    }
    release.countDown();

    assertEquals(List.of(1L, 2L, 3L, 4L), nextDataIds(4));
    awaitState(connection, FeedState.STREAMING);
    commit("c-1");
    assertEquals(List.of(5L), nextDataIds(1));
  }

  // ── Keep-alive and lifecycle ──

  @Test
  void idleFeedSendsKeepAlive() throws Exception {
    coordinator = coordinatorBuilder(log).keepAlive(Duration.ofMillis(50)).build();
    commit("c-1");

    FeedConnection connection = coordinator.open(null, EventKeys.ALL_EVENTS, frames::add);

    assertEquals("1", frames.poll(5, TimeUnit.SECONDS).id());
    SseFrame keepAlive = frames.poll(5, TimeUnit.SECONDS);
    assertNotNull(keepAlive);
    assertTrue(keepAlive.isComment());
    assertEquals(SseFrame.KEEP_ALIVE_COMMENT, keepAlive.comment());
    assertEquals(1, connection.cursor(), "keep-alive does not move the cursor");
  }

  @Test
  void sinkFailureClosesFeedAndReleasesSubscription() throws Exception {
    coordinator = coordinatorBuilder(log).build();
    commit("c-1");

    FeedConnection connection = coordinator.open(null, EventKeys.ALL_EVENTS, frame -> {
      throw new IOException("client gone");
    });

    connection.termination().get(5, TimeUnit.SECONDS);
    assertEquals(FeedState.CLOSED, connection.state());
    assertEquals(0, bus.subscriberCount());
    assertEquals(0, coordinator.openConnections());
  }

  @Test
  void closeStopsStreaming() throws Exception {
    coordinator = coordinatorBuilder(log).build();
    FeedConnection connection = coordinator.open(null, EventKeys.ALL_EVENTS, frames::add);
    awaitState(connection, FeedState.STREAMING);

    connection.close();
    connection.termination().get(5, TimeUnit.SECONDS);
    commit("c-1");

    assertEquals(FeedState.CLOSED, connection.state());
    assertEquals(0, bus.subscriberCount());
    assertNull(frames.poll(200, TimeUnit.MILLISECONDS));
  }

  @Test
  void subscribesBeforeReturning() {
    coordinator = coordinatorBuilder(log).build();

    coordinator.open(null, KeyExpression.parse("events/Counter/*"), frames::add);

    assertEquals(1, bus.subscriberCount());
  }

  @Test
  void resumesFromLastEventIdHeader() throws Exception {
    coordinator = coordinatorBuilder(log).build();
    commit("c-1");
    commit("c-1");
    OptionalLong lastSeen = SseFrame.parseLastEventId("1");

    coordinator.open(lastSeen.isPresent() ? lastSeen.getAsLong() : null, EventKeys.ALL_EVENTS, frames::add);

    assertEquals(List.of(2L), nextDataIds(1));
  }

  private static void awaitUninterruptibly(CountDownLatch latch) {
    try {
      latch.await(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private static class DelegatingEventLog implements EventLog {
    private final EventLog delegate;

    DelegatingEventLog(EventLog delegate) {
      this.delegate = delegate;
    }

    @Override
    public List<Long> append(String aggregateType, String aggregateId, long expectedVersion,
        List<io.eventlog.EventEnvelope> events) {
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
}
