package io.eventlog.demo;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.eventlog.ConcurrencyConflictException;
import io.eventlog.EventEnvelope;
import io.eventlog.StoredEvent;
import io.eventlog.bus.EventKeys;
import io.eventlog.demo.todo.TodoAggregate;
import io.eventlog.demo.todo.TodoCommand;
import io.eventlog.demo.todo.TodoEvent;
import io.eventlog.feed.FeedConnection;
import io.eventlog.feed.FeedState;
import io.eventlog.feed.SseFrame;
import io.eventlog.runtime.CommandContext;
import io.eventlog.runtime.CommandResult;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end scenarios over H2: single create, racing creators, and feed replay into live
 * streaming.
 */
class TodoAcceptanceTest {
  private static final CommandContext USER = CommandContext.user("tester");

  private HikariDataSource eventStore;
  private TodoApplication app;

  @BeforeEach
  void setUp() {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:todo_acceptance_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
    config.setMaximumPoolSize(8);
    eventStore = new HikariDataSource(config);
    JdbcDataSource analytics = new JdbcDataSource();
    analytics.setURL("jdbc:h2:mem:todo_acceptance_analytics;DB_CLOSE_DELAY=-1");
    app = new TodoApplication(eventStore, analytics, Duration.ofMillis(200));
  }

  @AfterEach
  void tearDown() {
    app.close();
    eventStore.close();
  }

  // ── Scenario A: create ──

  @Test
  void createProducesExactlyOneEvent() {
    long before = app.eventLog().latestSequence().orElse(0);

    CommandResult result = app.gateway().dispatch(
        new TodoCommand.CreateTodo("t-1", "buy milk", Instant.now()), USER);

    assertEquals(1, result.version());
    assertEquals(1, result.events().size());
    StoredEvent stored = result.events().get(0);
    assertEquals("TodoCreated", stored.eventType());
    assertEquals(1, stored.aggregateSequence());
    assertEquals(2, stored.schemaVersion());
    assertEquals("tester", stored.metadataValue("actor"));

    List<StoredEvent> since = app.eventLog().querySince(before, 100);
    assertEquals(1, since.size());
    assertEquals(stored.eventId(), since.get(0).eventId());
    assertEquals(stored.globalSequence(), since.get(0).globalSequence());
    TodoEvent decoded = TodoAggregate.CODEC.decode(since.get(0));
    assertEquals("buy milk", ((TodoEvent.TodoCreated) decoded).text());
  }

  // ── Scenario B: racing creators ──

  @Test
  void racingAppendsAtVersionZeroHaveOneWinner() throws Exception {
    int writers = 2;
    CountDownLatch start = new CountDownLatch(1);
    AtomicInteger winners = new AtomicInteger();
    List<ConcurrencyConflictException> conflicts = new CopyOnWriteArrayList<>();
    List<Throwable> errors = new CopyOnWriteArrayList<>();
    ExecutorService executor = Executors.newFixedThreadPool(writers);
    for (int i = 0; i < writers; i++) {
      String text = "writer " + i;
      executor.submit(() -> {
        try {
          start.await();
          EventEnvelope envelope = TodoAggregate.CODEC.encode(
              new TodoEvent.TodoCreated("t-race", text, Instant.now()), Map.of());
          app.eventLog().append(TodoAggregate.TYPE, "t-race", 0, List.of(envelope));
          winners.incrementAndGet();
        } catch (ConcurrencyConflictException e) {
          conflicts.add(e);
        } catch (Throwable e) {
          errors.add(e);
        }
      });
    }
    start.countDown();
    executor.shutdown();
    assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));

    assertTrue(errors.isEmpty(), () -> "unexpected errors: " + errors);
    assertEquals(1, winners.get());
    assertEquals(1, conflicts.size());
    assertEquals(0, conflicts.get(0).expected());
    assertEquals(1, conflicts.get(0).actual());

    List<StoredEvent> stream = app.eventLog().load(TodoAggregate.TYPE, "t-race");
    assertEquals(1, stream.size());
    assertEquals(1, stream.get(0).aggregateSequence());
  }

  // ── Scenario C: replay then live ──

  @Test
  void feedReplaysHistoryThenStreamsWithoutDuplicates() throws Exception {
    for (int i = 0; i < 5; i++) {
      app.gateway().dispatch(new TodoCommand.CreateTodo("t-" + i, "item " + i, Instant.now()), USER);
    }

    List<SseFrame> frames = new CopyOnWriteArrayList<>();
    FeedConnection feed = app.feeds().open(null, EventKeys.ALL_EVENTS, frames::add);
    try {
      for (int i = 5; i < 10; i++) {
        app.gateway().dispatch(new TodoCommand.CreateTodo("t-" + i, "item " + i, Instant.now()), USER);
      }
      long latest = app.eventLog().latestSequence().orElseThrow();
      awaitTrue(() -> feed.lastSentSequence() == latest);
      assertEquals(FeedState.STREAMING, feed.state());

      List<Long> ids = dataIds(frames);
      assertEquals(10, ids.size());
      for (int i = 0; i < ids.size(); i++) {
        assertEquals(i + 1, ids.get(i));
      }
    } finally {
      feed.close();
    }
    assertEquals(FeedState.CLOSED, feed.state());
  }

  @Test
  void feedResumesAfterLastEventId() throws Exception {
    for (int i = 0; i < 4; i++) {
      app.gateway().dispatch(new TodoCommand.CreateTodo("t-" + i, "item " + i, Instant.now()), USER);
    }
    List<SseFrame> frames = new CopyOnWriteArrayList<>();
    long cursor = SseFrame.parseLastEventId("2").orElseThrow();
    try (FeedConnection feed = app.feeds().open(cursor, EventKeys.aggregateTypePattern("Todo"), frames::add)) {
      awaitTrue(() -> feed.lastSentSequence() == 4);
      assertEquals(List.of(3L, 4L), dataIds(frames));
    }
  }

  @Test
  void idleFeedSendsKeepAlive() throws Exception {
    List<SseFrame> frames = new CopyOnWriteArrayList<>();
    try (FeedConnection feed = app.feeds().open(null, EventKeys.ALL_EVENTS, frames::add)) {
      awaitTrue(() -> frames.stream().anyMatch(SseFrame::isComment));
      assertEquals(": keepalive\n\n", frames.get(0).render());
      assertEquals(0, feed.cursor());
    }
  }

  private static List<Long> dataIds(List<SseFrame> frames) {
    List<Long> ids = new ArrayList<>();
    for (SseFrame frame : frames) {
      if (!frame.isComment()) {
        ids.add(Long.parseLong(frame.id()));
      }
    }
    return ids;
  }

  static void awaitTrue(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
    while (!condition.getAsBoolean()) {
      assertTrue(System.nanoTime() < deadline, "condition not met within 10s");
      Thread.sleep(20);
    }
  }
}
