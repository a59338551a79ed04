package io.eventlog.memory;

import io.eventlog.ConcurrencyConflictException;
import io.eventlog.Counters;
import io.eventlog.EventEnvelope;
import io.eventlog.StoredEvent;
import io.eventlog.upcast.Upcaster;
import io.eventlog.upcast.UpcasterChain;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryEventLogTest {

  private final InMemoryEventLog log = new InMemoryEventLog();

  // ── Append ──

  @Test
  void appendAssignsGaplessSequences() {
    List<Long> first = log.append("Counter", "a", 0, List.of(Counters.incremented("a", 1), Counters.incremented("a", 2)));
    List<Long> second = log.append("Counter", "b", 0, List.of(Counters.incremented("b", 1)));

    assertEquals(List.of(1L, 2L), first);
    assertEquals(List.of(3L), second);
    assertEquals(2, log.currentVersion("Counter", "a"));
    assertEquals(1, log.currentVersion("Counter", "b"));
  }

  @Test
  void appendStoresEnvelopeFields() {
    Instant occurredAt = Instant.parse("2024-03-01T12:00:00Z");
    EventEnvelope envelope = EventEnvelope.builder("Incremented")
        .eventId("evt-1")
        .schemaVersion(2)
        .occurredAt(occurredAt)
        .metadata(Map.of("actor", "alice"))
        .payloadJson("{\"amount\":\"1\"}")
        .build();

    log.append("Counter", "a", 0, List.of(envelope));
    StoredEvent stored = log.load("Counter", "a").get(0);

    assertEquals(1, stored.globalSequence());
    assertEquals("evt-1", stored.eventId());
    assertEquals("Counter", stored.aggregateType());
    assertEquals("a", stored.aggregateId());
    assertEquals(1, stored.aggregateSequence());
    assertEquals(2, stored.schemaVersion());
    assertEquals(occurredAt, stored.createdAt());
    assertEquals("alice", stored.metadataValue("actor"));
    assertEquals("{\"amount\":\"1\"}", stored.payloadJson());
  }

  @Test
  void staleExpectedVersionConflicts() {
    log.append("Counter", "a", 0, List.of(Counters.incremented("a", 1)));

    ConcurrencyConflictException e = assertThrows(ConcurrencyConflictException.class, () ->
        log.append("Counter", "a", 0, List.of(Counters.incremented("a", 1))));

    assertEquals(0, e.expected());
    assertEquals(1, e.actual());
    assertEquals("Counter", e.aggregateType());
    assertEquals("a", e.aggregateId());
    assertEquals(1, log.latestSequence().getAsLong(), "failed batch stores nothing");
  }

  @Test
  void emptyBatchChecksVersionAndStoresNothing() {
    assertEquals(List.of(), log.append("Counter", "a", 0, List.of()));
    assertThrows(ConcurrencyConflictException.class, () -> log.append("Counter", "a", 3, List.of()));
    assertTrue(log.latestSequence().isEmpty());
  }

  @Test
  void differentAggregatesNeverConflict() throws Exception {
    int writers = 8;
    int perWriter = 50;
    ExecutorService pool = Executors.newFixedThreadPool(writers);
    CountDownLatch start = new CountDownLatch(1);
    AtomicInteger failures = new AtomicInteger();
    for (int w = 0; w < writers; w++) {
      String id = "c-" + w;
      pool.submit(() -> {
        try {
          start.await();
          for (int i = 0; i < perWriter; i++) {
            log.append("Counter", id, i, List.of(Counters.incremented(id, 1)));
          }
        } catch (Exception e) {
          failures.incrementAndGet();
        }
        return null;
      });
    }
    start.countDown();
    pool.shutdown();
    assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

    assertEquals(0, failures.get());
    List<StoredEvent> all = log.querySince(0);
    assertEquals(writers * perWriter, all.size());
    for (int i = 0; i < all.size(); i++) {
      assertEquals(i + 1, all.get(i).globalSequence());
    }
  }

  // ── Read ──

  @Test
  void loadReturnsOnlyOneAggregateInOrder() {
    log.append("Counter", "a", 0, List.of(Counters.incremented("a", 1)));
    log.append("Counter", "b", 0, List.of(Counters.incremented("b", 1)));
    log.append("Counter", "a", 1, List.of(Counters.incremented("a", 2)));

    List<StoredEvent> events = log.load("Counter", "a");

    assertEquals(2, events.size());
    assertEquals(1, events.get(0).aggregateSequence());
    assertEquals(2, events.get(1).aggregateSequence());
    assertEquals(List.of(), log.load("Counter", "missing"));
  }

  @Test
  void querySinceIsExclusiveAndPaged() {
    for (int i = 0; i < 5; i++) {
      log.append("Counter", "a", i, List.of(Counters.incremented("a", 1)));
    }

    assertEquals(5, log.querySince(0).size());
    assertEquals(List.of(4L, 5L), sequences(log.querySince(3)));
    assertEquals(List.of(2L, 3L), sequences(log.querySince(1, 2)));
    assertEquals(List.of(), log.querySince(5));
    assertEquals(List.of(), log.querySince(99));
    assertThrows(IllegalArgumentException.class, () -> log.querySince(0, 0));
  }

  @Test
  void diagnosticsAndPurge() {
    assertFalse(log.earliestSequence().isPresent());
    log.append("Counter", "a", 0, List.of(Counters.incremented("a", 1), Counters.incremented("a", 1)));

    assertEquals(1, log.earliestSequence().getAsLong());
    assertEquals(2, log.latestSequence().getAsLong());
    assertEquals(2, log.purge());
    assertTrue(log.latestSequence().isEmpty());
    assertEquals(List.of(1L), log.append("Counter", "a", 0, List.of(Counters.incremented("a", 1))));
  }

  @Test
  void readsApplyUpcasters() {
    Upcaster toV2 = new Upcaster() {
      @Override
      public String eventType() {
        return "Incremented";
      }

      @Override
      public int sourceVersion() {
        return 1;
      }

      @Override
      public byte[] transform(byte[] payload) {
        return "{\"upgraded\":\"true\"}".getBytes(StandardCharsets.UTF_8);
      }
    };
    InMemoryEventLog upcasting = new InMemoryEventLog(UpcasterChain.builder().register(toV2).build());
    upcasting.append("Counter", "a", 0, List.of(Counters.incremented("a", 1)));

    StoredEvent loaded = upcasting.load("Counter", "a").get(0);
    StoredEvent queried = upcasting.querySince(0).get(0);

    assertEquals(2, loaded.schemaVersion());
    assertEquals("{\"upgraded\":\"true\"}", loaded.payloadJson());
    assertEquals(loaded, queried);
  }

  private static List<Long> sequences(List<StoredEvent> events) {
    List<Long> result = new ArrayList<>();
    for (StoredEvent event : events) {
      result.add(event.globalSequence());
    }
    return result;
  }
}
