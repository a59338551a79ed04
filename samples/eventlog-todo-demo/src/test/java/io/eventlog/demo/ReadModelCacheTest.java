package io.eventlog.demo;

import io.eventlog.StoredEvent;
import io.eventlog.demo.todo.TodoState;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ReadModelCacheTest {

  private final AtomicInteger loads = new AtomicInteger();
  private final ReadModelCache cache = new ReadModelCache(id -> {
    loads.incrementAndGet();
    return new TodoState(id, "text " + loads.get(), TodoState.Status.ACTIVE, Instant.EPOCH, null, null);
  });

  private static StoredEvent event(long sequence, String todoId) {
    return new StoredEvent(sequence, "e-" + sequence, "Todo", todoId, 1, "TodoTextUpdated", 1,
        "{}".getBytes(StandardCharsets.UTF_8), Map.of(), Instant.EPOCH);
  }

  @Test
  void loadsOnceUntilInvalidated() {
    assertEquals("text 1", cache.get("t-1").text());
    assertEquals("text 1", cache.get("t-1").text());
    assertEquals(1, loads.get());

    cache.onEvent(event(7, "t-1"));

    assertFalse(cache.isCached("t-1"));
    assertEquals("text 2", cache.get("t-1").text());
    assertEquals(1, cache.invalidations());
    assertEquals(7, cache.lastSeenSequence());
  }

  @Test
  void eventsForUncachedTodosAreNotInvalidations() {
    cache.onEvent(event(1, "t-9"));
    assertEquals(0, cache.invalidations());
    assertEquals(1, cache.lastSeenSequence());
  }

  @Test
  void lagClearsEverything() {
    cache.get("t-1");
    cache.get("t-2");
    cache.onLagged(3);
    assertFalse(cache.isCached("t-1"));
    assertFalse(cache.isCached("t-2"));
  }
}
