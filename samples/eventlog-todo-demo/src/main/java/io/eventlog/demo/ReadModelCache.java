package io.eventlog.demo;

import io.eventlog.StoredEvent;
import io.eventlog.bus.BusListener;
import io.eventlog.demo.todo.TodoState;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Caches folded todo states and evicts an entry whenever an event for that todo is
 * published. A lagged subscription clears the whole cache, since evictions may have been
 * missed.
 */
public final class ReadModelCache implements BusListener {
  private static final Logger logger = Logger.getLogger(ReadModelCache.class.getName());

  private final Map<String, TodoState> states = new ConcurrentHashMap<>();
  private final Function<String, TodoState> loader;
  private final AtomicLong invalidations = new AtomicLong();
  private final AtomicLong lastSeen = new AtomicLong();

  public ReadModelCache(Function<String, TodoState> loader) {
    this.loader = Objects.requireNonNull(loader, "loader");
  }

  public TodoState get(String todoId) {
    return states.computeIfAbsent(todoId, loader);
  }

  public boolean isCached(String todoId) {
    return states.containsKey(todoId);
  }

  public long invalidations() {
    return invalidations.get();
  }

  /** Global sequence of the last event this cache processed. */
  public long lastSeenSequence() {
    return lastSeen.get();
  }

  @Override
  public void onEvent(StoredEvent event) {
    if (states.remove(event.aggregateId()) != null) {
      invalidations.incrementAndGet();
    }
    lastSeen.accumulateAndGet(event.globalSequence(), Math::max);
  }

  @Override
  public void onLagged(long dropped) {
    logger.log(Level.WARNING, "Todo cache lagged by {0} events, clearing", dropped);
    states.clear();
  }
}
