package io.eventlog.bus;

import io.eventlog.StoredEvent;

/**
 * Callback receiving live events from {@link EventBus#subscribe(KeyExpression,
 * SubscriptionOptions, BusListener)}. Typical implementations invalidate caches or update
 * read models.
 *
 * <p>Each listener runs on its own worker thread. Exceptions are logged and do not stop
 * delivery of later events.
 */
@FunctionalInterface
public interface BusListener {

  /**
   * Called for each matching event, in publication order.
   *
   * @param event the published event
   * @throws Exception on failure; logged by the bus
   */
  void onEvent(StoredEvent event) throws Exception;

  /**
   * Called for each matching event together with the sequences the bus had published without
   * gap at delivery. Listeners that track a position override this to tell filtered-out
   * sequences from missed ones; the default ignores the range.
   *
   * @param event     the published event
   * @param published the published range at delivery
   * @throws Exception on failure; logged by the bus
   */
  default void onEvent(StoredEvent event, PublishedRange published) throws Exception {
    onEvent(event);
  }

  /**
   * Called when the subscription dropped events because the listener fell behind.
   * Implementations that need every event should rebuild from the log.
   *
   * @param droppedTotal total number of events dropped so far
   */
  default void onLagged(long droppedTotal) {
  }
}
