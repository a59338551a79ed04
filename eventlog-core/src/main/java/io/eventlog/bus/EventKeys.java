package io.eventlog.bus;

import io.eventlog.StoredEvent;

import java.util.Objects;

/**
 * Builds distribution keys of the form {@code events/{aggregateType}/{aggregateId}} and the
 * usual subscription patterns over them.
 */
public final class EventKeys {
  public static final String ROOT = "events";

  /** Matches every event. */
  public static final KeyExpression ALL_EVENTS = KeyExpression.parse(ROOT + "/**");

  private EventKeys() {}

  public static String eventKey(StoredEvent event) {
    return eventKey(event.aggregateType(), event.aggregateId());
  }

  public static String eventKey(String aggregateType, String aggregateId) {
    return ROOT + KeyExpression.SEPARATOR + segment("aggregateType", aggregateType)
        + KeyExpression.SEPARATOR + segment("aggregateId", aggregateId);
  }

  /** Pattern matching every instance of one aggregate type. */
  public static KeyExpression aggregateTypePattern(String aggregateType) {
    return KeyExpression.parse(ROOT + KeyExpression.SEPARATOR + segment("aggregateType", aggregateType)
        + KeyExpression.SEPARATOR + KeyExpression.MULTI_WILDCARD);
  }

  /** Pattern matching exactly one aggregate instance. */
  public static KeyExpression aggregateInstancePattern(String aggregateType, String aggregateId) {
    return KeyExpression.parse(eventKey(aggregateType, aggregateId));
  }

  private static String segment(String name, String value) {
    Objects.requireNonNull(value, name);
    if (value.isEmpty() || value.contains(KeyExpression.SEPARATOR) || value.contains(KeyExpression.SINGLE_WILDCARD)) {
      throw new IllegalArgumentException(name + " must be non-empty and contain neither '/' nor '*': " + value);
    }
    return value;
  }
}
