package io.eventlog.feed;

import io.eventlog.StoredEvent;
import io.eventlog.util.FlatJsonCodec;

/**
 * Converts stored events into SSE frames.
 *
 * <p>Implementations must set the frame id to the event's global sequence; the feed's
 * resumption relies on it.
 */
@FunctionalInterface
public interface FrameRenderer {

  SseFrame render(StoredEvent event);

  /**
   * Returns the default renderer. The frame's event name is the event type and its data a
   * JSON document with the aggregate identity, the sequences, the schema version and the
   * payload, embedded verbatim when it is a JSON object or array.
   *
   * @return the default renderer
   */
  static FrameRenderer json() {
    return event -> SseFrame.data(Long.toString(event.globalSequence()), event.eventType(), toJson(event));
  }

  private static String toJson(StoredEvent event) {
    String payload = event.payloadJson();
    String trimmed = payload.trim();
    String embedded = trimmed.startsWith("{") || trimmed.startsWith("[") ? trimmed : FlatJsonCodec.quote(payload);
    return "{\"globalSequence\":" + event.globalSequence()
        + ",\"aggregateType\":" + FlatJsonCodec.quote(event.aggregateType())
        + ",\"aggregateId\":" + FlatJsonCodec.quote(event.aggregateId())
        + ",\"aggregateSequence\":" + event.aggregateSequence()
        + ",\"eventType\":" + FlatJsonCodec.quote(event.eventType())
        + ",\"schemaVersion\":" + event.schemaVersion()
        + ",\"payload\":" + embedded + '}';
  }
}
