package io.eventlog.feed;

import java.util.OptionalLong;

/**
 * One Server-Sent Events frame.
 *
 * <p>Data frames produced for stored events carry the event's global sequence as {@code id},
 * so a reconnecting client sends it back as {@code Last-Event-ID}. Keep-alive frames are
 * comments, which clients ignore.
 */
public final class SseFrame {
  /** Comment text of keep-alive frames. */
  public static final String KEEP_ALIVE_COMMENT = "keepalive";

  private static final SseFrame KEEP_ALIVE = new SseFrame(null, null, null, KEEP_ALIVE_COMMENT);

  private final String id;
  private final String event;
  private final String data;
  private final String comment;

  private SseFrame(String id, String event, String data, String comment) {
    this.id = id;
    this.event = event;
    this.data = data;
    this.comment = comment;
  }

  /**
   * Creates a data frame.
   *
   * @param id    the frame id, usually a global sequence; may be null
   * @param event the event name; may be null for the default {@code message} event
   * @param data  the payload; may span several lines
   * @return the frame
   */
  public static SseFrame data(String id, String event, String data) {
    return new SseFrame(id, event, data == null ? "" : data, null);
  }

  public static SseFrame comment(String comment) {
    return new SseFrame(null, null, null, comment == null ? "" : comment);
  }

  public static SseFrame keepAlive() {
    return KEEP_ALIVE;
  }

  public String id() {
    return id;
  }

  public String event() {
    return event;
  }

  public String data() {
    return data;
  }

  public String comment() {
    return comment;
  }

  public boolean isComment() {
    return comment != null;
  }

  /**
   * Renders the frame as it goes on the wire, terminated by a blank line.
   *
   * @return the frame text
   */
  public String render() {
    StringBuilder sb = new StringBuilder();
    if (comment != null) {
      for (String line : comment.split("\r?\n", -1)) {
        sb.append(": ").append(line).append('\n');
      }
      return sb.append('\n').toString();
    }
    if (id != null) {
      sb.append("id: ").append(id).append('\n');
    }
    if (event != null) {
      sb.append("event: ").append(event).append('\n');
    }
    // each data line needs its own prefix
    for (String line : data.split("\r?\n", -1)) {
      sb.append("data: ").append(line).append('\n');
    }
    return sb.append('\n').toString();
  }

  /**
   * Parses a {@code Last-Event-ID} header value into a replay cursor.
   *
   * @param header the header value, may be null
   * @return the cursor, or empty when absent or not a non-negative number
   */
  public static OptionalLong parseLastEventId(String header) {
    if (header == null || header.isBlank()) {
      return OptionalLong.empty();
    }
    try {
      long value = Long.parseLong(header.trim());
      return value < 0 ? OptionalLong.empty() : OptionalLong.of(value);
    } catch (NumberFormatException e) {
      return OptionalLong.empty();
    }
  }

  @Override
  public String toString() {
    return isComment() ? "SseFrame{comment=" + comment + '}' : "SseFrame{id=" + id + ", event=" + event + '}';
  }
}
