package io.eventlog.feed;

import java.io.IOException;

/**
 * Destination of a feed's frames, typically an HTTP response body.
 */
@FunctionalInterface
public interface FeedSink {

  /**
   * Writes and flushes one frame.
   *
   * @param frame the frame
   * @throws IOException if the client is gone; the feed closes
   */
  void send(SseFrame frame) throws IOException;
}
