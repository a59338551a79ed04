package io.eventlog.feed;

/**
 * Lifecycle of a {@link FeedConnection}.
 */
public enum FeedState {
  /** Created, no subscription yet. */
  CONNECTING,
  /** Live subscription open; events committed from now on are buffered. */
  SUBSCRIBED,
  /** Sending stored events after the client's cursor. */
  REPLAYING,
  /** Forwarding live events as they are committed. */
  STREAMING,
  /** Terminal. The subscription is released. */
  CLOSED
}
