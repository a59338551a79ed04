package io.eventlog.bus;

/**
 * What a subscription does when its bounded buffer is full and another event arrives.
 */
public enum OverflowPolicy {
  /**
   * Discard the oldest buffered event and mark the subscription lagged. Suited to UI feeds,
   * which recover the gap by replaying from the log.
   */
  DROP_OLDEST,
  /**
   * Hold further events in a bounded backlog while the buffer is full, waiting up to the
   * subscription's block timeout for free space. The publisher itself never waits. A
   * subscriber still full after the timeout, or whose backlog fills up, is closed as overrun
   * and must resubscribe and replay. Suited to administrative feeds that must not silently
   * miss events.
   */
  BLOCK
}
