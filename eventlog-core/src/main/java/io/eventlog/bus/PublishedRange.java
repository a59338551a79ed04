package io.eventlog.bus;

/**
 * Global sequences {@code from..to} (inclusive) that the {@link EventBus} had published, with no
 * gap, when an event was delivered to a subscription.
 *
 * <p>Matching events inside the range reached the subscription no later than that event, so a
 * consumer whose cursor lies inside the range knows it has seen or skipped every one of them
 * without asking the event log.
 *
 * @param from lowest tracked sequence
 * @param to   highest sequence below which nothing is missing; less than {@code from} when empty
 */
public record PublishedRange(long from, long to) {
  public static final PublishedRange EMPTY = new PublishedRange(1, 0);

  /**
   * Returns whether every sequence after {@code cursor} up to and including {@code sequence}
   * lies inside this range.
   *
   * @param cursor   the last sequence already examined
   * @param sequence the sequence just received
   * @return {@code true} if nothing between the two can be missing
   */
  public boolean covers(long cursor, long sequence) {
    return cursor + 1 >= from && sequence <= to;
  }
}
