package io.eventlog.bus;

import java.time.Duration;
import java.util.Objects;

/**
 * Buffer settings of one subscription.
 *
 * @param capacity     maximum buffered events, must be &gt; 0
 * @param overflow     behavior when the buffer is full
 * @param blockTimeout how long a full buffer may stay full under {@link OverflowPolicy#BLOCK}
 */
public record SubscriptionOptions(int capacity, OverflowPolicy overflow, Duration blockTimeout) {
  public static final int DEFAULT_CAPACITY = 256;
  public static final Duration DEFAULT_BLOCK_TIMEOUT = Duration.ofSeconds(1);

  public SubscriptionOptions {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
    }
    Objects.requireNonNull(overflow, "overflow");
    Objects.requireNonNull(blockTimeout, "blockTimeout");
    if (blockTimeout.isNegative()) {
      throw new IllegalArgumentException("blockTimeout must not be negative");
    }
  }

  /** Default options for UI feeds: 256 events, drop oldest. */
  public static SubscriptionOptions defaults() {
    return new SubscriptionOptions(DEFAULT_CAPACITY, OverflowPolicy.DROP_OLDEST, DEFAULT_BLOCK_TIMEOUT);
  }

  public static SubscriptionOptions dropOldest(int capacity) {
    return new SubscriptionOptions(capacity, OverflowPolicy.DROP_OLDEST, DEFAULT_BLOCK_TIMEOUT);
  }

  public static SubscriptionOptions block(int capacity, Duration blockTimeout) {
    return new SubscriptionOptions(capacity, OverflowPolicy.BLOCK, blockTimeout);
  }
}
