package io.eventlog.bus;

import java.util.TreeSet;

/**
 * Tracks which global sequences the bus has published. Not thread-safe; guarded by the
 * publish lock of {@link EventBus}.
 *
 * <p>Sequences published ahead of a missing one are held as pending. A sequence that is never
 * published would hold the range back forever, so once {@link #MAX_PENDING} sequences are
 * pending the range restarts at the lowest of them. Consumers whose cursor lies below the new
 * start then fall back to the log.
 */
final class PublishedSequences {
  static final int MAX_PENDING = 4096;

  private final TreeSet<Long> pending = new TreeSet<>();
  private PublishedRange range = PublishedRange.EMPTY;
  private boolean started;

  PublishedRange record(long sequence) {
    if (!started) {
      started = true;
      range = new PublishedRange(sequence, sequence);
      return range;
    }
    long to = range.to();
    if (sequence == to + 1) {
      range = new PublishedRange(range.from(), extend(sequence));
    } else if (sequence > to + 1) {
      pending.add(sequence);
      if (pending.size() > MAX_PENDING) {
        long from = pending.pollFirst();
        range = new PublishedRange(from, extend(from));
      }
    }
    // at or below the range: republished or older than tracking
    return range;
  }

  PublishedRange range() {
    return range;
  }

  int pendingCount() {
    return pending.size();
  }

  private long extend(long to) {
    while (pending.remove(to + 1)) {
      to++;
    }
    return to;
  }
}
