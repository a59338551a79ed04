package io.eventlog.bus;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PublishedSequencesTest {

  private final PublishedSequences published = new PublishedSequences();

  // ── Contiguous growth ──

  @Test
  void startsAtFirstPublishedSequence() {
    assertEquals(PublishedRange.EMPTY, published.range());
    assertFalse(PublishedRange.EMPTY.covers(0, 1));

    assertEquals(new PublishedRange(41, 41), published.record(41));
    assertEquals(new PublishedRange(41, 42), published.record(42));
  }

  @Test
  void outOfOrderSequencesFillTheGap() {
    published.record(1);
    assertEquals(new PublishedRange(1, 1), published.record(3));
    assertEquals(1, published.pendingCount());

    assertEquals(new PublishedRange(1, 3), published.record(2));
    assertEquals(0, published.pendingCount());
  }

  @Test
  void republishedAndOlderSequencesAreIgnored() {
    published.record(5);
    published.record(6);

    assertEquals(new PublishedRange(5, 6), published.record(6));
    assertEquals(new PublishedRange(5, 6), published.record(4));
  }

  // ── Coverage ──

  @Test
  void coversOnlyCursorsInsideTheRange() {
    PublishedRange range = new PublishedRange(5, 10);

    assertTrue(range.covers(4, 10));
    assertTrue(range.covers(7, 9));
    assertFalse(range.covers(3, 6), "sequence 4 was never tracked");
    assertFalse(range.covers(7, 11));
  }

  // ── Bounded pending set ──

  @Test
  void restartsPastASequenceThatNeverArrives() {
    published.record(1);
    for (long sequence = 3; sequence <= PublishedSequences.MAX_PENDING + 3; sequence++) {
      published.record(sequence);
    }

    PublishedRange range = published.range();
    assertEquals(3, range.from());
    assertEquals(PublishedSequences.MAX_PENDING + 3, range.to());
    assertEquals(0, published.pendingCount());
    assertFalse(range.covers(1, 4), "the missing sequence stays uncovered");
  }
}
