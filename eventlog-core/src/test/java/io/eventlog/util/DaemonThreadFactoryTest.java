package io.eventlog.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DaemonThreadFactoryTest {

  @Test
  void createsNamedDaemonThreads() {
    DaemonThreadFactory factory = new DaemonThreadFactory("eventlog-test-");

    Thread t1 = factory.newThread(() -> {
    });
    Thread t2 = factory.newThread(() -> {
    });

    assertTrue(t1.isDaemon());
    assertEquals("eventlog-test-1", t1.getName());
    assertEquals("eventlog-test-2", t2.getName());
    assertNotNull(t1.getUncaughtExceptionHandler());
  }

  @Test
  void nullPrefixThrows() {
    assertThrows(NullPointerException.class, () -> new DaemonThreadFactory(null));
  }
}
