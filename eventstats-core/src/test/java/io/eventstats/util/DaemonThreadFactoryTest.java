package io.eventstats.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DaemonThreadFactoryTest {

  @Test
  void createsNumberedDaemonThreads() {
    DaemonThreadFactory factory = new DaemonThreadFactory("eventstats-test-");

    Thread first = factory.newThread(() -> { });
    Thread second = factory.newThread(() -> { });

    assertEquals("eventstats-test-1", first.getName());
    assertEquals("eventstats-test-2", second.getName());
    assertTrue(first.isDaemon());
    assertNotSame(first.getThreadGroup(), first.getUncaughtExceptionHandler());
  }

  @Test
  void rejectsNullPrefix() {
    assertThrows(NullPointerException.class, () -> new DaemonThreadFactory(null));
  }
}
