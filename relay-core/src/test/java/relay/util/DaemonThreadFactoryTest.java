package relay.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DaemonThreadFactoryTest {

  @Test
  void createsNumberedDaemonThreads() {
    DaemonThreadFactory factory = new DaemonThreadFactory("relay-flush-");

    Thread first = factory.newThread(() -> {});
    Thread second = factory.newThread(() -> {});

    assertTrue(first.isDaemon());
    assertEquals("relay-flush-1", first.getName());
    assertEquals("relay-flush-2", second.getName());
    assertEquals(2, factory.threadsCreated());
  }

  @Test
  void uncaughtFailureIsLoggedNotPropagated() throws InterruptedException {
    DaemonThreadFactory factory = new DaemonThreadFactory("relay-test-");
    Thread thread = factory.newThread(() -> {
      throw new IllegalStateException("boom");
    });

    assertNotNull(thread.getUncaughtExceptionHandler());
    thread.start();
    thread.join(5000);

    assertFalse(thread.isAlive());
  }
}
