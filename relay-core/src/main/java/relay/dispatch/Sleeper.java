package relay.dispatch;

/**
 * Blocks the flushing thread between retry attempts. Replaced in tests to observe
 * backoff delays without waiting.
 */
@FunctionalInterface
public interface Sleeper {

  /** Sleeps on the current thread via {@link Thread#sleep(long)}. */
  Sleeper SYSTEM = millis -> {
    if (millis > 0) {
      Thread.sleep(millis);
    }
  };

  /**
   * @param millis time to wait in milliseconds
   * @throws InterruptedException if the thread is interrupted while waiting
   */
  void sleep(long millis) throws InterruptedException;
}
