package relay.dispatch;

/**
 * Retry policy whose delay grows with the attempt count: {@code baseDelay * attempts}.
 *
 * <p>This is the default policy of the relay.
 */
public final class LinearBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;

  /**
   * @param baseDelayMs delay after the first failed attempt (milliseconds), must be &ge; 0
   */
  public LinearBackoffRetryPolicy(long baseDelayMs) {
    if (baseDelayMs < 0) {
      throw new IllegalArgumentException("baseDelayMs must be >= 0, got: " + baseDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    if (baseDelayMs != 0 && attempts > Long.MAX_VALUE / baseDelayMs) {
      return Long.MAX_VALUE;
    }
    return baseDelayMs * attempts;
  }
}
