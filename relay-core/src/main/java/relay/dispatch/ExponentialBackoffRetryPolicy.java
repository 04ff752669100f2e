package relay.dispatch;

import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Retry policy that doubles the delay after every failed attempt.
 *
 * <p>The raw delay is {@code baseDelay * 2^(attempts-1)}, saturating at {@code maxDelay}.
 * It is then scaled by a jitter factor in [0.5, 1.5) so that many relays recovering from
 * the same outage do not retry in lockstep, and capped at {@code maxDelay} again.
 * Selected with {@code relay.retry.strategy=EXPONENTIAL}.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;
  private final DoubleSupplier unitRandom;

  /**
   * @param baseDelayMs delay after the first failed attempt (milliseconds), must be &ge; 0
   * @param maxDelayMs  upper bound for any delay (milliseconds), must be &ge; 0
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    this(baseDelayMs, maxDelayMs, () -> ThreadLocalRandom.current().nextDouble());
  }

  /**
   * @param baseDelayMs delay after the first failed attempt (milliseconds), must be &ge; 0
   * @param maxDelayMs  upper bound for any delay (milliseconds), must be &ge; 0
   * @param unitRandom  source of values in [0, 1) used for jitter
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs, DoubleSupplier unitRandom) {
    if (baseDelayMs < 0) {
      throw new IllegalArgumentException("baseDelayMs must be >= 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < 0) {
      throw new IllegalArgumentException("maxDelayMs must be >= 0, got: " + maxDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.unitRandom = Objects.requireNonNull(unitRandom, "unitRandom");
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0 || baseDelayMs == 0) {
      return 0L;
    }
    long delay = Math.min(baseDelayMs, maxDelayMs);
    for (int i = 1; i < attempts && delay < maxDelayMs; i++) {
      delay = delay > maxDelayMs / 2 ? maxDelayMs : delay * 2;
    }
    double factor = 0.5 + unitRandom.getAsDouble();
    return Math.min(maxDelayMs, (long) (delay * factor));
  }
}
