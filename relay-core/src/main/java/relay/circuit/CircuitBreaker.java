package relay.circuit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Consecutive-failure circuit breaker guarding sink calls.
 *
 * <p>Transitions:
 * <ul>
 *   <li>{@code CLOSED → OPEN} when {@code consecutiveFailures} reaches the failure threshold</li>
 *   <li>{@code OPEN → HALF_OPEN} on the first {@link #canAttempt()} after the reset timeout</li>
 *   <li>{@code HALF_OPEN → CLOSED} on {@link #recordSuccess()}</li>
 *   <li>{@code HALF_OPEN → OPEN} on {@link #recordFailure()}</li>
 * </ul>
 *
 * <p>{@code HALF_OPEN} admits a single trial. While the trial is outstanding,
 * {@link #canAttempt()} returns {@code false}. A caller that obtained the trial but made
 * no call must hand it back with {@link #releaseTrial()}.
 *
 * <p>This class is thread-safe.
 */
public final class CircuitBreaker {
  private static final Logger logger = Logger.getLogger(CircuitBreaker.class.getName());

  private final int failureThreshold;
  private final Duration resetTimeout;
  private final Clock clock;

  private CircuitState state = CircuitState.CLOSED;
  private int consecutiveFailures;
  private Instant openedAt;
  private boolean trialOutstanding;

  /**
   * @param failureThreshold consecutive failures that open the breaker, must be &gt; 0
   * @param resetTimeout     cool-down before a trial is permitted, must be &ge; 0
   * @param clock            time source
   */
  public CircuitBreaker(int failureThreshold, Duration resetTimeout, Clock clock) {
    if (failureThreshold <= 0) {
      throw new IllegalArgumentException("failureThreshold must be > 0, got: " + failureThreshold);
    }
    Objects.requireNonNull(resetTimeout, "resetTimeout");
    if (resetTimeout.isNegative()) {
      throw new IllegalArgumentException("resetTimeout must be >= 0");
    }
    this.failureThreshold = failureThreshold;
    this.resetTimeout = resetTimeout;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Returns whether a send may be attempted now. Moves an expired {@code OPEN} breaker
   * to {@code HALF_OPEN} and hands out its single trial.
   *
   * @return {@code true} if the caller may call the sink
   */
  public synchronized boolean canAttempt() {
    switch (state) {
      case CLOSED:
        return true;
      case OPEN:
        if (openedAt != null && !clock.instant().isBefore(openedAt.plus(resetTimeout))) {
          state = CircuitState.HALF_OPEN;
          trialOutstanding = true;
          logger.log(Level.INFO, "Circuit breaker HALF_OPEN; permitting a trial send");
          return true;
        }
        return false;
      case HALF_OPEN:
        if (!trialOutstanding) {
          trialOutstanding = true;
          return true;
        }
        return false;
      default:
        throw new IllegalStateException("Unknown state: " + state);
    }
  }

  /** Resets the failure count and closes a half-open breaker. */
  public synchronized void recordSuccess() {
    consecutiveFailures = 0;
    trialOutstanding = false;
    if (state == CircuitState.HALF_OPEN) {
      state = CircuitState.CLOSED;
      openedAt = null;
      logger.log(Level.INFO, "Circuit breaker CLOSED after successful trial");
    }
  }

  /** Counts a failure; opens the breaker at the threshold or when a trial fails. */
  public synchronized void recordFailure() {
    consecutiveFailures++;
    trialOutstanding = false;
    if (state == CircuitState.HALF_OPEN) {
      open("trial send failed");
    } else if (state == CircuitState.CLOSED && consecutiveFailures >= failureThreshold) {
      open(consecutiveFailures + " consecutive failures");
    }
  }

  /**
   * Returns an unused half-open trial so that the next {@link #canAttempt()} can take it.
   * No-op in any other situation.
   */
  public synchronized void releaseTrial() {
    trialOutstanding = false;
  }

  /** Returns the breaker to {@code CLOSED} with no recorded failures. */
  public synchronized void reset() {
    state = CircuitState.CLOSED;
    consecutiveFailures = 0;
    openedAt = null;
    trialOutstanding = false;
  }

  public synchronized CircuitState state() {
    return state;
  }

  public synchronized CircuitBreakerState snapshot() {
    return new CircuitBreakerState(state, consecutiveFailures, openedAt);
  }

  private void open(String reason) {
    state = CircuitState.OPEN;
    openedAt = clock.instant();
    logger.log(Level.WARNING, "Circuit breaker OPEN ({0}); sends suspended for {1}",
        new Object[]{reason, resetTimeout});
  }
}
