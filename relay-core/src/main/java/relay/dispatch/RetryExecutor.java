package relay.dispatch;

import relay.TelemetryRecord;
import relay.metrics.TelemetryMetrics;
import relay.spi.Sink;
import relay.spi.SinkError;
import relay.spi.SinkResult;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sends one chunk to the {@link Sink} with bounded retries.
 *
 * <p>Up to {@code maxRetries} sink calls are made. Between attempts the executor waits:
 * <ul>
 *   <li>{@code rateLimitCooldownMs} after a {@link SinkError#RATE_LIMITED} result, which is
 *       also counted in {@code rateLimitHits}</li>
 *   <li>{@link RetryPolicy#computeDelayMs(int)} after any other failure, including an
 *       exception thrown by the sink</li>
 * </ul>
 * No wait follows the final attempt.
 *
 * <p>The executor neither touches the dead-letter queue nor the circuit breaker; the
 * caller acts on the returned {@link SendOutcome}.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class RetryExecutor {
  private static final Logger logger = Logger.getLogger(RetryExecutor.class.getName());

  private final Sink sink;
  private final int maxRetries;
  private final RetryPolicy retryPolicy;
  private final long rateLimitCooldownMs;
  private final Sleeper sleeper;
  private final TelemetryMetrics metrics;

  private RetryExecutor(Builder builder) {
    this.sink = Objects.requireNonNull(builder.sink, "sink");
    if (builder.maxRetries < 1) {
      throw new IllegalArgumentException("maxRetries must be >= 1");
    }
    if (builder.rateLimitCooldownMs < 0) {
      throw new IllegalArgumentException("rateLimitCooldownMs must be >= 0");
    }
    this.maxRetries = builder.maxRetries;
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new LinearBackoffRetryPolicy(1000);
    this.rateLimitCooldownMs = builder.rateLimitCooldownMs;
    this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.SYSTEM;
    this.metrics = builder.metrics != null ? builder.metrics : new TelemetryMetrics();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Sends {@code chunk} to {@code destination}, retrying failed attempts.
   *
   * @param chunk       non-empty batch of records
   * @param destination destination name passed to the sink
   * @return the outcome; {@link SendOutcome#success()} is {@code true} as soon as one attempt succeeds
   */
  public SendOutcome send(List<TelemetryRecord> chunk, String destination) {
    SinkError lastError = null;
    String lastMessage = null;
    for (int attempt = 1; attempt <= maxRetries; attempt++) {
      SinkResult result = invoke(chunk, destination);
      if (result.isOk()) {
        if (attempt > 1) {
          logger.log(Level.FINE, "Batch of {0} to {1} delivered on attempt {2}",
              new Object[]{chunk.size(), destination, attempt});
        }
        return SendOutcome.success(attempt);
      }
      lastError = result.error();
      lastMessage = result.message();
      if (lastError == SinkError.RATE_LIMITED) {
        metrics.recordRateLimitHit();
      }
      if (attempt == maxRetries) {
        return SendOutcome.failure(attempt, lastError, lastMessage);
      }

      long delayMs = lastError == SinkError.RATE_LIMITED
          ? rateLimitCooldownMs : retryPolicy.computeDelayMs(attempt);
      logger.log(Level.FINE, "Attempt {0}/{1} to {2} failed ({3}: {4}); retrying in {5} ms",
          new Object[]{attempt, maxRetries, destination, lastError, lastMessage, delayMs});
      try {
        sleeper.sleep(delayMs);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        logger.log(Level.WARNING, "Interrupted while backing off; abandoning batch to " + destination);
        return SendOutcome.failure(attempt, lastError, lastMessage);
      }
    }
    return SendOutcome.failure(maxRetries, lastError, lastMessage);
  }

  private SinkResult invoke(List<TelemetryRecord> chunk, String destination) {
    try {
      SinkResult result = sink.insert(destination, chunk);
      if (result == null) {
        return SinkResult.transientFailure("sink returned no result");
      }
      return result;
    } catch (RuntimeException e) {
      logger.log(Level.FINE, "Sink threw while inserting into " + destination, e);
      return SinkResult.transientFailure(e.getClass().getSimpleName() + ": " + e.getMessage());
    }
  }

  /** Builder for {@link RetryExecutor}. */
  public static final class Builder {
    private Sink sink;
    private int maxRetries = 3;
    private RetryPolicy retryPolicy;
    private long rateLimitCooldownMs = 10_000;
    private Sleeper sleeper;
    private TelemetryMetrics metrics;

    private Builder() {}

    /**
     * Sets the sink that receives the batches.
     *
     * <p><b>Required.</b>
     *
     * @param sink the remote store
     * @return this builder
     */
    public Builder sink(Sink sink) {
      this.sink = sink;
      return this;
    }

    /**
     * Sets the maximum number of sink calls per chunk.
     *
     * <p>Optional. Defaults to {@code 3}. Must be &ge; 1.
     *
     * @param maxRetries maximum attempts per chunk
     * @return this builder
     */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    /**
     * Sets the policy computing the wait after an ordinary failure.
     *
     * <p>Optional. Defaults to {@link LinearBackoffRetryPolicy} with a 1000 ms base.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the fixed wait after a rate-limited attempt.
     *
     * <p>Optional. Defaults to {@code 10000} ms. Must be &ge; 0.
     *
     * @param rateLimitCooldownMs cool-down in milliseconds
     * @return this builder
     */
    public Builder rateLimitCooldownMs(long rateLimitCooldownMs) {
      this.rateLimitCooldownMs = rateLimitCooldownMs;
      return this;
    }

    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    public Builder metrics(TelemetryMetrics metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Builds the executor.
     *
     * @return a new {@link RetryExecutor}
     * @throws NullPointerException     if {@code sink} is null
     * @throws IllegalArgumentException if {@code maxRetries < 1} or the cool-down is negative
     */
    public RetryExecutor build() {
      return new RetryExecutor(this);
    }
  }
}
