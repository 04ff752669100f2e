package relay;

import relay.dispatch.ExponentialBackoffRetryPolicy;
import relay.dispatch.LinearBackoffRetryPolicy;
import relay.dispatch.RetryPolicy;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Tunables of the relay, with the defaults used when nothing is configured.
 *
 * <p>Setters are fluent. {@link #fromEnvironment(Map)} reads the {@code RELAY_*} variables;
 * call {@link #validate()} before handing a hand-built instance to the pipeline.
 */
public final class RelayConfig {
  public static final String ENABLED = "RELAY_ENABLED";
  public static final String FLUSH_INTERVAL_MS = "RELAY_FLUSH_INTERVAL_MS";
  public static final String MAX_BATCH_SIZE = "RELAY_MAX_BATCH_SIZE";
  public static final String MAX_RETRIES = "RELAY_MAX_RETRIES";
  public static final String RETRY_STRATEGY = "RELAY_RETRY_STRATEGY";
  public static final String RETRY_BASE_DELAY_MS = "RELAY_RETRY_BASE_DELAY_MS";
  public static final String RETRY_MAX_DELAY_MS = "RELAY_RETRY_MAX_DELAY_MS";
  public static final String RATE_LIMIT_COOLDOWN_MS = "RELAY_RATE_LIMIT_COOLDOWN_MS";
  public static final String FAILURE_THRESHOLD = "RELAY_FAILURE_THRESHOLD";
  public static final String CIRCUIT_RESET_TIMEOUT_MS = "RELAY_CIRCUIT_RESET_TIMEOUT_MS";
  public static final String DLQ_CAPACITY = "RELAY_DLQ_CAPACITY";
  public static final String BUFFER_CAPACITY = "RELAY_BUFFER_CAPACITY";
  public static final String FLUSH_HISTORY_SIZE = "RELAY_FLUSH_HISTORY_SIZE";
  public static final String EVENTS_DESTINATION = "RELAY_EVENTS_DESTINATION";
  public static final String SNAPSHOTS_DESTINATION = "RELAY_SNAPSHOTS_DESTINATION";
  public static final String MUTATIONS_DESTINATION = "RELAY_MUTATIONS_DESTINATION";

  /** How the wait between ordinary retry attempts grows. */
  public enum RetryStrategy {
    /** {@code base * attempt}. */
    LINEAR,
    /** {@code base * 2^(attempt-1)} with jitter, capped at the max delay. */
    EXPONENTIAL
  }

  private boolean enabled = true;
  private long flushIntervalMs = 5000L;
  private int maxBatchSize = 50;
  private int maxRetries = 3;
  private RetryStrategy retryStrategy = RetryStrategy.LINEAR;
  private long retryBaseDelayMs = 1000L;
  private long retryMaxDelayMs = 60000L;
  private long rateLimitCooldownMs = 10000L;
  private int failureThreshold = 5;
  private long circuitResetTimeoutMs = 60000L;
  private int deadLetterCapacity = 100;
  private int bufferCapacity = 1000;
  private int flushHistorySize = 100;
  private final Map<RecordKind, String> destinations = new EnumMap<>(RecordKind.class);

  public boolean isEnabled() {
    return enabled;
  }

  public RelayConfig setEnabled(boolean enabled) {
    this.enabled = enabled;
    return this;
  }

  public long getFlushIntervalMs() {
    return flushIntervalMs;
  }

  public RelayConfig setFlushIntervalMs(long flushIntervalMs) {
    this.flushIntervalMs = flushIntervalMs;
    return this;
  }

  public int getMaxBatchSize() {
    return maxBatchSize;
  }

  public RelayConfig setMaxBatchSize(int maxBatchSize) {
    this.maxBatchSize = maxBatchSize;
    return this;
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  public RelayConfig setMaxRetries(int maxRetries) {
    this.maxRetries = maxRetries;
    return this;
  }

  public RetryStrategy getRetryStrategy() {
    return retryStrategy;
  }

  public RelayConfig setRetryStrategy(RetryStrategy retryStrategy) {
    this.retryStrategy = Objects.requireNonNull(retryStrategy, "retryStrategy");
    return this;
  }

  public long getRetryBaseDelayMs() {
    return retryBaseDelayMs;
  }

  public RelayConfig setRetryBaseDelayMs(long retryBaseDelayMs) {
    this.retryBaseDelayMs = retryBaseDelayMs;
    return this;
  }

  public long getRetryMaxDelayMs() {
    return retryMaxDelayMs;
  }

  public RelayConfig setRetryMaxDelayMs(long retryMaxDelayMs) {
    this.retryMaxDelayMs = retryMaxDelayMs;
    return this;
  }

  public long getRateLimitCooldownMs() {
    return rateLimitCooldownMs;
  }

  public RelayConfig setRateLimitCooldownMs(long rateLimitCooldownMs) {
    this.rateLimitCooldownMs = rateLimitCooldownMs;
    return this;
  }

  public int getFailureThreshold() {
    return failureThreshold;
  }

  public RelayConfig setFailureThreshold(int failureThreshold) {
    this.failureThreshold = failureThreshold;
    return this;
  }

  public long getCircuitResetTimeoutMs() {
    return circuitResetTimeoutMs;
  }

  public RelayConfig setCircuitResetTimeoutMs(long circuitResetTimeoutMs) {
    this.circuitResetTimeoutMs = circuitResetTimeoutMs;
    return this;
  }

  public int getDeadLetterCapacity() {
    return deadLetterCapacity;
  }

  public RelayConfig setDeadLetterCapacity(int deadLetterCapacity) {
    this.deadLetterCapacity = deadLetterCapacity;
    return this;
  }

  public int getBufferCapacity() {
    return bufferCapacity;
  }

  public RelayConfig setBufferCapacity(int bufferCapacity) {
    this.bufferCapacity = bufferCapacity;
    return this;
  }

  public int getFlushHistorySize() {
    return flushHistorySize;
  }

  public RelayConfig setFlushHistorySize(int flushHistorySize) {
    this.flushHistorySize = flushHistorySize;
    return this;
  }

  /**
   * Returns the destination for {@code kind}, falling back to its default table.
   *
   * @param kind record kind
   * @return the configured or default destination
   */
  public String getDestination(RecordKind kind) {
    String destination = destinations.get(kind);
    return destination != null ? destination : kind.defaultDestination();
  }

  public RelayConfig setDestination(RecordKind kind, String destination) {
    Objects.requireNonNull(kind, "kind");
    if (destination == null || destination.isBlank()) {
      destinations.remove(kind);
    } else {
      destinations.put(kind, destination);
    }
    return this;
  }

  /**
   * Creates the retry policy described by the strategy and delay settings.
   *
   * @return a new retry policy
   */
  public RetryPolicy createRetryPolicy() {
    return retryStrategy == RetryStrategy.EXPONENTIAL
        ? new ExponentialBackoffRetryPolicy(retryBaseDelayMs, retryMaxDelayMs)
        : new LinearBackoffRetryPolicy(retryBaseDelayMs);
  }

  /**
   * Checks every setting.
   *
   * @return this config
   * @throws IllegalArgumentException naming the first invalid setting
   */
  public RelayConfig validate() {
    requirePositive("flushIntervalMs", flushIntervalMs);
    requirePositive("maxBatchSize", maxBatchSize);
    requirePositive("maxRetries", maxRetries);
    requireNonNegative("retryBaseDelayMs", retryBaseDelayMs);
    if (retryMaxDelayMs < retryBaseDelayMs) {
      throw new IllegalArgumentException("retryMaxDelayMs must be >= retryBaseDelayMs");
    }
    requireNonNegative("rateLimitCooldownMs", rateLimitCooldownMs);
    requirePositive("failureThreshold", failureThreshold);
    requireNonNegative("circuitResetTimeoutMs", circuitResetTimeoutMs);
    requirePositive("deadLetterCapacity", deadLetterCapacity);
    requirePositive("bufferCapacity", bufferCapacity);
    requirePositive("flushHistorySize", flushHistorySize);
    return this;
  }

  private static void requirePositive(String name, long value) {
    if (value <= 0) {
      throw new IllegalArgumentException(name + " must be > 0, got: " + value);
    }
  }

  private static void requireNonNegative(String name, long value) {
    if (value < 0) {
      throw new IllegalArgumentException(name + " must be >= 0, got: " + value);
    }
  }

  /**
   * Reads the process environment.
   *
   * @return a validated config
   * @see #fromEnvironment(Map)
   */
  public static RelayConfig fromSystemEnvironment() {
    return fromEnvironment(System.getenv());
  }

  /**
   * Builds a config from {@code RELAY_*} variables. Missing or blank variables keep their
   * defaults. {@code RELAY_ENABLED} is false only for {@code false}, {@code 0}, {@code no}
   * or {@code off}, case-insensitively.
   *
   * @param env variable map
   * @return a validated config
   * @throws IllegalArgumentException if a variable is malformed or out of range
   */
  public static RelayConfig fromEnvironment(Map<String, String> env) {
    Objects.requireNonNull(env, "env");
    RelayConfig config = new RelayConfig();
    String enabled = value(env, ENABLED);
    if (enabled != null) {
      String normalized = enabled.toLowerCase(Locale.ROOT);
      config.setEnabled(!(normalized.equals("false") || normalized.equals("0")
          || normalized.equals("no") || normalized.equals("off")));
    }
    String strategy = value(env, RETRY_STRATEGY);
    if (strategy != null) {
      try {
        config.setRetryStrategy(RetryStrategy.valueOf(strategy.toUpperCase(Locale.ROOT)));
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException(RETRY_STRATEGY + " must be LINEAR or EXPONENTIAL, got: " + strategy, e);
      }
    }
    config.setFlushIntervalMs(longValue(env, FLUSH_INTERVAL_MS, config.flushIntervalMs))
        .setMaxBatchSize(intValue(env, MAX_BATCH_SIZE, config.maxBatchSize))
        .setMaxRetries(intValue(env, MAX_RETRIES, config.maxRetries))
        .setRetryBaseDelayMs(longValue(env, RETRY_BASE_DELAY_MS, config.retryBaseDelayMs))
        .setRetryMaxDelayMs(longValue(env, RETRY_MAX_DELAY_MS, config.retryMaxDelayMs))
        .setRateLimitCooldownMs(longValue(env, RATE_LIMIT_COOLDOWN_MS, config.rateLimitCooldownMs))
        .setFailureThreshold(intValue(env, FAILURE_THRESHOLD, config.failureThreshold))
        .setCircuitResetTimeoutMs(longValue(env, CIRCUIT_RESET_TIMEOUT_MS, config.circuitResetTimeoutMs))
        .setDeadLetterCapacity(intValue(env, DLQ_CAPACITY, config.deadLetterCapacity))
        .setBufferCapacity(intValue(env, BUFFER_CAPACITY, config.bufferCapacity))
        .setFlushHistorySize(intValue(env, FLUSH_HISTORY_SIZE, config.flushHistorySize))
        .setDestination(RecordKind.EVENT, value(env, EVENTS_DESTINATION))
        .setDestination(RecordKind.SNAPSHOT, value(env, SNAPSHOTS_DESTINATION))
        .setDestination(RecordKind.MUTATION, value(env, MUTATIONS_DESTINATION));
    return config.validate();
  }

  private static String value(Map<String, String> env, String name) {
    String raw = env.get(name);
    if (raw == null || raw.isBlank()) {
      return null;
    }
    return raw.trim();
  }

  private static long longValue(Map<String, String> env, String name, long defaultValue) {
    String raw = value(env, name);
    if (raw == null) {
      return defaultValue;
    }
    try {
      return Long.parseLong(raw);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(name + " is not a number: " + raw, e);
    }
  }

  private static int intValue(Map<String, String> env, String name, int defaultValue) {
    String raw = value(env, name);
    if (raw == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(name + " is not a number: " + raw, e);
    }
  }
}
