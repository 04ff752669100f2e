package relay.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;
import relay.RecordKind;
import relay.RelayConfig;

/**
 * Configuration properties for the telemetry relay.
 *
 * @see RelayAutoConfiguration
 */
@ConfigurationProperties(prefix = "relay")
public class RelayProperties {

  /**
   * Whether records are collected and delivered at all.
   */
  private boolean enabled = true;

  /**
   * Delay between periodic flushes in milliseconds.
   */
  private long flushIntervalMs = 5000;

  /**
   * Maximum records per sink call.
   */
  private int maxBatchSize = 50;

  /**
   * Capacity of each per-kind producer buffer.
   */
  private int bufferCapacity = 1000;

  /**
   * Number of recent flush durations kept for the average.
   */
  private int flushHistorySize = 100;

  private final Retry retry = new Retry();
  private final CircuitBreaker circuitBreaker = new CircuitBreaker();
  private final DeadLetter deadLetter = new DeadLetter();
  private final Destinations destinations = new Destinations();
  private final Metrics metrics = new Metrics();

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public long getFlushIntervalMs() {
    return flushIntervalMs;
  }

  public void setFlushIntervalMs(long flushIntervalMs) {
    this.flushIntervalMs = flushIntervalMs;
  }

  public int getMaxBatchSize() {
    return maxBatchSize;
  }

  public void setMaxBatchSize(int maxBatchSize) {
    this.maxBatchSize = maxBatchSize;
  }

  public int getBufferCapacity() {
    return bufferCapacity;
  }

  public void setBufferCapacity(int bufferCapacity) {
    this.bufferCapacity = bufferCapacity;
  }

  public int getFlushHistorySize() {
    return flushHistorySize;
  }

  public void setFlushHistorySize(int flushHistorySize) {
    this.flushHistorySize = flushHistorySize;
  }

  public Retry getRetry() {
    return retry;
  }

  public CircuitBreaker getCircuitBreaker() {
    return circuitBreaker;
  }

  public DeadLetter getDeadLetter() {
    return deadLetter;
  }

  public Destinations getDestinations() {
    return destinations;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  /**
   * Copies these properties into a validated {@link RelayConfig}.
   *
   * @return the relay configuration
   * @throws IllegalArgumentException if a value is out of range
   */
  public RelayConfig toRelayConfig() {
    return new RelayConfig()
        .setEnabled(enabled)
        .setFlushIntervalMs(flushIntervalMs)
        .setMaxBatchSize(maxBatchSize)
        .setBufferCapacity(bufferCapacity)
        .setFlushHistorySize(flushHistorySize)
        .setMaxRetries(retry.getMaxRetries())
        .setRetryStrategy(retry.getStrategy())
        .setRetryBaseDelayMs(retry.getBaseDelayMs())
        .setRetryMaxDelayMs(retry.getMaxDelayMs())
        .setRateLimitCooldownMs(retry.getRateLimitCooldownMs())
        .setFailureThreshold(circuitBreaker.getFailureThreshold())
        .setCircuitResetTimeoutMs(circuitBreaker.getResetTimeoutMs())
        .setDeadLetterCapacity(deadLetter.getCapacity())
        .setDestination(RecordKind.EVENT, destinations.getEvents())
        .setDestination(RecordKind.SNAPSHOT, destinations.getSnapshots())
        .setDestination(RecordKind.MUTATION, destinations.getMutations())
        .validate();
  }

  public static class Retry {
    private RelayConfig.RetryStrategy strategy = RelayConfig.RetryStrategy.LINEAR;
    private int maxRetries = 3;
    private long baseDelayMs = 1000;
    private long maxDelayMs = 60000;
    private long rateLimitCooldownMs = 10000;

    public RelayConfig.RetryStrategy getStrategy() {
      return strategy;
    }

    public void setStrategy(RelayConfig.RetryStrategy strategy) {
      this.strategy = strategy;
    }

    public int getMaxRetries() {
      return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
    }

    public long getBaseDelayMs() {
      return baseDelayMs;
    }

    public void setBaseDelayMs(long baseDelayMs) {
      this.baseDelayMs = baseDelayMs;
    }

    public long getMaxDelayMs() {
      return maxDelayMs;
    }

    public void setMaxDelayMs(long maxDelayMs) {
      this.maxDelayMs = maxDelayMs;
    }

    public long getRateLimitCooldownMs() {
      return rateLimitCooldownMs;
    }

    public void setRateLimitCooldownMs(long rateLimitCooldownMs) {
      this.rateLimitCooldownMs = rateLimitCooldownMs;
    }
  }

  public static class CircuitBreaker {
    private int failureThreshold = 5;
    private long resetTimeoutMs = 60000;

    public int getFailureThreshold() {
      return failureThreshold;
    }

    public void setFailureThreshold(int failureThreshold) {
      this.failureThreshold = failureThreshold;
    }

    public long getResetTimeoutMs() {
      return resetTimeoutMs;
    }

    public void setResetTimeoutMs(long resetTimeoutMs) {
      this.resetTimeoutMs = resetTimeoutMs;
    }
  }

  public static class DeadLetter {
    private int capacity = 100;

    public int getCapacity() {
      return capacity;
    }

    public void setCapacity(int capacity) {
      this.capacity = capacity;
    }
  }

  public static class Destinations {
    private String events = RecordKind.EVENT.defaultDestination();
    private String snapshots = RecordKind.SNAPSHOT.defaultDestination();
    private String mutations = RecordKind.MUTATION.defaultDestination();

    public String getEvents() {
      return events;
    }

    public void setEvents(String events) {
      this.events = events;
    }

    public String getSnapshots() {
      return snapshots;
    }

    public void setSnapshots(String snapshots) {
      this.snapshots = snapshots;
    }

    public String getMutations() {
      return mutations;
    }

    public void setMutations(String mutations) {
      this.mutations = mutations;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "relay";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
