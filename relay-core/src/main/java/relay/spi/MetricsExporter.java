package relay.spi;

import relay.circuit.CircuitState;

/**
 * Observability hook for exporting relay counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 *
 * <p>Exported counters only ever grow; {@code resetMetrics()} on the pipeline resets the
 * in-process snapshot but not the values already handed to an exporter.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Adds to the count of records delivered to the sink.
   *
   * @param count number of records
   */
  void incrementEventsTracked(long count);

  /**
   * Adds to the count of records dropped (circuit open, buffer full, dead-letter eviction).
   *
   * @param count number of records
   */
  void incrementEventsDropped(long count);

  /**
   * Adds to the count of records whose batch exhausted its retries.
   *
   * @param count number of records
   */
  void incrementEventsFailed(long count);

  /**
   * Increments the count of batches delivered to the sink.
   */
  void incrementBatchesSent();

  /**
   * Increments the count of batches that exhausted their retries.
   */
  void incrementBatchesFailed();

  /**
   * Increments the count of sink calls rejected as rate-limited.
   */
  default void incrementRateLimitHits() {
  }

  /**
   * Records the wall-clock duration of one flush.
   *
   * @param durationMs flush duration in milliseconds (always non-negative)
   */
  default void recordFlushDurationMs(long durationMs) {
  }

  /**
   * Records the current number of entries held in the dead-letter queue.
   *
   * @param depth dead-letter queue size
   */
  default void recordDeadLetterDepth(int depth) {
  }

  /**
   * Records the current circuit breaker state.
   *
   * @param state the breaker state
   */
  default void recordCircuitState(CircuitState state) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementEventsTracked(long count) {
    }

    @Override
    public void incrementEventsDropped(long count) {
    }

    @Override
    public void incrementEventsFailed(long count) {
    }

    @Override
    public void incrementBatchesSent() {
    }

    @Override
    public void incrementBatchesFailed() {
    }
  }
}
