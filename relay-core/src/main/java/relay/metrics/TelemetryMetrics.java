package relay.metrics;

import relay.circuit.CircuitBreakerState;
import relay.circuit.CircuitState;
import relay.spi.MetricsExporter;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process counters and flush-time history of a pipeline.
 *
 * <p>Every change is mirrored to the configured {@link MetricsExporter}. The flush-time
 * history keeps only the most recent {@code historySize} durations so a long-running
 * process does not grow it without bound.
 *
 * <p>This class is thread-safe. The pipeline's flush path is its only writer.
 */
public final class TelemetryMetrics {
  public static final int DEFAULT_HISTORY_SIZE = 100;

  private final MetricsExporter exporter;
  private final int historySize;

  private final AtomicLong eventsTracked = new AtomicLong();
  private final AtomicLong eventsDropped = new AtomicLong();
  private final AtomicLong eventsFailed = new AtomicLong();
  private final AtomicLong batchesSent = new AtomicLong();
  private final AtomicLong batchesFailed = new AtomicLong();
  private final AtomicLong rateLimitHits = new AtomicLong();

  private final ArrayDeque<Long> flushTimes = new ArrayDeque<>();
  private long flushTimeTotal;
  private long lastFlushTimeMs;

  public TelemetryMetrics() {
    this(MetricsExporter.NOOP, DEFAULT_HISTORY_SIZE);
  }

  public TelemetryMetrics(MetricsExporter exporter, int historySize) {
    this.exporter = Objects.requireNonNull(exporter, "exporter");
    if (historySize <= 0) {
      throw new IllegalArgumentException("historySize must be > 0, got: " + historySize);
    }
    this.historySize = historySize;
  }

  public void recordTracked(int count) {
    if (count <= 0) return;
    eventsTracked.addAndGet(count);
    exporter.incrementEventsTracked(count);
  }

  public void recordDropped(int count) {
    if (count <= 0) return;
    eventsDropped.addAndGet(count);
    exporter.incrementEventsDropped(count);
  }

  public void recordFailed(int count) {
    if (count <= 0) return;
    eventsFailed.addAndGet(count);
    exporter.incrementEventsFailed(count);
  }

  public void recordBatchSent() {
    batchesSent.incrementAndGet();
    exporter.incrementBatchesSent();
  }

  public void recordBatchFailed() {
    batchesFailed.incrementAndGet();
    exporter.incrementBatchesFailed();
  }

  public void recordRateLimitHit() {
    rateLimitHits.incrementAndGet();
    exporter.incrementRateLimitHits();
  }

  /**
   * Adds a flush duration to the bounded history, evicting the oldest beyond the window.
   *
   * @param durationMs flush duration in milliseconds
   */
  public void recordFlushTime(long durationMs) {
    long value = Math.max(0L, durationMs);
    synchronized (flushTimes) {
      flushTimes.addLast(value);
      flushTimeTotal += value;
      while (flushTimes.size() > historySize) {
        flushTimeTotal -= flushTimes.removeFirst();
      }
      lastFlushTimeMs = value;
    }
    exporter.recordFlushDurationMs(value);
  }

  public void recordDeadLetterDepth(int depth) {
    exporter.recordDeadLetterDepth(depth);
  }

  public void recordCircuitState(CircuitState state) {
    exporter.recordCircuitState(state);
  }

  /**
   * Copies the counters together with the breaker and dead-letter state supplied by the caller.
   *
   * @param breakerState        current breaker state
   * @param deadLetterQueueSize current dead-letter queue size
   * @return an immutable snapshot
   */
  public MetricsSnapshot snapshot(CircuitBreakerState breakerState, int deadLetterQueueSize) {
    double average;
    long last;
    synchronized (flushTimes) {
      average = flushTimes.isEmpty() ? 0.0 : (double) flushTimeTotal / flushTimes.size();
      last = lastFlushTimeMs;
    }
    return new MetricsSnapshot(
        eventsTracked.get(),
        eventsDropped.get(),
        eventsFailed.get(),
        batchesSent.get(),
        batchesFailed.get(),
        rateLimitHits.get(),
        average,
        last,
        breakerState,
        deadLetterQueueSize);
  }

  /** Zeroes every counter and clears the flush-time history. */
  public void reset() {
    eventsTracked.set(0);
    eventsDropped.set(0);
    eventsFailed.set(0);
    batchesSent.set(0);
    batchesFailed.set(0);
    rateLimitHits.set(0);
    synchronized (flushTimes) {
      flushTimes.clear();
      flushTimeTotal = 0;
      lastFlushTimeMs = 0;
    }
  }

  int historyLength() {
    synchronized (flushTimes) {
      return flushTimes.size();
    }
  }
}
