package relay.metrics;

import org.junit.jupiter.api.Test;
import relay.circuit.CircuitBreakerState;
import relay.spi.MetricsExporter;

import static org.junit.jupiter.api.Assertions.*;

class TelemetryMetricsTest {

  @Test
  void countersAccumulate() {
    TelemetryMetrics metrics = new TelemetryMetrics();

    metrics.recordTracked(3);
    metrics.recordTracked(2);
    metrics.recordDropped(4);
    metrics.recordFailed(1);
    metrics.recordBatchSent();
    metrics.recordBatchFailed();
    metrics.recordRateLimitHit();

    MetricsSnapshot snapshot = metrics.snapshot(CircuitBreakerState.INITIAL, 7);
    assertEquals(5, snapshot.eventsTracked());
    assertEquals(4, snapshot.eventsDropped());
    assertEquals(1, snapshot.eventsFailed());
    assertEquals(1, snapshot.batchesSent());
    assertEquals(1, snapshot.batchesFailed());
    assertEquals(1, snapshot.rateLimitHits());
    assertEquals(7, snapshot.deadLetterQueueSize());
    assertSame(CircuitBreakerState.INITIAL, snapshot.circuitBreakerState());
  }

  @Test
  void nonPositiveCountsAreIgnored() {
    TelemetryMetrics metrics = new TelemetryMetrics();

    metrics.recordDropped(0);
    metrics.recordTracked(-2);

    MetricsSnapshot snapshot = metrics.snapshot(CircuitBreakerState.INITIAL, 0);
    assertEquals(0, snapshot.eventsDropped());
    assertEquals(0, snapshot.eventsTracked());
  }

  @Test
  void flushTimeAverageUsesBoundedWindow() {
    TelemetryMetrics metrics = new TelemetryMetrics(MetricsExporter.NOOP, 3);

    metrics.recordFlushTime(100);
    metrics.recordFlushTime(10);
    metrics.recordFlushTime(20);
    metrics.recordFlushTime(30);

    MetricsSnapshot snapshot = metrics.snapshot(CircuitBreakerState.INITIAL, 0);
    assertEquals(3, metrics.historyLength());
    assertEquals(20.0, snapshot.averageFlushTimeMs(), 0.0001);
    assertEquals(30, snapshot.lastFlushTimeMs());
  }

  @Test
  void averageIsZeroWithoutFlushes() {
    assertEquals(0.0, new TelemetryMetrics().snapshot(CircuitBreakerState.INITIAL, 0).averageFlushTimeMs());
  }

  @Test
  void resetZeroesEverything() {
    TelemetryMetrics metrics = new TelemetryMetrics();
    metrics.recordTracked(3);
    metrics.recordFlushTime(50);

    metrics.reset();

    MetricsSnapshot snapshot = metrics.snapshot(CircuitBreakerState.INITIAL, 0);
    assertEquals(0, snapshot.eventsTracked());
    assertEquals(0, snapshot.lastFlushTimeMs());
    assertEquals(0, metrics.historyLength());
  }

  @Test
  void rejectsNonPositiveHistorySize() {
    assertThrows(IllegalArgumentException.class,
        () -> new TelemetryMetrics(MetricsExporter.NOOP, 0));
  }
}
