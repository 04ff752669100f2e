package relay.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import relay.circuit.CircuitState;
import relay.spi.MetricsExporter;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code relay.events.tracked}: records delivered</li>
 *   <li>{@code relay.events.dropped}: records discarded (circuit open, buffer full, dead-letter eviction)</li>
 *   <li>{@code relay.events.failed}: records whose batch exhausted its retries</li>
 *   <li>{@code relay.batches.sent}</li>
 *   <li>{@code relay.batches.failed}</li>
 *   <li>{@code relay.rate_limit.hits}: sink calls rejected as rate-limited</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code relay.dlq.depth}: entries held in the dead-letter queue</li>
 *   <li>{@code relay.circuit.state}: {@code 0} closed, {@code 1} half-open, {@code 2} open</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code relay.flush.duration}: wall-clock duration of flushes that reached the sink</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter eventsTracked;
  private final Counter eventsDropped;
  private final Counter eventsFailed;
  private final Counter batchesSent;
  private final Counter batchesFailed;
  private final Counter rateLimitHits;
  private final Timer flushDuration;
  private final Gauge deadLetterGauge;
  private final Gauge circuitGauge;

  private final AtomicInteger deadLetterDepth = new AtomicInteger();
  private final AtomicInteger circuitState = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "relay"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "relay");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "mcp.telemetry"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.eventsTracked = counter(namePrefix + ".events.tracked", "Records delivered to the sink");
    this.eventsDropped = counter(namePrefix + ".events.dropped", "Records discarded without delivery");
    this.eventsFailed = counter(namePrefix + ".events.failed", "Records whose batch exhausted its retries");
    this.batchesSent = counter(namePrefix + ".batches.sent", "Batches delivered to the sink");
    this.batchesFailed = counter(namePrefix + ".batches.failed", "Batches that exhausted their retries");
    this.rateLimitHits = counter(namePrefix + ".rate_limit.hits", "Sink calls rejected as rate-limited");
    this.flushDuration = Timer.builder(namePrefix + ".flush.duration")
        .description("Duration of flushes that reached the sink")
        .register(registry);
    this.deadLetterGauge = Gauge.builder(namePrefix + ".dlq.depth", deadLetterDepth, AtomicInteger::get)
        .description("Entries held in the dead-letter queue")
        .register(registry);
    this.circuitGauge = Gauge.builder(namePrefix + ".circuit.state", circuitState, AtomicInteger::get)
        .description("Circuit breaker state: 0 closed, 1 half-open, 2 open")
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementEventsTracked(long count) {
    if (closed) return;
    eventsTracked.increment(count);
  }

  @Override
  public void incrementEventsDropped(long count) {
    if (closed) return;
    eventsDropped.increment(count);
  }

  @Override
  public void incrementEventsFailed(long count) {
    if (closed) return;
    eventsFailed.increment(count);
  }

  @Override
  public void incrementBatchesSent() {
    if (closed) return;
    batchesSent.increment();
  }

  @Override
  public void incrementBatchesFailed() {
    if (closed) return;
    batchesFailed.increment();
  }

  @Override
  public void incrementRateLimitHits() {
    if (closed) return;
    rateLimitHits.increment();
  }

  @Override
  public void recordFlushDurationMs(long durationMs) {
    if (closed) return;
    flushDuration.record(Duration.ofMillis(durationMs));
  }

  @Override
  public void recordDeadLetterDepth(int depth) {
    if (closed) return;
    deadLetterDepth.set(depth);
  }

  @Override
  public void recordCircuitState(CircuitState state) {
    if (closed) return;
    circuitState.set(gaugeValue(state));
  }

  static int gaugeValue(CircuitState state) {
    switch (state) {
      case CLOSED:
        return 0;
      case HALF_OPEN:
        return 1;
      case OPEN:
        return 2;
      default:
        throw new IllegalArgumentException("Unknown state: " + state);
    }
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Called by {@link relay.TelemetryPipeline#close()} to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(eventsTracked, eventsDropped, eventsFailed, batchesSent,
        batchesFailed, rateLimitHits, flushDuration, deadLetterGauge, circuitGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
