package relay;

import relay.batch.BatchProcessor;
import relay.buffer.PendingRecords;
import relay.buffer.RecordBuffer;
import relay.circuit.CircuitBreaker;
import relay.dead.DeadLetterQueue;
import relay.dispatch.RetryPolicy;
import relay.dispatch.Sleeper;
import relay.lifecycle.FlushScheduler;
import relay.lifecycle.JvmShutdownLifecycle;
import relay.lifecycle.Lifecycle;
import relay.metrics.MetricsSnapshot;
import relay.metrics.TelemetryMetrics;
import relay.spi.MetricsExporter;
import relay.spi.Sink;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires a {@link RecordBuffer}, a {@link BatchProcessor} and a
 * {@link FlushScheduler} into a single {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * TelemetryPipeline pipeline = TelemetryPipeline.builder()
 *     .config(RelayConfig.fromSystemEnvironment())
 *     .sink(new JdbcSink(connectionProvider))
 *     .build();
 * pipeline.start();
 * pipeline.track(TelemetryRecord.event(Map.of("event", "tool_used")));
 * }</pre>
 *
 * <p>None of {@link #track}, {@link #flush()}, {@link #start()}, {@link #stop()} or
 * {@link #close()} throws; failures are logged.
 *
 * @see BatchProcessor
 * @see FlushScheduler
 */
public final class TelemetryPipeline implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(TelemetryPipeline.class.getName());

  private final RecordBuffer buffer;
  private final BatchProcessor processor;
  private final FlushScheduler scheduler;
  private final MetricsExporter exporter;

  private TelemetryPipeline(Builder builder) {
    RelayConfig config = (builder.config != null ? builder.config : new RelayConfig()).validate();
    Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    BooleanSupplier enabled = builder.enabled != null ? builder.enabled : config::isEnabled;
    this.exporter = builder.metricsExporter != null ? builder.metricsExporter : MetricsExporter.NOOP;

    TelemetryMetrics metrics = new TelemetryMetrics(exporter, config.getFlushHistorySize());
    BatchProcessor.Builder processorBuilder = BatchProcessor.builder()
        .sink(builder.sink)
        .enabled(enabled)
        .maxBatchSize(config.getMaxBatchSize())
        .maxRetries(config.getMaxRetries())
        .retryPolicy(builder.retryPolicy != null ? builder.retryPolicy : config.createRetryPolicy())
        .rateLimitCooldownMs(config.getRateLimitCooldownMs())
        .sleeper(builder.sleeper)
        .circuitBreaker(new CircuitBreaker(config.getFailureThreshold(),
            Duration.ofMillis(config.getCircuitResetTimeoutMs()), clock))
        .deadLetterQueue(new DeadLetterQueue(config.getDeadLetterCapacity(), clock))
        .metrics(metrics);
    for (RecordKind kind : RecordKind.values()) {
      processorBuilder.destination(kind, config.getDestination(kind));
    }
    this.processor = processorBuilder.build();
    this.buffer = new RecordBuffer(config.getBufferCapacity(), metrics);
    this.scheduler = FlushScheduler.builder()
        .flushTask(this::flush)
        .intervalMs(config.getFlushIntervalMs())
        .lifecycle(builder.lifecycle != null ? builder.lifecycle : JvmShutdownLifecycle.INSTANCE)
        .active(processor::isActive)
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Buffers a record for the next flush. Does nothing while the relay is inactive.
   *
   * @param record the record to deliver
   * @return {@code true} if buffered; {@code false} if inactive or the buffer is full
   */
  public boolean track(TelemetryRecord record) {
    if (record == null || !processor.isActive()) {
      return false;
    }
    return buffer.offer(record);
  }

  /**
   * Drains the buffer and delivers its content, then re-sends dead letters when healthy.
   * Blocks while another flush is in progress.
   */
  public void flush() {
    if (!processor.isActive()) {
      return;
    }
    PendingRecords pending = buffer.drain();
    processor.flush(pending);
  }

  /** Starts the periodic flush and registers the shutdown flush. No-op while inactive. */
  public void start() {
    scheduler.start();
  }

  /** Cancels future periodic flushes; an in-flight flush completes. */
  public void stop() {
    scheduler.stop();
  }

  public boolean isRunning() {
    return scheduler.isRunning();
  }

  public boolean isActive() {
    return processor.isActive();
  }

  public MetricsSnapshot getMetrics() {
    return processor.getMetrics();
  }

  public void resetMetrics() {
    processor.resetMetrics();
  }

  public int bufferedCount() {
    return buffer.size();
  }

  /**
   * Stops the scheduler, performs a final flush and closes the metrics exporter if it is
   * {@link AutoCloseable}.
   */
  @Override
  public void close() {
    scheduler.close();
    flush();
    if (exporter instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        logger.log(Level.WARNING, "Failed to close metrics exporter", e);
      }
    }
  }

  /** Builder for {@link TelemetryPipeline}. Single use. */
  public static final class Builder {
    private RelayConfig config;
    private Sink sink;
    private BooleanSupplier enabled;
    private Lifecycle lifecycle;
    private Clock clock;
    private Sleeper sleeper;
    private MetricsExporter metricsExporter;
    private RetryPolicy retryPolicy;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    /**
     * Sets the tunables.
     *
     * <p>Optional. Defaults to {@code new RelayConfig()}.
     *
     * @param config relay configuration
     * @return this builder
     */
    public Builder config(RelayConfig config) {
      this.config = config;
      return this;
    }

    /**
     * Sets the remote store.
     *
     * <p>Optional. Without a sink the pipeline is inactive: nothing is buffered,
     * scheduled or sent.
     *
     * @param sink the sink
     * @return this builder
     */
    public Builder sink(Sink sink) {
      this.sink = sink;
      return this;
    }

    /**
     * Sets a runtime switch replacing {@link RelayConfig#isEnabled()}.
     *
     * @param enabled consulted before every track, flush and start
     * @return this builder
     */
    public Builder enabled(BooleanSupplier enabled) {
      this.enabled = enabled;
      return this;
    }

    /**
     * Sets where the shutdown flush is registered.
     *
     * <p>Optional. Defaults to {@link JvmShutdownLifecycle#INSTANCE}.
     *
     * @param lifecycle the lifecycle
     * @return this builder
     */
    public Builder lifecycle(Lifecycle lifecycle) {
      this.lifecycle = lifecycle;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}. Closed with the pipeline when
     * it implements {@link AutoCloseable}.
     *
     * @param metricsExporter the metrics exporter
     * @return this builder
     */
    public Builder metricsExporter(MetricsExporter metricsExporter) {
      this.metricsExporter = metricsExporter;
      return this;
    }

    /**
     * Overrides the retry policy derived from the config.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Builds the pipeline. The scheduler is not started.
     *
     * @return a new pipeline
     * @throws IllegalStateException    if called twice
     * @throws IllegalArgumentException if the config is invalid
     */
    public TelemetryPipeline build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      return new TelemetryPipeline(this);
    }
  }
}
