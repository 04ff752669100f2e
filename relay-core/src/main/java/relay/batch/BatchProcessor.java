package relay.batch;

import relay.RecordKind;
import relay.TelemetryRecord;
import relay.buffer.PendingRecords;
import relay.circuit.CircuitBreaker;
import relay.circuit.CircuitState;
import relay.dead.DeadLetterEntry;
import relay.dead.DeadLetterQueue;
import relay.dispatch.RetryExecutor;
import relay.dispatch.RetryPolicy;
import relay.dispatch.SendOutcome;
import relay.dispatch.Sleeper;
import relay.metrics.MetricsSnapshot;
import relay.metrics.TelemetryMetrics;
import relay.spi.Sink;
import relay.util.SnakeCaseKeys;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns the records of one flush into bounded batches and delivers them.
 *
 * <p>A flush runs these steps:
 * <ol>
 *   <li>return at once when disabled or when no sink is configured</li>
 *   <li>drop and count every incoming record when the circuit breaker refuses the attempt</li>
 *   <li>drop later snapshots whose {@code contentHash} already appeared in this call</li>
 *   <li>rewrite the top-level payload keys of mutations to snake_case</li>
 *   <li>send each kind in chunks of at most {@code maxBatchSize} through the
 *       {@link RetryExecutor}; dead-letter every chunk that exhausts its retries</li>
 *   <li>re-send the dead-letter queue when the breaker is closed and no chunk failed</li>
 *   <li>record the flush duration</li>
 * </ol>
 *
 * <p>Flushes are serialized by a single lock. A caller arriving while another flush runs
 * waits for it to complete and then performs its own flush. Chunks within one flush are
 * sent one after another.
 *
 * <p>{@code flush} never throws. Create instances via {@link #builder()}.
 *
 * @see RetryExecutor
 * @see CircuitBreaker
 * @see DeadLetterQueue
 */
public final class BatchProcessor {
  private static final Logger logger = Logger.getLogger(BatchProcessor.class.getName());

  private final Sink sink;
  private final BooleanSupplier enabled;
  private final int maxBatchSize;
  private final Map<RecordKind, String> destinations;
  private final RetryExecutor retryExecutor;
  private final CircuitBreaker circuitBreaker;
  private final DeadLetterQueue deadLetterQueue;
  private final TelemetryMetrics metrics;
  private final ReentrantLock flushLock = new ReentrantLock();

  private BatchProcessor(Builder builder) {
    if (builder.maxBatchSize <= 0) {
      throw new IllegalArgumentException("maxBatchSize must be > 0");
    }
    if (builder.maxRetries < 1) {
      throw new IllegalArgumentException("maxRetries must be >= 1");
    }
    if (builder.rateLimitCooldownMs < 0) {
      throw new IllegalArgumentException("rateLimitCooldownMs must be >= 0");
    }
    Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.sink = builder.sink;
    this.enabled = builder.enabled != null ? builder.enabled : () -> true;
    this.maxBatchSize = builder.maxBatchSize;
    this.metrics = builder.metrics != null ? builder.metrics : new TelemetryMetrics();
    this.circuitBreaker = builder.circuitBreaker != null
        ? builder.circuitBreaker : new CircuitBreaker(5, Duration.ofMinutes(1), clock);
    this.deadLetterQueue = builder.deadLetterQueue != null
        ? builder.deadLetterQueue : new DeadLetterQueue(100, clock);

    Map<RecordKind, String> resolved = new EnumMap<>(RecordKind.class);
    for (RecordKind kind : RecordKind.values()) {
      String destination = builder.destinations.get(kind);
      resolved.put(kind, destination != null ? destination : kind.defaultDestination());
    }
    this.destinations = resolved;

    this.retryExecutor = sink == null ? null : RetryExecutor.builder()
        .sink(sink)
        .maxRetries(builder.maxRetries)
        .retryPolicy(builder.retryPolicy)
        .rateLimitCooldownMs(builder.rateLimitCooldownMs)
        .sleeper(builder.sleeper)
        .metrics(metrics)
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns whether flushes do any work: the relay is enabled and a sink is configured.
   *
   * @return {@code true} if flushes reach the sink
   */
  public boolean isActive() {
    return sink != null && enabled.getAsBoolean();
  }

  /**
   * Delivers the given records. Any argument may be {@code null}.
   *
   * @param events    usage events
   * @param snapshots structural snapshots, de-duplicated by content hash
   * @param mutations mutation logs
   */
  public void flush(List<TelemetryRecord> events, List<TelemetryRecord> snapshots,
      List<TelemetryRecord> mutations) {
    if (!isActive()) {
      return;
    }
    flushLock.lock();
    try {
      runFlush(orEmpty(events), orEmpty(snapshots), orEmpty(mutations));
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Telemetry flush failed", e);
    } finally {
      circuitBreaker.releaseTrial();
      flushLock.unlock();
    }
  }

  public void flush(PendingRecords pending) {
    if (pending == null) {
      flush(null, null, null);
      return;
    }
    flush(pending.events(), pending.snapshots(), pending.mutations());
  }

  /**
   * Delivers records of mixed kinds, grouping them by {@link TelemetryRecord#kind()}.
   * A {@code null} collection is treated as empty.
   *
   * @param records records to deliver
   */
  public void flush(Collection<TelemetryRecord> records) {
    List<TelemetryRecord> events = new ArrayList<>();
    List<TelemetryRecord> snapshots = new ArrayList<>();
    List<TelemetryRecord> mutations = new ArrayList<>();
    if (records == null) {
      records = List.of();
    }
    for (TelemetryRecord record : records) {
      if (record == null) {
        // counted as dropped by runFlush
        events.add(null);
        continue;
      }
      switch (record.kind()) {
        case EVENT -> events.add(record);
        case SNAPSHOT -> snapshots.add(record);
        case MUTATION -> mutations.add(record);
        default -> throw new IllegalStateException("Unknown kind: " + record.kind());
      }
    }
    flush(events, snapshots, mutations);
  }

  private void runFlush(List<TelemetryRecord> events, List<TelemetryRecord> snapshots,
      List<TelemetryRecord> mutations) {
    events = withoutNulls(events);
    snapshots = withoutNulls(snapshots);
    mutations = withoutNulls(mutations);
    int incoming = events.size() + snapshots.size() + mutations.size();
    if (!circuitBreaker.canAttempt()) {
      if (incoming > 0) {
        metrics.recordDropped(incoming);
        logger.log(Level.FINE, "Circuit breaker open; dropped {0} records", incoming);
      }
      metrics.recordCircuitState(circuitBreaker.state());
      return;
    }

    long start = System.nanoTime();
    FlushPass pass = new FlushPass();
    sendKind(RecordKind.EVENT, events, pass);
    sendKind(RecordKind.SNAPSHOT, deduplicate(snapshots), pass);
    sendKind(RecordKind.MUTATION, toSnakeCase(mutations), pass);
    if (pass.failedChunks == 0) {
      drainDeadLetters(pass);
    }

    if (pass.sinkCalls > 0) {
      metrics.recordFlushTime(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
      metrics.recordDeadLetterDepth(deadLetterQueue.size());
      metrics.recordCircuitState(circuitBreaker.state());
    }
  }

  private void sendKind(RecordKind kind, List<TelemetryRecord> records, FlushPass pass) {
    List<List<TelemetryRecord>> chunks = Chunks.of(records, maxBatchSize);
    String destination = destinations.get(kind);
    for (int i = 0; i < chunks.size(); i++) {
      if (circuitBreaker.state() == CircuitState.OPEN) {
        int remaining = 0;
        for (int j = i; j < chunks.size(); j++) {
          remaining += chunks.get(j).size();
        }
        metrics.recordDropped(remaining);
        logger.log(Level.WARNING, "Circuit breaker opened mid-flush; dropped {0} {1} records",
            new Object[]{remaining, kind});
        return;
      }
      List<TelemetryRecord> chunk = chunks.get(i);
      SendOutcome outcome = retryExecutor.send(chunk, destination);
      pass.sinkCalls += outcome.attempts();
      if (outcome.success()) {
        metrics.recordTracked(chunk.size());
        metrics.recordBatchSent();
        circuitBreaker.recordSuccess();
      } else {
        pass.failedChunks++;
        circuitBreaker.recordFailure();
        metrics.recordFailed(chunk.size());
        metrics.recordBatchFailed();
        metrics.recordDropped(deadLetterQueue.enqueue(chunk));
        logger.log(Level.WARNING, "Batch of {0} records to {1} failed after {2} attempts ({3}: {4}); "
                + "moved to dead-letter queue",
            new Object[]{chunk.size(), destination, outcome.attempts(), outcome.lastError(), outcome.message()});
      }
    }
  }

  private void drainDeadLetters(FlushPass pass) {
    List<DeadLetterEntry> candidates = deadLetterQueue.drainIfHealthy(circuitBreaker);
    if (candidates.isEmpty()) {
      return;
    }
    Map<RecordKind, List<DeadLetterEntry>> byKind = new LinkedHashMap<>();
    for (DeadLetterEntry entry : candidates) {
      byKind.computeIfAbsent(entry.kind(), k -> new ArrayList<>()).add(entry);
    }

    int redelivered = 0;
    for (Map.Entry<RecordKind, List<DeadLetterEntry>> group : byKind.entrySet()) {
      String destination = destinations.get(group.getKey());
      for (List<DeadLetterEntry> chunk : Chunks.of(group.getValue(), maxBatchSize)) {
        List<TelemetryRecord> records = new ArrayList<>(chunk.size());
        for (DeadLetterEntry entry : chunk) {
          records.add(entry.record());
        }
        SendOutcome outcome = retryExecutor.send(records, destination);
        pass.sinkCalls += outcome.attempts();
        if (!outcome.success()) {
          circuitBreaker.recordFailure();
          logger.log(Level.WARNING, "Dead-letter re-send to {0} failed ({1}); {2} entries remain queued",
              new Object[]{destination, outcome.lastError(), deadLetterQueue.size()});
          return;
        }
        deadLetterQueue.acknowledge(chunk);
        metrics.recordTracked(chunk.size());
        metrics.recordBatchSent();
        circuitBreaker.recordSuccess();
        redelivered += chunk.size();
      }
    }
    logger.log(Level.INFO, "Re-delivered {0} dead-letter records", redelivered);
  }

  private static List<TelemetryRecord> deduplicate(List<TelemetryRecord> snapshots) {
    if (snapshots.size() < 2) {
      return snapshots;
    }
    Set<String> seen = new HashSet<>();
    List<TelemetryRecord> unique = new ArrayList<>(snapshots.size());
    for (TelemetryRecord snapshot : snapshots) {
      String hash = snapshot.contentHash();
      if (hash == null || seen.add(hash)) {
        unique.add(snapshot);
      }
    }
    return unique;
  }

  private static List<TelemetryRecord> toSnakeCase(List<TelemetryRecord> mutations) {
    List<TelemetryRecord> converted = new ArrayList<>(mutations.size());
    for (TelemetryRecord mutation : mutations) {
      converted.add(mutation.withPayload(SnakeCaseKeys.convertTopLevel(mutation.payload())));
    }
    return converted;
  }

  private static List<TelemetryRecord> orEmpty(List<TelemetryRecord> records) {
    return records == null ? List.of() : records;
  }

  private List<TelemetryRecord> withoutNulls(List<TelemetryRecord> records) {
    List<TelemetryRecord> present = new ArrayList<>(records.size());
    for (TelemetryRecord record : records) {
      if (record != null) {
        present.add(record);
      }
    }
    int skipped = records.size() - present.size();
    if (skipped == 0) {
      return records;
    }
    metrics.recordDropped(skipped);
    logger.log(Level.WARNING, "Skipped {0} null records", skipped);
    return present;
  }

  /**
   * Returns a point-in-time copy of the counters, breaker state and dead-letter size.
   *
   * @return the metrics snapshot
   */
  public MetricsSnapshot getMetrics() {
    return metrics.snapshot(circuitBreaker.snapshot(), deadLetterQueue.size());
  }

  /**
   * Zeroes all counters, clears the flush-time history and closes the circuit breaker.
   * Waits for an in-flight flush. Dead-letter entries are kept.
   */
  public void resetMetrics() {
    flushLock.lock();
    try {
      metrics.reset();
      circuitBreaker.reset();
      metrics.recordCircuitState(circuitBreaker.state());
      metrics.recordDeadLetterDepth(deadLetterQueue.size());
    } finally {
      flushLock.unlock();
    }
  }

  public String destinationFor(RecordKind kind) {
    return destinations.get(kind);
  }

  CircuitBreaker circuitBreaker() {
    return circuitBreaker;
  }

  DeadLetterQueue deadLetterQueue() {
    return deadLetterQueue;
  }

  private static final class FlushPass {
    int sinkCalls;
    int failedChunks;
  }

  /** Builder for {@link BatchProcessor}. */
  public static final class Builder {
    private Sink sink;
    private BooleanSupplier enabled;
    private int maxBatchSize = 50;
    private int maxRetries = 3;
    private RetryPolicy retryPolicy;
    private long rateLimitCooldownMs = 10_000;
    private Sleeper sleeper;
    private Clock clock;
    private CircuitBreaker circuitBreaker;
    private DeadLetterQueue deadLetterQueue;
    private TelemetryMetrics metrics;
    private final Map<RecordKind, String> destinations = new EnumMap<>(RecordKind.class);

    private Builder() {}

    /**
     * Sets the remote store.
     *
     * <p>Optional. Without a sink every flush is a silent no-op.
     *
     * @param sink the sink, may be {@code null}
     * @return this builder
     */
    public Builder sink(Sink sink) {
      this.sink = sink;
      return this;
    }

    /**
     * Sets the switch consulted at the start of every flush.
     *
     * <p>Optional. Defaults to always enabled.
     *
     * @param enabled runtime enabled flag
     * @return this builder
     */
    public Builder enabled(BooleanSupplier enabled) {
      this.enabled = enabled;
      return this;
    }

    /**
     * Sets the maximum number of records per sink call.
     *
     * <p>Optional. Defaults to {@code 50}. Must be &gt; 0.
     *
     * @param maxBatchSize maximum batch length
     * @return this builder
     */
    public Builder maxBatchSize(int maxBatchSize) {
      this.maxBatchSize = maxBatchSize;
      return this;
    }

    /**
     * Sets the maximum number of sink calls per batch.
     *
     * <p>Optional. Defaults to {@code 3}. Must be &ge; 1.
     *
     * @param maxRetries attempts per batch
     * @return this builder
     */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    public Builder rateLimitCooldownMs(long rateLimitCooldownMs) {
      this.rateLimitCooldownMs = rateLimitCooldownMs;
      return this;
    }

    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    /**
     * Sets the clock used by the default circuit breaker and dead-letter queue.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock time source
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Builder circuitBreaker(CircuitBreaker circuitBreaker) {
      this.circuitBreaker = circuitBreaker;
      return this;
    }

    public Builder deadLetterQueue(DeadLetterQueue deadLetterQueue) {
      this.deadLetterQueue = deadLetterQueue;
      return this;
    }

    public Builder metrics(TelemetryMetrics metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Overrides the destination of one record kind.
     *
     * <p>Optional. Defaults to {@link RecordKind#defaultDestination()}.
     *
     * @param kind        record kind
     * @param destination destination name
     * @return this builder
     */
    public Builder destination(RecordKind kind, String destination) {
      this.destinations.put(Objects.requireNonNull(kind, "kind"),
          Objects.requireNonNull(destination, "destination"));
      return this;
    }

    /**
     * Builds the processor.
     *
     * @return a new {@link BatchProcessor}
     * @throws IllegalArgumentException if {@code maxBatchSize <= 0}, {@code maxRetries < 1}
     *     or the rate-limit cool-down is negative
     */
    public BatchProcessor build() {
      return new BatchProcessor(this);
    }
  }
}
