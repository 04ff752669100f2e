package relay.buffer;

import relay.RecordKind;
import relay.TelemetryRecord;
import relay.metrics.TelemetryMetrics;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Producer-side buffer where the host application deposits records between flushes.
 *
 * <p>One bounded queue per {@link RecordKind}. {@link #offer} never waits: when the queue
 * for the record's kind is full the record is rejected and counted as dropped.
 *
 * <p>This class is thread-safe.
 */
public final class RecordBuffer {
  private static final Logger logger = Logger.getLogger(RecordBuffer.class.getName());

  private final Map<RecordKind, BlockingQueue<TelemetryRecord>> queues = new EnumMap<>(RecordKind.class);
  private final TelemetryMetrics metrics;

  public RecordBuffer(int capacityPerKind, TelemetryMetrics metrics) {
    if (capacityPerKind <= 0) {
      throw new IllegalArgumentException("capacityPerKind must be > 0, got: " + capacityPerKind);
    }
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    for (RecordKind kind : RecordKind.values()) {
      queues.put(kind, new ArrayBlockingQueue<>(capacityPerKind));
    }
  }

  /**
   * Adds a record without blocking.
   *
   * @param record the record to buffer
   * @return {@code true} if buffered, {@code false} if the queue for its kind is full
   */
  public boolean offer(TelemetryRecord record) {
    Objects.requireNonNull(record, "record");
    if (queues.get(record.kind()).offer(record)) {
      return true;
    }
    metrics.recordDropped(1);
    logger.log(Level.FINE, "Buffer full for {0}; record dropped", record.kind());
    return false;
  }

  /**
   * Removes and returns everything currently buffered.
   *
   * @return the drained records grouped by kind
   */
  public PendingRecords drain() {
    return new PendingRecords(
        drain(RecordKind.EVENT),
        drain(RecordKind.SNAPSHOT),
        drain(RecordKind.MUTATION));
  }

  private List<TelemetryRecord> drain(RecordKind kind) {
    List<TelemetryRecord> out = new ArrayList<>();
    queues.get(kind).drainTo(out);
    return out;
  }

  public int size() {
    int total = 0;
    for (BlockingQueue<TelemetryRecord> queue : queues.values()) {
      total += queue.size();
    }
    return total;
  }
}
