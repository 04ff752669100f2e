package relay.spi;

import relay.TelemetryRecord;

import java.util.List;

/**
 * Remote analytics store that receives batches of telemetry records.
 *
 * <p>Implementations should report failures through the returned {@link SinkResult}.
 * A {@link RuntimeException} thrown from {@link #insert} is treated as
 * {@link SinkError#TRANSIENT} by the retry executor.
 *
 * <p>Calls are made sequentially from the flush path; implementations need not be
 * safe for concurrent use by the same pipeline.
 */
@FunctionalInterface
public interface Sink {

  /**
   * Inserts a batch of records into the named destination.
   *
   * @param destination logical destination, typically a table name
   * @param records     non-empty batch, all of the same kind
   * @return the outcome of the call, never {@code null}
   */
  SinkResult insert(String destination, List<TelemetryRecord> records);
}
