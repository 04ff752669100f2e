/**
 * Background delivery of telemetry records to a remote store.
 *
 * <p>{@link relay.TelemetryPipeline} is the entry point. Records are buffered by
 * {@link relay.buffer.RecordBuffer}, batched and sent by {@link relay.batch.BatchProcessor}
 * through a {@link relay.spi.Sink}, and flushed periodically and at shutdown by
 * {@link relay.lifecycle.FlushScheduler}.
 *
 * @see relay.RelayConfig
 */
package relay;
