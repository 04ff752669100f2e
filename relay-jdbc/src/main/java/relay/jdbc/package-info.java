/**
 * JDBC delivery of telemetry batches.
 *
 * <p>{@link relay.jdbc.JdbcSink} writes one table per destination and classifies
 * database errors for the retry executor.
 *
 * @see relay.jdbc.JdbcSink
 * @see relay.jdbc.SqlErrorClassifier
 */
package relay.jdbc;
