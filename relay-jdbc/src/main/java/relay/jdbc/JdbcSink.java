package relay.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import relay.TelemetryRecord;
import relay.spi.Sink;
import relay.spi.SinkError;
import relay.spi.SinkResult;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link Sink} that inserts each batch into the table named by the destination.
 *
 * <p>Target tables need the columns {@code kind}, {@code content_hash},
 * {@code payload_json} and {@code created_at}; see {@code relay/jdbc/schema.sql}.
 * A batch is written with one JDBC batch statement in a single transaction, so it is
 * either stored completely or not at all.
 *
 * <p>Payloads are serialized with Jackson. A payload that cannot be serialized fails the
 * whole batch as {@link SinkError#PERMANENT}; JDBC errors are classified by
 * {@link SqlErrorClassifier}.
 *
 * <p>This class is thread-safe.
 */
public final class JdbcSink implements Sink {
  private static final Logger logger = Logger.getLogger(JdbcSink.class.getName());

  private final ConnectionProvider connectionProvider;
  private final ObjectMapper objectMapper;

  public JdbcSink(ConnectionProvider connectionProvider) {
    this(connectionProvider, new ObjectMapper());
  }

  public JdbcSink(ConnectionProvider connectionProvider, ObjectMapper objectMapper) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  @Override
  public SinkResult insert(String destination, List<TelemetryRecord> records) {
    if (records.isEmpty()) {
      return SinkResult.ok();
    }
    if (destination == null) {
      return SinkResult.permanentFailure("destination is null");
    }
    String table;
    try {
      table = TableNames.validate(destination);
    } catch (IllegalArgumentException e) {
      return SinkResult.permanentFailure(e.getMessage());
    }

    List<String> payloads = new ArrayList<>(records.size());
    for (TelemetryRecord record : records) {
      try {
        payloads.add(objectMapper.writeValueAsString(record.payload()));
      } catch (JsonProcessingException e) {
        logger.log(Level.WARNING, "Unserializable " + record.kind() + " payload for " + table, e);
        return SinkResult.permanentFailure("payload serialization failed: " + e.getOriginalMessage());
      }
    }

    try (Connection conn = connectionProvider.getConnection()) {
      insertBatch(conn, table, records, payloads);
      return SinkResult.ok();
    } catch (SQLException e) {
      SinkError error = SqlErrorClassifier.classify(e);
      logger.log(Level.FINE, "Insert of " + records.size() + " rows into " + table + " failed as " + error, e);
      return SinkResult.failed(error, e.getSQLState() + ": " + e.getMessage());
    }
  }

  private static void insertBatch(Connection conn, String table, List<TelemetryRecord> records,
      List<String> payloads) throws SQLException {
    String sql = "INSERT INTO " + table + " (kind, content_hash, payload_json, created_at) VALUES (?, ?, ?, ?)";
    boolean autoCommit = conn.getAutoCommit();
    conn.setAutoCommit(false);
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      for (int i = 0; i < records.size(); i++) {
        TelemetryRecord record = records.get(i);
        ps.setString(1, record.kind().name());
        ps.setString(2, record.contentHash());
        ps.setString(3, payloads.get(i));
        ps.setTimestamp(4, Timestamp.from(record.createdAt()));
        ps.addBatch();
      }
      ps.executeBatch();
      conn.commit();
    } catch (SQLException | RuntimeException e) {
      rollbackQuietly(conn, e);
      throw e;
    } finally {
      restoreAutoCommit(conn, autoCommit);
    }
  }

  private static void rollbackQuietly(Connection conn, Exception cause) {
    try {
      conn.rollback();
    } catch (SQLException rollbackFailure) {
      cause.addSuppressed(rollbackFailure);
    }
  }

  private static void restoreAutoCommit(Connection conn, boolean autoCommit) {
    try {
      conn.setAutoCommit(autoCommit);
    } catch (SQLException e) {
      logger.log(Level.FINE, "Failed to restore auto-commit", e);
    }
  }
}
