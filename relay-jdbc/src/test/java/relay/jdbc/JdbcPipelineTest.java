package relay.jdbc;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import relay.RelayConfig;
import relay.TelemetryPipeline;
import relay.TelemetryRecord;
import relay.circuit.CircuitState;
import relay.lifecycle.Lifecycle;
import relay.metrics.MetricsSnapshot;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JdbcPipelineTest {
  private static final Lifecycle NO_HOOKS = (name, hook) -> () -> {};

  private JdbcDataSource dataSource;
  private Connection keepAlive;

  @BeforeEach
  void setup() throws SQLException {
    dataSource = H2Database.newDataSource();
    keepAlive = dataSource.getConnection();
    H2Database.createSchema(keepAlive);
  }

  @AfterEach
  void tearDown() throws SQLException {
    keepAlive.close();
  }

  private TelemetryPipeline pipeline(RelayConfig config) {
    return TelemetryPipeline.builder()
        .config(config)
        .sink(new JdbcSink(ConnectionProvider.of(dataSource)))
        .lifecycle(NO_HOOKS)
        .sleeper(millis -> {})
        .build();
  }

  @Test
  void deliversEveryKindToItsTable() throws Exception {
    TelemetryPipeline pipeline = pipeline(new RelayConfig().setMaxBatchSize(50));
    for (int i = 0; i < 120; i++) {
      pipeline.track(TelemetryRecord.event(Map.of("event", "tool_used", "seq", i)));
    }
    pipeline.track(TelemetryRecord.snapshot("h1", Map.of("nodeCount", 3)));
    pipeline.track(TelemetryRecord.snapshot("h1", Map.of("nodeCount", 3)));
    pipeline.track(TelemetryRecord.mutation(Map.of("workflowHashBefore", "a", "workflowHashAfter", "b")));

    pipeline.flush();

    assertEquals(120, H2Database.count(keepAlive, "telemetry_events"));
    assertEquals(1, H2Database.count(keepAlive, "telemetry_workflows"));
    assertEquals(1, H2Database.count(keepAlive, "workflow_mutations"));
    try (PreparedStatement ps = keepAlive.prepareStatement("SELECT payload_json FROM workflow_mutations");
         ResultSet rs = ps.executeQuery()) {
      assertTrue(rs.next());
      assertTrue(rs.getString(1).contains("\"workflow_hash_before\""));
    }
    MetricsSnapshot metrics = pipeline.getMetrics();
    assertEquals(122, metrics.eventsTracked());
    assertEquals(5, metrics.batchesSent());
  }

  @Test
  void missingTableDeadLettersAndRecoversOnceCreated() throws Exception {
    try (Statement st = keepAlive.createStatement()) {
      st.execute("DROP TABLE telemetry_events");
    }
    TelemetryPipeline pipeline = pipeline(new RelayConfig().setMaxRetries(2));
    pipeline.track(TelemetryRecord.event(Map.of("event", "lost?")));

    pipeline.flush();

    MetricsSnapshot failed = pipeline.getMetrics();
    assertEquals(1, failed.eventsFailed());
    assertEquals(1, failed.deadLetterQueueSize());
    assertEquals(CircuitState.CLOSED, failed.circuitBreakerState().state());

    H2Database.createSchema(keepAlive);
    pipeline.flush();

    assertEquals(1, H2Database.count(keepAlive, "telemetry_events"));
    assertEquals(0, pipeline.getMetrics().deadLetterQueueSize());
  }
}
