package relay.benchmark;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.openjdk.jmh.annotations.*;
import relay.RelayConfig;
import relay.TelemetryPipeline;
import relay.TelemetryRecord;
import relay.jdbc.ConnectionProvider;
import relay.jdbc.JdbcSink;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Measures end-to-end track-then-flush throughput into an in-memory H2 database behind a
 * HikariCP pool.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar JdbcFlushBenchmark}
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class JdbcFlushBenchmark {

  @Param({"10", "200"})
  private int recordsPerFlush;

  private HikariDataSource dataSource;
  private TelemetryPipeline pipeline;

  @Setup(Level.Trial)
  public void setup() throws IOException, SQLException {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:bench_flush;DB_CLOSE_DELAY=-1");
    config.setMaximumPoolSize(2);
    dataSource = new HikariDataSource(config);
    createSchema();

    pipeline = TelemetryPipeline.builder()
        .config(new RelayConfig().setFlushIntervalMs(3_600_000).setBufferCapacity(recordsPerFlush))
        .sink(new JdbcSink(ConnectionProvider.of(dataSource)))
        .build();
  }

  @Benchmark
  public int trackAndFlush() {
    for (int i = 0; i < recordsPerFlush; i++) {
      pipeline.track(TelemetryRecord.event(Map.of("eventName", "bench", "sequence", i)));
    }
    pipeline.flush();
    return pipeline.bufferedCount();
  }

  @TearDown(Level.Trial)
  public void tearDown() {
    pipeline.close();
    dataSource.close();
  }

  private void createSchema() throws IOException, SQLException {
    String ddl;
    try (InputStream in = JdbcSink.class.getResourceAsStream("/relay/jdbc/schema.sql")) {
      if (in == null) {
        throw new IllegalStateException("relay/jdbc/schema.sql not on classpath");
      }
      ddl = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      for (String sql : ddl.split(";")) {
        if (!sql.isBlank()) {
          stmt.execute(sql);
        }
      }
    }
  }
}
