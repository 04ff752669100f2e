package relay.benchmark;

import org.openjdk.jmh.annotations.*;
import relay.TelemetryRecord;
import relay.batch.BatchProcessor;
import relay.spi.SinkResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/**
 * Measures the batching path (dedup, key conversion, chunking, retry bookkeeping) against an
 * in-memory sink, isolating the pipeline overhead from any I/O.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar FlushBenchmark}
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class FlushBenchmark {

  @Param({"50", "500"})
  private int maxBatchSize;

  @Param({"100", "5000"})
  private int recordCount;

  private final LongAdder delivered = new LongAdder();
  private BatchProcessor processor;
  private List<TelemetryRecord> events;
  private List<TelemetryRecord> snapshots;

  @Setup(Level.Trial)
  public void setup() {
    processor = BatchProcessor.builder()
        .sink((destination, records) -> {
          delivered.add(records.size());
          return SinkResult.ok();
        })
        .maxBatchSize(maxBatchSize)
        .build();

    events = new ArrayList<>(recordCount);
    snapshots = new ArrayList<>(recordCount / 10);
    for (int i = 0; i < recordCount; i++) {
      events.add(TelemetryRecord.event(Map.of(
          "eventName", "node_added",
          "workflowId", "wf-" + (i % 17),
          "nodeType", "http_request")));
      if (i % 10 == 0) {
        // every other snapshot repeats a hash so deduplication has work to do
        snapshots.add(TelemetryRecord.snapshot("hash-" + (i / 20), Map.of(
            "workflowId", "wf-" + i,
            "nodeCount", i % 40)));
      }
    }
  }

  @Benchmark
  public long flush() {
    processor.flush(events, snapshots, List.of());
    return delivered.sum();
  }
}
