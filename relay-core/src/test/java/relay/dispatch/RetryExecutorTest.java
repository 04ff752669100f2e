package relay.dispatch;

import org.junit.jupiter.api.Test;
import relay.RecordingSleeper;
import relay.Records;
import relay.ScriptedSink;
import relay.TelemetryRecord;
import relay.circuit.CircuitBreakerState;
import relay.metrics.TelemetryMetrics;
import relay.spi.Sink;
import relay.spi.SinkError;
import relay.spi.SinkResult;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryExecutorTest {

  private final RecordingSleeper sleeper = new RecordingSleeper();
  private final TelemetryMetrics metrics = new TelemetryMetrics();
  private final List<TelemetryRecord> chunk = Records.events(2);

  private RetryExecutor executor(Sink sink) {
    return RetryExecutor.builder()
        .sink(sink)
        .maxRetries(3)
        .retryPolicy(new LinearBackoffRetryPolicy(1000))
        .rateLimitCooldownMs(10_000)
        .sleeper(sleeper)
        .metrics(metrics)
        .build();
  }

  private int rateLimitHits() {
    return (int) metrics.snapshot(CircuitBreakerState.INITIAL, 0).rateLimitHits();
  }

  @Test
  void firstAttemptSuccessDoesNotWait() {
    ScriptedSink sink = ScriptedSink.alwaysOk();

    SendOutcome outcome = executor(sink).send(chunk, "telemetry_events");

    assertTrue(outcome.success());
    assertEquals(1, outcome.attempts());
    assertEquals(1, sink.callCount());
    assertEquals("telemetry_events", sink.calls().get(0).destination());
    assertTrue(sleeper.sleeps().isEmpty());
  }

  @Test
  void exhaustsRetriesWithLinearBackoffAndNoFinalWait() {
    ScriptedSink sink = ScriptedSink.alwaysFailing();

    SendOutcome outcome = executor(sink).send(chunk, "telemetry_events");

    assertFalse(outcome.success());
    assertEquals(3, outcome.attempts());
    assertEquals(SinkError.TRANSIENT, outcome.lastError());
    assertEquals(3, sink.callCount());
    assertEquals(List.of(1000L, 2000L), sleeper.sleeps());
  }

  @Test
  void succeedsOnRetry() {
    ScriptedSink sink = ScriptedSink.alwaysOk()
        .then(SinkResult.transientFailure("timeout"), SinkResult.permanentFailure("bad row"));

    SendOutcome outcome = executor(sink).send(chunk, "telemetry_events");

    assertTrue(outcome.success());
    assertEquals(3, outcome.attempts());
    assertEquals(List.of(1000L, 2000L), sleeper.sleeps());
  }

  @Test
  void rateLimitedWaitsFixedCooldownAndCountsHit() {
    ScriptedSink sink = ScriptedSink.alwaysOk()
        .then(SinkResult.rateLimited("too many connections"));

    SendOutcome outcome = executor(sink).send(chunk, "telemetry_events");

    assertTrue(outcome.success());
    assertEquals(List.of(10_000L), sleeper.sleeps());
    assertEquals(1, rateLimitHits());
  }

  @Test
  void rateLimitOnEveryAttemptCountsEachHit() {
    ScriptedSink sink = ScriptedSink.alwaysOk();
    sink.answerWith(SinkResult.rateLimited("slow down"));

    SendOutcome outcome = executor(sink).send(chunk, "telemetry_events");

    assertFalse(outcome.success());
    assertEquals(SinkError.RATE_LIMITED, outcome.lastError());
    assertEquals(3, rateLimitHits());
    assertEquals(List.of(10_000L, 10_000L), sleeper.sleeps());
  }

  @Test
  void sinkExceptionIsRetriedAsTransient() {
    AtomicInteger calls = new AtomicInteger();
    RetryExecutor executor = executor((destination, records) -> {
      if (calls.incrementAndGet() == 1) {
        throw new IllegalStateException("socket closed");
      }
      return SinkResult.ok();
    });

    SendOutcome outcome = executor.send(chunk, "telemetry_events");

    assertTrue(outcome.success());
    assertEquals(2, calls.get());
    assertEquals(List.of(1000L), sleeper.sleeps());
  }

  @Test
  void nullResultIsTreatedAsTransient() {
    SendOutcome outcome = executor((destination, records) -> null).send(chunk, "telemetry_events");

    assertFalse(outcome.success());
    assertEquals(SinkError.TRANSIENT, outcome.lastError());
  }

  @Test
  void interruptionAbandonsBatchAndKeepsFlag() {
    ScriptedSink sink = ScriptedSink.alwaysFailing();
    RetryExecutor executor = RetryExecutor.builder()
        .sink(sink)
        .sleeper(millis -> {
          throw new InterruptedException("shutdown");
        })
        .build();

    try {
      SendOutcome outcome = executor.send(chunk, "telemetry_events");

      assertFalse(outcome.success());
      assertEquals(1, outcome.attempts());
      assertEquals(1, sink.callCount());
      assertTrue(Thread.currentThread().isInterrupted());
    } finally {
      Thread.interrupted();
    }
  }

  @Test
  void builderValidatesArguments() {
    assertThrows(NullPointerException.class, () -> RetryExecutor.builder().build());
    assertThrows(IllegalArgumentException.class,
        () -> RetryExecutor.builder().sink(ScriptedSink.alwaysOk()).maxRetries(0).build());
    assertThrows(IllegalArgumentException.class,
        () -> RetryExecutor.builder().sink(ScriptedSink.alwaysOk()).rateLimitCooldownMs(-1).build());
  }
}
