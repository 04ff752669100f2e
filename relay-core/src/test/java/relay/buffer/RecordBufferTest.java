package relay.buffer;

import org.junit.jupiter.api.Test;
import relay.Records;
import relay.TelemetryRecord;
import relay.circuit.CircuitBreakerState;
import relay.metrics.TelemetryMetrics;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RecordBufferTest {

  private final TelemetryMetrics metrics = new TelemetryMetrics();

  @Test
  void drainGroupsByKindAndEmptiesBuffer() {
    RecordBuffer buffer = new RecordBuffer(10, metrics);
    buffer.offer(Records.events(1).get(0));
    buffer.offer(Records.snapshot("h", "wf"));
    buffer.offer(TelemetryRecord.mutation(Map.of("k", 1)));

    PendingRecords pending = buffer.drain();

    assertEquals(1, pending.events().size());
    assertEquals(1, pending.snapshots().size());
    assertEquals(1, pending.mutations().size());
    assertEquals(0, buffer.size());
    assertTrue(buffer.drain().isEmpty());
  }

  @Test
  void fullQueueRejectsAndCountsDrop() {
    RecordBuffer buffer = new RecordBuffer(2, metrics);

    assertTrue(buffer.offer(Records.events(1).get(0)));
    assertTrue(buffer.offer(Records.events(1).get(0)));
    assertFalse(buffer.offer(Records.events(1).get(0)));
    assertTrue(buffer.offer(Records.snapshot("h", "wf")), "capacity is per kind");

    assertEquals(3, buffer.size());
    assertEquals(1, metrics.snapshot(CircuitBreakerState.INITIAL, 0).eventsDropped());
  }

  @Test
  void rejectsNullRecord() {
    RecordBuffer buffer = new RecordBuffer(1, metrics);

    assertThrows(NullPointerException.class, () -> buffer.offer(null));
  }
}
