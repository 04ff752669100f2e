package relay;

import org.junit.jupiter.api.Test;
import relay.dispatch.ExponentialBackoffRetryPolicy;
import relay.dispatch.LinearBackoffRetryPolicy;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RelayConfigTest {

  @Test
  void emptyEnvironmentYieldsDefaults() {
    RelayConfig config = RelayConfig.fromEnvironment(Map.of());

    assertTrue(config.isEnabled());
    assertEquals(5000L, config.getFlushIntervalMs());
    assertEquals(50, config.getMaxBatchSize());
    assertEquals(3, config.getMaxRetries());
    assertEquals(1000L, config.getRetryBaseDelayMs());
    assertEquals(10000L, config.getRateLimitCooldownMs());
    assertEquals(5, config.getFailureThreshold());
    assertEquals(60000L, config.getCircuitResetTimeoutMs());
    assertEquals(100, config.getDeadLetterCapacity());
    assertEquals(1000, config.getBufferCapacity());
    assertEquals(100, config.getFlushHistorySize());
    assertEquals("telemetry_events", config.getDestination(RecordKind.EVENT));
    assertEquals("telemetry_workflows", config.getDestination(RecordKind.SNAPSHOT));
    assertEquals("workflow_mutations", config.getDestination(RecordKind.MUTATION));
    assertInstanceOf(LinearBackoffRetryPolicy.class, config.createRetryPolicy());
  }

  @Test
  void readsVariables() {
    Map<String, String> env = new HashMap<>();
    env.put(RelayConfig.FLUSH_INTERVAL_MS, "250");
    env.put(RelayConfig.MAX_BATCH_SIZE, " 10 ");
    env.put(RelayConfig.FAILURE_THRESHOLD, "2");
    env.put(RelayConfig.DLQ_CAPACITY, "25");
    env.put(RelayConfig.RETRY_STRATEGY, "exponential");
    env.put(RelayConfig.EVENTS_DESTINATION, "events_v2");

    RelayConfig config = RelayConfig.fromEnvironment(env);

    assertEquals(250L, config.getFlushIntervalMs());
    assertEquals(10, config.getMaxBatchSize());
    assertEquals(2, config.getFailureThreshold());
    assertEquals(25, config.getDeadLetterCapacity());
    assertEquals("events_v2", config.getDestination(RecordKind.EVENT));
    assertInstanceOf(ExponentialBackoffRetryPolicy.class, config.createRetryPolicy());
  }

  @Test
  void disabledValues() {
    for (String value : new String[]{"false", "FALSE", "0", "no", "off"}) {
      assertFalse(RelayConfig.fromEnvironment(Map.of(RelayConfig.ENABLED, value)).isEnabled(), value);
    }
    assertTrue(RelayConfig.fromEnvironment(Map.of(RelayConfig.ENABLED, "true")).isEnabled());
    assertTrue(RelayConfig.fromEnvironment(Map.of(RelayConfig.ENABLED, "")).isEnabled());
  }

  @Test
  void malformedNumberNamesVariable() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> RelayConfig.fromEnvironment(Map.of(RelayConfig.MAX_RETRIES, "three")));

    assertTrue(e.getMessage().contains(RelayConfig.MAX_RETRIES));
  }

  @Test
  void unknownStrategyIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> RelayConfig.fromEnvironment(Map.of(RelayConfig.RETRY_STRATEGY, "fibonacci")));
  }

  @Test
  void validateRejectsOutOfRangeValues() {
    assertThrows(IllegalArgumentException.class, () -> new RelayConfig().setMaxBatchSize(0).validate());
    assertThrows(IllegalArgumentException.class, () -> new RelayConfig().setMaxRetries(0).validate());
    assertThrows(IllegalArgumentException.class, () -> new RelayConfig().setDeadLetterCapacity(-1).validate());
    assertThrows(IllegalArgumentException.class,
        () -> new RelayConfig().setRetryBaseDelayMs(5000).setRetryMaxDelayMs(1000).validate());
  }

  @Test
  void blankDestinationFallsBackToDefault() {
    RelayConfig config = new RelayConfig()
        .setDestination(RecordKind.SNAPSHOT, "custom")
        .setDestination(RecordKind.SNAPSHOT, " ");

    assertEquals("telemetry_workflows", config.getDestination(RecordKind.SNAPSHOT));
  }
}
