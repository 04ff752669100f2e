package relay;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable unit of telemetry produced by the host application.
 *
 * <p>The payload is copied on construction and exposed as an unmodifiable map that keeps
 * the caller's key order. Only {@link RecordKind#SNAPSHOT} records are expected to carry a
 * {@code contentHash}; it is used to drop duplicate snapshots within a single flush.
 *
 * @param kind        record category, never null
 * @param payload     record body, never null
 * @param contentHash optional hash for de-duplication, may be null
 * @param createdAt   creation time, never null
 */
public record TelemetryRecord(
    RecordKind kind,
    Map<String, Object> payload,
    String contentHash,
    Instant createdAt) {

  public TelemetryRecord {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(createdAt, "createdAt");
    payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
  }

  public static TelemetryRecord event(Map<String, Object> payload) {
    return new TelemetryRecord(RecordKind.EVENT, payload, null, Instant.now());
  }

  public static TelemetryRecord snapshot(String contentHash, Map<String, Object> payload) {
    return new TelemetryRecord(RecordKind.SNAPSHOT, payload, contentHash, Instant.now());
  }

  public static TelemetryRecord mutation(Map<String, Object> payload) {
    return new TelemetryRecord(RecordKind.MUTATION, payload, null, Instant.now());
  }

  /**
   * Returns a copy of this record with a different payload, keeping kind, hash and timestamp.
   *
   * @param newPayload the replacement payload
   * @return a new record
   */
  public TelemetryRecord withPayload(Map<String, Object> newPayload) {
    return new TelemetryRecord(kind, newPayload, contentHash, createdAt);
  }
}
