package relay.dead;

import relay.RecordKind;
import relay.TelemetryRecord;

import java.time.Instant;
import java.util.Objects;

/**
 * A record held in the {@link DeadLetterQueue} after its batch exhausted its retries.
 *
 * @param id         queue-assigned sequence number, unique per queue
 * @param record     the undelivered record
 * @param enqueuedAt when the record entered the queue
 */
public record DeadLetterEntry(long id, TelemetryRecord record, Instant enqueuedAt) {

  public DeadLetterEntry {
    Objects.requireNonNull(record, "record");
    Objects.requireNonNull(enqueuedAt, "enqueuedAt");
  }

  public RecordKind kind() {
    return record.kind();
  }
}
