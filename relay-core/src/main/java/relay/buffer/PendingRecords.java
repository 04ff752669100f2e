package relay.buffer;

import relay.TelemetryRecord;

import java.util.List;

/**
 * Records taken out of a {@link RecordBuffer} for one flush, grouped by kind.
 *
 * @param events    usage events
 * @param snapshots structural snapshots
 * @param mutations mutation logs
 */
public record PendingRecords(
    List<TelemetryRecord> events,
    List<TelemetryRecord> snapshots,
    List<TelemetryRecord> mutations) {

  public static final PendingRecords EMPTY = new PendingRecords(List.of(), List.of(), List.of());

  public PendingRecords {
    events = events == null ? List.of() : List.copyOf(events);
    snapshots = snapshots == null ? List.of() : List.copyOf(snapshots);
    mutations = mutations == null ? List.of() : List.copyOf(mutations);
  }

  public int size() {
    return events.size() + snapshots.size() + mutations.size();
  }

  public boolean isEmpty() {
    return size() == 0;
  }
}
