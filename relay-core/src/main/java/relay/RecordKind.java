package relay;

/**
 * Category of a {@link TelemetryRecord}. The kind decides the destination table a record
 * is delivered to and which pre-send treatment it receives.
 *
 * <ul>
 *   <li>{@link #EVENT}: usage events, sent as-is</li>
 *   <li>{@link #SNAPSHOT}: structural snapshots, de-duplicated by content hash per flush</li>
 *   <li>{@link #MUTATION}: mutation logs, top-level payload keys converted to snake_case</li>
 * </ul>
 */
public enum RecordKind {
  EVENT("telemetry_events"),
  SNAPSHOT("telemetry_workflows"),
  MUTATION("workflow_mutations");

  private final String defaultDestination;

  RecordKind(String defaultDestination) {
    this.defaultDestination = defaultDestination;
  }

  /**
   * Returns the destination table used when none is configured for this kind.
   *
   * @return the default destination name
   */
  public String defaultDestination() {
    return defaultDestination;
  }
}
