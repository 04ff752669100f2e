package relay.jdbc;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Validation of destination names before they are spliced into SQL.
 */
public final class TableNames {
  private static final Pattern TABLE_NAME = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*(\\.[a-zA-Z_][a-zA-Z0-9_]*)?");

  private TableNames() {}

  /**
   * Accepts an identifier, optionally schema-qualified ({@code analytics.telemetry_events}).
   *
   * @param tableName candidate name
   * @return {@code tableName}
   * @throws IllegalArgumentException if the name is not a plain identifier
   */
  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!TABLE_NAME.matcher(tableName).matches()) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
