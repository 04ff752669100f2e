package relay.jdbc;

import relay.spi.SinkError;

import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;

/**
 * Maps JDBC failures onto the retry classes of the relay.
 *
 * <ul>
 *   <li>{@link SinkError#RATE_LIMITED}: too many connections (SQL state {@code 53300},
 *       MySQL error {@code 1040})</li>
 *   <li>{@link SinkError#TRANSIENT}: {@link SQLTransientException},
 *       {@link SQLRecoverableException}, SQL state classes {@code 08} (connection) and
 *       {@code 40} (transaction rollback, serialization, deadlock)</li>
 *   <li>{@link SinkError#PERMANENT}: everything else</li>
 * </ul>
 *
 * <p>The whole {@link SQLException#getNextException()} chain is inspected; the most
 * retryable class found wins.
 */
public final class SqlErrorClassifier {
  static final String TOO_MANY_CONNECTIONS_STATE = "53300";
  static final int MYSQL_TOO_MANY_CONNECTIONS = 1040;

  private SqlErrorClassifier() {}

  public static SinkError classify(SQLException failure) {
    SinkError result = SinkError.PERMANENT;
    for (SQLException e = failure; e != null; e = e.getNextException()) {
      SinkError single = classifySingle(e);
      if (single == SinkError.RATE_LIMITED) {
        return single;
      }
      if (single == SinkError.TRANSIENT) {
        result = single;
      }
    }
    return result;
  }

  private static SinkError classifySingle(SQLException e) {
    String state = e.getSQLState();
    if (TOO_MANY_CONNECTIONS_STATE.equals(state) || e.getErrorCode() == MYSQL_TOO_MANY_CONNECTIONS) {
      return SinkError.RATE_LIMITED;
    }
    if (e instanceof SQLTransientException || e instanceof SQLRecoverableException) {
      return SinkError.TRANSIENT;
    }
    if (state != null && (state.startsWith("08") || state.startsWith("40"))) {
      return SinkError.TRANSIENT;
    }
    return SinkError.PERMANENT;
  }
}
