package relay.jdbc;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Provides JDBC connections to the {@link JdbcSink}.
 *
 * <p>Callers are responsible for closing the returned connection.
 */
@FunctionalInterface
public interface ConnectionProvider {

  /**
   * Obtains a new JDBC connection.
   *
   * @return an open connection; the caller must close it
   * @throws SQLException if a connection cannot be obtained
   */
  Connection getConnection() throws SQLException;

  /**
   * Borrows connections from a {@link DataSource}, typically a pool.
   *
   * @param dataSource connection source
   * @return a provider delegating to {@link DataSource#getConnection()}
   */
  static ConnectionProvider of(DataSource dataSource) {
    Objects.requireNonNull(dataSource, "dataSource");
    return dataSource::getConnection;
  }
}
