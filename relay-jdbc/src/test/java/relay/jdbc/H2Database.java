package relay.jdbc;

import org.h2.jdbcx.JdbcDataSource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

/** In-memory H2 database with the relay tables. */
final class H2Database {

  private H2Database() {}

  static JdbcDataSource newDataSource() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:relay_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    return ds;
  }

  static void createSchema(Connection conn) throws SQLException {
    String script;
    try (InputStream in = H2Database.class.getResourceAsStream("/relay/jdbc/schema.sql")) {
      if (in == null) {
        throw new IllegalStateException("relay/jdbc/schema.sql not on classpath");
      }
      script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    try (Statement st = conn.createStatement()) {
      for (String sql : script.split(";")) {
        if (!sql.isBlank()) {
          st.execute(sql);
        }
      }
    }
  }

  static int count(Connection conn, String table) throws SQLException {
    try (Statement st = conn.createStatement();
         ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + table)) {
      rs.next();
      return rs.getInt(1);
    }
  }
}
