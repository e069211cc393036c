package lexicon.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections to the repositories and the durable queue.
 *
 * <p>Callers are responsible for closing the returned connection. Prefer
 * {@link #withConnection(ConnectionCallback)}, which releases it on every exit path.
 *
 * @see lexicon.jdbc.pool.ConnectionPool
 */
public interface ConnectionProvider {

  /**
   * Obtains a connection.
   *
   * @return an open connection; the caller must close it
   * @throws SQLException if a connection cannot be obtained
   */
  Connection getConnection() throws SQLException;

  /**
   * Runs {@code callback} with a connection and closes the connection afterwards,
   * whether the callback returns or throws.
   *
   * @param callback work to run against the connection
   * @return the callback's result
   * @throws SQLException if the connection cannot be obtained or the callback fails
   */
  default <T> T withConnection(ConnectionCallback<T> callback) throws SQLException {
    try (Connection conn = getConnection()) {
      return callback.doInConnection(conn);
    }
  }

  /**
   * Work run against a borrowed connection.
   */
  @FunctionalInterface
  interface ConnectionCallback<T> {
    T doInConnection(Connection conn) throws SQLException;
  }
}
