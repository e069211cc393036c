package lexicon.jdbc.pool;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import com.zaxxer.hikari.pool.HikariPool;
import lexicon.ConnectivityException;
import lexicon.jdbc.SqlErrors;
import lexicon.spi.ConnectionProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * The process-wide pool of store connections, backed by HikariCP.
 *
 * <p>Built once at startup with {@link #create(PoolSettings)}; nothing else opens
 * physical connections. Callers borrow with {@link #withConnection} or
 * {@link #acquire()}/{@link #release(Connection)}. When every connection is leased,
 * a caller waits up to the acquisition timeout and then fails with
 * {@link ConnectivityException}.
 *
 * <p>This class is thread-safe.
 */
public final class ConnectionPool implements ConnectionProvider, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ConnectionPool.class);

  private final HikariDataSource dataSource;

  private ConnectionPool(HikariDataSource dataSource) {
    this.dataSource = dataSource;
  }

  /**
   * Opens a pool. The store is contacted immediately.
   *
   * @throws ConnectivityException if the store cannot be reached
   */
  public static ConnectionPool create(PoolSettings settings) {
    Objects.requireNonNull(settings, "settings");
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(settings.jdbcUrl());
    config.setUsername(settings.username());
    config.setPassword(settings.password());
    config.setMinimumIdle(settings.minSize());
    config.setMaximumPoolSize(settings.maxSize());
    config.setConnectionTimeout(settings.acquireTimeout().toMillis());
    config.setPoolName(settings.poolName());
    try {
      ConnectionPool pool = new ConnectionPool(new HikariDataSource(config));
      log.info("Opened connection pool {} (min={}, max={}, timeout={}ms)", settings.poolName(),
          settings.minSize(), settings.maxSize(), settings.acquireTimeout().toMillis());
      return pool;
    } catch (HikariPool.PoolInitializationException e) {
      throw new ConnectivityException("Cannot open connection pool " + settings.poolName()
          + " for " + settings.jdbcUrl(), e);
    }
  }

  @Override
  public Connection getConnection() throws SQLException {
    return dataSource.getConnection();
  }

  /**
   * Borrows a connection. Must be handed back with {@link #release(Connection)}.
   *
   * @throws ConnectivityException if no connection frees up within the timeout or the
   *                               store is unreachable
   */
  public Connection acquire() {
    try {
      return dataSource.getConnection();
    } catch (SQLException e) {
      throw new ConnectivityException("Cannot acquire connection from " + dataSource.getPoolName()
          + ": " + e.getMessage(), e);
    }
  }

  /**
   * Returns a borrowed connection. {@code null} is ignored.
   */
  public void release(Connection connection) {
    if (connection == null) {
      return;
    }
    try {
      connection.close();
    } catch (SQLException e) {
      throw SqlErrors.translate("Failed to release connection", e);
    }
  }

  /**
   * Number of connections currently leased.
   */
  public int activeConnections() {
    HikariPoolMXBean bean = dataSource.getHikariPoolMXBean();
    return bean == null ? 0 : bean.getActiveConnections();
  }

  /**
   * Number of connections open, leased or idle.
   */
  public int totalConnections() {
    HikariPoolMXBean bean = dataSource.getHikariPoolMXBean();
    return bean == null ? 0 : bean.getTotalConnections();
  }

  /**
   * The configured JDBC URL.
   */
  public String jdbcUrl() {
    return dataSource.getJdbcUrl();
  }

  public boolean isClosed() {
    return dataSource.isClosed();
  }

  /**
   * The underlying data source, for frameworks that need one.
   */
  public DataSource dataSource() {
    return dataSource;
  }

  @Override
  public void close() {
    if (!dataSource.isClosed()) {
      log.info("Closing connection pool {}", dataSource.getPoolName());
      dataSource.close();
    }
  }
}
