package lexicon.jdbc.pool;

import lexicon.ConnectivityException;
import lexicon.jdbc.JdbcTemplate;
import lexicon.jdbc.StoreException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionPoolTest {
  private ConnectionPool pool;

  @BeforeEach
  void setup() {
    pool = ConnectionPool.create(PoolSettings.builder()
        .jdbcUrl("jdbc:h2:mem:pool_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1")
        .minSize(1)
        .maxSize(2)
        .acquireTimeout(Duration.ofMillis(300))
        .poolName("pool-test")
        .build());
  }

  @AfterEach
  void tearDown() {
    pool.close();
  }

  @Test
  void withConnectionReleasesOnSuccess() throws SQLException {
    int one = pool.withConnection(conn ->
        JdbcTemplate.queryOne(conn, "SELECT 1", rs -> rs.getInt(1)).orElseThrow());

    assertEquals(1, one);
    assertEquals(0, pool.activeConnections());
  }

  @Test
  void withConnectionReleasesOnStoreError() {
    assertThrows(StoreException.class, () -> pool.withConnection(conn ->
        JdbcTemplate.update(conn, "UPDATE no_such_table SET x = 1")));

    assertEquals(0, pool.activeConnections());
  }

  @Test
  void withConnectionReleasesOnRuntimeException() {
    assertThrows(IllegalStateException.class, () -> pool.withConnection(conn -> {
      throw new IllegalStateException("boom");
    }));

    assertEquals(0, pool.activeConnections());
  }

  @Test
  void acquireAndReleaseTrackLeases() {
    Connection first = pool.acquire();
    Connection second = pool.acquire();
    assertEquals(2, pool.activeConnections());

    pool.release(first);
    pool.release(second);
    assertEquals(0, pool.activeConnections());
  }

  @Test
  void exhaustionFailsWithConnectivityAfterTimeout() {
    List<Connection> held = new ArrayList<>();
    held.add(pool.acquire());
    held.add(pool.acquire());
    try {
      long start = System.nanoTime();
      ConnectivityException ex = assertThrows(ConnectivityException.class, pool::acquire);
      long waitedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

      assertTrue(waitedMs >= 250, "waited " + waitedMs + "ms");
      assertTrue(ex.getMessage().contains("pool-test"));
    } finally {
      held.forEach(pool::release);
    }
    assertEquals(0, pool.activeConnections());
  }

  @Test
  void waitingCallerGetsConnectionOnceReleased() throws Exception {
    Connection first = pool.acquire();
    Connection second = pool.acquire();
    CountDownLatch acquired = new CountDownLatch(1);
    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      executor.submit(() -> {
        Connection conn = pool.acquire();
        acquired.countDown();
        pool.release(conn);
      });
      Thread.sleep(50);
      pool.release(first);

      assertTrue(acquired.await(2, TimeUnit.SECONDS));
    } finally {
      pool.release(second);
      executor.shutdownNow();
    }
  }

  @Test
  void unreachableStoreFailsWithConnectivity() {
    PoolSettings settings = PoolSettings.builder()
        .jdbcUrl("jdbc:postgresql://127.0.0.1:1/unreachable")
        .username("nobody")
        .password("nothing")
        .minSize(0)
        .maxSize(1)
        .acquireTimeout(Duration.ofMillis(250))
        .build();

    assertThrows(ConnectivityException.class, () -> ConnectionPool.create(settings));
  }

  @Test
  void closeShutsDownPool() {
    pool.close();

    assertTrue(pool.isClosed());
    assertThrows(ConnectivityException.class, pool::acquire);
  }
}
