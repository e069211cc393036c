package lexicon.jdbc.queue;

import com.github.f4b6a3.ulid.UlidCreator;
import lexicon.jdbc.JdbcTemplate;
import lexicon.jdbc.TableNames;
import lexicon.jdbc.spi.Dialect;
import lexicon.spi.ConnectionProvider;
import lexicon.spi.Delivery;
import lexicon.spi.MessageQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link MessageQueue} stored in the {@code message_queue} table.
 *
 * <p>Rows move {@code NEW -> IN_FLIGHT -> ACKED}. {@link #receive} claims the oldest
 * {@code NEW} row through {@link Dialect#claimNext}, polling until the timeout expires.
 * Claimed rows are never handed out again, even if the consumer dies before acking.
 *
 * <p>This class is thread-safe.
 */
public final class JdbcMessageQueue implements MessageQueue {
  private static final Logger log = LoggerFactory.getLogger(JdbcMessageQueue.class);

  static final String STATUS_NEW = "NEW";
  static final String STATUS_IN_FLIGHT = "IN_FLIGHT";
  static final String STATUS_ACKED = "ACKED";

  public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(50);

  private final ConnectionProvider connections;
  private final Dialect dialect;
  private final String table;
  private final Clock clock;
  private final long pollIntervalMs;

  public JdbcMessageQueue(ConnectionProvider connections, Dialect dialect) {
    this(connections, dialect, TableNames.DEFAULT, Clock.systemUTC(), DEFAULT_POLL_INTERVAL);
  }

  public JdbcMessageQueue(ConnectionProvider connections, Dialect dialect, TableNames tables,
      Clock clock, Duration pollInterval) {
    this.connections = Objects.requireNonNull(connections, "connections");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.table = Objects.requireNonNull(tables, "tables").messageQueue();
    this.clock = Objects.requireNonNull(clock, "clock");
    if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
      throw new IllegalArgumentException("pollInterval must be > 0");
    }
    this.pollIntervalMs = pollInterval.toMillis();
  }

  @Override
  public String publish(String body) {
    Objects.requireNonNull(body, "body");
    String id = UlidCreator.getMonotonicUlid().toString();
    String sql = "INSERT INTO " + table + " (id, body, status, created_at) VALUES (?,?,?,?)";
    JdbcTemplate.withConnection(connections, "Failed to publish message",
        conn -> JdbcTemplate.update(conn, sql, id, body, STATUS_NEW, clock.instant()));
    return id;
  }

  @Override
  public Delivery receive(Duration timeout) throws InterruptedException {
    long deadline = System.nanoTime() + timeout.toNanos();
    while (true) {
      Optional<Delivery> claimed = claimNext();
      if (claimed.isPresent()) {
        return claimed.get();
      }
      long remainingMs = (deadline - System.nanoTime()) / 1_000_000L;
      if (remainingMs <= 0) {
        return null;
      }
      Thread.sleep(Math.min(pollIntervalMs, remainingMs));
    }
  }

  @Override
  public void ack(Delivery delivery) {
    String sql = "UPDATE " + table + " SET status=?, acked_at=? WHERE id=? AND status=?";
    int updated = JdbcTemplate.withConnection(connections, "Failed to ack message " + delivery.messageId(),
        conn -> JdbcTemplate.update(conn, sql, STATUS_ACKED, clock.instant(), delivery.messageId(),
            STATUS_IN_FLIGHT));
    if (updated == 0) {
      log.debug("Message {} was not in flight; ack ignored", delivery.messageId());
    }
  }

  @Override
  public int unackedCount() {
    return countWithStatus(STATUS_IN_FLIGHT);
  }

  /**
   * Number of messages published but not yet received.
   */
  public int pendingCount() {
    return countWithStatus(STATUS_NEW);
  }

  /**
   * Deletes acknowledged messages whose ack is older than {@code retention}.
   *
   * @return number of rows deleted
   */
  public int purgeAcked(Duration retention) {
    Instant cutoff = clock.instant().minus(retention);
    String sql = "DELETE FROM " + table + " WHERE status=? AND acked_at < ?";
    int purged = JdbcTemplate.withConnection(connections, "Failed to purge acked messages",
        conn -> JdbcTemplate.update(conn, sql, STATUS_ACKED, cutoff));
    if (purged > 0) {
      log.info("Purged {} acked messages older than {}", purged, cutoff);
    }
    return purged;
  }

  private Optional<Delivery> claimNext() {
    String token = UlidCreator.getMonotonicUlid().toString();
    Instant now = clock.instant();
    return JdbcTemplate.withConnection(connections, "Failed to claim message",
        conn -> dialect.claimNext(conn, table, token, now));
  }

  private int countWithStatus(String status) {
    String sql = "SELECT COUNT(*) AS total FROM " + table + " WHERE status=?";
    return JdbcTemplate.withConnection(connections, "Failed to count messages",
        conn -> JdbcTemplate.queryOne(conn, sql, rs -> rs.getInt("total"), status))
        .orElse(0);
  }
}
