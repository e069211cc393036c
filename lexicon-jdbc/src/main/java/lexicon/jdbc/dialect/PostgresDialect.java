package lexicon.jdbc.dialect;

import lexicon.jdbc.JdbcTemplate;
import lexicon.spi.Delivery;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * PostgreSQL dialect.
 */
public final class PostgresDialect extends AbstractDialect {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  protected String upsert(String table, List<String> columns, List<String> keys) {
    String updates = nonKey(columns, keys).stream()
        .map(c -> c + " = EXCLUDED." + c)
        .collect(Collectors.joining(", "));
    return "INSERT INTO " + table + " (" + columnList(columns) + ") VALUES (" + placeholders(columns.size()) + ")"
        + " ON CONFLICT (" + columnList(keys) + ") DO UPDATE SET " + updates;
  }

  @Override
  protected String insertIgnoring(String table, List<String> columns, List<String> keys) {
    return "INSERT INTO " + table + " (" + columnList(columns) + ") VALUES (" + placeholders(columns.size()) + ")"
        + " ON CONFLICT (" + columnList(keys) + ") DO NOTHING";
  }

  @Override
  public Optional<Delivery> claimNext(Connection conn, String table, String claimToken, Instant now) {
    // Single round-trip: FOR UPDATE SKIP LOCKED + RETURNING
    String sql = "UPDATE " + table + " SET status='IN_FLIGHT', locked_by=?, locked_at=? " +
        "WHERE id IN (" +
        "SELECT id FROM " + table + " WHERE status='NEW' ORDER BY id LIMIT 1" +
        " FOR UPDATE SKIP LOCKED" +
        ") RETURNING id, body";
    return JdbcTemplate.updateReturning(conn, sql, MESSAGE_ROW_MAPPER, claimToken, now).stream()
        .findFirst()
        .map(row -> new Delivery(row[0], row[1], now));
  }
}
