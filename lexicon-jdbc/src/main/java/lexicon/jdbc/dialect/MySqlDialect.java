package lexicon.jdbc.dialect;

import lexicon.jdbc.JdbcTemplate;
import lexicon.spi.Delivery;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * MySQL dialect.
 */
public final class MySqlDialect extends AbstractDialect {

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:");
  }

  @Override
  protected String upsert(String table, List<String> columns, List<String> keys) {
    String updates = nonKey(columns, keys).stream()
        .map(c -> c + " = VALUES(" + c + ")")
        .collect(Collectors.joining(", "));
    return "INSERT INTO " + table + " (" + columnList(columns) + ") VALUES (" + placeholders(columns.size()) + ")"
        + " ON DUPLICATE KEY UPDATE " + updates;
  }

  @Override
  protected String insertIgnoring(String table, List<String> columns, List<String> keys) {
    return "INSERT IGNORE INTO " + table + " (" + columnList(columns) + ") VALUES ("
        + placeholders(columns.size()) + ")";
  }

  @Override
  public Optional<Delivery> claimNext(Connection conn, String table, String claimToken, Instant now) {
    // MySQL supports UPDATE...ORDER BY...LIMIT (no subquery needed)
    String claimSql = "UPDATE " + table + " SET status='IN_FLIGHT', locked_by=?, locked_at=? " +
        "WHERE status='NEW' ORDER BY id LIMIT 1";
    int updated = JdbcTemplate.update(conn, claimSql, claimToken, now);
    if (updated == 0) return Optional.empty();
    return selectClaimed(conn, table, claimToken, now);
  }
}
