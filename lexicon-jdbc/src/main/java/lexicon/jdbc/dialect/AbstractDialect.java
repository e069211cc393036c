package lexicon.jdbc.dialect;

import lexicon.jdbc.JdbcTemplate;
import lexicon.jdbc.TableNames;
import lexicon.jdbc.spi.Dialect;
import lexicon.spi.Delivery;

import java.sql.Connection;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Base dialect that derives every statement from two primitives, {@link #upsert}
 * and {@link #insertIgnoring}.
 *
 * <p>The default {@link #claimNext} is a two-phase UPDATE-then-SELECT that works on H2.
 */
public abstract class AbstractDialect implements Dialect {

  static final List<String> USER_COLUMNS = List.of(
      "user_id", "username", "first_name", "source", "language", "fluency", "topics", "lang_code");
  static final List<String> PROFILE_COLUMNS = List.of(
      "user_id", "nickname", "email", "birthday", "gender", "intro", "dating", "status");
  static final List<String> LOCATION_COLUMNS = List.of(
      "user_id", "latitude", "longitude", "city", "country", "timezone");
  static final List<String> TRANSLATION_COLUMNS = List.of("word_id", "translation", "part_of_speech");
  static final List<String> CONTEXT_COLUMNS = List.of("user_id", "word_id", "context");
  static final List<String> AUDIO_COLUMNS = List.of("user_id", "word_id", "url");

  static final List<String> USER_KEY = List.of("user_id");
  static final List<String> CHILD_KEY = List.of("user_id", "word_id");

  protected static final JdbcTemplate.RowMapper<String[]> MESSAGE_ROW_MAPPER =
      rs -> new String[] {rs.getString("id"), rs.getString("body")};

  /**
   * Insert of {@code columns} that overwrites the non-key columns when a row with the
   * same {@code keys} exists.
   */
  protected abstract String upsert(String table, List<String> columns, List<String> keys);

  /**
   * Insert of {@code columns} that does nothing when a row with the same {@code keys} exists.
   */
  protected abstract String insertIgnoring(String table, List<String> columns, List<String> keys);

  @Override
  public String upsertUserSql(TableNames tables) {
    return upsert(tables.users(), USER_COLUMNS, USER_KEY);
  }

  @Override
  public String updateProfileSql(TableNames tables) {
    String assignments = nonKey(PROFILE_COLUMNS, USER_KEY).stream()
        .map(c -> c + "=?")
        .collect(Collectors.joining(", "));
    return "UPDATE " + tables.profiles() + " SET " + assignments + " WHERE user_id=?";
  }

  @Override
  public String insertProfileSql(TableNames tables) {
    return "INSERT INTO " + tables.profiles() + " (" + columnList(PROFILE_COLUMNS) + ") VALUES ("
        + placeholders(PROFILE_COLUMNS.size()) + ")";
  }

  @Override
  public String upsertLocationSql(TableNames tables) {
    return upsert(tables.locations(), LOCATION_COLUMNS, USER_KEY);
  }

  @Override
  public String insertTranslationSql(TableNames tables) {
    return insertIgnoring(tables.translations(), TRANSLATION_COLUMNS, TRANSLATION_COLUMNS);
  }

  @Override
  public String upsertContextSql(TableNames tables) {
    return upsert(tables.contexts(), CONTEXT_COLUMNS, CHILD_KEY);
  }

  @Override
  public String upsertAudioSql(TableNames tables) {
    return upsert(tables.audios(), AUDIO_COLUMNS, CHILD_KEY);
  }

  @Override
  public Optional<Delivery> claimNext(Connection conn, String table, String claimToken, Instant now) {
    // Phase 1: UPDATE with subquery (H2-compatible default)
    String claimSql = "UPDATE " + table + " SET status='IN_FLIGHT', locked_by=?, locked_at=? " +
        "WHERE status='NEW' AND id IN (" +
        "SELECT id FROM " + table + " WHERE status='NEW' ORDER BY id LIMIT 1)";
    int updated = JdbcTemplate.update(conn, claimSql, claimToken, now);
    if (updated == 0) return Optional.empty();
    // Phase 2: SELECT the claimed row
    return selectClaimed(conn, table, claimToken, now);
  }

  protected static Optional<Delivery> selectClaimed(Connection conn, String table, String claimToken, Instant now) {
    String selectSql = "SELECT id, body FROM " + table + " WHERE locked_by=?";
    return JdbcTemplate.queryOne(conn, selectSql, MESSAGE_ROW_MAPPER, claimToken)
        .map(row -> new Delivery(row[0], row[1], now));
  }

  static String columnList(List<String> columns) {
    return String.join(", ", columns);
  }

  static String placeholders(int count) {
    return String.join(",", Collections.nCopies(count, "?"));
  }

  static List<String> nonKey(List<String> columns, List<String> keys) {
    return columns.stream().filter(c -> !keys.contains(c)).toList();
  }
}
