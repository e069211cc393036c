package lexicon.jdbc.spi;

import lexicon.jdbc.TableNames;
import lexicon.spi.Delivery;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * SPI for database dialect support.
 *
 * <p>Implementations provide the statements whose syntax differs between databases:
 * upserts, duplicate-tolerant inserts and the queue claim. Everything else the
 * repositories run is portable SQL. Register custom dialects via
 * {@code META-INF/services/lexicon.jdbc.spi.Dialect}.
 *
 * <p>Built-in dialects: MySQL, PostgreSQL, H2.
 *
 * @see lexicon.jdbc.dialect.Dialects
 */
public interface Dialect {

  /**
   * Unique identifier for this dialect (e.g., "mysql", "postgresql", "h2").
   */
  String name();

  /**
   * JDBC URL prefixes this dialect handles (e.g., "jdbc:mysql:").
   */
  List<String> jdbcUrlPrefixes();

  /**
   * Classpath location of the schema script, with {@code ${table}} placeholders.
   */
  default String schemaResource() {
    return "lexicon/schema/" + name() + ".sql";
  }

  /**
   * Insert-or-overwrite of a user's application-owned columns, keyed on {@code user_id}.
   *
   * <p>Parameters: user_id, username, first_name, source, language, fluency,
   * topics (JSON text), lang_code
   */
  String upsertUserSql(TableNames tables);

  /**
   * Overwrite of an existing profile, matched on {@code user_id} only.
   *
   * <p>Parameters: nickname, email, birthday, gender, intro, dating, status, user_id
   */
  String updateProfileSql(TableNames tables);

  /**
   * Plain insert of a profile. A taken nickname must fail as a unique violation.
   *
   * <p>Parameters: user_id, nickname, email, birthday, gender, intro, dating, status
   */
  String insertProfileSql(TableNames tables);

  /**
   * Parameters: user_id, latitude, longitude, city, country, timezone
   */
  String upsertLocationSql(TableNames tables);

  /**
   * Insert of a translation that silently skips an identical existing row.
   *
   * <p>Parameters: word_id, translation, part_of_speech
   */
  String insertTranslationSql(TableNames tables);

  /**
   * Parameters: user_id, word_id, context
   */
  String upsertContextSql(TableNames tables);

  /**
   * Parameters: user_id, word_id, url
   */
  String upsertAudioSql(TableNames tables);

  /**
   * Claims the oldest {@code NEW} message of the queue table: marks it
   * {@code IN_FLIGHT} with {@code claimToken} as {@code locked_by} and returns it.
   *
   * @param conn       JDBC connection in auto-commit mode
   * @param table      queue table name
   * @param claimToken unique token of this claim
   * @param now        claim time
   * @return the claimed message, or empty if none is waiting
   */
  Optional<Delivery> claimNext(Connection conn, String table, String claimToken, Instant now);
}
