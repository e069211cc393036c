package lexicon.jdbc.repo;

import lexicon.PaymentRequiredException;
import lexicon.jdbc.JdbcTemplate;
import lexicon.jdbc.SqlErrors;
import lexicon.jdbc.StoreException;
import lexicon.jdbc.TableNames;
import lexicon.jdbc.spi.Dialect;
import lexicon.jdbc.tx.JdbcTransactionManager;
import lexicon.lock.KeyedLocks;
import lexicon.model.DueWords;
import lexicon.model.NewWord;
import lexicon.model.PublicWord;
import lexicon.model.Translation;
import lexicon.model.WordEntry;
import lexicon.model.WordState;
import lexicon.model.WordStats;
import lexicon.spi.ConnectionProvider;
import lexicon.spi.WordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * JDBC implementation of {@link WordRepository}.
 *
 * <p>Renames of one user's words are serialized by a per-user lease from
 * {@link KeyedLocks}; statistics reads are serialized by a single global lock.
 * All other calls borrow one connection in auto-commit mode.
 */
public final class JdbcWordRepository implements WordRepository {
  private static final Logger log = LoggerFactory.getLogger(JdbcWordRepository.class);

  static final String NOUN = "noun";
  static final String VERB = "verb";
  static final String ADJECTIVE = "adjective";
  static final String ADVERB = "adverb";

  private final ConnectionProvider connections;
  private final JdbcTransactionManager txManager;
  private final Dialect dialect;
  private final TableNames tables;
  private final Clock clock;
  private final KeyedLocks<Long> userLocks;
  private final ReentrantLock statsLock = new ReentrantLock();

  public JdbcWordRepository(ConnectionProvider connections, Dialect dialect) {
    this(connections, dialect, TableNames.DEFAULT, Clock.systemUTC(), new KeyedLocks<>());
  }

  public JdbcWordRepository(ConnectionProvider connections, Dialect dialect, TableNames tables,
      Clock clock, KeyedLocks<Long> userLocks) {
    this.connections = Objects.requireNonNull(connections, "connections");
    this.txManager = new JdbcTransactionManager(connections);
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.tables = Objects.requireNonNull(tables, "tables");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.userLocks = Objects.requireNonNull(userLocks, "userLocks");
  }

  @Override
  public long addWord(NewWord word) {
    long userId = word.userId();
    return JdbcTemplate.withConnection(connections, "Failed to add word for " + userId, conn -> {
      boolean active = JdbcTemplate.queryOne(conn,
          "SELECT is_active FROM " + tables.users() + " WHERE user_id=?",
          rs -> rs.getBoolean("is_active"), userId).orElse(false);
      if (!active) {
        throw new PaymentRequiredException(userId);
      }

      long wordId = JdbcTemplate.insertReturningKey(conn,
          "INSERT INTO " + tables.words() + " (user_id, word, is_public, state, created_at)"
              + " VALUES (?,?,?,?,?)",
          userId, word.word(), word.isPublic(), WordState.NEW.name(), clock.instant());

      // Children follow the committed word one statement at a time
      String translationSql = dialect.insertTranslationSql(tables);
      for (Translation translation : word.translations()) {
        JdbcTemplate.update(conn, translationSql, wordId, translation.translation(), translation.partOfSpeech());
      }
      if (word.context() != null) {
        JdbcTemplate.update(conn, dialect.upsertContextSql(tables), userId, wordId, word.context());
      }
      if (word.audio() != null) {
        JdbcTemplate.update(conn, dialect.upsertAudioSql(tables), userId, wordId, word.audio());
      }
      log.debug("Added word {} ({}) for user {} with {} translations",
          wordId, word.word(), userId, word.translations().size());
      return wordId;
    });
  }

  @Override
  public boolean wordExists(long userId, String word) {
    String sql = "SELECT 1 FROM " + tables.words() + " WHERE user_id=? AND word=?";
    return JdbcTemplate.withConnection(connections, "Failed to check word of " + userId,
        conn -> JdbcTemplate.exists(conn, sql, userId, word));
  }

  @Override
  public List<WordEntry> queryWordsByUser(long userId) {
    return JdbcTemplate.withConnection(connections, "Failed to list words of " + userId,
        conn -> selectWords(conn, "w.user_id=?", userId));
  }

  @Override
  public Optional<WordEntry> findWord(long userId, String word) {
    List<WordEntry> found = JdbcTemplate.withConnection(connections, "Failed to find word of " + userId,
        conn -> selectWords(conn, "w.user_id=? AND w.word=?", userId, word));
    return found.stream().findFirst();
  }

  @Override
  public List<PublicWord> searchPublicWord(String word) {
    String sql = "SELECT p.nickname, w.user_id, w.word, w.created_at"
        + " FROM " + tables.words() + " w"
        + " JOIN " + tables.profiles() + " p ON p.user_id = w.user_id"
        + " WHERE w.word=? AND w.is_public = TRUE"
        + " ORDER BY w.created_at, w.user_id";
    return JdbcTemplate.withConnection(connections, "Failed to search public word",
        conn -> JdbcTemplate.query(conn, sql, rs -> new PublicWord(
            rs.getString("nickname"),
            rs.getLong("user_id"),
            rs.getString("word"),
            JdbcTemplate.instant(rs, "created_at")), word));
  }

  @Override
  public boolean deleteWord(long userId, long wordId) {
    String sql = "DELETE FROM " + tables.words() + " WHERE id=? AND user_id=?";
    int deleted = JdbcTemplate.withConnection(connections, "Failed to delete word " + wordId,
        conn -> JdbcTemplate.update(conn, sql, wordId, userId));
    return deleted > 0;
  }

  @Override
  public boolean renameWord(long userId, String oldWord, String newWord) {
    Objects.requireNonNull(oldWord, "oldWord");
    Objects.requireNonNull(newWord, "newWord");
    try {
      return userLocks.withLock(userId, () -> renameInTransaction(userId, oldWord, newWord));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StoreException("Interrupted while waiting to rename a word of user " + userId, e);
    } catch (SQLException e) {
      throw SqlErrors.translate("Failed to rename word of " + userId, e);
    }
  }

  private boolean renameInTransaction(long userId, String oldWord, String newWord) throws SQLException {
    String findSql = "SELECT id FROM " + tables.words() + " WHERE user_id=? AND word=?";
    try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
      Connection conn = tx.connection();
      Optional<Long> oldId = JdbcTemplate.queryOne(conn, findSql, rs -> rs.getLong("id"), userId, oldWord);
      if (oldId.isEmpty()) {
        return false;
      }
      if (!oldWord.equals(newWord)) {
        Optional<Long> targetId = JdbcTemplate.queryOne(conn, findSql, rs -> rs.getLong("id"), userId, newWord);
        if (targetId.isPresent()) {
          JdbcTemplate.update(conn, "DELETE FROM " + tables.words() + " WHERE id=?", oldId.get());
          log.debug("Merged word '{}' into '{}' for user {}", oldWord, newWord, userId);
        } else {
          JdbcTemplate.update(conn, "UPDATE " + tables.words() + " SET word=? WHERE id=?", newWord, oldId.get());
          log.debug("Renamed word '{}' to '{}' for user {}", oldWord, newWord, userId);
        }
      }
      tx.commit();
      return true;
    }
  }

  @Override
  public Optional<WordState> reviewOutcome(long userId, String word, boolean correct) {
    WordState[] ladder = WordState.values();
    StringBuilder sql = new StringBuilder("UPDATE ").append(tables.words()).append(" SET state = CASE state");
    List<Object> params = new ArrayList<>();
    for (WordState state : ladder) {
      sql.append(" WHEN '").append(state.name()).append("' THEN ?");
      params.add(state.next(correct).name());
    }
    sql.append(" ELSE state END WHERE user_id=? AND word=?");
    params.add(userId);
    params.add(word);

    String selectSql = "SELECT state FROM " + tables.words() + " WHERE user_id=? AND word=?";
    // the row lock taken by the UPDATE holds until commit, so the read-back sees this step only
    try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
      Connection conn = tx.connection();
      int updated = JdbcTemplate.update(conn, sql.toString(), params.toArray());
      if (updated == 0) {
        return Optional.empty();
      }
      Optional<WordState> state = JdbcTemplate.queryOne(conn, selectSql,
          rs -> WordState.valueOf(rs.getString("state")), userId, word);
      tx.commit();
      return state;
    } catch (SQLException e) {
      throw SqlErrors.translate("Failed to apply review outcome for " + userId, e);
    }
  }

  @Override
  public List<DueWords> dueForReview() {
    Instant now = clock.instant();
    List<String> arms = new ArrayList<>();
    List<Object> params = new ArrayList<>();
    for (WordState state : WordState.values()) {
      state.dueCutoff(now).ifPresent(cutoff -> {
        arms.add("(state=? AND created_at <= ?)");
        params.add(state.name());
        params.add(cutoff);
      });
    }
    String sql = "SELECT DISTINCT user_id, word FROM " + tables.words()
        + " WHERE " + String.join(" OR ", arms)
        + " ORDER BY user_id, word";

    List<Object[]> rows = JdbcTemplate.withConnection(connections, "Failed to select due words",
        conn -> JdbcTemplate.query(conn, sql,
            rs -> new Object[] {rs.getLong("user_id"), rs.getString("word")}, params.toArray()));

    Map<Long, List<String>> byUser = new LinkedHashMap<>();
    for (Object[] row : rows) {
      byUser.computeIfAbsent((Long) row[0], k -> new ArrayList<>()).add((String) row[1]);
    }
    List<DueWords> due = new ArrayList<>(byUser.size());
    byUser.forEach((userId, words) -> due.add(new DueWords(userId, words)));
    return due;
  }

  @Override
  public int markRepeated(String nickname, String message) {
    List<String> tokens = Arrays.stream(message.toLowerCase(Locale.ROOT).trim().split("\\s+"))
        .filter(token -> !token.isEmpty())
        .distinct()
        .toList();
    if (tokens.isEmpty()) {
      return 0;
    }
    String sql = "UPDATE " + tables.words() + " SET state=?"
        + " WHERE state=?"
        + " AND user_id = (SELECT user_id FROM " + tables.profiles() + " WHERE nickname=?)"
        + " AND LOWER(word) IN (" + String.join(",", Collections.nCopies(tokens.size(), "?")) + ")";
    List<Object> params = new ArrayList<>();
    params.add(WordState.NEW.next(true).name());
    params.add(WordState.NEW.name());
    params.add(nickname);
    params.addAll(tokens);

    int updated = JdbcTemplate.withConnection(connections, "Failed to mark words repeated for " + nickname,
        conn -> JdbcTemplate.update(conn, sql, params.toArray()));
    if (updated > 0) {
      log.debug("Marked {} words of {} as repeated", updated, nickname);
    }
    return updated;
  }

  @Override
  public WordStats getUserStats(long userId) {
    String known = "'" + NOUN + "','" + VERB + "','" + ADJECTIVE + "','" + ADVERB + "'";
    String sql = "SELECT"
        + countWordsWith("t.part_of_speech='" + NOUN + "'") + " AS nouns,"
        + countWordsWith("t.part_of_speech='" + VERB + "'") + " AS verbs,"
        + countWordsWith("t.part_of_speech='" + ADJECTIVE + "'") + " AS adjectives,"
        + countWordsWith("t.part_of_speech='" + ADVERB + "'") + " AS adverbs,"
        + countWordsWith("t.part_of_speech NOT IN (" + known + ")") + " AS others"
        + " FROM " + tables.words() + " w"
        + " LEFT JOIN " + tables.translations() + " t ON t.word_id = w.id"
        + " WHERE w.user_id=?";
    statsLock.lock();
    try {
      return JdbcTemplate.withConnection(connections, "Failed to read stats of " + userId,
          conn -> JdbcTemplate.queryOne(conn, sql, JdbcWordRepository::mapStats, userId))
          .orElse(WordStats.EMPTY);
    } finally {
      statsLock.unlock();
    }
  }

  @Override
  public long countWordsSince(long userId, Duration window) {
    Instant since = clock.instant().minus(window);
    String sql = "SELECT COUNT(*) AS added FROM " + tables.words() + " WHERE user_id=? AND created_at >= ?";
    statsLock.lock();
    try {
      return JdbcTemplate.withConnection(connections, "Failed to count recent words of " + userId,
          conn -> JdbcTemplate.queryOne(conn, sql, rs -> rs.getLong("added"), userId, since))
          .orElse(0L);
    } finally {
      statsLock.unlock();
    }
  }

  /**
   * Whether a statistics read is in progress. Exposed for tests.
   */
  boolean isStatsLocked() {
    return statsLock.isLocked();
  }

  private static String countWordsWith(String condition) {
    return " COUNT(DISTINCT CASE WHEN " + condition + " THEN w.id END)";
  }

  private static WordStats mapStats(ResultSet rs) throws SQLException {
    return new WordStats(
        rs.getLong("nouns"),
        rs.getLong("verbs"),
        rs.getLong("adjectives"),
        rs.getLong("adverbs"),
        rs.getLong("others"));
  }

  private List<WordEntry> selectWords(Connection conn, String condition, Object... params) {
    String wordsSql = "SELECT w.id, w.user_id, w.word, w.is_public, w.state, w.created_at,"
        + " p.nickname, c.context, a.url"
        + " FROM " + tables.words() + " w"
        + " LEFT JOIN " + tables.profiles() + " p ON p.user_id = w.user_id"
        + " LEFT JOIN " + tables.contexts() + " c ON c.word_id = w.id AND c.user_id = w.user_id"
        + " LEFT JOIN " + tables.audios() + " a ON a.word_id = w.id AND a.user_id = w.user_id"
        + " WHERE " + condition
        + " ORDER BY w.word";
    String translationsSql = "SELECT t.word_id, t.translation, t.part_of_speech"
        + " FROM " + tables.translations() + " t"
        + " JOIN " + tables.words() + " w ON w.id = t.word_id"
        + " WHERE " + condition
        + " ORDER BY t.word_id, t.translation, t.part_of_speech";

    Map<Long, List<Translation>> translations = new LinkedHashMap<>();
    JdbcTemplate.query(conn, translationsSql, rs -> {
      translations.computeIfAbsent(rs.getLong("word_id"), k -> new ArrayList<>())
          .add(new Translation(rs.getString("translation"), rs.getString("part_of_speech")));
      return null;
    }, params);

    return JdbcTemplate.query(conn, wordsSql, rs -> {
      long id = rs.getLong("id");
      return new WordEntry(
          id,
          rs.getLong("user_id"),
          rs.getString("nickname"),
          rs.getString("word"),
          rs.getBoolean("is_public"),
          WordState.valueOf(rs.getString("state")),
          JdbcTemplate.instant(rs, "created_at"),
          rs.getString("context"),
          rs.getString("url"),
          translations.getOrDefault(id, List.of()));
    }, params);
  }
}
