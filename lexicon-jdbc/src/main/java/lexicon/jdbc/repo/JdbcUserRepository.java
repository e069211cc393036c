package lexicon.jdbc.repo;

import lexicon.jdbc.JdbcTemplate;
import lexicon.jdbc.TableNames;
import lexicon.jdbc.spi.Dialect;
import lexicon.model.Location;
import lexicon.model.NotificationTarget;
import lexicon.model.Payment;
import lexicon.model.Profile;
import lexicon.model.User;
import lexicon.model.UserField;
import lexicon.model.UserInfo;
import lexicon.model.UserLocation;
import lexicon.spi.ConnectionProvider;
import lexicon.spi.UserRepository;
import lexicon.util.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC implementation of {@link UserRepository}.
 *
 * <p>Each call borrows one connection in auto-commit mode. {@code topics} is stored as
 * a JSON array in a text column. Profiles are written as update-then-insert on
 * {@code user_id} rather than through a dialect upsert: MySQL's upsert would also match
 * the nickname key and overwrite another user's row.
 */
public final class JdbcUserRepository implements UserRepository {
  private static final Logger log = LoggerFactory.getLogger(JdbcUserRepository.class);

  private final ConnectionProvider connections;
  private final Dialect dialect;
  private final TableNames tables;
  private final JsonCodec json;
  private final Clock clock;

  public JdbcUserRepository(ConnectionProvider connections, Dialect dialect) {
    this(connections, dialect, TableNames.DEFAULT, JsonCodec.getDefault(), Clock.systemUTC());
  }

  public JdbcUserRepository(ConnectionProvider connections, Dialect dialect, TableNames tables,
      JsonCodec json, Clock clock) {
    this.connections = Objects.requireNonNull(connections, "connections");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.tables = Objects.requireNonNull(tables, "tables");
    this.json = Objects.requireNonNull(json, "json");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public void upsertUser(User user) {
    String sql = dialect.upsertUserSql(tables);
    update("Failed to upsert user " + user.userId(), sql,
        user.userId(), user.username(), user.firstName(), user.source(), user.language(),
        user.fluency(), json.toJson(user.topics()), user.langCode());
  }

  @Override
  public void upsertProfile(Profile profile) {
    JdbcTemplate.withConnection(connections, "Failed to upsert profile " + profile.userId(), conn -> {
      int updated = JdbcTemplate.update(conn, dialect.updateProfileSql(tables),
          profile.nickname(), profile.email(), profile.birthday(), profile.gender(),
          profile.intro(), profile.dating(), profile.status(), profile.userId());
      if (updated == 0) {
        JdbcTemplate.update(conn, dialect.insertProfileSql(tables),
            profile.userId(), profile.nickname(), profile.email(), profile.birthday(), profile.gender(),
            profile.intro(), profile.dating(), profile.status());
      }
      return null;
    });
  }

  @Override
  public void upsertLocation(Location location) {
    String sql = dialect.upsertLocationSql(tables);
    update("Failed to upsert location " + location.userId(), sql,
        location.userId(), location.latitude(), location.longitude(), location.city(),
        location.country(), location.timezone());
  }

  @Override
  public void createPayment(Payment payment) {
    String sql = "INSERT INTO " + tables.payments()
        + " (user_id, amount, period, trial, is_active, paid_until, currency, created_at)"
        + " VALUES (?,?,?,?,?,?,?,?)";
    update("Failed to create payment for " + payment.userId(), sql,
        payment.userId(), payment.amount(), payment.period(), payment.trial(), payment.active(),
        payment.until(), payment.currency(), clock.instant());
  }

  @Override
  public boolean userExists(long userId) {
    return exists("SELECT 1 FROM " + tables.users() + " WHERE user_id=?", userId);
  }

  @Override
  public boolean profileExists(long userId) {
    return exists("SELECT 1 FROM " + tables.profiles() + " WHERE user_id=?", userId);
  }

  @Override
  public boolean locationExists(long userId) {
    return exists("SELECT 1 FROM " + tables.locations() + " WHERE user_id=?", userId);
  }

  @Override
  public boolean nicknameExists(String nickname) {
    return exists("SELECT 1 FROM " + tables.profiles() + " WHERE nickname=?", nickname);
  }

  @Override
  public Optional<UserInfo> getUserInfo(long userId) {
    String sql = "SELECT u.user_id, u.username, u.first_name, u.source, u.language, u.fluency,"
        + " u.topics, u.lang_code, u.is_active, u.blocked, u.last_notified,"
        + " p.user_id AS profile_user_id, p.nickname, p.email, p.birthday, p.gender, p.intro,"
        + " p.dating, p.status"
        + " FROM " + tables.users() + " u"
        + " LEFT JOIN " + tables.profiles() + " p ON p.user_id = u.user_id"
        + " WHERE u.user_id=?";
    return JdbcTemplate.withConnection(connections, "Failed to read user " + userId,
        conn -> JdbcTemplate.queryOne(conn, sql, this::mapUserInfo, userId));
  }

  @Override
  public Optional<UserLocation> getLocation(long userId) {
    String sql = "SELECT city, country FROM " + tables.locations() + " WHERE user_id=?";
    return JdbcTemplate.withConnection(connections, "Failed to read location " + userId,
        conn -> JdbcTemplate.queryOne(conn, sql,
            rs -> new UserLocation(rs.getString("city"), rs.getString("country")), userId));
  }

  @Override
  public Optional<Object> getField(long userId, UserField field) {
    String sql = "SELECT " + field.column() + " FROM " + ownerTable(field) + " WHERE user_id=?";
    return JdbcTemplate.withConnection(connections, "Failed to read " + field + " of " + userId,
        conn -> JdbcTemplate.queryOne(conn, sql, rs -> readField(rs, field), userId));
  }

  @Override
  public boolean updateField(long userId, UserField field, Object value) {
    field.requireAssignable(value);
    Object bound = field == UserField.TOPICS && value != null ? json.toJson(value) : value;
    String sql = "UPDATE " + ownerTable(field) + " SET " + field.column() + "=? WHERE user_id=?";
    int updated = update("Failed to update " + field + " of " + userId, sql, bound, userId);
    log.debug("Updated {} of user {} ({} rows)", field, userId, updated);
    return updated > 0;
  }

  @Override
  public List<NotificationTarget> notificationTargets() {
    String sql = "SELECT user_id, last_notified FROM " + tables.users()
        + " WHERE blocked = FALSE ORDER BY user_id";
    return JdbcTemplate.withConnection(connections, "Failed to list notification targets",
        conn -> JdbcTemplate.query(conn, sql,
            rs -> new NotificationTarget(rs.getLong("user_id"), JdbcTemplate.instant(rs, "last_notified"))));
  }

  @Override
  public void markNotified(long userId) {
    update("Failed to mark user " + userId + " notified",
        "UPDATE " + tables.users() + " SET last_notified=? WHERE user_id=?", clock.instant(), userId);
  }

  @Override
  public boolean isBlocked(long userId) {
    String sql = "SELECT blocked FROM " + tables.users() + " WHERE user_id=?";
    return JdbcTemplate.withConnection(connections, "Failed to read blocked flag of " + userId,
        conn -> JdbcTemplate.queryOne(conn, sql, rs -> rs.getBoolean("blocked"), userId))
        .orElse(false);
  }

  @Override
  public void markBlocked(long userId) {
    int updated = update("Failed to mark user " + userId + " blocked",
        "UPDATE " + tables.users() + " SET is_active = FALSE, blocked = TRUE WHERE user_id=?", userId);
    if (updated > 0) {
      log.info("User {} blocked the bot; deactivated", userId);
    }
  }

  private int update(String action, String sql, Object... params) {
    return JdbcTemplate.withConnection(connections, action,
        conn -> JdbcTemplate.update(conn, sql, params));
  }

  private boolean exists(String sql, Object... params) {
    return JdbcTemplate.withConnection(connections, "Failed to check existence",
        conn -> JdbcTemplate.exists(conn, sql, params));
  }

  private String ownerTable(UserField field) {
    return field.owner() == UserField.Owner.USER ? tables.users() : tables.profiles();
  }

  private Object readField(ResultSet rs, UserField field) throws SQLException {
    String column = field.column();
    switch (field) {
      case FLUENCY: {
        int fluency = rs.getInt(column);
        return rs.wasNull() ? null : fluency;
      }
      case DATING:
        return rs.getBoolean(column);
      case BIRTHDAY:
        return toLocalDate(rs.getDate(column));
      case TOPICS:
        return decodeTopics(rs.getString(column));
      default:
        return rs.getString(column);
    }
  }

  private UserInfo mapUserInfo(ResultSet rs) throws SQLException {
    long userId = rs.getLong("user_id");
    User user = new User(
        userId,
        rs.getString("username"),
        rs.getString("first_name"),
        rs.getString("source"),
        rs.getString("language"),
        rs.getInt("fluency"),
        decodeTopics(rs.getString("topics")),
        rs.getString("lang_code"));
    rs.getLong("profile_user_id");
    Profile profile = rs.wasNull() ? null : new Profile(
        userId,
        rs.getString("nickname"),
        rs.getString("email"),
        toLocalDate(rs.getDate("birthday")),
        rs.getString("gender"),
        rs.getString("intro"),
        rs.getBoolean("dating"),
        rs.getString("status"));
    return new UserInfo(user, rs.getBoolean("is_active"), rs.getBoolean("blocked"),
        JdbcTemplate.instant(rs, "last_notified"), profile);
  }

  private List<String> decodeTopics(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    return List.of(json.fromJson(text, String[].class));
  }

  private static LocalDate toLocalDate(Date date) {
    return date == null ? null : date.toLocalDate();
  }
}
