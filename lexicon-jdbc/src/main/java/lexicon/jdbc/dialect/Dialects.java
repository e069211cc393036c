package lexicon.jdbc.dialect;

import lexicon.jdbc.SqlErrors;
import lexicon.jdbc.pool.ConnectionPool;
import lexicon.jdbc.spi.Dialect;
import lexicon.spi.ConnectionProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;

/**
 * Picks the {@link Dialect} the repositories and the queue run against.
 *
 * <p>Dialects come from {@code META-INF/services/lexicon.jdbc.spi.Dialect}; when two share
 * a name the first one on the class path is kept. A store is matched by the prefix of its
 * JDBC URL. For a {@link ConnectionPool} the URL is taken from its configuration, so no
 * connection is opened; any other provider is asked for one and its metadata is read.
 *
 * <pre>{@code
 * Dialect dialect = Dialects.resolve(configuredName, pool);   // blank name: detect
 * SchemaInitializer.create(pool, dialect);
 * }</pre>
 */
public final class Dialects {
  private static final Logger log = LoggerFactory.getLogger(Dialects.class);

  private static final Map<String, Dialect> REGISTERED = load();

  private Dialects() {
  }

  private static Map<String, Dialect> load() {
    Map<String, Dialect> byName = new LinkedHashMap<>();
    for (Dialect dialect : ServiceLoader.load(Dialect.class)) {
      String key = dialect.name().toLowerCase(Locale.ROOT);
      Dialect kept = byName.putIfAbsent(key, dialect);
      if (kept != null) {
        log.warn("Ignoring dialect {} ({}): name already taken by {}", key,
            dialect.getClass().getName(), kept.getClass().getName());
      }
    }
    return Collections.unmodifiableMap(byName);
  }

  /**
   * Registered dialects, in class-path order.
   */
  public static Collection<Dialect> registered() {
    return REGISTERED.values();
  }

  /**
   * The dialect called {@code name} (case-insensitive).
   *
   * @throws IllegalArgumentException if none is registered under that name
   */
  public static Dialect named(String name) {
    Dialect dialect = REGISTERED.get(name.trim().toLowerCase(Locale.ROOT));
    if (dialect == null) {
      throw new IllegalArgumentException("Unknown dialect '" + name + "', registered: " + REGISTERED.keySet());
    }
    return dialect;
  }

  /**
   * The configured dialect when {@code name} is set, otherwise the one detected for
   * {@code connections}.
   */
  public static Dialect resolve(String name, ConnectionProvider connections) {
    if (name != null && !name.isBlank()) {
      Dialect dialect = named(name);
      log.info("Using configured {} dialect", dialect.name());
      return dialect;
    }
    return detect(connections);
  }

  /**
   * The dialect matching the store behind {@code connections}.
   *
   * @throws lexicon.LexiconException if the store must be contacted and cannot be
   * @throws IllegalArgumentException if no dialect handles its URL
   */
  public static Dialect detect(ConnectionProvider connections) {
    String url = connections instanceof ConnectionPool
        ? ((ConnectionPool) connections).jdbcUrl()
        : urlOf(connections);
    Dialect dialect = forUrl(url);
    log.info("Detected {} dialect for {}", dialect.name(), url);
    return dialect;
  }

  /**
   * The dialect whose URL prefix matches {@code jdbcUrl}, compared case-insensitively.
   *
   * @throws IllegalArgumentException if the URL is blank or no dialect handles it
   */
  public static Dialect forUrl(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isBlank()) {
      throw new IllegalArgumentException("JDBC URL must not be blank");
    }
    String url = jdbcUrl.toLowerCase(Locale.ROOT);
    return REGISTERED.values().stream()
        .filter(d -> d.jdbcUrlPrefixes().stream().anyMatch(p -> url.startsWith(p.toLowerCase(Locale.ROOT))))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("No dialect handles " + jdbcUrl
            + ", registered: " + REGISTERED.keySet()));
  }

  private static String urlOf(ConnectionProvider connections) {
    try {
      return connections.withConnection(conn -> conn.getMetaData().getURL());
    } catch (SQLException e) {
      throw SqlErrors.translate("Failed to read store URL for dialect detection", e);
    }
  }
}
