package lexicon.jdbc;

import lexicon.jdbc.spi.Dialect;
import lexicon.spi.ConnectionProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Creates the lexicon tables from the dialect's schema script.
 *
 * <p>Scripts only use {@code CREATE ... IF NOT EXISTS}, so running the initializer
 * against an existing schema is a no-op.
 */
public final class SchemaInitializer {
  private static final Logger log = LoggerFactory.getLogger(SchemaInitializer.class);

  private SchemaInitializer() {}

  public static void create(ConnectionProvider connections, Dialect dialect) {
    create(connections, dialect, TableNames.DEFAULT);
  }

  /**
   * Runs the schema script of {@code dialect} with {@code tables} substituted in.
   *
   * @throws lexicon.ConnectivityException if the store is unreachable
   * @throws StoreException                if a statement fails
   */
  public static void create(ConnectionProvider connections, Dialect dialect, TableNames tables) {
    List<String> statements = statements(dialect, tables);
    JdbcTemplate.withConnection(connections, "Failed to initialize schema", conn -> {
      JdbcTemplate.execute(conn, statements);
      return null;
    });
    log.info("Initialized {} schema ({} statements)", dialect.name(), statements.size());
  }

  static List<String> statements(Dialect dialect, TableNames tables) {
    String script = render(load(dialect.schemaResource()), tables.placeholders());
    List<String> statements = new ArrayList<>();
    for (String stmt : script.split(";")) {
      String trimmed = stmt.trim();
      if (!trimmed.isEmpty()) {
        statements.add(trimmed);
      }
    }
    return statements;
  }

  static String render(String script, Map<String, String> placeholders) {
    String rendered = script;
    for (Map.Entry<String, String> entry : placeholders.entrySet()) {
      rendered = rendered.replace("${" + entry.getKey() + "}", entry.getValue());
    }
    return rendered;
  }

  private static String load(String resource) {
    ClassLoader loader = SchemaInitializer.class.getClassLoader();
    try (InputStream in = loader.getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalStateException("Schema resource not found: " + resource);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read schema resource " + resource, e);
    }
  }
}
