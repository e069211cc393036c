package lexicon.spring.boot;

import lexicon.jdbc.SchemaInitializer;
import lexicon.jdbc.TableNames;
import lexicon.jdbc.spi.Dialect;
import lexicon.spi.ConnectionProvider;

/**
 * Creates the lexicon tables once, before the first bean that reads or writes them.
 *
 * @see LexiconProperties.Schema#isInitialize()
 */
public class LexiconSchemaInitializer {
  private final ConnectionProvider connections;
  private final Dialect dialect;
  private final TableNames tables;
  private boolean created;

  public LexiconSchemaInitializer(ConnectionProvider connections, Dialect dialect, TableNames tables) {
    this.connections = connections;
    this.dialect = dialect;
    this.tables = tables;
  }

  public synchronized void ensureCreated() {
    if (!created) {
      SchemaInitializer.create(connections, dialect, tables);
      created = true;
    }
  }
}
