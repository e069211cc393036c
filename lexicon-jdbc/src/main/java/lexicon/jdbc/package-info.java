/**
 * JDBC support: statement helper, error translation, table names and schema setup.
 *
 * <h2>Schema</h2>
 * <p>{@link lexicon.jdbc.SchemaInitializer} runs {@code lexicon/schema/<dialect>.sql}
 * from the classpath, substituting {@link lexicon.jdbc.TableNames#placeholders()}.
 *
 * @see lexicon.jdbc.pool.ConnectionPool
 * @see lexicon.jdbc.dialect.Dialects
 */
package lexicon.jdbc;
