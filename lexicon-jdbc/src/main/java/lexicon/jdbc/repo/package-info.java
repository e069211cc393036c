/**
 * JDBC implementations of the user and word repositories.
 *
 * <p>Dialect-specific statements come from {@link lexicon.jdbc.spi.Dialect}; table names
 * from {@link lexicon.jdbc.TableNames}.
 */
package lexicon.jdbc.repo;
