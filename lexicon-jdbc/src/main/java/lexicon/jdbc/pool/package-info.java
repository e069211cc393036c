/**
 * The connection pool and its settings.
 */
package lexicon.jdbc.pool;
