/**
 * Manual JDBC transactions, used where several statements must commit together.
 *
 * @see lexicon.jdbc.tx.JdbcTransactionManager
 */
package lexicon.jdbc.tx;
