/**
 * Extension point for additional databases.
 */
package lexicon.jdbc.spi;
