/**
 * Built-in SQL dialects and their ServiceLoader-backed registry.
 *
 * @see lexicon.jdbc.dialect.Dialects
 */
package lexicon.jdbc.dialect;
