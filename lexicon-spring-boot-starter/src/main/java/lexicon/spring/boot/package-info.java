/**
 * Spring Boot auto-configuration for the lexicon service.
 *
 * <p>Add the starter next to a JDBC driver and either a Spring {@code DataSource} or
 * {@code lexicon.pool.url}. Handlers beyond the built-in user-state ones are contributed
 * with {@link lexicon.spring.boot.PurposeListener}.
 */
package lexicon.spring.boot;
