package lexicon.jdbc.dialect;

import java.util.List;

/**
 * H2 dialect. Used for tests and embedded runs.
 *
 * <p>Both upserts and duplicate-tolerant inserts are {@code MERGE INTO ... KEY (...)}:
 * with every column in the key, the update part of the merge changes nothing.
 */
public final class H2Dialect extends AbstractDialect {

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  protected String upsert(String table, List<String> columns, List<String> keys) {
    return "MERGE INTO " + table + " (" + columnList(columns) + ") KEY (" + columnList(keys) + ")"
        + " VALUES (" + placeholders(columns.size()) + ")";
  }

  @Override
  protected String insertIgnoring(String table, List<String> columns, List<String> keys) {
    return upsert(table, columns, keys);
  }
}
