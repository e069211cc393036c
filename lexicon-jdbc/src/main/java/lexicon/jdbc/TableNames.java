package lexicon.jdbc;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Physical table names. Every name is validated as a plain SQL identifier because
 * it is concatenated into statements.
 *
 * <p>Deployments differ only in the profiles table, hence {@link #withProfiles(String)}.
 */
public record TableNames(
    String users,
    String profiles,
    String locations,
    String words,
    String translations,
    String contexts,
    String audios,
    String payments,
    String messageQueue) {

  public static final TableNames DEFAULT = new TableNames(
      "users", "profiles", "locations", "words", "translations",
      "contexts", "audios", "payments", "message_queue");

  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  public TableNames {
    validate(users);
    validate(profiles);
    validate(locations);
    validate(words);
    validate(translations);
    validate(contexts);
    validate(audios);
    validate(payments);
    validate(messageQueue);
  }

  public TableNames withProfiles(String profiles) {
    return new TableNames(users, profiles, locations, words, translations, contexts, audios, payments,
        messageQueue);
  }

  /**
   * Placeholder values for schema scripts: {@code ${users}}, {@code ${profiles}}, ...
   */
  public Map<String, String> placeholders() {
    Map<String, String> values = new LinkedHashMap<>();
    values.put("users", users);
    values.put("profiles", profiles);
    values.put("locations", locations);
    values.put("words", words);
    values.put("translations", translations);
    values.put("contexts", contexts);
    values.put("audios", audios);
    values.put("payments", payments);
    values.put("message_queue", messageQueue);
    return values;
  }

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
