package lexicon.util;

import java.util.Map;

/**
 * Codec between JSON text and Java values used for envelopes and payloads.
 *
 * <p>The default implementation ({@link JacksonJsonCodec}) uses snake_case property
 * names, ISO-8601 dates and ignores unknown properties, matching the wire format
 * written by {@link lexicon.publisher.EventPublisher}.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

  /**
   * Returns the default singleton implementation.
   *
   * @return the default {@link JsonCodec}
   */
  static JsonCodec getDefault() {
    return JacksonJsonCodec.INSTANCE;
  }

  /**
   * Encodes a value (record, map, list or scalar) as JSON text.
   *
   * @param value the value to encode
   * @return JSON text
   * @throws IllegalArgumentException if the value cannot be serialized
   */
  String toJson(Object value);

  /**
   * Decodes JSON text into an instance of {@code type}.
   *
   * @param json the JSON text
   * @param type target type
   * @return the decoded value, never {@code null}
   * @throws IllegalArgumentException if the text is not valid JSON for {@code type}
   */
  <T> T fromJson(String json, Class<T> type);

  /**
   * Parses a JSON object into a map of plain Java values (strings, numbers,
   * booleans, lists, nested maps).
   *
   * @param json the JSON text
   * @return the parsed object (never {@code null})
   * @throws IllegalArgumentException if the input is not a JSON object
   */
  Map<String, Object> parseObject(String json);
}
