package lexicon.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Map;
import java.util.Objects;

/**
 * {@link JsonCodec} backed by a Jackson {@link ObjectMapper}.
 */
public final class JacksonJsonCodec implements JsonCodec {
  static final JacksonJsonCodec INSTANCE = new JacksonJsonCodec(defaultMapper());

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final ObjectMapper mapper;

  public JacksonJsonCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  /**
   * Mapper configuration used by the default codec. Exposed so that callers
   * can derive a customized copy.
   */
  public static ObjectMapper defaultMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  @Override
  public String toJson(Object value) {
    try {
      return mapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot encode " + typeName(value) + " as JSON", e);
    }
  }

  @Override
  public <T> T fromJson(String json, Class<T> type) {
    Objects.requireNonNull(type, "type");
    if (json == null || json.isBlank()) {
      throw new IllegalArgumentException("Cannot decode empty JSON as " + type.getSimpleName());
    }
    try {
      T value = mapper.readValue(json, type);
      if (value == null) {
        throw new IllegalArgumentException("JSON null is not a valid " + type.getSimpleName());
      }
      return value;
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid " + type.getSimpleName() + " JSON: "
          + e.getOriginalMessage(), e);
    }
  }

  @Override
  public Map<String, Object> parseObject(String json) {
    if (json == null || json.isBlank()) {
      throw new IllegalArgumentException("Expected a JSON object but got empty input");
    }
    try {
      Map<String, Object> parsed = mapper.readValue(json, MAP_TYPE);
      if (parsed == null) {
        throw new IllegalArgumentException("Expected a JSON object but got null");
      }
      return parsed;
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Expected a JSON object: " + e.getOriginalMessage(), e);
    }
  }

  private static String typeName(Object value) {
    return value == null ? "null" : value.getClass().getSimpleName();
  }
}
