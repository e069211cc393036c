package lexicon.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;

import java.util.List;
import java.util.Objects;

/**
 * Application-owned columns of a user row, as carried by {@code ADD_USER}.
 *
 * @param source acquisition channel, {@code camefrom} on the wire
 */
public record User(
    @JsonProperty(required = true) @JsonSetter(nulls = Nulls.FAIL) long userId,
    String username,
    String firstName,
    @JsonProperty("camefrom") String source,
    String language,
    int fluency,
    List<String> topics,
    String langCode) {

  public User {
    Objects.requireNonNull(firstName, "firstName");
    topics = topics == null ? List.of() : List.copyOf(topics);
  }
}
