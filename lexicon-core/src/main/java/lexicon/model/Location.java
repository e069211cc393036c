package lexicon.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;

/**
 * Resolved location of a user. All fields except the user id are optional.
 *
 * @param timezone time zone name, {@code tzone} on the wire
 */
public record Location(
    @JsonProperty(required = true) @JsonSetter(nulls = Nulls.FAIL) long userId,
    String latitude,
    String longitude,
    String city,
    String country,
    @JsonProperty("tzone") String timezone) {
}
