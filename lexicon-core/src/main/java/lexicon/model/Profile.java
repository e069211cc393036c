package lexicon.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lexicon.util.LenientDateDeserializer;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Public profile of a user. One per user; the nickname is unique across all users.
 */
public record Profile(
    @JsonProperty(required = true) @JsonSetter(nulls = Nulls.FAIL) long userId,
    String nickname,
    String email,
    @JsonDeserialize(using = LenientDateDeserializer.class) LocalDate birthday,
    String gender,
    String intro,
    boolean dating,
    String status) {

  public static final String DEFAULT_STATUS = "rookie";

  public Profile {
    Objects.requireNonNull(nickname, "nickname");
    status = status == null || status.isBlank() ? DEFAULT_STATUS : status;
  }
}
