package lexicon.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;

import java.util.List;
import java.util.Objects;

/**
 * A word a user wants to add to their dictionary, with optional children.
 *
 * @param context an example sentence, may be {@code null}
 * @param audio   URL of a pronunciation recording, may be {@code null}
 */
public record NewWord(
    @JsonProperty(required = true) @JsonSetter(nulls = Nulls.FAIL) long userId,
    String word,
    @JsonProperty("is_public") boolean isPublic,
    List<Translation> translations,
    String context,
    String audio) {

  public NewWord {
    Objects.requireNonNull(word, "word");
    if (word.isBlank()) {
      throw new IllegalArgumentException("word must not be blank");
    }
    translations = translations == null ? List.of() : List.copyOf(translations);
  }
}
