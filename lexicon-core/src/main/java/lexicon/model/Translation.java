package lexicon.model;

import java.util.Objects;

/**
 * One translation of a word together with its part of speech.
 */
public record Translation(String translation, String partOfSpeech) {

  public Translation {
    Objects.requireNonNull(translation, "translation");
    Objects.requireNonNull(partOfSpeech, "partOfSpeech");
  }
}
