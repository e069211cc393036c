package lexicon.model;

import java.util.List;

/**
 * Distinct words of one user that are due for review, sorted by text.
 */
public record DueWords(long userId, List<String> words) {

  public DueWords {
    words = List.copyOf(words);
  }
}
