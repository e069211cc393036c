package lexicon.model;

import java.time.Instant;
import java.util.List;

/**
 * A stored word as seen by its owner, with its translations and optional children.
 */
public record WordEntry(
    long id,
    long userId,
    String nickname,
    String word,
    boolean isPublic,
    WordState state,
    Instant createdAt,
    String context,
    String audio,
    List<Translation> translations) {

  public WordEntry {
    translations = translations == null ? List.of() : List.copyOf(translations);
  }
}
