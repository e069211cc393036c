package lexicon.model;

/**
 * Per-part-of-speech word counts of a user. Missing categories count as zero.
 */
public record WordStats(long nouns, long verbs, long adjectives, long adverbs, long others) {

  public static final WordStats EMPTY = new WordStats(0, 0, 0, 0, 0);

  public long total() {
    return nouns + verbs + adjectives + adverbs + others;
  }
}
