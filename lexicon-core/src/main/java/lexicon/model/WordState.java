package lexicon.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Review ladder of a learned word: {@code NEW -> REPEATED -> REINFORCED -> LEARNED}.
 *
 * <p>A correct answer climbs one rung, an incorrect one drops one rung. {@link #LEARNED}
 * is the ceiling and {@link #NEW} the floor; no transition ever skips a rung.
 */
public enum WordState {
  NEW(Duration.ofDays(1)),
  REPEATED(Duration.ofDays(5)),
  REINFORCED(Duration.ofDays(14)),
  LEARNED(null);

  private final Duration reviewAfter;

  WordState(Duration reviewAfter) {
    this.reviewAfter = reviewAfter;
  }

  /**
   * Returns the state reached after one review outcome.
   *
   * @param correct whether the learner answered correctly
   * @return the neighbouring rung, or this state at the ceiling/floor
   */
  public WordState next(boolean correct) {
    int target = correct ? ordinal() + 1 : ordinal() - 1;
    WordState[] ladder = values();
    if (target < 0 || target >= ladder.length) {
      return this;
    }
    return ladder[target];
  }

  /**
   * Age a word in this state must reach before it is due for review again.
   * Empty for {@link #LEARNED}, which is never due.
   */
  public Optional<Duration> reviewAfter() {
    return Optional.ofNullable(reviewAfter);
  }

  /**
   * Whether a word created at {@code createdAt} is due for review at {@code now}.
   * The threshold is inclusive.
   */
  public boolean isDue(Instant createdAt, Instant now) {
    if (reviewAfter == null) {
      return false;
    }
    return !Duration.between(createdAt, now).minus(reviewAfter).isNegative();
  }

  /**
   * Latest creation instant that is due at {@code now}, i.e. {@code now - reviewAfter}.
   */
  public Optional<Instant> dueCutoff(Instant now) {
    return reviewAfter().map(now::minus);
  }
}
