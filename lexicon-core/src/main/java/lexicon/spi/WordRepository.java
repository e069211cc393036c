package lexicon.spi;

import lexicon.model.DueWords;
import lexicon.model.NewWord;
import lexicon.model.PublicWord;
import lexicon.model.WordEntry;
import lexicon.model.WordState;
import lexicon.model.WordStats;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Reads and writes of words and their translations, contexts and audio.
 *
 * @see UserRepository
 */
public interface WordRepository {

  /**
   * Adds a word and then, one by one, its translations, context and audio.
   *
   * <p>The child rows are not written in the word's transaction: if one of them
   * fails the word stays committed and the remaining children are missing.
   *
   * @return the generated word id
   * @throws lexicon.PaymentRequiredException if the owner is missing or inactive
   * @throws lexicon.ConflictException        if the user already has this word
   */
  long addWord(NewWord word);

  boolean wordExists(long userId, String word);

  /**
   * All words of a user ordered by word text.
   */
  List<WordEntry> queryWordsByUser(long userId);

  Optional<WordEntry> findWord(long userId, String word);

  /**
   * Public entries of {@code word} from users that have a nickname.
   */
  List<PublicWord> searchPublicWord(String word);

  /**
   * Deletes a word of a user together with its children.
   *
   * @return {@code true} if the word existed
   */
  boolean deleteWord(long userId, long wordId);

  /**
   * Moves a word to a new text in one transaction, serialized per user.
   * Translations, context, audio, visibility, state and creation time move with it.
   * If the user already has {@code newWord}, the old word is merged into it.
   *
   * @return {@code false} if the user has no {@code oldWord}
   */
  boolean renameWord(long userId, String oldWord, String newWord);

  /**
   * Applies one review outcome to a word.
   *
   * @return the new state, or empty if the user has no such word
   */
  Optional<WordState> reviewOutcome(long userId, String word, boolean correct);

  /**
   * Per user, the distinct non-learned words old enough to be reviewed again.
   */
  List<DueWords> dueForReview();

  /**
   * Promotes NEW words of the user with {@code nickname} that occur in
   * {@code message} (case-insensitive, whitespace-separated) to REPEATED.
   *
   * @return number of words promoted
   */
  int markRepeated(String nickname, String message);

  WordStats getUserStats(long userId);

  /**
   * Number of words the user added within the last {@code window}.
   */
  long countWordsSince(long userId, Duration window);
}
