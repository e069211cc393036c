package lexicon;

/**
 * A unique constraint rejected the write, e.g. a duplicate word for the same
 * user or a nickname already taken by another user.
 */
public final class ConflictException extends LexiconException {

  public ConflictException(String message) {
    super(message);
  }

  public ConflictException(String message, Throwable cause) {
    super(message, cause);
  }
}
