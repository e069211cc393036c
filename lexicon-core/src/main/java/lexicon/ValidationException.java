package lexicon;

/**
 * A message body or payload could not be decoded into a well-formed request.
 */
public final class ValidationException extends LexiconException {

  public ValidationException(String message) {
    super(message);
  }

  public ValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
