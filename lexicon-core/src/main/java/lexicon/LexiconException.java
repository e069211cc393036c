package lexicon;

/**
 * Base type for the error taxonomy surfaced by lexicon operations.
 *
 * <p>All subclasses are unchecked. Errors raised inside a message handler are
 * caught at the {@link lexicon.consumer.MessageConsumer} boundary; errors raised by
 * synchronous repository calls propagate to the caller.
 *
 * @see ConnectivityException
 * @see ConflictException
 * @see PaymentRequiredException
 * @see ValidationException
 */
public abstract class LexiconException extends RuntimeException {

  protected LexiconException(String message) {
    super(message);
  }

  protected LexiconException(String message, Throwable cause) {
    super(message, cause);
  }
}
