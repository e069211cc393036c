package lexicon.jdbc;

import lexicon.LexiconException;

/**
 * Unchecked exception wrapping JDBC errors that are neither a conflict nor a
 * connectivity failure.
 *
 * @see SqlErrors
 */
public final class StoreException extends LexiconException {
  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
