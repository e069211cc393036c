package lexicon;

/**
 * The store could not be reached, or no pooled connection became available
 * within the acquisition timeout. Transient; never retried internally.
 */
public final class ConnectivityException extends LexiconException {

  public ConnectivityException(String message, Throwable cause) {
    super(message, cause);
  }
}
