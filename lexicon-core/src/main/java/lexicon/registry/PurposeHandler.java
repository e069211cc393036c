package lexicon.registry;

import lexicon.Envelope;

/**
 * Applies the side effects of one purpose.
 *
 * <p>Handlers are invoked by consumer worker threads and must be thread-safe.
 * Any exception is logged by the consumer and the message is acknowledged anyway.
 *
 * @see HandlerRegistry
 */
@FunctionalInterface
public interface PurposeHandler {

  /**
   * Handles one envelope.
   *
   * @param envelope the decoded envelope, whose purpose is the one this handler was registered for
   * @throws Exception if handling fails
   */
  void handle(Envelope envelope) throws Exception;
}
