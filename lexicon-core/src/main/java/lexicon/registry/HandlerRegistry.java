package lexicon.registry;

import lexicon.Purpose;

import java.util.Set;

/**
 * Lookup of the handler for a purpose tag.
 *
 * @see DefaultHandlerRegistry
 */
public interface HandlerRegistry {

  /**
   * Returns the handler registered for a wire tag.
   *
   * @param purposeTag the raw tag from the envelope
   * @return the handler, or {@code null} if the tag is unknown or has no handler
   */
  PurposeHandler handlerFor(String purposeTag);

  /**
   * Purposes that have a handler.
   */
  Set<Purpose> purposes();
}
