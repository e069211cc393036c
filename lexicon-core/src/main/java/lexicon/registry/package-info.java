/**
 * Routing of envelopes to handlers by purpose tag.
 *
 * <p>Each purpose maps to at most one {@link lexicon.registry.PurposeHandler}.
 * Envelopes whose tag has no handler are logged and acknowledged without side effects.
 *
 * @see lexicon.registry.HandlerRegistry
 * @see lexicon.registry.DefaultHandlerRegistry
 */
package lexicon.registry;
