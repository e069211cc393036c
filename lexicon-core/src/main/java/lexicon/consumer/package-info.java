/**
 * Queue consumption: worker threads receive envelopes, dispatch them by purpose
 * and acknowledge every message once it has been handled or dropped.
 *
 * @see lexicon.consumer.MessageConsumer
 */
package lexicon.consumer;
