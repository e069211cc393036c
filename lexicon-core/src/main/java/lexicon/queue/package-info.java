/**
 * Queue implementations that need no external store.
 */
package lexicon.queue;
