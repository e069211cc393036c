/**
 * Built-in handlers that turn user-state envelopes into repository writes.
 */
package lexicon.handler;
