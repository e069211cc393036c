/**
 * Per-entity locking for writes that must not interleave, such as renaming a word
 * of a user.
 *
 * @see lexicon.lock.KeyedLocks
 */
package lexicon.lock;
