/**
 * Domain records of learners, their words and subscriptions, and the
 * {@linkplain lexicon.model.WordState review ladder} of a word.
 */
package lexicon.model;
