/**
 * JSON codec, lenient date parsing and thread utilities.
 */
package lexicon.util;
