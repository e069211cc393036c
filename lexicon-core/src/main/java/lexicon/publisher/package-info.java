/**
 * Producer side of the pipeline.
 */
package lexicon.publisher;
