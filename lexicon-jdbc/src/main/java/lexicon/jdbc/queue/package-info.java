/**
 * Durable message queue backed by a database table, and the scheduler that purges
 * its acknowledged rows.
 */
package lexicon.jdbc.queue;
