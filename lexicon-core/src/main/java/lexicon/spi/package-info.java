/**
 * Service provider interfaces implemented by the storage, queue and metrics modules.
 *
 * @see lexicon.spi.ConnectionProvider
 * @see lexicon.spi.MessageQueue
 * @see lexicon.spi.UserRepository
 * @see lexicon.spi.WordRepository
 * @see lexicon.spi.MetricsExporter
 */
package lexicon.spi;
