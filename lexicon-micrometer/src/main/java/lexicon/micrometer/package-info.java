/**
 * Micrometer bridge for {@link lexicon.spi.MetricsExporter}.
 */
package lexicon.micrometer;
