package lexicon.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import lexicon.micrometer.MicrometerMetricsExporter;
import lexicon.spi.MessageQueue;
import lexicon.spi.MetricsExporter;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath
 * and {@code lexicon.metrics.enabled} is true (default). Once all singletons exist,
 * the exporter also gauges the queue's un-acknowledged count.
 *
 * <p>Runs before {@link LexiconAutoConfiguration} so the {@link MetricsExporter}
 * bean is available to the publisher and consumer.
 */
@AutoConfiguration(before = LexiconAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "lexicon.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(LexiconProperties.class)
public class LexiconMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, LexiconProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }

  @Bean
  @ConditionalOnBean(MicrometerMetricsExporter.class)
  public SmartInitializingSingleton lexiconQueueGauge(MicrometerMetricsExporter exporter,
      ObjectProvider<MessageQueue> queue) {
    return () -> queue.ifAvailable(exporter::monitor);
  }
}
