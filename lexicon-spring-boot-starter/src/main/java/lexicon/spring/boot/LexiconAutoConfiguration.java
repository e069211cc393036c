package lexicon.spring.boot;

import lexicon.EnvelopeCodec;
import lexicon.consumer.MessageConsumer;
import lexicon.handler.UserStateHandlers;
import lexicon.jdbc.TableNames;
import lexicon.jdbc.dialect.Dialects;
import lexicon.jdbc.pool.ConnectionPool;
import lexicon.jdbc.queue.AckedMessagePurgeScheduler;
import lexicon.jdbc.queue.JdbcMessageQueue;
import lexicon.jdbc.repo.JdbcUserRepository;
import lexicon.jdbc.repo.JdbcWordRepository;
import lexicon.jdbc.spi.Dialect;
import lexicon.lock.KeyedLocks;
import lexicon.publisher.EventPublisher;
import lexicon.queue.InMemoryMessageQueue;
import lexicon.registry.DefaultHandlerRegistry;
import lexicon.registry.HandlerRegistry;
import lexicon.spi.ConnectionProvider;
import lexicon.spi.MessageQueue;
import lexicon.spi.MetricsExporter;
import lexicon.spi.UserRepository;
import lexicon.spi.WordRepository;
import lexicon.util.JsonCodec;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Auto-configuration for the lexicon service.
 *
 * <p>Connections come from the application's {@link DataSource} when there is one,
 * otherwise from a {@link ConnectionPool} opened from {@code lexicon.pool.*}. On top
 * of that it wires the dialect, schema, repositories, message queue, publisher,
 * handler registry and consumer.
 *
 * @see LexiconProperties
 * @see LexiconMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(JdbcUserRepository.class)
@EnableConfigurationProperties(LexiconProperties.class)
public class LexiconAutoConfiguration {

  @Bean
  @ConditionalOnBean(DataSource.class)
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public ConnectionProvider lexiconConnectionProvider(DataSource dataSource) {
    return dataSource::getConnection;
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean({ConnectionProvider.class, DataSource.class})
  @ConditionalOnProperty(prefix = "lexicon.pool", name = "url")
  public ConnectionPool lexiconConnectionPool(LexiconProperties props) {
    return ConnectionPool.create(props.getPool().toSettings());
  }

  @Bean
  @ConditionalOnMissingBean
  public Dialect lexiconDialect(LexiconProperties props, ConnectionProvider connections) {
    return Dialects.resolve(props.getSchema().getDialect(), connections);
  }

  @Bean
  @ConditionalOnMissingBean
  public TableNames lexiconTableNames(LexiconProperties props) {
    return TableNames.DEFAULT.withProfiles(props.getTables().getProfiles());
  }

  @Bean
  @ConditionalOnMissingBean
  public JsonCodec lexiconJsonCodec() {
    return JsonCodec.getDefault();
  }

  @Bean
  @ConditionalOnMissingBean(name = "lexiconUserLocks")
  public KeyedLocks<Long> lexiconUserLocks() {
    return new KeyedLocks<>();
  }

  @Bean
  @ConditionalOnProperty(prefix = "lexicon.schema", name = "initialize", matchIfMissing = true)
  public LexiconSchemaInitializer lexiconSchemaInitializer(ConnectionProvider connections,
      Dialect dialect, TableNames tables) {
    return new LexiconSchemaInitializer(connections, dialect, tables);
  }

  @Bean
  @ConditionalOnMissingBean
  public UserRepository lexiconUserRepository(ConnectionProvider connections, Dialect dialect,
      TableNames tables, JsonCodec json, ObjectProvider<Clock> clock,
      ObjectProvider<LexiconSchemaInitializer> schema) {
    schema.ifAvailable(LexiconSchemaInitializer::ensureCreated);
    return new JdbcUserRepository(connections, dialect, tables, json, clock.getIfAvailable(Clock::systemUTC));
  }

  @Bean
  @ConditionalOnMissingBean
  public WordRepository lexiconWordRepository(ConnectionProvider connections, Dialect dialect,
      TableNames tables, ObjectProvider<Clock> clock, KeyedLocks<Long> lexiconUserLocks,
      ObjectProvider<LexiconSchemaInitializer> schema) {
    schema.ifAvailable(LexiconSchemaInitializer::ensureCreated);
    return new JdbcWordRepository(connections, dialect, tables, clock.getIfAvailable(Clock::systemUTC),
        lexiconUserLocks);
  }

  @Bean
  @ConditionalOnMissingBean
  public MessageQueue lexiconMessageQueue(LexiconProperties props, ObjectProvider<ConnectionProvider> connections,
      ObjectProvider<Dialect> dialect, TableNames tables, ObjectProvider<Clock> clock,
      ObjectProvider<LexiconSchemaInitializer> schema) {
    LexiconProperties.Queue queue = props.getQueue();
    Clock queueClock = clock.getIfAvailable(Clock::systemUTC);
    return switch (queue.getType()) {
      case IN_MEMORY -> new InMemoryMessageQueue(queue.getCapacity(), queueClock);
      case JDBC -> {
        schema.ifAvailable(LexiconSchemaInitializer::ensureCreated);
        yield new JdbcMessageQueue(connections.getObject(), dialect.getObject(), tables, queueClock,
            queue.getPollInterval());
      }
    };
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "lexicon.queue.purge", name = "enabled", havingValue = "true")
  public AckedMessagePurgeScheduler lexiconPurgeScheduler(MessageQueue queue, LexiconProperties props) {
    if (!(queue instanceof JdbcMessageQueue jdbcQueue)) {
      throw new IllegalStateException("lexicon.queue.purge requires the JDBC queue, but the queue is "
          + queue.getClass().getName());
    }
    LexiconProperties.Purge purge = props.getQueue().getPurge();
    AckedMessagePurgeScheduler scheduler = AckedMessagePurgeScheduler.builder()
        .queue(jdbcQueue)
        .retention(purge.getRetention())
        .intervalSeconds(purge.getIntervalSeconds())
        .build();
    scheduler.start();
    return scheduler;
  }

  @Bean
  @ConditionalOnMissingBean
  public EventPublisher lexiconEventPublisher(MessageQueue queue, JsonCodec json,
      ObjectProvider<MetricsExporter> metricsProvider) {
    return new EventPublisher(queue, json, metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP));
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "lexicon.consumer", name = "builtin-handlers", matchIfMissing = true)
  public UserStateHandlers lexiconUserStateHandlers(UserRepository users, WordRepository words,
      JsonCodec json, ObjectProvider<Clock> clock, KeyedLocks<Long> lexiconUserLocks, LexiconProperties props) {
    return new UserStateHandlers(users, words, json, clock.getIfAvailable(Clock::systemUTC),
        props.getTrial().toTerms(), lexiconUserLocks);
  }

  @Bean
  @ConditionalOnMissingBean
  public PurposeListenerRegistrar purposeListenerRegistrar(ListableBeanFactory beanFactory) {
    return new PurposeListenerRegistrar(beanFactory);
  }

  @Bean
  @ConditionalOnMissingBean(HandlerRegistry.class)
  public DefaultHandlerRegistry lexiconHandlerRegistry(ObjectProvider<UserStateHandlers> builtins,
      PurposeListenerRegistrar registrar) {
    DefaultHandlerRegistry.Builder builder = DefaultHandlerRegistry.builder();
    builtins.ifAvailable(handlers -> handlers.registerAll(builder));
    return registrar.registerAll(builder).build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "lexicon.consumer", name = "enabled", matchIfMissing = true)
  public MessageConsumer lexiconMessageConsumer(MessageQueue queue, HandlerRegistry registry,
      JsonCodec json, ObjectProvider<MetricsExporter> metricsProvider, LexiconProperties props) {
    LexiconProperties.Consumer consumer = props.getConsumer();
    return MessageConsumer.builder()
        .queue(queue)
        .registry(registry)
        .codec(new EnvelopeCodec(json))
        .metrics(metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP))
        .workerCount(consumer.getWorkerCount())
        .pollTimeout(consumer.getPollTimeout())
        .drainTimeoutMs(consumer.getDrainTimeoutMs())
        .build();
  }
}
