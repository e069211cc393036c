package lexicon.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class LexiconPropertiesTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(PropsConfig.class);

  @Test
  void defaultValues() {
    runner.run(ctx -> {
      var props = ctx.getBean(LexiconProperties.class);
      assertNull(props.getPool().getUrl());
      assertEquals(5, props.getPool().getMinSize());
      assertEquals(20, props.getPool().getMaxSize());
      assertEquals(Duration.ofSeconds(60), props.getPool().getAcquireTimeout());
      assertTrue(props.getConsumer().isEnabled());
      assertTrue(props.getConsumer().isBuiltinHandlers());
      assertEquals(4, props.getConsumer().getWorkerCount());
      assertEquals(Duration.ofMillis(500), props.getConsumer().getPollTimeout());
      assertEquals(5000, props.getConsumer().getDrainTimeoutMs());
      assertEquals(LexiconProperties.QueueType.JDBC, props.getQueue().getType());
      assertEquals(Duration.ofMillis(50), props.getQueue().getPollInterval());
      assertFalse(props.getQueue().getPurge().isEnabled());
      assertEquals(Duration.ofDays(7), props.getQueue().getPurge().getRetention());
      assertTrue(props.getSchema().isInitialize());
      assertEquals("profiles", props.getTables().getProfiles());
      assertEquals(new BigDecimal("199.00"), props.getTrial().getAmount());
      assertEquals("RUB", props.getTrial().getCurrency());
      assertEquals(Duration.ofDays(3), props.getTrial().getLength());
      assertTrue(props.getMetrics().isEnabled());
      assertEquals("lexicon", props.getMetrics().getNamePrefix());
    });
  }

  @Test
  void customValues() {
    runner.withPropertyValues(
        "lexicon.pool.url=jdbc:postgresql://db/lexicon",
        "lexicon.pool.username=bot",
        "lexicon.pool.max-size=50",
        "lexicon.pool.acquire-timeout=10s",
        "lexicon.consumer.worker-count=8",
        "lexicon.consumer.builtin-handlers=false",
        "lexicon.queue.type=in-memory",
        "lexicon.queue.capacity=100",
        "lexicon.queue.purge.enabled=true",
        "lexicon.queue.purge.interval-seconds=60",
        "lexicon.schema.initialize=false",
        "lexicon.tables.profiles=bot_profiles",
        "lexicon.trial.amount=0",
        "lexicon.trial.length=P14D",
        "lexicon.metrics.name-prefix=bot").run(ctx -> {
      var props = ctx.getBean(LexiconProperties.class);
      assertEquals("jdbc:postgresql://db/lexicon", props.getPool().getUrl());
      assertEquals("bot", props.getPool().getUsername());
      assertEquals(50, props.getPool().getMaxSize());
      assertEquals(Duration.ofSeconds(10), props.getPool().getAcquireTimeout());
      assertEquals(8, props.getConsumer().getWorkerCount());
      assertFalse(props.getConsumer().isBuiltinHandlers());
      assertEquals(LexiconProperties.QueueType.IN_MEMORY, props.getQueue().getType());
      assertEquals(100, props.getQueue().getCapacity());
      assertTrue(props.getQueue().getPurge().isEnabled());
      assertEquals(60, props.getQueue().getPurge().getIntervalSeconds());
      assertFalse(props.getSchema().isInitialize());
      assertEquals("bot_profiles", props.getTables().getProfiles());
      assertEquals(0, BigDecimal.ZERO.compareTo(props.getTrial().getAmount()));
      assertEquals(Duration.ofDays(14), props.getTrial().getLength());
      assertEquals("bot", props.getMetrics().getNamePrefix());
    });
  }

  @Test
  void poolSettingsAreValidated() {
    var pool = new LexiconProperties.Pool();
    pool.setUrl("jdbc:h2:mem:x");
    pool.setMinSize(30);
    assertThrows(IllegalArgumentException.class, pool::toSettings);
  }

  @Configuration
  @EnableConfigurationProperties(LexiconProperties.class)
  static class PropsConfig {
  }
}
