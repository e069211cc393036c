package lexicon.spring.boot;

import lexicon.Envelope;
import lexicon.Purpose;
import lexicon.registry.DefaultHandlerRegistry;
import lexicon.registry.PurposeHandler;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.*;

class PurposeListenerRegistrarTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner();

  @Test
  void registersAnnotatedHandlers() {
    runner.withUserConfiguration(WordAndLocationConfig.class).run(ctx -> {
      var registry = ctx.getBean(DefaultHandlerRegistry.class);
      assertInstanceOf(WordListener.class, registry.handlerFor("ADD_WORD"));
      assertInstanceOf(LocationListener.class, registry.handlerFor("ADD_LOCATION"));
      assertNull(registry.handlerFor("ADD_USER"));
    });
  }

  @Test
  void emptyWithoutListeners() {
    runner.withUserConfiguration(BaseConfig.class).run(ctx -> {
      assertTrue(ctx.getBean(DefaultHandlerRegistry.class).purposes().isEmpty());
    });
  }

  @Test
  void failsWhenBeanIsNotAHandler() {
    runner.withUserConfiguration(NotAHandlerConfig.class).run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure());
    });
  }

  @Test
  void failsOnDuplicatePurpose() {
    runner.withUserConfiguration(DuplicateConfig.class).run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      Throwable cause = ctx.getStartupFailure();
      while (cause.getCause() != null) {
        cause = cause.getCause();
      }
      assertInstanceOf(IllegalStateException.class, cause);
      assertEquals("Duplicate handler for purpose ADD_WORD", cause.getMessage());
    });
  }

  // ── Test support ─────────────────────────────────────────────

  @PurposeListener(Purpose.ADD_WORD)
  static class WordListener implements PurposeHandler {
    @Override
    public void handle(Envelope envelope) {}
  }

  @PurposeListener(Purpose.ADD_WORD)
  static class SecondWordListener implements PurposeHandler {
    @Override
    public void handle(Envelope envelope) {}
  }

  @PurposeListener(Purpose.ADD_LOCATION)
  static class LocationListener implements PurposeHandler {
    @Override
    public void handle(Envelope envelope) {}
  }

  @PurposeListener(Purpose.ADD_PROFILE)
  static class NotAHandler {
    // Does NOT implement PurposeHandler
  }

  @Configuration
  static class BaseConfig {
    @Bean
    PurposeListenerRegistrar registrar(ListableBeanFactory beanFactory) {
      return new PurposeListenerRegistrar(beanFactory);
    }

    @Bean
    DefaultHandlerRegistry handlerRegistry(PurposeListenerRegistrar registrar) {
      return registrar.registerAll(DefaultHandlerRegistry.builder()).build();
    }
  }

  @Configuration
  static class WordAndLocationConfig extends BaseConfig {
    @Bean
    WordListener wordListener() {
      return new WordListener();
    }

    @Bean
    LocationListener locationListener() {
      return new LocationListener();
    }
  }

  @Configuration
  static class NotAHandlerConfig extends BaseConfig {
    @Bean
    NotAHandler notAHandler() {
      return new NotAHandler();
    }
  }

  @Configuration
  static class DuplicateConfig extends BaseConfig {
    @Bean
    WordListener wordListener() {
      return new WordListener();
    }

    @Bean
    SecondWordListener secondWordListener() {
      return new SecondWordListener();
    }
  }
}
