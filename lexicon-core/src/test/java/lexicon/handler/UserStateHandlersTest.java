package lexicon.handler;

import lexicon.Envelope;
import lexicon.PaymentRequiredException;
import lexicon.Purpose;
import lexicon.ValidationException;
import lexicon.lock.KeyedLocks;
import lexicon.model.Payment;
import lexicon.model.TrialTerms;
import lexicon.registry.DefaultHandlerRegistry;
import lexicon.registry.HandlerRegistry;
import lexicon.util.JsonCodec;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class UserStateHandlersTest {
  private static final Instant NOW = Instant.parse("2024-04-01T08:00:00Z");
  private static final String USER_42 =
      "{\"user_id\":42,\"username\":\"ann\",\"first_name\":\"Ann\",\"camefrom\":\"ads\","
          + "\"language\":\"en\",\"fluency\":2,\"topics\":[\"travel\"],\"lang_code\":\"en\"}";

  private final InMemoryUserRepository users = new InMemoryUserRepository();
  private final RecordingWordRepository words = new RecordingWordRepository();
  private final UserStateHandlers handlers = new UserStateHandlers(users, words, JsonCodec.getDefault(),
      Clock.fixed(NOW, ZoneOffset.UTC), TrialTerms.DEFAULT, new KeyedLocks<>());

  @Test
  void registersAllFivePurposes() {
    HandlerRegistry registry = handlers.registerAll(DefaultHandlerRegistry.builder()).build();

    assertEquals(EnumSet.allOf(Purpose.class), registry.purposes());
  }

  @Test
  void newUserGetsTrialPayment() throws Exception {
    handlers.addUser(Envelope.of(Purpose.ADD_USER, USER_42));

    assertTrue(users.userExists(42));
    assertEquals(1, users.payments.size());
    Payment trial = users.payments.get(0);
    assertEquals(Payment.TRIAL_PERIOD, trial.period());
    assertEquals(new BigDecimal("199.00"), trial.amount());
    assertEquals("RUB", trial.currency());
    assertEquals(NOW.plus(Duration.ofDays(3)), trial.until());
    assertTrue(trial.trial());
    assertTrue(trial.active());
  }

  @Test
  void knownUserIsUpdatedWithoutSecondTrial() throws Exception {
    handlers.addUser(Envelope.of(Purpose.ADD_USER, USER_42));
    handlers.addUser(Envelope.of(Purpose.ADD_USER, USER_42.replace("\"fluency\":2", "\"fluency\":3")));

    assertEquals(3, users.users.get(42L).fluency());
    assertEquals(1, users.payments.size());
  }

  @Test
  void concurrentRegistrationsOpenOneTrial() throws Exception {
    int threads = 8;
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    try {
      List<Future<Object>> futures = new java.util.ArrayList<>();
      for (int i = 0; i < threads; i++) {
        futures.add(pool.submit(() -> {
          start.await();
          handlers.addUser(Envelope.of(Purpose.ADD_USER, USER_42));
          return null;
        }));
      }
      start.countDown();
      for (Future<Object> f : futures) {
        f.get(10, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    assertEquals(1, users.payments.size());
  }

  @Test
  void profileAndLocationAreUpserted() {
    handlers.addProfile(Envelope.of(Purpose.ADD_PROFILE,
        "{\"user_id\":42,\"nickname\":\"annie\",\"birthday\":\"01-02-2000\"}"));
    handlers.addLocation(Envelope.of(Purpose.ADD_LOCATION,
        "{\"user_id\":42,\"city\":\"Riga\",\"country\":\"Latvia\",\"tzone\":\"Europe/Riga\"}"));

    assertTrue(users.profileExists(42));
    assertEquals("Europe/Riga", users.locations.get(42L).timezone());
    assertEquals("Riga", users.getLocation(42).orElseThrow().city());
  }

  @Test
  void wordOfInactiveUserIsRejected() {
    assertThrows(PaymentRequiredException.class, () -> handlers.addWord(Envelope.of(Purpose.ADD_WORD,
        "{\"user_id\":9,\"word\":\"cat\",\"is_public\":false}")));
  }

  @Test
  void wordOfActiveUserIsAdded() {
    words.activeUsers.add(9L);

    handlers.addWord(Envelope.of(Purpose.ADD_WORD,
        "{\"user_id\":9,\"word\":\"cat\",\"is_public\":false,"
            + "\"translations\":[{\"translation\":\"кошка\",\"part_of_speech\":\"noun\"}],\"context\":\"a cat sat\"}"));

    assertTrue(words.wordExists(9, "cat"));
    assertEquals("noun", words.added.get(0).translations().get(0).partOfSpeech());
  }

  @Test
  void paymentAcceptsLocalDateTimeUntil() {
    handlers.createPayment(Envelope.of(Purpose.CREATE_PAYMENT_PURPOSE,
        "{\"user_id\":42,\"amount\":499.00,\"period\":\"month\",\"trial\":false,\"is_active\":true,"
            + "\"until\":\"2024-05-01T08:00:00\",\"currency\":\"RUB\"}"));

    assertEquals(Instant.parse("2024-05-01T08:00:00Z"), users.payments.get(0).until());
  }

  @Test
  void invalidPayloadIsValidationError() {
    ValidationException e = assertThrows(ValidationException.class,
        () -> handlers.addUser(Envelope.of(Purpose.ADD_USER, "{\"user_id\":42}")));
    assertTrue(e.getMessage().contains("ADD_USER"));
    assertFalse(users.userExists(42));
  }

  @Test
  void userWithoutIdIsRejectedBeforeAnyWrite() {
    String noId = "{\"username\":\"a\",\"first_name\":\"A\",\"camefrom\":\"ads\",\"language\":\"en\"}";

    ValidationException e = assertThrows(ValidationException.class,
        () -> handlers.addUser(Envelope.of(Purpose.ADD_USER, noId)));
    assertTrue(e.getMessage().contains("user_id"), e.getMessage());
    assertTrue(users.users.isEmpty());
    assertTrue(users.payments.isEmpty());
  }

  @Test
  void everyPayloadRequiresUserId() {
    assertThrows(ValidationException.class, () -> handlers.addUser(Envelope.of(Purpose.ADD_USER,
        USER_42.replace("\"user_id\":42", "\"user_id\":null"))));
    assertThrows(ValidationException.class, () -> handlers.addProfile(Envelope.of(Purpose.ADD_PROFILE,
        "{\"user_id\":null,\"nickname\":\"annie\"}")));
    assertThrows(ValidationException.class, () -> handlers.addLocation(Envelope.of(Purpose.ADD_LOCATION,
        "{\"city\":\"Riga\"}")));
    assertThrows(ValidationException.class, () -> handlers.addWord(Envelope.of(Purpose.ADD_WORD,
        "{\"word\":\"cat\",\"is_public\":false}")));
    assertThrows(ValidationException.class, () -> handlers.createPayment(Envelope.of(Purpose.CREATE_PAYMENT_PURPOSE,
        "{\"amount\":499.00,\"period\":\"month\",\"until\":\"2024-05-01T08:00:00\",\"currency\":\"RUB\"}")));

    assertTrue(users.users.isEmpty());
    assertTrue(users.payments.isEmpty());
    assertTrue(users.profiles.isEmpty());
    assertTrue(users.locations.isEmpty());
    assertTrue(words.added.isEmpty());
  }
}
