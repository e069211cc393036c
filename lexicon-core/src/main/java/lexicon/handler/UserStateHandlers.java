package lexicon.handler;

import lexicon.Envelope;
import lexicon.Purpose;
import lexicon.ValidationException;
import lexicon.lock.KeyedLocks;
import lexicon.model.Location;
import lexicon.model.NewWord;
import lexicon.model.Payment;
import lexicon.model.Profile;
import lexicon.model.TrialTerms;
import lexicon.model.User;
import lexicon.registry.DefaultHandlerRegistry;
import lexicon.registry.PurposeHandler;
import lexicon.spi.UserRepository;
import lexicon.spi.WordRepository;
import lexicon.util.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * The built-in handlers for the five user-state purposes.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * UserStateHandlers handlers = new UserStateHandlers(users, words);
 * HandlerRegistry registry = handlers.registerAll(DefaultHandlerRegistry.builder()).build();
 * }</pre>
 *
 * <p>{@code ADD_USER} is serialized per user id so that two concurrent registrations
 * of the same user open a single trial.
 */
public final class UserStateHandlers {
  private static final Logger log = LoggerFactory.getLogger(UserStateHandlers.class);

  private final UserRepository users;
  private final WordRepository words;
  private final JsonCodec json;
  private final Clock clock;
  private final TrialTerms trialTerms;
  private final KeyedLocks<Long> userLocks;

  public UserStateHandlers(UserRepository users, WordRepository words) {
    this(users, words, JsonCodec.getDefault(), Clock.systemUTC(), TrialTerms.DEFAULT, new KeyedLocks<>());
  }

  public UserStateHandlers(UserRepository users, WordRepository words, JsonCodec json,
      Clock clock, TrialTerms trialTerms, KeyedLocks<Long> userLocks) {
    this.users = Objects.requireNonNull(users, "users");
    this.words = Objects.requireNonNull(words, "words");
    this.json = Objects.requireNonNull(json, "json");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.trialTerms = Objects.requireNonNull(trialTerms, "trialTerms");
    this.userLocks = Objects.requireNonNull(userLocks, "userLocks");
  }

  /**
   * Handlers keyed by the purpose they serve.
   */
  public Map<Purpose, PurposeHandler> handlers() {
    Map<Purpose, PurposeHandler> handlers = new EnumMap<>(Purpose.class);
    handlers.put(Purpose.ADD_USER, this::addUser);
    handlers.put(Purpose.ADD_PROFILE, this::addProfile);
    handlers.put(Purpose.ADD_LOCATION, this::addLocation);
    handlers.put(Purpose.ADD_WORD, this::addWord);
    handlers.put(Purpose.CREATE_PAYMENT_PURPOSE, this::createPayment);
    return Collections.unmodifiableMap(handlers);
  }

  /**
   * Registers all built-in handlers with {@code builder}.
   *
   * @throws IllegalStateException if the builder already has a handler for one of the purposes
   */
  public DefaultHandlerRegistry.Builder registerAll(DefaultHandlerRegistry.Builder builder) {
    return builder.registerAll(handlers());
  }

  /**
   * Upserts the user. A user seen for the first time also gets a trial payment.
   */
  public void addUser(Envelope envelope) throws InterruptedException {
    User user = decode(envelope, User.class);
    userLocks.withLock(user.userId(), () -> {
      boolean known = users.userExists(user.userId());
      users.upsertUser(user);
      if (!known) {
        Payment trial = Payment.trial(user.userId(), trialTerms, clock.instant());
        users.createPayment(trial);
        log.info("Registered user {} with trial until {}", user.userId(), trial.until());
      } else {
        log.debug("Updated user {}", user.userId());
      }
      return null;
    });
  }

  public void addProfile(Envelope envelope) {
    Profile profile = decode(envelope, Profile.class);
    users.upsertProfile(profile);
    log.debug("Saved profile of user {}", profile.userId());
  }

  public void addLocation(Envelope envelope) {
    Location location = decode(envelope, Location.class);
    users.upsertLocation(location);
    log.debug("Saved location of user {}", location.userId());
  }

  public void addWord(Envelope envelope) {
    NewWord word = decode(envelope, NewWord.class);
    long id = words.addWord(word);
    log.debug("Added word {} for user {}", id, word.userId());
  }

  public void createPayment(Envelope envelope) {
    Payment payment = decode(envelope, Payment.class);
    users.createPayment(payment);
    log.info("Recorded {} payment of user {} until {}", payment.period(), payment.userId(), payment.until());
  }

  private <T> T decode(Envelope envelope, Class<T> type) {
    try {
      return json.fromJson(envelope.payloadJson(), type);
    } catch (IllegalArgumentException e) {
      throw new ValidationException("Invalid " + envelope.purposeTag() + " payload: " + e.getMessage(), e);
    }
  }
}
