package lexicon.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lexicon.util.LenientInstantDeserializer;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * A subscription payment of a user.
 *
 * @param period billing period label, {@code "trial"} for trial windows
 * @param until  end of the paid window
 */
public record Payment(
    @JsonProperty(required = true) @JsonSetter(nulls = Nulls.FAIL) long userId,
    BigDecimal amount,
    String period,
    boolean trial,
    @JsonProperty("is_active") boolean active,
    @JsonDeserialize(using = LenientInstantDeserializer.class) Instant until,
    String currency) {

  public static final String TRIAL_PERIOD = "trial";

  public Payment {
    Objects.requireNonNull(amount, "amount");
    Objects.requireNonNull(period, "period");
    Objects.requireNonNull(until, "until");
    Objects.requireNonNull(currency, "currency");
  }

  /**
   * Creates the active trial payment granted to a newly registered user.
   *
   * @param userId the new user
   * @param terms  trial price and length
   * @param now    start of the trial window
   */
  public static Payment trial(long userId, TrialTerms terms, Instant now) {
    return new Payment(userId, terms.amount(), TRIAL_PERIOD, true, true,
        now.plus(terms.length()), terms.currency());
  }
}
