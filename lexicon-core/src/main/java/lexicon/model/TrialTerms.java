package lexicon.model;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Objects;

/**
 * Price and length of the trial window opened for every new user.
 */
public record TrialTerms(BigDecimal amount, String currency, Duration length) {

  public static final TrialTerms DEFAULT =
      new TrialTerms(new BigDecimal("199.00"), "RUB", Duration.ofDays(3));

  public TrialTerms {
    Objects.requireNonNull(amount, "amount");
    Objects.requireNonNull(currency, "currency");
    Objects.requireNonNull(length, "length");
    if (length.isNegative() || length.isZero()) {
      throw new IllegalArgumentException("length must be positive");
    }
  }
}
