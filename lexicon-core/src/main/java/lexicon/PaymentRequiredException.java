package lexicon;

/**
 * A write was blocked because the owning user has no active subscription.
 */
public final class PaymentRequiredException extends LexiconException {
  private final long userId;

  public PaymentRequiredException(long userId) {
    super("User " + userId + " has no active subscription");
    this.userId = userId;
  }

  public long userId() {
    return userId;
  }
}
