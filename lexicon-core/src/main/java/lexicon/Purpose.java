package lexicon;

import java.util.Optional;

/**
 * Purpose tags carried in the {@code purpose} field of every envelope.
 *
 * <p>Each purpose names the JSON field that holds its payload. The payload is
 * itself a JSON document, usually embedded as an encoded string.
 */
public enum Purpose {
  ADD_USER("user"),
  ADD_PROFILE("profile"),
  ADD_LOCATION("location"),
  ADD_WORD("word"),
  CREATE_PAYMENT_PURPOSE("payment");

  private final String payloadKey;

  Purpose(String payloadKey) {
    this.payloadKey = payloadKey;
  }

  /**
   * Name of the envelope field that carries this purpose's payload.
   */
  public String payloadKey() {
    return payloadKey;
  }

  /**
   * Resolves a wire tag. Tags are matched exactly; anything else is unknown.
   *
   * @param tag the raw tag, may be {@code null}
   * @return the purpose, or empty for unknown or missing tags
   */
  public static Optional<Purpose> fromTag(String tag) {
    if (tag == null) {
      return Optional.empty();
    }
    for (Purpose purpose : values()) {
      if (purpose.name().equals(tag)) {
        return Optional.of(purpose);
      }
    }
    return Optional.empty();
  }
}
