package lexicon;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * A decoded broker message: the purpose tag and the JSON payload stored under
 * the purpose's payload key.
 *
 * <p>The tag is kept verbatim so that messages with unknown purposes can still be
 * represented, logged and acknowledged. For unknown tags the payload is {@code null}.
 *
 * @see EnvelopeCodec
 */
public final class Envelope {
  public static final int MAX_PAYLOAD_BYTES = 1024 * 1024; // 1MB

  private final String purposeTag;
  private final String payloadJson;

  private Envelope(String purposeTag, String payloadJson) {
    this.purposeTag = Objects.requireNonNull(purposeTag, "purposeTag");
    if (payloadJson != null && payloadJson.getBytes(StandardCharsets.UTF_8).length > MAX_PAYLOAD_BYTES) {
      throw new IllegalArgumentException("Payload exceeds maximum size of " + MAX_PAYLOAD_BYTES + " bytes");
    }
    this.payloadJson = payloadJson;
  }

  /**
   * Creates an envelope for a known purpose.
   *
   * @param purpose     the purpose
   * @param payloadJson JSON document of the payload
   */
  public static Envelope of(Purpose purpose, String payloadJson) {
    Objects.requireNonNull(purpose, "purpose");
    Objects.requireNonNull(payloadJson, "payloadJson");
    return new Envelope(purpose.name(), payloadJson);
  }

  /**
   * Creates an envelope for a tag that does not name a known purpose.
   */
  static Envelope unrouted(String purposeTag) {
    return new Envelope(purposeTag, null);
  }

  public String purposeTag() {
    return purposeTag;
  }

  public Optional<Purpose> purpose() {
    return Purpose.fromTag(purposeTag);
  }

  /**
   * JSON payload, or {@code null} when the purpose is unknown.
   */
  public String payloadJson() {
    return payloadJson;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Envelope other)) return false;
    return purposeTag.equals(other.purposeTag) && Objects.equals(payloadJson, other.payloadJson);
  }

  @Override
  public int hashCode() {
    return Objects.hash(purposeTag, payloadJson);
  }

  @Override
  public String toString() {
    return "Envelope{purpose=" + purposeTag + ", payloadBytes="
        + (payloadJson == null ? 0 : payloadJson.length()) + "}";
  }
}
