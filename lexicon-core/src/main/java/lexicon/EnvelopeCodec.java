package lexicon;

import lexicon.util.JsonCodec;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Encodes envelopes to and decodes them from the broker body format
 * {@code {"purpose": <tag>, "<payload-key>": "<JSON-encoded payload>"}}.
 *
 * <p>On decode the payload may also be an inline JSON object instead of an
 * encoded string.
 */
public final class EnvelopeCodec {
  public static final String PURPOSE_FIELD = "purpose";

  private final JsonCodec json;

  public EnvelopeCodec() {
    this(JsonCodec.getDefault());
  }

  public EnvelopeCodec(JsonCodec json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  public String encode(Envelope envelope) {
    Objects.requireNonNull(envelope, "envelope");
    Purpose purpose = envelope.purpose()
        .orElseThrow(() -> new IllegalArgumentException("Cannot encode unknown purpose " + envelope.purposeTag()));
    Map<String, Object> body = new LinkedHashMap<>();
    body.put(PURPOSE_FIELD, purpose.name());
    body.put(purpose.payloadKey(), envelope.payloadJson());
    return json.toJson(body);
  }

  /**
   * Decodes a broker body.
   *
   * @param body the raw message body
   * @return the envelope; for unknown tags an envelope without payload
   * @throws ValidationException if the body is not a JSON object, has no purpose
   *                             tag, or a known purpose lacks its payload
   */
  public Envelope decode(String body) {
    Map<String, Object> fields;
    try {
      fields = json.parseObject(body);
    } catch (IllegalArgumentException e) {
      throw new ValidationException("Malformed envelope: " + e.getMessage(), e);
    }

    Object tag = fields.get(PURPOSE_FIELD);
    if (!(tag instanceof String purposeTag) || purposeTag.isEmpty()) {
      throw new ValidationException("Envelope has no purpose tag");
    }

    Optional<Purpose> purpose = Purpose.fromTag(purposeTag);
    if (purpose.isEmpty()) {
      return Envelope.unrouted(purposeTag);
    }

    String key = purpose.get().payloadKey();
    Object payload = fields.get(key);
    if (payload instanceof String encoded) {
      return envelope(purpose.get(), encoded);
    }
    if (payload instanceof Map<?, ?>) {
      return envelope(purpose.get(), json.toJson(payload));
    }
    throw new ValidationException("Envelope " + purposeTag + " has no '" + key + "' payload");
  }

  private static Envelope envelope(Purpose purpose, String payloadJson) {
    try {
      return Envelope.of(purpose, payloadJson);
    } catch (IllegalArgumentException e) {
      throw new ValidationException(e.getMessage(), e);
    }
  }
}
