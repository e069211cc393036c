package lexicon;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EnvelopeCodecTest {
  private final EnvelopeCodec codec = new EnvelopeCodec();

  @Test
  void encodesPayloadAsStringUnderPayloadKey() {
    String body = codec.encode(Envelope.of(Purpose.ADD_USER, "{\"user_id\":1}"));

    assertEquals("{\"purpose\":\"ADD_USER\",\"user\":\"{\\\"user_id\\\":1}\"}", body);
  }

  @Test
  void decodesStringPayload() {
    Envelope envelope = codec.decode("{\"purpose\":\"ADD_WORD\",\"word\":\"{\\\"word\\\":\\\"cat\\\"}\"}");

    assertEquals(Purpose.ADD_WORD, envelope.purpose().orElseThrow());
    assertEquals("{\"word\":\"cat\"}", envelope.payloadJson());
  }

  @Test
  void decodesInlineObjectPayload() {
    Envelope envelope = codec.decode("{\"purpose\":\"ADD_LOCATION\",\"location\":{\"user_id\":7,\"city\":\"Oslo\"}}");

    Map<String, Object> payload = lexicon.util.JsonCodec.getDefault().parseObject(envelope.payloadJson());
    assertEquals(7, payload.get("user_id"));
    assertEquals("Oslo", payload.get("city"));
  }

  @Test
  void unknownPurposeDecodesWithoutPayload() {
    Envelope envelope = codec.decode("{\"purpose\":\"DELETE_EVERYTHING\",\"x\":\"{}\"}");

    assertEquals("DELETE_EVERYTHING", envelope.purposeTag());
    assertTrue(envelope.purpose().isEmpty());
    assertNull(envelope.payloadJson());
  }

  @Test
  void tagsAreCaseSensitive() {
    assertTrue(codec.decode("{\"purpose\":\"add_user\"}").purpose().isEmpty());
  }

  @Test
  void rejectsMalformedBody() {
    assertThrows(ValidationException.class, () -> codec.decode("not json"));
    assertThrows(ValidationException.class, () -> codec.decode("[1,2]"));
    assertThrows(ValidationException.class, () -> codec.decode(""));
  }

  @Test
  void rejectsMissingPurpose() {
    assertThrows(ValidationException.class, () -> codec.decode("{\"user\":\"{}\"}"));
    assertThrows(ValidationException.class, () -> codec.decode("{\"purpose\":42}"));
  }

  @Test
  void rejectsKnownPurposeWithoutPayload() {
    ValidationException e = assertThrows(ValidationException.class,
        () -> codec.decode("{\"purpose\":\"ADD_PROFILE\",\"user\":\"{}\"}"));
    assertTrue(e.getMessage().contains("profile"));
  }

  @Test
  void rejectsOversizedPayload() {
    String big = "\"" + "a".repeat(Envelope.MAX_PAYLOAD_BYTES) + "\"";
    String body = "{\"purpose\":\"ADD_USER\",\"user\":" + lexicon.util.JsonCodec.getDefault().toJson(big) + "}";

    assertThrows(ValidationException.class, () -> codec.decode(body));
  }

  @Test
  void encodeRejectsUnroutedEnvelope() {
    assertThrows(IllegalArgumentException.class, () -> codec.encode(Envelope.unrouted("OTHER")));
  }
}
