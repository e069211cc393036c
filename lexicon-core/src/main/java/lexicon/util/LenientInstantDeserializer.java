package lexicon.util;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.time.Instant;

/**
 * Reads an {@link Instant} from ISO-8601 text with or without an offset, or from
 * epoch milliseconds.
 */
public final class LenientInstantDeserializer extends StdDeserializer<Instant> {

  public LenientInstantDeserializer() {
    super(Instant.class);
  }

  @Override
  public Instant deserialize(JsonParser parser, DeserializationContext context) throws IOException {
    JsonToken token = parser.currentToken();
    if (token == JsonToken.VALUE_NUMBER_INT) {
      return Instant.ofEpochMilli(parser.getLongValue());
    }
    if (token != JsonToken.VALUE_STRING) {
      return (Instant) context.handleUnexpectedToken(Instant.class, parser);
    }
    try {
      return LenientDates.parseInstant(parser.getText());
    } catch (IllegalArgumentException e) {
      return (Instant) context.handleWeirdStringValue(Instant.class, parser.getText(), e.getMessage());
    }
  }
}
