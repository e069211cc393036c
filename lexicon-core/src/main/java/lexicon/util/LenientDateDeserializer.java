package lexicon.util;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.time.LocalDate;

/**
 * Reads a {@link LocalDate} written in any format accepted by {@link LenientDates#parseDate}.
 */
public final class LenientDateDeserializer extends StdDeserializer<LocalDate> {

  public LenientDateDeserializer() {
    super(LocalDate.class);
  }

  @Override
  public LocalDate deserialize(JsonParser parser, DeserializationContext context) throws IOException {
    if (parser.currentToken() != JsonToken.VALUE_STRING) {
      return (LocalDate) context.handleUnexpectedToken(LocalDate.class, parser);
    }
    try {
      return LenientDates.parseDate(parser.getText());
    } catch (IllegalArgumentException e) {
      return (LocalDate) context.handleWeirdStringValue(LocalDate.class, parser.getText(), e.getMessage());
    }
  }
}
