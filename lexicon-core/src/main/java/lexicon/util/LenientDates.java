package lexicon.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;

/**
 * Parsing of the date formats accepted from clients.
 */
public final class LenientDates {

  // Day-first forms are tried before month-first ones.
  private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
      strict("dd-MM-uuuu"),
      strict("uuuu-MM-dd"),
      strict("dd/MM/uuuu"),
      strict("MM/dd/uuuu"),
      strict("dd.MM.uuuu"),
      strict("uuuu.MM.dd"));

  private LenientDates() {}

  /**
   * Parses a calendar date in any of the supported formats.
   *
   * @throws IllegalArgumentException if no format matches
   */
  public static LocalDate parseDate(String text) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("Date must not be empty");
    }
    String trimmed = text.trim();
    for (DateTimeFormatter format : DATE_FORMATS) {
      try {
        return LocalDate.parse(trimmed, format);
      } catch (DateTimeParseException ignored) {
        // try the next format
      }
    }
    throw new IllegalArgumentException("Invalid date format: " + text);
  }

  /**
   * Parses an ISO-8601 instant. Values without an offset are read as UTC; a bare
   * date means the start of that day in UTC.
   *
   * @throws IllegalArgumentException if the text is not ISO-8601
   */
  public static Instant parseInstant(String text) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("Timestamp must not be empty");
    }
    String trimmed = text.trim();
    try {
      return OffsetDateTime.parse(trimmed).toInstant();
    } catch (DateTimeParseException ignored) {
      // fall through to zone-less forms
    }
    try {
      return LocalDateTime.parse(trimmed).toInstant(ZoneOffset.UTC);
    } catch (DateTimeParseException ignored) {
      // fall through to date-only form
    }
    try {
      return LocalDate.parse(trimmed).atStartOfDay(ZoneOffset.UTC).toInstant();
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid ISO-8601 timestamp: " + text, e);
    }
  }

  private static DateTimeFormatter strict(String pattern) {
    return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
  }
}
