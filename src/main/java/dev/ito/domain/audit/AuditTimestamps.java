package dev.ito.domain.audit;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Formats and parses audit timestamps ({@code yyyy-MM-dd'T'HH:mm:ss.SSS'Z'}).
 *
 * @since 0.1.0
 */
public final class AuditTimestamps {
  private static final DateTimeFormatter FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

  private AuditTimestamps() {
    // Utility
  }

  /**
   * Renders an instant in UTC with millisecond precision.
   *
   * @param instant instant to render
   * @return formatted timestamp
   */
  public static String format(Instant instant) {
    return FORMAT.format(Objects.requireNonNull(instant, "instant"));
  }

  /**
   * Parses any ISO-8601 instant or offset date-time.
   *
   * @param text timestamp text
   * @return parsed instant
   * @throws DateTimeParseException when the text is not ISO-8601
   */
  public static Instant parse(String text) {
    Objects.requireNonNull(text, "text");
    try {
      return Instant.parse(text);
    } catch (DateTimeParseException ex) {
      return DateTimeFormatter.ISO_OFFSET_DATE_TIME.parse(text, Instant::from);
    }
  }

  /**
   * Truncates an epoch-millis reading to the precision written on disk.
   *
   * @param epochMillis milliseconds since the epoch
   * @return instant at millisecond precision
   */
  public static Instant ofEpochMillis(long epochMillis) {
    return Instant.ofEpochMilli(epochMillis).truncatedTo(ChronoUnit.MILLIS);
  }
}
