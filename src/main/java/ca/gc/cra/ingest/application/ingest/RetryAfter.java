package ca.gc.cra.ingest.application.ingest;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Parser for the HTTP {@code Retry-After} header.
 *
 * <p>Accepts delta-seconds ({@code 120}) and IMF-fixdate values ({@code Wed, 21 Oct 2015 07:28:00 GMT}). Dates in
 * the past yield a zero wait.</p>
 *
 * @since 0.1.0
 */
public final class RetryAfter {
  private RetryAfter() {}

  /**
   * Parses a header value.
   *
   * @param header raw header value; {@code null} or blank yields empty
   * @param nowMillis current epoch milliseconds, used for HTTP-date values
   * @return wait duration, or empty when the header is missing or unparsable
   */
  public static Optional<Duration> parse(String header, long nowMillis) {
    if (header == null || header.isBlank()) {
      return Optional.empty();
    }
    String value = header.trim();
    if (isDigits(value)) {
      try {
        return Optional.of(Duration.ofSeconds(Long.parseLong(value)));
      } catch (NumberFormatException ex) {
        // more digits than a long holds; treat as unparsable
        return Optional.empty();
      }
    }
    try {
      ZonedDateTime at = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME);
      long waitMillis = at.toInstant().toEpochMilli() - nowMillis;
      return Optional.of(Duration.ofMillis(Math.max(0L, waitMillis)));
    } catch (DateTimeParseException ex) {
      return Optional.empty();
    }
  }

  private static boolean isDigits(String value) {
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c < '0' || c > '9') {
        return false;
      }
    }
    return true;
  }
}
