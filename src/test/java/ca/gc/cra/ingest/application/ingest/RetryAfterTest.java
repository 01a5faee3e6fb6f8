package ca.gc.cra.ingest.application.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class RetryAfterTest {
  private static final long NOW = Instant.parse("2015-10-21T07:28:00Z").toEpochMilli();

  @Test
  void parsesDeltaSeconds() {
    assertEquals(Optional.of(Duration.ofSeconds(120)), RetryAfter.parse(" 120 ", NOW));
    assertEquals(Optional.of(Duration.ZERO), RetryAfter.parse("0", NOW));
  }

  @Test
  void parsesHttpDateRelativeToNow() {
    assertEquals(
        Optional.of(Duration.ofSeconds(30)),
        RetryAfter.parse("Wed, 21 Oct 2015 07:28:30 GMT", NOW));
  }

  @Test
  void pastHttpDateMeansNoWait() {
    assertEquals(Optional.of(Duration.ZERO), RetryAfter.parse("Wed, 21 Oct 2015 07:00:00 GMT", NOW));
  }

  @Test
  void unusableValuesAreEmpty() {
    assertTrue(RetryAfter.parse(null, NOW).isEmpty());
    assertTrue(RetryAfter.parse("  ", NOW).isEmpty());
    assertTrue(RetryAfter.parse("-5", NOW).isEmpty());
    assertTrue(RetryAfter.parse("1.5", NOW).isEmpty());
    assertTrue(RetryAfter.parse("soon", NOW).isEmpty());
    assertTrue(RetryAfter.parse("99999999999999999999999", NOW).isEmpty());
  }
}
