package pgsync.transform;

import org.junit.jupiter.api.Test;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class DateConverterTest {

  private static final long JAN_15_2024_1430_UTC = 1705329000L;

  private final DateConverter utc = new DateConverter(ZoneOffset.UTC);

  @Test
  void nullStaysNull() {
    assertNull(utc.toEpochSeconds(null));
  }

  @Test
  void numbersAreTruncatedToSeconds() {
    assertEquals(1700000000L, utc.toEpochSeconds(1700000000));
    assertEquals(1700000000L, utc.toEpochSeconds(1700000000.9d));
    assertEquals(42L, utc.toEpochSeconds(new java.math.BigDecimal("42.5")));
  }

  @Test
  void isoWithZuluSuffix() {
    assertEquals(JAN_15_2024_1430_UTC, utc.toEpochSeconds("2024-01-15T14:30:00Z"));
  }

  @Test
  void isoWithOffset() {
    assertEquals(JAN_15_2024_1430_UTC, utc.toEpochSeconds("2024-01-15T16:30:00+02:00"));
  }

  @Test
  void isoWithSpaceSeparatorAndFraction() {
    assertEquals(JAN_15_2024_1430_UTC, utc.toEpochSeconds("2024-01-15 14:30:00.123456"));
    assertEquals(JAN_15_2024_1430_UTC, utc.toEpochSeconds("2024-01-15 14:30:00+00:00"));
  }

  @Test
  void dateOnlyIsStartOfDay() {
    assertEquals(1705276800L, utc.toEpochSeconds("2024-01-15"));
    assertEquals(1705276800L, utc.toEpochSeconds(LocalDate.of(2024, 1, 15)));
  }

  @Test
  void fallbackFormatsAcceptUnpaddedFields() {
    assertEquals(1704420000L, utc.toEpochSeconds("2024-1-5 2:00:00"));
    assertEquals(1704420000L, utc.toEpochSeconds("2024-1-5T2:00:00.5"));
    assertEquals(1704412800L, utc.toEpochSeconds("2024-1-5"));
  }

  @Test
  void naiveValuesUseConfiguredZone() {
    DateConverter berlin = new DateConverter(ZoneId.of("Europe/Berlin"));

    assertEquals(JAN_15_2024_1430_UTC, berlin.toEpochSeconds("2024-01-15T15:30:00"));
    assertEquals(JAN_15_2024_1430_UTC, berlin.toEpochSeconds(LocalDateTime.of(2024, 1, 15, 15, 30)));
    assertEquals(JAN_15_2024_1430_UTC, berlin.toEpochSeconds("2024-01-15T14:30:00Z"));
  }

  @Test
  void temporalObjects() {
    Instant instant = Instant.ofEpochSecond(JAN_15_2024_1430_UTC);

    assertEquals(JAN_15_2024_1430_UTC, utc.toEpochSeconds(instant));
    assertEquals(JAN_15_2024_1430_UTC, utc.toEpochSeconds(OffsetDateTime.ofInstant(instant, ZoneOffset.ofHours(5))));
    assertEquals(JAN_15_2024_1430_UTC, utc.toEpochSeconds(Timestamp.from(instant)));
    assertEquals(JAN_15_2024_1430_UTC, utc.toEpochSeconds(java.util.Date.from(instant)));
    assertEquals(1705276800L, utc.toEpochSeconds(java.sql.Date.valueOf(LocalDate.of(2024, 1, 15))));
  }

  @Test
  void roundTripsThroughIsoText() {
    long seconds = 1718000000L;
    String iso = Instant.ofEpochSecond(seconds).toString();

    assertEquals(seconds, utc.toEpochSeconds(iso));
  }

  @Test
  void rejectsUnparseableText() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> utc.toEpochSeconds("not a date"));
    assertTrue(e.getMessage().contains("not a date"));
    assertThrows(IllegalArgumentException.class, () -> utc.toEpochSeconds("2024-02-30"));
  }

  @Test
  void rejectsUnsupportedTypes() {
    assertThrows(IllegalArgumentException.class, () -> utc.toEpochSeconds(new Object()));
    assertThrows(IllegalArgumentException.class, () -> utc.toEpochSeconds(true));
  }

  @Test
  void timeOfDayIsNotADate() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> utc.toEpochSeconds(java.sql.Time.valueOf("14:30:00")));

    assertTrue(e.getMessage().startsWith("Unsupported date type: Time"));
  }
}
