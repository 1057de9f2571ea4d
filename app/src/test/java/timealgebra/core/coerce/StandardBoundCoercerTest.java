package timealgebra.core.coerce;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import org.junit.jupiter.api.Test;
import timealgebra.core.model.Interval;

final class StandardBoundCoercerTest {
  private final StandardBoundCoercer utc = StandardBoundCoercer.utc();

  @Test
  void nullMeansUnbounded() {
    assertEquals(Interval.UNBOUNDED_START, utc.coerce(null, BoundEdge.START));
    assertEquals(Interval.UNBOUNDED_END, utc.coerce(null, BoundEdge.END));
  }

  @Test
  void integralNumbersAreSeconds() {
    assertEquals(42L, utc.coerce(42L, BoundEdge.START));
    assertEquals(42L, utc.coerce(42, BoundEdge.END));
  }

  @Test
  void zonedValuesUseTheirEpochSecond() {
    Instant instant = Instant.parse("2024-03-01T10:00:00Z");
    long expected = instant.getEpochSecond();
    assertEquals(expected, utc.coerce(instant, BoundEdge.START));
    assertEquals(
        expected, utc.coerce(instant.atZone(ZoneId.of("Europe/Amsterdam")), BoundEdge.START));
    assertEquals(
        expected,
        utc.coerce(OffsetDateTime.ofInstant(instant, ZoneOffset.ofHours(-5)), BoundEdge.END));
  }

  @Test
  void dateCoversTheWholeDay() {
    LocalDate day = LocalDate.of(2024, 3, 1);
    long start = utc.coerce(day, BoundEdge.START);
    long end = utc.coerce(day, BoundEdge.END);
    assertEquals(Instant.parse("2024-03-01T00:00:00Z").getEpochSecond(), start);
    assertEquals(86_400, end - start, "A date as end bound includes that whole day");
  }

  @Test
  void dateIsReadInTheCoercerZone() {
    ZoneId tokyo = ZoneId.of("Asia/Tokyo");
    BoundCoercer coercer = StandardBoundCoercer.inZone(tokyo);
    long start = coercer.coerce(LocalDate.of(2024, 3, 1), BoundEdge.START);
    assertEquals(ZonedDateTime.of(2024, 3, 1, 0, 0, 0, 0, tokyo).toEpochSecond(), start);
  }

  @Test
  void localDateTimeIsRejectedWithHint() {
    IllegalArgumentException ex =
        assertThrows(
            IllegalArgumentException.class,
            () -> utc.coerce(LocalDateTime.of(2024, 3, 1, 9, 0), BoundEdge.START));
    assertTrue(ex.getMessage().contains("atZone"), "Message should suggest attaching a zone");
  }

  @Test
  void unsupportedTypesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> utc.coerce("tomorrow", BoundEdge.END));
    assertThrows(IllegalArgumentException.class, () -> utc.coerce(1.5d, BoundEdge.END));
  }
}
