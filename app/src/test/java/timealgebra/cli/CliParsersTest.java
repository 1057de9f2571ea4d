package timealgebra.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import timealgebra.core.model.Interval;
import timealgebra.core.model.InvalidIntervalException;
import timealgebra.filter.Filter;

final class CliParsersTest {

  @Test
  void namedSpecsKeepTheirOrder() {
    Map<String, String> specs = CliParsers.parseNamedSpecs(" b = 1:2 ; a=3:4;", "--intervals");

    assertEquals(List.of("b", "a"), List.copyOf(specs.keySet()));
    assertEquals("1:2", specs.get("b"));
  }

  @Test
  void malformedNamedSpecsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> CliParsers.parseNamedSpecs("x", "--masks"));
    assertThrows(
        IllegalArgumentException.class, () -> CliParsers.parseNamedSpecs("x=1:2;x=3:4", "--masks"));
    assertThrows(
        IllegalArgumentException.class, () -> CliParsers.parseNamedSpecs("9x=1:2", "--masks"));
  }

  @Test
  void intervalsAreSortedAndMayBeOpen() {
    List<NamedInterval> intervals = CliParsers.parseIntervals("50:60, :10, 20:", "s");

    assertEquals(
        List.of(
            new NamedInterval(Interval.UNBOUNDED_START, 10, "s"),
            new NamedInterval(20, Interval.UNBOUNDED_END, "s"),
            new NamedInterval(50, 60, "s")),
        intervals);
  }

  @Test
  void reversedIntervalIsAValidationError() {
    assertThrows(InvalidIntervalException.class, () -> CliParsers.parseIntervals("10:0", "s"));
    assertThrows(IllegalArgumentException.class, () -> CliParsers.parseIntervals("10", "s"));
  }

  @Test
  void boundsAcceptSecondsInstantsAndDates() {
    assertNull(CliParsers.parseBound(" ", "--start"));
    assertEquals(42L, CliParsers.parseBound("42", "--start"));
    assertEquals(
        Instant.parse("2024-01-01T00:00:00Z"),
        CliParsers.parseBound("2024-01-01T00:00:00Z", "--start"));
    assertEquals(
        OffsetDateTime.parse("2024-01-01T09:00:00+02:00"),
        CliParsers.parseBound("2024-01-01T09:00:00+02:00", "--start"));
    assertEquals(LocalDate.of(2024, 1, 1), CliParsers.parseBound("2024-01-01", "--end"));
    assertThrows(IllegalArgumentException.class, () -> CliParsers.parseBound("soon", "--end"));
  }

  @Test
  void filtersFromText() {
    Filter<Interval> longOnes = CliParsers.parseFilter("hours >= 1.5", "long");
    Filter<Interval> early = CliParsers.parseFilter("start<100", "early");

    assertTrue(longOnes.test(Interval.of(0, 7200)));
    assertFalse(longOnes.test(Interval.of(0, 3600)));
    assertTrue(early.test(Interval.of(99, 200)));
    assertThrows(IllegalArgumentException.class, () -> CliParsers.parseFilter("weight>1", "w"));
    assertThrows(IllegalArgumentException.class, () -> CliParsers.parseFilter("hours", "h"));
  }

  @Test
  void positiveSecondsOnly() {
    assertEquals(Duration.ofSeconds(30), CliParsers.parseSeconds("30", "--ttl"));
    assertThrows(IllegalArgumentException.class, () -> CliParsers.parseSeconds("0", "--ttl"));
    assertThrows(IllegalArgumentException.class, () -> CliParsers.parseSeconds("x", "--ttl"));
  }
}
