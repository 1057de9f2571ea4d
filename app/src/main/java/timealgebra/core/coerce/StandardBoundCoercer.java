package timealgebra.core.coerce;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Default coercion: integral numbers are seconds, zoned {@code java.time} values are converted to
 * their epoch second, and {@link LocalDate}s are read in a configured zone.
 *
 * <p>A date used as a start bound means the start of that day; used as an end bound it means the
 * start of the following day, so the whole day is included in the half-open range.
 */
public final class StandardBoundCoercer implements BoundCoercer {
  private static final StandardBoundCoercer UTC = new StandardBoundCoercer(ZoneOffset.UTC);

  private final ZoneId zone;

  private StandardBoundCoercer(ZoneId zone) {
    this.zone = Objects.requireNonNull(zone, "zone");
  }

  public static StandardBoundCoercer utc() {
    return UTC;
  }

  public static StandardBoundCoercer inZone(ZoneId zone) {
    return ZoneOffset.UTC.equals(zone) ? UTC : new StandardBoundCoercer(zone);
  }

  public ZoneId zone() {
    return zone;
  }

  @Override
  public long coerce(Object bound, BoundEdge edge) {
    Objects.requireNonNull(edge, "edge");
    if (bound == null) {
      return edge.unboundedValue();
    }
    if (bound instanceof Long || bound instanceof Integer || bound instanceof Short) {
      return ((Number) bound).longValue();
    }
    if (bound instanceof Instant instant) {
      return instant.getEpochSecond();
    }
    if (bound instanceof ZonedDateTime zoned) {
      return zoned.toEpochSecond();
    }
    if (bound instanceof OffsetDateTime offset) {
      return offset.toEpochSecond();
    }
    if (bound instanceof LocalDate date) {
      LocalDate day = edge == BoundEdge.START ? date : date.plusDays(1);
      return day.atStartOfDay(zone).toEpochSecond();
    }
    if (bound instanceof LocalDateTime) {
      throw new IllegalArgumentException(
          "Query "
              + edge.label()
              + " bound must carry a zone, got local date-time "
              + bound
              + ". Use atZone(...) or atOffset(...) before querying.");
    }
    throw new IllegalArgumentException(
        "Query "
            + edge.label()
            + " bound must be an integral number of seconds, Instant, ZonedDateTime,"
            + " OffsetDateTime, LocalDate or null; got "
            + bound.getClass().getSimpleName()
            + ": "
            + bound);
  }

  @Override
  public String toString() {
    return "StandardBoundCoercer[" + zone + "]";
  }
}
