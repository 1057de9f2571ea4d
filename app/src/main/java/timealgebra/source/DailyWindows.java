package timealgebra.source;

import com.google.common.collect.AbstractIterator;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.Objects;
import java.util.Set;
import timealgebra.core.Timeline;
import timealgebra.core.coerce.BoundCoercer;
import timealgebra.core.coerce.StandardBoundCoercer;
import timealgebra.core.model.Interval;

/**
 * Mask timeline with one window per selected day, computed in a time zone.
 *
 * <p>Windows are generated day by day for the queried range, so both query bounds must be finite.
 * Window edges follow local wall-clock time, which makes windows around daylight-saving changes
 * shorter or longer than usual.
 */
public final class DailyWindows implements Timeline<Interval> {
  private static final Set<DayOfWeek> WEEKDAYS =
      EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY);
  private static final Set<DayOfWeek> WEEKENDS =
      EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY);

  private final String name;
  private final ZoneId zone;
  private final Set<DayOfWeek> days;
  private final int startHour;
  private final int endHour;
  private final BoundCoercer coercer;

  private DailyWindows(String name, ZoneId zone, Set<DayOfWeek> days, int startHour, int endHour) {
    if (startHour < 0 || startHour > 23) {
      throw new IllegalArgumentException("startHour must be 0-23, got " + startHour);
    }
    if (endHour < 0 || endHour > 24) {
      throw new IllegalArgumentException("endHour must be 0-24, got " + endHour);
    }
    if (startHour >= endHour) {
      throw new IllegalArgumentException(
          "startHour must be before endHour, got " + startHour + " >= " + endHour);
    }
    this.name = name;
    this.zone = Objects.requireNonNull(zone, "zone");
    this.days = Set.copyOf(days);
    this.startHour = startHour;
    this.endHour = endHour;
    this.coercer = StandardBoundCoercer.inZone(zone);
  }

  /** Whole days Monday to Friday. */
  public static DailyWindows weekdays(ZoneId zone) {
    return new DailyWindows("weekdays", zone, WEEKDAYS, 0, 24);
  }

  /** Whole days Saturday and Sunday. */
  public static DailyWindows weekends(ZoneId zone) {
    return new DailyWindows("weekends", zone, WEEKENDS, 0, 24);
  }

  /** Weekdays from {@code startHour} (inclusive) to {@code endHour} (exclusive). */
  public static DailyWindows businessHours(ZoneId zone, int startHour, int endHour) {
    return new DailyWindows("businessHours", zone, WEEKDAYS, startHour, endHour);
  }

  public static DailyWindows businessHours(ZoneId zone) {
    return businessHours(zone, 9, 17);
  }

  public ZoneId zone() {
    return zone;
  }

  @Override
  public Iterator<Interval> fetch(long start, long end) {
    if (start == Interval.UNBOUNDED_START || end == Interval.UNBOUNDED_END) {
      throw new IllegalArgumentException(name + " requires finite start and end bounds");
    }
    LocalDate first = LocalDate.ofInstant(Instant.ofEpochSecond(start), zone).minusDays(1);
    LocalDate last = LocalDate.ofInstant(Instant.ofEpochSecond(end), zone);
    return new AbstractIterator<>() {
      private LocalDate day = first;

      @Override
      protected Interval computeNext() {
        while (!day.isAfter(last)) {
          LocalDate current = day;
          day = day.plusDays(1);
          if (!days.contains(current.getDayOfWeek())) {
            continue;
          }
          long windowStart =
              current.atTime(LocalTime.of(startHour, 0)).atZone(zone).toEpochSecond();
          long windowEnd =
              endHour == 24
                  ? current.plusDays(1).atStartOfDay(zone).toEpochSecond()
                  : current.atTime(LocalTime.of(endHour, 0)).atZone(zone).toEpochSecond();
          if (windowEnd > start && windowStart < end) {
            return new Interval(windowStart, windowEnd);
          }
        }
        return endOfData();
      }
    };
  }

  @Override
  public boolean isMask() {
    return true;
  }

  @Override
  public BoundCoercer boundCoercer() {
    return coercer;
  }

  @Override
  public String toString() {
    return "DailyWindows[" + name + ", " + zone + ", " + startHour + "-" + endHour + "]";
  }
}
