package timealgebra.core.model;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Half-open time range {@code [start, end)} measured in seconds.
 *
 * <p>Either end may be unbounded. Unbounded ends are stored as the sentinels {@link
 * #UNBOUNDED_START} and {@link #UNBOUNDED_END}, so {@link #finiteStart()} and {@link #finiteEnd()}
 * can be used directly in comparisons without branching on boundedness.
 *
 * <p>Intervals are immutable. Domain variants carry metadata by subclassing and must override
 * {@link #withBounds(long, long)} to return an instance of their own type with the same metadata;
 * every operator that trims an interval goes through that method.
 */
public class Interval {
  public static final long UNBOUNDED_START = Long.MIN_VALUE;
  public static final long UNBOUNDED_END = Long.MAX_VALUE;

  private final long start;
  private final long end;

  public Interval(long start, long end) {
    if (start > end) {
      throw new InvalidIntervalException(
          "Interval start must not be after end: start=" + start + ", end=" + end);
    }
    this.start = start;
    this.end = end;
  }

  public static Interval of(long start, long end) {
    return new Interval(start, end);
  }

  /** {@code [start, +inf)} */
  public static Interval from(long start) {
    return new Interval(start, UNBOUNDED_END);
  }

  /** {@code (-inf, end)} */
  public static Interval until(long end) {
    return new Interval(UNBOUNDED_START, end);
  }

  public static Interval unbounded() {
    return new Interval(UNBOUNDED_START, UNBOUNDED_END);
  }

  public final long finiteStart() {
    return start;
  }

  public final long finiteEnd() {
    return end;
  }

  public final OptionalLong start() {
    return hasBoundedStart() ? OptionalLong.of(start) : OptionalLong.empty();
  }

  public final OptionalLong end() {
    return hasBoundedEnd() ? OptionalLong.of(end) : OptionalLong.empty();
  }

  public final boolean hasBoundedStart() {
    return start != UNBOUNDED_START;
  }

  public final boolean hasBoundedEnd() {
    return end != UNBOUNDED_END;
  }

  public final boolean isBounded() {
    return hasBoundedStart() && hasBoundedEnd();
  }

  public final boolean isEmpty() {
    return start == end;
  }

  /** Length in seconds; empty when either end is unbounded. */
  public final OptionalLong duration() {
    return isBounded() ? OptionalLong.of(end - start) : OptionalLong.empty();
  }

  public final boolean contains(long point) {
    return start <= point && point < end;
  }

  public final boolean overlaps(Interval other) {
    return Math.max(start, other.start) < Math.min(end, other.end);
  }

  /**
   * Returns the part of this interval inside {@code [rangeStart, rangeEnd)} as an instance of the
   * same concrete type, or empty when the two do not overlap.
   */
  public final Optional<Interval> clip(long rangeStart, long rangeEnd) {
    if (isEmpty()) {
      return rangeStart <= start && start < rangeEnd ? Optional.of(this) : Optional.empty();
    }
    long clippedStart = Math.max(start, rangeStart);
    long clippedEnd = Math.min(end, rangeEnd);
    if (clippedStart >= clippedEnd) {
      return Optional.empty();
    }
    if (clippedStart == start && clippedEnd == end) {
      return Optional.of(this);
    }
    return Optional.of(withBounds(clippedStart, clippedEnd));
  }

  /**
   * Copies this interval with new bounds. Subclasses carrying metadata override this to keep their
   * concrete type and fields.
   */
  public Interval withBounds(long newStart, long newEnd) {
    return new Interval(newStart, newEnd);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Interval other = (Interval) o;
    return start == other.start && end == other.end;
  }

  @Override
  public int hashCode() {
    return Objects.hash(start, end);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + boundText(start) + ", " + boundText(end) + ")";
  }

  protected static String boundText(long bound) {
    if (bound == UNBOUNDED_START) {
      return "-inf";
    }
    if (bound == UNBOUNDED_END) {
      return "+inf";
    }
    return Long.toString(bound);
  }
}
