package timealgebra.cache;

import com.google.common.collect.ImmutableList;
import java.util.List;
import timealgebra.core.model.Interval;

/**
 * A cached stretch of coverage: the range that was fetched, what the wrapped timeline returned
 * for it, and when.
 *
 * @param start inclusive start of the covered range
 * @param end exclusive end of the covered range
 * @param intervals fetched intervals overlapping the range, in fetch order
 * @param fetchedAtNanos ticker reading when the range was fetched
 */
public record CacheSegment<T extends Interval>(
    long start, long end, List<T> intervals, long fetchedAtNanos) {

  public CacheSegment {
    if (start >= end) {
      throw new IllegalArgumentException("Cache segment must not be empty: " + start + ", " + end);
    }
    intervals = ImmutableList.copyOf(intervals);
  }

  static <T extends Interval> CacheSegment<T> of(
      long start, long end, Iterable<? extends T> fetched, long fetchedAtNanos) {
    ImmutableList.Builder<T> kept = ImmutableList.builder();
    for (T interval : fetched) {
      if (touches(interval, start, end)) {
        kept.add(interval);
      }
    }
    return new CacheSegment<>(start, end, kept.build(), fetchedAtNanos);
  }

  boolean isFresh(long nowNanos, long ttlNanos) {
    return nowNanos - fetchedAtNanos < ttlNanos;
  }

  boolean overlaps(long rangeStart, long rangeEnd) {
    return start < rangeEnd && rangeStart < end;
  }

  boolean contains(long point) {
    return start <= point && point < end;
  }

  /** The part of this segment inside {@code [from, to)}, keeping its timestamp. */
  CacheSegment<T> restrict(long from, long to) {
    return of(Math.max(start, from), Math.min(end, to), intervals, fetchedAtNanos);
  }

  private static boolean touches(Interval interval, long start, long end) {
    if (interval.isEmpty()) {
      return start <= interval.finiteStart() && interval.finiteStart() < end;
    }
    return interval.finiteStart() < end && interval.finiteEnd() > start;
  }
}
