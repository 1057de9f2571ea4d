package timealgebra.core;

import com.google.common.collect.AbstractIterator;
import java.time.Duration;
import java.util.Iterator;
import timealgebra.cache.CacheOptions;
import timealgebra.cache.CachedTimeline;
import timealgebra.core.coerce.BoundCoercer;
import timealgebra.core.coerce.StandardBoundCoercer;
import timealgebra.core.model.Interval;
import timealgebra.filter.Filter;
import timealgebra.ops.Complement;
import timealgebra.ops.Difference;
import timealgebra.ops.Filtered;
import timealgebra.ops.Flatten;
import timealgebra.ops.Intersection;
import timealgebra.ops.Union;

/**
 * A source of intervals that can be queried over a half-open range.
 *
 * <p>Contract for implementations:
 *
 * <ul>
 *   <li>{@link #fetch(long, long)} returns intervals in ascending {@code (start, end)} order.
 *   <li>Returned intervals overlap the requested range but may extend past it; the query entry
 *       point ({@link TimelineQuery}) clips them.
 *   <li>Every call is an independent evaluation. No cursor state survives between calls.
 *   <li>An absent bound is passed as {@link Interval#UNBOUNDED_START} or {@link
 *       Interval#UNBOUNDED_END}.
 * </ul>
 *
 * <p>Ordering is a precondition on leaf implementations and is not re-checked by the operators.
 *
 * @param <T> interval type produced by this timeline
 */
public interface Timeline<T extends Interval> {

  Iterator<T> fetch(long start, long end);

  /**
   * True when this timeline only produces intervals without metadata. Fixed at construction;
   * {@link Intersection} uses it to decide which children it emits from.
   */
  boolean isMask();

  /** Strategy the query entry point uses to turn caller bounds into seconds. */
  default BoundCoercer boundCoercer() {
    return StandardBoundCoercer.utc();
  }

  /** Intervals containing {@code point}, unclipped. */
  default Iterator<T> overlapping(long point) {
    Iterator<T> source = fetch(point, point == Interval.UNBOUNDED_END ? point : point + 1);
    return new AbstractIterator<>() {
      @Override
      protected T computeNext() {
        while (source.hasNext()) {
          T next = source.next();
          if (next.finiteStart() > point) {
            return endOfData();
          }
          if (next.contains(point)) {
            return next;
          }
        }
        return endOfData();
      }
    };
  }

  default TimelineQuery<T> query() {
    return TimelineQuery.of(this);
  }

  default Timeline<T> or(Timeline<? extends T> other) {
    return Union.of(this, other);
  }

  default Timeline<T> and(Timeline<? extends T> other) {
    return Intersection.of(this, other);
  }

  /**
   * Restricts this timeline to the coverage of a mask timeline, keeping this timeline's metadata.
   *
   * @throws IllegalArgumentException if {@code mask} is not a mask timeline
   */
  default Timeline<T> within(Timeline<?> mask) {
    return Intersection.within(this, mask);
  }

  default Timeline<T> minus(Timeline<?> other) {
    return new Difference<>(this, other);
  }

  default Timeline<Interval> complement() {
    return new Complement(this);
  }

  default Timeline<Interval> flatten() {
    return Flatten.of(this);
  }

  default Timeline<T> where(Filter<? super T> filter) {
    return new Filtered<>(this, filter);
  }

  default CachedTimeline<T> cached(Duration ttl) {
    return new CachedTimeline<>(this, CacheOptions.withTtl(ttl));
  }
}
