package timealgebra.core;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;
import com.google.common.collect.Lists;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import timealgebra.core.coerce.BoundCoercer;
import timealgebra.core.coerce.BoundEdge;
import timealgebra.core.model.Interval;
import timealgebra.core.model.Intervals;

/**
 * Entry point for executing a timeline over a range.
 *
 * <p>Raw bounds are kept as supplied and coerced with the timeline's {@link BoundCoercer} (or the
 * one set with {@link #coercer(BoundCoercer)}) when the query runs. Every returned interval is
 * clipped to the requested range, whatever the depth of the tree.
 *
 * <pre>{@code
 * List<Interval> free = busy.complement().query().between(monday, friday).list();
 * }</pre>
 */
public final class TimelineQuery<T extends Interval> {
  private final Timeline<T> timeline;
  private BoundCoercer coercer;
  private Object start;
  private Object end;
  private Direction direction = Direction.ASCENDING;

  private TimelineQuery(Timeline<T> timeline) {
    this.timeline = Objects.requireNonNull(timeline, "timeline");
    this.coercer = timeline.boundCoercer();
  }

  public static <T extends Interval> TimelineQuery<T> of(Timeline<T> timeline) {
    return new TimelineQuery<>(timeline);
  }

  /**
   * Point query: intervals that contain {@code point}, not clipped to it. Fragments produced by
   * difference and complement are returned whole.
   */
  public static <T extends Interval> List<T> overlapping(Timeline<T> timeline, long point) {
    return ImmutableList.copyOf(timeline.overlapping(point));
  }

  /** Inclusive lower bound; {@code null} leaves the range open below. */
  public TimelineQuery<T> from(Object start) {
    this.start = start;
    return this;
  }

  /** Exclusive upper bound; {@code null} leaves the range open above. */
  public TimelineQuery<T> until(Object end) {
    this.end = end;
    return this;
  }

  public TimelineQuery<T> between(Object start, Object end) {
    return from(start).until(end);
  }

  public TimelineQuery<T> coercer(BoundCoercer coercer) {
    this.coercer = Objects.requireNonNull(coercer, "coercer");
    return this;
  }

  public TimelineQuery<T> direction(Direction direction) {
    this.direction = Objects.requireNonNull(direction, "direction");
    return this;
  }

  public TimelineQuery<T> descending() {
    return direction(Direction.DESCENDING);
  }

  public long startSeconds() {
    return coercer.coerce(start, BoundEdge.START);
  }

  public long endSeconds() {
    return coercer.coerce(end, BoundEdge.END);
  }

  public Iterator<T> iterator() {
    long s = startSeconds();
    long e = endSeconds();
    if (s > e) {
      throw new IllegalArgumentException(
          "Query start must not be after end: start=" + s + ", end=" + e);
    }
    if (s == e) {
      return Collections.emptyIterator();
    }
    Iterator<T> ascending = clipped(timeline.fetch(s, e), s, e);
    if (direction == Direction.ASCENDING) {
      return ascending;
    }
    return Lists.reverse(Lists.newArrayList(ascending)).iterator();
  }

  public List<T> list() {
    return ImmutableList.copyOf(iterator());
  }

  public Stream<T> stream() {
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL),
        false);
  }

  public Optional<T> first() {
    Iterator<T> it = iterator();
    return it.hasNext() ? Optional.of(it.next()) : Optional.empty();
  }

  public int count() {
    return Iterators.size(iterator());
  }

  private static <T extends Interval> Iterator<T> clipped(
      Iterator<T> source, long start, long end) {
    return new AbstractIterator<>() {
      @Override
      protected T computeNext() {
        while (source.hasNext()) {
          T next = source.next();
          if (next.finiteStart() >= end) {
            return endOfData();
          }
          Optional<T> clip = Intervals.clip(next, start, end);
          if (clip.isPresent()) {
            return clip.get();
          }
        }
        return endOfData();
      }
    };
  }
}
