package timealgebra.ops;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;
import com.google.common.collect.PeekingIterator;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;
import timealgebra.core.Timeline;
import timealgebra.core.coerce.BoundCoercer;
import timealgebra.core.model.Interval;
import timealgebra.core.model.IntervalOrder;
import timealgebra.core.model.Intervals;

/**
 * Source intervals with every subtractor interval cut out of them.
 *
 * <p>Each source interval yields zero or more fragments carrying the source interval's metadata.
 * Subtractors are merged into one ascending stream and swept alongside the source; subtractors
 * still reaching past the current source start stay active, so overlapping source intervals are
 * each carved against every hole they touch.
 */
public final class Difference<T extends Interval> implements Timeline<T> {
  private final Timeline<? extends T> source;
  private final List<Timeline<?>> subtractors;

  public Difference(Timeline<? extends T> source, Timeline<?>... subtractors) {
    this(source, List.of(subtractors));
  }

  public Difference(Timeline<? extends T> source, List<? extends Timeline<?>> subtractors) {
    this.source = Objects.requireNonNull(source, "source");
    this.subtractors = ImmutableList.copyOf(Objects.requireNonNull(subtractors, "subtractors"));
  }

  public Timeline<? extends T> source() {
    return source;
  }

  public List<Timeline<?>> subtractors() {
    return subtractors;
  }

  @Override
  public Iterator<T> fetch(long start, long end) {
    if (subtractors.isEmpty()) {
      return Iterators.unmodifiableIterator(source.fetch(start, end));
    }
    return new CarvingIterator<>(source.fetch(start, end), holes(start, end));
  }

  /**
   * Fragments containing {@code point}. Subtractors are fetched over each whole source interval,
   * so the fragment comes back complete rather than cut at the point.
   */
  @Override
  public Iterator<T> overlapping(long point) {
    List<T> found = new ArrayList<>();
    Iterator<? extends T> containing = source.overlapping(point);
    while (containing.hasNext()) {
      T interval = containing.next();
      Iterator<T> fragments =
          subtractors.isEmpty()
              ? Iterators.singletonIterator(interval)
              : new CarvingIterator<>(
                  Iterators.singletonIterator(interval),
                  holes(interval.finiteStart(), interval.finiteEnd()));
      while (fragments.hasNext()) {
        T fragment = fragments.next();
        if (fragment.contains(point)) {
          found.add(fragment);
        }
      }
    }
    return found.iterator();
  }

  private Iterator<Interval> holes(long start, long end) {
    List<Iterator<? extends Interval>> streams = new ArrayList<>(subtractors.size());
    for (Timeline<?> subtractor : subtractors) {
      streams.add(subtractor.fetch(start, end));
    }
    return MergingIterator.merge(streams);
  }

  @Override
  public boolean isMask() {
    return source.isMask();
  }

  @Override
  public BoundCoercer boundCoercer() {
    return source.boundCoercer();
  }

  @Override
  public String toString() {
    return "Difference[" + source + " - " + subtractors + "]";
  }

  private static final class CarvingIterator<T extends Interval> extends AbstractIterator<T> {
    private final PeekingIterator<T> source;
    private final PeekingIterator<Interval> holes;
    private final List<Interval> active = new ArrayList<>();
    private final PriorityQueue<Fragment<T>> pending =
        new PriorityQueue<>(
            Comparator.<Fragment<T>, Interval>comparing(f -> f.interval, IntervalOrder.NATURAL)
                .thenComparingLong(f -> f.sequence));
    private long sequence;

    private CarvingIterator(Iterator<? extends T> source, Iterator<Interval> holes) {
      this.source = Iterators.peekingIterator(source);
      this.holes = Iterators.peekingIterator(holes);
    }

    @Override
    protected T computeNext() {
      while (true) {
        if (!pending.isEmpty() && releasable(pending.peek().interval)) {
          return pending.poll().interval;
        }
        if (!source.hasNext()) {
          return endOfData();
        }
        carve(source.next());
      }
    }

    /** Fragments of later source intervals can never sort before this one. */
    private boolean releasable(Interval fragment) {
      return !source.hasNext() || fragment.finiteStart() < source.peek().finiteStart();
    }

    private void carve(T interval) {
      long start = interval.finiteStart();
      long end = interval.finiteEnd();
      active.removeIf(hole -> hole.finiteEnd() <= start);
      while (holes.hasNext() && holes.peek().finiteStart() < Math.max(end, start + 1)) {
        Interval hole = holes.next();
        if (!hole.isEmpty() && hole.finiteEnd() > start) {
          active.add(hole);
        }
      }

      if (interval.isEmpty()) {
        if (active.stream().noneMatch(hole -> hole.contains(start))) {
          add(interval);
        }
        return;
      }

      long cursor = start;
      for (Interval hole : active) {
        if (hole.finiteStart() >= end) {
          break;
        }
        if (hole.finiteEnd() <= cursor) {
          continue;
        }
        if (hole.finiteStart() > cursor) {
          add(Intervals.withBounds(interval, cursor, hole.finiteStart()));
        }
        cursor = Math.max(cursor, hole.finiteEnd());
        if (cursor >= end) {
          return;
        }
      }
      add(Intervals.withBounds(interval, cursor, end));
    }

    private void add(T fragment) {
      pending.add(new Fragment<>(fragment, sequence++));
    }
  }

  private static final class Fragment<T> {
    private final T interval;
    private final long sequence;

    private Fragment(T interval, long sequence) {
      this.interval = interval;
      this.sequence = sequence;
    }
  }
}
