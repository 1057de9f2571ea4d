package timealgebra.ops;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Iterators;
import java.util.Collections;
import java.util.Iterator;
import java.util.Objects;
import timealgebra.core.Timeline;
import timealgebra.core.coerce.BoundCoercer;
import timealgebra.core.model.Interval;
import timealgebra.core.model.Intervals;

/**
 * Gaps in the coverage of a child timeline.
 *
 * <p>Gaps are confined to the queried range. An open side of the range with nothing in the child
 * to bound it yields a gap that is unbounded on that side, so the complement of an empty timeline
 * over an open range is exactly one fully unbounded interval. Output is always mask intervals.
 */
public final class Complement implements Timeline<Interval> {
  private static final long INITIAL_WINDOW = 86_400;

  private final Timeline<?> source;
  private final MaskFactory factory;

  public Complement(Timeline<?> source) {
    this(source, MaskFactory.PLAIN);
  }

  public Complement(Timeline<?> source, MaskFactory factory) {
    this.source = Objects.requireNonNull(source, "source");
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  public Timeline<?> source() {
    return source;
  }

  public MaskFactory factory() {
    return factory;
  }

  @Override
  public Iterator<Interval> fetch(long start, long end) {
    return new GapIterator(source.fetch(start, end), start, end, factory);
  }

  /**
   * The whole gap around {@code point}. The child is fetched over windows on each side of the
   * point that double in width until a child interval bounds the gap; a side is left open only
   * once the window has grown to the whole timeline and still found nothing.
   */
  @Override
  public Iterator<Interval> overlapping(long point) {
    Iterator<? extends Interval> at = source.fetch(point, Intervals.plus(point, 1));
    while (at.hasNext()) {
      if (at.next().contains(point)) {
        return Collections.emptyIterator();
      }
    }
    return Iterators.singletonIterator(factory.create(gapStart(point), gapEnd(point)));
  }

  private long gapStart(long point) {
    for (long width = INITIAL_WINDOW; ; width *= 2) {
      long from = Intervals.minus(point, width);
      boolean open = from <= Interval.UNBOUNDED_START + 1 || width > Long.MAX_VALUE / 2;
      long bound = Interval.UNBOUNDED_START;
      Iterator<? extends Interval> before =
          source.fetch(open ? Interval.UNBOUNDED_START : from, point);
      while (before.hasNext()) {
        Interval interval = before.next();
        if (!interval.isEmpty() && interval.finiteEnd() <= point) {
          bound = Math.max(bound, interval.finiteEnd());
        }
      }
      if (bound != Interval.UNBOUNDED_START || open) {
        return bound;
      }
    }
  }

  private long gapEnd(long point) {
    for (long width = INITIAL_WINDOW; ; width *= 2) {
      long to = Intervals.plus(point, width);
      boolean open = to >= Interval.UNBOUNDED_END - 1 || width > Long.MAX_VALUE / 2;
      Iterator<? extends Interval> after = source.fetch(point, open ? Interval.UNBOUNDED_END : to);
      while (after.hasNext()) {
        Interval interval = after.next();
        if (!interval.isEmpty() && interval.finiteStart() > point) {
          return interval.finiteStart();
        }
      }
      if (open) {
        return Interval.UNBOUNDED_END;
      }
    }
  }

  @Override
  public boolean isMask() {
    return true;
  }

  @Override
  public BoundCoercer boundCoercer() {
    return source.boundCoercer();
  }

  @Override
  public String toString() {
    return "Complement[" + source + "]";
  }

  /**
   * Walks the child in order with a cursor marking where the next gap may begin. The cursor only
   * moves forward, so overlapping or nested child intervals are absorbed.
   */
  static final class GapIterator extends AbstractIterator<Interval> {
    private final Iterator<? extends Interval> covered;
    private final long end;
    private final MaskFactory factory;
    private long cursor;
    private boolean done;

    GapIterator(Iterator<? extends Interval> covered, long start, long end, MaskFactory factory) {
      this.covered = covered;
      this.end = end;
      this.factory = factory;
      this.cursor = start;
      this.done = start >= end;
    }

    @Override
    protected Interval computeNext() {
      if (done) {
        return endOfData();
      }
      while (covered.hasNext()) {
        Interval next = covered.next();
        if (next.isEmpty()) {
          continue;
        }
        if (next.finiteStart() >= end) {
          break;
        }
        long segmentStart = Math.max(next.finiteStart(), cursor);
        long segmentEnd = Math.min(next.finiteEnd(), end);
        if (segmentEnd <= cursor) {
          continue;
        }
        Interval gap = null;
        if (segmentStart > cursor) {
          gap = factory.create(cursor, segmentStart);
        }
        cursor = segmentEnd;
        if (cursor >= end) {
          done = true;
        }
        if (gap != null) {
          return gap;
        }
        if (done) {
          return endOfData();
        }
      }
      done = true;
      return cursor < end ? factory.create(cursor, end) : endOfData();
    }
  }
}
