package timealgebra.transform;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Iterators;
import com.google.common.collect.PeekingIterator;
import java.util.Iterator;
import java.util.Objects;
import timealgebra.core.Timeline;
import timealgebra.core.coerce.BoundCoercer;
import timealgebra.core.model.Interval;
import timealgebra.core.model.Intervals;
import timealgebra.ops.MaskFactory;

/**
 * Coalesces intervals separated by at most {@code gap} seconds into single mask intervals.
 *
 * <p>A gap of zero merges only touching and overlapping intervals, which matches {@link
 * timealgebra.ops.Flatten} on the fetched range. The child is fetched {@code gap} seconds beyond
 * each side of the range, so a chain of close intervals reaching further out is only merged as far
 * as that margin.
 */
public final class MergeWithin implements Timeline<Interval> {
  private final Timeline<?> source;
  private final long gap;
  private final MaskFactory factory;

  public MergeWithin(Timeline<?> source, long gap) {
    this(source, gap, MaskFactory.PLAIN);
  }

  public MergeWithin(Timeline<?> source, long gap, MaskFactory factory) {
    if (gap < 0) {
      throw new IllegalArgumentException("Merge gap must be non-negative, got " + gap);
    }
    this.source = Objects.requireNonNull(source, "source");
    this.gap = gap;
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  @Override
  public Iterator<Interval> fetch(long start, long end) {
    PeekingIterator<? extends Interval> intervals =
        Iterators.peekingIterator(
            source.fetch(Intervals.minus(start, gap), Intervals.plus(end, gap)));
    return new AbstractIterator<>() {
      @Override
      protected Interval computeNext() {
        while (intervals.hasNext()) {
          Interval first = intervals.next();
          long mergedStart = first.finiteStart();
          long mergedEnd = first.finiteEnd();
          while (intervals.hasNext()
              && intervals.peek().finiteStart() <= Intervals.plus(mergedEnd, gap)) {
            mergedEnd = Math.max(mergedEnd, intervals.next().finiteEnd());
          }
          // Neighbours fetched only to bridge gaps at the range edges.
          boolean inRange =
              mergedStart == mergedEnd ? mergedStart >= start : mergedEnd > start;
          if (mergedStart < end && inRange) {
            return factory.create(mergedStart, mergedEnd);
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
    return source.boundCoercer();
  }

  @Override
  public String toString() {
    return "MergeWithin[" + source + ", " + gap + "]";
  }
}
