package timealgebra.ops;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;
import com.google.common.collect.PeekingIterator;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.function.Function;
import java.util.stream.IntStream;
import timealgebra.core.Timeline;
import timealgebra.core.coerce.BoundCoercer;
import timealgebra.core.model.Interval;
import timealgebra.core.model.IntervalOrder;
import timealgebra.core.model.Intervals;

/**
 * Coverage shared by every child.
 *
 * <p>Every combination of one interval per child whose members all overlap yields the overlap
 * {@code [max(starts), min(ends))}. Children may hold overlapping intervals of their own, such as
 * overlapping calendar events; each of them is paired separately. Output is ascending.
 *
 * <p>Which children an overlap is emitted from depends on their mask flags:
 *
 * <ul>
 *   <li>all masks: one interval per overlap, taken from the first child;
 *   <li>masks mixed with rich children: one clipped copy per rich child, so rich metadata survives
 *       and the masks add no entries;
 *   <li>all rich: one clipped copy per child, so an overlap of two rich children yields two
 *       intervals in the same position. Apply {@link Flatten} for plain coverage.
 * </ul>
 *
 * <p>Consecutive entries of one child in the same position are collapsed before pairing.
 * Intersections nested directly inside an intersection are folded into one node when built.
 */
public final class Intersection<T extends Interval> implements Timeline<T> {
  private final List<Timeline<? extends T>> sources;
  private final boolean mask;
  private final int[] emitIndices;

  public Intersection(List<? extends Timeline<? extends T>> sources) {
    Objects.requireNonNull(sources, "sources");
    List<Timeline<? extends T>> flattened = new ArrayList<>();
    for (Timeline<? extends T> source : sources) {
      Objects.requireNonNull(source, "source");
      if (source instanceof Intersection<?> nested) {
        flattened.addAll(childrenOf(nested));
      } else {
        flattened.add(source);
      }
    }
    this.sources = ImmutableList.copyOf(flattened);
    this.mask = this.sources.stream().allMatch(Timeline::isMask);
    this.emitIndices = emitIndices(this.sources, mask);
  }

  @SafeVarargs
  public static <T extends Interval> Intersection<T> of(Timeline<? extends T>... sources) {
    return new Intersection<>(List.of(sources));
  }

  /**
   * Intersection of a timeline with a mask. The mask never contributes entries, so the result
   * keeps the element type of {@code source}.
   */
  @SuppressWarnings("unchecked")
  public static <T extends Interval> Intersection<T> within(Timeline<T> source, Timeline<?> mask) {
    Objects.requireNonNull(mask, "mask");
    if (!mask.isMask()) {
      throw new IllegalArgumentException(
          "within() needs a mask timeline; use and() to intersect two rich timelines");
    }
    return new Intersection<>(List.of(source, (Timeline<? extends T>) mask));
  }

  @SuppressWarnings("unchecked")
  private static <T extends Interval> List<Timeline<? extends T>> childrenOf(Intersection<?> n) {
    return (List<Timeline<? extends T>>) (List<?>) n.sources;
  }

  private static int[] emitIndices(List<? extends Timeline<?>> sources, boolean allMask) {
    if (sources.isEmpty()) {
      return new int[0];
    }
    if (allMask) {
      return new int[] {0};
    }
    return IntStream.range(0, sources.size()).filter(i -> !sources.get(i).isMask()).toArray();
  }

  public List<Timeline<? extends T>> sources() {
    return sources;
  }

  @Override
  public Iterator<T> fetch(long start, long end) {
    return evaluate(source -> source.fetch(start, end));
  }

  @Override
  public Iterator<T> overlapping(long point) {
    return evaluate(source -> source.overlapping(point));
  }

  private Iterator<T> evaluate(Function<Timeline<? extends T>, Iterator<? extends T>> open) {
    if (sources.isEmpty()) {
      return Collections.emptyIterator();
    }
    if (sources.size() == 1) {
      return Iterators.unmodifiableIterator(open.apply(sources.get(0)));
    }
    List<Iterator<? extends T>> streams = new ArrayList<>(sources.size());
    for (Timeline<? extends T> source : sources) {
      streams.add(new SamePositionSkipper<>(open.apply(source)));
    }
    return new SweepIterator<>(streams, emitIndices);
  }

  @Override
  public boolean isMask() {
    return mask;
  }

  @Override
  public BoundCoercer boundCoercer() {
    return sources.isEmpty() ? Timeline.super.boundCoercer() : sources.get(0).boundCoercer();
  }

  @Override
  public String toString() {
    return "Intersection" + sources;
  }

  /** Skips entries that repeat the previous entry's {@code (start, end)}. */
  private static final class SamePositionSkipper<T extends Interval> extends AbstractIterator<T> {
    private final Iterator<? extends T> source;
    private T previous;

    private SamePositionSkipper(Iterator<? extends T> source) {
      this.source = source;
    }

    @Override
    protected T computeNext() {
      while (source.hasNext()) {
        T next = source.next();
        if (previous == null || !IntervalOrder.samePosition(previous, next)) {
          previous = next;
          return next;
        }
      }
      return endOfData();
    }
  }

  /**
   * Sweeps the children in global start order. Every child keeps the intervals that still reach
   * past the sweep position; when an interval arrives, it is paired with each combination of
   * active intervals from the other children. The arriving interval has the largest start of any
   * such combination, so each combination is produced exactly once and overlaps are produced in
   * start order. Overlaps sharing a start are held until the sweep moves past it, then released
   * sorted by end.
   */
  private static final class SweepIterator<T extends Interval> extends AbstractIterator<T> {
    private final List<PeekingIterator<? extends T>> streams;
    private final int[] emitIndices;
    private final List<List<T>> active;
    private final PriorityQueue<Overlap<T>> pending =
        new PriorityQueue<>(
            Comparator.<Overlap<T>, Interval>comparing(o -> o.interval, IntervalOrder.NATURAL)
                .thenComparingLong(o -> o.sequence));
    private long sequence;

    private SweepIterator(List<Iterator<? extends T>> streams, int[] emitIndices) {
      this.streams = new ArrayList<>(streams.size());
      this.active = new ArrayList<>(streams.size());
      for (Iterator<? extends T> stream : streams) {
        this.streams.add(Iterators.peekingIterator(stream));
        this.active.add(new ArrayList<>());
      }
      this.emitIndices = emitIndices;
    }

    @Override
    protected T computeNext() {
      while (true) {
        int next = nextChild();
        if (!pending.isEmpty()) {
          Overlap<T> head = pending.peek();
          if (next < 0 || head.interval.finiteStart() < streams.get(next).peek().finiteStart()) {
            return pending.poll().interval;
          }
        }
        if (next < 0) {
          return endOfData();
        }
        arrive(next, streams.get(next).next());
      }
    }

    /** Child holding the smallest next interval, earlier children first on ties; -1 when done. */
    private int nextChild() {
      int best = -1;
      for (int i = 0; i < streams.size(); i++) {
        PeekingIterator<? extends T> stream = streams.get(i);
        if (!stream.hasNext()) {
          if (active.get(i).isEmpty()) {
            return -1;
          }
          continue;
        }
        if (best < 0
            || IntervalOrder.NATURAL.compare(stream.peek(), streams.get(best).peek()) < 0) {
          best = i;
        }
      }
      return best;
    }

    private void arrive(int child, T interval) {
      long position = interval.finiteStart();
      for (List<T> intervals : active) {
        intervals.removeIf(open -> open.finiteEnd() <= position);
      }
      List<T> combination = new ArrayList<>(Collections.<T>nCopies(streams.size(), null));
      combination.set(child, interval);
      pair(combination, child, 0, position, interval.finiteEnd());
      if (interval.finiteEnd() > position) {
        active.get(child).add(interval);
      }
    }

    private void pair(List<T> combination, int arriving, int index, long start, long end) {
      if (end <= start) {
        return;
      }
      if (index == combination.size()) {
        for (int idx : emitIndices) {
          pending.add(
              new Overlap<>(Intervals.withBounds(combination.get(idx), start, end), sequence++));
        }
        return;
      }
      if (index == arriving) {
        pair(combination, arriving, index + 1, start, end);
        return;
      }
      for (T open : active.get(index)) {
        combination.set(index, open);
        pair(combination, arriving, index + 1, start, Math.min(end, open.finiteEnd()));
      }
    }
  }

  private static final class Overlap<T> {
    private final T interval;
    private final long sequence;

    private Overlap(T interval, long sequence) {
      this.interval = interval;
      this.sequence = sequence;
    }
  }
}
