package timealgebra.source;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import timealgebra.core.Timeline;
import timealgebra.core.coerce.BoundCoercer;
import timealgebra.core.coerce.StandardBoundCoercer;
import timealgebra.core.model.Interval;
import timealgebra.core.model.IntervalOrder;

/**
 * Timeline over a fixed, in-memory collection of intervals.
 *
 * <p>Intervals are sorted once at construction. A running maximum of end bounds lets a fetch skip
 * the prefix of intervals that all end before the query start, and a binary search on start bounds
 * finds where to stop.
 */
public final class StaticTimeline<T extends Interval> implements Timeline<T> {
  private final List<T> intervals;
  private final long[] starts;
  private final long[] maxEndPrefix;
  private final boolean mask;
  private final BoundCoercer coercer;

  private StaticTimeline(Collection<? extends T> intervals, boolean mask, BoundCoercer coercer) {
    List<T> sorted = new ArrayList<>(intervals);
    sorted.forEach(i -> Objects.requireNonNull(i, "interval"));
    sorted.sort(IntervalOrder.NATURAL);
    this.intervals = ImmutableList.copyOf(sorted);
    this.starts = new long[sorted.size()];
    this.maxEndPrefix = new long[sorted.size()];
    long maxEnd = Interval.UNBOUNDED_START;
    for (int i = 0; i < sorted.size(); i++) {
      T interval = sorted.get(i);
      starts[i] = interval.finiteStart();
      maxEnd = Math.max(maxEnd, interval.finiteEnd());
      maxEndPrefix[i] = maxEnd;
    }
    this.mask = mask;
    this.coercer = Objects.requireNonNull(coercer, "coercer");
  }

  /** Rich timeline: its intervals are treated as carrying metadata. */
  public static <T extends Interval> StaticTimeline<T> of(Collection<? extends T> intervals) {
    return new StaticTimeline<>(intervals, false, StandardBoundCoercer.utc());
  }

  @SafeVarargs
  public static <T extends Interval> StaticTimeline<T> of(T... intervals) {
    return of(Arrays.asList(intervals));
  }

  /** Mask timeline: plain coverage without metadata. */
  public static StaticTimeline<Interval> masks(Collection<? extends Interval> intervals) {
    return new StaticTimeline<>(intervals, true, StandardBoundCoercer.utc());
  }

  public static StaticTimeline<Interval> masks(Interval... intervals) {
    return masks(Arrays.asList(intervals));
  }

  public static <T extends Interval> Builder<T> builder() {
    return new Builder<>();
  }

  public List<T> intervals() {
    return intervals;
  }

  public int size() {
    return intervals.size();
  }

  @Override
  public Iterator<T> fetch(long start, long end) {
    if (intervals.isEmpty() || start >= end) {
      return Collections.emptyIterator();
    }
    int from = firstEndingAtOrAfter(start);
    int to = firstStartingAtOrAfter(end);
    if (from >= to) {
      return Collections.emptyIterator();
    }
    List<T> matches = new ArrayList<>(to - from);
    for (T interval : intervals.subList(from, to)) {
      if (interval.finiteEnd() > start || (interval.isEmpty() && interval.finiteStart() >= start)) {
        matches.add(interval);
      }
    }
    return Collections.unmodifiableList(matches).iterator();
  }

  private int firstEndingAtOrAfter(long start) {
    int low = 0;
    int high = maxEndPrefix.length - 1;
    while (low <= high) {
      int mid = (low + high) >>> 1;
      if (maxEndPrefix[mid] < start) {
        low = mid + 1;
      } else {
        high = mid - 1;
      }
    }
    return low;
  }

  private int firstStartingAtOrAfter(long end) {
    int low = 0;
    int high = starts.length - 1;
    while (low <= high) {
      int mid = (low + high) >>> 1;
      if (starts[mid] < end) {
        low = mid + 1;
      } else {
        high = mid - 1;
      }
    }
    return low;
  }

  @Override
  public boolean isMask() {
    return mask;
  }

  @Override
  public BoundCoercer boundCoercer() {
    return coercer;
  }

  @Override
  public String toString() {
    return "StaticTimeline" + (mask ? "(mask)" : "") + intervals;
  }

  public static final class Builder<T extends Interval> {
    private final List<T> intervals = new ArrayList<>();
    private boolean mask;
    private BoundCoercer coercer = StandardBoundCoercer.utc();

    private Builder() {}

    public Builder<T> add(T interval) {
      intervals.add(Objects.requireNonNull(interval, "interval"));
      return this;
    }

    public Builder<T> addAll(Collection<? extends T> more) {
      more.forEach(this::add);
      return this;
    }

    public Builder<T> mask(boolean mask) {
      this.mask = mask;
      return this;
    }

    public Builder<T> coercer(BoundCoercer coercer) {
      this.coercer = Objects.requireNonNull(coercer, "coercer");
      return this;
    }

    public StaticTimeline<T> build() {
      return new StaticTimeline<>(intervals, mask, coercer);
    }
  }
}
