package timealgebra.transform;

import com.google.common.collect.Iterators;
import java.util.Iterator;
import java.util.Objects;
import timealgebra.core.Timeline;
import timealgebra.core.coerce.BoundCoercer;
import timealgebra.core.model.Interval;
import timealgebra.core.model.Intervals;

/**
 * Widens every interval by {@code before} seconds at the start and {@code after} seconds at the
 * end. Unbounded ends stay unbounded and metadata is kept.
 *
 * <p>Widening never reorders intervals, and buffered intervals may overlap; flatten the result for
 * plain coverage.
 */
public final class Buffer<T extends Interval> implements Timeline<T> {
  private final Timeline<? extends T> source;
  private final long before;
  private final long after;

  public Buffer(Timeline<? extends T> source, long before, long after) {
    if (before < 0 || after < 0) {
      throw new IllegalArgumentException(
          "Buffer amounts must be non-negative, got before=" + before + ", after=" + after);
    }
    this.source = Objects.requireNonNull(source, "source");
    this.before = before;
    this.after = after;
  }

  @Override
  public Iterator<T> fetch(long start, long end) {
    Iterator<? extends T> widened =
        source.fetch(Intervals.minus(start, after), Intervals.plus(end, before));
    return Iterators.transform(widened, this::widen);
  }

  private T widen(T interval) {
    return Intervals.withBounds(
        interval,
        Intervals.minus(interval.finiteStart(), before),
        Intervals.plus(interval.finiteEnd(), after));
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
    return "Buffer[" + source + ", -" + before + "/+" + after + "]";
  }
}
