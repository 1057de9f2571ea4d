package timealgebra.ops;

import com.google.common.collect.Iterators;
import java.util.Iterator;
import java.util.Objects;
import timealgebra.core.Timeline;
import timealgebra.core.coerce.BoundCoercer;
import timealgebra.core.model.Interval;
import timealgebra.filter.Filter;

/** Child intervals that satisfy a {@link Filter}, passed through unmodified. */
public final class Filtered<T extends Interval> implements Timeline<T> {
  private final Timeline<? extends T> source;
  private final Filter<? super T> filter;

  public Filtered(Timeline<? extends T> source, Filter<? super T> filter) {
    this.source = Objects.requireNonNull(source, "source");
    this.filter = Objects.requireNonNull(filter, "filter");
  }

  public Timeline<? extends T> source() {
    return source;
  }

  public Filter<? super T> filter() {
    return filter;
  }

  @Override
  public Iterator<T> fetch(long start, long end) {
    return Iterators.filter(Iterators.unmodifiableIterator(source.fetch(start, end)), filter::test);
  }

  @Override
  public Iterator<T> overlapping(long point) {
    return Iterators.filter(
        Iterators.unmodifiableIterator(source.overlapping(point)), filter::test);
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
    return "Filtered[" + source + " where " + filter + "]";
  }
}
