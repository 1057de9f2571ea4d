package timealgebra.testing;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import timealgebra.core.Timeline;
import timealgebra.core.coerce.BoundCoercer;
import timealgebra.core.model.Interval;

/** Wraps a timeline and records every range it is fetched over. */
public final class CountingTimeline<T extends Interval> implements Timeline<T> {
  private final Timeline<T> delegate;
  private final List<Interval> fetchedRanges = new ArrayList<>();

  public CountingTimeline(Timeline<T> delegate) {
    this.delegate = delegate;
  }

  @Override
  public Iterator<T> fetch(long start, long end) {
    fetchedRanges.add(Interval.of(start, end));
    return delegate.fetch(start, end);
  }

  @Override
  public boolean isMask() {
    return delegate.isMask();
  }

  @Override
  public BoundCoercer boundCoercer() {
    return delegate.boundCoercer();
  }

  public int fetchCount() {
    return fetchedRanges.size();
  }

  public List<Interval> fetchedRanges() {
    return List.copyOf(fetchedRanges);
  }

  public Interval lastRange() {
    return fetchedRanges.get(fetchedRanges.size() - 1);
  }

  public void reset() {
    fetchedRanges.clear();
  }
}
