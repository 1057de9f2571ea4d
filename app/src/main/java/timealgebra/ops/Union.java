package timealgebra.ops;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import timealgebra.core.Timeline;
import timealgebra.core.coerce.BoundCoercer;
import timealgebra.core.model.Interval;

/**
 * All intervals of all children, merged by {@code (start, end)}.
 *
 * <p>Intervals are emitted unchanged and duplicates across children are kept. Unions nested
 * directly inside a union are folded into a single N-way merge when the node is built.
 */
public final class Union<T extends Interval> implements Timeline<T> {
  private final List<Timeline<? extends T>> sources;
  private final boolean mask;

  public Union(List<? extends Timeline<? extends T>> sources) {
    Objects.requireNonNull(sources, "sources");
    List<Timeline<? extends T>> flattened = new ArrayList<>();
    for (Timeline<? extends T> source : sources) {
      Objects.requireNonNull(source, "source");
      if (source instanceof Union<?> nested) {
        flattened.addAll(childrenOf(nested));
      } else {
        flattened.add(source);
      }
    }
    this.sources = ImmutableList.copyOf(flattened);
    this.mask = this.sources.stream().allMatch(Timeline::isMask);
  }

  @SafeVarargs
  public static <T extends Interval> Union<T> of(Timeline<? extends T>... sources) {
    return new Union<>(List.of(sources));
  }

  @SuppressWarnings("unchecked")
  private static <T extends Interval> List<Timeline<? extends T>> childrenOf(Union<?> nested) {
    return (List<Timeline<? extends T>>) (List<?>) nested.sources;
  }

  public List<Timeline<? extends T>> sources() {
    return sources;
  }

  @Override
  public Iterator<T> fetch(long start, long end) {
    List<Iterator<? extends T>> streams = new ArrayList<>(sources.size());
    for (Timeline<? extends T> source : sources) {
      streams.add(source.fetch(start, end));
    }
    return MergingIterator.merge(streams);
  }

  @Override
  public Iterator<T> overlapping(long point) {
    List<Iterator<? extends T>> streams = new ArrayList<>(sources.size());
    for (Timeline<? extends T> source : sources) {
      streams.add(source.overlapping(point));
    }
    return MergingIterator.merge(streams);
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
    return "Union" + sources;
  }
}
