package timealgebra.ops;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import timealgebra.cache.CacheOptions;
import timealgebra.cache.CachedTimeline;
import timealgebra.core.Timeline;
import timealgebra.core.model.Interval;
import timealgebra.source.StaticTimeline;
import timealgebra.transform.Buffer;
import timealgebra.transform.MergeWithin;

/** Static constructors for building timeline expressions without the fluent methods. */
public final class Timelines {

  private Timelines() {}

  @SafeVarargs
  public static <T extends Interval> Timeline<T> unionOf(Timeline<? extends T>... sources) {
    return unionOf(List.of(sources));
  }

  /**
   * @throws IllegalArgumentException if {@code sources} is empty
   */
  public static <T extends Interval> Timeline<T> unionOf(
      List<? extends Timeline<? extends T>> sources) {
    requireSome(sources, "union");
    return new Union<>(sources);
  }

  @SafeVarargs
  public static <T extends Interval> Timeline<T> intersectionOf(Timeline<? extends T>... sources) {
    return intersectionOf(List.of(sources));
  }

  /**
   * @throws IllegalArgumentException if {@code sources} is empty
   */
  public static <T extends Interval> Timeline<T> intersectionOf(
      List<? extends Timeline<? extends T>> sources) {
    requireSome(sources, "intersection");
    return new Intersection<>(sources);
  }

  public static <T extends Interval> Timeline<T> differenceOf(
      Timeline<? extends T> source, Timeline<?>... subtractors) {
    return new Difference<>(source, subtractors);
  }

  public static Timeline<Interval> complementOf(Timeline<?> source) {
    return new Complement(source);
  }

  public static Timeline<Interval> flattenOf(Timeline<?> source) {
    return Flatten.of(source);
  }

  public static <T extends Interval> Timeline<T> bufferOf(
      Timeline<? extends T> source, Duration before, Duration after) {
    return new Buffer<>(source, before.getSeconds(), after.getSeconds());
  }

  public static Timeline<Interval> mergeWithin(Timeline<?> source, Duration gap) {
    return new MergeWithin(source, gap.getSeconds());
  }

  public static <T extends Interval> CachedTimeline<T> cachedOf(
      Timeline<? extends T> source, CacheOptions options) {
    return new CachedTimeline<>(source, options);
  }

  public static <T extends Interval> Timeline<T> of(Collection<? extends T> intervals) {
    return StaticTimeline.of(intervals);
  }

  public static Timeline<Interval> masks(Interval... intervals) {
    return StaticTimeline.masks(intervals);
  }

  /** A mask timeline that never yields anything. Its complement is one unbounded interval. */
  public static Timeline<Interval> empty() {
    return new Timeline<>() {
      @Override
      public Iterator<Interval> fetch(long start, long end) {
        return Collections.emptyIterator();
      }

      @Override
      public boolean isMask() {
        return true;
      }

      @Override
      public String toString() {
        return "Empty";
      }
    };
  }

  private static void requireSome(List<?> sources, String kind) {
    Objects.requireNonNull(sources, "sources");
    if (sources.isEmpty()) {
      throw new IllegalArgumentException("A " + kind + " needs at least one timeline");
    }
  }
}
