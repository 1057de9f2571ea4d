package timealgebra.filter;

import timealgebra.core.model.Interval;

/**
 * Predicate over a single interval.
 *
 * <p>Filters combine with each other through {@link #and(Filter)} and {@link #or(Filter)}; they
 * are applied to a timeline with {@link timealgebra.core.Timeline#where(Filter)}.
 */
@FunctionalInterface
public interface Filter<T extends Interval> {

  boolean test(T interval);

  default Filter<T> and(Filter<? super T> other) {
    return And.of(this, other);
  }

  default Filter<T> or(Filter<? super T> other) {
    return Or.of(this, other);
  }
}
