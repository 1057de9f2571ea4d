package timealgebra.filter;

import timealgebra.core.model.Interval;

/** A property whose values are ordered, adding range comparisons. */
@FunctionalInterface
public interface ComparableProperty<T extends Interval, V extends Comparable<? super V>>
    extends Property<T, V> {

  default Filter<T> atLeast(V bound) {
    return matches(">= " + bound, v -> v.compareTo(bound) >= 0);
  }

  default Filter<T> atMost(V bound) {
    return matches("<= " + bound, v -> v.compareTo(bound) <= 0);
  }

  default Filter<T> greaterThan(V bound) {
    return matches("> " + bound, v -> v.compareTo(bound) > 0);
  }

  default Filter<T> lessThan(V bound) {
    return matches("< " + bound, v -> v.compareTo(bound) < 0);
  }
}
