package timealgebra.filter;

import java.util.Objects;
import java.util.function.Predicate;
import timealgebra.core.model.Interval;

/** A value read from an interval, used to build filters. */
@FunctionalInterface
public interface Property<T extends Interval, V> {

  V apply(T interval);

  default Filter<T> matches(String description, Predicate<? super V> predicate) {
    return new Comparison<>(this, description, predicate);
  }

  /** Equality against a value of the property's own type. */
  default Filter<T> isEqualTo(V value) {
    return matches("== " + value, v -> Objects.equals(v, value));
  }

  default Filter<T> isNotEqualTo(V value) {
    return matches("!= " + value, v -> !Objects.equals(v, value));
  }
}
