package timealgebra.filter;

import java.util.Objects;
import java.util.function.Predicate;
import timealgebra.core.model.Interval;

/** Filter that tests the value of a {@link Property}. */
public final class Comparison<T extends Interval, V> implements Filter<T> {
  private final Property<T, V> property;
  private final String description;
  private final Predicate<? super V> predicate;

  public Comparison(Property<T, V> property, String description, Predicate<? super V> predicate) {
    this.property = Objects.requireNonNull(property, "property");
    this.description = Objects.requireNonNull(description, "description");
    this.predicate = Objects.requireNonNull(predicate, "predicate");
  }

  @Override
  public boolean test(T interval) {
    return predicate.test(property.apply(interval));
  }

  @Override
  public String toString() {
    return "value " + description;
  }
}
