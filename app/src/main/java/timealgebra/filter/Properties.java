package timealgebra.filter;

import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import timealgebra.core.model.Interval;

/**
 * Ready-made properties and membership filters.
 *
 * <pre>{@code
 * Timeline<Meeting> longOnes = meetings.where(Properties.hours().atLeast(2.0));
 * Timeline<Meeting> focus = meetings.where(Properties.oneOf(Properties.field(Meeting::label),
 *     Set.of("focus")));
 * }</pre>
 */
public final class Properties {
  private static final long SECOND = 1;
  private static final long MINUTE = 60;
  private static final long HOUR = 3600;
  private static final long DAY = 86400;

  private Properties() {}

  /** Start bound in seconds, with an open start reading as {@link Long#MIN_VALUE}. */
  public static ComparableProperty<Interval, Long> start() {
    return Interval::finiteStart;
  }

  /** End bound in seconds, with an open end reading as {@link Long#MAX_VALUE}. */
  public static ComparableProperty<Interval, Long> end() {
    return Interval::finiteEnd;
  }

  public static ComparableProperty<Interval, Double> seconds() {
    return duration(SECOND);
  }

  public static ComparableProperty<Interval, Double> minutes() {
    return duration(MINUTE);
  }

  public static ComparableProperty<Interval, Double> hours() {
    return duration(HOUR);
  }

  public static ComparableProperty<Interval, Double> days() {
    return duration(DAY);
  }

  /** Duration in the given unit; unbounded intervals are infinitely long. */
  private static ComparableProperty<Interval, Double> duration(long scale) {
    return interval -> {
      if (!interval.isBounded()) {
        return Double.POSITIVE_INFINITY;
      }
      return (interval.finiteEnd() - interval.finiteStart()) / (double) scale;
    };
  }

  public static <T extends Interval, V> Property<T, V> field(Function<? super T, ? extends V> f) {
    Objects.requireNonNull(f, "accessor");
    return f::apply;
  }

  public static <T extends Interval, V extends Comparable<? super V>>
      ComparableProperty<T, V> comparableField(Function<? super T, ? extends V> accessor) {
    Objects.requireNonNull(accessor, "accessor");
    return accessor::apply;
  }

  /** Matches when the property value is one of {@code values}. */
  public static <T extends Interval, V> Filter<T> oneOf(
      Property<T, V> property, Collection<?> values) {
    Set<?> accepted = ImmutableSet.copyOf(values);
    return property.matches("in " + accepted, accepted::contains);
  }

  /**
   * Matches when a collection-valued property shares at least one element with {@code values}. A
   * non-collection value matches when it is itself one of {@code values}.
   */
  public static <T extends Interval, V> Filter<T> hasAny(
      Property<T, V> property, Collection<?> values) {
    Set<?> wanted = ImmutableSet.copyOf(values);
    return property.matches(
        "has any of " + wanted,
        value -> {
          if (value instanceof Collection<?> collection) {
            return collection.stream().anyMatch(wanted::contains);
          }
          return wanted.contains(value);
        });
  }

  /**
   * Matches when a collection-valued property contains every element of {@code values}. A
   * non-collection value matches only a single required value equal to it.
   */
  public static <T extends Interval, V> Filter<T> hasAll(
      Property<T, V> property, Collection<?> values) {
    Set<?> wanted = ImmutableSet.copyOf(values);
    return property.matches(
        "has all of " + wanted,
        value -> {
          if (value instanceof Collection<?> collection) {
            return collection.containsAll(wanted);
          }
          return wanted.size() == 1 && wanted.contains(value);
        });
  }
}
