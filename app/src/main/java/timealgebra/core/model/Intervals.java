package timealgebra.core.model;

import java.util.Optional;

/**
 * Type-preserving helpers over {@link Interval}.
 *
 * <p>{@link Interval#withBounds(long, long)} is declared to return {@code Interval}; subclasses
 * narrow it to their own type, which is what makes the casts below safe for well-behaved variants.
 */
public final class Intervals {

  private Intervals() {}

  @SuppressWarnings("unchecked")
  public static <T extends Interval> T withBounds(T interval, long start, long end) {
    if (interval.finiteStart() == start && interval.finiteEnd() == end) {
      return interval;
    }
    return (T) interval.withBounds(start, end);
  }

  @SuppressWarnings("unchecked")
  public static <T extends Interval> Optional<T> clip(T interval, long start, long end) {
    return (Optional<T>) (Optional<?>) interval.clip(start, end);
  }

  public static boolean overlaps(Interval a, Interval b) {
    return a.overlaps(b);
  }

  /** Subtraction that saturates at the unbounded sentinels instead of wrapping. */
  public static long minus(long bound, long amount) {
    if (bound == Interval.UNBOUNDED_START || bound == Interval.UNBOUNDED_END) {
      return bound;
    }
    long result = bound - amount;
    long floor = Interval.UNBOUNDED_START + 1;
    return result > bound ? floor : Math.max(result, floor);
  }

  /** Addition that saturates at the unbounded sentinels instead of wrapping. */
  public static long plus(long bound, long amount) {
    if (bound == Interval.UNBOUNDED_START || bound == Interval.UNBOUNDED_END) {
      return bound;
    }
    long result = bound + amount;
    long ceiling = Interval.UNBOUNDED_END - 1;
    return result < bound ? ceiling : Math.min(result, ceiling);
  }
}
