package timealgebra.ops;

import java.util.Objects;
import timealgebra.core.Timeline;
import timealgebra.core.model.Interval;
import timealgebra.filter.And;
import timealgebra.filter.Filter;
import timealgebra.filter.Or;

/**
 * Combines operands whose kind is only known at runtime, such as names resolved by the expression
 * parser. An operand is either a {@link Timeline} or a {@link Filter}.
 *
 * <ul>
 *   <li>{@link #either}: timeline with timeline is a {@link Union}; filter with filter is an {@link
 *       Or}. A timeline with a filter is rejected.
 *   <li>{@link #both}: timeline with timeline is an {@link Intersection}; filter with filter is an
 *       {@link And}; a timeline with a filter, in either order, is {@link Filtered}.
 * </ul>
 */
public final class Composition {

  private Composition() {}

  @SuppressWarnings({"unchecked", "rawtypes"})
  public static Object either(Object left, Object right) {
    requireOperand(left);
    requireOperand(right);
    if (left instanceof Timeline<?> a && right instanceof Timeline<?> b) {
      return Union.of((Timeline) a, (Timeline) b);
    }
    if (left instanceof Filter<?> a && right instanceof Filter<?> b) {
      return Or.of((Filter) a, (Filter) b);
    }
    throw new TimelineCompositionException(
        "Cannot union a "
            + kind(left)
            + " with a "
            + kind(right)
            + ". Use '|' between two timelines or two filters; apply a filter to a timeline with"
            + " '&'.");
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  public static Object both(Object left, Object right) {
    requireOperand(left);
    requireOperand(right);
    if (left instanceof Timeline<?> a && right instanceof Timeline<?> b) {
      return Intersection.of((Timeline) a, (Timeline) b);
    }
    if (left instanceof Filter<?> a && right instanceof Filter<?> b) {
      return And.of((Filter) a, (Filter) b);
    }
    if (left instanceof Timeline<?> timeline) {
      return new Filtered((Timeline) timeline, (Filter) right);
    }
    return new Filtered((Timeline) right, (Filter) left);
  }

  /** Difference of two timelines. Filters cannot be subtracted. */
  public static Timeline<?> without(Object left, Object right) {
    if (left instanceof Timeline<?> a && right instanceof Timeline<?> b) {
      return new Difference<Interval>(a, b);
    }
    throw new TimelineCompositionException(
        "Cannot subtract a " + kind(right) + " from a " + kind(left) + "; both must be timelines.");
  }

  public static Timeline<Interval> complement(Object operand) {
    if (operand instanceof Timeline<?> timeline) {
      return new Complement(timeline);
    }
    throw new TimelineCompositionException("Cannot complement a " + kind(operand) + ".");
  }

  public static Timeline<Interval> flatten(Object operand) {
    if (operand instanceof Timeline<?> timeline) {
      return Flatten.of(timeline);
    }
    throw new TimelineCompositionException("Cannot flatten a " + kind(operand) + ".");
  }

  private static void requireOperand(Object operand) {
    Objects.requireNonNull(operand, "operand");
    if (!(operand instanceof Timeline<?>) && !(operand instanceof Filter<?>)) {
      throw new TimelineCompositionException(
          "Operands must be timelines or filters, got " + operand.getClass().getName());
    }
  }

  private static String kind(Object operand) {
    if (operand instanceof Timeline<?>) {
      return "timeline";
    }
    if (operand instanceof Filter<?>) {
      return "filter";
    }
    return operand == null ? "null" : operand.getClass().getSimpleName();
  }
}
