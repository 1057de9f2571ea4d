package timealgebra.filter;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import timealgebra.core.model.Interval;

/** Matches when any filter matches. An empty disjunction matches nothing. */
public final class Or<T extends Interval> implements Filter<T> {
  private final List<Filter<? super T>> filters;

  public Or(List<? extends Filter<? super T>> filters) {
    List<Filter<? super T>> flattened = new ArrayList<>();
    for (Filter<? super T> filter : filters) {
      Objects.requireNonNull(filter, "filter");
      if (filter instanceof Or<?> nested) {
        flattened.addAll(membersOf(nested));
      } else {
        flattened.add(filter);
      }
    }
    this.filters = ImmutableList.copyOf(flattened);
  }

  @SafeVarargs
  public static <T extends Interval> Or<T> of(Filter<? super T>... filters) {
    return new Or<T>(List.<Filter<? super T>>of(filters));
  }

  /** A nested disjunction over a supertype of {@code T} only holds filters over supertypes. */
  @SuppressWarnings("unchecked")
  private static <T extends Interval> List<Filter<? super T>> membersOf(Or<?> nested) {
    return (List<Filter<? super T>>) (List<?>) nested.filters;
  }

  public List<Filter<? super T>> filters() {
    return filters;
  }

  @Override
  public boolean test(T interval) {
    for (Filter<? super T> filter : filters) {
      if (filter.test(interval)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return "Or" + filters;
  }
}
