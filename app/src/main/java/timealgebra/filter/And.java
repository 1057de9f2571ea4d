package timealgebra.filter;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import timealgebra.core.model.Interval;

/** Matches when every filter matches. An empty conjunction matches everything. */
public final class And<T extends Interval> implements Filter<T> {
  private final List<Filter<? super T>> filters;

  public And(List<? extends Filter<? super T>> filters) {
    List<Filter<? super T>> flattened = new ArrayList<>();
    for (Filter<? super T> filter : filters) {
      Objects.requireNonNull(filter, "filter");
      if (filter instanceof And<?> nested) {
        flattened.addAll(membersOf(nested));
      } else {
        flattened.add(filter);
      }
    }
    this.filters = ImmutableList.copyOf(flattened);
  }

  @SafeVarargs
  public static <T extends Interval> And<T> of(Filter<? super T>... filters) {
    return new And<T>(List.<Filter<? super T>>of(filters));
  }

  /** A nested conjunction over a supertype of {@code T} only holds filters over supertypes. */
  @SuppressWarnings("unchecked")
  private static <T extends Interval> List<Filter<? super T>> membersOf(And<?> nested) {
    return (List<Filter<? super T>>) (List<?>) nested.filters;
  }

  public List<Filter<? super T>> filters() {
    return filters;
  }

  @Override
  public boolean test(T interval) {
    for (Filter<? super T> filter : filters) {
      if (!filter.test(interval)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString() {
    return "And" + filters;
  }
}
