package timealgebra.core.model;

import java.util.Comparator;

/** Orderings over intervals. Sentinel bounds sort as the extreme values they encode. */
public final class IntervalOrder {

  /** Lexicographic on {@code (start, end)}. */
  public static final Comparator<Interval> NATURAL =
      Comparator.comparingLong(Interval::finiteStart).thenComparingLong(Interval::finiteEnd);

  private IntervalOrder() {}

  public static int compare(Interval a, Interval b) {
    return NATURAL.compare(a, b);
  }

  public static boolean samePosition(Interval a, Interval b) {
    return a.finiteStart() == b.finiteStart() && a.finiteEnd() == b.finiteEnd();
  }
}
