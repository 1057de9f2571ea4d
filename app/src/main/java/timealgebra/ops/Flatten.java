package timealgebra.ops;

import timealgebra.core.Timeline;
import timealgebra.core.model.Interval;

/**
 * Coalesced coverage of a timeline: the fewest non-overlapping mask intervals covering exactly
 * what the child covers. Touching and overlapping spans merge; metadata is dropped.
 *
 * <p>Built as a double {@link Complement}, which also gives it the complement's handling of open
 * ranges.
 */
public final class Flatten {

  private Flatten() {}

  public static Timeline<Interval> of(Timeline<?> source) {
    return of(source, MaskFactory.PLAIN);
  }

  public static Timeline<Interval> of(Timeline<?> source, MaskFactory factory) {
    return new Complement(new Complement(source), factory);
  }
}
