package timealgebra.core.coerce;

import timealgebra.core.model.Interval;

/** Which side of a query range a bound sits on. */
public enum BoundEdge {
  START,
  END;

  /** Sentinel used when this side of the range is left open. */
  public long unboundedValue() {
    return this == START ? Interval.UNBOUNDED_START : Interval.UNBOUNDED_END;
  }

  public String label() {
    return this == START ? "start" : "end";
  }
}
