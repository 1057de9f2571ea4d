package timealgebra.core;

/** Delivery order of query results. */
public enum Direction {
  ASCENDING,
  /** Newest first. Same result set as {@link #ASCENDING}, reversed. */
  DESCENDING
}
