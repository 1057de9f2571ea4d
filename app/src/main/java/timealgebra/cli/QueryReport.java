package timealgebra.cli;

import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import timealgebra.cache.CacheStats;
import timealgebra.core.Direction;
import timealgebra.core.model.Interval;

/** Outcome of one command-line query, ready to be rendered. */
record QueryReport(
    String expression,
    long start,
    long end,
    Direction direction,
    boolean mask,
    List<? extends Interval> intervals,
    Map<String, CacheStats> cacheStats,
    int repeat,
    long elapsedMillis) {

  QueryReport {
    intervals = List.copyOf(intervals);
    cacheStats = ImmutableMap.copyOf(cacheStats);
  }
}
