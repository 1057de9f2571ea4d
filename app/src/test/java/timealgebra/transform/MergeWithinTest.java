package timealgebra.transform;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static timealgebra.testing.TestTimelines.fetchAll;
import static timealgebra.testing.TestTimelines.labeled;
import static timealgebra.testing.TestTimelines.masks;
import static timealgebra.testing.TestTimelines.spans;

import java.util.List;
import org.junit.jupiter.api.Test;
import timealgebra.core.Timeline;
import timealgebra.core.model.Interval;
import timealgebra.ops.Flatten;

final class MergeWithinTest {

  @Test
  void closeIntervalsAreMerged() {
    Timeline<Interval> merged = new MergeWithin(labeled("e", 0, 10, 15, 20, 40, 50), 5);

    assertEquals(spans(0, 20, 40, 50), fetchAll(merged, 0, 100));
    assertTrue(merged.isMask());
  }

  @Test
  void zeroGapMatchesFlatten() {
    Timeline<Interval> source = masks(0, 10, 10, 20, 5, 8, 25, 30);

    assertEquals(
        fetchAll(Flatten.of(source), 0, 100), fetchAll(new MergeWithin(source, 0), 0, 100));
  }

  @Test
  void neighboursJustOutsideTheRangeBridgeGaps() {
    Timeline<Interval> merged = new MergeWithin(masks(0, 10, 14, 20, 200, 210), 5);

    assertEquals(spans(0, 20), fetchAll(merged, 12, 100));
    assertEquals(spans(0, 12), merged.query().between(0L, 12L).list());
  }

  @Test
  void spansEntirelyOutsideTheRangeAreDropped() {
    Timeline<Interval> merged = new MergeWithin(masks(0, 10, 102, 110), 5);

    assertEquals(List.of(), fetchAll(merged, 12, 100));
  }

  @Test
  void unboundedIntervalsMerge() {
    Timeline<Interval> merged = new MergeWithin(masks(Long.MIN_VALUE, 0, 3, 10), 5);

    assertEquals(
        List.of(Interval.until(10)),
        fetchAll(merged, Interval.UNBOUNDED_START, Interval.UNBOUNDED_END));
  }

  @Test
  void negativeGapIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new MergeWithin(masks(0, 1), -1));
  }
}
