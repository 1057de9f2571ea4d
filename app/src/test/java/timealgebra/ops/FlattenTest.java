package timealgebra.ops;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static timealgebra.testing.TestTimelines.fetchAll;
import static timealgebra.testing.TestTimelines.labeled;
import static timealgebra.testing.TestTimelines.masks;
import static timealgebra.testing.TestTimelines.spans;

import java.util.List;
import org.junit.jupiter.api.Test;
import timealgebra.core.Timeline;
import timealgebra.core.model.Interval;

final class FlattenTest {

  @Test
  void overlappingAndTouchingSpansCoalesce() {
    Timeline<Interval> flat = Flatten.of(labeled("x", 0, 10, 5, 20, 20, 25, 30, 35));

    assertEquals(spans(0, 25, 30, 35), fetchAll(flat, 0, 50));
    assertTrue(flat.isMask());
  }

  @Test
  void flattenIsIdempotent() {
    Timeline<Interval> source = masks(0, 10, 3, 7, 9, 14, 20, 21, 21, 22);
    Timeline<Interval> once = Flatten.of(source);
    Timeline<Interval> twice = Flatten.of(once);

    for (long[] range : new long[][] {{0, 30}, {5, 21}, {-10, 100}, {12, 13}}) {
      assertEquals(
          fetchAll(once, range[0], range[1]),
          fetchAll(twice, range[0], range[1]),
          "Range " + range[0] + ".." + range[1]);
    }
  }

  @Test
  void flattenHandlesUnboundedRanges() {
    Timeline<Interval> flat = Flatten.of(masks(Long.MIN_VALUE, 0, -5, 10));

    assertEquals(
        List.of(Interval.until(10)),
        fetchAll(flat, Interval.UNBOUNDED_START, Interval.UNBOUNDED_END));
  }

  @Test
  void flattenOfNothingIsNothing() {
    assertEquals(
        List.of(),
        fetchAll(Flatten.of(Timelines.empty()), Interval.UNBOUNDED_START, Interval.UNBOUNDED_END));
  }
}
