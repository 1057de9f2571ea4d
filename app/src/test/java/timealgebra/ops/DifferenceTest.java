package timealgebra.ops;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static timealgebra.testing.TestTimelines.fetchAll;
import static timealgebra.testing.TestTimelines.labeled;
import static timealgebra.testing.TestTimelines.masks;
import static timealgebra.testing.TestTimelines.spans;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.junit.jupiter.api.Test;
import timealgebra.core.Timeline;
import timealgebra.core.model.Interval;
import timealgebra.testing.LabeledInterval;

final class DifferenceTest {

  @Test
  void holeInTheMiddle() {
    Timeline<Interval> rest = new Difference<>(masks(0, 30), masks(10, 20));

    assertEquals(spans(0, 10, 20, 30), fetchAll(rest, 0, 30));
  }

  @Test
  void severalHolesAndSubtractors() {
    Timeline<Interval> rest =
        new Difference<>(masks(0, 100), masks(20, 30), masks(25, 40, 90, 120));

    assertEquals(spans(0, 20, 40, 90), fetchAll(rest, 0, 100));
  }

  @Test
  void fragmentsKeepMetadata() {
    Timeline<LabeledInterval> rest = labeled("shift", 0, 100).minus(masks(40, 60));

    assertEquals(
        List.of(new LabeledInterval(0, 40, "shift"), new LabeledInterval(60, 100, "shift")),
        fetchAll(rest, 0, 100));
  }

  @Test
  void overlappingSourceIntervalsAreEachCarved() {
    Timeline<LabeledInterval> rest = labeled("s", 0, 50, 10, 20, 30, 70).minus(masks(15, 35));

    List<LabeledInterval> result = fetchAll(rest, 0, 100);

    assertEquals(
        List.of(
            new LabeledInterval(0, 15, "s"),
            new LabeledInterval(10, 15, "s"),
            new LabeledInterval(35, 50, "s"),
            new LabeledInterval(35, 70, "s")),
        result);
  }

  @Test
  void fullyCoveredSourceDisappears() {
    assertEquals(List.of(), fetchAll(new Difference<>(masks(10, 20), masks(0, 30)), 0, 30));
  }

  @Test
  void noSubtractorsIsIdentity() {
    assertEquals(spans(0, 5), fetchAll(new Difference<Interval>(masks(0, 5)), 0, 10));
  }

  @Test
  void unboundedSourceMinusFiniteHole() {
    Timeline<Interval> rest = new Difference<>(masks(Long.MIN_VALUE, Long.MAX_VALUE), masks(0, 10));

    assertEquals(
        List.of(Interval.until(0), Interval.from(10)),
        fetchAll(rest, Interval.UNBOUNDED_START, Interval.UNBOUNDED_END));
  }

  @Test
  void pointQueryReturnsTheWholeFragment() {
    Timeline<Interval> rest = new Difference<>(masks(0, 100), masks(40, 60));

    List<Interval> result = ImmutableList.copyOf(rest.overlapping(70));

    assertEquals(spans(60, 100), result);
  }
}
