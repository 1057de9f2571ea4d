package timealgebra.ops;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static timealgebra.testing.TestTimelines.fetchAll;
import static timealgebra.testing.TestTimelines.labeled;
import static timealgebra.testing.TestTimelines.masks;
import static timealgebra.testing.TestTimelines.spans;

import com.google.common.collect.ImmutableList;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;
import timealgebra.core.Timeline;
import timealgebra.core.TimelineQuery;
import timealgebra.core.model.Interval;
import timealgebra.source.DailyWindows;
import timealgebra.testing.CountingTimeline;
import timealgebra.testing.LabeledInterval;

final class ComplementTest {

  @Test
  void gapsAroundOneInterval() {
    Timeline<Interval> gaps = new Complement(masks(10, 20));

    assertEquals(spans(0, 10, 20, 30), fetchAll(gaps, 0, 30));
  }

  @Test
  void overlappingAndNestedIntervalsAreAbsorbed() {
    Timeline<Interval> gaps = new Complement(masks(0, 10, 2, 4, 5, 15, 20, 25));

    assertEquals(spans(15, 20, 25, 40), fetchAll(gaps, 0, 40));
  }

  @Test
  void emptyIntervalsDoNotSplitGaps() {
    Timeline<Interval> gaps = new Complement(masks(5, 5, 20, 30));

    assertEquals(spans(0, 20), fetchAll(gaps, 0, 30));
  }

  @Test
  void complementOfNothingOverAnOpenRangeIsEverything() {
    Timeline<Interval> gaps = Timelines.complementOf(Timelines.empty());

    assertEquals(
        List.of(Interval.unbounded()),
        fetchAll(gaps, Interval.UNBOUNDED_START, Interval.UNBOUNDED_END));
  }

  @Test
  void openRangeProducesOpenGaps() {
    Timeline<Interval> gaps = new Complement(masks(0, 10));

    assertEquals(
        List.of(Interval.until(0), Interval.from(10)),
        fetchAll(gaps, Interval.UNBOUNDED_START, Interval.UNBOUNDED_END));
  }

  @Test
  void alwaysMaskAndStripsMetadata() {
    Timeline<Interval> gaps = labeled("busy", 10, 20).complement();

    assertTrue(gaps.isMask());
    assertEquals(Interval.class, fetchAll(gaps, 0, 30).get(0).getClass());
  }

  @Test
  void injectedFactoryBuildsTheGaps() {
    Timeline<Interval> gaps =
        new Complement(masks(10, 20), (start, end) -> new LabeledInterval(start, end, "free"));

    assertEquals(
        List.of(new LabeledInterval(0, 10, "free"), new LabeledInterval(20, 30, "free")),
        fetchAll(gaps, 0, 30));
  }

  @Test
  void involutionEqualsFlatten() {
    Timeline<LabeledInterval> busy = labeled("busy", 0, 10, 5, 12, 12, 15, 30, 40);

    List<Interval> twice = fetchAll(new Complement(new Complement(busy)), 0, 50);

    assertEquals(spans(0, 15, 30, 40), twice);
  }

  @Test
  void pointQueryReturnsTheWholeGap() {
    Timeline<Interval> gaps = new Complement(masks(0, 10, 50, 60));

    assertEquals(spans(10, 50), ImmutableList.copyOf(gaps.overlapping(30)));
    assertEquals(List.of(), ImmutableList.copyOf(gaps.overlapping(5)));
    assertEquals(List.of(Interval.from(60)), ImmutableList.copyOf(gaps.overlapping(1_000)));
  }

  @Test
  void pointQueryFetchesTheChildOverFiniteWindows() {
    CountingTimeline<Interval> busy = new CountingTimeline<>(masks(0, 10, 50, 60));

    assertEquals(spans(10, 50), ImmutableList.copyOf(new Complement(busy).overlapping(30)));
    for (Interval range : busy.fetchedRanges()) {
      assertTrue(range.isBounded(), "Unexpected open fetch " + range);
    }
  }

  @Test
  void pointQueryWorksOnSourcesThatNeedFiniteBounds() {
    // 1970-01-01 was a Thursday.
    Timeline<Interval> hours = DailyWindows.businessHours(ZoneOffset.UTC);

    assertEquals(
        List.of(Interval.of(-25_200, 32_400)),
        TimelineQuery.overlapping(hours.complement(), 3_600));
    assertEquals(
        List.of(Interval.of(32_400, 61_200)), TimelineQuery.overlapping(hours.flatten(), 36_000));
  }
}
