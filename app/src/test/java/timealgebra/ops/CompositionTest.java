package timealgebra.ops;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static timealgebra.testing.TestTimelines.fetchAll;
import static timealgebra.testing.TestTimelines.masks;
import static timealgebra.testing.TestTimelines.spans;

import org.junit.jupiter.api.Test;
import timealgebra.core.Timeline;
import timealgebra.core.model.Interval;
import timealgebra.filter.And;
import timealgebra.filter.Filter;
import timealgebra.filter.Or;
import timealgebra.filter.Properties;

final class CompositionTest {
  private final Timeline<Interval> timeline = masks(0, 10, 20, 50);
  private final Filter<Interval> longOnes = Properties.seconds().atLeast(20.0);
  private final Filter<Interval> early = Properties.start().lessThan(5L);

  @Test
  void eitherOfTimelinesIsUnion() {
    assertInstanceOf(Union.class, Composition.either(timeline, masks(60, 70)));
  }

  @Test
  void eitherOfFiltersIsOr() {
    assertInstanceOf(Or.class, Composition.either(longOnes, early));
  }

  @Test
  void eitherOfTimelineAndFilterIsRejected() {
    TimelineCompositionException ex =
        assertThrows(TimelineCompositionException.class, () -> Composition.either(timeline, early));
    assertTrue(ex.getMessage().contains("timeline"), "Message should name the operand kinds");
    assertThrows(TimelineCompositionException.class, () -> Composition.either(early, timeline));
  }

  @Test
  void bothOfFiltersIsAnd() {
    assertInstanceOf(And.class, Composition.both(longOnes, early));
  }

  @Test
  void bothOfTimelineAndFilterAppliesTheFilterInEitherOrder() {
    Object left = Composition.both(timeline, longOnes);
    Object right = Composition.both(longOnes, timeline);

    assertInstanceOf(Filtered.class, left);
    assertInstanceOf(Filtered.class, right);
    assertEquals(spans(20, 50), fetchAll((Timeline<?>) left, 0, 100));
    assertEquals(spans(20, 50), fetchAll((Timeline<?>) right, 0, 100));
  }

  @Test
  void bothOfTimelinesIsIntersection() {
    Object both = Composition.both(timeline, masks(5, 25));

    assertEquals(spans(5, 10, 20, 25), fetchAll((Timeline<?>) both, 0, 100));
  }

  @Test
  void filtersCannotBeSubtractedOrComplemented() {
    assertThrows(TimelineCompositionException.class, () -> Composition.without(timeline, early));
    assertThrows(TimelineCompositionException.class, () -> Composition.complement(early));
    assertThrows(TimelineCompositionException.class, () -> Composition.flatten(longOnes));
  }

  @Test
  void otherOperandTypesAreRejected() {
    assertThrows(TimelineCompositionException.class, () -> Composition.either("x", timeline));
  }
}
