package eventlist.pipeline;

import static eventlist.testing.IrFixtures.UNLIMITED;
import static eventlist.testing.IrFixtures.at;
import static eventlist.testing.IrFixtures.compressedLoop;
import static eventlist.testing.IrFixtures.count;
import static eventlist.testing.IrFixtures.generate;
import static eventlist.testing.IrFixtures.iteration;
import static eventlist.testing.IrFixtures.ofType;
import static eventlist.testing.IrFixtures.play;
import static eventlist.testing.IrFixtures.section;
import static eventlist.testing.IrFixtures.types;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.collect.ImmutableSet;
import eventlist.core.model.LoopIr;
import eventlist.core.model.LoopIterationIr;
import eventlist.core.model.SweepParameter;
import eventlist.event.Event;
import eventlist.event.EventKey;
import eventlist.event.EventType;
import eventlist.event.ParameterRef;
import eventlist.util.EventListValidator;
import java.util.List;
import org.junit.jupiter.api.Test;

final class LoopExpanderTest {

  private static LoopIr threeIterationLoop() {
    LoopIterationIr prototype = iteration("loop", 10, 0, 3, at(0, play("loop", "drive", 10)));
    return compressedLoop("loop", 3, prototype);
  }

  @Test
  void compressedLoopWithoutExpansionEmitsThePrototypeOnce() {
    List<Event> events = generate(threeIterationLoop(), UNLIMITED, false);

    assertEquals(
        List.of(
            EventType.SECTION_START,
            EventType.LOOP_START,
            EventType.LOOP_STEP_START,
            EventType.PLAY_START,
            EventType.PLAY_END,
            EventType.LOOP_STEP_END,
            EventType.LOOP_ITERATION_END,
            EventType.LOOP_END,
            EventType.SECTION_END),
        types(events));
    Event loopStart = events.get(1);
    assertEquals(3, loopStart.get(EventKey.ITERATIONS));
    assertEquals(Boolean.TRUE, loopStart.get(EventKey.COMPRESSED));
    assertEquals(Boolean.TRUE, events.get(6).get(EventKey.COMPRESSED), "Prototype is compressed");
    assertEquals(30, events.get(8).time(), "Loop closes after its full length");
    assertTrue(new EventListValidator().validate(events).isValid());
  }

  @Test
  void expansionEmitsShiftedShadowIterations() {
    List<Event> events = generate(threeIterationLoop(), UNLIMITED, true);

    List<Event> steps = ofType(events, EventType.LOOP_STEP_START);
    assertEquals(3, steps.size(), "One block per iteration");
    for (int i = 0; i < steps.size(); i++) {
      assertEquals(10L * i, steps.get(i).time(), "Iteration " + i + " start");
      assertEquals(i, steps.get(i).get(EventKey.ITERATION));
    }
    assertEquals(
        List.of(0L, 10L, 20L),
        ofType(events, EventType.PLAY_START).stream().map(Event::time).toList());

    for (Event event : events) {
      Integer iteration = event.get(EventKey.ITERATION);
      if (iteration == null) {
        continue;
      }
      assertEquals(
          iteration > 0,
          Boolean.TRUE.equals(event.get(EventKey.SHADOW)),
          "Shadow tag on " + event);
    }
    List<Event> plays = ofType(events, EventType.PLAY_START);
    assertEquals(2, plays.stream().filter(e -> e.has(EventKey.SHADOW)).count());
    assertTrue(new EventListValidator().validate(events).isValid());
  }

  @Test
  void onlyTheFirstIterationCarriesTheTerminalMarker() {
    List<Event> expanded = generate(threeIterationLoop(), UNLIMITED, true);

    List<Event> markers = ofType(expanded, EventType.LOOP_ITERATION_END);
    assertEquals(1, markers.size());
    assertEquals(0, markers.get(0).get(EventKey.ITERATION));
    assertFalse(markers.get(0).has(EventKey.SHADOW));
  }

  @Test
  void iterationEventsAreOneLevelDeeperThanTheirLoop() {
    LoopIterationIr innerPrototype = iteration("inner", 10, 0, 2, at(0, play("inner", "d", 10)));
    LoopIr inner = compressedLoop("inner", 2, innerPrototype);
    LoopIterationIr outerPrototype = iteration("outer", 20, 0, 2, at(0, inner));
    LoopIr outer = compressedLoop("outer", 2, outerPrototype);

    List<Event> events = generate(outer, UNLIMITED, false);

    assertEquals(0, events.get(0).get(EventKey.NESTING_LEVEL), "Outer SECTION_START");
    assertEquals(0, events.get(1).get(EventKey.NESTING_LEVEL), "Outer LOOP_START");
    assertEquals(1, events.get(2).get(EventKey.NESTING_LEVEL), "Outer LOOP_STEP_START");
    Event innerLoopStart =
        ofType(events, EventType.LOOP_START).stream()
            .filter(e -> "inner".equals(e.get(EventKey.SECTION_NAME)))
            .findFirst()
            .orElseThrow();
    assertEquals(1, innerLoopStart.get(EventKey.NESTING_LEVEL));
    Event innerStep =
        ofType(events, EventType.LOOP_STEP_START).stream()
            .filter(e -> "inner".equals(e.get(EventKey.SECTION_NAME)))
            .findFirst()
            .orElseThrow();
    assertEquals(2, innerStep.get(EventKey.NESTING_LEVEL));
    assertFalse(ofType(events, EventType.PLAY_START).get(0).has(EventKey.NESTING_LEVEL));
  }

  @Test
  void smallBudgetStopsExpansionAfterThePrototype() {
    List<Event> events = generate(threeIterationLoop(), 6, true);

    assertEquals(1, count(events, EventType.LOOP_STEP_START));
    assertEquals(1, count(events, EventType.LOOP_END));
    assertTrue(new EventListValidator().validate(events).isValid());
  }

  @Test
  void truncatedExpansionStaysWellFormed() {
    for (int budget = 1; budget <= 40; budget++) {
      List<Event> events = generate(threeIterationLoop(), budget, true);
      assertTrue(count(events, EventType.LOOP_STEP_START) <= 3, "Budget " + budget);
      assertEquals(1, count(events, EventType.LOOP_ITERATION_END), "Budget " + budget);
      assertTrue(new EventListValidator().validate(events).isValid(), "Budget " + budget);
    }
  }

  @Test
  void unrolledLoopEmitsExplicitIterationsWithoutSubsections() {
    LoopIr unrolled =
        new LoopIr(
            "loop",
            20L,
            ImmutableSet.of(),
            List.of(
                at(0, iteration("loop", 10, 0, 2, at(0, section("body", 10)))),
                at(10, iteration("loop", 10, 1, 2, at(0, section("body", 10))))),
            2,
            false);

    List<Event> events = generate(unrolled, UNLIMITED, true);

    assertEquals(2, count(events, EventType.LOOP_STEP_START));
    assertEquals(1, count(events, EventType.LOOP_ITERATION_END));
    assertFalse(events.stream().anyMatch(e -> e.has(EventKey.SHADOW)));
    assertEquals(
        2,
        count(events, EventType.SUBSECTION_START),
        "Only the sections inside the iterations are wrapped");
    assertEquals(10, ofType(events, EventType.LOOP_STEP_START).get(1).time());
  }

  @Test
  void iterationEmitsParameterValuesAndPrngDraws() {
    LoopIterationIr second =
        new LoopIterationIr(
            "sweep",
            10L,
            ImmutableSet.of(),
            List.of(),
            1,
            2,
            List.of(new SweepParameter("amp", List.of(0.1, 0.2))),
            "sample",
            false);

    List<Event> events = generate(second, 50, UNLIMITED, true);

    assertEquals(
        List.of(
            EventType.LOOP_STEP_START,
            EventType.PARAMETER_SET,
            EventType.DRAW_PRNG_SAMPLE,
            EventType.LOOP_STEP_END,
            EventType.DROP_PRNG_SAMPLE),
        types(events));
    Event parameter = events.get(1);
    assertEquals(new ParameterRef("amp"), parameter.get(EventKey.PARAMETER));
    assertEquals(0.2, parameter.get(EventKey.VALUE));
    assertEquals(1, parameter.get(EventKey.ITERATION));
    assertEquals("sample", events.get(2).get(EventKey.SAMPLE_NAME));
    assertEquals(events.get(2).id(), events.get(4).chainElementId());
    assertEquals(60, events.get(3).time());
  }

  @Test
  void compressedLoopNeedsAnIterationPrototype() {
    LoopIr broken =
        new LoopIr("loop", 10L, ImmutableSet.of(), List.of(at(0, section("s", 10))), 1, true);

    assertThrows(IllegalStateException.class, () -> generate(broken, UNLIMITED, true));
  }
}
