package eventlist.testing;

import com.google.common.collect.ImmutableSet;
import eventlist.core.CompilerSettings;
import eventlist.core.model.IrChild;
import eventlist.core.model.IrNode;
import eventlist.core.model.LoopIr;
import eventlist.core.model.LoopIterationIr;
import eventlist.core.model.PulseIr;
import eventlist.core.model.SectionIr;
import eventlist.core.model.SectionPulse;
import eventlist.core.model.SweepParameter;
import eventlist.event.Event;
import eventlist.event.EventKey;
import eventlist.event.EventType;
import eventlist.pipeline.EventListGenerator;
import eventlist.pipeline.IdTracker;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/** Small builders for already scheduled IR trees, plus helpers to inspect event lists. */
public final class IrFixtures {
  public static final int UNLIMITED = 1_000_000;

  private IrFixtures() {}

  public static IrChild at(long start, IrNode node) {
    return IrChild.at(start, node);
  }

  public static SectionIr section(String name, long length, IrChild... children) {
    return SectionIr.of(name, length, ImmutableSet.of(), List.of(children));
  }

  public static PulseIr play(String section, String signal, long length) {
    return PulseIr.builder(section, SectionPulse.play(signal, "wave_" + signal))
        .length(length)
        .build();
  }

  /** Iteration {@code index} of a loop with no sweep and no PRNG draw. */
  public static LoopIterationIr iteration(
      String loop, long length, int index, int numRepeats, IrChild... children) {
    return iteration(loop, length, index, numRepeats, List.of(), children);
  }

  public static LoopIterationIr iteration(
      String loop,
      long length,
      int index,
      int numRepeats,
      List<SweepParameter> sweep,
      IrChild... children) {
    return new LoopIterationIr(
        loop, length, ImmutableSet.of(), List.of(children), index, numRepeats, sweep, null, false);
  }

  public static LoopIr compressedLoop(String name, int iterations, LoopIterationIr prototype) {
    return new LoopIr(
        name,
        prototype.length() * iterations,
        ImmutableSet.of(),
        List.of(IrChild.at(0, prototype)),
        iterations,
        true);
  }

  public static List<Event> generate(IrNode node, int maxEvents, boolean expandLoops) {
    return generate(node, 0, maxEvents, expandLoops);
  }

  public static List<Event> generate(IrNode node, long start, int maxEvents, boolean expandLoops) {
    return EventListGenerator.generateEventList(
        node, start, maxEvents, new IdTracker(), expandLoops, CompilerSettings.defaults());
  }

  public static List<EventType> types(List<Event> events) {
    return events.stream().map(Event::type).collect(Collectors.toList());
  }

  public static long count(List<Event> events, EventType type) {
    return events.stream().filter(e -> e.type() == type).count();
  }

  public static List<Event> ofType(List<Event> events, EventType type) {
    List<Event> matching = new ArrayList<>();
    for (Event event : events) {
      if (event.type() == type) {
        matching.add(event);
      }
    }
    return matching;
  }

  public static List<Event> inSection(List<Event> events, String section) {
    return events.stream()
        .filter(e -> section.equals(e.get(EventKey.SECTION_NAME)))
        .collect(Collectors.toList());
  }
}
