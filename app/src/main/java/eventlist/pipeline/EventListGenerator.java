package eventlist.pipeline;

import eventlist.core.CompilerSettings;
import eventlist.core.model.AcquireGroupIr;
import eventlist.core.model.CaseIr;
import eventlist.core.model.EmptyBranchIr;
import eventlist.core.model.HwOscillatorReset;
import eventlist.core.model.IrNode;
import eventlist.core.model.IrVisitor;
import eventlist.core.model.LoopIr;
import eventlist.core.model.LoopIterationIr;
import eventlist.core.model.MatchIr;
import eventlist.core.model.OscillatorFrequencyStepIr;
import eventlist.core.model.PhaseResetIr;
import eventlist.core.model.PrecompClearIr;
import eventlist.core.model.PrngSetup;
import eventlist.core.model.PulseIr;
import eventlist.core.model.ReserveIr;
import eventlist.core.model.RootIr;
import eventlist.core.model.SectionIr;
import eventlist.core.model.SectionPulse;
import eventlist.core.model.SweepParameter;
import eventlist.core.model.SweptOscillator;
import eventlist.core.model.TriggerOutput;
import eventlist.event.DigitalChange;
import eventlist.event.Event;
import eventlist.event.EventKey;
import eventlist.event.EventType;
import eventlist.event.ParameterRef;
import eventlist.event.PlayWaveType;
import eventlist.event.TriggerSignal;
import eventlist.util.PulseParameters;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a timed schedule tree into a flat event list.
 *
 * <p>Each node kind has its own emission rule. Events are appended in structural order (a node's
 * opening events, then its children in child order, then its closing events) and receive their ids
 * in that same order, so ids increase strictly along the list. The list is not sorted by time.
 *
 * <p>An instance serves a single generation call: it owns the id tracker and the loop expansion
 * flag for that call and must not be shared between threads.
 */
public final class EventListGenerator
    implements IrVisitor<EventListGenerator.Placement, List<Event>> {

  /** Events a loop emits around its iterations before any of them is visited. */
  static final int LOOP_WRAPPER_EVENTS = 3;

  static final String EMPTY_CASE_WAVE_ID = "EMPTY_MATCH_CASE_DELAY";
  static final String DELAY_WAVE_ID = "delay";

  /** Absolute start of a node and the number of events it may emit. */
  public record Placement(long start, int maxEvents) {}

  private final IdTracker ids;
  private final boolean expandLoops;
  private final CompilerSettings settings;
  private final ChildEventCollector childCollector;
  private final LoopExpander loopExpander;
  private boolean truncated;

  public EventListGenerator(IdTracker ids, boolean expandLoops, CompilerSettings settings) {
    this.ids = Objects.requireNonNull(ids, "ids");
    this.expandLoops = expandLoops;
    this.settings = Objects.requireNonNull(settings, "settings");
    this.childCollector = new ChildEventCollector(this);
    this.loopExpander = new LoopExpander(this);
  }

  /** Emits the events of {@code node} placed at {@code start}, within {@code maxEvents}. */
  public static List<Event> generateEventList(
      IrNode node,
      long start,
      int maxEvents,
      IdTracker ids,
      boolean expandLoops,
      CompilerSettings settings) {
    return new EventListGenerator(ids, expandLoops, settings).generate(node, start, maxEvents);
  }

  public List<Event> generate(IrNode node, long start, int maxEvents) {
    Objects.requireNonNull(node, "node");
    return node.accept(this, new Placement(start, maxEvents));
  }

  /** Whether any node of this call had to drop events to stay within its budget. */
  boolean truncated() {
    return truncated;
  }

  public CompilerSettings settings() {
    return settings;
  }

  IdTracker ids() {
    return ids;
  }

  boolean expandLoops() {
    return expandLoops;
  }

  void markTruncated() {
    truncated = true;
  }

  static long requireLength(IrNode node) {
    Long length = node.length();
    if (length == null) {
      throw new IllegalStateException(
          "Length of "
              + node.getClass().getSimpleName()
              + " in section '"
              + node.section()
              + "' is not resolved");
    }
    return length;
  }

  @Override
  public List<Event> visitRoot(RootIr node, Placement at) {
    requireLength(node);
    EventBudget budget = EventBudget.of(at.maxEvents());
    budget.reserve(2);
    return flatten(childCollector.collect(node, at.start(), budget.remaining(), false));
  }

  @Override
  public List<Event> visitSection(SectionIr node, Placement at) {
    return sectionEvents(node, at.start(), at.maxEvents());
  }

  @Override
  public List<Event> visitMatch(MatchIr node, Placement at) {
    List<Event> events = sectionEvents(node.body(), at.start(), at.maxEvents());
    if (events.isEmpty()) {
      return events;
    }
    Event sectionStart = events.get(0);
    if (sectionStart.type() != EventType.SECTION_START) {
      throw new IllegalStateException(
          "Match section '" + node.section() + "' does not open with " + EventType.SECTION_START);
    }
    Event.Builder annotated = sectionStart.toBuilder();
    if (node.handle() != null) {
      annotated.put(EventKey.HANDLE, node.handle()).put(EventKey.LOCAL, node.local());
    }
    annotated
        .put(EventKey.USER_REGISTER, node.userRegister())
        .put(EventKey.PRNG_SAMPLE, node.prngSample());
    events.set(0, annotated.build());
    return events;
  }

  @Override
  public List<Event> visitCase(CaseIr node, Placement at) {
    List<Event> events = sectionEvents(node.body(), at.start(), at.maxEvents());
    events.replaceAll(e -> e.with(EventKey.STATE, node.state()));
    return events;
  }

  @Override
  public List<Event> visitEmptyBranch(EmptyBranchIr node, Placement at) {
    SectionIr body = node.body();
    long start = at.start();
    long end = start + requireLength(node);
    if (!body.children().isEmpty() || !body.triggerOutput().isEmpty() || body.prngSetup() != null) {
      throw new IllegalStateException(
          "Empty branch '" + body.section() + "' must not have children, triggers or a PRNG");
    }

    List<Event> events = new ArrayList<>();
    int startId = ids.next();
    events.add(sectionBoundary(EventType.SECTION_START, start, startId, startId, body));

    EventBudget budget = EventBudget.of(at.maxEvents());
    for (String signal : body.signals()) {
      if (budget.remaining() <= 2) {
        markTruncated();
        break;
      }
      budget.reserve(2);
      int delayId = ids.next();
      events.add(emptyCaseDelay(EventType.DELAY_START, start, delayId, delayId, body, signal));
      events.add(emptyCaseDelay(EventType.DELAY_END, end, ids.next(), delayId, body, signal));
    }

    events.add(sectionBoundary(EventType.SECTION_END, end, ids.next(), startId, body));
    events.replaceAll(e -> e.with(EventKey.STATE, node.state()));
    return events;
  }

  @Override
  public List<Event> visitLoop(LoopIr node, Placement at) {
    long start = at.start();
    long end = start + requireLength(node);
    EventBudget budget = EventBudget.of(at.maxEvents());
    budget.reserve(LOOP_WRAPPER_EVENTS);

    List<Event> events = new ArrayList<>();
    int startId = ids.next();
    events.add(loopBoundary(EventType.SECTION_START, start, startId, startId, node).build());
    int loopId = ids.next();
    events.add(
        loopBoundary(EventType.LOOP_START, start, loopId, loopId, node)
            .put(EventKey.ITERATIONS, node.iterations())
            .put(EventKey.COMPRESSED, node.compressed())
            .build());

    List<List<Event>> iterations =
        node.compressed()
            ? loopExpander.expand(node, start, budget.remaining())
            : childCollector.collect(node, start, budget.remaining(), false);
    for (List<Event> iteration : iterations) {
      for (Event event : iteration) {
        events.add(deeper(event));
      }
    }

    events.add(loopBoundary(EventType.LOOP_END, end, ids.next(), loopId, node).build());
    events.add(loopBoundary(EventType.SECTION_END, end, ids.next(), startId, node).build());
    return events;
  }

  @Override
  public List<Event> visitLoopIteration(LoopIterationIr node, Placement at) {
    long start = at.start();
    long end = start + requireLength(node);
    boolean first = node.iteration() == 0;

    EventBudget budget = EventBudget.of(at.maxEvents());
    budget.reserve(node.sweepParameters().size());
    if (first) {
      budget.reserve(1);
    }
    budget.reserve(3);

    List<Event> events = new ArrayList<>();
    int stepId = ids.next();
    events.add(
        iterationEvent(EventType.LOOP_STEP_START, start, stepId, node)
            .chainElementId(stepId)
            .build());
    for (SweepParameter parameter : node.sweepParameters()) {
      events.add(
          Event.builder(EventType.PARAMETER_SET, start)
              .id(ids.next())
              .put(EventKey.SECTION_NAME, node.section())
              .put(EventKey.PARAMETER, new ParameterRef(parameter.uid()))
              .put(EventKey.ITERATION, node.iteration())
              .put(EventKey.VALUE, parameter.valueAt(node.iteration()))
              .build());
    }
    int drawId = -1;
    if (node.prngSample() != null) {
      drawId = ids.next();
      events.add(
          iterationEvent(EventType.DRAW_PRNG_SAMPLE, start, drawId, node)
              .chainElementId(drawId)
              .put(EventKey.SAMPLE_NAME, node.prngSample())
              .build());
    }

    events.addAll(flatten(childCollector.collect(node, start, budget.remaining(), true)));

    events.add(
        iterationEvent(EventType.LOOP_STEP_END, end, ids.next(), node)
            .chainElementId(stepId)
            .build());
    if (node.prngSample() != null) {
      events.add(
          iterationEvent(EventType.DROP_PRNG_SAMPLE, end, ids.next(), node)
              .chainElementId(drawId)
              .put(EventKey.SAMPLE_NAME, node.prngSample())
              .build());
    }
    // Only the first iteration carries the terminal marker, shadows included.
    if (first) {
      events.add(iterationEvent(EventType.LOOP_ITERATION_END, end, ids.next(), node).build());
    }

    if (node.shadow()) {
      events.replaceAll(e -> e.with(EventKey.SHADOW, true));
    }
    return events;
  }

  @Override
  public List<Event> visitPulse(PulseIr node, Placement at) {
    long start = at.start();
    long length = requireLength(node);
    SectionPulse pulse = node.pulse();

    EventType startType;
    EventType endType;
    long startTime = start + node.offset();
    if (pulse.isDelay()) {
      startType = EventType.DELAY_START;
      endType = EventType.DELAY_END;
      startTime = start;
    } else if (node.acquire()) {
      startType = EventType.ACQUIRE_START;
      endType = EventType.ACQUIRE_END;
    } else {
      startType = EventType.PLAY_START;
      endType = EventType.PLAY_END;
    }

    int startId = ids.next();
    int endId = ids.next();
    Event.Builder startEvent =
        pulseCommon(Event.builder(startType, startTime).id(startId), node, startId)
            .put(EventKey.AMPLITUDE, node.amplitude())
            .put(EventKey.PHASE, node.phase())
            .put(EventKey.AMPLITUDE_PARAMETER, node.amplitudeParameter())
            .put(EventKey.MARKERS, node.markers().isEmpty() ? null : node.markers())
            .put(EventKey.OSCILLATOR_FREQUENCY, node.oscillatorFrequency())
            .put(EventKey.PULSE_PULSE_PARAMETERS, encoded(node.pulsePulseParameters()))
            .put(EventKey.PLAY_PULSE_PARAMETERS, encoded(node.playPulseParameters()))
            .put(EventKey.INCREMENT_OSCILLATOR_PHASE, node.incrementOscillatorPhase())
            .put(EventKey.SET_OSCILLATOR_PHASE, node.setOscillatorPhase());

    if (pulse.isDelay()) {
      startEvent.put(EventKey.PLAY_WAVE_TYPE, PlayWaveType.DELAY);
    } else if (node.acquire()) {
      if (pulse.acquireParams() != null) {
        startEvent
            .put(
                EventKey.ACQUISITION_TYPE,
                Collections.singletonList(pulse.acquireParams().acquisitionType()))
            .put(EventKey.ACQUIRE_HANDLE, pulse.acquireParams().handle());
      } else {
        startEvent.put(EventKey.ACQUISITION_TYPE, List.of());
      }
    }

    Event endEvent =
        pulseCommon(Event.builder(endType, start + length).id(endId), node, startId).build();
    return new ArrayList<>(List.of(startEvent.build(), endEvent));
  }

  @Override
  public List<Event> visitAcquireGroup(AcquireGroupIr node, Placement at) {
    long start = at.start();
    long length = requireLength(node);
    checkAcquireGroup(node);

    SectionPulse first = node.pulses().get(0);
    List<String> waveIds = new ArrayList<>();
    List<List<String>> parametrizedWith = new ArrayList<>();
    for (SectionPulse pulse : node.pulses()) {
      waveIds.add(pulse.pulseId());
      parametrizedWith.add(pulse.parametrizedWith());
    }

    int startId = ids.next();
    List<Event> events = new ArrayList<>(2);
    events.add(
        acquireGroupCommon(Event.builder(EventType.ACQUIRE_START, start + node.offset()), node)
            .id(startId)
            .chainElementId(startId)
            .put(EventKey.SIGNAL, first.signal())
            .put(EventKey.PLAY_WAVE_IDS, waveIds)
            .put(EventKey.PARAMETRIZED_WITH_PER_PULSE, parametrizedWith)
            .build());
    events.add(
        acquireGroupCommon(Event.builder(EventType.ACQUIRE_END, start + length), node)
            .id(ids.next())
            .chainElementId(startId)
            .put(EventKey.SIGNAL, first.signal())
            .put(EventKey.PLAY_WAVE_IDS, waveIds)
            .put(EventKey.PARAMETRIZED_WITH_PER_PULSE, parametrizedWith)
            .build());
    return events;
  }

  @Override
  public List<Event> visitOscillatorFrequencyStep(OscillatorFrequencyStepIr node, Placement at) {
    long start = at.start();
    long end = start + requireLength(node);
    int count = node.parameters().size();
    if (node.oscillators().size() != count || node.values().size() != count) {
      throw new IllegalStateException(
          "Oscillator frequency step in section '"
              + node.section()
              + "' has mismatched parameters, oscillators and values");
    }

    List<Event> events = new ArrayList<>(2 * count);
    for (int i = 0; i < count; i++) {
      SweptOscillator oscillator = node.oscillators().get(i);
      int startId = ids.next();
      events.add(
          Event.builder(EventType.SET_OSCILLATOR_FREQUENCY_START, start)
              .id(startId)
              .chainElementId(startId)
              .put(EventKey.PARAMETER, new ParameterRef(node.parameters().get(i)))
              .put(EventKey.ITERATION, node.iteration())
              .put(EventKey.VALUE, node.values().get(i))
              .put(EventKey.SECTION_NAME, node.section())
              .put(EventKey.DEVICE_ID, oscillator.device())
              .put(EventKey.SIGNAL, oscillator.signal())
              .put(EventKey.OSCILLATOR_ID, oscillator.id())
              .build());
      events.add(
          Event.builder(EventType.SET_OSCILLATOR_FREQUENCY_END, end)
              .id(ids.next())
              .chainElementId(startId)
              .build());
    }
    return events;
  }

  @Override
  public List<Event> visitPhaseReset(PhaseResetIr node, Placement at) {
    requireLength(node);
    List<Event> events = new ArrayList<>();
    for (HwOscillatorReset reset : node.hwOscillatorResets()) {
      events.add(
          Event.builder(EventType.RESET_HW_OSCILLATOR_PHASE, at.start())
              .id(ids.next())
              .put(EventKey.SECTION_NAME, node.section())
              .put(EventKey.DURATION, reset.duration())
              .put(EventKey.DEVICE_ID, reset.device())
              .build());
    }
    if (node.resetSwOscillators()) {
      events.add(
          Event.builder(EventType.RESET_SW_OSCILLATOR_PHASE, at.start())
              .id(ids.next())
              .put(EventKey.SECTION_NAME, node.section())
              .build());
    }
    return events;
  }

  @Override
  public List<Event> visitReserve(ReserveIr node, Placement at) {
    requireLength(node);
    return new ArrayList<>();
  }

  @Override
  public List<Event> visitPrecompClear(PrecompClearIr node, Placement at) {
    requireLength(node);
    List<Event> events = new ArrayList<>(1);
    events.add(
        Event.builder(EventType.RESET_PRECOMPENSATION_FILTERS, at.start())
            .id(ids.next())
            .put(EventKey.SIGNAL_ID, node.signal())
            .put(EventKey.SECTION_NAME, node.section())
            .build());
    return events;
  }

  private List<Event> sectionEvents(SectionIr section, long start, int maxEvents) {
    long end = start + requireLength(section);
    EventBudget budget = EventBudget.of(maxEvents);
    budget.reserve(2);

    List<Event> events = new ArrayList<>();
    int startId = ids.next();
    events.add(sectionBoundary(EventType.SECTION_START, start, startId, startId, section));

    List<TriggerOutput> triggers = new ArrayList<>();
    for (TriggerOutput trigger : section.triggerOutput()) {
      if (!budget.allows(2)) {
        markTruncated();
        break;
      }
      budget.reserve(2);
      triggers.add(trigger);
      events.add(triggerChange(section, trigger, DigitalChange.SET, start));
    }

    PrngSetup prngSetup = section.prngSetup();
    int prngId = -1;
    if (prngSetup != null) {
      if (budget.isExhausted()) {
        markTruncated();
      } else {
        budget.reserve(2);
        prngId = ids.next();
        events.add(
            Event.builder(EventType.PRNG_SETUP, start)
                .id(prngId)
                .chainElementId(prngId)
                .put(EventKey.SECTION_NAME, section.section())
                .put(EventKey.RANGE, prngSetup.range())
                .put(EventKey.SEED, prngSetup.seed())
                .build());
      }
    }

    events.addAll(flatten(childCollector.collect(section, start, budget.remaining(), true)));

    if (prngId >= 0) {
      events.add(
          Event.builder(EventType.DROP_PRNG_SETUP, end)
              .id(ids.next())
              .chainElementId(prngId)
              .put(EventKey.SECTION_NAME, section.section())
              .build());
    }
    for (TriggerOutput trigger : triggers) {
      events.add(triggerChange(section, trigger, DigitalChange.CLEAR, end));
    }
    events.add(sectionBoundary(EventType.SECTION_END, end, ids.next(), startId, section));
    return events;
  }

  private Event sectionBoundary(
      EventType type, long time, int id, int chainElementId, SectionIr section) {
    Event.Builder builder =
        Event.builder(type, time)
            .id(id)
            .chainElementId(chainElementId)
            .put(EventKey.SECTION_NAME, section.section());
    if (!section.triggerOutput().isEmpty()) {
      builder.put(
          EventKey.TRIGGER_OUTPUT,
          section.triggerOutput().stream()
              .map(trigger -> new TriggerSignal(trigger.signal()))
              .toList());
    }
    return builder.build();
  }

  private Event triggerChange(
      SectionIr section, TriggerOutput trigger, DigitalChange change, long time) {
    return Event.builder(EventType.DIGITAL_SIGNAL_STATE_CHANGE, time)
        .id(ids.next())
        .put(EventKey.SECTION_NAME, section.section())
        .put(EventKey.BIT, trigger.bit())
        .put(EventKey.SIGNAL, trigger.signal())
        .put(EventKey.CHANGE, change)
        .build();
  }

  private Event emptyCaseDelay(
      EventType type, long time, int id, int chainElementId, SectionIr body, String signal) {
    return Event.builder(type, time)
        .id(id)
        .chainElementId(chainElementId)
        .put(EventKey.SIGNAL, signal)
        .put(EventKey.SECTION_NAME, body.section())
        .put(EventKey.PLAY_WAVE_ID, EMPTY_CASE_WAVE_ID)
        .put(EventKey.PLAY_WAVE_TYPE, PlayWaveType.EMPTY_CASE)
        .build();
  }

  private static Event.Builder loopBoundary(
      EventType type, long time, int id, int chainElementId, LoopIr loop) {
    return Event.builder(type, time)
        .id(id)
        .chainElementId(chainElementId)
        .put(EventKey.SECTION_NAME, loop.section())
        .put(EventKey.NESTING_LEVEL, 0);
  }

  private static Event.Builder iterationEvent(
      EventType type, long time, int id, LoopIterationIr iteration) {
    return Event.builder(type, time)
        .id(id)
        .put(EventKey.SECTION_NAME, iteration.section())
        .put(EventKey.ITERATION, iteration.iteration())
        .put(EventKey.NUM_REPEATS, iteration.numRepeats())
        .put(EventKey.NESTING_LEVEL, 0);
  }

  private static Event.Builder pulseCommon(Event.Builder builder, PulseIr node, int startId) {
    SectionPulse pulse = node.pulse();
    return builder
        .chainElementId(startId)
        .put(EventKey.SECTION_NAME, node.section())
        .put(EventKey.SIGNAL, pulse.signal())
        .put(EventKey.PLAY_WAVE_ID, pulse.isDelay() ? DELAY_WAVE_ID : pulse.pulseId())
        .put(EventKey.PARAMETRIZED_WITH, pulse.parametrizedWith());
  }

  private static Event.Builder acquireGroupCommon(Event.Builder builder, AcquireGroupIr node) {
    SectionPulse first = node.pulses().get(0);
    builder
        .put(EventKey.SECTION_NAME, node.section())
        .put(EventKey.PHASES, node.phases())
        .put(EventKey.AMPLITUDES, node.amplitudes())
        .put(
            EventKey.ACQUISITION_TYPE,
            Collections.singletonList(first.acquireParams().acquisitionType()))
        .put(EventKey.ACQUIRE_HANDLE, first.acquireParams().handle())
        .put(EventKey.OSCILLATOR_FREQUENCIES, node.oscillatorFrequencies());
    if (!node.pulsePulseParameters().isEmpty()) {
      builder.put(
          EventKey.PULSE_PULSE_PARAMETERS_PER_PULSE,
          PulseParameters.encodeAll(node.pulsePulseParameters()));
    }
    if (!node.playPulseParameters().isEmpty()) {
      builder.put(
          EventKey.PLAY_PULSE_PARAMETERS_PER_PULSE,
          PulseParameters.encodeAll(node.playPulseParameters()));
    }
    return builder;
  }

  private static void checkAcquireGroup(AcquireGroupIr node) {
    List<SectionPulse> pulses = node.pulses();
    int count = pulses.size();
    if (count == 0) {
      throw new IllegalStateException(
          "Acquire group in section '" + node.section() + "' has no pulses");
    }
    boolean aligned =
        node.amplitudes().size() == count
            && node.phases().size() == count
            && (node.oscillatorFrequencies() == null
                || node.oscillatorFrequencies().size() == count)
            && node.playPulseParameters().size() == count
            && node.pulsePulseParameters().size() == count;
    if (!aligned) {
      throw new IllegalStateException(
          "Acquire group in section '"
              + node.section()
              + "' has per-pulse fields not aligned with its "
              + count
              + " pulses");
    }
    SectionPulse first = pulses.get(0);
    for (SectionPulse pulse : pulses) {
      if (pulse.acquireParams() == null || first.acquireParams() == null) {
        throw new IllegalStateException(
            "Acquire group in section '" + node.section() + "' contains a non-acquire pulse");
      }
      if (!Objects.equals(pulse.acquireParams().handle(), first.acquireParams().handle())) {
        throw new IllegalStateException(
            "Acquire group in section '" + node.section() + "' mixes acquisition handles");
      }
      if (!Objects.equals(
          pulse.acquireParams().acquisitionType(), first.acquireParams().acquisitionType())) {
        throw new IllegalStateException(
            "Acquire group in section '" + node.section() + "' mixes acquisition types");
      }
      if (!pulse.signal().equals(first.signal())) {
        throw new IllegalStateException(
            "Acquire group in section '" + node.section() + "' spans several signals");
      }
    }
  }

  private static Map<String, Object> encoded(Map<String, Object> parameters) {
    return parameters.isEmpty() ? null : PulseParameters.encode(parameters);
  }

  private static Event deeper(Event event) {
    Integer level = event.get(EventKey.NESTING_LEVEL);
    return level == null ? event : event.with(EventKey.NESTING_LEVEL, level + 1);
  }

  private static List<Event> flatten(List<List<Event>> nested) {
    List<Event> events = new ArrayList<>();
    for (List<Event> list : nested) {
      events.addAll(list);
    }
    return events;
  }
}
