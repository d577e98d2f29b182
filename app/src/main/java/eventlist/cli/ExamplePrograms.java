package eventlist.cli;

import eventlist.core.model.AcquireParams;
import eventlist.core.model.CaseIr;
import eventlist.core.model.EmptyBranchIr;
import eventlist.core.model.IrChild;
import eventlist.core.model.IrNode;
import eventlist.core.model.LoopIr;
import eventlist.core.model.LoopIterationIr;
import eventlist.core.model.MatchIr;
import eventlist.core.model.PrngSetup;
import eventlist.core.model.PulseField;
import eventlist.core.model.PulseIr;
import eventlist.core.model.RootIr;
import eventlist.core.model.SectionIr;
import eventlist.core.model.SectionPulse;
import eventlist.core.model.SweepParameter;
import eventlist.core.model.TriggerOutput;
import eventlist.feedback.AcquirePulse;
import eventlist.feedback.BranchTimingResolver;
import eventlist.feedback.DeviceType;
import eventlist.feedback.ScheduleData;
import eventlist.feedback.SignalInfo;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/** Built-in, already scheduled programs the command line can generate event lists for. */
final class ExamplePrograms {
  /** Tinysamples per nanosecond. */
  static final long NS = 3_600;

  private static final String DRIVE = "q0_drive";
  private static final String MEASURE = "q0_measure";
  private static final String ACQUIRE = "q0_acquire";

  private static final Map<String, Supplier<IrNode>> EXAMPLES = buildExamples();

  private ExamplePrograms() {}

  static Set<String> names() {
    return EXAMPLES.keySet();
  }

  static IrNode load(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Unknown example: " + name);
    }
    Supplier<IrNode> supplier = EXAMPLES.get(name.trim().toLowerCase(Locale.ROOT));
    if (supplier == null) {
      throw new IllegalArgumentException(
          "Unknown example: " + name + " (available: " + String.join(", ", names()) + ")");
    }
    return supplier.get();
  }

  /** One section raising trigger bit 3 for its whole length. */
  static IrNode trigger() {
    SectionIr section =
        new SectionIr(
            "trigger", 100L, Set.of(), List.of(), List.of(new TriggerOutput(DRIVE, 3)), null);
    return root(100L, IrChild.at(0, section));
  }

  /** A compressed amplitude sweep: one drive pulse per iteration, then a readout. */
  static IrNode sweep() {
    long pulseLength = 32 * NS;
    long readoutLength = 200 * NS;
    long iterationLength = pulseLength + readoutLength;
    int iterations = 4;

    SectionPulse drive =
        SectionPulse.play(DRIVE, "x90").withSweptField(PulseField.AMPLITUDE, "amp");
    PulseIr play =
        PulseIr.builder("drive", drive)
            .length(pulseLength)
            .amplitude(0.5)
            .amplitudeParameter("amp")
            .build();
    SectionIr driveSection =
        SectionIr.of("drive", pulseLength, Set.of(DRIVE), List.of(IrChild.at(0, play)));

    SectionIr readout = readoutSection("readout", "result", readoutLength);
    LoopIterationIr prototype =
        new LoopIterationIr(
            "sweep",
            iterationLength,
            Set.of(DRIVE, MEASURE, ACQUIRE),
            List.of(IrChild.at(0, driveSection), IrChild.at(pulseLength, readout)),
            0,
            iterations,
            List.of(new SweepParameter("amp", List.of(0.1, 0.2, 0.3, 0.4))),
            null,
            false);
    LoopIr loop =
        new LoopIr(
            "sweep",
            iterationLength * iterations,
            Set.of(DRIVE, MEASURE, ACQUIRE),
            List.of(IrChild.at(0, prototype)),
            iterations,
            true);
    return root(loop.length(), IrChild.at(0, loop));
  }

  /**
   * Active reset: measure, then branch on the result. The branch start is pushed back until the
   * measurement result can reach the drive line.
   */
  static IrNode feedback() {
    long readoutLength = 200 * NS;
    long pulseLength = 32 * NS;
    long grid = 4 * NS;

    SectionIr readout = readoutSection("measure", "m0", readoutLength);
    SectionIr excited =
        SectionIr.of(
            "excited",
            pulseLength,
            Set.of(DRIVE),
            List.of(
                IrChild.at(
                    0,
                    PulseIr.builder("excited", SectionPulse.play(DRIVE, "x180"))
                        .length(pulseLength)
                        .amplitude(1.0)
                        .build())));
    SectionIr ground = SectionIr.of("ground", pulseLength, Set.of(DRIVE), List.of());
    SectionIr matchBody =
        SectionIr.of(
            "reset",
            pulseLength,
            Set.of(DRIVE),
            List.of(
                IrChild.at(0, new EmptyBranchIr(ground, 0)),
                IrChild.at(0, new CaseIr(excited, 1))));
    MatchIr match = new MatchIr(matchBody, "m0", false, null, null, grid);

    ScheduleData schedule =
        ScheduleData.builder()
            .acquisition("m0", new AcquirePulse(ACQUIRE, 0L, readoutLength))
            .signal(
                SignalInfo.builder(ACQUIRE, "shfqa_1", DeviceType.SHFQA)
                    .startDelay(4e-9)
                    .portDelay(2e-9)
                    .build())
            .signal(SignalInfo.builder(DRIVE, "shfsg_1", DeviceType.SHFSG).build())
            .sequencerRate("shfsg_1", 250e6)
            .build();
    long matchStart = new BranchTimingResolver(schedule).resolveStart(match, readoutLength, false);

    return root(
        matchStart + pulseLength, IrChild.at(0, readout), IrChild.at(matchStart, match));
  }

  /** Randomized benchmarking style program drawing one PRNG sample per iteration. */
  static IrNode prng() {
    long pulseLength = 32 * NS;
    int iterations = 3;

    SectionIr pick =
        SectionIr.of(
            "pick",
            pulseLength,
            Set.of(DRIVE),
            List.of(
                IrChild.at(
                    0,
                    new CaseIr(
                        SectionIr.of(
                            "gate_x",
                            pulseLength,
                            Set.of(DRIVE),
                            List.of(
                                IrChild.at(
                                    0,
                                    PulseIr.builder("gate_x", SectionPulse.play(DRIVE, "x90"))
                                        .length(pulseLength)
                                        .build()))),
                        0)),
                IrChild.at(
                    0,
                    new EmptyBranchIr(
                        SectionIr.of("gate_id", pulseLength, Set.of(DRIVE), List.of()), 1))));
    MatchIr match = new MatchIr(pick, null, false, null, "gate", pulseLength);
    LoopIterationIr prototype =
        new LoopIterationIr(
            "draws",
            pulseLength,
            Set.of(DRIVE),
            List.of(IrChild.at(0, match)),
            0,
            iterations,
            List.of(),
            "gate",
            false);
    LoopIr loop =
        new LoopIr(
            "draws",
            pulseLength * iterations,
            Set.of(DRIVE),
            List.of(IrChild.at(0, prototype)),
            iterations,
            true);
    SectionIr program =
        new SectionIr(
            "rb",
            loop.length(),
            Set.of(DRIVE),
            List.of(IrChild.at(0, loop)),
            List.of(),
            new PrngSetup(2, 17));
    return root(program.length(), IrChild.at(0, program));
  }

  private static SectionIr readoutSection(String name, String handle, long length) {
    PulseIr measure =
        PulseIr.builder(name, SectionPulse.play(MEASURE, "readout"))
            .length(length)
            .amplitude(0.8)
            .build();
    PulseIr acquire =
        PulseIr.builder(
                name,
                SectionPulse.acquire(
                    ACQUIRE, "integration", new AcquireParams(handle, "INTEGRATION")))
            .length(length)
            .build();
    return SectionIr.of(
        name,
        length,
        Set.of(MEASURE, ACQUIRE),
        List.of(IrChild.at(0, measure), IrChild.at(0, acquire)));
  }

  private static RootIr root(Long length, IrChild... children) {
    return new RootIr(length, Set.of(), List.of(children));
  }

  private static Map<String, Supplier<IrNode>> buildExamples() {
    Map<String, Supplier<IrNode>> examples = new LinkedHashMap<>();
    examples.put("trigger", ExamplePrograms::trigger);
    examples.put("sweep", ExamplePrograms::sweep);
    examples.put("feedback", ExamplePrograms::feedback);
    examples.put("prng", ExamplePrograms::prng);
    return Collections.unmodifiableMap(examples);
  }
}
