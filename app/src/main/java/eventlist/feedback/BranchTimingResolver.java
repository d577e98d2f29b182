package eventlist.feedback;

import eventlist.core.EventListException;
import eventlist.core.model.CaseIr;
import eventlist.core.model.EmptyBranchIr;
import eventlist.core.model.IrChild;
import eventlist.core.model.MatchIr;
import eventlist.util.TimeGrid;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the earliest start of a Match section bound to an acquisition handle.
 *
 * <p>The branch cannot start before the measurement result has reached every generator that plays
 * in it. For each of the match's signals the readout end of the handle's last acquisition is fed
 * through the latency model, converted into the signal's own time base and rounded up to the
 * match grid. The resolved start is the largest of these and the proposed start. Case children
 * all start together with the match, so the value is final for them.
 */
public final class BranchTimingResolver {
  private static final Logger LOG = LoggerFactory.getLogger(BranchTimingResolver.class);

  private final ScheduleData schedule;

  public BranchTimingResolver(ScheduleData schedule) {
    this.schedule = Objects.requireNonNull(schedule, "schedule");
  }

  /**
   * Resolves the start of {@code match}.
   *
   * @param proposedStart start the scheduler would use without feedback, in tinysamples
   * @param startMayChange whether an ancestor may still move the section (right alignment,
   *     automatic repetition)
   * @throws EventListException if the branch cannot be scheduled or the hardware combination does
   *     not support feedback
   */
  public long resolveStart(MatchIr match, long proposedStart, boolean startMayChange) {
    Objects.requireNonNull(match, "match");
    String section = match.section();
    checkCasePlacement(match);

    if (match.handle() == null) {
      return proposedStart;
    }
    String handle = match.handle();
    if (startMayChange) {
      throw new EventListException(
          "Match section '"
              + section
              + "' with handle '"
              + handle
              + "' may not be a subsection of a right-aligned section or within a loop with"
              + " repetition mode AUTO.",
          section,
          handle);
    }

    List<AcquirePulse> acquisitions = schedule.acquisitions(handle);
    if (acquisitions.isEmpty()) {
      throw new EventListException(
          "No acquire found for Match section '" + section + "' with handle '" + handle + "'.",
          section,
          handle);
    }
    AcquirePulse acquire = acquisitions.get(acquisitions.size() - 1);
    if (acquire.absoluteStart() == null) {
      throw new EventListException(
          "Match section '"
              + section
              + "' with handle '"
              + handle
              + "' can not be scheduled because the corresponding acquire is within a"
              + " right-aligned section or within a loop with repetition mode AUTO.",
          section,
          handle);
    }

    SignalInfo readoutSignal = schedule.signal(acquire.signalId());
    AnalyzerType analyzer = analyzerType(readoutSignal, section);
    long readoutEnd = readoutEndSamples(acquire, readoutSignal);
    FeedbackPath path = match.local() ? FeedbackPath.INTERNAL : FeedbackPath.ZSYNC;

    long earliest = 0;
    for (String signalId : match.signals()) {
      SignalInfo signal = schedule.signal(signalId);
      GeneratorType generator = generatorType(signal, section);
      long arrival = schedule.latencyModel().latency(generator, analyzer, path, readoutEnd);
      long latency = arrival * schedule.latencyUnitTinysamples(signal.deviceId());
      long ownOffset = TimeGrid.toTinysamples(signal.startDelay() + signal.delaySignal());
      earliest = Math.max(earliest, TimeGrid.ceilToGrid(latency - ownOffset, match.grid()));
    }

    long start = Math.max(earliest, proposedStart);
    LOG.debug(
        "Match '{}' on handle '{}': proposed start {}, resolved start {}",
        section,
        handle,
        proposedStart,
        start);
    return start;
  }

  /** End of the readout integration, in analyzer samples from the trigger. */
  static long readoutEndSamples(AcquirePulse acquire, SignalInfo readout) {
    double seconds =
        acquire.absoluteStart() * TimeGrid.TINYSAMPLE
            + acquire.length() * TimeGrid.TINYSAMPLE
            + readout.startDelay()
            + readout.delaySignal()
            + readout.baseDelaySignal();
    long portDelay =
        TimeGrid.totalRoundedDelaySamples(
            readout.samplingRate(),
            readout.deviceType().sampleMultiple(),
            readout.basePortDelay(),
            readout.portDelay());
    return (long) Math.rint(seconds * readout.samplingRate()) + portDelay;
  }

  static AnalyzerType analyzerType(SignalInfo signal, String section) {
    if (signal.combinedDevice()) {
      return AnalyzerType.SHFQC;
    }
    return switch (signal.deviceType()) {
      case SHFQA -> AnalyzerType.SHFQA;
      case SHFQC -> AnalyzerType.SHFQC;
      default -> throw new EventListException(
          "Feedback not supported for an acquisition on a " + signal.deviceType() + ".",
          section,
          signal.signalId());
    };
  }

  static GeneratorType generatorType(SignalInfo signal, String section) {
    if (signal.combinedDevice()) {
      return GeneratorType.SHFQC;
    }
    return switch (signal.deviceType()) {
      case HDAWG -> GeneratorType.HDAWG;
      case SHFSG -> GeneratorType.SHFSG;
      case SHFQC -> GeneratorType.SHFQC;
      default -> throw new EventListException(
          "Feedback not supported for signal '"
              + signal.signalId()
              + "' on a "
              + signal.deviceType()
              + ".",
          section,
          signal.signalId());
    };
  }

  private static void checkCasePlacement(MatchIr match) {
    for (IrChild child : match.children()) {
      if (!(child.node() instanceof CaseIr) && !(child.node() instanceof EmptyBranchIr)) {
        throw new IllegalStateException(
            "Match section '"
                + match.section()
                + "' has a child that is not a case: "
                + child.node().section());
      }
      if (child.start() != 0) {
        throw new IllegalStateException(
            "Case '"
                + child.node().section()
                + "' of match section '"
                + match.section()
                + "' starts at offset "
                + child.start()
                + " instead of 0");
      }
    }
  }
}
