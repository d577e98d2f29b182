package eventlist.feedback;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Latency model with a fixed transport cost per feedback path on top of the readout end, which is
 * converted to sequencer cycles by rounding up.
 */
public final class LinearFeedbackLatencyModel implements FeedbackLatencyModel {
  private final int analyzerSamplesPerCycle;
  private final Map<FeedbackPath, Long> pathCycles;

  public LinearFeedbackLatencyModel(
      int analyzerSamplesPerCycle, Map<FeedbackPath, Long> pathCycles) {
    if (analyzerSamplesPerCycle <= 0) {
      throw new IllegalArgumentException(
          "analyzerSamplesPerCycle must be positive: " + analyzerSamplesPerCycle);
    }
    Objects.requireNonNull(pathCycles, "pathCycles");
    this.analyzerSamplesPerCycle = analyzerSamplesPerCycle;
    this.pathCycles = new EnumMap<>(FeedbackPath.class);
    this.pathCycles.putAll(pathCycles);
    for (FeedbackPath path : FeedbackPath.values()) {
      if (!this.pathCycles.containsKey(path)) {
        throw new IllegalArgumentException("No transport latency given for " + path);
      }
    }
  }

  /** Rough figures for a QCCS setup at 2 GS/s. */
  public static LinearFeedbackLatencyModel qccsDefaults() {
    return new LinearFeedbackLatencyModel(
        8, Map.of(FeedbackPath.INTERNAL, 58L, FeedbackPath.ZSYNC, 95L));
  }

  @Override
  public long latency(
      GeneratorType generator, AnalyzerType analyzer, FeedbackPath path, long readoutEndSamples) {
    Objects.requireNonNull(generator, "generator");
    Objects.requireNonNull(analyzer, "analyzer");
    long readoutCycles =
        Math.floorDiv(readoutEndSamples + analyzerSamplesPerCycle - 1, analyzerSamplesPerCycle);
    return readoutCycles + pathCycles.get(path);
  }
}
