package eventlist.feedback;

/** Round-trip latency of a measurement result to the generating sequencer. */
public interface FeedbackLatencyModel {

  /**
   * Returns the sequencer cycle, counted from the trigger, at which a result whose readout ends
   * at {@code readoutEndSamples} (analyzer samples from the trigger) is available in the
   * generator's register.
   */
  long latency(
      GeneratorType generator, AnalyzerType analyzer, FeedbackPath path, long readoutEndSamples);
}
