package eventlist.feedback;

/** Device classes whose readout results can drive feedback. */
public enum AnalyzerType {
  SHFQA,
  SHFQC
}
