package eventlist.feedback;

/** Device classes that can execute a feedback-driven branch. */
public enum GeneratorType {
  HDAWG,
  SHFSG,
  SHFQC
}
