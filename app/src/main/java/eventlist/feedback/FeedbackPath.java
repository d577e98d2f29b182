package eventlist.feedback;

/** Route a measurement result takes to the generating device. */
public enum FeedbackPath {
  /** Decision taken on the instrument that acquired the result. */
  INTERNAL,
  /** Result forwarded through the sync hub. */
  ZSYNC
}
