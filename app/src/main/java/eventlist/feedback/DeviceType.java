package eventlist.feedback;

/** Instrument classes a signal can live on, with the sample granularity of their sequencers. */
public enum DeviceType {
  HDAWG(16),
  UHFQA(8),
  SHFQA(16),
  SHFSG(16),
  SHFQC(16);

  private final int sampleMultiple;

  DeviceType(int sampleMultiple) {
    this.sampleMultiple = sampleMultiple;
  }

  /** Timing granularity in device samples. */
  public int sampleMultiple() {
    return sampleMultiple;
  }
}
