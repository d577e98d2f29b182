package eventlist.core.model;

/** Pulse fields that may be driven by a sweep parameter instead of a constant. */
public enum PulseField {
  LENGTH,
  AMPLITUDE,
  PHASE,
  OFFSET
}
