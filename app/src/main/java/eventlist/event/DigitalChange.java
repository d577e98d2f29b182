package eventlist.event;

/** Edge of a digital trigger line. */
public enum DigitalChange {
  SET,
  CLEAR
}
