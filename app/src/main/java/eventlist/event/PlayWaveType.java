package eventlist.event;

/** Kind of waveform slot a play or delay event stands for. */
public enum PlayWaveType {
  PLAY,
  DELAY,
  EMPTY_CASE
}
