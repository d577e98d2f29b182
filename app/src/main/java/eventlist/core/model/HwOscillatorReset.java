package eventlist.core.model;

/** A device whose hardware oscillators need a phase reset, and how long the reset takes (s). */
public record HwOscillatorReset(String device, double duration) {}
