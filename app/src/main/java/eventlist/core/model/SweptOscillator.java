package eventlist.core.model;

/** An oscillator whose frequency is stepped by a sweep, with the device and signal it drives. */
public record SweptOscillator(String id, String signal, String device) {}
