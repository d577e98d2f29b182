package eventlist.core.model;

/** A marker output annotation attached to a played pulse. */
public record Marker(
    String markerSelector, boolean enable, Double start, Double length, String pulseId) {}
