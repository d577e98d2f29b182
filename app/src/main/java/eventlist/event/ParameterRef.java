package eventlist.event;

/** Reference to a sweep parameter by uid, written as {@code {"id": uid}}. */
public record ParameterRef(String id) {}
