package eventlist.core.model;

/** Acquisition settings of an acquire pulse. */
public record AcquireParams(String handle, String acquisitionType) {}
