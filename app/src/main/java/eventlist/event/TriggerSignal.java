package eventlist.event;

/** A signal driving a section's trigger output, written as {@code {"signal_id": id}}. */
public record TriggerSignal(String signalId) {}
