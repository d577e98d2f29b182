package eventlist.pipeline;

import eventlist.event.Event;
import java.util.List;

/**
 * Outcome of one top-level generation.
 *
 * @param events emitted events in emission order
 * @param elapsedMillis wall-clock time spent generating
 */
public record EventListResult(List<Event> events, long elapsedMillis) {

  public EventListResult {
    events = List.copyOf(events);
  }

  public int size() {
    return events.size();
  }
}
