package eventlist.util;

import eventlist.event.Event;
import eventlist.event.EventType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Structural checks on an emitted event list: ids unique and increasing, every paired START closed
 * by exactly one END of the matching type with the same chain element id, and no END before its
 * START.
 */
public final class EventListValidator {

  public record ValidationResult(List<String> violations, int pairCount) {
    public boolean isValid() {
      return violations.isEmpty();
    }
  }

  public ValidationResult validate(List<Event> events) {
    Objects.requireNonNull(events, "events");

    List<String> violations = new ArrayList<>();
    Map<Integer, Event> open = new LinkedHashMap<>();
    int pairs = 0;
    Integer previousId = null;

    for (int i = 0; i < events.size(); i++) {
      Event event = events.get(i);
      if (previousId != null && event.id() <= previousId) {
        violations.add(
            String.format(
                "event #%d %s: id %d does not increase (previous %d)",
                i, event.type(), event.id(), previousId));
      }
      previousId = event.id();

      EventType type = event.type();
      if (type.opensPair()) {
        Integer chain = event.chainElementId();
        if (chain == null || chain != event.id()) {
          violations.add(
              String.format(
                  "event #%d %s: chain element id %s differs from own id %d",
                  i, type, chain, event.id()));
          continue;
        }
        open.put(chain, event);
      } else if (type.closesPair()) {
        Integer chain = event.chainElementId();
        Event start = chain == null ? null : open.remove(chain);
        if (start == null) {
          violations.add(
              String.format("event #%d %s: no open START with chain %s", i, type, chain));
          continue;
        }
        if (start.type().closingType() != type) {
          violations.add(
              String.format(
                  "event #%d %s: closes %s (chain %d)", i, type, start.type(), chain));
        }
        if (event.time() < start.time()) {
          violations.add(
              String.format(
                  "event #%d %s: ends at %d before its start at %d",
                  i, type, event.time(), start.time()));
        }
        pairs++;
      }
    }

    for (Event start : open.values()) {
      violations.add(
          String.format(
              "%s id %d at t=%d is never closed", start.type(), start.id(), start.time()));
    }
    return new ValidationResult(List.copyOf(violations), pairs);
  }
}
