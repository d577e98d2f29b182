package eventlist.pipeline;

import com.google.common.math.IntMath;
import eventlist.event.Event;
import java.util.List;

/**
 * Number of events a node and its descendants may still emit. Each call owns its own budget,
 * seeded from the value its parent hands down; the parent learns what was spent from the size of
 * the returned list.
 *
 * <p>Arithmetic saturates, so a very negative budget stays exhausted instead of wrapping around.
 */
final class EventBudget {
  private int remaining;

  private EventBudget(int remaining) {
    this.remaining = remaining;
  }

  static EventBudget of(int maxEvents) {
    return new EventBudget(maxEvents);
  }

  /** Sets aside room for events this node emits itself. */
  void reserve(int events) {
    remaining = IntMath.saturatedSubtract(remaining, events);
  }

  /** Accounts for events a child emitted. */
  void charge(List<Event> emitted) {
    remaining = IntMath.saturatedSubtract(remaining, emitted.size());
  }

  boolean allows(int events) {
    return remaining >= events;
  }

  boolean isExhausted() {
    return remaining <= 0;
  }

  int remaining() {
    return remaining;
  }
}
