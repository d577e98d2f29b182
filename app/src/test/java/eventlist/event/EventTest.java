package eventlist.event;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

final class EventTest {

  @Test
  void builderKeepsAcceptedFieldsAndSkipsNulls() {
    Event event =
        Event.builder(EventType.SECTION_START, 10)
            .id(3)
            .chainElementId(3)
            .put(EventKey.SECTION_NAME, "s")
            .put(EventKey.HANDLE, null)
            .build();

    assertEquals("s", event.get(EventKey.SECTION_NAME));
    assertFalse(event.has(EventKey.HANDLE));
    assertNull(event.get(EventKey.HANDLE));
    assertEquals(3, event.chainElementId());
  }

  @Test
  void fieldsForeignToTheTypeAreRejected() {
    Event.Builder builder = Event.builder(EventType.SECTION_START, 0).id(0);

    assertThrows(IllegalStateException.class, () -> builder.put(EventKey.BIT, 3));
  }

  @Test
  void scalarAndPerMemberFieldsCannotShareAWireName() {
    Event.Builder builder =
        Event.builder(EventType.ACQUIRE_START, 0).id(0).put(EventKey.AMPLITUDE, 0.5);

    assertThrows(
        IllegalStateException.class, () -> builder.put(EventKey.AMPLITUDES, List.of(0.5)));
  }

  @Test
  void eventsNeedAnId() {
    assertThrows(
        IllegalStateException.class, () -> Event.builder(EventType.PLAY_START, 0).build());
  }

  @Test
  void stateAndShadowAreAcceptedEverywhere() {
    for (EventType type : EventType.values()) {
      assertTrue(type.accepts(EventKey.STATE), type + " accepts state");
      assertTrue(type.accepts(EventKey.SHADOW), type + " accepts shadow");
    }
  }

  @Test
  void withReturnsAnnotatedCopy() {
    Event original =
        Event.builder(EventType.PLAY_START, 5)
            .id(7)
            .chainElementId(7)
            .put(EventKey.SIGNAL, "a")
            .build();

    Event shadow = original.with(EventKey.SHADOW, true);

    assertEquals(7, shadow.id());
    assertEquals(Integer.valueOf(7), shadow.chainElementId());
    assertEquals("a", shadow.get(EventKey.SIGNAL));
    assertEquals(Boolean.TRUE, shadow.get(EventKey.SHADOW));
    assertFalse(original.has(EventKey.SHADOW));
    assertEquals(original, original.toBuilder().build());
  }

  @Test
  void pairingIsDeclaredOnTheTypes() {
    assertEquals(EventType.DROP_PRNG_SETUP, EventType.PRNG_SETUP.closingType());
    assertTrue(EventType.LOOP_STEP_END.closesPair());
    assertFalse(EventType.LOOP_ITERATION_END.opensPair());
    assertFalse(EventType.LOOP_ITERATION_END.closesPair());
  }
}
