package eventlist.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

final class IdTrackerTest {

  @Test
  void handsOutConsecutiveIds() {
    IdTracker ids = new IdTracker();

    assertEquals(0, ids.next());
    assertEquals(1, ids.next());
    assertEquals(2, ids.peek(), "peek does not consume");
    assertEquals(2, ids.next());
  }

  @Test
  void canStartAtAnOffset() {
    assertEquals(100, new IdTracker(100).next());
    assertThrows(IllegalArgumentException.class, () -> new IdTracker(-1));
  }

  @Test
  void refusesToWrapAround() {
    IdTracker ids = new IdTracker(Integer.MAX_VALUE - 1);

    assertEquals(Integer.MAX_VALUE - 1, ids.next());
    assertThrows(IllegalStateException.class, ids::next);
  }
}
