package eventlist.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

final class PulseParametersTest {

  @Test
  void encodingIsKeySortedAndOrderIndependent() {
    Map<String, Object> first = new LinkedHashMap<>();
    first.put("sigma", 0.2);
    first.put("beta", 0.5);
    Map<String, Object> second = new LinkedHashMap<>();
    second.put("beta", 0.5);
    second.put("sigma", 0.2);

    Map<String, Object> encoded = PulseParameters.encode(first);

    assertEquals(List.of("beta", "sigma"), List.copyOf(encoded.keySet()));
    assertEquals(encoded, PulseParameters.encode(second));
    assertEquals(encoded.hashCode(), PulseParameters.encode(second).hashCode());
  }

  @Test
  void nestedValuesAreEncodedDeeply() {
    Map<String, Object> inner = new LinkedHashMap<>();
    inner.put("z", 1);
    inner.put("a", 2);
    Map<String, Object> parameters = new LinkedHashMap<>();
    parameters.put("shape", inner);
    parameters.put("samples", new double[] {0.1, 0.2});
    parameters.put("dropped", null);

    Map<String, Object> encoded = PulseParameters.encode(parameters);

    @SuppressWarnings("unchecked")
    Map<String, Object> shape = (Map<String, Object>) encoded.get("shape");
    assertEquals(List.of("a", "z"), List.copyOf(shape.keySet()));
    assertEquals(List.of(0.1, 0.2), encoded.get("samples"));
    assertEquals(List.of("samples", "shape"), List.copyOf(encoded.keySet()));
    assertThrows(UnsupportedOperationException.class, () -> encoded.put("x", 1));
  }

  @Test
  void membersWithoutParametersStayNull() {
    List<Map<String, Object>> encoded =
        PulseParameters.encodeAll(Arrays.asList(Map.of("a", 1), null));

    assertEquals(2, encoded.size());
    assertEquals(Map.of("a", 1), encoded.get(0));
    assertNull(encoded.get(1));
    assertNull(PulseParameters.encode(null));
  }
}
