package eventlist.util;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Canonical encoding of user pulse-shaping parameters.
 *
 * <p>Encoded maps are key-sorted and deeply immutable, so two parameter sets with the same content
 * compare equal and hash alike regardless of how they were built.
 */
public final class PulseParameters {

  private PulseParameters() {}

  public static Map<String, Object> encode(Map<String, ?> parameters) {
    if (parameters == null) {
      return null;
    }
    ImmutableSortedMap.Builder<String, Object> encoded = ImmutableSortedMap.naturalOrder();
    for (Map.Entry<String, ?> entry : parameters.entrySet()) {
      Object value = encodeValue(entry.getValue());
      if (value != null) {
        encoded.put(entry.getKey(), value);
      }
    }
    return encoded.build();
  }

  /** Encodes each member's parameters; members without parameters stay {@code null}. */
  public static List<Map<String, Object>> encodeAll(List<Map<String, Object>> parameters) {
    List<Map<String, Object>> encoded = new ArrayList<>(parameters.size());
    for (Map<String, Object> member : parameters) {
      encoded.add(encode(member));
    }
    return encoded;
  }

  @SuppressWarnings("unchecked")
  private static Object encodeValue(Object value) {
    if (value instanceof Map<?, ?> map) {
      return encode((Map<String, ?>) map);
    }
    if (value instanceof Iterable<?> iterable) {
      ImmutableList.Builder<Object> list = ImmutableList.builder();
      for (Object element : iterable) {
        Object encoded = encodeValue(element);
        if (encoded != null) {
          list.add(encoded);
        }
      }
      return list.build();
    }
    if (value instanceof double[] array) {
      ImmutableList.Builder<Object> list = ImmutableList.builder();
      for (double element : array) {
        list.add(element);
      }
      return list.build();
    }
    return value;
  }
}
