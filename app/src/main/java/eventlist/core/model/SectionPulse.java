package eventlist.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A pulse as placed in a section.
 *
 * @param signal signal the pulse is played or acquired on
 * @param pulseId waveform id, {@code null} for a plain delay
 * @param acquireParams acquisition settings, {@code null} unless this is an acquire
 * @param sweptFields fields bound to a sweep parameter, mapped to the parameter uid
 */
public record SectionPulse(
    String signal,
    String pulseId,
    AcquireParams acquireParams,
    Map<PulseField, String> sweptFields) {

  public SectionPulse {
    Objects.requireNonNull(signal, "signal");
    EnumMap<PulseField, String> copy = new EnumMap<>(PulseField.class);
    if (sweptFields != null) {
      copy.putAll(sweptFields);
    }
    sweptFields = Collections.unmodifiableMap(copy);
  }

  public static SectionPulse play(String signal, String pulseId) {
    return new SectionPulse(signal, pulseId, null, Map.of());
  }

  public static SectionPulse delay(String signal) {
    return new SectionPulse(signal, null, null, Map.of());
  }

  public static SectionPulse acquire(String signal, String pulseId, AcquireParams acquireParams) {
    return new SectionPulse(signal, pulseId, acquireParams, Map.of());
  }

  public SectionPulse withSweptField(PulseField field, String parameterUid) {
    Map<PulseField, String> fields = new EnumMap<>(PulseField.class);
    fields.putAll(sweptFields);
    fields.put(field, parameterUid);
    return new SectionPulse(signal, pulseId, acquireParams, fields);
  }

  public boolean isDelay() {
    return pulseId == null;
  }

  /** Uids of the sweep parameters driving this pulse, in length/amplitude/phase/offset order. */
  public List<String> parametrizedWith() {
    List<String> uids = new ArrayList<>();
    for (PulseField field : PulseField.values()) {
      String uid = sweptFields.get(field);
      if (uid != null) {
        uids.add(uid);
      }
    }
    return List.copyOf(uids);
  }
}
