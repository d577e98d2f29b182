package eventlist.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Simultaneous acquisitions on one signal that share a handle and acquisition type. The per-member
 * lists are index-aligned with {@link #pulses()}; member entries may be {@code null}.
 */
public record AcquireGroupIr(
    String section,
    Long length,
    long offset,
    List<SectionPulse> pulses,
    List<Double> amplitudes,
    List<Double> phases,
    List<Double> oscillatorFrequencies,
    List<Map<String, Object>> playPulseParameters,
    List<Map<String, Object>> pulsePulseParameters)
    implements IrNode {

  public AcquireGroupIr {
    Objects.requireNonNull(section, "section");
    pulses = List.copyOf(pulses);
    amplitudes = copyOfNullable(amplitudes);
    phases = copyOfNullable(phases);
    oscillatorFrequencies =
        oscillatorFrequencies == null ? null : copyOfNullable(oscillatorFrequencies);
    playPulseParameters = copyOfNullable(playPulseParameters);
    pulsePulseParameters = copyOfNullable(pulsePulseParameters);
  }

  @Override
  public Set<String> signals() {
    Set<String> signals = new LinkedHashSet<>();
    for (SectionPulse pulse : pulses) {
      signals.add(pulse.signal());
    }
    return Collections.unmodifiableSet(signals);
  }

  @Override
  public List<IrChild> children() {
    return List.of();
  }

  @Override
  public <A, R> R accept(IrVisitor<A, R> visitor, A arg) {
    return visitor.visitAcquireGroup(this, arg);
  }

  private static <T> List<T> copyOfNullable(List<T> values) {
    if (values == null) {
      return List.of();
    }
    return Collections.unmodifiableList(new ArrayList<>(values));
  }
}
