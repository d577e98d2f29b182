package eventlist.core.model;

import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** Oscillator phase reset at the start of a section. */
public record PhaseResetIr(
    String section,
    Long length,
    Set<String> signals,
    List<HwOscillatorReset> hwOscillatorResets,
    boolean resetSwOscillators)
    implements IrNode {

  public PhaseResetIr {
    Objects.requireNonNull(section, "section");
    signals = signals == null ? ImmutableSet.of() : ImmutableSet.copyOf(signals);
    hwOscillatorResets = hwOscillatorResets == null ? List.of() : List.copyOf(hwOscillatorResets);
  }

  @Override
  public List<IrChild> children() {
    return List.of();
  }

  @Override
  public <A, R> R accept(IrVisitor<A, R> visitor, A arg) {
    return visitor.visitPhaseReset(this, arg);
  }
}
