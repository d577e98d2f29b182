package eventlist.core.model;

import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Sets new oscillator frequencies at the start of a loop iteration. {@code parameters}, {@code
 * oscillators} and {@code values} are index-aligned.
 */
public record OscillatorFrequencyStepIr(
    String section,
    Long length,
    Set<String> signals,
    int iteration,
    List<String> parameters,
    List<SweptOscillator> oscillators,
    List<Double> values)
    implements IrNode {

  public OscillatorFrequencyStepIr {
    Objects.requireNonNull(section, "section");
    signals = signals == null ? ImmutableSet.of() : ImmutableSet.copyOf(signals);
    parameters = List.copyOf(parameters);
    oscillators = List.copyOf(oscillators);
    values = List.copyOf(values);
  }

  @Override
  public List<IrChild> children() {
    return List.of();
  }

  @Override
  public <A, R> R accept(IrVisitor<A, R> visitor, A arg) {
    return visitor.visitOscillatorFrequencyStep(this, arg);
  }
}
