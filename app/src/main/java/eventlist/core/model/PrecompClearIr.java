package eventlist.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/** Clears the precompensation filters of the device driving {@code signal}. */
public record PrecompClearIr(String section, Long length, String signal) implements IrNode {

  public PrecompClearIr {
    Objects.requireNonNull(section, "section");
    Objects.requireNonNull(signal, "signal");
  }

  @Override
  public Set<String> signals() {
    return Set.of(signal);
  }

  @Override
  public List<IrChild> children() {
    return List.of();
  }

  @Override
  public <A, R> R accept(IrVisitor<A, R> visitor, A arg) {
    return visitor.visitPrecompClear(this, arg);
  }
}
