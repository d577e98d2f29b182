package eventlist.core.model;

import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** Blocks a signal's timeline without producing output. */
public record ReserveIr(String section, Long length, Set<String> signals) implements IrNode {

  public ReserveIr {
    Objects.requireNonNull(section, "section");
    signals = signals == null ? ImmutableSet.of() : ImmutableSet.copyOf(signals);
  }

  @Override
  public List<IrChild> children() {
    return List.of();
  }

  @Override
  public <A, R> R accept(IrVisitor<A, R> visitor, A arg) {
    return visitor.visitReserve(this, arg);
  }
}
