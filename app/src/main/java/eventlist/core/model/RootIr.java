package eventlist.core.model;

import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Set;

/** Top of the schedule tree. Has no section of its own and emits only its children. */
public record RootIr(Long length, Set<String> signals, List<IrChild> children) implements IrNode {

  public RootIr {
    signals = signals == null ? ImmutableSet.of() : ImmutableSet.copyOf(signals);
    children = children == null ? List.of() : List.copyOf(children);
  }

  @Override
  public String section() {
    return null;
  }

  @Override
  public <A, R> R accept(IrVisitor<A, R> visitor, A arg) {
    return visitor.visitRoot(this, arg);
  }
}
