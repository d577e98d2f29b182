package eventlist.core.model;

import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A loop over {@link LoopIterationIr} children.
 *
 * <p>When {@code compressed}, only the first iteration (the prototype) is present in {@link
 * #children()}; otherwise every iteration is an explicit child.
 */
public record LoopIr(
    String section,
    Long length,
    Set<String> signals,
    List<IrChild> children,
    int iterations,
    boolean compressed)
    implements SectionNode {

  public LoopIr {
    Objects.requireNonNull(section, "section");
    signals = signals == null ? ImmutableSet.of() : ImmutableSet.copyOf(signals);
    children = children == null ? List.of() : List.copyOf(children);
    if (iterations < 0) {
      throw new IllegalArgumentException("iterations must be non-negative: " + iterations);
    }
  }

  @Override
  public <A, R> R accept(IrVisitor<A, R> visitor, A arg) {
    return visitor.visitLoop(this, arg);
  }
}
