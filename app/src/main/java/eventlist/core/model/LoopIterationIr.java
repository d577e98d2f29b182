package eventlist.core.model;

import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** One iteration of a loop body. */
public record LoopIterationIr(
    String section,
    Long length,
    Set<String> signals,
    List<IrChild> children,
    int iteration,
    int numRepeats,
    List<SweepParameter> sweepParameters,
    String prngSample,
    boolean shadow)
    implements SectionNode {

  public LoopIterationIr {
    Objects.requireNonNull(section, "section");
    signals = signals == null ? ImmutableSet.of() : ImmutableSet.copyOf(signals);
    children = children == null ? List.of() : List.copyOf(children);
    sweepParameters = sweepParameters == null ? List.of() : List.copyOf(sweepParameters);
  }

  /**
   * Derives the shadow of this prototype for {@code iteration}: same subtree and length, new
   * iteration index, marked as a shadow. The prototype itself is left untouched.
   */
  public LoopIterationIr compressedIteration(int iteration) {
    return new LoopIterationIr(
        section,
        length,
        signals,
        children,
        iteration,
        numRepeats,
        sweepParameters,
        prngSample,
        true);
  }

  @Override
  public <A, R> R accept(IrVisitor<A, R> visitor, A arg) {
    return visitor.visitLoopIteration(this, arg);
  }
}
