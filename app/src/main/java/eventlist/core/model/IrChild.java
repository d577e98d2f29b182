package eventlist.core.model;

import java.util.Objects;

/** A child node together with its start offset relative to the parent's start. */
public record IrChild(long start, IrNode node) {

  public IrChild {
    Objects.requireNonNull(node, "node");
  }

  public static IrChild at(long start, IrNode node) {
    return new IrChild(start, node);
  }
}
