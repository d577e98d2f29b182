package eventlist.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A case with nothing programmed. Its signals still have to be kept busy for the length of the
 * match so that every branch occupies the same timeline.
 */
public record EmptyBranchIr(SectionIr body, long state) implements SectionNode {

  public EmptyBranchIr {
    Objects.requireNonNull(body, "body");
  }

  @Override
  public String section() {
    return body.section();
  }

  @Override
  public Long length() {
    return body.length();
  }

  @Override
  public Set<String> signals() {
    return body.signals();
  }

  @Override
  public List<IrChild> children() {
    return body.children();
  }

  @Override
  public <A, R> R accept(IrVisitor<A, R> visitor, A arg) {
    return visitor.visitEmptyBranch(this, arg);
  }
}
