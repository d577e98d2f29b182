package eventlist.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/** One branch of a {@link MatchIr}, selected when the branch value equals {@code state}. */
public record CaseIr(SectionIr body, long state) implements SectionNode {

  public CaseIr {
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
    return visitor.visitCase(this, arg);
  }
}
