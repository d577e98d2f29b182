package eventlist.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A real-time conditional branch. Dispatches at runtime to exactly one of its {@link CaseIr} (or
 * {@link EmptyBranchIr}) children, keyed by an acquisition {@code handle}, a user register or a
 * PRNG sample.
 *
 * @param body section data of the match itself; its children are the cases
 * @param handle acquisition handle the branch reads, or {@code null}
 * @param local whether the decision is taken on the generating device (no sync hub round trip)
 * @param userRegister user register the branch reads, or {@code null}
 * @param prngSample name of the PRNG sample the branch reads, or {@code null}
 * @param grid timing grid, in tinysamples, the branch start must be aligned to
 */
public record MatchIr(
    SectionIr body,
    String handle,
    boolean local,
    Integer userRegister,
    String prngSample,
    long grid)
    implements SectionNode {

  public MatchIr {
    Objects.requireNonNull(body, "body");
    if (grid <= 0) {
      throw new IllegalArgumentException("grid must be positive: " + grid);
    }
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
    return visitor.visitMatch(this, arg);
  }
}
