package eventlist.core.model;

import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** A plain section. Also the body shared by the branch kinds ({@link MatchIr}, {@link CaseIr}). */
public record SectionIr(
    String section,
    Long length,
    Set<String> signals,
    List<IrChild> children,
    List<TriggerOutput> triggerOutput,
    PrngSetup prngSetup)
    implements SectionNode {

  public SectionIr {
    Objects.requireNonNull(section, "section");
    signals = signals == null ? ImmutableSet.of() : ImmutableSet.copyOf(signals);
    children = children == null ? List.of() : List.copyOf(children);
    triggerOutput = triggerOutput == null ? List.of() : List.copyOf(triggerOutput);
  }

  public static SectionIr of(
      String section, Long length, Set<String> signals, List<IrChild> children) {
    return new SectionIr(section, length, signals, children, List.of(), null);
  }

  @Override
  public <A, R> R accept(IrVisitor<A, R> visitor, A arg) {
    return visitor.visitSection(this, arg);
  }
}
