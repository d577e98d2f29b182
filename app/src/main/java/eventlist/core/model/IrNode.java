package eventlist.core.model;

import java.util.List;
import java.util.Set;

/**
 * A node of the timed schedule tree handed to event-list generation.
 *
 * <p>Nodes are immutable. Child start offsets are relative to the start of the parent; {@link
 * #length()} stays {@code null} until the scheduler has resolved it.
 */
public sealed interface IrNode
    permits RootIr,
        SectionNode,
        PulseIr,
        AcquireGroupIr,
        OscillatorFrequencyStepIr,
        PhaseResetIr,
        ReserveIr,
        PrecompClearIr {

  /** Name of the owning section, {@code null} for the root. */
  String section();

  /** Duration in tinysamples, {@code null} while unresolved. */
  Long length();

  Set<String> signals();

  List<IrChild> children();

  <A, R> R accept(IrVisitor<A, R> visitor, A arg);
}
