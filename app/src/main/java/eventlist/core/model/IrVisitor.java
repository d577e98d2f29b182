package eventlist.core.model;

/**
 * Exhaustive visitor over {@link IrNode} kinds. Adding a node kind breaks every implementation
 * until it handles the new kind.
 */
public interface IrVisitor<A, R> {
  R visitRoot(RootIr node, A arg);

  R visitSection(SectionIr node, A arg);

  R visitLoop(LoopIr node, A arg);

  R visitLoopIteration(LoopIterationIr node, A arg);

  R visitMatch(MatchIr node, A arg);

  R visitCase(CaseIr node, A arg);

  R visitEmptyBranch(EmptyBranchIr node, A arg);

  R visitPulse(PulseIr node, A arg);

  R visitAcquireGroup(AcquireGroupIr node, A arg);

  R visitOscillatorFrequencyStep(OscillatorFrequencyStepIr node, A arg);

  R visitPhaseReset(PhaseResetIr node, A arg);

  R visitReserve(ReserveIr node, A arg);

  R visitPrecompClear(PrecompClearIr node, A arg);
}
