package eventlist.core.model;

/**
 * Marker for node kinds that behave as sections: their children are wrapped in subsection events
 * when they appear below another section.
 */
public sealed interface SectionNode extends IrNode
    permits SectionIr, LoopIr, LoopIterationIr, MatchIr, CaseIr, EmptyBranchIr {}
