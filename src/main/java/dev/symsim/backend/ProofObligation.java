package dev.symsim.backend;

import java.util.List;
import java.util.Objects;

/** 待外部证明的目标，以及记录它时处于作用域内的全部假设。 */
public record ProofObligation(List<LabeledPred<AssumptionReason>> assumptions, LabeledPred<AssertionFailure> goal) {
    public ProofObligation {
        Objects.requireNonNull(assumptions, "assumptions");
        Objects.requireNonNull(goal, "goal");
        assumptions = List.copyOf(assumptions);
    }
}
