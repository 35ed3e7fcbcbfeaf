package dev.symsim.backend;

import java.util.Objects;

public record LabeledPred<L>(SymExpr pred, L label) {
    public LabeledPred {
        Objects.requireNonNull(pred, "pred");
        Objects.requireNonNull(label, "label");
        if (pred.type() != BaseType.BOOL) {
            throw new IllegalArgumentException("labeled predicate must be boolean, got " + pred.type());
        }
    }

    public LabeledPred<L> withPred(SymExpr newPred) {
        return new LabeledPred<>(newPred, label);
    }
}
