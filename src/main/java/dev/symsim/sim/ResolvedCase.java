package dev.symsim.sim;

import dev.symsim.backend.SymExpr;
import java.util.Objects;

public record ResolvedCase(SymExpr pred, ResolvedJump jump) {
    public ResolvedCase {
        Objects.requireNonNull(pred, "pred");
        Objects.requireNonNull(jump, "jump");
    }
}
