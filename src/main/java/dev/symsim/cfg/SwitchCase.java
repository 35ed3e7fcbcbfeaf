package dev.symsim.cfg;

import java.util.Objects;

/** {@link TermStmt.VariantElim} 的一个分支：条件寄存器（bool）与跳转目标。 */
public record SwitchCase(int cond, JumpTarget target) {
    public SwitchCase {
        Objects.requireNonNull(target, "target");
    }
}
