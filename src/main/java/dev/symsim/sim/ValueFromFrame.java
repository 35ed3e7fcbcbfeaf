package dev.symsim.sim;

import dev.symsim.backend.AssumptionFrame;
import dev.symsim.backend.ProgramLoc;
import dev.symsim.backend.SymExpr;
import java.util.Objects;

/**
 * 函数帧内部的上下文栈：等待在帧内汇合的分支，以及已并入部分性的中止路径。
 *
 * <p>只有 {@link End} 允许从当前函数返回；栈顶仍有 {@link Branch} 时返回属于致命错误。</p>
 */
public sealed interface ValueFromFrame permits ValueFromFrame.Branch, ValueFromFrame.Partial, ValueFromFrame.End {
    /**
     * A symbolic branch in progress. The active path runs under {@code pred}; {@code checkpoint}
     * scopes the assumptions made on it.
     */
    record Branch(
            ValueFromFrame outer,
            AssumptionFrame checkpoint,
            ProgramLoc loc,
            SymExpr pred,
            SiblingPath sibling,
            BranchTarget target)
            implements ValueFromFrame {
        public Branch {
            Objects.requireNonNull(outer, "outer");
            Objects.requireNonNull(checkpoint, "checkpoint");
            Objects.requireNonNull(loc, "loc");
            Objects.requireNonNull(pred, "pred");
            Objects.requireNonNull(sibling, "sibling");
            Objects.requireNonNull(target, "target");
        }
    }

    /** The active path is only defined when {@code pred} holds; the rest aborted with {@code aborted}. */
    record Partial(ValueFromFrame outer, SymExpr pred, AbortedResult aborted, PendingPartialMerges pending)
            implements ValueFromFrame {
        public Partial {
            Objects.requireNonNull(outer, "outer");
            Objects.requireNonNull(pred, "pred");
            Objects.requireNonNull(aborted, "aborted");
            Objects.requireNonNull(pending, "pending");
        }
    }

    record End(ValueFromValue vfv) implements ValueFromFrame {
        public End {
            Objects.requireNonNull(vfv, "vfv");
        }
    }
}
