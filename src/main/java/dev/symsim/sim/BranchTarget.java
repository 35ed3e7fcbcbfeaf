package dev.symsim.sim;

import dev.symsim.cfg.BlockId;
import java.util.Objects;

/** 分支汇合点：函数内的某个块，或函数返回。 */
public sealed interface BranchTarget permits BranchTarget.BlockTarget, BranchTarget.ReturnTarget {
    record BlockTarget(BlockId block) implements BranchTarget {
        public BlockTarget {
            Objects.requireNonNull(block, "block");
        }

        @Override
        public String toString() {
            return block.toString();
        }
    }

    record ReturnTarget() implements BranchTarget {
        @Override
        public String toString() {
            return "return";
        }
    }
}
