package dev.symsim.sim;

import dev.symsim.cfg.BlockId;
import java.util.List;
import java.util.Objects;

/** 暂停的帧被恢复时要做的第一件事。 */
public sealed interface ControlResumption
        permits ControlResumption.Continue, ControlResumption.CheckMerge, ControlResumption.Switch {
    record Continue() implements ControlResumption {}

    /** The frame is already at {@code block}, which is a merge point. */
    record CheckMerge(BlockId block) implements ControlResumption {
        public CheckMerge {
            Objects.requireNonNull(block, "block");
        }
    }

    /** Remaining cases of a multi-way branch. */
    record Switch(List<ResolvedCase> cases) implements ControlResumption {
        public Switch {
            Objects.requireNonNull(cases, "cases");
            cases = List.copyOf(cases);
        }
    }
}
