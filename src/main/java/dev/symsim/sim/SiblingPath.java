package dev.symsim.sim;

import dev.symsim.backend.AssumptionReason;
import dev.symsim.backend.LabeledPred;
import dev.symsim.backend.ProgramLoc;
import java.util.List;
import java.util.Objects;

/** 分支节点上另一条路径的状态：尚未执行，或已到达汇合点。 */
public sealed interface SiblingPath permits SiblingPath.ActivePath, SiblingPath.CompletePath {
    /** Not yet run. {@code targetLoc} is null for the deferred cases of a multi-way branch. */
    record ActivePath(ProgramLoc targetLoc, PausedFrame frame) implements SiblingPath {
        public ActivePath {
            Objects.requireNonNull(frame, "frame");
        }
    }

    /** Reached the merge point with {@code result}, under {@code assumptions}. */
    record CompletePath(List<LabeledPred<AssumptionReason>> assumptions, PartialResult<SimFrame> result)
            implements SiblingPath {
        public CompletePath {
            Objects.requireNonNull(assumptions, "assumptions");
            Objects.requireNonNull(result, "result");
            assumptions = List.copyOf(assumptions);
        }
    }
}
