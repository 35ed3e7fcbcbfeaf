package dev.symsim.sim;

import java.util.Objects;

/** 整个计算的结局。 */
public sealed interface ExecResult permits ExecResult.Finished, ExecResult.Aborted {
    SimContext context();

    /** At least one path returned; {@code result} is the merged return value. */
    record Finished(SimContext context, PartialResult<RegEntry> result) implements ExecResult {
        public Finished {
            Objects.requireNonNull(context, "context");
            Objects.requireNonNull(result, "result");
        }
    }

    /** Every path aborted. */
    record Aborted(SimContext context, AbortedResult result) implements ExecResult {
        public Aborted {
            Objects.requireNonNull(context, "context");
            Objects.requireNonNull(result, "result");
        }
    }
}
