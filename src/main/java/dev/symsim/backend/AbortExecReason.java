package dev.symsim.backend;

import java.util.Objects;

/**
 * 路径中止的原因。中止不一定表示错误：路径可能因为条件矛盾而不可行，或者程序主动退出。
 */
public sealed interface AbortExecReason
        permits AbortExecReason.InfeasibleBranch,
                AbortExecReason.AssumedFalse,
                AbortExecReason.VariantOptionsExhausted,
                AbortExecReason.EarlyExit {
    String describe();

    record InfeasibleBranch(ProgramLoc loc) implements AbortExecReason {
        public InfeasibleBranch {
            Objects.requireNonNull(loc, "loc");
        }

        @Override
        public String describe() {
            return "Abort due to infeasible branch at " + loc;
        }
    }

    record AssumedFalse(AssumptionReason reason) implements AbortExecReason {
        public AssumedFalse {
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public String describe() {
            return "Abort due to false assumption: " + reason.describe();
        }
    }

    record VariantOptionsExhausted(ProgramLoc loc) implements AbortExecReason {
        public VariantOptionsExhausted {
            Objects.requireNonNull(loc, "loc");
        }

        @Override
        public String describe() {
            return "Variant options exhausted at " + loc;
        }
    }

    record EarlyExit(int exitCode, ProgramLoc loc) implements AbortExecReason {
        public EarlyExit {
            Objects.requireNonNull(loc, "loc");
        }

        @Override
        public String describe() {
            return "Program exited with code " + exitCode + " at " + loc;
        }
    }
}
