package dev.symsim.sim;

import dev.symsim.backend.AbortExecReason;
import java.util.Objects;

/**
 * 驱动循环的状态机。每一步由 {@link Simulator#singleStep(ExecState)} 推进到下一个状态，
 * 直到 {@link Result}。
 */
public sealed interface ExecState
        permits ExecState.Result,
                ExecState.AbortPending,
                ExecState.Running,
                ExecState.OverrideEntry,
                ExecState.ControlTransferPending {
    record Result(ExecResult result) implements ExecState {
        public Result {
            Objects.requireNonNull(result, "result");
        }
    }

    record AbortPending(AbortExecReason reason, SimState state) implements ExecState {
        public AbortPending {
            Objects.requireNonNull(reason, "reason");
            Objects.requireNonNull(state, "state");
        }
    }

    /** Execute the next statement or terminator of the CFG frame on top. */
    record Running(SimState state) implements ExecState {
        public Running {
            Objects.requireNonNull(state, "state");
        }
    }

    record OverrideEntry(HostOverride override, SimState state) implements ExecState {
        public OverrideEntry {
            Objects.requireNonNull(override, "override");
            Objects.requireNonNull(state, "state");
        }
    }

    /** Control is arriving at {@code target}; pending merges there are resolved first. */
    record ControlTransferPending(BranchTarget target, SimState state) implements ExecState {
        public ControlTransferPending {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(state, "state");
        }
    }
}
