package dev.symsim.sim;

import dev.symsim.cfg.FnHandle;
import java.util.Objects;

/**
 * 仿真器内部的致命错误。与路径中止（{@link dev.symsim.backend.AbortExecReason}）不同，
 * 它们表示程序或仿真器本身的不变式被破坏，不会被核心逻辑捕获。
 */
public sealed class SimulatorError extends Exception
        permits SimulatorError.UnresolvableFunction, SimulatorError.UnresolvedMerge, SimulatorError.InvalidState {
    SimulatorError(String message) {
        super(message);
    }

    SimulatorError(String message, Throwable cause) {
        super(message, cause);
    }

    public static final class UnresolvableFunction extends SimulatorError {
        private final FnHandle handle;

        public UnresolvableFunction(FnHandle handle) {
            super("Could not resolve function: `" + Objects.requireNonNull(handle, "handle").name() + "`");
            this.handle = handle;
        }

        public FnHandle handle() {
            return handle;
        }
    }

    public static final class UnresolvedMerge extends SimulatorError {
        public UnresolvedMerge(String context) {
            super(
                    "Unexpected attempt to exit function before all intra-procedural merges are complete. "
                            + "The call stack was: " + context);
        }
    }

    public static final class InvalidState extends SimulatorError {
        public InvalidState(String message) {
            super(message);
        }

        public InvalidState(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
