package dev.symsim.backend;

import java.util.Objects;

public sealed interface AssumptionReason
        permits AssumptionReason.ExploringAPath,
                AssumptionReason.UserAssumption,
                AssumptionReason.AssumingNoError {
    String describe();

    /** Assumed because the simulator chose a branch at {@code loc}; {@code target} may be null. */
    record ExploringAPath(ProgramLoc loc, ProgramLoc target) implements AssumptionReason {
        public ExploringAPath {
            Objects.requireNonNull(loc, "loc");
        }

        @Override
        public String describe() {
            if (target == null) {
                return "exploring branch at " + loc;
            }
            return "exploring branch at " + loc + " toward " + target;
        }
    }

    record UserAssumption(ProgramLoc loc, String message) implements AssumptionReason {
        public UserAssumption {
            Objects.requireNonNull(loc, "loc");
            Objects.requireNonNull(message, "message");
        }

        @Override
        public String describe() {
            return "assumption at " + loc + ": " + message;
        }
    }

    record AssumingNoError(AssertionFailure failure) implements AssumptionReason {
        public AssumingNoError {
            Objects.requireNonNull(failure, "failure");
        }

        @Override
        public String describe() {
            return "assuming no error: " + failure;
        }
    }
}
