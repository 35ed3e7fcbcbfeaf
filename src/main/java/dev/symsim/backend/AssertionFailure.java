package dev.symsim.backend;

import java.util.Objects;

/** 一次失败（或待证明）的断言：位置 + 描述。 */
public record AssertionFailure(ProgramLoc loc, String message) {
    public AssertionFailure {
        Objects.requireNonNull(loc, "loc");
        Objects.requireNonNull(message, "message");
    }

    @Override
    public String toString() {
        return message + " (at " + loc + ")";
    }
}
