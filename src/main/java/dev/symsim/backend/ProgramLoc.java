package dev.symsim.backend;

import java.util.Objects;

/** 程序位置：所在函数 + 函数内位置（块/语句）。仅用于诊断。 */
public record ProgramLoc(String function, String position) {
    public ProgramLoc {
        Objects.requireNonNull(function, "function");
        Objects.requireNonNull(position, "position");
    }

    public static ProgramLoc initial() {
        return new ProgramLoc("_start", "<initialization>");
    }

    @Override
    public String toString() {
        return function + " " + position;
    }
}
