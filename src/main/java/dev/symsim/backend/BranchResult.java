package dev.symsim.backend;

public sealed interface BranchResult permits BranchResult.NoBranch, BranchResult.SymbolicBranch {
    /** The condition is decided under the current assumptions; only {@code chosen} is feasible. */
    record NoBranch(boolean chosen) implements BranchResult {}

    /** Both arms are feasible; {@code chosen} says which one to explore first. */
    record SymbolicBranch(boolean chosen) implements BranchResult {}
}
