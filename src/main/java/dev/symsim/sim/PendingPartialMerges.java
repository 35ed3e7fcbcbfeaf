package dev.symsim.sim;

/** Whether the surviving path still carries a branch push that must be undone on merge. */
public enum PendingPartialMerges {
    NO_NEED_TO_ABORT,
    NEEDS_TO_BE_ABORTED
}
