package dev.symsim.sim;

import dev.symsim.backend.AbortExecReason;

/** 内置的宿主 override。 */
public final class Overrides {
    private Overrides() {}

    /** Ends the calling path with {@code exitCode}, recorded as an early-exit abort. */
    public static HostOverride exit(String name, int exitCode) {
        return new HostOverride(
                name,
                state ->
                        Operations.runAbortHandler(
                                new AbortExecReason.EarlyExit(exitCode, state.backend().getCurrentProgramLoc()),
                                state));
    }

    /** Returns its first argument unchanged. */
    public static HostOverride identity(String name) {
        return new HostOverride(
                name,
                state -> {
                    RegMap args = state.overrideFrame().args();
                    if (args.size() == 0) {
                        throw new SimulatorError.InvalidState("`" + name + "` needs an argument to return");
                    }
                    return Operations.returnValue(args.get(0), state);
                });
    }
}
