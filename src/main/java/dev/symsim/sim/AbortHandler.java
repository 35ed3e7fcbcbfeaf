package dev.symsim.sim;

import dev.symsim.backend.AbortExecReason;

@FunctionalInterface
public interface AbortHandler {
    ExecState onAbort(AbortExecReason reason, SimState state) throws SimulatorError;
}
