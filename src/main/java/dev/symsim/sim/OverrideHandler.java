package dev.symsim.sim;

@FunctionalInterface
public interface OverrideHandler {
    ExecState run(SimState state) throws SimulatorError;
}
