package dev.symsim.sim;

/** Rest of an override, run when a function it called returns {@code value}. */
@FunctionalInterface
public interface OverrideContinuation {
    ExecState resume(RegEntry value, SimState state) throws SimulatorError;
}
