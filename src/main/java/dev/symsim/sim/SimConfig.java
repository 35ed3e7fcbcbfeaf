package dev.symsim.sim;

import java.io.PrintStream;
import java.util.Objects;

/**
 * 仿真器选项。
 *
 * <p>{@code verbosity > 0} 时，每次路径中止都会把原因和调用栈打印到 {@code output}。</p>
 */
public record SimConfig(int verbosity, PrintStream output) {
    public SimConfig {
        Objects.requireNonNull(output, "output");
        if (verbosity < 0) {
            throw new IllegalArgumentException("verbosity must be >= 0");
        }
    }

    public static SimConfig defaults() {
        return new SimConfig(0, System.out);
    }

    public SimConfig withVerbosity(int newVerbosity) {
        return new SimConfig(newVerbosity, output);
    }

    public SimConfig withOutput(PrintStream newOutput) {
        return new SimConfig(verbosity, newOutput);
    }
}
