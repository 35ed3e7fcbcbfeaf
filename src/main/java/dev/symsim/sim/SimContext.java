package dev.symsim.sim;

import dev.symsim.backend.ExprBuilder;
import dev.symsim.backend.SymBackend;
import java.util.Objects;

public record SimContext(SymBackend backend, FunctionBindings bindings, SimConfig config) {
    public SimContext {
        Objects.requireNonNull(backend, "backend");
        Objects.requireNonNull(bindings, "bindings");
        Objects.requireNonNull(config, "config");
    }

    public ExprBuilder exprBuilder() {
        return backend.exprBuilder();
    }
}
