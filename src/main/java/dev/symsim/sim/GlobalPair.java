package dev.symsim.sim;

import java.util.Objects;

/** 一个值以及产生它时的全局状态。 */
public record GlobalPair<V>(V value, SymGlobalState globals) {
    public GlobalPair {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(globals, "globals");
    }

    public <W> GlobalPair<W> withValue(W newValue) {
        return new GlobalPair<>(newValue, globals);
    }

    public GlobalPair<V> withGlobals(SymGlobalState newGlobals) {
        return new GlobalPair<>(value, newGlobals);
    }
}
