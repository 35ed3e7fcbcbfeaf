package dev.symsim.sim;

import dev.symsim.backend.ExprBuilder;
import dev.symsim.backend.SymExpr;
import dev.symsim.cfg.GlobalVar;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 全局变量存储（不可变）。
 *
 * <p>{@code branchDepth} 记录当前路径上尚未合并/撤销的分支层数：每次 {@link #pushBranch()}
 * 加一，{@link #abortBranch()} 或 {@link #mux} 减一。</p>
 */
public final class SymGlobalState {
    private static final SymGlobalState EMPTY = new SymGlobalState(Map.of(), 0);

    private final Map<GlobalVar, RegEntry> values;
    private final int branchDepth;

    private SymGlobalState(Map<GlobalVar, RegEntry> values, int branchDepth) {
        this.values = values;
        this.branchDepth = branchDepth;
    }

    public static SymGlobalState empty() {
        return EMPTY;
    }

    public int branchDepth() {
        return branchDepth;
    }

    public Optional<RegEntry> lookup(GlobalVar global) {
        Objects.requireNonNull(global, "global");
        return Optional.ofNullable(values.get(global));
    }

    public SymGlobalState insert(GlobalVar global, RegEntry value) {
        Objects.requireNonNull(global, "global");
        Objects.requireNonNull(value, "value");
        if (global.type() != value.type()) {
            throw new IllegalArgumentException(
                    "global `" + global.name() + "` has type " + global.type().displayName() + ", got "
                            + value.type().displayName());
        }
        LinkedHashMap<GlobalVar, RegEntry> next = new LinkedHashMap<>(values);
        next.put(global, value);
        return new SymGlobalState(Collections.unmodifiableMap(next), branchDepth);
    }

    public Map<GlobalVar, RegEntry> values() {
        return values;
    }

    public SymGlobalState pushBranch() {
        return new SymGlobalState(values, branchDepth + 1);
    }

    public SymGlobalState abortBranch() throws SimulatorError {
        if (branchDepth == 0) {
            throw new SimulatorError.InvalidState("abortBranch on global state with no pending branch");
        }
        return new SymGlobalState(values, branchDepth - 1);
    }

    /** Merges two branch states; variables present on only one side are dropped. */
    public static SymGlobalState mux(ExprBuilder eb, SymExpr pred, SymGlobalState x, SymGlobalState y)
            throws SimulatorError {
        if (x.branchDepth != y.branchDepth) {
            throw new SimulatorError.InvalidState(
                    "cannot merge global states at different branch depths: " + x.branchDepth + " vs "
                            + y.branchDepth);
        }
        if (x.branchDepth == 0) {
            throw new SimulatorError.InvalidState("cannot merge global states with no pending branch");
        }
        LinkedHashMap<GlobalVar, RegEntry> merged = new LinkedHashMap<>();
        for (Map.Entry<GlobalVar, RegEntry> e : x.values.entrySet()) {
            RegEntry other = y.values.get(e.getKey());
            if (other != null) {
                merged.put(e.getKey(), RegMerge.muxRegEntry(eb, pred, e.getValue(), other));
            }
        }
        return new SymGlobalState(Collections.unmodifiableMap(merged), x.branchDepth - 1);
    }

    @Override
    public String toString() {
        return "SymGlobalState" + values + "@" + branchDepth;
    }
}
