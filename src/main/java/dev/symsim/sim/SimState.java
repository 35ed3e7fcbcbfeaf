package dev.symsim.sim;

import dev.symsim.backend.ExprBuilder;
import dev.symsim.backend.SymBackend;
import java.util.Objects;

/** 仿真状态（不可变）：每个操作都返回新的状态。 */
public record SimState(SimContext context, AbortHandler abortHandler, ActiveTree tree) {
    public SimState {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(abortHandler, "abortHandler");
        Objects.requireNonNull(tree, "tree");
    }

    public SimState withTree(ActiveTree newTree) {
        return new SimState(context, abortHandler, newTree);
    }

    public SymBackend backend() {
        return context.backend();
    }

    public ExprBuilder exprBuilder() {
        return context.exprBuilder();
    }

    public SimFrame frame() {
        return tree.frame();
    }

    public SimFrame.CrucibleFrame crucibleFrame() throws SimulatorError {
        if (tree.frame() instanceof SimFrame.CrucibleFrame cf) {
            return cf;
        }
        throw new SimulatorError.InvalidState("expected a CFG frame on top, found " + describe(tree.frame()));
    }

    public SimFrame.OverrideFrame overrideFrame() throws SimulatorError {
        if (tree.frame() instanceof SimFrame.OverrideFrame of) {
            return of;
        }
        throw new SimulatorError.InvalidState("expected an override frame on top, found " + describe(tree.frame()));
    }

    private static String describe(SimFrame f) {
        return f.getClass().getSimpleName();
    }
}
