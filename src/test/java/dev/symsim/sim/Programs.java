package dev.symsim.sim;

import dev.symsim.backend.SimpleBackend;
import dev.symsim.cfg.Block;
import dev.symsim.cfg.Cfg;
import dev.symsim.cfg.FnHandle;
import dev.symsim.cfg.JumpTarget;
import dev.symsim.cfg.Stmt;
import dev.symsim.cfg.TermStmt;
import dev.symsim.cfg.TypeRepr;
import dev.symsim.cfg.VerifyException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/** Small CFGs and contexts shared by the simulator tests. */
final class Programs {
    static final FnHandle EXIT = new FnHandle(90, "exit", List.of(), TypeRepr.UNIT);
    static final FnHandle PROBE = new FnHandle(91, "probe", List.of(), TypeRepr.UNIT);
    static final FnHandle INC = new FnHandle(92, "inc", List.of(TypeRepr.INT), TypeRepr.INT);

    private Programs() {}

    static Block block(List<TypeRepr> params, TermStmt term, Stmt... stmts) {
        return new Block(params, List.of(stmts), term);
    }

    static Block block(TermStmt term, Stmt... stmts) {
        return block(List.of(), term, stmts);
    }

    static TermStmt jump(int block, Integer... args) {
        return new TermStmt.Jump(JumpTarget.to(block, args));
    }

    static TermStmt br(int cond, JumpTarget ifTrue, JumpTarget ifFalse) {
        return new TermStmt.Br(cond, ifTrue, ifFalse);
    }

    /** {@code inc(n) = n + 1}. */
    static Cfg inc() {
        return new Cfg(
                INC,
                List.of(block(List.of(TypeRepr.INT), new TermStmt.Return(2), new Stmt.IntLit(1), new Stmt.IntAdd(0, 1))));
    }

    /**
     * {@code f(c) = c ? 1 : 2} as a diamond merging at {@code %3}. Each arm may be given extra
     * leading statements.
     */
    static Cfg diamond(FnHandle handle, List<Stmt> thenPrefix, TermStmt thenTerm, List<Stmt> elsePrefix, TermStmt elseTerm) {
        return new Cfg(
                handle,
                List.of(
                        block(List.of(TypeRepr.BOOL), br(0, JumpTarget.to(1), JumpTarget.to(2))),
                        armBlock(thenPrefix, 1, thenTerm),
                        armBlock(elsePrefix, 2, elseTerm),
                        block(List.of(TypeRepr.INT), new TermStmt.Return(0))));
    }

    /** Arm that runs {@code prefix}, defines {@code value} and ends with {@code term}, or jumps to %3 when null. */
    private static Block armBlock(List<Stmt> prefix, long value, TermStmt term) {
        ArrayList<Stmt> stmts = new ArrayList<>(prefix);
        int defined = 0;
        for (Stmt s : prefix) {
            if (s.definesRegister()) {
                defined++;
            }
        }
        if (term != null) {
            return new Block(List.of(), stmts, term);
        }
        stmts.add(new Stmt.IntLit(value));
        return new Block(List.of(), stmts, jump(3, defined));
    }

    static Cfg diamond(FnHandle handle) {
        return diamond(handle, List.of(), null, List.of(), null);
    }

    static FnHandle boolToInt(int index, String name) {
        return new FnHandle(index, name, List.of(TypeRepr.BOOL), TypeRepr.INT);
    }

    /** Statements calling {@code handle} with no arguments, discarding the unit result. */
    static List<Stmt> callUnit(FnHandle handle) {
        return List.of(new Stmt.FnLit(handle), new Stmt.Call(0, List.of(), TypeRepr.UNIT));
    }

    static FunctionBindings bindings(Cfg... cfgs) {
        FunctionBindings b = new FunctionBindings();
        try {
            for (Cfg cfg : cfgs) {
                b.registerCfg(cfg);
            }
        } catch (VerifyException e) {
            throw new AssertionError("test program does not verify: " + e.getMessage(), e);
        }
        b.registerOverride(EXIT, Overrides.exit("exit", 0));
        return b;
    }

    /** Registers a {@code probe} override that hands the simulator state to {@code sink} and returns unit. */
    static void registerProbe(FunctionBindings bindings, Consumer<SimState> sink) {
        bindings.registerOverride(
                PROBE,
                new HostOverride(
                        "probe",
                        state -> {
                            sink.accept(state);
                            return Operations.returnValue(RegEntry.unit(), state);
                        }));
    }

    static SimContext context(SimpleBackend backend, FunctionBindings bindings) {
        return new SimContext(backend, bindings, SimConfig.defaults());
    }

    /** Steps {@code initial} to completion, handing every intermediate simulator state to {@code observer}. */
    static ExecResult runObserved(ExecState initial, Consumer<SimState> observer) throws SimulatorError {
        ExecState st = initial;
        while (!(st instanceof ExecState.Result)) {
            SimState s = stateOf(st);
            if (s != null) {
                observer.accept(s);
            }
            st = Simulator.singleStep(st);
        }
        return ((ExecState.Result) st).result();
    }

    private static SimState stateOf(ExecState st) {
        if (st instanceof ExecState.Running r) {
            return r.state();
        }
        if (st instanceof ExecState.ControlTransferPending c) {
            return c.state();
        }
        if (st instanceof ExecState.OverrideEntry o) {
            return o.state();
        }
        if (st instanceof ExecState.AbortPending a) {
            return a.state();
        }
        return null;
    }
}
