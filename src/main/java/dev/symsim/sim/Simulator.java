package dev.symsim.sim;

import dev.symsim.backend.AbortExecReason;
import dev.symsim.backend.AssertionFailure;
import dev.symsim.backend.AssumptionReason;
import dev.symsim.backend.BaseType;
import dev.symsim.backend.ExprBuilder;
import dev.symsim.backend.LabeledPred;
import dev.symsim.backend.ProgramLoc;
import dev.symsim.backend.SymBackend;
import dev.symsim.backend.SymExpr;
import dev.symsim.cfg.Block;
import dev.symsim.cfg.FnHandle;
import dev.symsim.cfg.JumpTarget;
import dev.symsim.cfg.Stmt;
import dev.symsim.cfg.SwitchCase;
import dev.symsim.cfg.TermStmt;
import dev.symsim.cfg.TypeRepr;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 仿真器驱动：按 {@link ExecState} 逐步推进，直到得到 {@link ExecResult}。
 *
 * <p>{@link ExecState.Running} 状态下每一步执行当前 CFG 帧的一条语句或块的终结指令；
 * 分支、汇合、调用与返回都交给 {@link Operations}。</p>
 */
public final class Simulator {
    private static final Logger logger = LoggerFactory.getLogger(Simulator.class);

    /** Name of the override frame every computation starts in. */
    public static final String START_FRAME = "_start";

    private Simulator() {}

    public static SimState initSimState(SimContext context, SymGlobalState globals, AbortHandler abortHandler) {
        SimFrame start = new SimFrame.OverrideFrame(START_FRAME, RegMap.empty());
        return new SimState(context, abortHandler, ActiveTree.singleton(new GlobalPair<>(start, globals)));
    }

    /** Calls {@code handle} from the start frame; its return value ends the computation. */
    public static ExecState callEntry(SimState state, FnHandle handle, RegMap args) throws SimulatorError {
        return Operations.callFunction(state, new FnVal.HandleFnVal(handle), args, Operations::returnValue);
    }

    public static ExecResult run(SimContext context, SymGlobalState globals, FnHandle handle, RegMap args)
            throws SimulatorError {
        SimState init = initSimState(context, globals, Operations.defaultAbortHandler());
        return executeCrucible(callEntry(init, handle, args));
    }

    public static ExecResult executeCrucible(ExecState initial) throws SimulatorError {
        ExecState st = initial;
        while (!(st instanceof ExecState.Result)) {
            st = singleStep(st);
        }
        ExecResult result = ((ExecState.Result) st).result();
        logger.debug("execution finished: {}", result.getClass().getSimpleName());
        return result;
    }

    public static ExecState singleStep(ExecState st) throws SimulatorError {
        if (st instanceof ExecState.Result) {
            return st;
        }
        if (st instanceof ExecState.AbortPending a) {
            return a.state().abortHandler().onAbort(a.reason(), a.state());
        }
        if (st instanceof ExecState.OverrideEntry o) {
            return o.override().handler().run(o.state());
        }
        if (st instanceof ExecState.ControlTransferPending c) {
            return Operations.performIntraFrameMerge(c.target(), c.state());
        }
        return step(((ExecState.Running) st).state());
    }

    private static ExecState step(SimState state) throws SimulatorError {
        SimFrame.CrucibleFrame frame = state.crucibleFrame();
        Block block = frame.currentBlock();
        state.backend().setCurrentProgramLoc(frame.programLoc());
        if (frame.pc() < block.stmts().size()) {
            return evalStmt(state, frame, block.stmts().get(frame.pc()));
        }
        return evalTerm(state, frame, block.term());
    }

    // ====== Statements ======

    private static ExecState evalStmt(SimState state, SimFrame.CrucibleFrame f, Stmt stmt) throws SimulatorError {
        SymBackend sym = state.backend();
        ExprBuilder eb = sym.exprBuilder();

        if (stmt instanceof Stmt.BoolLit s) {
            return define(state, f, RegEntry.bool(eb.boolLit(s.value())));
        }
        if (stmt instanceof Stmt.IntLit s) {
            return define(state, f, RegEntry.integer(eb.intLit(s.value())));
        }
        if (stmt instanceof Stmt.UnitLit) {
            return define(state, f, RegEntry.unit());
        }
        if (stmt instanceof Stmt.FnLit s) {
            return define(state, f, RegEntry.fn(new FnVal.HandleFnVal(s.handle())));
        }
        if (stmt instanceof Stmt.Closure s) {
            return define(state, f, RegEntry.fn(new FnVal.ClosureFnVal(fnReg(f, s.fn()), f.regs().get(s.captured()))));
        }
        if (stmt instanceof Stmt.Not s) {
            return define(state, f, RegEntry.bool(eb.notPred(boolReg(f, s.operand()))));
        }
        if (stmt instanceof Stmt.And s) {
            return define(state, f, RegEntry.bool(eb.andPred(boolReg(f, s.lhs()), boolReg(f, s.rhs()))));
        }
        if (stmt instanceof Stmt.Or s) {
            return define(state, f, RegEntry.bool(eb.orPred(boolReg(f, s.lhs()), boolReg(f, s.rhs()))));
        }
        if (stmt instanceof Stmt.IntAdd s) {
            return define(state, f, RegEntry.integer(eb.intAdd(intReg(f, s.lhs()), intReg(f, s.rhs()))));
        }
        if (stmt instanceof Stmt.IntSub s) {
            return define(state, f, RegEntry.integer(eb.intSub(intReg(f, s.lhs()), intReg(f, s.rhs()))));
        }
        if (stmt instanceof Stmt.IntMul s) {
            return define(state, f, RegEntry.integer(eb.intMul(intReg(f, s.lhs()), intReg(f, s.rhs()))));
        }
        if (stmt instanceof Stmt.IntEq s) {
            return define(state, f, RegEntry.bool(eb.intEq(intReg(f, s.lhs()), intReg(f, s.rhs()))));
        }
        if (stmt instanceof Stmt.IntLe s) {
            return define(state, f, RegEntry.bool(eb.intLe(intReg(f, s.lhs()), intReg(f, s.rhs()))));
        }
        if (stmt instanceof Stmt.IntLt s) {
            return define(state, f, RegEntry.bool(eb.intLt(intReg(f, s.lhs()), intReg(f, s.rhs()))));
        }
        if (stmt instanceof Stmt.Ite s) {
            RegEntry v =
                    RegMerge.muxRegEntry(eb, boolReg(f, s.cond()), f.regs().get(s.then()), f.regs().get(s.otherwise()));
            return define(state, f, v);
        }
        if (stmt instanceof Stmt.FreshConstant s) {
            if (s.type() == TypeRepr.BOOL) {
                return define(state, f, RegEntry.bool(eb.freshConstant(s.name(), BaseType.BOOL)));
            }
            return define(state, f, RegEntry.integer(eb.freshConstant(s.name(), BaseType.INT)));
        }
        if (stmt instanceof Stmt.ReadGlobal s) {
            Optional<RegEntry> v = state.tree().globals().lookup(s.global());
            if (v.isEmpty()) {
                return Operations.runGenericErrorHandler(
                        "Attempt to read undefined global `" + s.global().name() + "`", state);
            }
            return define(state, f, v.get());
        }
        if (stmt instanceof Stmt.WriteGlobal s) {
            RegEntry v = f.regs().get(s.value());
            if (v.type() != s.global().type()) {
                throw new SimulatorError.InvalidState(
                        "global `" + s.global().name() + "` has type " + s.global().type().displayName()
                                + ", got " + v.type().displayName());
            }
            ActiveTree tree = state.tree().withGlobals(state.tree().globals().insert(s.global(), v));
            return Operations.continueExec(state.withTree(tree.withFrame(f.withPc(f.pc() + 1))));
        }
        if (stmt instanceof Stmt.Call s) {
            ResolvedCall rc = Operations.resolveCall(state.context().bindings(), fnReg(f, s.fn()), argRegs(f, s.args()));
            ActiveTree tree =
                    Operations.callFn(new ReturnHandler.ToCrucible(s.returnType(), f.pc() + 1), rc.frame(), state.tree());
            return Operations.enterCall(rc, state.withTree(tree));
        }
        if (stmt instanceof Stmt.Assert s) {
            SymExpr cond = boolReg(f, s.cond());
            AssertionFailure failure = new AssertionFailure(sym.getCurrentProgramLoc(), s.message());
            Optional<Boolean> c = eb.asConstantPred(cond);
            if (c.isPresent() && c.get()) {
                return advance(state, f);
            }
            sym.addProofObligation(new LabeledPred<>(cond, failure));
            if (c.isPresent()) {
                return Operations.runAbortHandler(
                        new AbortExecReason.AssumedFalse(new AssumptionReason.AssumingNoError(failure)), state);
            }
            sym.addAssumption(new LabeledPred<>(cond, new AssumptionReason.AssumingNoError(failure)));
            return advance(state, f);
        }
        Stmt.Assume s = (Stmt.Assume) stmt;
        SymExpr cond = boolReg(f, s.cond());
        AssumptionReason reason = new AssumptionReason.UserAssumption(sym.getCurrentProgramLoc(), s.message());
        Optional<Boolean> c = eb.asConstantPred(cond);
        if (c.isPresent() && !c.get()) {
            return Operations.runAbortHandler(new AbortExecReason.AssumedFalse(reason), state);
        }
        sym.addAssumption(new LabeledPred<>(cond, reason));
        return advance(state, f);
    }

    private static ExecState define(SimState state, SimFrame.CrucibleFrame f, RegEntry value) {
        return Operations.continueExec(state.withTree(state.tree().withFrame(f.extend(value).withPc(f.pc() + 1))));
    }

    private static ExecState advance(SimState state, SimFrame.CrucibleFrame f) {
        return Operations.continueExec(state.withTree(state.tree().withFrame(f.withPc(f.pc() + 1))));
    }

    // ====== Terminators ======

    private static ExecState evalTerm(SimState state, SimFrame.CrucibleFrame f, TermStmt term) throws SimulatorError {
        if (term instanceof TermStmt.Jump t) {
            return Operations.jumpToBlock(resolveJump(f, t.target()), state);
        }
        if (term instanceof TermStmt.Br t) {
            return Operations.conditionalBranch(
                    boolReg(f, t.cond()), resolveJump(f, t.ifTrue()), resolveJump(f, t.ifFalse()), state);
        }
        if (term instanceof TermStmt.VariantElim t) {
            ArrayList<ResolvedCase> cases = new ArrayList<>(t.cases().size());
            for (SwitchCase c : t.cases()) {
                cases.add(new ResolvedCase(boolReg(f, c.cond()), resolveJump(f, c.target())));
            }
            return Operations.variantCases(cases, state);
        }
        if (term instanceof TermStmt.Return t) {
            RegEntry v = f.regs().get(t.value());
            TypeRepr expected = f.cfg().handle().returnType();
            if (v.type() != expected) {
                throw new SimulatorError.InvalidState(
                        "`" + f.cfg().handle().name() + "` returns " + expected.displayName() + ", got "
                                + v.type().displayName());
            }
            return Operations.returnAndMerge(v, state);
        }
        if (term instanceof TermStmt.TailCall t) {
            ResolvedCall rc = Operations.resolveCall(state.context().bindings(), fnReg(f, t.fn()), argRegs(f, t.args()));
            Optional<ActiveTree> replaced = Operations.replaceTailFrame(state.tree(), rc.frame());
            ActiveTree tree =
                    replaced.isPresent()
                            ? replaced.get()
                            : Operations.callFn(new ReturnHandler.TailToCrucible(), rc.frame(), state.tree());
            return Operations.enterCall(rc, state.withTree(tree));
        }
        TermStmt.ErrorStmt t = (TermStmt.ErrorStmt) term;
        return Operations.runGenericErrorHandler(t.message(), state);
    }

    private static ResolvedJump resolveJump(SimFrame.CrucibleFrame f, JumpTarget target) {
        return new ResolvedJump(target.block(), argRegs(f, target.args()));
    }

    private static RegMap argRegs(SimFrame.CrucibleFrame f, List<Integer> regs) {
        ArrayList<RegEntry> out = new ArrayList<>(regs.size());
        for (int r : regs) {
            out.add(f.regs().get(r));
        }
        return new RegMap(out);
    }

    // ====== Register access ======

    private static SymExpr boolReg(SimFrame.CrucibleFrame f, int reg) throws SimulatorError {
        RegEntry e = f.regs().get(reg);
        if (e.type() != TypeRepr.BOOL) {
            throw new SimulatorError.InvalidState(regMismatch(f, reg, "bool", e));
        }
        return e.expr();
    }

    private static SymExpr intReg(SimFrame.CrucibleFrame f, int reg) throws SimulatorError {
        RegEntry e = f.regs().get(reg);
        if (e.type() != TypeRepr.INT) {
            throw new SimulatorError.InvalidState(regMismatch(f, reg, "int", e));
        }
        return e.expr();
    }

    private static FnVal fnReg(SimFrame.CrucibleFrame f, int reg) throws SimulatorError {
        RegEntry e = f.regs().get(reg);
        if (e.type() != TypeRepr.FUNCTION) {
            throw new SimulatorError.InvalidState(regMismatch(f, reg, "fn", e));
        }
        return e.fnVal();
    }

    private static String regMismatch(SimFrame.CrucibleFrame f, int reg, String expected, RegEntry got) {
        ProgramLoc loc = f.programLoc();
        return loc + ": register " + reg + " expected " + expected + ", got " + got.type().displayName();
    }
}
