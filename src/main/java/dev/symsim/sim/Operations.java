package dev.symsim.sim;

import dev.symsim.backend.AbortExecReason;
import dev.symsim.backend.AssertionFailure;
import dev.symsim.backend.AssumptionFrame;
import dev.symsim.backend.AssumptionReason;
import dev.symsim.backend.BranchResult;
import dev.symsim.backend.ExprBuilder;
import dev.symsim.backend.LabeledPred;
import dev.symsim.backend.ProgramLoc;
import dev.symsim.backend.SymBackend;
import dev.symsim.backend.SymExpr;
import dev.symsim.cfg.TypeRepr;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 执行树上的操作：分支、汇合、调用/返回与中止。
 *
 * <p>每个操作接收当前 {@link SimState}，返回驱动循环的下一个 {@link ExecState}；状态本身不会被修改。
 * 唯一的副作用是 backend 上的假设栈与证明义务。</p>
 */
public final class Operations {
    private static final Logger logger = LoggerFactory.getLogger(Operations.class);

    private Operations() {}

    // ====== Calls ======

    /**
     * Resolves {@code fn} to its implementation and builds the callee frame. Closures append their
     * captured value to {@code args}.
     */
    public static ResolvedCall resolveCall(FunctionBindings bindings, FnVal fn, RegMap args) throws SimulatorError {
        FnVal cur = fn;
        RegMap curArgs = args;
        while (cur instanceof FnVal.ClosureFnVal c) {
            curArgs = curArgs.append(c.captured());
            cur = c.inner();
        }
        FnVal.HandleFnVal h = (FnVal.HandleFnVal) cur;
        if (!curArgs.types().equals(h.handle().argTypes())) {
            throw new SimulatorError.InvalidState(
                    "call to `" + h.handle().name() + "` with argument types " + typeNames(curArgs.types())
                            + ", expected " + typeNames(h.handle().argTypes()));
        }
        FnState st = bindings.lookup(h.handle()).orElseThrow(() -> new SimulatorError.UnresolvableFunction(h.handle()));
        if (st instanceof FnState.UseOverride o) {
            return new ResolvedCall.OverrideCall(
                    o.override(), new SimFrame.OverrideFrame(o.override().name(), curArgs));
        }
        FnState.UseCfg g = (FnState.UseCfg) st;
        return new ResolvedCall.CrucibleCall(SimFrame.CrucibleFrame.entry(g.cfg(), g.postdoms(), curArgs));
    }

    private static String typeNames(List<TypeRepr> types) {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < types.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(types.get(i).displayName());
        }
        return sb.append(')').toString();
    }

    /** Pushes a call to {@code callee}; {@code handler} decides what the caller does with the result. */
    public static ActiveTree callFn(ReturnHandler handler, SimFrame callee, ActiveTree tree) {
        ValueFromValue call = new ValueFromValue.Call(tree.context(), tree.frame(), handler);
        return new ActiveTree(new ValueFromFrame.End(call), tree.result().withValue(callee));
    }

    /**
     * Calls {@code fn} from an override. When it returns, {@code continuation} runs with the value
     * and the override frame back on top.
     */
    public static ExecState callFunction(SimState state, FnVal fn, RegMap args, OverrideContinuation continuation)
            throws SimulatorError {
        ResolvedCall rc = resolveCall(state.context().bindings(), fn, args);
        ActiveTree tree = callFn(new ReturnHandler.ToOverride(continuation), rc.frame(), state.tree());
        return enterCall(rc, state.withTree(tree));
    }

    /** Transfers control into a call whose frame is already on top of {@code state}. */
    static ExecState enterCall(ResolvedCall rc, SimState state) {
        logger.debug("call {}", rc.frame());
        if (rc instanceof ResolvedCall.OverrideCall oc) {
            return runOverride(oc.override(), state);
        }
        return continueExec(state);
    }

    // ====== State transitions ======

    public static ExecState runOverride(HostOverride override, SimState state) {
        return new ExecState.OverrideEntry(override, state);
    }

    public static ExecState continueExec(SimState state) {
        return new ExecState.Running(state);
    }

    public static ExecState runAbortHandler(AbortExecReason reason, SimState state) {
        return new ExecState.AbortPending(reason, state);
    }

    /**
     * Aborts the current path because of {@code failure}. A {@code false} proof obligation is
     * recorded first, so the path must be shown infeasible.
     */
    public static ExecState runErrorHandler(AssertionFailure failure, SimState state) {
        SymBackend sym = state.backend();
        sym.addProofObligation(new LabeledPred<>(sym.exprBuilder().falsePred(), failure));
        return runAbortHandler(
                new AbortExecReason.AssumedFalse(new AssumptionReason.AssumingNoError(failure)), state);
    }

    public static ExecState runGenericErrorHandler(String message, SimState state) {
        return runErrorHandler(new AssertionFailure(state.backend().getCurrentProgramLoc(), message), state);
    }

    public static ExecState jumpToBlock(ResolvedJump jump, SimState state) throws SimulatorError {
        SimFrame.CrucibleFrame f = state.crucibleFrame().setBlock(jump.block(), jump.args());
        return checkForIntraFrameMerge(
                new BranchTarget.BlockTarget(jump.block()), state.withTree(state.tree().withFrame(f)));
    }

    public static ExecState checkForIntraFrameMerge(BranchTarget target, SimState state) {
        return new ExecState.ControlTransferPending(target, state);
    }

    // ====== Branching ======

    /** Branches on {@code pred}; both arms meet again at the current block's immediate postdominator. */
    public static ExecState conditionalBranch(SymExpr pred, ResolvedJump ifTrue, ResolvedJump ifFalse, SimState state)
            throws SimulatorError {
        SimFrame.CrucibleFrame top = state.crucibleFrame();
        BranchTarget target = top.postdomTarget();
        GlobalPair<SimFrame> pair = state.tree().result().pair();
        PausedFrame t = cruciblePausedFrame(ifTrue, pair, target);
        PausedFrame f = cruciblePausedFrame(ifFalse, pair, target);
        return intraBranch(
                pred, t, top.blockLoc(ifTrue.block()), f, top.blockLoc(ifFalse.block()), target, state);
    }

    /**
     * Multi-way branch. The first case whose predicate holds is taken, so each case runs under the
     * negation of all earlier predicates. An empty list aborts the path.
     */
    public static ExecState variantCases(List<ResolvedCase> cases, SimState state) throws SimulatorError {
        SimFrame.CrucibleFrame top = state.crucibleFrame();
        if (cases.isEmpty()) {
            return abortExec(new AbortExecReason.VariantOptionsExhausted(top.programLoc()), state);
        }
        ResolvedCase first = cases.get(0);
        BranchTarget target = top.postdomTarget();
        GlobalPair<SimFrame> pair = state.tree().result().pair();
        PausedFrame x = cruciblePausedFrame(first.jump(), pair, target);
        PausedFrame rest =
                new PausedFrame(
                        new PartialResult.Total<>(pair),
                        new ControlResumption.Switch(cases.subList(1, cases.size())));
        return intraBranch(first.pred(), x, top.blockLoc(first.jump().block()), rest, null, target, state);
    }

    private static PausedFrame cruciblePausedFrame(ResolvedJump jump, GlobalPair<SimFrame> top, BranchTarget target)
            throws SimulatorError {
        SimFrame.CrucibleFrame cf = ((SimFrame.CrucibleFrame) top.value()).setBlock(jump.block(), jump.args());
        ControlResumption res =
                target.equals(new BranchTarget.BlockTarget(jump.block()))
                        ? new ControlResumption.CheckMerge(jump.block())
                        : new ControlResumption.Continue();
        return new PausedFrame(new PartialResult.Total<>(top.withValue(cf)), res);
    }

    /** The context with any partiality of the active result moved onto it. */
    private static ValueFromFrame asContFrame(ActiveTree tree) {
        if (tree.result() instanceof PartialResult.Partial<SimFrame> p) {
            return new ValueFromFrame.Partial(
                    tree.context(), p.pred(), p.aborted(), PendingPartialMerges.NO_NEED_TO_ABORT);
        }
        return tree.context();
    }

    private static ExecState intraBranch(
            SymExpr pred,
            PausedFrame ifTrue,
            ProgramLoc trueLoc,
            PausedFrame ifFalse,
            ProgramLoc falseLoc,
            BranchTarget target,
            SimState state)
            throws SimulatorError {
        ValueFromFrame ctx = asContFrame(state.tree());
        SymBackend sym = state.backend();
        ExprBuilder eb = sym.exprBuilder();
        BranchResult r = sym.evalBranch(pred);
        ProgramLoc loc = sym.getCurrentProgramLoc();

        if (r instanceof BranchResult.SymbolicBranch sb) {
            boolean chosen = sb.chosen();
            SymExpr chosenPred = chosen ? pred : eb.notPred(pred);
            PausedFrame active = Merges.pushPausedFrame(chosen ? ifTrue : ifFalse);
            PausedFrame other = Merges.pushPausedFrame(chosen ? ifFalse : ifTrue);
            ProgramLoc activeLoc = chosen ? trueLoc : falseLoc;
            ProgramLoc otherLoc = chosen ? falseLoc : trueLoc;

            AssumptionFrame checkpoint = sym.pushAssumptionFrame();
            sym.addAssumption(new LabeledPred<>(chosenPred, new AssumptionReason.ExploringAPath(loc, activeLoc)));
            logger.debug("symbolic branch at {} on {}, merge at {}", loc, chosenPred, target);

            ValueFromFrame branch =
                    new ValueFromFrame.Branch(
                            ctx, checkpoint, loc, chosenPred, new SiblingPath.ActivePath(otherLoc, other), target);
            return resumeFrame(active, branch, state);
        }

        boolean chosen = ((BranchResult.NoBranch) r).chosen();
        ProgramLoc activeLoc = chosen ? trueLoc : falseLoc;
        sym.addAssumption(new LabeledPred<>(eb.truePred(), new AssumptionReason.ExploringAPath(loc, activeLoc)));
        return resumeFrame(chosen ? ifTrue : ifFalse, ctx, state);
    }

    /** Makes {@code frame} the active path under {@code ctx} and runs its resumption. */
    static ExecState resumeFrame(PausedFrame frame, ValueFromFrame ctx, SimState state) throws SimulatorError {
        PausedFrame.Contents c = frame.take();
        SimState next = state.withTree(new ActiveTree(ctx, c.result()));
        ControlResumption res = c.resumption();
        if (res instanceof ControlResumption.Switch s) {
            return variantCases(s.cases(), next);
        }
        if (res instanceof ControlResumption.CheckMerge cm) {
            return checkForIntraFrameMerge(new BranchTarget.BlockTarget(cm.block()), next);
        }
        return continueExec(next);
    }

    // ====== Merging ======

    /**
     * Resolves one pending merge at {@code target}: resumes the postponed sibling, merges with a
     * completed one, or folds in the partiality left by an aborted one. With nothing pending, control
     * continues into the block or returns from the function.
     */
    public static ExecState performIntraFrameMerge(BranchTarget target, SimState state) throws SimulatorError {
        ActiveTree tree = state.tree();
        ValueFromFrame ctx0 = tree.context();
        PartialResult<SimFrame> er = tree.result();
        SymBackend sym = state.backend();
        ExprBuilder eb = sym.exprBuilder();

        if (ctx0 instanceof ValueFromFrame.Branch b && b.target().equals(target)) {
            if (b.sibling() instanceof SiblingPath.ActivePath ap) {
                List<LabeledPred<AssumptionReason>> pathAssumes = popCheckpoint(sym, b.checkpoint());
                AssumptionFrame checkpoint = sym.pushAssumptionFrame();
                SymExpr pnot = eb.notPred(b.pred());
                sym.addAssumption(new LabeledPred<>(pnot, new AssumptionReason.ExploringAPath(b.loc(), ap.targetLoc())));
                logger.debug("reached {} under {}, resuming sibling", target, b.pred());

                SiblingPath done = new SiblingPath.CompletePath(pathAssumes, er);
                return resumeFrame(
                        ap.frame(), new ValueFromFrame.Branch(b.outer(), checkpoint, b.loc(), pnot, done, target), state);
            }

            SiblingPath.CompletePath cp = (SiblingPath.CompletePath) b.sibling();
            PartialResult<SimFrame> merged = Merges.mergePartialResult(eb, target, b.pred(), er, cp.result());
            List<LabeledPred<AssumptionReason>> pathAssumes = popCheckpoint(sym, b.checkpoint());
            sym.addAssumptions(Merges.mergeAssumptions(eb, b.pred(), pathAssumes, cp.assumptions()));
            logger.debug("merged both paths of branch at {} into {}", b.loc(), target);
            return checkForIntraFrameMerge(target, state.withTree(new ActiveTree(b.outer(), merged)));
        }

        if (ctx0 instanceof ValueFromFrame.Partial p) {
            PartialResult<SimFrame> er1 =
                    p.pending() == PendingPartialMerges.NEEDS_TO_BE_ABORTED ? Merges.abortPartialResult(er) : er;
            PartialResult<SimFrame> er2 = Merges.mergePartialAndAbortedResult(eb, p.pred(), er1, p.aborted());
            return checkForIntraFrameMerge(target, state.withTree(new ActiveTree(p.outer(), er2)));
        }

        if (target instanceof BranchTarget.BlockTarget) {
            return continueExec(state);
        }
        if (!(er.value() instanceof SimFrame.ReturnFrame rf)) {
            throw new SimulatorError.InvalidState("return merge reached without a return frame: " + er.value());
        }
        return handleSimReturn(returnContext(ctx0), er.withValue(rf.value()), state);
    }

    private static List<LabeledPred<AssumptionReason>> popCheckpoint(SymBackend sym, AssumptionFrame frame)
            throws SimulatorError {
        try {
            return sym.popAssumptionFrame(frame);
        } catch (IllegalStateException e) {
            throw new SimulatorError.InvalidState("assumption checkpoint misuse: " + e.getMessage(), e);
        }
    }

    // ====== Returns ======

    /** Returns {@code value} from the current CFG, after the merges pending at its exit. */
    public static ExecState returnAndMerge(RegEntry value, SimState state) {
        SimState next = state.withTree(state.tree().withFrame(new SimFrame.ReturnFrame(value)));
        return checkForIntraFrameMerge(new BranchTarget.ReturnTarget(), next);
    }

    /** Returns {@code value} from the current override. */
    public static ExecState returnValue(RegEntry value, SimState state) throws SimulatorError {
        ActiveTree tree = state.tree();
        return handleSimReturn(returnContext(tree.context()), tree.result().withValue(value), state);
    }

    static ExecState handleSimReturn(ValueFromValue ctx0, PartialResult<RegEntry> value, SimState state)
            throws SimulatorError {
        ValueFromValue ctx = ctx0;
        PartialResult<RegEntry> rv = value;
        while (ctx instanceof ValueFromValue.Partial p) {
            rv = Merges.mergePartialAndAbortedResult(state.exprBuilder(), p.pred(), rv, p.aborted());
            ctx = p.outer();
        }
        if (ctx instanceof ValueFromValue.End) {
            logger.debug("computation finished with {}", rv.value());
            return new ExecState.Result(new ExecResult.Finished(state.context(), rv));
        }

        ValueFromValue.Call call = (ValueFromValue.Call) ctx;
        RegEntry v = rv.value();
        ReturnHandler handler = call.handler();
        logger.debug("return {} to {}", v, call.caller());
        if (handler instanceof ReturnHandler.ToCrucible tc) {
            if (!(call.caller() instanceof SimFrame.CrucibleFrame cf)) {
                throw new SimulatorError.InvalidState("return to CFG, but the caller is " + call.caller());
            }
            if (v.type() != tc.returnType()) {
                throw new SimulatorError.InvalidState(
                        "call expected " + tc.returnType().displayName() + " result, got " + v.type().displayName());
            }
            SimFrame f = cf.extend(v).withPc(tc.resumePc());
            return continueExec(state.withTree(new ActiveTree(call.outer(), rv.withValue(f))));
        }
        if (handler instanceof ReturnHandler.TailToCrucible) {
            SimState next = state.withTree(new ActiveTree(call.outer(), rv.withValue(new SimFrame.ReturnFrame(v))));
            return returnAndMerge(v, next);
        }
        ReturnHandler.ToOverride to = (ReturnHandler.ToOverride) handler;
        if (!(call.caller() instanceof SimFrame.OverrideFrame)) {
            throw new SimulatorError.InvalidState("return to override, but the caller is " + call.caller());
        }
        SimState next = state.withTree(new ActiveTree(call.outer(), rv.withValue(call.caller())));
        return to.continuation().resume(v, next);
    }

    // ====== Aborts ======

    public static AbortHandler defaultAbortHandler() {
        return Operations::abortExecAndLog;
    }

    /** {@link #abortExec}, printing the reason and the active call stack when verbosity is above 0. */
    public static ExecState abortExecAndLog(AbortExecReason reason, SimState state) throws SimulatorError {
        logger.debug("path aborted: {}", reason.describe());
        SimConfig config = state.context().config();
        if (config.verbosity() > 0) {
            config.output().println(reason.describe());
            for (String line : describeFrames(state.tree().activeFrames())) {
                config.output().println("  " + line);
            }
        }
        return abortExec(reason, state);
    }

    /** Aborts the active path and resumes at the nearest pending branch. */
    public static ExecState abortExec(AbortExecReason reason, SimState state) throws SimulatorError {
        ActiveTree tree = state.tree();
        PartialResult<SimFrame> er = tree.result();
        AbortedResult ar = new AbortedResult.Exec(reason, er.pair());
        if (er instanceof PartialResult.Partial<SimFrame> p) {
            ar = new AbortedResult.Branch(p.pred(), ar, p.aborted());
        }
        return resumeValueFromFrameAbort(tree.context(), ar, state);
    }

    static ExecState resumeValueFromFrameAbort(ValueFromFrame ctx0, AbortedResult ar0, SimState state)
            throws SimulatorError {
        SymBackend sym = state.backend();
        ValueFromFrame ctx = ctx0;
        AbortedResult ar = ar0;
        while (ctx instanceof ValueFromFrame.Partial p) {
            ar = new AbortedResult.Branch(p.pred(), ar, p.aborted());
            ctx = p.outer();
        }
        if (ctx instanceof ValueFromFrame.End e) {
            return resumeValueFromValueAbort(e.vfv(), ar, state);
        }

        ValueFromFrame.Branch b = (ValueFromFrame.Branch) ctx;
        SymExpr pnot = sym.exprBuilder().notPred(b.pred());
        ValueFromFrame next =
                new ValueFromFrame.Partial(b.outer(), pnot, ar, PendingPartialMerges.NEEDS_TO_BE_ABORTED);
        popCheckpoint(sym, b.checkpoint());

        if (b.sibling() instanceof SiblingPath.ActivePath ap) {
            sym.addAssumption(new LabeledPred<>(pnot, new AssumptionReason.ExploringAPath(b.loc(), ap.targetLoc())));
            logger.debug("branch at {} lost one path, resuming sibling", b.loc());
            return resumeFrame(ap.frame(), next, state);
        }
        // The sibling already finished, so it is the only path left.
        SiblingPath.CompletePath cp = (SiblingPath.CompletePath) b.sibling();
        sym.addAssumptions(cp.assumptions());
        logger.debug("branch at {} lost one path, committing to the completed sibling", b.loc());
        return checkForIntraFrameMerge(b.target(), state.withTree(new ActiveTree(next, cp.result())));
    }

    static ExecState resumeValueFromValueAbort(ValueFromValue ctx0, AbortedResult ar0, SimState state)
            throws SimulatorError {
        ValueFromValue ctx = ctx0;
        AbortedResult ar = ar0;
        while (ctx instanceof ValueFromValue.Partial p) {
            ar = new AbortedResult.Branch(p.pred(), ar, p.aborted());
            ctx = p.outer();
        }
        if (ctx instanceof ValueFromValue.Call c) {
            return resumeValueFromFrameAbort(c.outer(), ar, state);
        }
        logger.debug("every path aborted");
        return new ExecState.Result(new ExecResult.Aborted(state.context(), ar));
    }

    // ====== Context stack ======

    /** True when the context holds exactly one live path (no pending symbolic branch). */
    public static boolean isSingleCont(ValueFromFrame ctx) {
        ValueFromFrame cur = ctx;
        while (true) {
            if (cur instanceof ValueFromFrame.Branch) {
                return false;
            }
            if (cur instanceof ValueFromFrame.Partial p) {
                cur = p.outer();
                continue;
            }
            ValueFromValue vfv = ((ValueFromFrame.End) cur).vfv();
            while (vfv instanceof ValueFromValue.Partial p) {
                vfv = p.outer();
            }
            if (vfv instanceof ValueFromValue.Call c) {
                cur = c.outer();
                continue;
            }
            return true;
        }
    }

    /** The value context of the current frame, or empty while a merge inside the frame is pending. */
    public static Optional<ValueFromValue> unwindContext(ValueFromFrame ctx) {
        if (ctx instanceof ValueFromFrame.End e) {
            return Optional.of(e.vfv());
        }
        if (ctx instanceof ValueFromFrame.Partial p && p.pending() == PendingPartialMerges.NO_NEED_TO_ABORT) {
            return unwindContext(p.outer()).map(outer -> new ValueFromValue.Partial(outer, p.pred(), p.aborted()));
        }
        return Optional.empty();
    }

    public static ValueFromValue returnContext(ValueFromFrame ctx) throws SimulatorError {
        Optional<ValueFromValue> vfv = unwindContext(ctx);
        if (vfv.isEmpty()) {
            throw new SimulatorError.UnresolvedMerge(renderContext(ctx));
        }
        return vfv.get();
    }

    /** Replaces the current activation by {@code frame}, if no merge inside it is pending. */
    public static Optional<ActiveTree> replaceTailFrame(ActiveTree tree, SimFrame frame) {
        return unwindContext(tree.context())
                .map(vfv -> new ActiveTree(new ValueFromFrame.End(vfv), tree.result().withValue(frame)));
    }

    /** The active path alone: every pending branch and partiality dropped, the call structure kept. */
    public static ActiveTree extractCurrentPath(ActiveTree tree) {
        return new ActiveTree(singleFrameContext(tree.context()), new PartialResult.Total<>(tree.result().pair()));
    }

    private static ValueFromFrame singleFrameContext(ValueFromFrame ctx) {
        ValueFromFrame cur = ctx;
        while (cur instanceof ValueFromFrame.Branch || cur instanceof ValueFromFrame.Partial) {
            cur = cur instanceof ValueFromFrame.Branch b ? b.outer() : ((ValueFromFrame.Partial) cur).outer();
        }
        return new ValueFromFrame.End(singleValueContext(((ValueFromFrame.End) cur).vfv()));
    }

    private static ValueFromValue singleValueContext(ValueFromValue ctx) {
        ValueFromValue cur = ctx;
        while (cur instanceof ValueFromValue.Partial p) {
            cur = p.outer();
        }
        if (cur instanceof ValueFromValue.Call c) {
            return new ValueFromValue.Call(singleFrameContext(c.outer()), c.caller(), c.handler());
        }
        return cur;
    }

    // ====== Diagnostics ======

    /**
     * One line per frame of {@code frames} (innermost first), leaving out the outermost one, which is
     * the synthetic start frame.
     */
    public static List<String> describeFrames(List<SimFrame> frames) {
        ArrayList<String> out = new ArrayList<>();
        for (int i = 0; i < frames.size() - 1; i++) {
            out.add(describeFrame(frames.get(i)));
        }
        return List.copyOf(out);
    }

    private static String describeFrame(SimFrame f) {
        if (f instanceof SimFrame.OverrideFrame of) {
            return "When calling " + of.name();
        }
        if (f instanceof SimFrame.CrucibleFrame cf) {
            return "In " + cf.cfg().handle().name() + " at " + cf.programLoc().position();
        }
        return "While returning value";
    }

    static String renderContext(ValueFromFrame ctx) {
        StringBuilder sb = new StringBuilder();
        ValueFromFrame cur = ctx;
        while (true) {
            if (cur instanceof ValueFromFrame.Branch b) {
                sb.append("branch at ").append(b.loc()).append(" (merge at ").append(b.target()).append(") <- ");
                cur = b.outer();
            } else if (cur instanceof ValueFromFrame.Partial p) {
                sb.append("partial").append(p.pending() == PendingPartialMerges.NEEDS_TO_BE_ABORTED ? " (pending)" : "")
                        .append(" <- ");
                cur = p.outer();
            } else {
                ValueFromValue vfv = ((ValueFromFrame.End) cur).vfv();
                while (vfv instanceof ValueFromValue.Partial p) {
                    vfv = p.outer();
                }
                if (vfv instanceof ValueFromValue.Call c) {
                    sb.append(describeFrame(c.caller())).append(" <- ");
                    cur = c.outer();
                } else {
                    return sb.append("end").toString();
                }
            }
        }
    }
}
