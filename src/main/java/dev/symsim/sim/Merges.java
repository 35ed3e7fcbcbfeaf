package dev.symsim.sim;

import dev.symsim.backend.AssumptionReason;
import dev.symsim.backend.ExprBuilder;
import dev.symsim.backend.LabeledPred;
import dev.symsim.backend.SymExpr;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 汇合点上的合并算法：帧、全局状态、部分结果、中止结果与假设。
 */
public final class Merges {
    private Merges() {}

    /**
     * Combines the aborted results of two paths split on {@code pred}. An {@code Exit} on either
     * immediate side wins; exits nested deeper inside a {@code Branch} are kept as they are.
     */
    public static AbortedResult mergeAbortedResult(SymExpr pred, AbortedResult left, AbortedResult right) {
        if (left instanceof AbortedResult.Exit) {
            return left;
        }
        if (right instanceof AbortedResult.Exit) {
            return right;
        }
        return new AbortedResult.Branch(pred, left, right);
    }

    /** Folds {@code aborted} into {@code result}, which stays defined only under {@code pred}. */
    public static <V> PartialResult<V> mergePartialAndAbortedResult(
            ExprBuilder eb, SymExpr pred, PartialResult<V> result, AbortedResult aborted) {
        if (result instanceof PartialResult.Partial<V> p) {
            return new PartialResult.Partial<>(
                    eb.andPred(pred, p.pred()), p.pair(), mergeAbortedResult(pred, p.aborted(), aborted));
        }
        return new PartialResult.Partial<>(pred, result.pair(), aborted);
    }

    static SimFrame mergeCrucibleFrame(ExprBuilder eb, BranchTarget target, SymExpr pred, SimFrame x, SimFrame y)
            throws SimulatorError {
        if (target instanceof BranchTarget.BlockTarget bt) {
            if (!(x instanceof SimFrame.CrucibleFrame cx) || !(y instanceof SimFrame.CrucibleFrame cy)) {
                throw new SimulatorError.InvalidState("merge at block " + bt.block() + " expects two CFG frames");
            }
            if (cx.cfg() != cy.cfg() || !cx.block().equals(bt.block()) || !cy.block().equals(bt.block())) {
                throw new SimulatorError.InvalidState(
                        "merge at block " + bt.block() + " of frames at " + cx.programLoc() + " and "
                                + cy.programLoc());
            }
            return new SimFrame.CrucibleFrame(
                    cx.cfg(), cx.postdoms(), cx.block(), cx.pc(), RegMerge.muxRegMap(eb, pred, cx.regs(), cy.regs()));
        }
        if (!(x instanceof SimFrame.ReturnFrame rx) || !(y instanceof SimFrame.ReturnFrame ry)) {
            throw new SimulatorError.InvalidState("merge at return expects two return frames");
        }
        return new SimFrame.ReturnFrame(RegMerge.muxRegEntry(eb, pred, rx.value(), ry.value()));
    }

    static GlobalPair<SimFrame> mergeGlobalPair(
            ExprBuilder eb, BranchTarget target, SymExpr pred, GlobalPair<SimFrame> x, GlobalPair<SimFrame> y)
            throws SimulatorError {
        return new GlobalPair<>(
                mergeCrucibleFrame(eb, target, pred, x.value(), y.value()),
                SymGlobalState.mux(eb, pred, x.globals(), y.globals()));
    }

    /**
     * Merges the result of the path that ran under {@code pred} ({@code x}) with the one that ran
     * under its negation ({@code y}).
     */
    public static PartialResult<SimFrame> mergePartialResult(
            ExprBuilder eb, BranchTarget target, SymExpr pred, PartialResult<SimFrame> x, PartialResult<SimFrame> y)
            throws SimulatorError {
        GlobalPair<SimFrame> merged = mergeGlobalPair(eb, target, pred, x.pair(), y.pair());
        if (x instanceof PartialResult.Partial<SimFrame> px) {
            if (y instanceof PartialResult.Partial<SimFrame> py) {
                return new PartialResult.Partial<>(
                        eb.itePred(pred, px.pred(), py.pred()),
                        merged,
                        mergeAbortedResult(pred, px.aborted(), py.aborted()));
            }
            return new PartialResult.Partial<>(eb.orPred(eb.notPred(pred), px.pred()), merged, px.aborted());
        }
        if (y instanceof PartialResult.Partial<SimFrame> py) {
            return new PartialResult.Partial<>(eb.orPred(pred, py.pred()), merged, py.aborted());
        }
        return new PartialResult.Total<>(merged);
    }

    /**
     * Qualifies each branch's assumptions by the branch condition ({@code pred => a} and
     * {@code not pred => a}), dropping the ones that become trivially true.
     */
    public static List<LabeledPred<AssumptionReason>> mergeAssumptions(
            ExprBuilder eb,
            SymExpr pred,
            List<LabeledPred<AssumptionReason>> thens,
            List<LabeledPred<AssumptionReason>> elses) {
        SymExpr pnot = eb.notPred(pred);
        ArrayList<LabeledPred<AssumptionReason>> out = new ArrayList<>(thens.size() + elses.size());
        for (LabeledPred<AssumptionReason> a : thens) {
            addUnlessTrue(eb, out, a.withPred(eb.impliesPred(pred, a.pred())));
        }
        for (LabeledPred<AssumptionReason> a : elses) {
            addUnlessTrue(eb, out, a.withPred(eb.impliesPred(pnot, a.pred())));
        }
        return List.copyOf(out);
    }

    private static void addUnlessTrue(
            ExprBuilder eb, List<LabeledPred<AssumptionReason>> out, LabeledPred<AssumptionReason> a) {
        Optional<Boolean> c = eb.asConstantPred(a.pred());
        if (c.isPresent() && c.get()) {
            return;
        }
        out.add(a);
    }

    /** Consumes {@code frame} and returns a copy whose globals carry one more pending branch. */
    static PausedFrame pushPausedFrame(PausedFrame frame) throws SimulatorError {
        PausedFrame.Contents c = frame.take();
        GlobalPair<SimFrame> pair = c.result().pair();
        return new PausedFrame(c.result().withPair(pair.withGlobals(pair.globals().pushBranch())), c.resumption());
    }

    static PartialResult<SimFrame> abortPartialResult(PartialResult<SimFrame> result) throws SimulatorError {
        GlobalPair<SimFrame> pair = result.pair();
        return result.withPair(pair.withGlobals(pair.globals().abortBranch()));
    }
}
