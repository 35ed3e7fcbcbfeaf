package dev.symsim.backend;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

final class SimpleBackendTest {
    private final SimpleBackend backend = new SimpleBackend();
    private final ExprBuilder eb = backend.exprBuilder();

    private static LabeledPred<AssumptionReason> assumption(SymExpr pred) {
        return new LabeledPred<>(pred, new AssumptionReason.UserAssumption(ProgramLoc.initial(), "test"));
    }

    @Test
    void constantBranchesAreDecided() {
        assertEquals(new BranchResult.NoBranch(true), backend.evalBranch(eb.truePred()));
        assertEquals(new BranchResult.NoBranch(false), backend.evalBranch(eb.falsePred()));
    }

    @Test
    void assumedPredicatesDecideTheBranch() {
        SymExpr c = eb.freshConstant("c", BaseType.BOOL);
        SymExpr d = eb.freshConstant("d", BaseType.BOOL);
        backend.addAssumption(assumption(c));
        assertEquals(new BranchResult.NoBranch(true), backend.evalBranch(c));
        assertEquals(new BranchResult.NoBranch(false), backend.evalBranch(eb.notPred(c)));
        assertEquals(new BranchResult.SymbolicBranch(true), backend.evalBranch(d));
    }

    @Test
    void popReturnsOnlyTheFramesOwnAssumptions() {
        SymExpr a = eb.freshConstant("a", BaseType.BOOL);
        SymExpr b = eb.freshConstant("b", BaseType.BOOL);
        backend.addAssumption(assumption(a));
        AssumptionFrame frame = backend.pushAssumptionFrame();
        backend.addAssumption(assumption(b));
        assertEquals(2, backend.collectAssumptions().size());

        List<LabeledPred<AssumptionReason>> popped = backend.popAssumptionFrame(frame);
        assertEquals(1, popped.size());
        assertEquals(b, popped.get(0).pred());
        assertEquals(List.of(assumption(a)), backend.collectAssumptions());
        assertTrue(frame.isPopped());
    }

    @Test
    void popRejectsFramesThatAreNotOnTop() {
        AssumptionFrame outer = backend.pushAssumptionFrame();
        backend.pushAssumptionFrame();
        assertThrows(IllegalStateException.class, () -> backend.popAssumptionFrame(outer));
    }

    @Test
    void popRejectsAFrameTwice() {
        AssumptionFrame frame = backend.pushAssumptionFrame();
        backend.popAssumptionFrame(frame);
        assertThrows(IllegalStateException.class, () -> backend.popAssumptionFrame(frame));
    }

    @Test
    void popRejectsFramesOfAnotherBackend() {
        AssumptionFrame foreign = new SimpleBackend().pushAssumptionFrame();
        backend.pushAssumptionFrame();
        assertThrows(IllegalStateException.class, () -> backend.popAssumptionFrame(foreign));
    }

    @Test
    void statisticsTrackPushesPopsAndPeakDepth() {
        AssumptionFrame f1 = backend.pushAssumptionFrame();
        AssumptionFrame f2 = backend.pushAssumptionFrame();
        backend.popAssumptionFrame(f2);
        backend.popAssumptionFrame(f1);
        backend.popAssumptionFrame(backend.pushAssumptionFrame());

        CheckpointStatistics stats = backend.checkpointStatistics();
        assertEquals(new CheckpointStatistics(3, 3, 2, 0), stats);
        assertTrue(stats.balanced());
    }

    @Test
    void proofObligationsCaptureAssumptionsInScope() {
        SymExpr c = eb.freshConstant("c", BaseType.BOOL);
        backend.addAssumption(assumption(c));
        AssertionFailure failure = new AssertionFailure(new ProgramLoc("f", "%0:1"), "x must be positive");
        backend.addProofObligation(new LabeledPred<>(eb.falsePred(), failure));

        List<ProofObligation> obligations = backend.proofObligations();
        assertEquals(1, obligations.size());
        assertEquals(List.of(assumption(c)), obligations.get(0).assumptions());
        assertEquals(failure, obligations.get(0).goal().label());
    }

    @Test
    void programLocationIsTracked() {
        assertEquals(ProgramLoc.initial(), backend.getCurrentProgramLoc());
        ProgramLoc loc = new ProgramLoc("g", "%2:0");
        backend.setCurrentProgramLoc(loc);
        assertEquals(loc, backend.getCurrentProgramLoc());
    }
}
