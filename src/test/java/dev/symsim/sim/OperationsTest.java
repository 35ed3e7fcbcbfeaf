package dev.symsim.sim;

import static dev.symsim.sim.Programs.*;
import static org.junit.jupiter.api.Assertions.*;

import dev.symsim.backend.AbortExecReason;
import dev.symsim.backend.AssumptionFrame;
import dev.symsim.backend.BaseType;
import dev.symsim.backend.ExprBuilder;
import dev.symsim.backend.ProgramLoc;
import dev.symsim.backend.SimpleBackend;
import dev.symsim.backend.SymExpr;
import dev.symsim.cfg.FnHandle;
import dev.symsim.cfg.TypeRepr;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

final class OperationsTest {
    private final SimpleBackend backend = new SimpleBackend();
    private final ExprBuilder eb = backend.exprBuilder();
    private final SymExpr c = eb.freshConstant("c", BaseType.BOOL);
    private final AbortedResult aborted =
            new AbortedResult.Exec(
                    new AbortExecReason.InfeasibleBranch(ProgramLoc.initial()),
                    new GlobalPair<>(new SimFrame.OverrideFrame("x", RegMap.empty()), SymGlobalState.empty()));

    private static final ValueFromFrame TOP = new ValueFromFrame.End(new ValueFromValue.End());

    private static GlobalPair<SimFrame> override(String name) {
        return new GlobalPair<>(new SimFrame.OverrideFrame(name, RegMap.empty()), SymGlobalState.empty());
    }

    private ValueFromFrame branchOver(ValueFromFrame outer) {
        AssumptionFrame checkpoint = backend.pushAssumptionFrame();
        PausedFrame sibling = new PausedFrame(new PartialResult.Total<>(override("sibling")), new ControlResumption.Continue());
        return new ValueFromFrame.Branch(
                outer,
                checkpoint,
                ProgramLoc.initial(),
                c,
                new SiblingPath.ActivePath(null, sibling),
                new BranchTarget.ReturnTarget());
    }

    @Test
    void returningWithAPendingBranchIsFatal() {
        ValueFromFrame ctx = branchOver(TOP);
        assertFalse(Operations.isSingleCont(ctx));
        assertTrue(Operations.unwindContext(ctx).isEmpty());
        SimulatorError.UnresolvedMerge e =
                assertThrows(SimulatorError.UnresolvedMerge.class, () -> Operations.returnContext(ctx));
        assertTrue(e.getMessage().contains("branch at"), e.getMessage());
    }

    @Test
    void unwindingCarriesPartialityOntoTheValueContext() throws Exception {
        ValueFromFrame ctx = new ValueFromFrame.Partial(TOP, c, aborted, PendingPartialMerges.NO_NEED_TO_ABORT);
        assertTrue(Operations.isSingleCont(ctx));
        assertEquals(new ValueFromValue.Partial(new ValueFromValue.End(), c, aborted), Operations.returnContext(ctx));

        ValueFromFrame pending = new ValueFromFrame.Partial(TOP, c, aborted, PendingPartialMerges.NEEDS_TO_BE_ABORTED);
        assertTrue(Operations.unwindContext(pending).isEmpty());
    }

    @Test
    void pendingBranchInTheCallerIsSeenThroughACall() {
        ValueFromFrame callee =
                new ValueFromFrame.End(
                        new ValueFromValue.Call(branchOver(TOP), override("caller").value(), new ReturnHandler.TailToCrucible()));
        assertFalse(Operations.isSingleCont(callee));
        assertTrue(Operations.unwindContext(callee).isPresent());
    }

    @Test
    void tailFrameIsReplacedOnlyWithoutPendingMerges() {
        SimFrame next = new SimFrame.OverrideFrame("next", RegMap.empty());

        ActiveTree plain = ActiveTree.singleton(override("current"));
        Optional<ActiveTree> replaced = Operations.replaceTailFrame(plain, next);
        assertEquals(next, replaced.orElseThrow().frame());
        assertEquals(1, replaced.orElseThrow().activeFrames().size());

        ActiveTree branching = new ActiveTree(branchOver(TOP), new PartialResult.Total<>(override("current")));
        assertTrue(Operations.replaceTailFrame(branching, next).isEmpty());
    }

    @Test
    void callPushesTheCallerUnderTheCallee() {
        ActiveTree tree = ActiveTree.singleton(override("caller"));
        SimFrame callee = new SimFrame.OverrideFrame("callee", RegMap.empty());

        ActiveTree called = Operations.callFn(new ReturnHandler.TailToCrucible(), callee, tree);

        assertEquals(List.of(callee, tree.frame()), called.activeFrames());
        assertEquals(0, called.pendingBranches());
    }

    @Test
    void currentPathDropsBranchesButKeepsCalls() {
        SimFrame caller = new SimFrame.OverrideFrame("caller", RegMap.empty());
        ValueFromFrame inner =
                branchOver(
                        new ValueFromFrame.Partial(
                                new ValueFromFrame.End(
                                        new ValueFromValue.Call(branchOver(TOP), caller, new ReturnHandler.TailToCrucible())),
                                c,
                                aborted,
                                PendingPartialMerges.NO_NEED_TO_ABORT));
        ActiveTree tree = new ActiveTree(inner, new PartialResult.Partial<>(c, override("callee"), aborted));
        assertEquals(2, tree.pendingBranches());

        ActiveTree path = Operations.extractCurrentPath(tree);

        assertEquals(0, path.pendingBranches());
        assertInstanceOf(PartialResult.Total.class, path.result());
        assertEquals(List.of(tree.frame(), caller), path.activeFrames());
        assertTrue(Operations.isSingleCont(path.context()));
    }

    @Test
    void resolvingAnUnboundHandleFails() {
        FnHandle missing = new FnHandle(50, "missing", List.of(), TypeRepr.UNIT);
        SimulatorError.UnresolvableFunction e =
                assertThrows(
                        SimulatorError.UnresolvableFunction.class,
                        () -> Operations.resolveCall(bindings(), new FnVal.HandleFnVal(missing), RegMap.empty()));
        assertEquals("Could not resolve function: `missing`", e.getMessage());
    }

    @Test
    void resolvingAClosureAppendsTheCapturedValue() throws Exception {
        RegEntry captured = RegEntry.integer(eb.intLit(7));
        FnVal closure = new FnVal.ClosureFnVal(new FnVal.HandleFnVal(INC), captured);

        ResolvedCall rc = Operations.resolveCall(bindings(inc()), closure, RegMap.empty());

        SimFrame.CrucibleFrame f = assertInstanceOf(SimFrame.CrucibleFrame.class, rc.frame());
        assertEquals(INC, f.cfg().handle());
        assertEquals(captured, f.regs().get(0));
    }

    @Test
    void resolvingAnOverrideBuildsItsFrame() throws Exception {
        RegMap args = RegMap.of(RegEntry.integer(eb.intLit(1)));
        FunctionBindings b = bindings();
        HostOverride id = Overrides.identity("id");
        b.registerOverride(INC, id);

        ResolvedCall rc = Operations.resolveCall(b, new FnVal.HandleFnVal(INC), args);

        ResolvedCall.OverrideCall oc = assertInstanceOf(ResolvedCall.OverrideCall.class, rc);
        assertSame(id, oc.override());
        assertEquals(new SimFrame.OverrideFrame("id", args), oc.frame());
    }

    @Test
    void resolvingChecksArgumentTypesAgainstTheHandle() {
        FunctionBindings b = bindings(inc());
        b.registerOverride(PROBE, Overrides.identity("probe"));

        assertThrows(
                SimulatorError.InvalidState.class,
                () -> Operations.resolveCall(b, new FnVal.HandleFnVal(INC), RegMap.of(RegEntry.bool(c))));
        assertThrows(
                SimulatorError.InvalidState.class,
                () -> Operations.resolveCall(b, new FnVal.HandleFnVal(PROBE), RegMap.of(RegEntry.unit())));
    }

    @Test
    void pausedFrameResumesOnce() throws Exception {
        PausedFrame frame = new PausedFrame(new PartialResult.Total<>(override("p")), new ControlResumption.Continue());
        assertFalse(frame.isConsumed());
        frame.take();
        assertTrue(frame.isConsumed());
        assertThrows(SimulatorError.InvalidState.class, frame::take);
    }

    @Test
    void describeFramesSkipsTheStartFrame() {
        List<SimFrame> frames =
                List.of(
                        new SimFrame.OverrideFrame("exit", RegMap.empty()),
                        new SimFrame.ReturnFrame(RegEntry.unit()),
                        new SimFrame.OverrideFrame(Simulator.START_FRAME, RegMap.empty()));
        assertEquals(List.of("When calling exit", "While returning value"), Operations.describeFrames(frames));
        assertEquals(List.of(), Operations.describeFrames(List.of()));
    }
}
