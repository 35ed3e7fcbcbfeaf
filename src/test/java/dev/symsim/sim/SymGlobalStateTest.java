package dev.symsim.sim;

import static org.junit.jupiter.api.Assertions.*;

import dev.symsim.backend.BaseType;
import dev.symsim.backend.ExprBuilder;
import dev.symsim.backend.SymExpr;
import dev.symsim.cfg.GlobalVar;
import dev.symsim.cfg.TypeRepr;
import org.junit.jupiter.api.Test;

final class SymGlobalStateTest {
    private static final GlobalVar X = new GlobalVar("x", TypeRepr.INT);
    private static final GlobalVar Y = new GlobalVar("y", TypeRepr.BOOL);

    private final ExprBuilder eb = new ExprBuilder();

    @Test
    void insertChecksTheDeclaredType() {
        assertThrows(
                IllegalArgumentException.class,
                () -> SymGlobalState.empty().insert(X, RegEntry.bool(eb.truePred())));
    }

    @Test
    void abortWithoutPendingBranchFails() throws Exception {
        assertThrows(SimulatorError.InvalidState.class, () -> SymGlobalState.empty().abortBranch());
        assertEquals(0, SymGlobalState.empty().pushBranch().abortBranch().branchDepth());
    }

    @Test
    void muxNeedsMatchingPendingDepths() {
        SymExpr c = eb.freshConstant("c", BaseType.BOOL);
        SymGlobalState one = SymGlobalState.empty().pushBranch();
        assertThrows(
                SimulatorError.InvalidState.class,
                () -> SymGlobalState.mux(eb, c, one, one.pushBranch()));
        assertThrows(
                SimulatorError.InvalidState.class,
                () -> SymGlobalState.mux(eb, c, SymGlobalState.empty(), SymGlobalState.empty()));
    }

    @Test
    void muxKeepsSharedVariablesAndPopsOneLevel() throws Exception {
        SymExpr c = eb.freshConstant("c", BaseType.BOOL);
        SymGlobalState base = SymGlobalState.empty().pushBranch().pushBranch();
        SymGlobalState x = base.insert(X, RegEntry.integer(eb.intLit(1))).insert(Y, RegEntry.bool(eb.truePred()));
        SymGlobalState y = base.insert(X, RegEntry.integer(eb.intLit(2)));

        SymGlobalState m = SymGlobalState.mux(eb, c, x, y);

        assertEquals(1, m.branchDepth());
        assertEquals(eb.intIte(c, eb.intLit(1), eb.intLit(2)), m.lookup(X).orElseThrow().expr());
        assertTrue(m.lookup(Y).isEmpty());
    }
}
