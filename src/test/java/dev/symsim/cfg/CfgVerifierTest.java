package dev.symsim.cfg;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

final class CfgVerifierTest {
    private static final FnHandle F = new FnHandle(0, "f", List.of(TypeRepr.INT), TypeRepr.INT);
    private static final GlobalVar G = new GlobalVar("g", TypeRepr.INT);

    private static Cfg single(List<Stmt> stmts, TermStmt term) {
        return new Cfg(F, List.of(new Block(List.of(TypeRepr.INT), stmts, term)));
    }

    @Test
    void acceptsWellFormedFunction() {
        Block b0 =
                new Block(
                        List.of(TypeRepr.INT),
                        List.of(new Stmt.IntLit(1), new Stmt.IntAdd(0, 1)),
                        new TermStmt.Jump(JumpTarget.to(1, 2)));
        Block b1 = new Block(List.of(TypeRepr.INT), List.of(), new TermStmt.Return(0));
        assertDoesNotThrow(() -> CfgVerifier.verify(new Cfg(F, List.of(b0, b1))));
    }

    @Test
    void rejectsJumpOutOfRange() {
        VerifyException e =
                assertThrows(
                        VerifyException.class,
                        () -> CfgVerifier.verify(single(List.of(), new TermStmt.Jump(JumpTarget.to(4)))));
        assertTrue(e.getMessage().contains("out of range"), e.getMessage());
    }

    @Test
    void rejectsJumpArityMismatch() {
        Block b0 = new Block(List.of(TypeRepr.INT), List.of(), new TermStmt.Jump(JumpTarget.to(1)));
        Block b1 = new Block(List.of(TypeRepr.INT), List.of(), new TermStmt.Return(0));
        assertThrows(VerifyException.class, () -> CfgVerifier.verify(new Cfg(F, List.of(b0, b1))));
    }

    @Test
    void rejectsRegisterOutOfRange() {
        assertThrows(VerifyException.class, () -> CfgVerifier.verify(single(List.of(), new TermStmt.Return(3))));
        assertThrows(
                VerifyException.class,
                () -> CfgVerifier.verify(single(List.of(new Stmt.IntAdd(0, 1)), new TermStmt.Return(0))));
    }

    @Test
    void nonDefiningStatementsDoNotAllocateRegisters() {
        Cfg cfg = single(List.of(new Stmt.WriteGlobal(G, 0)), new TermStmt.Return(1));
        assertThrows(VerifyException.class, () -> CfgVerifier.verify(cfg));
    }

    @Test
    void rejectsEntryBlockThatDoesNotMatchSignature() {
        Cfg cfg = new Cfg(F, List.of(new Block(List.of(), List.of(new Stmt.IntLit(0)), new TermStmt.Return(0))));
        assertThrows(VerifyException.class, () -> CfgVerifier.verify(cfg));
    }
}
