package dev.symsim.cfg;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

final class PostdominatorsTest {
    private static final FnHandle F = new FnHandle(0, "f", List.of(TypeRepr.BOOL), TypeRepr.UNIT);

    private static Block branch(int ifTrue, int ifFalse) {
        return new Block(List.of(TypeRepr.BOOL), List.of(), new TermStmt.Br(0, JumpTarget.to(ifTrue), JumpTarget.to(ifFalse)));
    }

    private static Block jump(int target) {
        return new Block(List.of(), List.of(), new TermStmt.Jump(JumpTarget.to(target)));
    }

    private static Block ret() {
        return new Block(List.of(), List.of(new Stmt.UnitLit()), new TermStmt.Return(0));
    }

    @Test
    void diamondMergesAtJoinBlock() {
        Cfg cfg = new Cfg(F, List.of(branch(1, 2), jump(3), jump(3), ret()));
        Postdominators pd = Postdominators.compute(cfg);
        assertEquals(Optional.of(new BlockId(3)), pd.immediate(new BlockId(0)));
        assertEquals(List.of(new BlockId(3)), pd.of(new BlockId(1)));
        assertEquals(Optional.empty(), pd.immediate(new BlockId(3)));
        assertEquals(4, pd.blockCount());
    }

    @Test
    void nestedBranchesListPostdominatorsNearestFirst() {
        Block b0 = new Block(List.of(TypeRepr.BOOL), List.of(), new TermStmt.Br(0, JumpTarget.to(1, 0), JumpTarget.to(5)));
        Cfg cfg =
                new Cfg(F, List.of(b0, branch(2, 3), jump(4), jump(4), jump(6), jump(6), ret()));
        Postdominators pd = Postdominators.compute(cfg);
        assertEquals(List.of(new BlockId(4), new BlockId(6)), pd.of(new BlockId(1)));
        assertEquals(Optional.of(new BlockId(6)), pd.immediate(new BlockId(0)));
    }

    @Test
    void branchesToSeparateReturnsHaveNoMergeBlock() {
        Cfg cfg = new Cfg(F, List.of(branch(1, 2), ret(), ret()));
        Postdominators pd = Postdominators.compute(cfg);
        assertEquals(Optional.empty(), pd.immediate(new BlockId(0)));
    }

    @Test
    void blocksThatNeverExitHaveNoPostdominators() {
        Cfg cfg = new Cfg(F, List.of(branch(1, 2), jump(1), ret()));
        Postdominators pd = Postdominators.compute(cfg);
        assertEquals(List.of(), pd.of(new BlockId(1)));
        assertEquals(Optional.of(new BlockId(2)), pd.immediate(new BlockId(0)));
    }
}
