package dev.symsim.backend;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;
import org.junit.jupiter.api.Test;

final class ExprBuilderTest {
    private final ExprBuilder eb = new ExprBuilder();

    @Test
    void notFoldsConstantsAndDoubleNegation() {
        SymExpr c = eb.freshConstant("c", BaseType.BOOL);
        assertEquals(eb.falsePred(), eb.notPred(eb.truePred()));
        assertEquals(c, eb.notPred(eb.notPred(c)));
        assertEquals("(not c)", eb.notPred(c).toString());
    }

    @Test
    void andOrUseIdentityIdempotenceAndComplement() {
        SymExpr c = eb.freshConstant("c", BaseType.BOOL);
        SymExpr d = eb.freshConstant("d", BaseType.BOOL);
        assertEquals(c, eb.andPred(eb.truePred(), c));
        assertEquals(eb.falsePred(), eb.andPred(c, eb.falsePred()));
        assertEquals(c, eb.andPred(c, c));
        assertEquals(eb.falsePred(), eb.andPred(c, eb.notPred(c)));
        assertEquals(eb.truePred(), eb.orPred(eb.notPred(c), c));
        assertEquals(d, eb.orPred(eb.falsePred(), d));
        assertEquals(new SymExpr.And(c, d), eb.andPred(c, d));
    }

    @Test
    void impliesOfItselfIsTrue() {
        SymExpr c = eb.freshConstant("c", BaseType.BOOL);
        SymExpr d = eb.freshConstant("d", BaseType.BOOL);
        assertEquals(eb.truePred(), eb.impliesPred(c, c));
        assertEquals(eb.orPred(eb.notPred(c), d), eb.impliesPred(c, d));
    }

    @Test
    void iteNormalizesNegatedConditions() {
        SymExpr c = eb.freshConstant("c", BaseType.BOOL);
        SymExpr a = eb.freshConstant("a", BaseType.BOOL);
        SymExpr b = eb.freshConstant("b", BaseType.BOOL);
        assertEquals(eb.itePred(c, a, b), eb.itePred(eb.notPred(c), b, a));
        assertEquals(c, eb.itePred(c, eb.truePred(), eb.falsePred()));
        assertEquals(eb.notPred(c), eb.itePred(c, eb.falsePred(), eb.truePred()));
        assertEquals(a, eb.itePred(eb.truePred(), a, b));
        assertEquals(a, eb.itePred(c, a, a));
    }

    @Test
    void integerOperationsFoldConstants() {
        SymExpr x = eb.freshConstant("x", BaseType.INT);
        assertEquals(Optional.of(5L), eb.asConstantInt(eb.intAdd(eb.intLit(2), eb.intLit(3))));
        assertEquals(x, eb.intAdd(x, eb.intLit(0)));
        assertEquals(eb.intLit(0), eb.intMul(x, eb.intLit(0)));
        assertEquals(eb.intLit(0), eb.intSub(x, x));
        assertEquals(eb.truePred(), eb.intEq(x, x));
        assertEquals(eb.falsePred(), eb.intLt(x, x));
        assertEquals(Optional.of(true), eb.asConstantPred(eb.intLe(eb.intLit(1), eb.intLit(2))));
        assertEquals("(+ x 1)", eb.intAdd(x, eb.intLit(1)).toString());
    }

    @Test
    void intIteSelectsOnConstantCondition() {
        SymExpr c = eb.freshConstant("c", BaseType.BOOL);
        SymExpr one = eb.intLit(1);
        SymExpr two = eb.intLit(2);
        assertEquals(two, eb.intIte(eb.falsePred(), one, two));
        assertEquals(new SymExpr.Ite(c, one, two), eb.intIte(eb.notPred(c), two, one));
        assertEquals("(ite c 1 2)", eb.ite(c, one, two).toString());
    }

    @Test
    void freshConstantsAreDistinct() {
        SymExpr a = eb.freshConstant("v", BaseType.INT);
        SymExpr b = eb.freshConstant("v", BaseType.INT);
        assertNotEquals(a, b);
        assertEquals(Optional.empty(), eb.asConstantInt(a));
    }

    @Test
    void rejectsOperandsOfTheWrongType() {
        assertThrows(IllegalArgumentException.class, () -> eb.andPred(eb.intLit(1), eb.truePred()));
        assertThrows(IllegalArgumentException.class, () -> eb.intAdd(eb.truePred(), eb.intLit(1)));
        assertThrows(IllegalArgumentException.class, () -> eb.ite(eb.truePred(), eb.intLit(1), eb.falsePred()));
    }

    @Test
    void foldingPastLongRangeKeepsTheTerm() {
        SymExpr max = eb.intLit(Long.MAX_VALUE);
        SymExpr min = eb.intLit(Long.MIN_VALUE);
        SymExpr one = eb.intLit(1);

        assertEquals(new SymExpr.IntAdd(max, one), eb.intAdd(max, one));
        assertEquals(new SymExpr.IntSub(min, one), eb.intSub(min, one));
        assertEquals(new SymExpr.IntMul(max, eb.intLit(2)), eb.intMul(max, eb.intLit(2)));
        assertEquals(Optional.of(Long.MAX_VALUE), eb.asConstantInt(eb.intAdd(eb.intLit(Long.MAX_VALUE - 1), one)));

        // max < max + 1 holds for unbounded integers, so it must not fold to false.
        SymExpr lt = eb.intLt(max, eb.intAdd(max, one));
        assertNotEquals(eb.falsePred(), lt);
        assertTrue(eb.asConstantPred(lt).isEmpty());
    }
}
