package dev.symsim.backend;

import java.util.Objects;
import java.util.Optional;

/**
 * 表达式构造器：类型检查 + 局部化简（常量折叠、双重否定、ite 条件取反交换分支等）。
 *
 * <p>不做任何需要求解器的推理；两个结构不同的表达式即便等价也不会被合并。</p>
 */
public final class ExprBuilder {
    private static final SymExpr.BoolConst TRUE = new SymExpr.BoolConst(true);
    private static final SymExpr.BoolConst FALSE = new SymExpr.BoolConst(false);

    private int nextVarId = 0;

    public SymExpr truePred() {
        return TRUE;
    }

    public SymExpr falsePred() {
        return FALSE;
    }

    public SymExpr boolLit(boolean value) {
        return value ? TRUE : FALSE;
    }

    public SymExpr intLit(long value) {
        return new SymExpr.IntConst(value);
    }

    public SymExpr freshConstant(String name, BaseType type) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        return new SymExpr.Var(nextVarId++, name, type);
    }

    public Optional<Boolean> asConstantPred(SymExpr e) {
        if (e instanceof SymExpr.BoolConst c) {
            return Optional.of(c.value());
        }
        return Optional.empty();
    }

    public Optional<Long> asConstantInt(SymExpr e) {
        if (e instanceof SymExpr.IntConst c) {
            return Optional.of(c.value());
        }
        return Optional.empty();
    }

    // ====== Boolean connectives ======

    public SymExpr notPred(SymExpr p) {
        requireType(p, BaseType.BOOL, "not");
        if (p instanceof SymExpr.BoolConst c) {
            return boolLit(!c.value());
        }
        if (p instanceof SymExpr.Not n) {
            return n.arg();
        }
        return new SymExpr.Not(p);
    }

    public SymExpr andPred(SymExpr a, SymExpr b) {
        requireType(a, BaseType.BOOL, "and");
        requireType(b, BaseType.BOOL, "and");
        Optional<Boolean> ca = asConstantPred(a);
        Optional<Boolean> cb = asConstantPred(b);
        if (ca.isPresent()) {
            return ca.get() ? b : FALSE;
        }
        if (cb.isPresent()) {
            return cb.get() ? a : FALSE;
        }
        if (a.equals(b)) {
            return a;
        }
        if (complementary(a, b)) {
            return FALSE;
        }
        return new SymExpr.And(a, b);
    }

    public SymExpr orPred(SymExpr a, SymExpr b) {
        requireType(a, BaseType.BOOL, "or");
        requireType(b, BaseType.BOOL, "or");
        Optional<Boolean> ca = asConstantPred(a);
        Optional<Boolean> cb = asConstantPred(b);
        if (ca.isPresent()) {
            return ca.get() ? TRUE : b;
        }
        if (cb.isPresent()) {
            return cb.get() ? TRUE : a;
        }
        if (a.equals(b)) {
            return a;
        }
        if (complementary(a, b)) {
            return TRUE;
        }
        return new SymExpr.Or(a, b);
    }

    public SymExpr impliesPred(SymExpr p, SymExpr q) {
        return orPred(notPred(p), q);
    }

    public SymExpr itePred(SymExpr c, SymExpr t, SymExpr e) {
        requireType(c, BaseType.BOOL, "ite condition");
        requireType(t, BaseType.BOOL, "ite");
        requireType(e, BaseType.BOOL, "ite");
        Optional<Boolean> cc = asConstantPred(c);
        if (cc.isPresent()) {
            return cc.get() ? t : e;
        }
        if (t.equals(e)) {
            return t;
        }
        if (c instanceof SymExpr.Not n) {
            return itePred(n.arg(), e, t);
        }
        Optional<Boolean> ct = asConstantPred(t);
        Optional<Boolean> ce = asConstantPred(e);
        if (ct.isPresent() && ce.isPresent()) {
            // t != e here, so exactly one of them is true.
            return ct.get() ? c : notPred(c);
        }
        return new SymExpr.Ite(c, t, e);
    }

    // ====== Integers ======

    public SymExpr intAdd(SymExpr a, SymExpr b) {
        requireType(a, BaseType.INT, "+");
        requireType(b, BaseType.INT, "+");
        Optional<Long> ca = asConstantInt(a);
        Optional<Long> cb = asConstantInt(b);
        if (ca.isPresent() && cb.isPresent()) {
            try {
                return intLit(Math.addExact(ca.get(), cb.get()));
            } catch (ArithmeticException overflow) {
                // Integers are unbounded; a result past 64 bits stays symbolic.
                return new SymExpr.IntAdd(a, b);
            }
        }
        if (ca.isPresent() && ca.get() == 0) {
            return b;
        }
        if (cb.isPresent() && cb.get() == 0) {
            return a;
        }
        return new SymExpr.IntAdd(a, b);
    }

    public SymExpr intSub(SymExpr a, SymExpr b) {
        requireType(a, BaseType.INT, "-");
        requireType(b, BaseType.INT, "-");
        Optional<Long> ca = asConstantInt(a);
        Optional<Long> cb = asConstantInt(b);
        if (ca.isPresent() && cb.isPresent()) {
            try {
                return intLit(Math.subtractExact(ca.get(), cb.get()));
            } catch (ArithmeticException overflow) {
                // Integers are unbounded; a result past 64 bits stays symbolic.
                return new SymExpr.IntSub(a, b);
            }
        }
        if (cb.isPresent() && cb.get() == 0) {
            return a;
        }
        if (a.equals(b)) {
            return intLit(0);
        }
        return new SymExpr.IntSub(a, b);
    }

    public SymExpr intMul(SymExpr a, SymExpr b) {
        requireType(a, BaseType.INT, "*");
        requireType(b, BaseType.INT, "*");
        Optional<Long> ca = asConstantInt(a);
        Optional<Long> cb = asConstantInt(b);
        if (ca.isPresent() && cb.isPresent()) {
            try {
                return intLit(Math.multiplyExact(ca.get(), cb.get()));
            } catch (ArithmeticException overflow) {
                // Integers are unbounded; a result past 64 bits stays symbolic.
                return new SymExpr.IntMul(a, b);
            }
        }
        if ((ca.isPresent() && ca.get() == 0) || (cb.isPresent() && cb.get() == 0)) {
            return intLit(0);
        }
        if (ca.isPresent() && ca.get() == 1) {
            return b;
        }
        if (cb.isPresent() && cb.get() == 1) {
            return a;
        }
        return new SymExpr.IntMul(a, b);
    }

    public SymExpr intEq(SymExpr a, SymExpr b) {
        requireType(a, BaseType.INT, "=");
        requireType(b, BaseType.INT, "=");
        Optional<Long> ca = asConstantInt(a);
        Optional<Long> cb = asConstantInt(b);
        if (ca.isPresent() && cb.isPresent()) {
            return boolLit(ca.get().longValue() == cb.get().longValue());
        }
        if (a.equals(b)) {
            return TRUE;
        }
        return new SymExpr.IntEq(a, b);
    }

    public SymExpr intLe(SymExpr a, SymExpr b) {
        requireType(a, BaseType.INT, "<=");
        requireType(b, BaseType.INT, "<=");
        Optional<Long> ca = asConstantInt(a);
        Optional<Long> cb = asConstantInt(b);
        if (ca.isPresent() && cb.isPresent()) {
            return boolLit(ca.get() <= cb.get());
        }
        if (a.equals(b)) {
            return TRUE;
        }
        return new SymExpr.IntLe(a, b);
    }

    public SymExpr intLt(SymExpr a, SymExpr b) {
        requireType(a, BaseType.INT, "<");
        requireType(b, BaseType.INT, "<");
        Optional<Long> ca = asConstantInt(a);
        Optional<Long> cb = asConstantInt(b);
        if (ca.isPresent() && cb.isPresent()) {
            return boolLit(ca.get() < cb.get());
        }
        if (a.equals(b)) {
            return FALSE;
        }
        return new SymExpr.IntLt(a, b);
    }

    public SymExpr intIte(SymExpr c, SymExpr t, SymExpr e) {
        requireType(c, BaseType.BOOL, "ite condition");
        requireType(t, BaseType.INT, "ite");
        requireType(e, BaseType.INT, "ite");
        Optional<Boolean> cc = asConstantPred(c);
        if (cc.isPresent()) {
            return cc.get() ? t : e;
        }
        if (t.equals(e)) {
            return t;
        }
        if (c instanceof SymExpr.Not n) {
            return intIte(n.arg(), e, t);
        }
        return new SymExpr.Ite(c, t, e);
    }

    /** Type-directed if-then-else over either base type. */
    public SymExpr ite(SymExpr c, SymExpr t, SymExpr e) {
        if (t.type() != e.type()) {
            throw new IllegalArgumentException("ite branches have different types: " + t.type() + " vs " + e.type());
        }
        return t.type() == BaseType.BOOL ? itePred(c, t, e) : intIte(c, t, e);
    }

    private static boolean complementary(SymExpr a, SymExpr b) {
        return (a instanceof SymExpr.Not na && na.arg().equals(b))
                || (b instanceof SymExpr.Not nb && nb.arg().equals(a));
    }

    private static void requireType(SymExpr e, BaseType expected, String op) {
        Objects.requireNonNull(e, op);
        if (e.type() != expected) {
            throw new IllegalArgumentException(
                    "`" + op + "` expects " + expected + " operand, got " + e.type() + ": " + e);
        }
    }
}
