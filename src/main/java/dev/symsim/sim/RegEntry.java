package dev.symsim.sim;

import dev.symsim.backend.SymExpr;
import dev.symsim.cfg.TypeRepr;
import java.util.Objects;

/** 带类型的寄存器值。类型与值的种类必须一致。 */
public record RegEntry(TypeRepr type, RegValue value) {
    public RegEntry {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(value, "value");
        if (!type.displayName().equals(value.kind())) {
            throw new IllegalArgumentException(
                    "register of type " + type.displayName() + " cannot hold a " + value.kind() + " value");
        }
    }

    public static RegEntry unit() {
        return new RegEntry(TypeRepr.UNIT, new RegValue.Unit());
    }

    public static RegEntry bool(SymExpr expr) {
        return new RegEntry(TypeRepr.BOOL, new RegValue.Bool(expr));
    }

    public static RegEntry integer(SymExpr expr) {
        return new RegEntry(TypeRepr.INT, new RegValue.Int(expr));
    }

    public static RegEntry fn(FnVal fn) {
        return new RegEntry(TypeRepr.FUNCTION, new RegValue.Fn(fn));
    }

    /** The symbolic expression of a bool or int register. */
    public SymExpr expr() {
        if (value instanceof RegValue.Bool b) {
            return b.expr();
        }
        if (value instanceof RegValue.Int n) {
            return n.expr();
        }
        throw new IllegalStateException("register of type " + type.displayName() + " has no symbolic expression");
    }

    public FnVal fnVal() {
        if (value instanceof RegValue.Fn f) {
            return f.fn();
        }
        throw new IllegalStateException("register of type " + type.displayName() + " is not a function value");
    }

    @Override
    public String toString() {
        if (value instanceof RegValue.Unit) {
            return "()";
        }
        if (value instanceof RegValue.Fn f) {
            return "fn " + f.fn().handle().name();
        }
        return expr().toString();
    }
}
