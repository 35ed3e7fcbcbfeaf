package dev.symsim.backend;

import java.util.Objects;

/**
 * 符号表达式（不可变、按结构比较）。
 *
 * <p>请通过 {@link ExprBuilder} 构造：它负责类型检查和局部化简。直接 {@code new}
 * 出来的节点不会被化简。</p>
 */
public sealed interface SymExpr
        permits SymExpr.BoolConst,
                SymExpr.IntConst,
                SymExpr.Var,
                SymExpr.Not,
                SymExpr.And,
                SymExpr.Or,
                SymExpr.Ite,
                SymExpr.IntAdd,
                SymExpr.IntSub,
                SymExpr.IntMul,
                SymExpr.IntEq,
                SymExpr.IntLe,
                SymExpr.IntLt {
    BaseType type();

    record BoolConst(boolean value) implements SymExpr {
        @Override
        public BaseType type() {
            return BaseType.BOOL;
        }

        @Override
        public String toString() {
            return value ? "true" : "false";
        }
    }

    record IntConst(long value) implements SymExpr {
        @Override
        public BaseType type() {
            return BaseType.INT;
        }

        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    record Var(int id, String name, BaseType type) implements SymExpr {
        public Var {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(type, "type");
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record Not(SymExpr arg) implements SymExpr {
        public Not {
            Objects.requireNonNull(arg, "arg");
        }

        @Override
        public BaseType type() {
            return BaseType.BOOL;
        }

        @Override
        public String toString() {
            return "(not " + arg + ")";
        }
    }

    record And(SymExpr lhs, SymExpr rhs) implements SymExpr {
        public And {
            Objects.requireNonNull(lhs, "lhs");
            Objects.requireNonNull(rhs, "rhs");
        }

        @Override
        public BaseType type() {
            return BaseType.BOOL;
        }

        @Override
        public String toString() {
            return "(and " + lhs + " " + rhs + ")";
        }
    }

    record Or(SymExpr lhs, SymExpr rhs) implements SymExpr {
        public Or {
            Objects.requireNonNull(lhs, "lhs");
            Objects.requireNonNull(rhs, "rhs");
        }

        @Override
        public BaseType type() {
            return BaseType.BOOL;
        }

        @Override
        public String toString() {
            return "(or " + lhs + " " + rhs + ")";
        }
    }

    record Ite(SymExpr cond, SymExpr then, SymExpr otherwise) implements SymExpr {
        public Ite {
            Objects.requireNonNull(cond, "cond");
            Objects.requireNonNull(then, "then");
            Objects.requireNonNull(otherwise, "otherwise");
        }

        @Override
        public BaseType type() {
            return then.type();
        }

        @Override
        public String toString() {
            return "(ite " + cond + " " + then + " " + otherwise + ")";
        }
    }

    record IntAdd(SymExpr lhs, SymExpr rhs) implements SymExpr {
        public IntAdd {
            Objects.requireNonNull(lhs, "lhs");
            Objects.requireNonNull(rhs, "rhs");
        }

        @Override
        public BaseType type() {
            return BaseType.INT;
        }

        @Override
        public String toString() {
            return "(+ " + lhs + " " + rhs + ")";
        }
    }

    record IntSub(SymExpr lhs, SymExpr rhs) implements SymExpr {
        public IntSub {
            Objects.requireNonNull(lhs, "lhs");
            Objects.requireNonNull(rhs, "rhs");
        }

        @Override
        public BaseType type() {
            return BaseType.INT;
        }

        @Override
        public String toString() {
            return "(- " + lhs + " " + rhs + ")";
        }
    }

    record IntMul(SymExpr lhs, SymExpr rhs) implements SymExpr {
        public IntMul {
            Objects.requireNonNull(lhs, "lhs");
            Objects.requireNonNull(rhs, "rhs");
        }

        @Override
        public BaseType type() {
            return BaseType.INT;
        }

        @Override
        public String toString() {
            return "(* " + lhs + " " + rhs + ")";
        }
    }

    record IntEq(SymExpr lhs, SymExpr rhs) implements SymExpr {
        public IntEq {
            Objects.requireNonNull(lhs, "lhs");
            Objects.requireNonNull(rhs, "rhs");
        }

        @Override
        public BaseType type() {
            return BaseType.BOOL;
        }

        @Override
        public String toString() {
            return "(= " + lhs + " " + rhs + ")";
        }
    }

    record IntLe(SymExpr lhs, SymExpr rhs) implements SymExpr {
        public IntLe {
            Objects.requireNonNull(lhs, "lhs");
            Objects.requireNonNull(rhs, "rhs");
        }

        @Override
        public BaseType type() {
            return BaseType.BOOL;
        }

        @Override
        public String toString() {
            return "(<= " + lhs + " " + rhs + ")";
        }
    }

    record IntLt(SymExpr lhs, SymExpr rhs) implements SymExpr {
        public IntLt {
            Objects.requireNonNull(lhs, "lhs");
            Objects.requireNonNull(rhs, "rhs");
        }

        @Override
        public BaseType type() {
            return BaseType.BOOL;
        }

        @Override
        public String toString() {
            return "(< " + lhs + " " + rhs + ")";
        }
    }
}
