package dev.symsim.cfg;

import java.util.List;
import java.util.Objects;

/**
 * 基本块内的 SSA 语句。
 *
 * <p>寄存器编号在块内连续分配：块参数占用 {@code 0..paramCount-1}，之后每条
 * {@link #definesRegister() 定义寄存器} 的语句依次追加一个新寄存器。</p>
 */
public sealed interface Stmt
        permits Stmt.BoolLit,
                Stmt.IntLit,
                Stmt.UnitLit,
                Stmt.FnLit,
                Stmt.Closure,
                Stmt.Not,
                Stmt.And,
                Stmt.Or,
                Stmt.IntAdd,
                Stmt.IntSub,
                Stmt.IntMul,
                Stmt.IntEq,
                Stmt.IntLe,
                Stmt.IntLt,
                Stmt.Ite,
                Stmt.FreshConstant,
                Stmt.ReadGlobal,
                Stmt.WriteGlobal,
                Stmt.Call,
                Stmt.Assert,
                Stmt.Assume {
    default boolean definesRegister() {
        return true;
    }

    record BoolLit(boolean value) implements Stmt {}

    record IntLit(long value) implements Stmt {}

    record UnitLit() implements Stmt {}

    record FnLit(FnHandle handle) implements Stmt {
        public FnLit {
            Objects.requireNonNull(handle, "handle");
        }
    }

    /** Captures the value in {@code captured}; it is appended to the arguments on call. */
    record Closure(int fn, int captured) implements Stmt {}

    record Not(int operand) implements Stmt {}

    record And(int lhs, int rhs) implements Stmt {}

    record Or(int lhs, int rhs) implements Stmt {}

    record IntAdd(int lhs, int rhs) implements Stmt {}

    record IntSub(int lhs, int rhs) implements Stmt {}

    record IntMul(int lhs, int rhs) implements Stmt {}

    record IntEq(int lhs, int rhs) implements Stmt {}

    record IntLe(int lhs, int rhs) implements Stmt {}

    record IntLt(int lhs, int rhs) implements Stmt {}

    record Ite(int cond, int then, int otherwise) implements Stmt {}

    record FreshConstant(TypeRepr type, String name) implements Stmt {
        public FreshConstant {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(name, "name");
            if (type != TypeRepr.BOOL && type != TypeRepr.INT) {
                throw new IllegalArgumentException("fresh constants must be bool or int, got " + type.displayName());
            }
        }
    }

    record ReadGlobal(GlobalVar global) implements Stmt {
        public ReadGlobal {
            Objects.requireNonNull(global, "global");
        }
    }

    record WriteGlobal(GlobalVar global, int value) implements Stmt {
        public WriteGlobal {
            Objects.requireNonNull(global, "global");
        }

        @Override
        public boolean definesRegister() {
            return false;
        }
    }

    record Call(int fn, List<Integer> args, TypeRepr returnType) implements Stmt {
        public Call {
            Objects.requireNonNull(args, "args");
            Objects.requireNonNull(returnType, "returnType");
            args = List.copyOf(args);
        }
    }

    record Assert(int cond, String message) implements Stmt {
        public Assert {
            Objects.requireNonNull(message, "message");
        }

        @Override
        public boolean definesRegister() {
            return false;
        }
    }

    record Assume(int cond, String message) implements Stmt {
        public Assume {
            Objects.requireNonNull(message, "message");
        }

        @Override
        public boolean definesRegister() {
            return false;
        }
    }
}
