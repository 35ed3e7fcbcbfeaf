package dev.symsim.sim;

import dev.symsim.backend.BaseType;
import dev.symsim.backend.SymExpr;
import java.util.Objects;

public sealed interface RegValue permits RegValue.Unit, RegValue.Bool, RegValue.Int, RegValue.Fn {
    String kind();

    record Unit() implements RegValue {
        @Override
        public String kind() {
            return "unit";
        }
    }

    record Bool(SymExpr expr) implements RegValue {
        public Bool {
            Objects.requireNonNull(expr, "expr");
            if (expr.type() != BaseType.BOOL) {
                throw new IllegalArgumentException("bool register holds " + expr.type() + " expression " + expr);
            }
        }

        @Override
        public String kind() {
            return "bool";
        }
    }

    record Int(SymExpr expr) implements RegValue {
        public Int {
            Objects.requireNonNull(expr, "expr");
            if (expr.type() != BaseType.INT) {
                throw new IllegalArgumentException("int register holds " + expr.type() + " expression " + expr);
            }
        }

        @Override
        public String kind() {
            return "int";
        }
    }

    record Fn(FnVal fn) implements RegValue {
        public Fn {
            Objects.requireNonNull(fn, "fn");
        }

        @Override
        public String kind() {
            return "fn";
        }
    }
}
