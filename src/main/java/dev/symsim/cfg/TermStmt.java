package dev.symsim.cfg;

import java.util.List;
import java.util.Objects;

public sealed interface TermStmt
        permits TermStmt.Jump,
                TermStmt.Br,
                TermStmt.VariantElim,
                TermStmt.Return,
                TermStmt.TailCall,
                TermStmt.ErrorStmt {
    record Jump(JumpTarget target) implements TermStmt {
        public Jump {
            Objects.requireNonNull(target, "target");
        }
    }

    record Br(int cond, JumpTarget ifTrue, JumpTarget ifFalse) implements TermStmt {
        public Br {
            Objects.requireNonNull(ifTrue, "ifTrue");
            Objects.requireNonNull(ifFalse, "ifFalse");
        }
    }

    /**
     * Multi-way branch. Each case implicitly assumes that none of the earlier
     * conditions held; if every condition is false the path aborts.
     */
    record VariantElim(List<SwitchCase> cases) implements TermStmt {
        public VariantElim {
            Objects.requireNonNull(cases, "cases");
            cases = List.copyOf(cases);
        }
    }

    record Return(int value) implements TermStmt {}

    record TailCall(int fn, List<Integer> args) implements TermStmt {
        public TailCall {
            Objects.requireNonNull(args, "args");
            args = List.copyOf(args);
        }
    }

    record ErrorStmt(String message) implements TermStmt {
        public ErrorStmt {
            Objects.requireNonNull(message, "message");
        }
    }
}
