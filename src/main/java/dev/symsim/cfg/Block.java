package dev.symsim.cfg;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public record Block(List<TypeRepr> paramTypes, List<Stmt> stmts, TermStmt term) {
    public Block {
        Objects.requireNonNull(paramTypes, "paramTypes");
        Objects.requireNonNull(stmts, "stmts");
        Objects.requireNonNull(term, "term");
        paramTypes = List.copyOf(paramTypes);
        stmts = List.copyOf(stmts);
    }

    public int paramCount() {
        return paramTypes.size();
    }

    /** Number of registers live before statement {@code stmtIndex} executes. */
    public int regCountBefore(int stmtIndex) {
        if (stmtIndex < 0 || stmtIndex > stmts.size()) {
            throw new IndexOutOfBoundsException("statement index " + stmtIndex + " out of range");
        }
        int count = paramTypes.size();
        for (int i = 0; i < stmtIndex; i++) {
            if (stmts.get(i).definesRegister()) {
                count++;
            }
        }
        return count;
    }

    /** Successor blocks in terminator order (duplicates removed). */
    public List<BlockId> successors() {
        ArrayList<BlockId> out = new ArrayList<>();
        if (term instanceof TermStmt.Jump j) {
            out.add(j.target().block());
        } else if (term instanceof TermStmt.Br br) {
            out.add(br.ifTrue().block());
            if (!out.contains(br.ifFalse().block())) {
                out.add(br.ifFalse().block());
            }
        } else if (term instanceof TermStmt.VariantElim v) {
            for (SwitchCase c : v.cases()) {
                if (!out.contains(c.target().block())) {
                    out.add(c.target().block());
                }
            }
        }
        return out;
    }
}
