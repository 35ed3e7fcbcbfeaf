package dev.symsim.cfg;

import java.util.List;

/**
 * CFG 的结构校验：块索引、跳转参数个数、寄存器编号范围。
 *
 * <p>入口块参数必须与句柄声明的参数类型一致；除此之外不检查寄存器类型，类型错误留到执行时由模拟器报告。</p>
 */
public final class CfgVerifier {
    private CfgVerifier() {}

    public static void verify(Cfg cfg) throws VerifyException {
        String fn = cfg.handle().name();

        // Entry parameters are the function arguments.
        Block entry = cfg.blocks().get(0);
        if (!entry.paramTypes().equals(cfg.handle().argTypes())) {
            throw new VerifyException(
                    "entry block of `" + fn + "` takes " + entry.paramTypes() + " but handle declares "
                            + cfg.handle().argTypes());
        }

        for (int b = 0; b < cfg.blockCount(); b++) {
            Block block = cfg.blocks().get(b);
            String where = "`" + fn + "` %" + b;

            int live = block.paramCount();
            for (int i = 0; i < block.stmts().size(); i++) {
                Stmt stmt = block.stmts().get(i);
                checkStmt(where + " stmt " + i, stmt, live);
                if (stmt.definesRegister()) {
                    live++;
                }
            }
            checkTerm(cfg, where + " terminator", block.term(), live);
        }
    }

    private static void checkStmt(String where, Stmt stmt, int live) throws VerifyException {
        if (stmt instanceof Stmt.Closure s) {
            checkRegs(where, live, s.fn(), s.captured());
        } else if (stmt instanceof Stmt.Not s) {
            checkRegs(where, live, s.operand());
        } else if (stmt instanceof Stmt.And s) {
            checkRegs(where, live, s.lhs(), s.rhs());
        } else if (stmt instanceof Stmt.Or s) {
            checkRegs(where, live, s.lhs(), s.rhs());
        } else if (stmt instanceof Stmt.IntAdd s) {
            checkRegs(where, live, s.lhs(), s.rhs());
        } else if (stmt instanceof Stmt.IntSub s) {
            checkRegs(where, live, s.lhs(), s.rhs());
        } else if (stmt instanceof Stmt.IntMul s) {
            checkRegs(where, live, s.lhs(), s.rhs());
        } else if (stmt instanceof Stmt.IntEq s) {
            checkRegs(where, live, s.lhs(), s.rhs());
        } else if (stmt instanceof Stmt.IntLe s) {
            checkRegs(where, live, s.lhs(), s.rhs());
        } else if (stmt instanceof Stmt.IntLt s) {
            checkRegs(where, live, s.lhs(), s.rhs());
        } else if (stmt instanceof Stmt.Ite s) {
            checkRegs(where, live, s.cond(), s.then(), s.otherwise());
        } else if (stmt instanceof Stmt.WriteGlobal s) {
            checkRegs(where, live, s.value());
        } else if (stmt instanceof Stmt.Call s) {
            checkRegs(where, live, s.fn());
            checkRegList(where, live, s.args());
        } else if (stmt instanceof Stmt.Assert s) {
            checkRegs(where, live, s.cond());
        } else if (stmt instanceof Stmt.Assume s) {
            checkRegs(where, live, s.cond());
        }
        // Literals, fresh constants and global reads take no register operands.
    }

    private static void checkTerm(Cfg cfg, String where, TermStmt term, int live) throws VerifyException {
        if (term instanceof TermStmt.Jump t) {
            checkJump(cfg, where, t.target(), live);
        } else if (term instanceof TermStmt.Br t) {
            checkRegs(where, live, t.cond());
            checkJump(cfg, where, t.ifTrue(), live);
            checkJump(cfg, where, t.ifFalse(), live);
        } else if (term instanceof TermStmt.VariantElim t) {
            for (SwitchCase c : t.cases()) {
                checkRegs(where, live, c.cond());
                checkJump(cfg, where, c.target(), live);
            }
        } else if (term instanceof TermStmt.Return t) {
            checkRegs(where, live, t.value());
        } else if (term instanceof TermStmt.TailCall t) {
            checkRegs(where, live, t.fn());
            checkRegList(where, live, t.args());
        }
    }

    private static void checkJump(Cfg cfg, String where, JumpTarget target, int live) throws VerifyException {
        Block dst =
                cfg.block(target.block())
                        .orElseThrow(
                                () ->
                                        new VerifyException(
                                                where + ": jump target " + target.block() + " out of range (blocks="
                                                        + cfg.blockCount() + ")"));
        if (dst.paramCount() != target.args().size()) {
            throw new VerifyException(
                    where + ": jump to " + target.block() + " passes " + target.args().size()
                            + " argument(s) but the block takes " + dst.paramCount());
        }
        checkRegList(where, live, target.args());
    }

    private static void checkRegList(String where, int live, List<Integer> regs) throws VerifyException {
        for (int r : regs) {
            checkRegs(where, live, r);
        }
    }

    private static void checkRegs(String where, int live, int... regs) throws VerifyException {
        for (int r : regs) {
            if (r < 0 || r >= live) {
                throw new VerifyException(where + ": register " + r + " out of range (live=" + live + ")");
            }
        }
    }
}
