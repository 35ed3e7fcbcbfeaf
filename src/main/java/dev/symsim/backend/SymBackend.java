package dev.symsim.backend;

import java.util.List;

/**
 * 仿真器使用的求解器侧接口：表达式构造、带检查点的假设栈、分支可行性判断以及证明义务记录。
 *
 * <p>检查点严格按栈顺序使用：每个 push 必须恰好对应一个 pop，pop 的 token 必须是栈顶的那个。
 * 违反时抛出 {@link IllegalStateException}。</p>
 */
public interface SymBackend {
    ExprBuilder exprBuilder();

    ProgramLoc getCurrentProgramLoc();

    void setCurrentProgramLoc(ProgramLoc loc);

    AssumptionFrame pushAssumptionFrame();

    /** Pops {@code frame} and returns the assumptions added while it was on top. */
    List<LabeledPred<AssumptionReason>> popAssumptionFrame(AssumptionFrame frame);

    void addAssumption(LabeledPred<AssumptionReason> assumption);

    default void addAssumptions(List<LabeledPred<AssumptionReason>> assumptions) {
        for (LabeledPred<AssumptionReason> a : assumptions) {
            addAssumption(a);
        }
    }

    /** Every assumption currently in scope, outermost frame first. */
    List<LabeledPred<AssumptionReason>> collectAssumptions();

    void addProofObligation(LabeledPred<AssertionFailure> goal);

    List<ProofObligation> proofObligations();

    BranchResult evalBranch(SymExpr pred);

    CheckpointStatistics checkpointStatistics();
}
