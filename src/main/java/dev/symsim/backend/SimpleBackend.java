package dev.symsim.backend;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 不带求解器的参考 backend。
 *
 * <p>分支判断只看两件事：谓词是否为常量；谓词（或其否定）是否已作为假设出现在作用域内。
 * 其它情况一律视为两边都可行。</p>
 */
public final class SimpleBackend implements SymBackend {
    private static final Logger logger = LoggerFactory.getLogger(SimpleBackend.class);

    private record Level(AssumptionFrame token, ArrayList<LabeledPred<AssumptionReason>> assumptions) {}

    private final ExprBuilder exprBuilder;
    private final ArrayList<Level> levels = new ArrayList<>();
    private final ArrayList<ProofObligation> obligations = new ArrayList<>();
    private ProgramLoc currentLoc = ProgramLoc.initial();

    private long nextSerial = 0;
    private int pushes = 0;
    private int pops = 0;
    private int peakDepth = 0;

    public SimpleBackend() {
        this(new ExprBuilder());
    }

    public SimpleBackend(ExprBuilder exprBuilder) {
        this.exprBuilder = Objects.requireNonNull(exprBuilder, "exprBuilder");
        // Base level, never popped.
        levels.add(new Level(null, new ArrayList<>()));
    }

    @Override
    public ExprBuilder exprBuilder() {
        return exprBuilder;
    }

    @Override
    public ProgramLoc getCurrentProgramLoc() {
        return currentLoc;
    }

    @Override
    public void setCurrentProgramLoc(ProgramLoc loc) {
        this.currentLoc = Objects.requireNonNull(loc, "loc");
    }

    @Override
    public AssumptionFrame pushAssumptionFrame() {
        AssumptionFrame token = new AssumptionFrame(this, levels.size(), nextSerial++);
        levels.add(new Level(token, new ArrayList<>()));
        pushes++;
        peakDepth = Math.max(peakDepth, depth());
        logger.debug("push assumption frame {}", token);
        return token;
    }

    @Override
    public List<LabeledPred<AssumptionReason>> popAssumptionFrame(AssumptionFrame frame) {
        Objects.requireNonNull(frame, "frame");
        if (!frame.ownedBy(this)) {
            throw new IllegalStateException("assumption frame belongs to a different backend: " + frame);
        }
        if (frame.isPopped()) {
            throw new IllegalStateException("assumption frame already popped: " + frame);
        }
        Level top = levels.get(levels.size() - 1);
        if (top.token() != frame) {
            throw new IllegalStateException(
                    "assumption frame " + frame + " is not on top of the stack (depth=" + depth() + ")");
        }
        levels.remove(levels.size() - 1);
        frame.markPopped();
        pops++;
        logger.debug("pop assumption frame {} ({} assumption(s))", frame, top.assumptions().size());
        return List.copyOf(top.assumptions());
    }

    @Override
    public void addAssumption(LabeledPred<AssumptionReason> assumption) {
        Objects.requireNonNull(assumption, "assumption");
        levels.get(levels.size() - 1).assumptions().add(assumption);
    }

    @Override
    public List<LabeledPred<AssumptionReason>> collectAssumptions() {
        ArrayList<LabeledPred<AssumptionReason>> out = new ArrayList<>();
        for (Level level : levels) {
            out.addAll(level.assumptions());
        }
        return List.copyOf(out);
    }

    @Override
    public void addProofObligation(LabeledPred<AssertionFailure> goal) {
        Objects.requireNonNull(goal, "goal");
        obligations.add(new ProofObligation(collectAssumptions(), goal));
    }

    @Override
    public List<ProofObligation> proofObligations() {
        return List.copyOf(obligations);
    }

    @Override
    public BranchResult evalBranch(SymExpr pred) {
        Optional<Boolean> c = exprBuilder.asConstantPred(pred);
        if (c.isPresent()) {
            return new BranchResult.NoBranch(c.get());
        }
        SymExpr negated = exprBuilder.notPred(pred);
        for (Level level : levels) {
            for (LabeledPred<AssumptionReason> a : level.assumptions()) {
                if (a.pred().equals(pred)) {
                    return new BranchResult.NoBranch(true);
                }
                if (a.pred().equals(negated)) {
                    return new BranchResult.NoBranch(false);
                }
            }
        }
        return new BranchResult.SymbolicBranch(true);
    }

    @Override
    public CheckpointStatistics checkpointStatistics() {
        return new CheckpointStatistics(pushes, pops, peakDepth, depth());
    }

    private int depth() {
        return levels.size() - 1;
    }
}
