package dev.symsim.sim;

import dev.symsim.backend.AbortExecReason;
import dev.symsim.backend.ProgramLoc;
import dev.symsim.backend.SymExpr;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 被中止路径的记录：一棵二叉树，叶子是单条中止路径（附带中止时的帧快照）或程序退出。
 */
public sealed interface AbortedResult permits AbortedResult.Exec, AbortedResult.Exit, AbortedResult.Branch {
    record Exec(AbortExecReason reason, GlobalPair<SimFrame> snapshot) implements AbortedResult {
        public Exec {
            Objects.requireNonNull(reason, "reason");
            Objects.requireNonNull(snapshot, "snapshot");
        }
    }

    record Exit(int exitCode) implements AbortedResult {}

    /** {@code left} is the result when {@code pred} holds, {@code right} otherwise. */
    record Branch(SymExpr pred, AbortedResult left, AbortedResult right) implements AbortedResult {
        public Branch {
            Objects.requireNonNull(pred, "pred");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    /** Frame snapshots of every aborted path, left to right. */
    default List<SimFrame> frames() {
        ArrayList<SimFrame> out = new ArrayList<>();
        collectFrames(this, out);
        return List.copyOf(out);
    }

    /** Locations of the CFG frames among {@link #frames()}. */
    default List<ProgramLoc> crucibleLocations() {
        ArrayList<ProgramLoc> out = new ArrayList<>();
        for (SimFrame f : frames()) {
            if (f instanceof SimFrame.CrucibleFrame cf) {
                out.add(cf.programLoc());
            }
        }
        return List.copyOf(out);
    }

    private static void collectFrames(AbortedResult ar, List<SimFrame> out) {
        if (ar instanceof Exec e) {
            out.add(e.snapshot().value());
        } else if (ar instanceof Branch b) {
            collectFrames(b.left(), out);
            collectFrames(b.right(), out);
        }
    }
}
