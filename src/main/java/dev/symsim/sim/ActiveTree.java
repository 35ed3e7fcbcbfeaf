package dev.symsim.sim;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 执行树中当前活动的路径：上下文栈 + 当前帧的（可能部分的）结果。
 */
public record ActiveTree(ValueFromFrame context, PartialResult<SimFrame> result) {
    public ActiveTree {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(result, "result");
    }

    /** A single path with no pending branches or calls. */
    public static ActiveTree singleton(GlobalPair<SimFrame> top) {
        return new ActiveTree(
                new ValueFromFrame.End(new ValueFromValue.End()), new PartialResult.Total<>(top));
    }

    public SimFrame frame() {
        return result.value();
    }

    public SymGlobalState globals() {
        return result.pair().globals();
    }

    public ActiveTree withFrame(SimFrame frame) {
        return new ActiveTree(context, result.withValue(frame));
    }

    public ActiveTree withGlobals(SymGlobalState globals) {
        return new ActiveTree(context, result.withPair(result.pair().withGlobals(globals)));
    }

    /** Frames of the active call stack, innermost first. */
    public List<SimFrame> activeFrames() {
        ArrayList<SimFrame> out = new ArrayList<>();
        out.add(frame());
        ValueFromFrame vff = context;
        while (true) {
            if (vff instanceof ValueFromFrame.Branch b) {
                vff = b.outer();
            } else if (vff instanceof ValueFromFrame.Partial p) {
                vff = p.outer();
            } else {
                ValueFromValue vfv = ((ValueFromFrame.End) vff).vfv();
                while (vfv instanceof ValueFromValue.Partial p) {
                    vfv = p.outer();
                }
                if (vfv instanceof ValueFromValue.Call c) {
                    out.add(c.caller());
                    vff = c.outer();
                } else {
                    return List.copyOf(out);
                }
            }
        }
    }

    /** Number of symbolic branches on the whole context stack that are still waiting to merge. */
    public int pendingBranches() {
        int n = 0;
        ValueFromFrame vff = context;
        while (true) {
            if (vff instanceof ValueFromFrame.Branch b) {
                n++;
                vff = b.outer();
            } else if (vff instanceof ValueFromFrame.Partial p) {
                vff = p.outer();
            } else {
                ValueFromValue vfv = ((ValueFromFrame.End) vff).vfv();
                while (vfv instanceof ValueFromValue.Partial p) {
                    vfv = p.outer();
                }
                if (vfv instanceof ValueFromValue.Call c) {
                    vff = c.outer();
                } else {
                    return n;
                }
            }
        }
    }
}
