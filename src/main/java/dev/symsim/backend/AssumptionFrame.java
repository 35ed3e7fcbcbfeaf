package dev.symsim.backend;

import java.util.Objects;

/**
 * 假设栈检查点：一次性（one-shot）token，由 {@link SymBackend#pushAssumptionFrame()} 产生，
 * 只能被同一个 backend 的 {@link SymBackend#popAssumptionFrame(AssumptionFrame)} 消耗一次。
 */
public final class AssumptionFrame {
    private final Object owner;
    private final int depth;
    private final long serial;
    private boolean popped = false;

    AssumptionFrame(Object owner, int depth, long serial) {
        this.owner = Objects.requireNonNull(owner, "owner");
        this.depth = depth;
        this.serial = serial;
    }

    boolean ownedBy(Object backend) {
        return owner == backend;
    }

    int depth() {
        return depth;
    }

    long serial() {
        return serial;
    }

    void markPopped() {
        popped = true;
    }

    public boolean isPopped() {
        return popped;
    }

    @Override
    public String toString() {
        return "AssumptionFrame(depth=" + depth + ", serial=" + serial + (popped ? ", popped" : "") + ")";
    }
}
