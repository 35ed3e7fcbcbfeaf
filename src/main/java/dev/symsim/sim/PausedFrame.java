package dev.symsim.sim;

import java.util.Objects;

/**
 * 暂停的分支路径：一次性（one-shot），只能被 {@link #take()} 恢复一次。
 */
public final class PausedFrame {
    private Contents contents; // null 表示已被 take

    public PausedFrame(PartialResult<SimFrame> result, ControlResumption resumption) {
        this.contents = new Contents(result, resumption);
    }

    Contents take() throws SimulatorError {
        Contents c = contents;
        if (c == null) {
            throw new SimulatorError.InvalidState("paused frame resumed twice");
        }
        contents = null;
        return c;
    }

    public boolean isConsumed() {
        return contents == null;
    }

    record Contents(PartialResult<SimFrame> result, ControlResumption resumption) {
        Contents {
            Objects.requireNonNull(result, "result");
            Objects.requireNonNull(resumption, "resumption");
        }
    }
}
