package dev.symsim.sim;

import dev.symsim.cfg.BlockId;
import java.util.Objects;

/** 已求值的跳转：目标块及其参数值。 */
public record ResolvedJump(BlockId block, RegMap args) {
    public ResolvedJump {
        Objects.requireNonNull(block, "block");
        Objects.requireNonNull(args, "args");
    }
}
