package dev.symsim.cfg;

import java.util.List;
import java.util.Objects;

/** 跳转目标：目标块 + 作为目标块参数传入的寄存器。 */
public record JumpTarget(BlockId block, List<Integer> args) {
    public JumpTarget {
        Objects.requireNonNull(block, "block");
        Objects.requireNonNull(args, "args");
        args = List.copyOf(args);
    }

    public static JumpTarget to(int block, Integer... args) {
        return new JumpTarget(new BlockId(block), List.of(args));
    }
}
