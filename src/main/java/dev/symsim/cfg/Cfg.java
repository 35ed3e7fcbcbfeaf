package dev.symsim.cfg;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 一个函数体的控制流图。入口块固定为 {@code %0}，其参数即函数参数。
 */
public record Cfg(FnHandle handle, List<Block> blocks) {
    public Cfg {
        Objects.requireNonNull(handle, "handle");
        Objects.requireNonNull(blocks, "blocks");
        blocks = List.copyOf(blocks);
        if (blocks.isEmpty()) {
            throw new IllegalArgumentException("cfg `" + handle.name() + "` has no blocks");
        }
    }

    public BlockId entry() {
        return new BlockId(0);
    }

    public Optional<Block> block(BlockId id) {
        Objects.requireNonNull(id, "id");
        if (id.index() >= blocks.size()) {
            return Optional.empty();
        }
        return Optional.of(blocks.get(id.index()));
    }

    public int blockCount() {
        return blocks.size();
    }
}
