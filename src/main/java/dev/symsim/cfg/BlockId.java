package dev.symsim.cfg;

public record BlockId(int index) {
    public BlockId {
        if (index < 0) {
            throw new IllegalArgumentException("BlockId must be non-negative");
        }
    }

    @Override
    public String toString() {
        return "%" + index;
    }
}
