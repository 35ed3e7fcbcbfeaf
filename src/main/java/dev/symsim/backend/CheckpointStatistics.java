package dev.symsim.backend;

public record CheckpointStatistics(int pushes, int pops, int peakDepth, int depth) {
    public boolean balanced() {
        return pushes == pops && depth == 0;
    }
}
