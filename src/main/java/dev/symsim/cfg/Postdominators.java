package dev.symsim.cfg;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 每个块的（严格）后支配块列表，按由近到远排序；第一个元素即直接后支配块，
 * 也就是从该块发出的分支的汇合点。
 *
 * <p>无法到达函数出口的块（例如死循环）没有后支配块，此时分支直接在
 * {@code ReturnTarget} 处汇合。</p>
 */
public final class Postdominators {
    private final List<List<BlockId>> byBlock;

    private Postdominators(List<List<BlockId>> byBlock) {
        this.byBlock = byBlock;
    }

    public static Postdominators compute(Cfg cfg) {
        Objects.requireNonNull(cfg, "cfg");
        int n = cfg.blockCount();
        // Node n is the virtual exit shared by every block without successors.
        int exit = n;
        List<List<Integer>> succs = new ArrayList<>(n);
        for (Block b : cfg.blocks()) {
            ArrayList<Integer> s = new ArrayList<>();
            for (BlockId id : b.successors()) {
                s.add(id.index());
            }
            if (s.isEmpty()) {
                s.add(exit);
            }
            succs.add(s);
        }

        BitSet[] pdom = new BitSet[n + 1];
        pdom[exit] = new BitSet(n + 1);
        pdom[exit].set(exit);
        for (int i = 0; i < n; i++) {
            pdom[i] = new BitSet(n + 1);
            pdom[i].set(0, n + 1);
        }

        boolean changed = true;
        while (changed) {
            changed = false;
            for (int i = n - 1; i >= 0; i--) {
                BitSet next = null;
                for (int s : succs.get(i)) {
                    if (next == null) {
                        next = (BitSet) pdom[s].clone();
                    } else {
                        next.and(pdom[s]);
                    }
                }
                next.set(i);
                if (!next.equals(pdom[i])) {
                    pdom[i] = next;
                    changed = true;
                }
            }
        }

        BitSet reachesExit = new BitSet(n);
        changed = true;
        while (changed) {
            changed = false;
            for (int i = 0; i < n; i++) {
                if (reachesExit.get(i)) {
                    continue;
                }
                for (int s : succs.get(i)) {
                    if (s == exit || reachesExit.get(s)) {
                        reachesExit.set(i);
                        changed = true;
                        break;
                    }
                }
            }
        }

        List<List<BlockId>> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            BitSet set = pdom[i];
            if (!reachesExit.get(i)) {
                out.add(List.of());
                continue;
            }
            ArrayList<Integer> strict = new ArrayList<>();
            for (int d = set.nextSetBit(0); d >= 0 && d < n; d = set.nextSetBit(d + 1)) {
                if (d != i) {
                    strict.add(d);
                }
            }
            final BitSet[] sets = pdom;
            strict.sort(Comparator.comparingInt((Integer d) -> sets[d].cardinality()).reversed());
            ArrayList<BlockId> ids = new ArrayList<>(strict.size());
            for (int d : strict) {
                ids.add(new BlockId(d));
            }
            out.add(List.copyOf(ids));
        }
        return new Postdominators(List.copyOf(out));
    }

    public List<BlockId> of(BlockId block) {
        Objects.requireNonNull(block, "block");
        if (block.index() >= byBlock.size()) {
            throw new IndexOutOfBoundsException("block " + block + " out of range");
        }
        return byBlock.get(block.index());
    }

    public Optional<BlockId> immediate(BlockId block) {
        List<BlockId> all = of(block);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(0));
    }

    public int blockCount() {
        return byBlock.size();
    }
}
