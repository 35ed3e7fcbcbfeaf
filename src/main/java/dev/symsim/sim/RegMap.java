package dev.symsim.sim;

import dev.symsim.cfg.TypeRepr;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** 不可变寄存器表；寄存器编号即下标。 */
public record RegMap(List<RegEntry> entries) {
    private static final RegMap EMPTY = new RegMap(List.of());

    public RegMap {
        Objects.requireNonNull(entries, "entries");
        entries = List.copyOf(entries);
    }

    public static RegMap empty() {
        return EMPTY;
    }

    public static RegMap of(RegEntry... entries) {
        return new RegMap(List.of(entries));
    }

    public int size() {
        return entries.size();
    }

    public RegEntry get(int reg) {
        if (reg < 0 || reg >= entries.size()) {
            throw new IndexOutOfBoundsException("register " + reg + " out of range (size=" + entries.size() + ")");
        }
        return entries.get(reg);
    }

    public RegMap append(RegEntry entry) {
        Objects.requireNonNull(entry, "entry");
        ArrayList<RegEntry> next = new ArrayList<>(entries.size() + 1);
        next.addAll(entries);
        next.add(entry);
        return new RegMap(next);
    }

    public List<TypeRepr> types() {
        ArrayList<TypeRepr> out = new ArrayList<>(entries.size());
        for (RegEntry e : entries) {
            out.add(e.type());
        }
        return out;
    }
}
