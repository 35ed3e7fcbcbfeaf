package dev.symsim.sim;

import dev.symsim.backend.ExprBuilder;
import dev.symsim.backend.SymExpr;
import java.util.ArrayList;

/** 按类型合并寄存器：bool/int 生成 ite，unit 直接保留，函数值必须相同。 */
final class RegMerge {
    private RegMerge() {}

    static RegEntry muxRegEntry(ExprBuilder eb, SymExpr pred, RegEntry x, RegEntry y) throws SimulatorError {
        if (x.type() != y.type()) {
            throw new SimulatorError.InvalidState(
                    "cannot merge " + x.type().displayName() + " register with " + y.type().displayName());
        }
        return switch (x.type()) {
            case UNIT -> x;
            case BOOL -> RegEntry.bool(eb.itePred(pred, x.expr(), y.expr()));
            case INT -> RegEntry.integer(eb.intIte(pred, x.expr(), y.expr()));
            case FUNCTION -> {
                if (!x.fnVal().equals(y.fnVal())) {
                    throw new SimulatorError.InvalidState(
                            "cannot merge distinct function values `" + x + "` and `" + y + "`");
                }
                yield x;
            }
        };
    }

    static RegMap muxRegMap(ExprBuilder eb, SymExpr pred, RegMap x, RegMap y) throws SimulatorError {
        if (x.size() != y.size()) {
            throw new SimulatorError.InvalidState(
                    "cannot merge register maps of different sizes: " + x.size() + " vs " + y.size());
        }
        ArrayList<RegEntry> out = new ArrayList<>(x.size());
        for (int i = 0; i < x.size(); i++) {
            out.add(muxRegEntry(eb, pred, x.get(i), y.get(i)));
        }
        return new RegMap(out);
    }
}
