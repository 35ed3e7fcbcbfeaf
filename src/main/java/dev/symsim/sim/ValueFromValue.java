package dev.symsim.sim;

import dev.symsim.backend.SymExpr;
import java.util.Objects;

/** 等待返回值的上下文：调用者，或已并入部分性的中止路径，或整个计算的终点。 */
public sealed interface ValueFromValue permits ValueFromValue.Call, ValueFromValue.Partial, ValueFromValue.End {
    record Call(ValueFromFrame outer, SimFrame caller, ReturnHandler handler) implements ValueFromValue {
        public Call {
            Objects.requireNonNull(outer, "outer");
            Objects.requireNonNull(caller, "caller");
            Objects.requireNonNull(handler, "handler");
        }
    }

    record Partial(ValueFromValue outer, SymExpr pred, AbortedResult aborted) implements ValueFromValue {
        public Partial {
            Objects.requireNonNull(outer, "outer");
            Objects.requireNonNull(pred, "pred");
            Objects.requireNonNull(aborted, "aborted");
        }
    }

    record End() implements ValueFromValue {}
}
