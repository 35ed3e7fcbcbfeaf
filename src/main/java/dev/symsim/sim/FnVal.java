package dev.symsim.sim;

import dev.symsim.cfg.FnHandle;
import java.util.Objects;

/** 函数值：裸句柄，或捕获了一个值的闭包（调用时该值追加到参数末尾）。 */
public sealed interface FnVal permits FnVal.HandleFnVal, FnVal.ClosureFnVal {
    FnHandle handle();

    record HandleFnVal(FnHandle handle) implements FnVal {
        public HandleFnVal {
            Objects.requireNonNull(handle, "handle");
        }
    }

    record ClosureFnVal(FnVal inner, RegEntry captured) implements FnVal {
        public ClosureFnVal {
            Objects.requireNonNull(inner, "inner");
            Objects.requireNonNull(captured, "captured");
        }

        @Override
        public FnHandle handle() {
            return inner.handle();
        }
    }
}
