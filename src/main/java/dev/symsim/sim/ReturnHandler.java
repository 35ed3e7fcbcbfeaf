package dev.symsim.sim;

import dev.symsim.cfg.TypeRepr;
import java.util.Objects;

/** 被调函数返回后如何把值交还给调用者。 */
public sealed interface ReturnHandler
        permits ReturnHandler.ToOverride, ReturnHandler.ToCrucible, ReturnHandler.TailToCrucible {
    record ToOverride(OverrideContinuation continuation) implements ReturnHandler {
        public ToOverride {
            Objects.requireNonNull(continuation, "continuation");
        }
    }

    /** Bind the value to the caller's next register and resume at {@code resumePc}. */
    record ToCrucible(TypeRepr returnType, int resumePc) implements ReturnHandler {
        public ToCrucible {
            Objects.requireNonNull(returnType, "returnType");
        }
    }

    /** The call was in tail position: the value is returned straight from the caller. */
    record TailToCrucible() implements ReturnHandler {}
}
