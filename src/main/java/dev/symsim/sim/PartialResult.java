package dev.symsim.sim;

import dev.symsim.backend.SymExpr;
import java.util.Objects;

/**
 * 可能只在部分路径上有定义的结果。{@code Partial} 表示仅当 {@code pred} 成立时值才有定义，
 * 其余路径已中止（见 {@code aborted}）。
 */
public sealed interface PartialResult<V> permits PartialResult.Total, PartialResult.Partial {
    GlobalPair<V> pair();

    <W> PartialResult<W> withPair(GlobalPair<W> newPair);

    default V value() {
        return pair().value();
    }

    default <W> PartialResult<W> withValue(W newValue) {
        return withPair(pair().withValue(newValue));
    }

    record Total<V>(GlobalPair<V> pair) implements PartialResult<V> {
        public Total {
            Objects.requireNonNull(pair, "pair");
        }

        @Override
        public <W> PartialResult<W> withPair(GlobalPair<W> newPair) {
            return new Total<>(newPair);
        }
    }

    record Partial<V>(SymExpr pred, GlobalPair<V> pair, AbortedResult aborted) implements PartialResult<V> {
        public Partial {
            Objects.requireNonNull(pred, "pred");
            Objects.requireNonNull(pair, "pair");
            Objects.requireNonNull(aborted, "aborted");
        }

        @Override
        public <W> PartialResult<W> withPair(GlobalPair<W> newPair) {
            return new Partial<>(pred, newPair, aborted);
        }
    }
}
