package dev.symsim.cfg;

import java.util.List;
import java.util.Objects;

/**
 * 函数句柄：名字 + 签名。绑定表（FunctionBindings）以句柄为键解析调用目标。
 *
 * <p>句柄按值比较；同名不同 index 的句柄是不同的函数。</p>
 */
public record FnHandle(int index, String name, List<TypeRepr> argTypes, TypeRepr returnType) {
    public FnHandle {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(argTypes, "argTypes");
        Objects.requireNonNull(returnType, "returnType");
        argTypes = List.copyOf(argTypes);
        if (index < 0) {
            throw new IllegalArgumentException("FnHandle index must be non-negative");
        }
        if (name.isEmpty()) {
            throw new IllegalArgumentException("FnHandle name must not be empty");
        }
    }

    public int arity() {
        return argTypes.size();
    }

    @Override
    public String toString() {
        return name;
    }
}
