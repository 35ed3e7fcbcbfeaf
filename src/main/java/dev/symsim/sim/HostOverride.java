package dev.symsim.sim;

import java.util.Objects;

/** 由宿主 Java 代码实现的函数。 */
public record HostOverride(String name, OverrideHandler handler) {
    public HostOverride {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(handler, "handler");
    }
}
