package dev.symsim.cfg;

import java.util.Objects;

public record GlobalVar(String name, TypeRepr type) {
    public GlobalVar {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("global variable name must not be empty");
        }
    }
}
