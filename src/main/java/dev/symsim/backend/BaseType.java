package dev.symsim.backend;

public enum BaseType {
    BOOL,
    INT
}
