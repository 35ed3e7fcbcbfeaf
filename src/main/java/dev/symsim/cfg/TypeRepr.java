package dev.symsim.cfg;

/** 寄存器、全局变量与返回值的运行时类型。 */
public enum TypeRepr {
    UNIT("unit"),
    BOOL("bool"),
    INT("int"),
    FUNCTION("fn");

    private final String displayName;

    TypeRepr(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public static TypeRepr fromName(String name) {
        return switch (name) {
            case "unit" -> UNIT;
            case "bool" -> BOOL;
            case "int" -> INT;
            case "fn" -> FUNCTION;
            default -> throw new IllegalArgumentException("invalid type name `" + name + "`");
        };
    }
}
