package com.novalang.cfg.mir;

/**
 * 参数所对应的源码声明（参数名、局部变量名等）。
 * 仅作为元数据挂在 {@link MirArgument} 上，本层不解释其内容。
 */
public final class ValueDecl {

    private final String name;
    private final SourceLocation location;

    public ValueDecl(String name, SourceLocation location) {
        this.name = name;
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public ValueDecl(String name) {
        this(name, SourceLocation.UNKNOWN);
    }

    public String getName() { return name; }
    public SourceLocation getLocation() { return location; }

    @Override
    public String toString() {
        return name;
    }
}
