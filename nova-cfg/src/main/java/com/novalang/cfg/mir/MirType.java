package com.novalang.cfg.mir;

import java.util.Objects;

/**
 * MIR 类型标记。基本块层只比较和打印类型，不做类型检查。
 */
public final class MirType {

    public enum Kind {
        INT, LONG, FLOAT, DOUBLE, BOOLEAN, CHAR, VOID, OBJECT, ARRAY
    }

    private static final MirType INT = new MirType(Kind.INT, null, null);
    private static final MirType LONG = new MirType(Kind.LONG, null, null);
    private static final MirType FLOAT = new MirType(Kind.FLOAT, null, null);
    private static final MirType DOUBLE = new MirType(Kind.DOUBLE, null, null);
    private static final MirType BOOLEAN = new MirType(Kind.BOOLEAN, null, null);
    private static final MirType CHAR = new MirType(Kind.CHAR, null, null);
    private static final MirType VOID = new MirType(Kind.VOID, null, null);

    private final Kind kind;
    private final String className;     // OBJECT 时使用（JVM 内部名）
    private final MirType elementType;  // ARRAY 时使用

    private MirType(Kind kind, String className, MirType elementType) {
        this.kind = kind;
        this.className = className;
        this.elementType = elementType;
    }

    public static MirType ofInt()     { return INT; }
    public static MirType ofLong()    { return LONG; }
    public static MirType ofFloat()   { return FLOAT; }
    public static MirType ofDouble()  { return DOUBLE; }
    public static MirType ofBoolean() { return BOOLEAN; }
    public static MirType ofChar()    { return CHAR; }
    public static MirType ofVoid()    { return VOID; }

    public static MirType ofObject(String className) {
        return new MirType(Kind.OBJECT, Objects.requireNonNull(className, "className"), null);
    }

    public static MirType ofArray(MirType elementType) {
        return new MirType(Kind.ARRAY, null, Objects.requireNonNull(elementType, "elementType"));
    }

    public Kind getKind() { return kind; }
    public String getClassName() { return className; }
    public MirType getElementType() { return elementType; }

    public boolean isVoid() {
        return kind == Kind.VOID;
    }

    public boolean isPrimitive() {
        switch (kind) {
            case INT: case LONG: case FLOAT: case DOUBLE: case BOOLEAN: case CHAR: return true;
            default: return false;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MirType)) return false;
        MirType other = (MirType) o;
        return kind == other.kind
                && Objects.equals(className, other.className)
                && Objects.equals(elementType, other.elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, className, elementType);
    }

    @Override
    public String toString() {
        switch (kind) {
            case OBJECT: return className;
            case ARRAY: return elementType + "[]";
            default: return kind.name().toLowerCase();
        }
    }
}
