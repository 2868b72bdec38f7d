package com.novalang.cfg.mir;

import java.util.Objects;

/**
 * 基本块参数。只能经由所属 {@link BasicBlock} 的 create/insert/replace 方法创建，
 * 经由 erase/replace/drop 方法销毁；构造本身不会把参数挂入任何列表。
 *
 * <p>被销毁的参数 {@link #getParent()} 为 null，{@link #getIndex()} 为 -1。</p>
 */
public abstract class MirArgument implements MirValue {

    /** 所属基本块，由 BasicBlock 维护 */
    BasicBlock parent;
    private final MirType type;
    private final OwnershipKind ownershipKind;
    private final ValueDecl decl;

    MirArgument(MirType type, OwnershipKind ownershipKind, ValueDecl decl) {
        this.type = Objects.requireNonNull(type, "type");
        this.ownershipKind = Objects.requireNonNull(ownershipKind, "ownershipKind");
        this.decl = decl;
    }

    @Override
    public MirType getType() { return type; }
    public OwnershipKind getOwnershipKind() { return ownershipKind; }
    /** 对应的源码声明，可能为 null */
    public ValueDecl getDecl() { return decl; }
    public BasicBlock getParent() { return parent; }

    public MirFunction getFunction() {
        return parent != null ? parent.getParent() : null;
    }

    /** 在所属块参数列表中的位置，已销毁时为 -1 */
    public int getIndex() {
        return parent != null ? parent.indexOfArgument(this) : -1;
    }

    public abstract boolean isPhiArgument();

    public final boolean isFunctionArgument() {
        return !isPhiArgument();
    }

    String getReferenceName() {
        String base = decl != null ? decl.getName() : "arg" + getIndex();
        return parent != null ? "%B" + parent.getId() + "." + base : "%<detached>." + base;
    }

    @Override
    public String toString() {
        return getReferenceName() + ": " + type;
    }
}
