package com.novalang.cfg.mir;

/**
 * 入口块参数，对应函数的形参。
 */
public final class FunctionArgument extends MirArgument {

    FunctionArgument(MirType type, OwnershipKind ownershipKind, ValueDecl decl) {
        super(type, ownershipKind, decl);
    }

    @Override
    public boolean isPhiArgument() {
        return false;
    }
}
