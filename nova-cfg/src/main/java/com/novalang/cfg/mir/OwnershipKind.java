package com.novalang.cfg.mir;

/**
 * 值的所有权种类。本层只负责存储，由后续 pass 解释。
 */
public enum OwnershipKind {
    /** 无需生命周期管理的值（原始类型） */
    TRIVIAL,
    /** 不持有引用计数的借用 */
    UNOWNED,
    /** 持有所有权，使用方负责释放 */
    OWNED,
    /** 在作用域内由调用方保证存活 */
    GUARANTEED,
    /** 任意种类 */
    ANY;

    /**
     * 按类型推导默认所有权：原始类型为 TRIVIAL，其余为 OWNED。
     */
    public static OwnershipKind defaultFor(MirType type) {
        return type != null && type.isPrimitive() ? TRIVIAL : OWNED;
    }
}
