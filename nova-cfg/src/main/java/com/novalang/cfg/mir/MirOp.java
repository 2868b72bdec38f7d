package com.novalang.cfg.mir;

/**
 * MIR 非终止指令操作码。终止指令见 {@link MirTerminator.Kind}。
 */
public enum MirOp {
    // 常量
    CONST_INT,
    CONST_BOOL,

    MOVE,           // dest = src
    BINARY,         // dest = src1 op src2

    // 终止指令（仅由 MirTerminator 使用）
    TERMINATOR
}
