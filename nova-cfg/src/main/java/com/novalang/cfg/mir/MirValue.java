package com.novalang.cfg.mir;

/**
 * 可作为指令操作数的值：块参数或产生结果的指令。
 */
public interface MirValue {

    MirType getType();
}
