package com.novalang.cfg.pass;

import com.novalang.cfg.mir.MirModule;

/**
 * MIR 优化 pass 接口。
 */
public interface MirPass {

    /**
     * Pass 名称。
     */
    String getName();

    /**
     * 对 MIR 模块执行变换。
     */
    MirModule run(MirModule module);
}
