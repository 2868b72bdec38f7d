package com.novalang.cfg.mir;

/**
 * MIR 结构契约被破坏：缺少终止指令、跨函数移动基本块、重复挂接指令等。
 * 表示调用方 pass 的 bug，而不是可恢复的运行时状况。
 */
public class MalformedMirException extends IllegalStateException {

    private final transient BasicBlock block;

    public MalformedMirException(String message) {
        super(message);
        this.block = null;
    }

    public MalformedMirException(String message, BasicBlock block) {
        super(message);
        this.block = block;
    }

    /** 出错的基本块，可能为 null */
    public BasicBlock getBlock() {
        return block;
    }

    @Override
    public String getMessage() {
        if (block == null) {
            return super.getMessage();
        }
        StringBuilder sb = new StringBuilder(super.getMessage());
        sb.append(" (at B").append(block.getId());
        MirFunction fn = block.getParent();
        if (fn != null) {
            sb.append(" in ").append(fn.getName());
        }
        sb.append(')');
        return sb.toString();
    }
}
