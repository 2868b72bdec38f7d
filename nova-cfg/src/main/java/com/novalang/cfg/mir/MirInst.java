package com.novalang.cfg.mir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * MIR 指令。任一时刻至多属于一个基本块的指令列表。
 */
public class MirInst implements MirValue {

    private final MirOp op;
    private final MirType type;         // 结果类型（VOID = 无返回值）
    private final List<MirValue> operands;
    private final Object extra;         // 额外数据（常量值、运算符名）
    private final SourceLocation location;
    /** 所在基本块，由 {@link InstructionList} 维护 */
    BasicBlock parent;

    public MirInst(MirOp op, MirType type, List<? extends MirValue> operands,
                   Object extra, SourceLocation location) {
        this.op = Objects.requireNonNull(op, "op");
        this.type = type != null ? type : MirType.ofVoid();
        this.operands = operands != null ? new ArrayList<>(operands) : new ArrayList<>();
        this.extra = extra;
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public MirInst(MirOp op, MirType type, List<? extends MirValue> operands, SourceLocation location) {
        this(op, type, operands, null, location);
    }

    public MirOp getOp() { return op; }
    @Override
    public MirType getType() { return type; }
    public Object getExtra() { return extra; }
    public SourceLocation getLocation() { return location; }

    /** 所在基本块，未挂接时为 null */
    public BasicBlock getParent() { return parent; }

    public MirFunction getFunction() {
        return parent != null ? parent.getParent() : null;
    }

    public boolean hasResult() {
        return !type.isVoid();
    }

    /**
     * 是否为终止指令。基本块的最后一条指令必须满足该能力。
     */
    public boolean isTerminator() {
        return false;
    }

    public List<MirValue> getOperands() {
        return Collections.unmodifiableList(operands);
    }

    public int getOperandCount() {
        return operands.size();
    }

    /**
     * 获取第 n 个操作数。
     */
    public MirValue getOperand(int n) {
        return operands.get(n);
    }

    /**
     * 释放对外引用（操作数）。删除基本块前调用以打断引用环。
     */
    public void dropAllReferences() {
        operands.clear();
    }

    /**
     * 从所在基本块摘除，指令本身保留。
     */
    public void removeFromParent() {
        requireParent().remove(this);
    }

    /**
     * 从所在基本块摘除并销毁。
     *
     * @return 原位置之后的指令（继续遍历的位置），没有则为 null
     */
    public MirInst eraseFromParent() {
        return requireParent().erase(this);
    }

    private BasicBlock requireParent() {
        if (parent == null) {
            throw new MalformedMirException("指令未挂接到任何基本块: " + this);
        }
        return parent;
    }

    /** 打印用的操作数引用名 */
    static String ref(MirValue value) {
        if (value instanceof MirArgument) {
            return ((MirArgument) value).getReferenceName();
        }
        if (value instanceof MirInst) {
            MirInst inst = (MirInst) value;
            if (inst.parent == null) return "%<detached>";
            return "%B" + inst.parent.getId() + "." + inst.parent.getInstructions().indexOf(inst);
        }
        return String.valueOf(value);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (hasResult()) sb.append(ref(this)).append(" = ");
        sb.append(op.name());
        for (int i = 0; i < operands.size(); i++) {
            sb.append(i == 0 ? " " : ", ").append(ref(operands.get(i)));
        }
        if (extra != null) sb.append(" [").append(extra).append(']');
        if (hasResult()) sb.append(" : ").append(type);
        return sb.toString();
    }
}
