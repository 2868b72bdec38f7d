package com.novalang.cfg.mir;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * MIR 构建辅助类。
 * 维护一个插入点（基本块 + 位置），封装创建基本块、指令和终止指令的便捷方法。
 */
public class MirBuilder {

    private final MirFunction function;
    private BasicBlock currentBlock;
    /** 插入位置；-1 表示始终追加到块末尾 */
    private int insertIndex = -1;
    private SourceLocation location = SourceLocation.UNKNOWN;

    public MirBuilder(MirFunction function) {
        this.function = function;
        this.currentBlock = function.getEntryBlock() != null
                ? function.getEntryBlock() : function.createBlock(); // entry block
    }

    /** 绑定到已有函数和基本块（不创建新 block） */
    public MirBuilder(MirFunction function, BasicBlock existingBlock) {
        this.function = function;
        this.currentBlock = existingBlock;
    }

    public MirFunction getFunction() { return function; }
    public BasicBlock getCurrentBlock() { return currentBlock; }

    /** 之后发射的指令使用的源码位置 */
    public MirBuilder at(SourceLocation loc) {
        this.location = loc != null ? loc : SourceLocation.UNKNOWN;
        return this;
    }

    // ========== 基本块操作 ==========

    public BasicBlock newBlock() {
        return function.createBlock();
    }

    public BasicBlock newBlockAfter(BasicBlock after) {
        return function.createBlockAfter(after);
    }

    /** 切换到 block 末尾 */
    public void switchToBlock(BasicBlock block) {
        this.currentBlock = block;
        this.insertIndex = -1;
    }

    /** 之后的指令插在 inst 之前 */
    public void setInsertionPointBefore(MirInst inst) {
        BasicBlock block = inst.getParent();
        if (block == null) {
            throw new MalformedMirException("插入点指令未挂接: " + inst);
        }
        this.currentBlock = block;
        this.insertIndex = block.getInstructions().indexOf(inst);
    }

    // ========== 指令发射 ==========

    private <T extends MirInst> T emit(T inst) {
        if (insertIndex < 0) {
            currentBlock.pushBack(inst);
        } else {
            currentBlock.insert(insertIndex++, inst);
        }
        return inst;
    }

    public MirInst emitConstInt(int value) {
        return emit(new MirInst(MirOp.CONST_INT, MirType.ofInt(), null, value, location));
    }

    public MirInst emitConstBool(boolean value) {
        return emit(new MirInst(MirOp.CONST_BOOL, MirType.ofBoolean(), null, value, location));
    }

    public MirInst emitMove(MirValue src) {
        return emit(new MirInst(MirOp.MOVE, src.getType(), Collections.singletonList(src), location));
    }

    /**
     * 二元运算，op 为运算符名（如 "ADD"、"LT"）。
     */
    public MirInst emitBinary(String op, MirValue left, MirValue right, MirType resultType) {
        return emit(new MirInst(MirOp.BINARY, resultType, Arrays.asList(left, right), op, location));
    }

    // ========== 终止指令 ==========

    public MirTerminator.Goto emitGoto(BasicBlock target, MirValue... args) {
        return emit(new MirTerminator.Goto(location, target, Arrays.asList(args)));
    }

    public MirTerminator.Branch emitBranch(MirValue condition, BasicBlock thenBlock, BasicBlock elseBlock) {
        return emit(new MirTerminator.Branch(location, condition, thenBlock, elseBlock));
    }

    public MirTerminator.Branch emitBranch(MirValue condition,
                                           BasicBlock thenBlock, List<? extends MirValue> thenArgs,
                                           BasicBlock elseBlock, List<? extends MirValue> elseArgs) {
        return emit(new MirTerminator.Branch(location, condition, thenBlock, thenArgs, elseBlock, elseArgs));
    }

    public MirTerminator.Switch emitSwitch(MirValue key, Map<Object, BasicBlock> cases, BasicBlock defaultBlock) {
        return emit(new MirTerminator.Switch(location, key, cases, defaultBlock));
    }

    /** value 为 null 表示 void 返回 */
    public MirTerminator.Return emitReturn(MirValue value) {
        return emit(new MirTerminator.Return(location, value));
    }

    public MirTerminator.Throw emitThrow(MirValue exception) {
        return emit(new MirTerminator.Throw(location, exception));
    }

    public MirTerminator.Unreachable emitUnreachable() {
        return emit(new MirTerminator.Unreachable(location));
    }
}
