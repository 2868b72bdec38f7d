package com.novalang.cfg.mir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * MIR 函数（包含 CFG）。
 *
 * <p>函数拥有有序的基本块序列，是唯一可以插入、摘除、重排基本块并设置其
 * 所属函数引用的地方。</p>
 */
public class MirFunction {

    private final String name;
    private final MirType returnType;
    private MirModule module;
    private final List<BasicBlock> blocks = new ArrayList<>();
    /** 下一个块编号 */
    private int nextBlockId;

    public MirFunction(String name, MirType returnType) {
        this.name = Objects.requireNonNull(name, "name");
        this.returnType = returnType != null ? returnType : MirType.ofVoid();
    }

    public String getName() { return name; }
    public MirType getReturnType() { return returnType; }

    /** 所属模块，独立创建的函数为 null */
    public MirModule getModule() { return module; }

    void setModule(MirModule module) {
        this.module = module;
    }

    /** 块序列的只读视图 */
    public List<BasicBlock> getBlocks() {
        return Collections.unmodifiableList(blocks);
    }

    public int getBlockCount() {
        return blocks.size();
    }

    public BasicBlock getEntryBlock() {
        return blocks.isEmpty() ? null : blocks.get(0);
    }

    /** 块在序列中的位置，线性扫描，不在本函数中返回 -1 */
    public int indexOf(BasicBlock block) {
        if (block.getParent() != this) return -1;
        for (int i = 0; i < blocks.size(); i++) {
            if (blocks.get(i) == block) return i;
        }
        return -1;
    }

    /**
     * 在末尾创建新块。
     */
    public BasicBlock createBlock() {
        BasicBlock block = new BasicBlock(this, nextBlockId++);
        blocks.add(block);
        return block;
    }

    /**
     * 在 after 之后创建新块；after 为 null 时追加到末尾。
     */
    public BasicBlock createBlockAfter(BasicBlock after) {
        if (after == null) {
            return createBlock();
        }
        int index = requireOwned(after);
        BasicBlock block = new BasicBlock(this, nextBlockId++);
        blocks.add(index + 1, block);
        return block;
    }

    void moveBlockAfter(BasicBlock block, BasicBlock after) {
        requireOwned(after);
        if (block == after) {
            return;
        }
        blocks.remove(requireOwned(block));
        blocks.add(requireOwned(after) + 1, block);
    }

    void removeBlock(BasicBlock block) {
        blocks.remove(requireOwned(block));
        block.setParent(null);
    }

    /**
     * 把 source 中从 first 到 last（含）的连续块整体移到本函数末尾，并同时改写
     * 每个被移动块的所属函数。被移动块按本函数的编号序列重新编号。
     * 先校验全部前置条件，校验失败时两个函数都不变。
     *
     * @throws MalformedMirException 块不属于 source、区间逆序或 source 就是本函数
     */
    public void transferBlocksFrom(MirFunction source, BasicBlock first, BasicBlock last) {
        if (source == this) {
            throw new MalformedMirException("不能从函数自身转移基本块: " + name);
        }
        int from = source.indexOf(first);
        int to = source.indexOf(last);
        if (from < 0 || to < 0) {
            throw new MalformedMirException("转移区间的端点不属于函数 " + source.getName(),
                    from < 0 ? first : last);
        }
        if (from > to) {
            throw new MalformedMirException("转移区间逆序: B" + first.getId() + " 在 B" + last.getId() + " 之后",
                    first);
        }
        List<BasicBlock> range = source.blocks.subList(from, to + 1);
        List<BasicBlock> moved = new ArrayList<>(range);
        range.clear();
        blocks.addAll(moved);
        for (BasicBlock block : moved) {
            block.setParent(this);
            block.id = nextBlockId++;
        }
    }

    /**
     * 把 source 的全部块移到本函数末尾。
     */
    public void transferBlocksFrom(MirFunction source) {
        if (source.blocks.isEmpty()) {
            return;
        }
        transferBlocksFrom(source, source.blocks.get(0), source.blocks.get(source.blocks.size() - 1));
    }

    private int requireOwned(BasicBlock block) {
        int index = indexOf(block);
        if (index < 0) {
            throw new MalformedMirException("基本块不属于函数 " + name, block);
        }
        return index;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("fun ").append(name).append("(");
        BasicBlock entry = getEntryBlock();
        if (entry != null) {
            List<MirArgument> args = entry.getArguments();
            for (int i = 0; i < args.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(args.get(i));
            }
        }
        sb.append("): ").append(returnType).append(" {\n");
        for (BasicBlock block : blocks) {
            sb.append(block);
        }
        sb.append("}\n");
        return sb.toString();
    }
}
