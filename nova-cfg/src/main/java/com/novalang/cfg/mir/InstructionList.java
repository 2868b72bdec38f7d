package com.novalang.cfg.mir;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.RandomAccess;

/**
 * 基本块拥有的有序指令列表。
 *
 * <p>所有结构修改（包括经由迭代器、子列表进行的修改）都会同步维护指令的
 * 所属块引用：挂入时设置为本块，摘除时清空。一条指令同时只能在一个列表中，
 * 挂入已有归属的指令会抛出 {@link MalformedMirException}。</p>
 *
 * <p>迭代器是 fail-fast 的：遍历期间经由其他途径修改本列表会抛出
 * {@link java.util.ConcurrentModificationException}。</p>
 */
public final class InstructionList extends AbstractList<MirInst> implements RandomAccess {

    private final BasicBlock owner;
    private final ArrayList<MirInst> elements = new ArrayList<>();

    InstructionList(BasicBlock owner) {
        this.owner = owner;
    }

    public BasicBlock getOwner() {
        return owner;
    }

    @Override
    public MirInst get(int index) {
        return elements.get(index);
    }

    @Override
    public int size() {
        return elements.size();
    }

    @Override
    public void add(int index, MirInst inst) {
        Objects.requireNonNull(inst, "inst");
        if (inst.parent != null) {
            throw new MalformedMirException("指令已属于基本块 B" + inst.parent.getId()
                    + "，需先摘除: " + inst, owner);
        }
        elements.add(index, inst);
        inst.parent = owner;
        modCount++;
    }

    @Override
    public MirInst remove(int index) {
        MirInst inst = elements.remove(index);
        inst.parent = null;
        modCount++;
        return inst;
    }

    @Override
    public MirInst set(int index, MirInst inst) {
        Objects.requireNonNull(inst, "inst");
        MirInst old = elements.get(index);
        if (old == inst) {
            return old;
        }
        if (inst.parent != null) {
            throw new MalformedMirException("指令已属于基本块 B" + inst.parent.getId()
                    + "，需先摘除: " + inst, owner);
        }
        elements.set(index, inst);
        old.parent = null;
        inst.parent = owner;
        return old;
    }

    @Override
    protected void removeRange(int fromIndex, int toIndex) {
        List<MirInst> range = elements.subList(fromIndex, toIndex);
        for (MirInst inst : range) {
            inst.parent = null;
        }
        range.clear();
        modCount++;
    }

    @Override
    public int indexOf(Object o) {
        if (!(o instanceof MirInst) || ((MirInst) o).parent != owner) {
            return -1;
        }
        for (int i = 0; i < elements.size(); i++) {
            if (elements.get(i) == o) return i;
        }
        return -1;
    }

    @Override
    public int lastIndexOf(Object o) {
        return indexOf(o);
    }

    @Override
    public boolean contains(Object o) {
        return o instanceof MirInst && ((MirInst) o).parent == owner;
    }

    /**
     * 把 [fromIndex, size) 的指令按原顺序移动到 dest 末尾，转移所有权，不复制。
     */
    void transferTo(InstructionList dest, int fromIndex) {
        if (dest == this) {
            throw new MalformedMirException("不能把指令转移到自身", owner);
        }
        List<MirInst> moved = elements.subList(fromIndex, elements.size());
        if (moved.isEmpty()) {
            return;
        }
        for (MirInst inst : moved) {
            inst.parent = dest.owner;
        }
        dest.elements.addAll(moved);
        moved.clear();
        modCount++;
        dest.modCount++;
    }
}
