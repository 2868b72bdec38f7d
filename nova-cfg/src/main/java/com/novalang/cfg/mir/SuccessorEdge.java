package com.novalang.cfg.mir;

/**
 * 控制流边：由终止指令持有，指向目标基本块。
 *
 * <p>每条边同时是目标块前驱链上的一个节点。构造、改指向、断开时，边会把自己
 * 挂入/移出目标块的前驱链（插入到链头，因此前驱遍历顺序为注册顺序的逆序）。
 * 目标块只通过这条链得知自己的前驱，不另存前驱列表。</p>
 */
public final class SuccessorEdge {

    private final MirTerminator owner;
    private BasicBlock target;
    // 目标块前驱链上的前后节点
    private SuccessorEdge prev;
    private SuccessorEdge next;

    SuccessorEdge(MirTerminator owner, BasicBlock target) {
        this.owner = owner;
        setTarget(target);
    }

    /** 持有本边的终止指令 */
    public MirTerminator getOwner() {
        return owner;
    }

    /** 本边所在的源基本块（终止指令未挂接时为 null） */
    public BasicBlock getSourceBlock() {
        return owner.getParent();
    }

    /** 目标块，已断开时为 null */
    public BasicBlock getTarget() {
        return target;
    }

    public boolean isAttached() {
        return target != null;
    }

    /**
     * 改为指向 newTarget：从旧目标的前驱链摘除，再挂到新目标前驱链的链头。
     * newTarget 为 null 时仅断开。
     */
    public void setTarget(BasicBlock newTarget) {
        if (newTarget == target) {
            return;
        }
        unlink();
        target = newTarget;
        if (newTarget != null) {
            next = newTarget.predList;
            if (next != null) {
                next.prev = this;
            }
            prev = null;
            newTarget.predList = this;
        }
    }

    /**
     * 断开本边，目标块不再把源块视为前驱。
     */
    public void detach() {
        setTarget(null);
    }

    /** 同一前驱链上的下一条边 */
    SuccessorEdge nextInChain() {
        return next;
    }

    private void unlink() {
        if (target == null) {
            return;
        }
        if (prev != null) {
            prev.next = next;
        } else {
            target.predList = next;
        }
        if (next != null) {
            next.prev = prev;
        }
        prev = null;
        next = null;
        target = null;
    }

    @Override
    public String toString() {
        BasicBlock source = getSourceBlock();
        return (source != null ? "B" + source.getId() : "?")
                + " -> " + (target != null ? "B" + target.getId() : "<detached>");
    }
}
