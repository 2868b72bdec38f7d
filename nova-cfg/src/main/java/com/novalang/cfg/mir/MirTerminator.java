package com.novalang.cfg.mir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * MIR 基本块终止指令。每个结构完整的基本块以恰好一条终止指令结尾。
 *
 * <p>终止指令持有本块全部出边（{@link SuccessorEdge}），边的数量由种类决定：
 * goto 为 1，branch 为 2，switch 为 case 数 + 1，return/throw/unreachable 为 0。</p>
 */
public abstract class MirTerminator extends MirInst {

    public enum Kind {
        GOTO, BRANCH, SWITCH, RETURN, THROW, UNREACHABLE
    }

    /** 子类类型标记，消除 instanceof 链 */
    private final Kind kind;
    private final List<SuccessorEdge> successors = new ArrayList<>(2);

    protected MirTerminator(Kind kind, List<? extends MirValue> operands, SourceLocation location) {
        super(MirOp.TERMINATOR, MirType.ofVoid(), operands, null, location);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }

    @Override
    public final boolean isTerminator() {
        return true;
    }

    /** 仅供子类构造器使用：按顺序登记一条出边 */
    protected final SuccessorEdge addSuccessor(BasicBlock target) {
        SuccessorEdge edge = new SuccessorEdge(this, Objects.requireNonNull(target, "target"));
        successors.add(edge);
        return edge;
    }

    /** 出边列表（只读，顺序由种类决定） */
    public List<SuccessorEdge> getSuccessors() {
        return Collections.unmodifiableList(successors);
    }

    public int getNumSuccessors() {
        return successors.size();
    }

    /** 第 i 条出边的目标块 */
    public BasicBlock getSuccessor(int i) {
        return successors.get(i).getTarget();
    }

    /**
     * 所有出边的目标块，按出边顺序；已断开的边不计入。
     */
    public List<BasicBlock> getSuccessorBlocks() {
        List<BasicBlock> result = new ArrayList<>(successors.size());
        for (SuccessorEdge edge : successors) {
            if (edge.getTarget() != null) result.add(edge.getTarget());
        }
        return result;
    }

    /**
     * 把所有指向 oldTarget 的出边改指向 newTarget。
     *
     * @return 被改写的边数
     */
    public int replaceSuccessor(BasicBlock oldTarget, BasicBlock newTarget) {
        int count = 0;
        for (SuccessorEdge edge : successors) {
            if (edge.getTarget() == oldTarget) {
                edge.setTarget(newTarget);
                count++;
            }
        }
        return count;
    }

    /**
     * 沿 edge 传给目标块参数的值，与目标块参数按位置一一对应。
     * 不携带参数的种类返回空列表。
     */
    public List<MirValue> getBranchArgs(SuccessorEdge edge) {
        return Collections.emptyList();
    }

    public List<MirValue> getBranchArgs(int successorIndex) {
        return getBranchArgs(successors.get(successorIndex));
    }

    /**
     * 释放操作数并断开所有出边，目标块的前驱链随之更新。
     */
    @Override
    public void dropAllReferences() {
        super.dropAllReferences();
        for (SuccessorEdge edge : successors) {
            edge.detach();
        }
    }

    static String label(SuccessorEdge edge) {
        BasicBlock target = edge.getTarget();
        return target != null ? "B" + target.getId() : "<detached>";
    }

    static String argList(List<MirValue> args) {
        if (args.isEmpty()) return "";
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(ref(args.get(i)));
        }
        return sb.append(')').toString();
    }

    /**
     * 无条件跳转，可携带块参数。
     */
    public static class Goto extends MirTerminator {
        private final SuccessorEdge edge;

        public Goto(SourceLocation location, BasicBlock target, List<? extends MirValue> args) {
            super(Kind.GOTO, args, location);
            this.edge = addSuccessor(target);
        }

        public Goto(SourceLocation location, BasicBlock target) {
            this(location, target, Collections.<MirValue>emptyList());
        }

        public BasicBlock getTarget() { return edge.getTarget(); }

        public List<MirValue> getArgs() { return getOperands(); }

        @Override
        public List<MirValue> getBranchArgs(SuccessorEdge e) {
            return e == edge ? getOperands() : Collections.<MirValue>emptyList();
        }

        @Override
        public String toString() {
            return "goto " + label(edge) + argList(getOperands());
        }
    }

    /**
     * 条件分支。操作数布局：[条件, then 参数..., else 参数...]。
     */
    public static class Branch extends MirTerminator {
        private final SuccessorEdge thenEdge;
        private final SuccessorEdge elseEdge;
        private final int thenArgCount;

        public Branch(SourceLocation location, MirValue condition,
                      BasicBlock thenBlock, List<? extends MirValue> thenArgs,
                      BasicBlock elseBlock, List<? extends MirValue> elseArgs) {
            super(Kind.BRANCH, concat(condition, thenArgs, elseArgs), location);
            this.thenArgCount = thenArgs != null ? thenArgs.size() : 0;
            this.thenEdge = addSuccessor(thenBlock);
            this.elseEdge = addSuccessor(elseBlock);
        }

        public Branch(SourceLocation location, MirValue condition, BasicBlock thenBlock, BasicBlock elseBlock) {
            this(location, condition, thenBlock, null, elseBlock, null);
        }

        private static List<MirValue> concat(MirValue condition, List<? extends MirValue> thenArgs,
                                             List<? extends MirValue> elseArgs) {
            List<MirValue> all = new ArrayList<>();
            all.add(Objects.requireNonNull(condition, "condition"));
            if (thenArgs != null) all.addAll(thenArgs);
            if (elseArgs != null) all.addAll(elseArgs);
            return all;
        }

        /** 引用已释放时为 null */
        public MirValue getCondition() {
            return getOperandCount() > 0 ? getOperand(0) : null;
        }

        public BasicBlock getThenBlock() { return thenEdge.getTarget(); }
        public BasicBlock getElseBlock() { return elseEdge.getTarget(); }

        public List<MirValue> getThenArgs() {
            List<MirValue> ops = getOperands();
            if (ops.isEmpty()) return Collections.emptyList();
            return ops.subList(1, 1 + thenArgCount);
        }

        public List<MirValue> getElseArgs() {
            List<MirValue> ops = getOperands();
            if (ops.isEmpty()) return Collections.emptyList();
            return ops.subList(1 + thenArgCount, ops.size());
        }

        @Override
        public List<MirValue> getBranchArgs(SuccessorEdge e) {
            if (e == thenEdge) return getThenArgs();
            if (e == elseEdge) return getElseArgs();
            return Collections.emptyList();
        }

        @Override
        public String toString() {
            return "branch " + ref(getCondition()) + " ? " + label(thenEdge) + argList(getThenArgs())
                    + " : " + label(elseEdge) + argList(getElseArgs());
        }
    }

    /**
     * Switch（多路分支）。出边顺序：各 case 按插入顺序，最后为 default。
     */
    public static class Switch extends MirTerminator {
        private final List<Object> caseValues;
        private final SuccessorEdge defaultEdge;

        public Switch(SourceLocation location, MirValue key, Map<Object, BasicBlock> cases,
                      BasicBlock defaultBlock) {
            super(Kind.SWITCH, Collections.singletonList(Objects.requireNonNull(key, "key")), location);
            this.caseValues = new ArrayList<>(cases.size());
            for (Map.Entry<Object, BasicBlock> entry : cases.entrySet()) {
                caseValues.add(entry.getKey());
                addSuccessor(entry.getValue());
            }
            this.defaultEdge = addSuccessor(defaultBlock);
        }

        public MirValue getKey() {
            return getOperandCount() > 0 ? getOperand(0) : null;
        }

        public int getCaseCount() { return caseValues.size(); }
        public Object getCaseValue(int i) { return caseValues.get(i); }
        public BasicBlock getCaseBlock(int i) { return getSuccessor(i); }
        public BasicBlock getDefaultBlock() { return defaultEdge.getTarget(); }

        /** case 值 → 目标块（按插入顺序） */
        public Map<Object, BasicBlock> getCases() {
            Map<Object, BasicBlock> map = new LinkedHashMap<>();
            for (int i = 0; i < caseValues.size(); i++) {
                map.put(caseValues.get(i), getSuccessor(i));
            }
            return map;
        }

        @Override
        public String toString() {
            return "switch " + ref(getKey()) + " cases=" + caseValues.size()
                    + " default=" + label(defaultEdge);
        }
    }

    /**
     * 返回。
     */
    public static class Return extends MirTerminator {

        /** value 为 null 表示 void 返回 */
        public Return(SourceLocation location, MirValue value) {
            super(Kind.RETURN, value != null ? Collections.singletonList(value)
                    : Collections.<MirValue>emptyList(), location);
        }

        public MirValue getValue() {
            return getOperandCount() > 0 ? getOperand(0) : null;
        }

        @Override
        public String toString() {
            return getValue() != null ? "return " + ref(getValue()) : "return";
        }
    }

    /**
     * 抛出异常。
     */
    public static class Throw extends MirTerminator {

        public Throw(SourceLocation location, MirValue exception) {
            super(Kind.THROW, Collections.singletonList(Objects.requireNonNull(exception, "exception")),
                    location);
        }

        public MirValue getException() {
            return getOperandCount() > 0 ? getOperand(0) : null;
        }

        @Override
        public String toString() { return "throw " + ref(getException()); }
    }

    /**
     * 不可达。
     */
    public static class Unreachable extends MirTerminator {
        public Unreachable(SourceLocation location) {
            super(Kind.UNREACHABLE, Collections.<MirValue>emptyList(), location);
        }

        @Override
        public String toString() { return "unreachable"; }
    }
}
