package com.novalang.cfg.mir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.ListIterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * MIR 基本块。
 *
 * <p>基本块拥有一个指令列表（最后一条必须是 {@link MirTerminator}）和一个有序参数列表。
 * 后继从终止指令的出边直接读取；前驱不单独存储，而是沿指向本块的
 * {@link SuccessorEdge} 组成的前驱链遍历得到。</p>
 *
 * <p>基本块只能由 {@link MirFunction} 创建，所属函数引用也只由函数设置。</p>
 */
public class BasicBlock implements Iterable<MirInst> {

    /** 由所属函数分配，转移到其他函数时重新编号 */
    int id;
    private MirFunction parent;
    private final InstructionList instructions;
    private final List<MirArgument> arguments = new ArrayList<>();
    /** 前驱链链头，由 SuccessorEdge 维护 */
    SuccessorEdge predList;

    BasicBlock(MirFunction parent, int id) {
        this.parent = parent;
        this.id = id;
        this.instructions = new InstructionList(this);
    }

    /** 在所属函数内唯一的编号，仅用于打印，不代表位置 */
    public int getId() { return id; }

    public MirFunction getParent() { return parent; }

    void setParent(MirFunction parent) {
        this.parent = parent;
    }

    public MirModule getModule() {
        return parent != null ? parent.getModule() : null;
    }

    public boolean isEntry() {
        return parent != null && parent.getEntryBlock() == this;
    }

    /**
     * 在所属函数块序列中的位置。线性扫描，很慢，只用于调试输出。
     *
     * @return 位置，未挂接到函数时为 -1
     */
    public int getDebugId() {
        return parent != null ? parent.indexOf(this) : -1;
    }

    // ========== 指令列表 ==========

    /**
     * 指令列表的实时视图。经由该列表及其迭代器的修改都会维护指令的所属块。
     */
    public InstructionList getInstructions() { return instructions; }

    @Override
    public Iterator<MirInst> iterator() {
        return instructions.iterator();
    }

    /** 逆序遍历指令 */
    public Iterable<MirInst> reverseInstructions() {
        return () -> new Iterator<MirInst>() {
            private final ListIterator<MirInst> it = instructions.listIterator(instructions.size());

            @Override
            public boolean hasNext() { return it.hasPrevious(); }

            @Override
            public MirInst next() { return it.previous(); }

            @Override
            public void remove() { it.remove(); }
        };
    }

    public boolean isEmpty() {
        return instructions.isEmpty();
    }

    public int size() {
        return instructions.size();
    }

    public void insert(int index, MirInst inst) {
        instructions.add(index, inst);
    }

    public void insertBefore(MirInst pos, MirInst inst) {
        instructions.add(positionOf(pos), inst);
    }

    public void insertAfter(MirInst pos, MirInst inst) {
        instructions.add(positionOf(pos) + 1, inst);
    }

    public void pushFront(MirInst inst) {
        instructions.add(0, inst);
    }

    public void pushBack(MirInst inst) {
        instructions.add(inst);
    }

    /**
     * 摘除指令但不销毁，之后可挂入其他位置。
     */
    public MirInst remove(MirInst inst) {
        return instructions.remove(positionOf(inst));
    }

    /**
     * 摘除并销毁指令（释放其操作数，终止指令还会断开全部出边）。
     *
     * @return 被删指令之后的指令，作为继续遍历的位置；没有则为 null
     */
    public MirInst erase(MirInst inst) {
        int index = positionOf(inst);
        instructions.remove(index);
        inst.dropAllReferences();
        return index < instructions.size() ? instructions.get(index) : null;
    }

    public MirInst front() {
        if (instructions.isEmpty()) {
            throw new NoSuchElementException("基本块 B" + id + " 没有指令");
        }
        return instructions.get(0);
    }

    public MirInst back() {
        if (instructions.isEmpty()) {
            throw new NoSuchElementException("基本块 B" + id + " 没有指令");
        }
        return instructions.get(instructions.size() - 1);
    }

    /**
     * 获取终止指令。
     *
     * @throws MalformedMirException 块为空或最后一条指令不是终止指令
     */
    public MirTerminator getTerminator() {
        if (instructions.isEmpty()) {
            throw new MalformedMirException("空基本块没有终止指令", this);
        }
        MirInst last = instructions.get(instructions.size() - 1);
        if (!last.isTerminator()) {
            throw new MalformedMirException("最后一条指令不是终止指令: " + last, this);
        }
        return (MirTerminator) last;
    }

    public boolean hasTerminator() {
        return !instructions.isEmpty() && instructions.get(instructions.size() - 1).isTerminator();
    }

    /**
     * 把 other 的全部指令按顺序移到本块末尾，other 的指令列表变为空。
     */
    public void spliceAtEnd(BasicBlock other) {
        other.instructions.transferTo(instructions, 0);
    }

    /**
     * 在 index 处把块一分为二：index 及之后的指令移入紧随本块之后新建的块。
     *
     * <p>本块被留在没有终止指令的状态，不会自动补一条跳转；调用方必须自行插入
     * 终止指令（例如 goto 新块）以恢复结构完整。</p>
     *
     * @return 新块
     */
    public BasicBlock split(int index) {
        if (parent == null) {
            throw new MalformedMirException("未挂接到函数的基本块不能拆分", this);
        }
        Objects.checkIndex(index, instructions.size() + 1);
        BasicBlock tail = parent.createBlockAfter(this);
        instructions.transferTo(tail.instructions, index);
        return tail;
    }

    /**
     * 在指令 at 处拆分，at 成为新块的第一条指令。见 {@link #split(int)}。
     */
    public BasicBlock split(MirInst at) {
        return split(positionOf(at));
    }

    /**
     * 把本块移到同一函数中 after 之后。
     *
     * @throws MalformedMirException 两个块不属于同一函数
     */
    public void moveAfter(BasicBlock after) {
        if (parent == null || after.parent != parent) {
            throw new MalformedMirException("moveAfter 要求两个基本块属于同一函数: B"
                    + id + " / B" + after.id, this);
        }
        parent.moveBlockAfter(this, after);
    }

    /**
     * 从所属函数摘除并销毁本块：释放引用、清空参数、移出块序列、释放指令。
     *
     * @throws MalformedMirException 仍有其他块的出边指向本块
     */
    public void eraseFromParent() {
        if (parent == null) {
            throw new MalformedMirException("基本块未挂接到函数", this);
        }
        // 自环在 dropAllReferences 中随终止指令一起断开
        for (SuccessorEdge edge : getPredecessorEdges()) {
            if (edge.getSourceBlock() != this) {
                throw new MalformedMirException("仍有前驱跳转到该基本块，不能删除: " + edge, this);
            }
        }
        dropAllReferences();
        parent.removeBlock(this);
        instructions.clear();
    }

    /**
     * 清空参数列表并让每条指令释放对外引用，用于销毁前打断引用环。
     */
    public void dropAllReferences() {
        dropAllArguments();
        for (MirInst inst : instructions) {
            inst.dropAllReferences();
        }
    }

    private int positionOf(MirInst inst) {
        int index = instructions.indexOf(inst);
        if (index < 0) {
            throw new MalformedMirException("指令不在该基本块中: " + inst, this);
        }
        return index;
    }

    // ========== 参数列表 ==========

    public List<MirArgument> getArguments() {
        return Collections.unmodifiableList(arguments);
    }

    public int getNumArguments() {
        return arguments.size();
    }

    public boolean argsEmpty() {
        return arguments.isEmpty();
    }

    public MirArgument getArgument(int index) {
        Objects.checkIndex(index, arguments.size());
        return arguments.get(index);
    }

    int indexOfArgument(MirArgument arg) {
        for (int i = 0; i < arguments.size(); i++) {
            if (arguments.get(i) == arg) return i;
        }
        return -1;
    }

    /**
     * 参数列表的 PHI 视图（快照）。
     *
     * @throws MalformedMirException 列表中含函数参数
     */
    public List<PhiArgument> getPhiArguments() {
        List<PhiArgument> result = new ArrayList<>(arguments.size());
        for (MirArgument arg : arguments) {
            if (!(arg instanceof PhiArgument)) {
                throw new MalformedMirException("参数列表中存在函数参数: " + arg, this);
            }
            result.add((PhiArgument) arg);
        }
        return result;
    }

    /**
     * 参数列表的函数参数视图（快照）。
     *
     * @throws MalformedMirException 列表中含 PHI 参数
     */
    public List<FunctionArgument> getFunctionArguments() {
        List<FunctionArgument> result = new ArrayList<>(arguments.size());
        for (MirArgument arg : arguments) {
            if (!(arg instanceof FunctionArgument)) {
                throw new MalformedMirException("参数列表中存在 PHI 参数: " + arg, this);
            }
            result.add((FunctionArgument) arg);
        }
        return result;
    }

    /**
     * 追加函数参数，所有权按类型推导（原始类型 TRIVIAL，其余 OWNED）。
     */
    public FunctionArgument createFunctionArgument(MirType type, ValueDecl decl) {
        return insertFunctionArgument(arguments.size(), type, OwnershipKind.defaultFor(type), decl);
    }

    public FunctionArgument createFunctionArgument(MirType type) {
        return createFunctionArgument(type, null);
    }

    /**
     * 在 index 处插入函数参数，其后参数位置加一。
     */
    public FunctionArgument insertFunctionArgument(int index, MirType type, OwnershipKind kind,
                                                   ValueDecl decl) {
        Objects.checkIndex(index, arguments.size() + 1);
        FunctionArgument arg = new FunctionArgument(type, kind, decl);
        attachArgument(index, arg);
        return arg;
    }

    /**
     * 追加 PHI 参数。调用方须同时为每个前驱的分支参数在相同位置补上传入值。
     */
    public PhiArgument createPhiArgument(MirType type, OwnershipKind kind, ValueDecl decl) {
        return insertPhiArgument(arguments.size(), type, kind, decl);
    }

    public PhiArgument createPhiArgument(MirType type, OwnershipKind kind) {
        return createPhiArgument(type, kind, null);
    }

    /**
     * 在 index 处插入 PHI 参数，其后参数位置加一。
     */
    public PhiArgument insertPhiArgument(int index, MirType type, OwnershipKind kind, ValueDecl decl) {
        Objects.checkIndex(index, arguments.size() + 1);
        PhiArgument arg = new PhiArgument(type, kind, decl);
        attachArgument(index, arg);
        return arg;
    }

    public PhiArgument insertPhiArgument(int index, MirType type, OwnershipKind kind) {
        return insertPhiArgument(index, type, kind, null);
    }

    /**
     * 用新 PHI 参数替换 index 处的参数，其他参数位置不变。旧参数被销毁。
     */
    public PhiArgument replacePhiArgument(int index, MirType type, OwnershipKind kind, ValueDecl decl) {
        Objects.checkIndex(index, arguments.size());
        PhiArgument arg = new PhiArgument(type, kind, decl);
        MirArgument old = arguments.set(index, arg);
        old.parent = null;
        arg.parent = this;
        return arg;
    }

    public PhiArgument replacePhiArgument(int index, MirType type, OwnershipKind kind) {
        return replacePhiArgument(index, type, kind, null);
    }

    /**
     * 删除 index 处的参数，其后参数位置减一。
     */
    public void eraseArgument(int index) {
        Objects.checkIndex(index, arguments.size());
        MirArgument old = arguments.remove(index);
        old.parent = null;
    }

    /**
     * 无条件清空参数列表。
     */
    public void dropAllArguments() {
        for (MirArgument arg : arguments) {
            arg.parent = null;
        }
        arguments.clear();
    }

    /**
     * 按 other 的参数列表（种类、类型、所有权、声明）在本块末尾追加一份副本。
     *
     * @throws MalformedMirException 两个块一个是入口块一个不是
     */
    public void cloneArgumentList(BasicBlock other) {
        if (other.isEntry() != isEntry()) {
            throw new MalformedMirException("入口块与非入口块之间不能复制参数列表: B"
                    + other.id + " -> B" + id, this);
        }
        for (MirArgument arg : new ArrayList<>(other.arguments)) {
            if (arg.isFunctionArgument()) {
                insertFunctionArgument(arguments.size(), arg.getType(), arg.getOwnershipKind(), arg.getDecl());
            } else {
                createPhiArgument(arg.getType(), arg.getOwnershipKind(), arg.getDecl());
            }
        }
    }

    private void attachArgument(int index, MirArgument arg) {
        arguments.add(index, arg);
        arg.parent = this;
    }

    // ========== 后继 ==========

    /** 出边，直接读取终止指令 */
    public List<SuccessorEdge> getSuccessors() {
        return getTerminator().getSuccessors();
    }

    public List<BasicBlock> getSuccessorBlocks() {
        return getTerminator().getSuccessorBlocks();
    }

    public boolean succEmpty() {
        return getSuccessors().isEmpty();
    }

    /**
     * 恰有一条出边时返回其目标，否则返回 null。
     */
    public BasicBlock getSingleSuccessorBlock() {
        List<SuccessorEdge> succs = getSuccessors();
        return succs.size() == 1 ? succs.get(0).getTarget() : null;
    }

    public boolean isSuccessorBlock(BasicBlock block) {
        for (SuccessorEdge edge : getSuccessors()) {
            if (edge.getTarget() == block) return true;
        }
        return false;
    }

    // ========== 前驱 ==========

    public boolean predEmpty() {
        return predList == null;
    }

    /**
     * 指向本块的所有出边，沿前驱链遍历（最近注册的在前）。
     * 遍历期间修改任何指向本块的边，结果未定义。
     */
    public Iterable<SuccessorEdge> getPredecessorEdges() {
        return () -> new Iterator<SuccessorEdge>() {
            private SuccessorEdge cursor = predList;

            @Override
            public boolean hasNext() { return cursor != null; }

            @Override
            public SuccessorEdge next() {
                if (cursor == null) throw new NoSuchElementException();
                SuccessorEdge edge = cursor;
                cursor = edge.nextInChain();
                return edge;
            }
        };
    }

    /**
     * 前驱块，每条入边对应一项（同一前驱有两条边指向本块时出现两次）。
     */
    public Iterable<BasicBlock> getPredecessorBlocks() {
        return () -> new Iterator<BasicBlock>() {
            private final Iterator<SuccessorEdge> edges = getPredecessorEdges().iterator();

            @Override
            public boolean hasNext() { return edges.hasNext(); }

            @Override
            public BasicBlock next() { return edges.next().getSourceBlock(); }
        };
    }

    /**
     * 恰有一条入边时返回其源块，否则返回 null。
     */
    public BasicBlock getSinglePredecessorBlock() {
        if (predList == null || predList.nextInChain() != null) {
            return null;
        }
        return predList.getSourceBlock();
    }

    public boolean isPredecessorBlock(BasicBlock block) {
        for (BasicBlock pred : getPredecessorBlocks()) {
            if (pred == block) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("B").append(id);
        if (!arguments.isEmpty()) {
            sb.append('(');
            for (int i = 0; i < arguments.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(arguments.get(i));
            }
            sb.append(')');
        }
        sb.append(":\n");
        for (MirInst inst : instructions) {
            sb.append("  ").append(inst).append('\n');
        }
        return sb.toString();
    }
}
