package com.novalang.cfg.mir;

import java.util.ArrayList;
import java.util.List;

/**
 * 非入口块参数（SSA 合流点）。其值取决于从哪个前驱跳入。
 *
 * <p>位置契约：每个前驱终止指令传给本块的分支参数列表必须与本块参数列表按位置
 * 一一对应。增删参数时由调用方同步修改所有前驱的分支参数，本层不自动维护。</p>
 */
public final class PhiArgument extends MirArgument {

    PhiArgument(MirType type, OwnershipKind ownershipKind, ValueDecl decl) {
        super(type, ownershipKind, decl);
    }

    @Override
    public boolean isPhiArgument() {
        return true;
    }

    /**
     * 从 pred 跳入时本参数的取值；pred 不是前驱或分支参数不足时返回 null。
     *
     * <p>pred 有多条边指向本块时（例如 then/else 指向同一块的 branch），取前驱链上
     * 最先遇到的那条，即最后注册的边。需要区分时使用 {@link #getIncomingValue(SuccessorEdge)}。</p>
     */
    public MirValue getIncomingValue(BasicBlock pred) {
        if (parent == null) return null;
        for (SuccessorEdge edge : parent.getPredecessorEdges()) {
            if (edge.getSourceBlock() == pred) {
                return getIncomingValue(edge);
            }
        }
        return null;
    }

    /**
     * 沿 edge 跳入时本参数的取值；edge 不指向本块或分支参数不足时返回 null。
     */
    public MirValue getIncomingValue(SuccessorEdge edge) {
        if (parent == null || edge.getTarget() != parent) return null;
        int index = getIndex();
        List<MirValue> args = edge.getOwner().getBranchArgs(edge);
        return index < args.size() ? args.get(index) : null;
    }

    /**
     * 按前驱链顺序列出每条入边传入的值（同一前驱有多条边时出现多次）。
     */
    public List<MirValue> getIncomingValues() {
        List<MirValue> values = new ArrayList<>();
        if (parent == null) return values;
        int index = getIndex();
        for (SuccessorEdge edge : parent.getPredecessorEdges()) {
            List<MirValue> args = edge.getOwner().getBranchArgs(edge);
            if (index < args.size()) values.add(args.get(index));
        }
        return values;
    }
}
