package com.novalang.cfg.pass.mir;

import com.novalang.cfg.mir.*;
import com.novalang.cfg.pass.MirPass;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * 拆分关键边：源块有多个后继、目标块有多个前驱的边。
 *
 * <p>在源块之后插入一个中转块，中转块复制目标块的参数列表并以 goto 原样转发，
 * 原边改指向中转块。分支参数与参数的位置对应关系保持不变。</p>
 */
public class CriticalEdgeSplitting implements MirPass {

    private static final Logger LOG = Logger.getLogger(CriticalEdgeSplitting.class.getName());

    @Override
    public String getName() {
        return "CriticalEdgeSplitting";
    }

    @Override
    public MirModule run(MirModule module) {
        for (MirFunction func : module.getFunctions()) {
            int split = splitCriticalEdges(func);
            if (split > 0) {
                LOG.fine(func.getName() + ": 拆分关键边 " + split + " 条");
            }
        }
        return module;
    }

    /**
     * @return 拆分的边数
     */
    int splitCriticalEdges(MirFunction func) {
        int split = 0;
        for (BasicBlock block : new ArrayList<>(func.getBlocks())) {
            if (!block.hasTerminator()) continue;
            MirTerminator term = block.getTerminator();
            if (term.getNumSuccessors() < 2) continue;

            for (SuccessorEdge edge : term.getSuccessors()) {
                BasicBlock target = edge.getTarget();
                if (target == null || target.isEntry() || countPredecessors(target) < 2) continue;
                splitEdge(func, edge);
                split++;
            }
        }
        return split;
    }

    /**
     * 在 edge 上插入中转块并返回该块。
     */
    public static BasicBlock splitEdge(MirFunction func, SuccessorEdge edge) {
        BasicBlock source = edge.getSourceBlock();
        BasicBlock target = edge.getTarget();
        BasicBlock middle = func.createBlockAfter(source);
        middle.cloneArgumentList(target);
        List<MirValue> forwarded = new ArrayList<MirValue>(middle.getArguments());
        middle.pushBack(new MirTerminator.Goto(edge.getOwner().getLocation(), target, forwarded));
        edge.setTarget(middle);
        return middle;
    }

    private static int countPredecessors(BasicBlock block) {
        int count = 0;
        for (SuccessorEdge ignored : block.getPredecessorEdges()) {
            count++;
        }
        return count;
    }
}
