package com.novalang.cfg.pass.mir;

import com.novalang.cfg.mir.BasicBlock;
import com.novalang.cfg.mir.MirFunction;
import com.novalang.cfg.mir.MirModule;
import com.novalang.cfg.pass.MirPass;

import java.util.*;
import java.util.logging.Logger;

/**
 * MIR 优化：删除不可达基本块。
 * 从 entry block 开始做可达性分析，移除所有不可达的块。
 */
public class DeadBlockElimination implements MirPass {

    private static final Logger LOG = Logger.getLogger(DeadBlockElimination.class.getName());

    @Override
    public String getName() {
        return "DeadBlockElimination";
    }

    @Override
    public MirModule run(MirModule module) {
        for (MirFunction func : module.getFunctions()) {
            int removed = eliminateDeadBlocks(func);
            if (removed > 0) {
                LOG.fine(func.getName() + ": 删除不可达块 " + removed + " 个");
            }
        }
        return module;
    }

    /**
     * @return 删除的块数
     */
    int eliminateDeadBlocks(MirFunction func) {
        List<BasicBlock> blocks = func.getBlocks();
        if (blocks.size() <= 1) return 0;

        // 从 entry block 开始 BFS 找可达块
        Set<BasicBlock> reachable = new HashSet<>();
        Queue<BasicBlock> worklist = new ArrayDeque<>();
        BasicBlock entry = blocks.get(0);
        reachable.add(entry);
        worklist.add(entry);

        while (!worklist.isEmpty()) {
            BasicBlock block = worklist.poll();
            if (!block.hasTerminator()) continue;
            for (BasicBlock successor : block.getSuccessorBlocks()) {
                if (reachable.add(successor)) {
                    worklist.add(successor);
                }
            }
        }

        List<BasicBlock> dead = new ArrayList<>();
        for (BasicBlock block : blocks) {
            if (!reachable.contains(block)) dead.add(block);
        }
        // 不可达块只会被不可达块引用：先整体断开出边，再逐个删除
        for (BasicBlock block : dead) {
            block.dropAllReferences();
        }
        for (BasicBlock block : dead) {
            block.eraseFromParent();
        }
        return dead.size();
    }
}
