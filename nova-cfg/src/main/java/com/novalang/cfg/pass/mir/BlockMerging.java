package com.novalang.cfg.pass.mir;

import com.novalang.cfg.mir.*;
import com.novalang.cfg.pass.MirPass;

import java.util.List;
import java.util.logging.Logger;

/**
 * MIR 优化：合并单前驱/单后继基本块。
 * 如果块 A 以无参 goto 跳到块 B，且 B 的唯一前驱是 A、B 没有参数，则把 B 并入 A。
 */
public class BlockMerging implements MirPass {

    private static final Logger LOG = Logger.getLogger(BlockMerging.class.getName());

    @Override
    public String getName() {
        return "BlockMerging";
    }

    @Override
    public MirModule run(MirModule module) {
        for (MirFunction func : module.getFunctions()) {
            int merged = mergeBlocks(func);
            if (merged > 0) {
                LOG.fine(func.getName() + ": 合并基本块 " + merged + " 次");
            }
        }
        return module;
    }

    /**
     * @return 合并次数
     */
    int mergeBlocks(MirFunction func) {
        List<BasicBlock> blocks = func.getBlocks();
        int merged = 0;

        // 合并后回到当前块重新检查（可能链式合并）
        for (int i = 0; i < blocks.size(); i++) {
            BasicBlock block = blocks.get(i);
            if (!block.hasTerminator()) continue;
            MirTerminator term = block.getTerminator();
            if (term.getKind() != MirTerminator.Kind.GOTO) continue;

            MirTerminator.Goto jump = (MirTerminator.Goto) term;
            BasicBlock target = jump.getTarget();
            if (target == null || target == block) continue;
            if (target.isEntry()) continue;
            if (target.getSinglePredecessorBlock() != block) continue;
            if (!target.argsEmpty() || !jump.getArgs().isEmpty()) continue;

            // 合并：A 删除 goto 后吸收 B 的全部指令（含 B 的终止指令）
            block.erase(jump);
            block.spliceAtEnd(target);
            target.eraseFromParent();
            merged++;

            i = func.indexOf(block) - 1;
        }
        return merged;
    }
}
