package com.novalang.cfg.pass;

import com.novalang.cfg.mir.BasicBlock;
import com.novalang.cfg.mir.MalformedMirException;
import com.novalang.cfg.mir.MirArgument;
import com.novalang.cfg.mir.MirFunction;
import com.novalang.cfg.mir.MirInst;
import com.novalang.cfg.mir.MirModule;
import com.novalang.cfg.mir.MirTerminator;
import com.novalang.cfg.mir.SuccessorEdge;

import java.util.ArrayList;
import java.util.List;

/**
 * MIR 结构校验。
 *
 * <p>检查终止指令位置、指令/参数的所属关系、入口块与非入口块的参数种类、
 * 出边与前驱链的一致性，以及分支参数个数与目标块参数个数是否相等。</p>
 */
public final class MirVerifier {

    private MirVerifier() {
    }

    /**
     * 校验函数，返回发现的全部问题（为空表示结构完整）。
     */
    public static List<String> verify(MirFunction fn) {
        List<String> problems = new ArrayList<>();
        BasicBlock entry = fn.getEntryBlock();
        for (BasicBlock block : fn.getBlocks()) {
            String where = fn.getName() + ":B" + block.getId();
            if (block.getParent() != fn) {
                problems.add(where + " 所属函数引用错误");
            }
            checkInstructions(block, where, problems);
            checkArguments(block, block == entry, where, problems);
            if (block.hasTerminator()) {
                checkSuccessors(fn, block, where, problems);
            }
            checkPredecessors(fn, block, where, problems);
        }
        return problems;
    }

    public static List<String> verify(MirModule module) {
        List<String> problems = new ArrayList<>();
        for (MirFunction fn : module.getFunctions()) {
            problems.addAll(verify(fn));
        }
        return problems;
    }

    /**
     * 校验函数，有问题时抛出异常，消息中列出全部问题。
     */
    public static void verifyOrThrow(MirFunction fn) {
        List<String> problems = verify(fn);
        if (!problems.isEmpty()) {
            throw new MalformedMirException("MIR 校验失败:\n  " + String.join("\n  ", problems));
        }
    }

    private static void checkInstructions(BasicBlock block, String where, List<String> problems) {
        if (block.isEmpty()) {
            problems.add(where + " 是空基本块");
            return;
        }
        int last = block.size() - 1;
        for (int i = 0; i <= last; i++) {
            MirInst inst = block.getInstructions().get(i);
            if (inst.getParent() != block) {
                problems.add(where + " 指令 #" + i + " 的所属块引用错误");
            }
            if (inst.isTerminator() && i != last) {
                problems.add(where + " 终止指令出现在块中间 #" + i + ": " + inst);
            }
        }
        if (!block.hasTerminator()) {
            problems.add(where + " 缺少终止指令");
        }
    }

    private static void checkArguments(BasicBlock block, boolean isEntry, String where, List<String> problems) {
        List<MirArgument> args = block.getArguments();
        for (int i = 0; i < args.size(); i++) {
            MirArgument arg = args.get(i);
            if (arg.getParent() != block || arg.getIndex() != i) {
                problems.add(where + " 参数 #" + i + " 的所属块或位置错误");
            }
            if (isEntry && arg.isPhiArgument()) {
                problems.add(where + " 入口块含 PHI 参数 #" + i);
            } else if (!isEntry && arg.isFunctionArgument()) {
                problems.add(where + " 非入口块含函数参数 #" + i);
            }
        }
    }

    private static void checkSuccessors(MirFunction fn, BasicBlock block, String where, List<String> problems) {
        MirTerminator term = block.getTerminator();
        for (SuccessorEdge edge : term.getSuccessors()) {
            BasicBlock target = edge.getTarget();
            if (target == null) {
                problems.add(where + " 存在已断开的出边");
                continue;
            }
            if (target.getParent() != fn) {
                problems.add(where + " 出边指向其他函数的块 B" + target.getId());
            }
            int seen = 0;
            for (SuccessorEdge pred : target.getPredecessorEdges()) {
                if (pred == edge) seen++;
            }
            if (seen != 1) {
                problems.add(where + " 出边在 B" + target.getId() + " 的前驱链中出现 " + seen + " 次");
            }
            int passed = term.getBranchArgs(edge).size();
            if (passed != target.getNumArguments()) {
                problems.add(where + " 传给 B" + target.getId() + " 的参数个数 " + passed
                        + " 与其参数个数 " + target.getNumArguments() + " 不符");
            }
        }
    }

    private static void checkPredecessors(MirFunction fn, BasicBlock block, String where, List<String> problems) {
        for (SuccessorEdge edge : block.getPredecessorEdges()) {
            if (edge.getTarget() != block) {
                problems.add(where + " 前驱链中的边并不指向本块");
            }
            BasicBlock source = edge.getSourceBlock();
            if (source == null || source.getParent() != fn) {
                problems.add(where + " 前驱链中的边来自已摘除或其他函数的终止指令");
            } else if (!source.hasTerminator() || source.getTerminator() != edge.getOwner()) {
                problems.add(where + " 前驱 B" + source.getId() + " 的边不属于其当前终止指令");
            }
        }
    }
}
