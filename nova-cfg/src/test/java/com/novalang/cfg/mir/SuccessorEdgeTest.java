package com.novalang.cfg.mir;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * 出边与前驱链的一致性测试
 */
@DisplayName("后继/前驱协议")
class SuccessorEdgeTest {

    private MirFunction fn;
    private MirBuilder builder;

    @BeforeEach
    void setUp() {
        fn = new MirFunction("cfg", MirType.ofVoid());
        builder = new MirBuilder(fn);
    }

    private static List<BasicBlock> preds(BasicBlock block) {
        List<BasicBlock> list = new ArrayList<>();
        for (BasicBlock pred : block.getPredecessorBlocks()) list.add(pred);
        return list;
    }

    private static List<SuccessorEdge> predEdges(BasicBlock block) {
        List<SuccessorEdge> list = new ArrayList<>();
        for (SuccessorEdge edge : block.getPredecessorEdges()) list.add(edge);
        return list;
    }

    @Nested
    @DisplayName("后继")
    class SuccessorTests {

        @Test
        @DisplayName("后继序列等于终止指令出边目标序列")
        void testSuccessorsReadThrough() {
            BasicBlock entry = builder.getCurrentBlock();
            BasicBlock t = builder.newBlock();
            BasicBlock e = builder.newBlock();
            MirInst cond = builder.emitConstBool(true);
            MirTerminator.Branch br = builder.emitBranch(cond, t, e);

            assertThat(entry.getSuccessors()).isEqualTo(br.getSuccessors());
            assertThat(entry.getSuccessorBlocks()).containsExactly(t, e);
            assertThat(entry.succEmpty()).isFalse();
            assertThat(entry.isSuccessorBlock(t)).isTrue();
            assertThat(entry.isSuccessorBlock(entry)).isFalse();
            assertThat(entry.getSingleSuccessorBlock()).isNull();
            for (SuccessorEdge edge : entry.getSuccessors()) {
                assertThat(predEdges(edge.getTarget())).containsOnlyOnce(edge);
                assertThat(edge.getSourceBlock()).isSameAs(entry);
            }
        }

        @Test
        @DisplayName("单后继")
        void testSingleSuccessor() {
            BasicBlock entry = builder.getCurrentBlock();
            BasicBlock next = builder.newBlock();
            builder.emitGoto(next);

            assertThat(entry.getSingleSuccessorBlock()).isSameAs(next);
        }

        @Test
        @DisplayName("return 没有后继")
        void testNoSuccessor() {
            BasicBlock entry = builder.getCurrentBlock();
            builder.emitReturn(null);

            assertThat(entry.succEmpty()).isTrue();
            assertThat(entry.getSingleSuccessorBlock()).isNull();
        }

        @Test
        @DisplayName("没有终止指令时读取后继失败")
        void testSuccessorsWithoutTerminator() {
            BasicBlock entry = builder.getCurrentBlock();
            assertThatThrownBy(entry::getSuccessors).isInstanceOf(MalformedMirException.class);
        }

        @Test
        @DisplayName("switch 出边按 case 顺序，default 最后")
        void testSwitchSuccessors() {
            BasicBlock entry = builder.getCurrentBlock();
            BasicBlock a = builder.newBlock();
            BasicBlock b = builder.newBlock();
            BasicBlock d = builder.newBlock();
            Map<Object, BasicBlock> cases = new LinkedHashMap<>();
            cases.put(1, a);
            cases.put(2, b);
            cases.put(3, a);
            MirInst key = builder.emitConstInt(2);
            MirTerminator.Switch sw = builder.emitSwitch(key, cases, d);

            assertThat(entry.getSuccessorBlocks()).containsExactly(a, b, a, d);
            assertThat(sw.getCaseValue(2)).isEqualTo(3);
            assertThat(sw.getCaseCount()).isEqualTo(3);
            assertThat(sw.getCaseBlock(1)).isSameAs(b);
            assertThat(sw.getKey()).isSameAs(key);
            assertThat(sw.getDefaultBlock()).isSameAs(d);
            assertThat(sw.getCases()).containsEntry(2, b);
            assertThat(preds(a)).containsExactly(entry, entry);
            assertThat(a.getSinglePredecessorBlock()).isNull();
        }
    }

    @Nested
    @DisplayName("前驱")
    class PredecessorTests {

        @Test
        @DisplayName("无出边指向时 predEmpty")
        void testPredEmpty() {
            BasicBlock entry = builder.getCurrentBlock();
            BasicBlock orphan = builder.newBlock();
            builder.emitReturn(null);

            assertThat(entry.predEmpty()).isTrue();
            assertThat(orphan.predEmpty()).isTrue();
            assertThat(orphan.getSinglePredecessorBlock()).isNull();
        }

        @Test
        @DisplayName("三条边指向同一块，删除一条后剩余两条按注册逆序遍历")
        void testThreeEdgesDestroyOne() {
            BasicBlock x = fn.createBlock();
            BasicBlock p1 = fn.createBlock();
            BasicBlock p2 = fn.createBlock();
            BasicBlock p3 = fn.createBlock();
            MirTerminator.Goto g1 = new MirTerminator.Goto(null, x);
            p1.pushBack(g1);
            MirTerminator.Goto g2 = new MirTerminator.Goto(null, x);
            p2.pushBack(g2);
            MirTerminator.Goto g3 = new MirTerminator.Goto(null, x);
            p3.pushBack(g3);

            assertThat(preds(x)).containsExactly(p3, p2, p1);

            p2.erase(g2);

            assertThat(preds(x)).containsExactly(p3, p1);
            assertThat(predEdges(x)).containsExactly(g3.getSuccessors().get(0), g1.getSuccessors().get(0));
            assertThat(x.isPredecessorBlock(p2)).isFalse();
            assertThat(x.isPredecessorBlock(p1)).isTrue();
        }

        @Test
        @DisplayName("恰有一条入边时返回单前驱")
        void testSinglePredecessor() {
            BasicBlock entry = builder.getCurrentBlock();
            BasicBlock next = builder.newBlock();
            builder.emitGoto(next);

            assertThat(next.getSinglePredecessorBlock()).isSameAs(entry);
            assertThat(next.isPredecessorBlock(entry)).isTrue();
        }

        @Test
        @DisplayName("同一前驱两条边时不是单前驱")
        void testTwoEdgesFromSameBlock() {
            BasicBlock next = builder.newBlock();
            MirInst cond = builder.emitConstBool(false);
            builder.emitBranch(cond, next, next);

            assertThat(preds(next)).hasSize(2);
            assertThat(next.getSinglePredecessorBlock()).isNull();
        }
    }

    @Nested
    @DisplayName("改指向")
    class RetargetTests {

        @Test
        @DisplayName("setTarget 在新旧目标前驱链之间迁移")
        void testSetTarget() {
            BasicBlock entry = builder.getCurrentBlock();
            BasicBlock a = builder.newBlock();
            BasicBlock b = builder.newBlock();
            MirTerminator.Goto jump = builder.emitGoto(a);
            SuccessorEdge edge = jump.getSuccessors().get(0);

            edge.setTarget(b);

            assertThat(a.predEmpty()).isTrue();
            assertThat(b.getSinglePredecessorBlock()).isSameAs(entry);
            assertThat(jump.getTarget()).isSameAs(b);
        }

        @Test
        @DisplayName("中间节点摘除后链保持完整")
        void testUnlinkMiddle() {
            BasicBlock x = fn.createBlock();
            List<SuccessorEdge> edges = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                BasicBlock p = fn.createBlock();
                MirTerminator.Goto g = new MirTerminator.Goto(null, x);
                p.pushBack(g);
                edges.add(g.getSuccessors().get(0));
            }

            edges.get(2).detach();
            edges.get(0).detach();

            assertThat(predEdges(x)).containsExactly(edges.get(3), edges.get(1));
            assertThat(edges.get(2).isAttached()).isFalse();
            assertThat(edges.get(2).getTarget()).isNull();
        }

        @Test
        @DisplayName("replaceSuccessor 改写所有匹配的出边")
        void testReplaceSuccessor() {
            BasicBlock a = builder.newBlock();
            BasicBlock b = builder.newBlock();
            MirInst cond = builder.emitConstBool(true);
            MirTerminator.Branch br = builder.emitBranch(cond, a, a);

            assertThat(br.replaceSuccessor(a, b)).isEqualTo(2);
            assertThat(a.predEmpty()).isTrue();
            assertThat(preds(b)).hasSize(2);
            assertThat(br.getThenBlock()).isSameAs(b);
            assertThat(br.getElseBlock()).isSameAs(b);
        }

        @Test
        @DisplayName("终止指令释放引用时断开全部出边")
        void testTerminatorDropAllReferences() {
            BasicBlock a = builder.newBlock();
            BasicBlock b = builder.newBlock();
            MirInst cond = builder.emitConstBool(true);
            MirTerminator.Branch br = builder.emitBranch(cond, a, b);

            br.dropAllReferences();

            assertThat(a.predEmpty()).isTrue();
            assertThat(b.predEmpty()).isTrue();
            assertThat(br.getSuccessorBlocks()).isEmpty();
            assertThat(br.getCondition()).isNull();
        }
    }

    @Test
    @DisplayName("branch 按出边返回对应的分支参数")
    void testBranchArgs() {
        BasicBlock t = builder.newBlock();
        BasicBlock e = builder.newBlock();
        MirInst cond = builder.emitConstBool(true);
        MirInst x = builder.emitConstInt(1);
        MirInst y = builder.emitConstInt(2);
        MirInst z = builder.emitConstInt(3);
        MirTerminator.Branch br = builder.emitBranch(cond, t, List.of(x), e, List.of(y, z));

        assertThat(br.getThenArgs()).containsExactly(x);
        assertThat(br.getElseArgs()).containsExactly(y, z);
        assertThat(br.getBranchArgs(0)).containsExactly(x);
        assertThat(br.getBranchArgs(1)).containsExactly(y, z);
        assertThat(br.getCondition()).isSameAs(cond);
    }
}
