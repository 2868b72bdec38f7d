package com.novalang.cfg.mir;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("MirBuilder 测试")
class MirBuilderTest {

    private MirFunction fn;
    private MirBuilder builder;

    @BeforeEach
    void setUp() {
        fn = new MirFunction("build", MirType.ofInt());
        builder = new MirBuilder(fn);
    }

    @Nested
    @DisplayName("插入点")
    class InsertionPointTests {

        @Test
        @DisplayName("新建构建器复用已有入口块")
        void testReuseEntryBlock() {
            BasicBlock entry = builder.getCurrentBlock();
            MirBuilder again = new MirBuilder(fn);

            assertThat(again.getCurrentBlock()).isSameAs(entry);
            assertThat(fn.getBlockCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("插在指定指令之前，连续发射保持顺序")
        void testInsertBefore() {
            BasicBlock entry = builder.getCurrentBlock();
            MirInst a = builder.emitConstInt(1);
            MirTerminator.Return ret = builder.emitReturn(a);

            builder.setInsertionPointBefore(ret);
            MirInst x = builder.emitConstInt(2);
            MirInst y = builder.emitBinary("ADD", a, x, MirType.ofInt());

            assertThat(entry.getInstructions()).containsExactly(a, x, y, ret);
            assertThat(y.getExtra()).isEqualTo("ADD");
            assertThat(y.getOperands()).containsExactly(a, x);
        }

        @Test
        @DisplayName("切换块后恢复追加到末尾")
        void testSwitchResetsInsertionPoint() {
            BasicBlock entry = builder.getCurrentBlock();
            BasicBlock next = builder.newBlock();
            MirTerminator.Goto jump = builder.emitGoto(next);
            builder.setInsertionPointBefore(jump);
            MirInst first = builder.emitConstBool(false);

            builder.switchToBlock(entry);
            MirInst last = builder.emitConstBool(true);

            assertThat(entry.getInstructions()).containsExactly(first, jump, last);
        }

        @Test
        @DisplayName("插入点指令未挂接时失败")
        void testDetachedInsertionPoint() {
            MirInst loose = new MirInst(MirOp.CONST_INT, MirType.ofInt(), null, 1, null);
            assertThatThrownBy(() -> builder.setInsertionPointBefore(loose))
                    .isInstanceOf(MalformedMirException.class);
        }

        @Test
        @DisplayName("newBlockAfter 插在指定块之后")
        void testNewBlockAfter() {
            BasicBlock entry = builder.getCurrentBlock();
            BasicBlock exit = builder.newBlock();
            BasicBlock middle = builder.newBlockAfter(entry);

            assertThat(fn.getBlocks()).containsExactly(entry, middle, exit);
        }
    }

    @Test
    @DisplayName("at 设置之后指令的源码位置")
    void testSourceLocation() {
        SourceLocation loc = new SourceLocation("main.nova", 3, 5);
        MirInst before = builder.emitConstInt(0);
        MirInst located = builder.at(loc).emitConstInt(1);
        MirInst reset = builder.at(null).emitConstInt(2);

        assertThat(before.getLocation().isUnknown()).isTrue();
        assertThat(located.getLocation()).isSameAs(loc);
        assertThat(located.getLocation().isUnknown()).isFalse();
        assertThat(located.getLocation().toString()).isEqualTo("main.nova:3:5");
        assertThat(reset.getLocation()).isSameAs(SourceLocation.UNKNOWN);
    }

    @Test
    @DisplayName("throw 结束函数且没有后继")
    void testThrow() {
        BasicBlock entry = builder.getCurrentBlock();
        FunctionArgument error = entry.createFunctionArgument(MirType.ofObject("java/lang/Throwable"),
                new ValueDecl("e"));
        MirTerminator.Throw th = builder.emitThrow(error);

        assertThat(th.getKind()).isEqualTo(MirTerminator.Kind.THROW);
        assertThat(th.getException()).isSameAs(error);
        assertThat(entry.succEmpty()).isTrue();
        assertThat(th.toString()).isEqualTo("throw %B0.e");
    }
}
