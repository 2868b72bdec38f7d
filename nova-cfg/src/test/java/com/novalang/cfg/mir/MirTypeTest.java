package com.novalang.cfg.mir;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("MirType 测试")
class MirTypeTest {

    @Test
    @DisplayName("原始类型为单例且默认所有权为 TRIVIAL")
    void testPrimitives() {
        MirType[] primitives = {MirType.ofInt(), MirType.ofLong(), MirType.ofFloat(),
                MirType.ofDouble(), MirType.ofBoolean(), MirType.ofChar()};
        for (MirType type : primitives) {
            assertThat(type.isPrimitive()).as(type.toString()).isTrue();
            assertThat(OwnershipKind.defaultFor(type)).isEqualTo(OwnershipKind.TRIVIAL);
        }
        assertThat(MirType.ofDouble()).isSameAs(MirType.ofDouble());
        assertThat(MirType.ofChar().toString()).isEqualTo("char");
        assertThat(MirType.ofVoid().isVoid()).isTrue();
        assertThat(MirType.ofVoid().isPrimitive()).isFalse();
    }

    @Test
    @DisplayName("对象与数组类型按结构比较")
    void testReferenceTypes() {
        MirType str = MirType.ofObject("java/lang/String");
        MirType arr = MirType.ofArray(MirType.ofInt());

        assertThat(str).isEqualTo(MirType.ofObject("java/lang/String"));
        assertThat(str).hasSameHashCodeAs(MirType.ofObject("java/lang/String"));
        assertThat(str.getClassName()).isEqualTo("java/lang/String");
        assertThat(str.getKind()).isEqualTo(MirType.Kind.OBJECT);
        assertThat(arr).isEqualTo(MirType.ofArray(MirType.ofInt()));
        assertThat(arr).isNotEqualTo(MirType.ofArray(MirType.ofLong()));
        assertThat(arr.getElementType()).isSameAs(MirType.ofInt());
        assertThat(arr.toString()).isEqualTo("int[]");
        assertThat(OwnershipKind.defaultFor(arr)).isEqualTo(OwnershipKind.OWNED);
        assertThat(OwnershipKind.defaultFor(str)).isEqualTo(OwnershipKind.OWNED);
    }
}
