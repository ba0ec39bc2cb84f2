package org.templogic.stlmilp.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BoundsTest {

    @Nested
    @DisplayName("构造 (Construction)")
    class ConstructionTests {

        @Test
        @DisplayName("合法区间可以创建")
        void testOf_WithValidInterval_ShouldCreate() {
            Bounds b = Bounds.of(-1, 3);
            assertAll(
                    () -> assertEquals(-1.0, b.getLo()),
                    () -> assertEquals(3.0, b.getHi()),
                    () -> assertEquals(3.0, b.magnitude())
            );
        }

        @Test
        @DisplayName("lo > hi 时应抛出异常")
        void testOf_WithReversedInterval_ShouldThrow() {
            assertThrows(IllegalArgumentException.class, () -> Bounds.of(2, 1));
        }

        @Test
        @DisplayName("端点不是有限数时应抛出异常")
        void testOf_WithInfiniteEndpoint_ShouldThrow() {
            assertAll(
                    () -> assertThrows(IllegalArgumentException.class, () -> Bounds.of(Double.NEGATIVE_INFINITY, 0)),
                    () -> assertThrows(IllegalArgumentException.class, () -> Bounds.of(0, Double.NaN))
            );
        }

        @Test
        @DisplayName("symmetric 使用绝对值")
        void testSymmetric_WithNegativeMagnitude_ShouldUseAbsoluteValue() {
            assertEquals(Bounds.of(-4, 4), Bounds.symmetric(-4));
        }
    }

    @Nested
    @DisplayName("区间运算 (Operations)")
    class OperationTests {

        @Test
        @DisplayName("combine 取所有端点绝对值的最大值")
        void testCombine_ShouldReturnSymmetricMaxMagnitude() {
            Bounds combined = Bounds.combine(List.of(Bounds.of(-1, 3), Bounds.of(0, 5), Bounds.of(-7, -2)));
            assertEquals(Bounds.of(-7, 7), combined);
        }

        @Test
        @DisplayName("combine 与子区间的顺序无关")
        void testCombine_ShouldBeOrderIndependent() {
            Bounds a = Bounds.of(-1, 3);
            Bounds b = Bounds.of(0, 5);
            assertEquals(Bounds.combine(List.of(a, b)), Bounds.combine(List.of(b, a)));
        }

        @Test
        @DisplayName("combine 单个子区间时结果包含该子区间")
        void testCombine_WithSingleChild_ShouldContainChild() {
            Bounds child = Bounds.of(2, 6);
            Bounds combined = Bounds.combine(List.of(child));
            assertAll(
                    () -> assertTrue(combined.contains(child.getLo())),
                    () -> assertTrue(combined.contains(child.getHi())),
                    () -> assertEquals(6.0, combined.magnitude())
            );
        }

        @Test
        @DisplayName("combine 空集合时应抛出异常")
        void testCombine_WithEmptyCollection_ShouldThrow() {
            assertThrows(IllegalArgumentException.class, () -> Bounds.combine(List.of()));
        }

        @Test
        @DisplayName("negate 返回 [-hi, -lo] 且不改变 magnitude")
        void testNegate_ShouldMirrorInterval() {
            Bounds b = Bounds.of(-1, 3);
            Bounds negated = b.negate();
            assertAll(
                    () -> assertEquals(Bounds.of(-3, 1), negated),
                    () -> assertEquals(b.magnitude(), negated.magnitude()),
                    () -> assertEquals(b, negated.negate())
            );
        }

        @Test
        @DisplayName("-0.0 与 0.0 视为相等")
        void testEquals_WithSignedZero_ShouldBeEqual() {
            Bounds zero = Bounds.of(0, 0);
            Bounds negated = zero.negate();
            assertAll(
                    () -> assertEquals(zero, negated),
                    () -> assertEquals(zero.hashCode(), negated.hashCode())
            );
        }
    }
}
