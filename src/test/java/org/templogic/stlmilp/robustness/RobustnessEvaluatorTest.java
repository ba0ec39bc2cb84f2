package org.templogic.stlmilp.robustness;

import org.templogic.stlmilp.core.Bounds;
import org.templogic.stlmilp.formula.Formula;
import org.templogic.stlmilp.formula.LinearSignal;
import org.templogic.stlmilp.formula.Trace;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.OptionalDouble;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class RobustnessEvaluatorTest {

    // --- Test Setup ---
    private static Formula x;
    private static Trace trace;

    @BeforeAll
    static void setUp() {
        x = Formula.expr(LinearSignal.of("x", Bounds.of(-10, 10)));
        trace = Trace.of("x", 1, -2, 3, 0, 5, -1);
    }

    @Nested
    @DisplayName("鲁棒度 (Robustness)")
    class RobustnessTests {

        @Test
        @DisplayName("always[0,2] x 在 t=0 为 -2，在 t=2 为 0")
        void testAlways() {
            Formula f = Formula.always(0, 2, x);
            assertAll(
                    () -> assertEquals(OptionalDouble.of(-2.0), RobustnessEvaluator.robustness(f, trace, 0)),
                    () -> assertEquals(OptionalDouble.of(0.0), RobustnessEvaluator.robustness(f, trace, 2))
            );
        }

        @Test
        @DisplayName("eventually[0,1] x 在 t=3 为 5")
        void testEventually() {
            assertEquals(OptionalDouble.of(5.0), RobustnessEvaluator.robustness(Formula.eventually(0, 1, x), trace, 3));
        }

        @Test
        @DisplayName("not 取反，next 向后移动一步")
        void testNotAndNext() {
            assertAll(
                    () -> assertEquals(OptionalDouble.of(-1.0), RobustnessEvaluator.robustness(Formula.not(x), trace, 0)),
                    () -> assertEquals(OptionalDouble.of(-2.0), RobustnessEvaluator.robustness(Formula.next(x), trace, 0)),
                    () -> assertEquals(OptionalDouble.of(1.0),
                            RobustnessEvaluator.robustness(Formula.not(Formula.not(x)), trace, 0))
            );
        }

        @Test
        @DisplayName("and、or 取子公式的 min、max")
        void testAndOr() {
            Formula nextX = Formula.next(x);
            assertAll(
                    () -> assertEquals(OptionalDouble.of(-2.0), RobustnessEvaluator.robustness(Formula.and(x, nextX), trace, 0)),
                    () -> assertEquals(OptionalDouble.of(1.0), RobustnessEvaluator.robustness(Formula.or(x, nextX), trace, 0))
            );
        }

        @Test
        @DisplayName("窗口完全超出记录时没有定义，部分超出时只看有定义的部分")
        void testOutOfRange() {
            assertAll(
                    () -> assertTrue(RobustnessEvaluator.robustness(Formula.always(10, 12, x), trace, 0).isEmpty()),
                    () -> assertEquals(OptionalDouble.of(-1.0),
                            RobustnessEvaluator.robustness(Formula.always(0, 3, x), trace, 4))
            );
        }
    }

    @Nested
    @DisplayName("鲁棒度树 (Tree shape)")
    class TreeTests {

        @Test
        @DisplayName("always 的树为窗口内每个偏移一个子节点，序号指向最小值")
        void testAlwaysTree() {
            RobustnessTree tree = RobustnessEvaluator.evaluate(Formula.always(0, 2, x), trace, 0).orElseThrow();
            assertAll(
                    () -> assertEquals(-2.0, tree.getRobustness()),
                    () -> assertEquals(Integer.valueOf(1), tree.getIndex()),
                    () -> assertEquals(3, tree.size()),
                    () -> assertEquals(RobustnessTree.leaf(3.0), tree.getChild(2))
            );
        }

        @Test
        @DisplayName("没有定义的子节点以 null 占位，序号只在有定义的子节点中计数")
        void testUndefinedChildren() {
            // t=4 时 x_4=5, x_5=-1, x_6、x_7 没有定义
            RobustnessTree tree = RobustnessEvaluator.evaluate(Formula.always(0, 3, x), trace, 4).orElseThrow();
            assertAll(
                    () -> assertEquals(4, tree.size()),
                    () -> assertEquals(Arrays.asList(RobustnessTree.leaf(5.0), RobustnessTree.leaf(-1.0), null, null),
                            tree.getChildren()),
                    () -> assertEquals(Integer.valueOf(1), tree.getIndex())
            );
        }

        @Test
        @DisplayName("并列极值取第一个")
        void testTieBreak_ShouldPickFirst() {
            Trace flat = Trace.of("x", 2, 2, 2);
            RobustnessTree tree = RobustnessEvaluator.evaluate(Formula.eventually(0, 2, x), flat, 0).orElseThrow();
            assertEquals(Integer.valueOf(0), tree.getIndex());
        }

        @Test
        @DisplayName("not 节点有一个子节点，next 不占节点")
        void testNotAndNextShape() {
            RobustnessTree notTree = RobustnessEvaluator.evaluate(Formula.not(Formula.next(x)), trace, 0).orElseThrow();
            assertEquals(RobustnessTree.of(2.0, List.of(RobustnessTree.leaf(-2.0))), notTree);
        }
    }

    @Nested
    @DisplayName("初始解提示 (StartHint)")
    class StartHintTests {

        @Test
        @DisplayName("三种提示状态")
        void testHintKinds() {
            StartHint none = RobustnessTree.hintOf(null);
            StartHint value = RobustnessTree.leaf(1.5).toStartHint();
            StartHint indexed = RobustnessTree.of(-2.0, 1, List.of()).toStartHint();
            assertAll(
                    () -> assertEquals(StartHint.Kind.NONE, none.getKind()),
                    () -> assertFalse(none.isPresent()),
                    () -> assertTrue(none.getValue().isEmpty()),
                    () -> assertEquals(StartHint.Kind.VALUE, value.getKind()),
                    () -> assertEquals(OptionalDouble.of(1.5), value.getValue()),
                    () -> assertTrue(value.getIndex().isEmpty()),
                    () -> assertEquals(StartHint.Kind.VALUE_WITH_INDEX, indexed.getKind()),
                    () -> assertEquals(OptionalInt.of(1), indexed.getIndex())
            );
        }

        @Test
        @DisplayName("非法提示应抛出异常")
        void testInvalidHints_ShouldThrow() {
            assertAll(
                    () -> assertThrows(IllegalArgumentException.class, () -> StartHint.of(Double.NaN)),
                    () -> assertThrows(IllegalArgumentException.class, () -> StartHint.of(1.0, -1)),
                    () -> assertThrows(IllegalArgumentException.class, () -> RobustnessTree.of(1.0, -1, List.of()))
            );
        }
    }
}
