package org.templogic.stlmilp.formula;

import org.templogic.stlmilp.core.Bounds;
import org.templogic.stlmilp.core.MilpVar;
import org.templogic.stlmilp.expressions.LinearExpression;
import org.templogic.stlmilp.symbolic.MilpModel;
import org.templogic.stlmilp.symbolic.Z3MilpModel;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

class FormulaTest {

    // --- Test Setup ---
    private static Bounds bounds;
    private static Formula x;

    @BeforeAll
    static void setUp() {
        bounds = Bounds.of(-10, 10);
        x = Formula.expr(LinearSignal.of("x", bounds));
    }

    @Nested
    @DisplayName("公式结构 (Structure)")
    class StructureTests {

        @Test
        @DisplayName("工厂方法检查子公式个数与时间窗口")
        void testFactories_WithInvalidArguments_ShouldThrow() {
            assertAll(
                    () -> assertThrows(IllegalArgumentException.class, () -> Formula.and(List.of())),
                    () -> assertThrows(IllegalArgumentException.class, () -> Formula.or()),
                    () -> assertThrows(IllegalArgumentException.class, () -> Formula.always(3, 2, x)),
                    () -> assertThrows(IllegalArgumentException.class, () -> Formula.eventually(-1, 2, x)),
                    () -> assertThrows(NullPointerException.class, () -> Formula.not(null))
            );
        }

        @Test
        @DisplayName("相同结构的公式相等")
        void testEquals_WithSameStructure() {
            Formula f1 = Formula.always(0, 2, Formula.not(x));
            Formula f2 = Formula.always(0, 2, Formula.not(Formula.expr(LinearSignal.of("x", bounds))));
            assertAll(
                    () -> assertNotSame(f1, f2),
                    () -> assertEquals(f1, f2),
                    () -> assertEquals(f1.hashCode(), f2.hashCode()),
                    () -> assertNotEquals(f1, Formula.eventually(0, 2, Formula.not(x)))
            );
        }

        @Test
        @DisplayName("窗口大小为 b - a + 1")
        void testWindowSize() {
            assertAll(
                    () -> assertEquals(3, Formula.always(1, 3, x).windowSize()),
                    () -> assertEquals(1, Formula.eventually(2, 2, x).windowSize()),
                    () -> assertEquals(0, Formula.and(x, x).windowSize())
            );
        }

        @Test
        @DisplayName("字符串形式")
        void testToString() {
            Formula f = Formula.always(0, 2, Formula.and(x, Formula.next(x)));
            assertEquals("alw_[0, 2] ((x) and next (x))", f.toString());
        }
    }

    @Nested
    @DisplayName("时间跨度 (Horizon)")
    class HorizonTests {

        @Test
        @DisplayName("叶子为 0，NOT 不改变跨度")
        void testHorizon_LeafAndNot() {
            assertAll(
                    () -> assertEquals(0, x.horizon()),
                    () -> assertEquals(0, Formula.not(x).horizon())
            );
        }

        @Test
        @DisplayName("always[0,3] next x 的跨度为 4")
        void testHorizon_AlwaysOfNext() {
            assertEquals(4, Formula.always(0, 3, Formula.next(x)).horizon());
        }

        @Test
        @DisplayName("AND、OR 取子公式跨度的最大值")
        void testHorizon_AndOr_ShouldTakeMax() {
            Formula f = Formula.or(Formula.eventually(1, 5, x), Formula.and(Formula.next(Formula.next(x)), x));
            assertEquals(5, f.horizon());
        }

        @Test
        @DisplayName("嵌套时序算子的跨度相加")
        void testHorizon_Nested() {
            Formula f = Formula.eventually(0, 2, Formula.always(1, 3, x));
            assertEquals(5, f.horizon());
        }
    }

    @Nested
    @DisplayName("信号 (Signal)")
    class SignalTests {

        @Test
        @DisplayName("信号在模型中找到变量时得到线性表达式")
        void testAt_WithExistingVariables() {
            LinearSignal diff = LinearSignal.of("x - y", Map.of("x", 1.0, "y", -1.0), 0.5, bounds);
            try (MilpModel m = new Z3MilpModel("signal")) {
                MilpVar x2 = m.addVar("x_2", -5, 5);
                MilpVar y2 = m.addVar("y_2", -5, 5);
                m.addVar("x_3", -5, 5);

                Optional<LinearExpression> at2 = diff.at(m, 2);
                assertAll(
                        () -> assertEquals(Optional.of(LinearExpression.of(x2).add(y2, -1.0).add(0.5)), at2),
                        () -> assertTrue(diff.at(m, 3).isEmpty(), "y_3 不存在，信号没有定义"),
                        () -> assertTrue(diff.at(m, 0).isEmpty())
                );
            }
        }

        @Test
        @DisplayName("谓词信号的符号约定")
        void testPredicates() {
            Trace trace = Trace.of("x", 1.0, 4.0);
            assertAll(
                    () -> assertEquals(OptionalDouble.of(-1.0), LinearSignal.greaterThan("x", 2.0, bounds).evaluate(trace, 0)),
                    () -> assertEquals(OptionalDouble.of(-2.0), LinearSignal.lessThan("x", 2.0, bounds).evaluate(trace, 1)),
                    () -> assertTrue(LinearSignal.of("x", bounds).evaluate(trace, 2).isEmpty())
            );
        }

        @Test
        @DisplayName("信号必须引用至少一个变量")
        void testOf_WithoutVariables_ShouldThrow() {
            assertThrows(IllegalArgumentException.class, () -> LinearSignal.of("c", Map.of(), 1.0, bounds));
        }

        @Test
        @DisplayName("变量命名为 前缀_时刻")
        void testVariableName() {
            assertEquals("x_12", Signal.variableName("x", 12));
        }
    }

    @Test
    @DisplayName("Trace 超出记录范围时没有取值")
    void testTrace_OutOfRange() {
        Trace trace = Trace.of(Map.of("x", new double[]{1, 2}, "y", new double[]{3}));
        assertAll(
                () -> assertEquals(2, trace.length("x")),
                () -> assertEquals(0, trace.length("z")),
                () -> assertTrue(trace.value("y", 1).isEmpty()),
                () -> assertTrue(trace.value("x", -1).isEmpty()),
                () -> assertEquals(OptionalDouble.of(3.0), trace.value("y", 0))
        );
    }
}
