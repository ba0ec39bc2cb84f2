package org.templogic.stlmilp.expressions;

import org.templogic.stlmilp.core.MilpVar;
import org.templogic.stlmilp.core.VarType;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LinearExpressionTest {

    // --- Test Setup ---
    private static MilpVar x, y;

    @BeforeAll
    static void setUp() {
        x = MilpVar.create(0, "x", -10, 10, VarType.CONTINUOUS);
        y = MilpVar.create(1, "y", -10, 10, VarType.CONTINUOUS);
    }

    @Nested
    @DisplayName("线性表达式 (LinearExpression)")
    class ExpressionTests {

        @Test
        @DisplayName("系数为零的变量被过滤")
        void testOf_WithZeroCoefficient_ShouldDropVariable() {
            LinearExpression expr = LinearExpression.of(Map.of(x, 0.0, y, 2.0), 1.0);
            assertAll(
                    () -> assertFalse(expr.getCoefficients().containsKey(x)),
                    () -> assertEquals(2.0, expr.getCoefficients().get(y)),
                    () -> assertEquals(1.0, expr.getConstant())
            );
        }

        @Test
        @DisplayName("相加后相同变量的系数合并，抵消为零的项被移除")
        void testAddAndSubtract_ShouldMergeCoefficients() {
            LinearExpression e1 = LinearExpression.of(x, 2.0).add(y, 1.0).add(3.0);
            LinearExpression e2 = LinearExpression.of(y).add(1.0);

            LinearExpression diff = e1.subtract(e2);
            assertAll(
                    () -> assertEquals(LinearExpression.of(x, 2.0).add(2.0), diff),
                    () -> assertEquals(e1, diff.add(e2))
            );
        }

        @Test
        @DisplayName("取反对每一项与常数项都取反")
        void testNegate_ShouldFlipAllSigns() {
            LinearExpression expr = LinearExpression.of(x, 2.0).add(y, -1.0).add(4.0);
            LinearExpression negated = expr.negate();
            assertAll(
                    () -> assertEquals(-2.0, negated.getCoefficients().get(x)),
                    () -> assertEquals(1.0, negated.getCoefficients().get(y)),
                    () -> assertEquals(-4.0, negated.getConstant()),
                    () -> assertEquals(LinearExpression.ZERO, expr.add(negated))
            );
        }

        @Test
        @DisplayName("非有限系数应抛出异常")
        void testOf_WithInfiniteCoefficient_ShouldThrow() {
            assertThrows(IllegalArgumentException.class, () -> LinearExpression.of(x, Double.POSITIVE_INFINITY));
        }

        @Test
        @DisplayName("字符串形式按变量顺序输出")
        void testToString_ShouldFormatTerms() {
            LinearExpression expr = LinearExpression.of(y, -1.0).add(x, 2.5).add(-3.0);
            assertAll(
                    () -> assertEquals("2.5 x - y - 3", expr.toString()),
                    () -> assertEquals("2.5 x - y", expr.toTermString()),
                    () -> assertEquals("0", LinearExpression.ZERO.toTermString()),
                    () -> assertEquals("0", LinearExpression.ZERO.toString())
            );
        }
    }

    @Nested
    @DisplayName("线性约束 (LinearConstraint)")
    class ConstraintTests {

        @Test
        @DisplayName("约束规范化为 (lhs - rhs) ~ 0")
        void testOf_ShouldNormalizeToZeroRightHandSide() {
            LinearConstraint c = LinearConstraint.of("c1", LinearExpression.of(x), RelationType.LE,
                    LinearExpression.of(y).add(2.0));
            assertAll(
                    () -> assertEquals(LinearExpression.of(x).add(y, -1.0).add(-2.0), c.getLeftExpr()),
                    () -> assertEquals(RelationType.LE, c.getRelation()),
                    () -> assertEquals("c1: x - y <= 2", c.toString())
            );
        }

        @Test
        @DisplayName("约束在变量取值下的可满足性判断")
        void testIsSatisfied_ShouldUseVariableValues() {
            MilpVar a = MilpVar.create(0, "a", 0, 5, VarType.CONTINUOUS);
            MilpVar b = MilpVar.create(1, "b", 0, 5, VarType.CONTINUOUS);
            a.setValue(1.0);
            b.setValue(3.0);

            LinearConstraint le = LinearConstraint.of("le", LinearExpression.of(a), RelationType.LE, LinearExpression.of(b));
            LinearConstraint ge = LinearConstraint.of("ge", LinearExpression.of(a), RelationType.GE, LinearExpression.of(b));
            LinearConstraint eq = LinearConstraint.of("eq", LinearExpression.of(a, 3.0), RelationType.EQ, LinearExpression.of(b));
            assertAll(
                    () -> assertTrue(le.isSatisfied(1e-9)),
                    () -> assertFalse(ge.isSatisfied(1e-9)),
                    () -> assertTrue(eq.isSatisfied(1e-9))
            );
        }

        @Test
        @DisplayName("RelationType.flip 交换方向")
        void testRelationFlip() {
            assertAll(
                    () -> assertEquals(RelationType.GE, RelationType.LE.flip()),
                    () -> assertEquals(RelationType.LE, RelationType.GE.flip()),
                    () -> assertEquals(RelationType.EQ, RelationType.EQ.flip())
            );
        }
    }
}
