package org.templogic.stlmilp.expressions; // 放在 expressions 包下

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import org.templogic.stlmilp.symbolic.Z3VariableManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 代表一个线性约束，形式为 E1 ~ E2，其中 E1 和 E2 都是关于 MILP 变量的线性表达式。
 * 内部规范化为 E_normalized ~ 0 的形式。
 * 此类是不可变的。
 */
@Getter
public final class LinearConstraint implements ToZ3BoolExpr {

    private static final Logger logger = LoggerFactory.getLogger(LinearConstraint.class);

    private final String name;
    // 规范化后的形式：leftExpr ~ 0
    private final LinearExpression leftExpr; // 规范化后的左侧表达式 (E1 - E2)
    private final RelationType relation;

    private final int hashCode;

    /**
     * 私有构造函数，用于创建 LinearConstraint 实例。
     * 内部会进行规范化：将 E1 ~ E2 转换为 E_normalized ~ 0。
     *
     * @param name     约束名称。
     * @param left     原始左侧表达式。
     * @param right    原始右侧表达式。
     * @param relation 原始关系类型。
     * @throws NullPointerException 如果任何参数为 null。
     */
    private LinearConstraint(String name, LinearExpression left, LinearExpression right, RelationType relation) {
        this.name = Objects.requireNonNull(name, "LinearConstraint-构造函数: name 不能为 null");
        Objects.requireNonNull(left, "LinearConstraint-构造函数: left 表达式不能为 null");
        Objects.requireNonNull(right, "LinearConstraint-构造函数: right 表达式不能为 null");
        this.relation = Objects.requireNonNull(relation, "LinearConstraint-构造函数: relation 不能为 null");

        // E1 ~ E2  =>  (E1 - E2) ~ 0
        this.leftExpr = left.subtract(right);

        // 检查自身矛盾或恒真
        if (this.leftExpr.isConstant()) {
            if (relation.holds(this.leftExpr.getConstant(), 0.0)) {
                logger.info("LinearConstraint-构造函数: 创建了一个恒真约束: {}", this);
            } else {
                logger.warn("LinearConstraint-构造函数: 创建了一个恒假约束: {}", this);
            }
        }
        this.hashCode = Objects.hash(this.name, this.leftExpr, this.relation);
        logger.debug("创建 LinearConstraint: {}", this);
    }

    /**
     * 工厂方法：创建 LinearConstraint 实例。
     * @param name     约束名称。
     * @param left     左侧表达式。
     * @param relation 关系类型。
     * @param right    右侧表达式。
     * @return LinearConstraint 实例。
     */
    public static LinearConstraint of(String name, LinearExpression left, RelationType relation, LinearExpression right) {
        return new LinearConstraint(name, left, right, relation);
    }

    /**
     * 判断约束在当前求解结果下是否成立。
     * @param tolerance 数值容差。
     * @throws IllegalStateException 如果某个变量尚无求解结果。
     */
    public boolean isSatisfied(double tolerance) {
        return relation.holds(leftExpr.evaluate(), tolerance);
    }

    @Override
    public BoolExpr toZ3BoolExpr(Context ctx, Z3VariableManager varManager) {
        ArithExpr z3LeftExpr = leftExpr.toZ3ArithExpr(ctx, varManager);
        ArithExpr z3Zero = ctx.mkReal(0);

        return switch (relation) {
            case LE -> ctx.mkLe(z3LeftExpr, z3Zero);
            case GE -> ctx.mkGe(z3LeftExpr, z3Zero);
            case EQ -> ctx.mkEq(z3LeftExpr, z3Zero);
        };
    }

    // --- Object 方法 ---
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LinearConstraint that = (LinearConstraint) o;
        // 由于构造函数已规范化，直接比较字段即可
        return relation == that.relation && name.equals(that.name) && leftExpr.equals(that.leftExpr);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return name + ": " + leftExpr.toTermString() + " " + relation.getSymbol() + " "
                + LinearExpression.formatNumber(-leftExpr.getConstant());
    }
}
