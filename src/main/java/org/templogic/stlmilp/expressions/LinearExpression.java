package org.templogic.stlmilp.expressions; // 放在 expressions 包下

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import org.templogic.stlmilp.core.MilpVar;
import org.templogic.stlmilp.symbolic.Z3VariableManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 代表一个关于 MILP 变量的线性表达式，形式为 c1*v1 + c2*v2 + ... + const。
 * 此类是不可变的。
 */
@Getter
public final class LinearExpression implements ToZ3ArithExpr {

    private static final Logger logger = LoggerFactory.getLogger(LinearExpression.class);

    public static final LinearExpression ZERO = new LinearExpression(Collections.emptyMap(), 0.0);

    private final SortedMap<MilpVar, Double> coefficients;

    private final double constant;

    private final int hashCode;

    /**
     * 私有构造函数。
     * @param coefficients 变量到其系数的映射。
     * @param constant 常数项。
     */
    private LinearExpression(Map<MilpVar, Double> coefficients, double constant) {
        // 拷贝并确保有序性，同时过滤掉系数为零的变量
        Map<MilpVar, Double> tempCoefficients = new HashMap<>();
        for (Map.Entry<MilpVar, Double> entry : Objects.requireNonNull(coefficients, "Coefficients map cannot be null").entrySet()) {
            MilpVar var = Objects.requireNonNull(entry.getKey(), "Variable in coefficients map cannot be null");
            Double coeff = Objects.requireNonNull(entry.getValue(), "Coefficient cannot be null");
            checkFinite(coeff);
            if (coeff != 0.0) {
                tempCoefficients.put(var, coeff);
            }
        }
        checkFinite(constant);
        this.coefficients = Collections.unmodifiableSortedMap(new TreeMap<>(tempCoefficients));
        this.constant = constant;
        this.hashCode = Objects.hash(this.coefficients, this.constant + 0.0);
    }

    private static void checkFinite(double v) {
        if (!Double.isFinite(v)) {
            logger.error("LinearExpression: 系数或常数项不是有限数: {}", v);
            throw new IllegalArgumentException("线性表达式的系数和常数项必须是有限数: " + v);
        }
    }

    /**
     * 工厂方法：创建 LinearExpression 实例。
     * @param coefficients 变量到其系数的映射。
     * @param constant 常数项。
     * @return LinearExpression 实例。
     */
    public static LinearExpression of(Map<MilpVar, Double> coefficients, double constant) {
        return new LinearExpression(coefficients, constant);
    }

    /**
     * 工厂方法：创建只包含常数项的 LinearExpression 实例。
     */
    public static LinearExpression constant(double constant) {
        return new LinearExpression(Collections.emptyMap(), constant);
    }

    /**
     * 工厂方法：创建只包含一个变量的 LinearExpression 实例 (例如 v)。
     */
    public static LinearExpression of(MilpVar var) {
        return new LinearExpression(Map.of(var, 1.0), 0.0);
    }

    /**
     * 工厂方法：创建只包含一个变量和系数的 LinearExpression 实例 (例如 2*v)。
     */
    public static LinearExpression of(MilpVar var, double coefficient) {
        return new LinearExpression(Map.of(var, coefficient), 0.0);
    }

    /**
     * 将此表达式与另一个表达式相加。
     * @param other 另一个 LinearExpression。
     * @return 相加后的新 LinearExpression。
     */
    public LinearExpression add(LinearExpression other) {
        Map<MilpVar, Double> newCoefficients = new HashMap<>(this.coefficients);
        other.coefficients.forEach((var, value) -> newCoefficients.merge(var, value, Double::sum));
        return new LinearExpression(newCoefficients, this.constant + other.constant);
    }

    /**
     * 加上 coefficient*var。
     */
    public LinearExpression add(MilpVar var, double coefficient) {
        return add(of(var, coefficient));
    }

    /**
     * 加上常数。
     */
    public LinearExpression add(double c) {
        return new LinearExpression(this.coefficients, this.constant + c);
    }

    /**
     * 将此表达式减去另一个表达式。
     * @param other 另一个 LinearExpression。
     * @return 相减后的新 LinearExpression。
     */
    public LinearExpression subtract(LinearExpression other) {
        Map<MilpVar, Double> newCoefficients = new HashMap<>(this.coefficients);
        other.coefficients.forEach((var, value) -> newCoefficients.merge(var, -value, Double::sum)); // 减去相当于加上负数
        return new LinearExpression(newCoefficients, this.constant - other.constant);
    }

    /**
     * 将此表达式乘以标量。
     */
    public LinearExpression multiply(double scalar) {
        Map<MilpVar, Double> scaled = this.coefficients.entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, entry -> entry.getValue() * scalar));
        return new LinearExpression(scaled, this.constant * scalar);
    }

    /**
     * 对此表达式取反 (乘以 -1)。
     * @return 取反后的新 LinearExpression。
     */
    public LinearExpression negate() {
        return multiply(-1.0);
    }

    public boolean isConstant() {
        return coefficients.isEmpty();
    }

    /**
     * 根据变量的求解结果计算表达式的具体数值。
     * @return 表达式的值。
     * @throws IllegalStateException 如果某个变量尚无求解结果。
     */
    public double evaluate() {
        double result = this.constant;
        for (Map.Entry<MilpVar, Double> entry : coefficients.entrySet()) {
            result += entry.getValue() * entry.getKey().getValue();
        }
        return result;
    }

    /**
     * 只输出变量部分，常数项由调用者处理。LP 文件格式使用此形式。
     */
    public String toTermString() {
        if (coefficients.isEmpty()) {
            return "0";
        }
        StringBuilder sb = new StringBuilder();
        boolean firstTerm = true;
        for (Map.Entry<MilpVar, Double> entry : coefficients.entrySet()) {
            double coeff = entry.getValue();
            if (firstTerm) {
                if (coeff < 0) {
                    sb.append("- ");
                }
            } else {
                sb.append(coeff < 0 ? " - " : " + ");
            }
            double abs = Math.abs(coeff);
            if (abs != 1.0) {
                sb.append(formatNumber(abs)).append(' ');
            }
            sb.append(entry.getKey().getName());
            firstTerm = false;
        }
        return sb.toString();
    }

    /**
     * 整数值输出为整数形式，其余按 Double.toString 输出。
     */
    public static String formatNumber(double v) {
        if (v == Math.rint(v) && Math.abs(v) < 1e15) {
            return Long.toString((long) v);
        }
        return Double.toString(v);
    }

    @Override
    public String toString() {
        if (coefficients.isEmpty()) {
            return formatNumber(constant);
        }
        StringBuilder sb = new StringBuilder(toTermString());
        if (constant > 0) {
            sb.append(" + ").append(formatNumber(constant));
        } else if (constant < 0) {
            sb.append(" - ").append(formatNumber(-constant));
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LinearExpression that = (LinearExpression) o;
        return constant == that.constant && coefficients.equals(that.coefficients);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public ArithExpr toZ3ArithExpr(Context ctx, Z3VariableManager varManager) {
        ArithExpr result = varManager.mkReal(constant);
        for (Map.Entry<MilpVar, Double> entry : coefficients.entrySet()) {
            ArithExpr varExpr = varManager.getZ3Var(entry.getKey());
            ArithExpr z3Coeff = varManager.mkReal(entry.getValue());
            result = ctx.mkAdd(result, ctx.mkMul(z3Coeff, varExpr));
        }
        return result;
    }
}
