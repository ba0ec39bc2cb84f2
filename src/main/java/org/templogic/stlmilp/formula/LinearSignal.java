package org.templogic.stlmilp.formula;

import lombok.Getter;
import org.templogic.stlmilp.core.Bounds;
import org.templogic.stlmilp.core.MilpVar;
import org.templogic.stlmilp.expressions.LinearExpression;
import org.templogic.stlmilp.symbolic.MilpModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 形如 c1*v1(t) + c2*v2(t) + ... + c0 的信号，其中 vi(t) 是模型中名为 "vi_t" 的系统变量。
 * 任一引用变量在 t 时刻不存在时，信号在 t 时刻没有定义。
 * 此类是不可变的。
 */
@Getter
public final class LinearSignal implements Signal {

    private static final Logger logger = LoggerFactory.getLogger(LinearSignal.class);

    private final String name;
    private final SortedMap<String, Double> coefficients;
    private final double constant;
    private final Bounds bounds;

    private LinearSignal(String name, Map<String, Double> coefficients, double constant, Bounds bounds) {
        this.name = Objects.requireNonNull(name, "Signal name cannot be null");
        this.bounds = Objects.requireNonNull(bounds, "Signal bounds cannot be null");
        Objects.requireNonNull(coefficients, "Coefficients map cannot be null");
        if (coefficients.isEmpty()) {
            logger.error("LinearSignal-构造函数: 信号 {} 不引用任何系统变量", name);
            throw new IllegalArgumentException("信号 " + name + " 必须至少引用一个系统变量");
        }
        this.coefficients = Collections.unmodifiableSortedMap(new TreeMap<>(coefficients));
        this.constant = constant;
        logger.debug("创建 LinearSignal: {} 范围 {}", this, bounds);
    }

    /**
     * 工厂方法：一般形式。
     */
    public static LinearSignal of(String name, Map<String, Double> coefficients, double constant, Bounds bounds) {
        return new LinearSignal(name, coefficients, constant, bounds);
    }

    /**
     * 工厂方法：信号即系统变量本身，x(t)。
     */
    public static LinearSignal of(String prefix, Bounds bounds) {
        return new LinearSignal(prefix, Map.of(prefix, 1.0), 0.0, bounds);
    }

    /**
     * 工厂方法：谓词 x > c 的鲁棒度，x(t) - c。
     */
    public static LinearSignal greaterThan(String prefix, double threshold, Bounds bounds) {
        return new LinearSignal(prefix + " > " + threshold, Map.of(prefix, 1.0), -threshold, bounds);
    }

    /**
     * 工厂方法：谓词 x < c 的鲁棒度，c - x(t)。
     */
    public static LinearSignal lessThan(String prefix, double threshold, Bounds bounds) {
        return new LinearSignal(prefix + " < " + threshold, Map.of(prefix, -1.0), threshold, bounds);
    }

    @Override
    public Optional<LinearExpression> at(MilpModel model, int t) {
        Map<MilpVar, Double> terms = new HashMap<>();
        for (Map.Entry<String, Double> entry : coefficients.entrySet()) {
            String varName = Signal.variableName(entry.getKey(), t);
            Optional<MilpVar> var = model.getVarByName(varName);
            if (var.isEmpty()) {
                logger.debug("信号 {} 在时刻 {} 没有定义：模型中不存在变量 {}", name, t, varName);
                return Optional.empty();
            }
            terms.merge(var.get(), entry.getValue(), Double::sum);
        }
        return Optional.of(LinearExpression.of(terms, constant));
    }

    @Override
    public OptionalDouble evaluate(Trace trace, int t) {
        double result = constant;
        for (Map.Entry<String, Double> entry : coefficients.entrySet()) {
            OptionalDouble v = trace.value(entry.getKey(), t);
            if (v.isEmpty()) {
                return OptionalDouble.empty();
            }
            result += entry.getValue() * v.getAsDouble();
        }
        return OptionalDouble.of(result);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LinearSignal that = (LinearSignal) o;
        return constant == that.constant && name.equals(that.name) && coefficients.equals(that.coefficients)
                && bounds.equals(that.bounds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, coefficients, constant + 0.0, bounds);
    }

    @Override
    public String toString() {
        return name;
    }
}
