package org.templogic.stlmilp.formula;

import org.templogic.stlmilp.core.Bounds;
import org.templogic.stlmilp.expressions.LinearExpression;
import org.templogic.stlmilp.symbolic.MilpModel;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * STL 原子表达式所引用的离散时间信号。
 * 信号的取值由系统动力学编码预先放入模型的变量决定，编码器只读取这些变量。
 */
public interface Signal {

    /**
     * 系统变量在时刻 t 的命名规则。
     */
    static String variableName(String prefix, int t) {
        return prefix + "_" + t;
    }

    String getName();

    /**
     * @return 信号的声明取值范围。
     */
    Bounds getBounds();

    /**
     * 获取信号在时刻 t 对应的线性表达式。
     * @param model 已包含系统变量的模型。
     * @param t 时刻。
     * @return 若信号在 t 时刻没有定义则为空。
     */
    Optional<LinearExpression> at(MilpModel model, int t);

    /**
     * 在记录的信号上求值。
     * @return 若信号在 t 时刻没有定义则为空。
     */
    OptionalDouble evaluate(Trace trace, int t);
}
