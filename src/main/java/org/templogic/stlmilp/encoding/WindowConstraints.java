package org.templogic.stlmilp.encoding;

import org.templogic.stlmilp.core.MilpVar;
import org.templogic.stlmilp.expressions.LinearExpression;
import org.templogic.stlmilp.expressions.RelationType;
import org.templogic.stlmilp.robustness.StartHint;
import org.templogic.stlmilp.symbolic.MilpModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * 直接作用于已有鲁棒度变量序列的约束，不经过公式树。
 */
public final class WindowConstraints {

    private static final Logger logger = LoggerFactory.getLogger(WindowConstraints.class);

    private WindowConstraints() {
    }

    /**
     * 添加 y = min(rho[t+a], ..., rho[t+b])。
     * @param rho 按时刻排列的鲁棒度变量。
     * @param k 不小于窗口内所有变量绝对值的上界。
     * @throws IllegalArgumentException 如果窗口非法或超出 rho 的范围。
     */
    public static MilpVar addAlways(MilpModel model, String label, int a, int b, List<MilpVar> rho, double k, int t) {
        Objects.requireNonNull(rho, "Robustness sequence cannot be null");
        int from = t + a;
        int to = t + b;
        if (a > b || from < 0 || to >= rho.size()) {
            logger.error("WindowConstraints.addAlways: 窗口 [{}, {}] (时刻 {}) 超出序列长度 {}", a, b, t, rho.size());
            throw new IllegalArgumentException("窗口 [" + a + ", " + b + "] (时刻 " + t + ") 超出序列长度 " + rho.size());
        }
        return MinMaxEncoder.addMin(model, label, rho.subList(from, to + 1), k, false, StartHint.none());
    }

    /**
     * 在目标函数中加入 weight * |var|。
     * 引入 p >= var 与 p >= -var，p 的目标系数为 weight；weight 为正时最优解中 p = |var|。
     * @return 惩罚变量 p。
     */
    public static MilpVar addPenalty(MilpModel model, String label, MilpVar var, double weight) {
        MilpVar p = model.addVar(label + "_penalty", 0.0, Double.POSITIVE_INFINITY);
        model.addConstraint(label + "_penalty_pos", LinearExpression.of(p), RelationType.GE, LinearExpression.of(var));
        model.addConstraint(label + "_penalty_neg", LinearExpression.of(p), RelationType.GE, LinearExpression.of(var, -1.0));
        model.setObjectiveCoefficient(p, weight);
        logger.debug("添加惩罚项 {} * |{}|", weight, var.getName());
        return p;
    }

    /**
     * {@link #addAlways} 之后对结果加上 {@link #addPenalty}。
     */
    public static MilpVar addAlwaysPenalized(MilpModel model, String label, int a, int b, List<MilpVar> rho,
                                             double k, double weight, int t) {
        MilpVar y = addAlways(model, label, a, b, rho, k, t);
        addPenalty(model, label, y, weight);
        return y;
    }
}
