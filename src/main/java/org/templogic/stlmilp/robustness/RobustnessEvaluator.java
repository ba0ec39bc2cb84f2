package org.templogic.stlmilp.robustness;

import org.apache.commons.lang3.tuple.Pair;
import org.templogic.stlmilp.formula.Formula;
import org.templogic.stlmilp.formula.Operator;
import org.templogic.stlmilp.formula.Trace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * 在记录的信号上直接计算 STL 公式的鲁棒度，并生成形状与编码器一致的鲁棒度树。
 * 生成的树可作为下一次求解的初始解。
 * <p>
 * 节点上的分支序号是被选中的子节点在"有定义的子节点"中的位置，
 * 与 min/max 编码中二元选择变量的顺序一致。
 */
public final class RobustnessEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(RobustnessEvaluator.class);

    private RobustnessEvaluator() {
    }

    /**
     * 计算公式在时刻 t 的鲁棒度树。
     * @param formula STL 公式。
     * @param trace 记录的信号。
     * @param t 基准时刻。
     * @return 若公式在 t 时刻没有任何有定义的部分则为空。
     */
    public static Optional<RobustnessTree> evaluate(Formula formula, Trace trace, int t) {
        Objects.requireNonNull(formula, "Formula cannot be null");
        Objects.requireNonNull(trace, "Trace cannot be null");
        return Optional.ofNullable(eval(formula, trace, t));
    }

    /**
     * @return 公式在时刻 t 的鲁棒度，没有定义时为空。
     */
    public static OptionalDouble robustness(Formula formula, Trace trace, int t) {
        return evaluate(formula, trace, t)
                .map(tree -> OptionalDouble.of(tree.getRobustness()))
                .orElse(OptionalDouble.empty());
    }

    private static RobustnessTree eval(Formula f, Trace trace, int t) {
        return switch (f.getOp()) {
            case EXPR -> {
                OptionalDouble v = f.getSignal().evaluate(trace, t);
                yield v.isPresent() ? RobustnessTree.leaf(v.getAsDouble()) : null;
            }
            case NOT -> {
                RobustnessTree child = eval(f.getArg(0), trace, t);
                yield child == null ? null : RobustnessTree.of(-child.getRobustness(), List.of(child));
            }
            case AND, OR -> {
                List<RobustnessTree> children = new ArrayList<>();
                for (Formula arg : f.getArgs()) {
                    children.add(eval(arg, trace, t));
                }
                yield combine(children, f.getOp() == Operator.AND);
            }
            case ALWAYS, EVENTUALLY -> {
                List<RobustnessTree> children = new ArrayList<>();
                for (int i = f.getWindowStart(); i <= f.getWindowEnd(); i++) {
                    children.add(eval(f.getArg(0), trace, t + i));
                }
                yield combine(children, f.getOp() == Operator.ALWAYS);
            }
            case NEXT -> eval(f.getArg(0), trace, t + 1);
        };
    }

    private static RobustnessTree combine(List<RobustnessTree> children, boolean min) {
        List<RobustnessTree> defined = new ArrayList<>();
        for (RobustnessTree child : children) {
            if (child != null) {
                defined.add(child);
            }
        }
        if (defined.isEmpty()) {
            return null;
        }
        Pair<Double, Integer> best = extremum(defined, min);
        logger.debug("{} 选中第 {} 个分支，鲁棒度 {}", min ? "min" : "max", best.getRight(), best.getLeft());
        return RobustnessTree.of(best.getLeft(), best.getRight(), children);
    }

    /**
     * @return (极值, 首个取得极值的位置)。
     */
    private static Pair<Double, Integer> extremum(List<RobustnessTree> defined, boolean min) {
        int bestIndex = 0;
        double best = defined.get(0).getRobustness();
        for (int i = 1; i < defined.size(); i++) {
            double r = defined.get(i).getRobustness();
            if (min ? r < best : r > best) {
                best = r;
                bestIndex = i;
            }
        }
        return Pair.of(best, bestIndex);
    }
}
