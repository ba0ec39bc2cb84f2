package org.templogic.stlmilp.encoding;

import org.templogic.stlmilp.core.Bounds;
import org.templogic.stlmilp.core.MilpVar;
import org.templogic.stlmilp.expressions.LinearExpression;
import org.templogic.stlmilp.expressions.RelationType;
import org.templogic.stlmilp.formula.Formula;
import org.templogic.stlmilp.formula.Operator;
import org.templogic.stlmilp.robustness.RobustnessTree;
import org.templogic.stlmilp.robustness.StartHint;
import org.templogic.stlmilp.symbolic.MilpModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 将 STL 公式递归编码为 MILP 约束，返回顶层鲁棒度变量。
 * <p>
 * 编码自底向上进行。EXPR 的信号在某时刻没有定义时返回空；AND、OR、ALWAYS、EVENTUALLY 跳过为空的子节点，
 * 全部为空时自身也为空，且不创建任何变量。
 * <p>
 * 可选的鲁棒度树与公式并行下降，用于设置初始解；树存在时会校验其形状，不一致立即报错。
 * 编码器只向模型添加变量和约束，从不修改已有内容。每次构建模型都应使用新的实例。
 */
public final class StlEncoder {

    private static final Logger logger = LoggerFactory.getLogger(StlEncoder.class);

    private final MilpModel model;

    public StlEncoder(MilpModel model) {
        this.model = Objects.requireNonNull(model, "Model cannot be null");
    }

    /**
     * 在时刻 0 编码公式，不使用初始解。
     */
    public Optional<StlEncoding> encode(String label, Formula formula) {
        return encode(label, formula, 0, null);
    }

    /**
     * 在时刻 t 编码公式 f。
     * @param label 变量名前缀。
     * @param f STL 公式。
     * @param t 基准时刻。
     * @param tree 与 f 形状一致的鲁棒度树，可为 null。
     * @return 顶层鲁棒度变量及其范围；若 f 在 t 时刻没有任何有定义的部分则为空。
     * @throws IllegalArgumentException 如果鲁棒度树的形状与公式不一致。
     */
    public Optional<StlEncoding> encode(String label, Formula f, int t, RobustnessTree tree) {
        Objects.requireNonNull(label, "Label cannot be null");
        Objects.requireNonNull(f, "Formula cannot be null");
        return switch (f.getOp()) {
            case EXPR -> encodeExpr(label, f, t, tree);
            case NOT -> encodeNot(label, f, t, tree);
            case AND, OR -> encodeAndOr(label, f, t, tree);
            case ALWAYS, EVENTUALLY -> encodeAlwaysEventually(label, f, t, tree);
            case NEXT -> encode(label, f.getArg(0), t + 1, tree);
        };
    }

    private Optional<StlEncoding> encodeExpr(String label, Formula f, int t, RobustnessTree tree) {
        checkShape(tree, 0, label, f, t);
        Optional<LinearExpression> expr = f.getSignal().at(model, t);
        if (expr.isEmpty()) {
            return Optional.empty();
        }
        Bounds bounds = f.getSignal().getBounds();
        MilpVar y = model.addVar(label, bounds.getLo(), bounds.getHi());
        RobustnessTree.hintOf(tree).getValue().ifPresent(y::setStart);
        model.addConstraint(label + "_def", LinearExpression.of(y), RelationType.EQ, expr.get());
        logger.debug("编码 {} 在时刻 {}: {} 范围 {}", f, t, label, bounds);
        return Optional.of(StlEncoding.of(y, bounds));
    }

    private Optional<StlEncoding> encodeNot(String label, Formula f, int t, RobustnessTree tree) {
        checkShape(tree, 1, label, f, t);
        RobustnessTree childTree = tree == null ? null : tree.getChild(0);
        Formula child = f.getArg(0);
        if (child.getOp() == Operator.NOT) {
            // not not f = f，直接下降两层
            checkShape(childTree, 1, label, child, t);
            RobustnessTree grandTree = childTree == null ? null : childTree.getChild(0);
            logger.debug("消去双重否定: {}", f);
            return encode(label, child.getArg(0), t, grandTree);
        }
        Optional<StlEncoding> x = encode(label + "_not", child, t, childTree);
        if (x.isEmpty()) {
            return Optional.empty();
        }
        Bounds bounds = x.get().getBounds().negate();
        MilpVar y = model.addVar(label, bounds.getLo(), bounds.getHi());
        RobustnessTree.hintOf(tree).getValue().ifPresent(y::setStart);
        model.addConstraint(label + "_neg", LinearExpression.of(y), RelationType.EQ,
                LinearExpression.of(x.get().getVar(), -1.0));
        logger.debug("编码 not 在时刻 {}: {} 范围 {}", t, label, bounds);
        return Optional.of(StlEncoding.of(y, bounds));
    }

    private Optional<StlEncoding> encodeAndOr(String label, Formula f, int t, RobustnessTree tree) {
        checkShape(tree, f.getArgs().size(), label, f, t);
        List<StlEncoding> collected = new ArrayList<>();
        for (int i = 0; i < f.getArgs().size(); i++) {
            RobustnessTree childTree = tree == null ? null : tree.getChild(i);
            encode(label + "_" + f.getOp().getLabel() + i, f.getArg(i), t, childTree).ifPresent(collected::add);
        }
        MinMaxEncoder.Kind kind = f.getOp() == Operator.AND ? MinMaxEncoder.Kind.MIN : MinMaxEncoder.Kind.MAX;
        return combine(label, kind, collected, tree, f, t);
    }

    private Optional<StlEncoding> encodeAlwaysEventually(String label, Formula f, int t, RobustnessTree tree) {
        int a = f.getWindowStart();
        int b = f.getWindowEnd();
        checkShape(tree, f.windowSize(), label, f, t);
        List<StlEncoding> collected = new ArrayList<>();
        for (int i = a; i <= b; i++) {
            RobustnessTree childTree = tree == null ? null : tree.getChild(i - a);
            encode(label + "_" + f.getOp().getLabel() + i, f.getArg(0), t + i, childTree).ifPresent(collected::add);
        }
        MinMaxEncoder.Kind kind = f.getOp() == Operator.ALWAYS ? MinMaxEncoder.Kind.MIN : MinMaxEncoder.Kind.MAX;
        return combine(label, kind, collected, tree, f, t);
    }

    private Optional<StlEncoding> combine(String label, MinMaxEncoder.Kind kind, List<StlEncoding> collected,
                                          RobustnessTree tree, Formula f, int t) {
        if (collected.isEmpty()) {
            logger.debug("{} 在时刻 {} 没有任何有定义的子节点", label, t);
            return Optional.empty();
        }
        List<MilpVar> vars = new ArrayList<>(collected.size());
        List<Bounds> boundsList = new ArrayList<>(collected.size());
        for (StlEncoding e : collected) {
            vars.add(e.getVar());
            boundsList.add(e.getBounds());
        }
        Bounds bounds = Bounds.combine(boundsList);
        StartHint hint = RobustnessTree.hintOf(tree);
        MilpVar y;
        try {
            y = MinMaxEncoder.add(model, label, kind, vars, bounds.magnitude(), false, hint);
        } catch (IllegalArgumentException e) {
            logger.error("StlEncoder: 编码 {} (节点 {}，时刻 {}) 失败", f.getOp(), label, t);
            throw new IllegalArgumentException("编码 " + f.getOp() + " 节点 " + label + " (时刻 " + t + ") 失败: "
                    + e.getMessage(), e);
        }
        logger.debug("编码 {} 在时刻 {}: {} 范围 {}", f.getOp(), t, label, bounds);
        return Optional.of(StlEncoding.of(y, bounds));
    }

    private static void checkShape(RobustnessTree tree, int expected, String label, Formula f, int t) {
        if (tree != null && tree.size() != expected) {
            logger.error("StlEncoder: 鲁棒度树形状不一致，节点 {} ({}，时刻 {}) 需要 {} 个子节点，实际为 {}",
                    label, f.getOp(), t, expected, tree.size());
            throw new IllegalArgumentException("鲁棒度树形状不一致：节点 " + label + " (" + f.getOp() + "，时刻 " + t
                    + ") 需要 " + expected + " 个子节点，实际为 " + tree.size());
        }
    }
}
