package org.templogic.stlmilp.encoding;

import org.templogic.stlmilp.core.MilpVar;
import org.templogic.stlmilp.expressions.LinearExpression;
import org.templogic.stlmilp.expressions.RelationType;
import org.templogic.stlmilp.robustness.StartHint;
import org.templogic.stlmilp.symbolic.MilpModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * 用 big-M 方法线性编码 y = min(x_1..x_n) 或 y = max(x_1..x_n)。
 * <p>
 * 对每个 x_i 引入二元选择变量 b_i，sum(b_i) = 1。以 min 为例：
 * <pre>
 *   y &lt;= x_i                    对所有 i
 *   y &gt;= x_i - M * (1 - b_i)    对所有 i
 * </pre>
 * 被选中的分支上两式合为 y = x_i，其余分支第二式被 M 放松。
 * 所有 x_i 与 y 都在 [-K, K] 内，故有符号时取 M = 2K，非负时取 M = K。
 */
public final class MinMaxEncoder {

    private static final Logger logger = LoggerFactory.getLogger(MinMaxEncoder.class);

    public enum Kind {
        MIN("min"),
        MAX("max");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }

    private MinMaxEncoder() {
    }

    public static MilpVar addMin(MilpModel model, String label, List<MilpVar> args, double k,
                                 boolean nonNegative, StartHint hint) {
        return add(model, label, Kind.MIN, args, k, nonNegative, hint);
    }

    public static MilpVar addMax(MilpModel model, String label, List<MilpVar> args, double k,
                                 boolean nonNegative, StartHint hint) {
        return add(model, label, Kind.MAX, args, k, nonNegative, hint);
    }

    /**
     * 添加 y = min/max(args) 的编码。
     * @param model 目标模型。
     * @param label y 的变量名，也是辅助变量与约束名的前缀。
     * @param kind MIN 或 MAX。
     * @param args 参与比较的变量，不能为空。
     * @param k 不小于所有参数绝对值的上界。
     * @param nonNegative 参数是否都非负。
     * @param hint y 与选择变量的初始解提示。
     * @return 新变量 y。
     * @throws IllegalArgumentException 如果参数为空、K 非法，或提示中的分支序号越界。
     */
    public static MilpVar add(MilpModel model, String label, Kind kind, List<MilpVar> args, double k,
                              boolean nonNegative, StartHint hint) {
        Objects.requireNonNull(model, "Model cannot be null");
        Objects.requireNonNull(label, "Label cannot be null");
        Objects.requireNonNull(kind, "Kind cannot be null");
        Objects.requireNonNull(args, "Arguments cannot be null");
        Objects.requireNonNull(hint, "Start hint cannot be null");
        if (args.isEmpty()) {
            logger.error("MinMaxEncoder.add: {} 没有参数", label);
            throw new IllegalArgumentException(label + ": " + kind.getLabel() + " 编码至少需要一个参数");
        }
        if (!Double.isFinite(k) || k < 0) {
            logger.error("MinMaxEncoder.add: {} 的 K 非法: {}", label, k);
            throw new IllegalArgumentException(label + ": K 必须是非负有限数，实际为 " + k);
        }
        OptionalInt startIndex = hint.getIndex();
        if (startIndex.isPresent() && startIndex.getAsInt() >= args.size()) {
            logger.error("MinMaxEncoder.add: {} 的初始分支序号 {} 超出参数个数 {}", label, startIndex.getAsInt(), args.size());
            throw new IllegalArgumentException(label + ": 初始分支序号 " + startIndex.getAsInt()
                    + " 超出参数个数 " + args.size());
        }

        double bigM = nonNegative ? k : 2 * k;
        MilpVar y = model.addVar(label, nonNegative ? 0.0 : -k, k);
        hint.getValue().ifPresent(y::setStart);

        List<MilpVar> selectors = new ArrayList<>(args.size());
        for (int i = 0; i < args.size(); i++) {
            MilpVar b = model.addBinaryVar(label + "_" + kind.getLabel() + i);
            if (startIndex.isPresent()) {
                b.setStart(i == startIndex.getAsInt() ? 1.0 : 0.0);
            }
            selectors.add(b);
        }

        LinearExpression yExpr = LinearExpression.of(y);
        LinearExpression selected = LinearExpression.ZERO;
        for (int i = 0; i < args.size(); i++) {
            MilpVar x = args.get(i);
            MilpVar b = selectors.get(i);
            String prefix = label + "_" + kind.getLabel() + i;
            // x_i -/+ M * (1 - b_i)
            LinearExpression relaxed = kind == Kind.MIN
                    ? LinearExpression.of(x).add(b, bigM).add(-bigM)
                    : LinearExpression.of(x).add(b, -bigM).add(bigM);
            if (kind == Kind.MIN) {
                model.addConstraint(prefix + "_ub", yExpr, RelationType.LE, LinearExpression.of(x));
                model.addConstraint(prefix + "_lb", yExpr, RelationType.GE, relaxed);
            } else {
                model.addConstraint(prefix + "_lb", yExpr, RelationType.GE, LinearExpression.of(x));
                model.addConstraint(prefix + "_ub", yExpr, RelationType.LE, relaxed);
            }
            selected = selected.add(b, 1.0);
        }
        model.addConstraint(label + "_" + kind.getLabel() + "_sel", selected, RelationType.EQ, LinearExpression.constant(1.0));

        logger.debug("添加 {} = {}({} 个参数)，K = {}，M = {}", label, kind.getLabel(), args.size(), k, bigM);
        return y;
    }
}
