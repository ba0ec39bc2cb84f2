package org.templogic.stlmilp.symbolic;

import org.templogic.stlmilp.core.MilpVar;
import org.templogic.stlmilp.expressions.LinearConstraint;
import org.templogic.stlmilp.expressions.LinearExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 将 MilpModel 输出为 CPLEX LP 文本格式，仅用于诊断。
 */
public final class LpFormatWriter {

    private static final Logger logger = LoggerFactory.getLogger(LpFormatWriter.class);

    private LpFormatWriter() {
    }

    public static String write(MilpModel model) {
        StringBuilder sb = new StringBuilder();
        sb.append("\\ Model ").append(model.getName()).append('\n');
        sb.append("\\ LP format - for model browsing.\n");

        sb.append("Minimize\n");
        LinearExpression objective = LinearExpression.of(model.getObjective(), 0.0);
        sb.append(" obj:");
        if (!objective.isConstant()) {
            sb.append(' ').append(objective.toTermString());
        }
        sb.append('\n');

        sb.append("Subject To\n");
        for (LinearConstraint c : model.getConstraints()) {
            if (c.getLeftExpr().isConstant()) {
                // LP 格式不接受没有变量的约束
                sb.append("\\ ").append(c).append('\n');
                continue;
            }
            sb.append(' ').append(c).append('\n');
        }

        sb.append("Bounds\n");
        for (MilpVar var : model.getVars()) {
            if (var.isBinary()) {
                continue;
            }
            sb.append(' ').append(formatBounds(var)).append('\n');
        }

        List<MilpVar> binaries = model.getVars().stream().filter(MilpVar::isBinary).collect(Collectors.toList());
        if (!binaries.isEmpty()) {
            sb.append("Binaries\n");
            for (MilpVar var : binaries) {
                sb.append(' ').append(var.getName()).append('\n');
            }
        }
        sb.append("End\n");
        logger.debug("输出模型 {} 的 LP 文本，{} 个变量，{} 个约束", model.getName(), model.numVars(), model.numConstraints());
        return sb.toString();
    }

    private static String formatBounds(MilpVar var) {
        double lb = var.getLowerBound();
        double ub = var.getUpperBound();
        if (lb == Double.NEGATIVE_INFINITY && ub == Double.POSITIVE_INFINITY) {
            return var.getName() + " free";
        }
        if (lb == ub) {
            return var.getName() + " = " + LinearExpression.formatNumber(lb);
        }
        return formatBound(lb) + " <= " + var.getName() + " <= " + formatBound(ub);
    }

    private static String formatBound(double v) {
        if (v == Double.NEGATIVE_INFINITY) {
            return "-infinity";
        }
        if (v == Double.POSITIVE_INFINITY) {
            return "+infinity";
        }
        return LinearExpression.formatNumber(v);
    }
}
