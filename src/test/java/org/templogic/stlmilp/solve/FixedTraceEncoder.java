package org.templogic.stlmilp.solve;

import org.templogic.stlmilp.core.Bounds;
import org.templogic.stlmilp.core.MilpVar;
import org.templogic.stlmilp.expressions.LinearExpression;
import org.templogic.stlmilp.expressions.RelationType;
import org.templogic.stlmilp.formula.Signal;
import org.templogic.stlmilp.formula.Trace;
import org.templogic.stlmilp.symbolic.MilpModel;

/**
 * 测试用系统编码：把记录的信号固定为模型中的 "名称_t" 变量。
 */
public class FixedTraceEncoder implements SystemEncoder {

    private final Trace trace;
    private final Bounds bounds;

    public FixedTraceEncoder(Trace trace, Bounds bounds) {
        this.trace = trace;
        this.bounds = bounds;
    }

    @Override
    public void encode(MilpModel model, int horizon) {
        for (String name : trace.getNames()) {
            int steps = Math.min(horizon, trace.length(name));
            for (int t = 0; t < steps; t++) {
                MilpVar v = model.addVar(Signal.variableName(name, t), bounds.getLo(), bounds.getHi());
                model.addConstraint(v.getName() + "_fix", LinearExpression.of(v), RelationType.EQ,
                        LinearExpression.constant(trace.value(name, t).getAsDouble()));
            }
        }
    }
}
