package org.templogic.stlmilp.solve;

import org.templogic.stlmilp.symbolic.MilpModel;

/**
 * 系统动力学编码回调：在 STL 约束之前向模型加入覆盖 horizon 个时间步的系统变量与约束。
 * 信号变量须按 {@link org.templogic.stlmilp.formula.Signal#variableName(String, int)} 命名。
 */
@FunctionalInterface
public interface SystemEncoder {

    void encode(MilpModel model, int horizon);
}
