package org.templogic.stlmilp.symbolic;

import org.templogic.stlmilp.core.MilpVar;
import org.templogic.stlmilp.core.VarType;
import org.templogic.stlmilp.expressions.LinearConstraint;
import org.templogic.stlmilp.expressions.LinearExpression;
import org.templogic.stlmilp.expressions.RelationType;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * STL 编码所依赖的 MILP 建模接口。
 * 目标函数总是最小化 sum(c_i * v_i)。
 * 实现不要求线程安全；一个模型在一次构建与求解过程中只由一个调用者持有。
 */
public interface MilpModel extends AutoCloseable {

    String getName();

    /**
     * 添加一个决策变量。
     * @param name 变量名，在模型内唯一。
     * @param lowerBound 下界。
     * @param upperBound 上界。
     * @param type 变量类型。
     * @return 新变量。
     * @throws IllegalArgumentException 如果变量名重复或上下界非法。
     */
    MilpVar addVar(String name, double lowerBound, double upperBound, VarType type);

    default MilpVar addVar(String name, double lowerBound, double upperBound) {
        return addVar(name, lowerBound, upperBound, VarType.CONTINUOUS);
    }

    default MilpVar addBinaryVar(String name) {
        return addVar(name, 0.0, 1.0, VarType.BINARY);
    }

    /**
     * 添加线性约束 lhs ~ rhs。
     * @throws IllegalArgumentException 如果约束引用了不属于本模型的变量。
     */
    LinearConstraint addConstraint(String name, LinearExpression lhs, RelationType relation, LinearExpression rhs);

    /**
     * 设置变量在目标函数中的系数，系数为 0 时移除该项。
     */
    void setObjectiveCoefficient(MilpVar var, double coefficient);

    Map<MilpVar, Double> getObjective();

    Optional<MilpVar> getVarByName(String name);

    List<MilpVar> getVars();

    List<LinearConstraint> getConstraints();

    default int numVars() {
        return getVars().size();
    }

    default int numBinVars() {
        return (int) getVars().stream().filter(MilpVar::isBinary).count();
    }

    default int numConstraints() {
        return getConstraints().size();
    }

    void setParameter(SolverParameter parameter, Number value);

    Optional<Number> getParameter(SolverParameter parameter);

    /**
     * 求解模型。求解结果通过 {@link #getStatus()} 与各变量的 {@link MilpVar#getValue()} 读取。
     * @return 求解状态。
     */
    SolverStatus optimize();

    SolverStatus getStatus();

    /**
     * @throws IllegalStateException 如果状态不是 OPTIMAL。
     */
    double getObjectiveValue();

    /**
     * 以 LP 文件格式输出模型。
     */
    void writeLp(Path path) throws IOException;

    @Override
    void close();
}
