package org.templogic.stlmilp.symbolic;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Optimize;
import com.microsoft.z3.Params;
import com.microsoft.z3.Status;
import lombok.Getter;
import org.templogic.stlmilp.core.MilpVar;
import org.templogic.stlmilp.core.VarType;
import org.templogic.stlmilp.expressions.LinearConstraint;
import org.templogic.stlmilp.expressions.LinearExpression;
import org.templogic.stlmilp.expressions.RelationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * 基于 Z3 Optimize 的 MilpModel 实现。
 * 变量、约束与目标函数以 Java 对象保存，在 {@link #optimize()} 时一次性翻译为 Z3 表达式。
 * 每个实例持有一个独立的 Z3 Context，使用完毕后必须调用 {@link #close()}。
 * <p>
 * Z3 没有初始解入口，也没有线程数与数值稳定性参数；这些设置只被记录。
 */
public class Z3MilpModel implements MilpModel {

    private static final Logger logger = LoggerFactory.getLogger(Z3MilpModel.class);

    @Getter
    private final String name;
    private final Context ctx;

    // 保持插入顺序，LP 输出与 Z3 声明顺序都依赖它
    private final Map<String, MilpVar> vars;
    private final List<LinearConstraint> constraints;
    private final Map<MilpVar, Double> objective;
    private final EnumMap<SolverParameter, Number> parameters;

    @Getter
    private SolverStatus status;
    private double objectiveValue;
    private boolean closed;

    public Z3MilpModel(String name) {
        this.name = Objects.requireNonNull(name, "Model name cannot be null");
        this.ctx = new Context();
        this.vars = new LinkedHashMap<>();
        this.constraints = new ArrayList<>();
        this.objective = new LinkedHashMap<>();
        this.parameters = new EnumMap<>(SolverParameter.class);
        this.status = SolverStatus.LOADED;
        logger.info("创建 Z3MilpModel: {}", name);
    }

    @Override
    public MilpVar addVar(String varName, double lowerBound, double upperBound, VarType type) {
        checkOpen();
        Objects.requireNonNull(varName, "Variable name cannot be null");
        if (vars.containsKey(varName)) {
            logger.error("Z3MilpModel.addVar: 模型 {} 中已存在变量 {}", name, varName);
            throw new IllegalArgumentException("模型 " + name + " 中已存在变量 " + varName);
        }
        MilpVar var = MilpVar.create(vars.size(), varName, lowerBound, upperBound, type);
        vars.put(varName, var);
        logger.debug("添加变量 {}", var);
        return var;
    }

    @Override
    public LinearConstraint addConstraint(String constrName, LinearExpression lhs, RelationType relation, LinearExpression rhs) {
        checkOpen();
        checkOwnership(lhs);
        checkOwnership(rhs);
        LinearConstraint constraint = LinearConstraint.of(constrName, lhs, relation, rhs);
        constraints.add(constraint);
        return constraint;
    }

    @Override
    public void setObjectiveCoefficient(MilpVar var, double coefficient) {
        checkOpen();
        checkOwnership(var);
        if (!Double.isFinite(coefficient)) {
            logger.error("Z3MilpModel.setObjectiveCoefficient: 变量 {} 的目标系数不是有限数: {}", var.getName(), coefficient);
            throw new IllegalArgumentException("目标系数必须是有限数: " + coefficient);
        }
        if (coefficient == 0.0) {
            objective.remove(var);
        } else {
            objective.put(var, coefficient);
        }
        logger.debug("设置变量 {} 的目标系数为 {}", var.getName(), coefficient);
    }

    @Override
    public Map<MilpVar, Double> getObjective() {
        return Collections.unmodifiableMap(objective);
    }

    @Override
    public Optional<MilpVar> getVarByName(String varName) {
        return Optional.ofNullable(vars.get(varName));
    }

    @Override
    public List<MilpVar> getVars() {
        return List.copyOf(vars.values());
    }

    @Override
    public List<LinearConstraint> getConstraints() {
        return Collections.unmodifiableList(constraints);
    }

    @Override
    public void setParameter(SolverParameter parameter, Number value) {
        Objects.requireNonNull(parameter, "Parameter cannot be null");
        Objects.requireNonNull(value, "Parameter value cannot be null");
        switch (parameter) {
            case THREADS -> {
                if (value.intValue() < 1) {
                    logger.error("Z3MilpModel.setParameter: 线程数必须为正: {}", value);
                    throw new IllegalArgumentException("线程数必须为正: " + value);
                }
            }
            case TIME_LIMIT -> {
                if (!(value.doubleValue() > 0)) {
                    logger.error("Z3MilpModel.setParameter: 时间上限必须为正: {}", value);
                    throw new IllegalArgumentException("时间上限必须为正: " + value);
                }
            }
            case OUTPUT_FLAG, NUMERIC_FOCUS -> {
                if (value.intValue() < 0) {
                    logger.error("Z3MilpModel.setParameter: 参数 {} 不能为负: {}", parameter, value);
                    throw new IllegalArgumentException("参数 " + parameter + " 不能为负: " + value);
                }
            }
        }
        parameters.put(parameter, value);
        logger.debug("设置求解参数 {} = {}", parameter, value);
    }

    @Override
    public Optional<Number> getParameter(SolverParameter parameter) {
        return Optional.ofNullable(parameters.get(parameter));
    }

    @Override
    public SolverStatus optimize() {
        checkOpen();
        clearSolution();

        Z3VariableManager varManager = new Z3VariableManager(ctx, vars.values());
        Optimize opt = ctx.mkOptimize();
        applyParameters(opt);
        varManager.assertDomains(opt);
        for (LinearConstraint c : constraints) {
            opt.Add(c.toZ3BoolExpr(ctx, varManager));
        }
        logStartHints();

        LinearExpression objectiveExpr = LinearExpression.of(objective, 0.0);
        Optimize.Handle<?> handle = opt.MkMinimize(objectiveExpr.toZ3ArithExpr(ctx, varManager));

        Status z3Status = opt.Check();
        logger.debug("Z3 Optimize 返回 {}", z3Status);
        if (isVerbose()) {
            logger.info("模型 {} 的 Z3 统计信息: {}", name, opt.getStatistics());
        }

        switch (z3Status) {
            case UNSATISFIABLE -> status = SolverStatus.INFEASIBLE;
            case UNKNOWN -> {
                logger.warn("Z3 无法判定模型 {}: {}", name, opt.getReasonUnknown());
                status = SolverStatus.UNKNOWN;
            }
            case SATISFIABLE -> {
                Expr value = handle.getValue();
                if (!Z3VariableManager.isNumeral(value)) {
                    logger.debug("目标函数值不是有限数: {}", value);
                    status = SolverStatus.UNBOUNDED;
                } else {
                    com.microsoft.z3.Model model = opt.getModel();
                    for (MilpVar var : vars.values()) {
                        var.setValue(varManager.evaluate(model, var));
                    }
                    objectiveValue = objectiveExpr.evaluate();
                    status = SolverStatus.OPTIMAL;
                }
            }
        }
        logger.info("模型 {} 求解完成，状态 {}", name, status);
        return status;
    }

    private void applyParameters(Optimize opt) {
        Number timeLimit = parameters.get(SolverParameter.TIME_LIMIT);
        if (timeLimit != null) {
            Params params = ctx.mkParams();
            long millis = Math.round(timeLimit.doubleValue() * 1000.0);
            params.add("timeout", (int) Math.min(Integer.MAX_VALUE, Math.max(1L, millis)));
            opt.setParameters(params);
            logger.debug("设置 Z3 timeout 为 {} ms", millis);
        }
        for (SolverParameter ignored : List.of(SolverParameter.THREADS, SolverParameter.NUMERIC_FOCUS)) {
            if (parameters.containsKey(ignored)) {
                logger.warn("Z3 Optimize 不支持参数 {}，已忽略 (值 {})", ignored, parameters.get(ignored));
            }
        }
    }

    private boolean isVerbose() {
        Number flag = parameters.get(SolverParameter.OUTPUT_FLAG);
        return flag != null && flag.intValue() > 0;
    }

    private void logStartHints() {
        if (!logger.isDebugEnabled()) {
            return;
        }
        long hinted = vars.values().stream().filter(v -> v.getStart().isPresent()).count();
        logger.debug("模型 {} 中有 {} 个变量带有初始值提示，Z3 Optimize 不使用这些提示", name, hinted);
    }

    private void clearSolution() {
        for (MilpVar var : vars.values()) {
            var.setValue(null);
        }
        objectiveValue = Double.NaN;
        status = SolverStatus.LOADED;
    }

    @Override
    public double getObjectiveValue() {
        if (status != SolverStatus.OPTIMAL) {
            logger.error("Z3MilpModel.getObjectiveValue: 模型 {} 的状态为 {}，没有目标函数值", name, status);
            throw new IllegalStateException("模型 " + name + " 的状态为 " + status + "，没有目标函数值");
        }
        return objectiveValue;
    }

    @Override
    public void writeLp(Path path) throws IOException {
        Files.writeString(path, LpFormatWriter.write(this), StandardCharsets.UTF_8);
        logger.info("模型 {} 已写入 {}", name, path);
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            ctx.close();
            logger.debug("关闭 Z3MilpModel: {}", name);
        }
    }

    private void checkOpen() {
        if (closed) {
            logger.error("Z3MilpModel: 模型 {} 已关闭", name);
            throw new IllegalStateException("模型 " + name + " 已关闭");
        }
    }

    private void checkOwnership(LinearExpression expr) {
        Objects.requireNonNull(expr, "Expression cannot be null");
        for (MilpVar var : expr.getCoefficients().keySet()) {
            checkOwnership(var);
        }
    }

    private void checkOwnership(MilpVar var) {
        Objects.requireNonNull(var, "Variable cannot be null");
        if (vars.get(var.getName()) != var) {
            logger.error("Z3MilpModel: 变量 {} 不属于模型 {}", var.getName(), name);
            throw new IllegalArgumentException("变量 " + var.getName() + " 不属于模型 " + name);
        }
    }

    @Override
    public String toString() {
        return "Z3MilpModel{" + name + ", vars=" + vars.size() + ", constraints=" + constraints.size()
                + ", status=" + status + "}";
    }
}
