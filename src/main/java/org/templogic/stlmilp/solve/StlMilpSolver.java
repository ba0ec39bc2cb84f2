package org.templogic.stlmilp.solve;

import org.templogic.stlmilp.core.MilpVar;
import org.templogic.stlmilp.encoding.StlEncoder;
import org.templogic.stlmilp.encoding.StlEncoding;
import org.templogic.stlmilp.formula.Formula;
import org.templogic.stlmilp.robustness.RobustnessTree;
import org.templogic.stlmilp.symbolic.MilpModel;
import org.templogic.stlmilp.symbolic.SolverParameter;
import org.templogic.stlmilp.symbolic.SolverStatus;
import org.templogic.stlmilp.symbolic.Z3MilpModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 构建完整的 MILP 模型 (系统约束 + STL 约束)，设置目标函数与求解参数，调用一次求解。
 * 每次调用都创建新的模型，返回后模型归调用者所有，由调用者关闭。
 */
public final class StlMilpSolver {

    private static final Logger logger = LoggerFactory.getLogger(StlMilpSolver.class);

    public static final String MODEL_NAME = "rhc_system";
    public static final String SPEC_LABEL = "spec";
    public static final String LP_FILE = "out.lp";
    public static final String VARS_FILE = "out_vars.txt";

    private final Function<String, MilpModel> modelFactory;

    public StlMilpSolver() {
        this(Z3MilpModel::new);
    }

    /**
     * @param modelFactory 按名称创建空模型。
     */
    public StlMilpSolver(Function<String, MilpModel> modelFactory) {
        this.modelFactory = Objects.requireNonNull(modelFactory, "Model factory cannot be null");
    }

    /**
     * 公式需要系统信号覆盖的时间步数。
     * @return max(0, horizon) + 1；没有公式时为 0。
     */
    public static int horizonOf(Formula spec) {
        return spec == null ? 0 : Math.max(0, spec.horizon()) + 1;
    }

    /**
     * 构建并求解。
     * @param spec STL 公式，可为 null (只求解系统约束)。
     * @param systemEncoder 系统动力学编码。
     * @param specObjective 顶层鲁棒度变量的目标系数；模型最小化目标，传 -1 即最大化鲁棒度。
     * @param startTree 初始解鲁棒度树，可为 null。
     * @param options 求解配置。
     * @return 求解后的模型，状态不是 OPTIMAL 时同样返回。
     * @throws IllegalStateException 如果公式在整个时域上都没有定义。
     * @throws IllegalArgumentException 如果鲁棒度树形状与公式不一致。
     */
    public MilpModel buildAndSolve(Formula spec, SystemEncoder systemEncoder, double specObjective,
                                   RobustnessTree startTree, SolverOptions options) {
        Objects.requireNonNull(systemEncoder, "System encoder cannot be null");
        Objects.requireNonNull(options, "Options cannot be null");

        int hd = horizonOf(spec);
        MilpModel m = modelFactory.apply(MODEL_NAME);
        try {
            logger.debug("添加系统约束，时域 {}", hd);
            systemEncoder.encode(m, hd);
            if (spec != null) {
                logger.debug("添加 STL 约束: {}", spec);
                if (startTree != null) {
                    logger.debug("使用初始鲁棒度树");
                }
                Optional<StlEncoding> encoding = new StlEncoder(m).encode(SPEC_LABEL, spec, 0, startTree);
                if (encoding.isEmpty()) {
                    logger.error("StlMilpSolver: 公式 {} 在时域 {} 内没有任何有定义的信号", spec, hd);
                    throw new IllegalStateException("公式 " + spec + " 在时域 " + hd + " 内没有任何有定义的信号");
                }
                m.setObjectiveCoefficient(encoding.get().getVar(), specObjective);
            }
            applyOptions(m, options);

            if (options.isLogFiles()) {
                writeLp(m, options.getOutputDirectory());
            }
            logger.debug("开始求解 MILP：{} 个变量 ({} 个二元)，{} 个约束",
                    m.numVars(), m.numBinVars(), m.numConstraints());
            SolverStatus status = m.optimize();
            logger.debug("求解结束");
            if (options.isLogFiles()) {
                writeVars(m, options.getOutputDirectory());
            }
            if (!status.isOptimal()) {
                logger.warn("MILP 求解状态: {}", status);
            }
        } catch (RuntimeException e) {
            m.close();
            throw e;
        }
        return m;
    }

    private static void applyOptions(MilpModel m, SolverOptions options) {
        if (options.getOutputFlag() != null) {
            m.setParameter(SolverParameter.OUTPUT_FLAG, options.getOutputFlag());
        }
        if (options.getNumericFocus() != null) {
            m.setParameter(SolverParameter.NUMERIC_FOCUS, options.getNumericFocus());
        }
        if (options.getThreads() != null) {
            m.setParameter(SolverParameter.THREADS, options.getThreads());
        }
        if (options.getTimeLimitSeconds() != null) {
            m.setParameter(SolverParameter.TIME_LIMIT, options.getTimeLimitSeconds());
        }
    }

    /**
     * 诊断文件只用于观察，写入失败时记录警告并继续求解。
     */
    private static void writeLp(MilpModel m, Path dir) {
        try {
            Files.createDirectories(dir);
            m.writeLp(dir.resolve(LP_FILE));
        } catch (IOException e) {
            logger.warn("写入 {} 失败: {}", dir.resolve(LP_FILE), e.getMessage());
        }
    }

    private static void writeVars(MilpModel m, Path dir) {
        String listing = m.getVars().stream()
                .map(MilpVar::toString)
                .collect(Collectors.joining(System.lineSeparator(), "", System.lineSeparator()));
        try {
            Files.createDirectories(dir);
            Files.writeString(dir.resolve(VARS_FILE), listing, StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.warn("写入 {} 失败: {}", dir.resolve(VARS_FILE), e.getMessage());
        }
    }
}
