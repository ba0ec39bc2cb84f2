package org.templogic.stlmilp.symbolic;

import com.microsoft.z3.AlgebraicNum;
import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntExpr;
import com.microsoft.z3.IntNum;
import com.microsoft.z3.Optimize;
import com.microsoft.z3.RatNum;
import lombok.Getter;
import org.templogic.stlmilp.core.MilpVar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.*;

/**
 * 负责管理 MilpVar 对象到 Z3 ArithExpr 变量的映射。
 * 连续变量映射为 Z3 实数常量；二元变量映射为 Z3 整数常量，并通过 to_real 以实数形式参与线性表达式。
 * 每次求解都新建一个实例，不在求解之间共享。
 */
@Getter
public class Z3VariableManager {

    private static final Logger logger = LoggerFactory.getLogger(Z3VariableManager.class);

    private final Context ctx;
    // 以实数形式出现在约束中的项
    private final Map<MilpVar, ArithExpr> z3Terms;
    // 二元变量对应的原始整数常量
    private final Map<MilpVar, IntExpr> z3IntVars;

    private final List<MilpVar> allKnownVars;

    /**
     * 构造函数。
     * @param ctx Z3 Context 实例。
     * @param allVars 模型中的全部变量。
     */
    public Z3VariableManager(Context ctx, Collection<MilpVar> allVars) {
        this.ctx = Objects.requireNonNull(ctx, "Z3 Context cannot be null.");
        this.allKnownVars = List.copyOf(allVars);
        this.z3Terms = new HashMap<>();
        this.z3IntVars = new HashMap<>();

        // 预先创建所有变量，保证 Z3 中的声明顺序与模型一致
        for (MilpVar var : allKnownVars) {
            getZ3Var(var);
        }
        logger.debug("Z3VariableManager 初始化完成，管理 {} 个变量。", allKnownVars.size());
    }

    /**
     * 获取指定 MilpVar 对应的 Z3 实数项。
     * 如果变量尚未创建，则会创建并缓存。
     * @param var MilpVar 对象。
     * @return 对应的 Z3 ArithExpr。
     */
    public ArithExpr getZ3Var(MilpVar var) {
        return z3Terms.computeIfAbsent(var, v -> {
            if (v.isBinary()) {
                IntExpr intVar = ctx.mkIntConst(v.getName());
                z3IntVars.put(v, intVar);
                logger.debug("创建 Z3 二元变量: {}", v.getName());
                return ctx.mkInt2Real(intVar);
            }
            logger.debug("创建 Z3 实数变量: {}", v.getName());
            return ctx.mkRealConst(v.getName());
        });
    }

    /**
     * 将有限的 double 转换为 Z3 实数常量。
     */
    public ArithExpr mkReal(double value) {
        if (!Double.isFinite(value)) {
            logger.error("非法调用Z3VariableManager.mkReal: 尝试将非有限数转换为Z3表达式: {}", value);
            throw new IllegalArgumentException("非法调用Z3VariableManager.mkReal: 尝试将非有限数转换为Z3表达式: " + value);
        }
        return ctx.mkReal(BigDecimal.valueOf(value).toPlainString());
    }

    /**
     * 向 Optimize 断言所有变量的上下界。无穷的界不产生约束。
     * @param optimize Z3 Optimize 实例。
     */
    public void assertDomains(Optimize optimize) {
        for (MilpVar var : allKnownVars) {
            ArithExpr term = getZ3Var(var);
            if (Double.isFinite(var.getLowerBound())) {
                optimize.Add(ctx.mkGe(term, mkReal(var.getLowerBound())));
            }
            if (Double.isFinite(var.getUpperBound())) {
                optimize.Add(ctx.mkLe(term, mkReal(var.getUpperBound())));
            }
        }
        logger.debug("断言 {} 个变量的上下界", allKnownVars.size());
    }

    /**
     * 从 Z3 模型中读取变量取值。
     * @param model Z3 Model 实例。
     * @param var MilpVar 对象。
     * @return 变量取值。
     */
    public double evaluate(com.microsoft.z3.Model model, MilpVar var) {
        Expr value = model.eval(getZ3Var(var), true);
        return toDouble(value);
    }

    /**
     * 将 Z3 数值常量转换为 double。
     * @throws IllegalStateException 如果表达式不是数值常量。
     */
    public static double toDouble(Expr value) {
        if (value.isIntNum()) {
            return ((IntNum) value).getBigInteger().doubleValue();
        }
        if (value.isRatNum()) {
            RatNum rat = (RatNum) value;
            return new BigDecimal(rat.getBigIntNumerator())
                    .divide(new BigDecimal(rat.getBigIntDenominator()), MathContext.DECIMAL64)
                    .doubleValue();
        }
        if (value.isAlgebraicNumber()) {
            // 十进制近似以 '?' 结尾
            String decimal = ((AlgebraicNum) value).toDecimal(17).replace("?", "");
            return Double.parseDouble(decimal);
        }
        logger.error("Z3VariableManager.toDouble: 无法转换为数值: {}", value);
        throw new IllegalStateException("无法将 Z3 表达式转换为数值: " + value);
    }

    /**
     * 判断 Z3 表达式是否为有限数值常量。
     */
    public static boolean isNumeral(Expr value) {
        return value.isIntNum() || value.isRatNum() || value.isAlgebraicNumber();
    }
}
