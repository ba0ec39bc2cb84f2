package org.templogic.stlmilp.formula;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 代表 STL 公式树中的一个节点。
 * EXPR 为叶子并持有信号；NOT、NEXT 有一个子公式；AND、OR 有一个或多个子公式；
 * ALWAYS、EVENTUALLY 有一个子公式和闭区间时间窗口 [a, b]，0 <= a <= b。
 * 此类是不可变的。
 */
@Getter
public final class Formula {

    private static final Logger logger = LoggerFactory.getLogger(Formula.class);

    private final Operator op;
    private final List<Formula> args;
    // 只有 EXPR 节点非空
    private final Signal signal;
    // 只有 ALWAYS、EVENTUALLY 节点有意义
    private final int windowStart;
    private final int windowEnd;

    private final int hashCode;

    private Formula(Operator op, List<Formula> args, Signal signal, int windowStart, int windowEnd) {
        this.op = Objects.requireNonNull(op, "Operator cannot be null");
        Objects.requireNonNull(args, "Arguments cannot be null");
        for (Formula arg : args) {
            Objects.requireNonNull(arg, "Sub-formula cannot be null");
        }
        this.args = List.copyOf(args);
        this.signal = signal;
        this.windowStart = windowStart;
        this.windowEnd = windowEnd;
        validate();
        this.hashCode = Objects.hash(op, this.args, signal, windowStart, windowEnd);
        logger.debug("创建 Formula: {}", this);
    }

    private void validate() {
        switch (op) {
            case EXPR -> {
                if (signal == null || !args.isEmpty()) {
                    logger.error("Formula: EXPR 节点必须持有信号且没有子公式");
                    throw new IllegalArgumentException("EXPR 节点必须持有信号且没有子公式");
                }
            }
            case NOT, NEXT, ALWAYS, EVENTUALLY -> {
                if (args.size() != 1) {
                    logger.error("Formula: {} 节点需要恰好一个子公式，实际为 {}", op, args.size());
                    throw new IllegalArgumentException(op + " 节点需要恰好一个子公式，实际为 " + args.size());
                }
            }
            case AND, OR -> {
                if (args.isEmpty()) {
                    logger.error("Formula: {} 节点至少需要一个子公式", op);
                    throw new IllegalArgumentException(op + " 节点至少需要一个子公式");
                }
            }
        }
        if (op.isTemporal() && (windowStart < 0 || windowStart > windowEnd)) {
            logger.error("Formula: {} 的时间窗口非法: [{}, {}]", op, windowStart, windowEnd);
            throw new IllegalArgumentException(op + " 的时间窗口非法: [" + windowStart + ", " + windowEnd + "]");
        }
    }

    // --- 静态工厂方法 ---

    public static Formula expr(Signal signal) {
        return new Formula(Operator.EXPR, List.of(), Objects.requireNonNull(signal, "Signal cannot be null"), 0, 0);
    }

    public static Formula not(Formula arg) {
        return new Formula(Operator.NOT, List.of(arg), null, 0, 0);
    }

    public static Formula and(Formula... args) {
        return and(Arrays.asList(args));
    }

    public static Formula and(List<Formula> args) {
        return new Formula(Operator.AND, args, null, 0, 0);
    }

    public static Formula or(Formula... args) {
        return or(Arrays.asList(args));
    }

    public static Formula or(List<Formula> args) {
        return new Formula(Operator.OR, args, null, 0, 0);
    }

    public static Formula always(int a, int b, Formula arg) {
        return new Formula(Operator.ALWAYS, List.of(arg), null, a, b);
    }

    public static Formula eventually(int a, int b, Formula arg) {
        return new Formula(Operator.EVENTUALLY, List.of(arg), null, a, b);
    }

    public static Formula next(Formula arg) {
        return new Formula(Operator.NEXT, List.of(arg), null, 0, 0);
    }

    /**
     * 计算公式需要的最大时间偏移：NEXT 贡献 1，ALWAYS、EVENTUALLY 贡献窗口上界 b。
     * 调用者据此决定系统信号需要覆盖多少个时间步。
     * @return 最大时间偏移，叶子为 0。
     */
    public int horizon() {
        return switch (op) {
            case EXPR -> 0;
            case NOT -> args.get(0).horizon();
            case NEXT -> 1 + args.get(0).horizon();
            case ALWAYS, EVENTUALLY -> windowEnd + args.get(0).horizon();
            case AND, OR -> args.stream().mapToInt(Formula::horizon).max().orElse(0);
        };
    }

    /**
     * @return 时间窗口包含的偏移个数 b - a + 1；非时序节点为 0。
     */
    public int windowSize() {
        return op.isTemporal() ? windowEnd - windowStart + 1 : 0;
    }

    public Formula getArg(int i) {
        return args.get(i);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Formula that = (Formula) o;
        return op == that.op && windowStart == that.windowStart && windowEnd == that.windowEnd
                && Objects.equals(signal, that.signal) && args.equals(that.args);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return switch (op) {
            case EXPR -> "(" + signal + ")";
            case NOT, NEXT -> op.getLabel() + " " + args.get(0);
            case AND, OR -> args.stream().map(Formula::toString)
                    .collect(Collectors.joining(" " + op.getLabel() + " ", "(", ")"));
            case ALWAYS, EVENTUALLY -> op.getLabel() + "_[" + windowStart + ", " + windowEnd + "] " + args.get(0);
        };
    }
}
