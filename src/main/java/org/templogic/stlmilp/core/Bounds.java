package org.templogic.stlmilp.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Objects;

/**
 * 代表一个闭区间 [lo, hi]，表示某个子公式鲁棒度变量在任何可行信号下的取值范围。
 * 其绝对值的最大值同时作为该节点 min/max 编码的 big-M 常数 K。
 * 此类是不可变的。
 */
@Getter
public final class Bounds {

    private static final Logger logger = LoggerFactory.getLogger(Bounds.class);

    private final double lo;
    private final double hi;

    private Bounds(double lo, double hi) {
        this.lo = lo;
        this.hi = hi;
    }

    /**
     * 工厂方法：创建区间 [lo, hi]。
     * @throws IllegalArgumentException 如果端点不是有限数或 lo > hi。
     */
    public static Bounds of(double lo, double hi) {
        if (!Double.isFinite(lo) || !Double.isFinite(hi)) {
            logger.error("Bounds.of: 区间端点必须是有限数: [{}, {}]", lo, hi);
            throw new IllegalArgumentException("区间端点必须是有限数: [" + lo + ", " + hi + "]");
        }
        if (lo > hi) {
            logger.error("Bounds.of: 区间下界大于上界: [{}, {}]", lo, hi);
            throw new IllegalArgumentException("区间下界大于上界: [" + lo + ", " + hi + "]");
        }
        return new Bounds(lo, hi);
    }

    /**
     * 工厂方法：创建对称区间 [-m, m]。
     */
    public static Bounds symmetric(double magnitude) {
        return of(-Math.abs(magnitude), Math.abs(magnitude));
    }

    /**
     * 合并若干子节点的区间。
     * 收集所有子节点的全部端点，取绝对值的最大值 M，返回 [-M, M]。
     * 这并不是最紧的区间，但对 min、max 两个方向都成立，因此 AND 与 OR 得到相同的结果。
     * 若需要更紧的合并规则，只需替换此方法。
     *
     * @param children 子节点区间，不能为空。
     * @return 合并后的区间。
     */
    public static Bounds combine(Collection<Bounds> children) {
        Objects.requireNonNull(children, "Children bounds cannot be null");
        if (children.isEmpty()) {
            logger.error("Bounds.combine: 没有可合并的子区间");
            throw new IllegalArgumentException("没有可合并的子区间");
        }
        double m = 0.0;
        for (Bounds b : children) {
            m = Math.max(m, b.magnitude());
        }
        Bounds result = symmetric(m);
        logger.debug("合并 {} 个子区间得到 {}", children.size(), result);
        return result;
    }

    /**
     * @return max(|lo|, |hi|)，即 big-M 常数 K。
     */
    public double magnitude() {
        return Math.max(Math.abs(lo), Math.abs(hi));
    }

    /**
     * @return [-hi, -lo]。
     */
    public Bounds negate() {
        return new Bounds(-hi, -lo);
    }

    public boolean contains(double v) {
        return lo <= v && v <= hi;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Bounds that = (Bounds) o;
        // -0.0 与 0.0 视为相等
        return lo == that.lo && hi == that.hi;
    }

    @Override
    public int hashCode() {
        return Objects.hash(lo + 0.0, hi + 0.0);
    }

    @Override
    public String toString() {
        return "[" + lo + ", " + hi + "]";
    }
}
