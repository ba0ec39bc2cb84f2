package org.templogic.stlmilp.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * 代表 MILP 模型中的一个决策变量。
 * 名称、上下界、类型在创建后不可变；初始值提示 (start) 与求解结果 (value) 可变。
 * 变量只能由 {@link org.templogic.stlmilp.symbolic.MilpModel} 创建，索引为其在模型中的创建顺序。
 */
@Getter
public final class MilpVar implements Comparable<MilpVar> {

    private static final Logger logger = LoggerFactory.getLogger(MilpVar.class);

    private final int index;
    private final String name;
    private final double lowerBound;
    private final double upperBound;
    private final VarType type;

    // null 表示未设置
    private Double start;
    private Double value;

    private MilpVar(int index, String name, double lowerBound, double upperBound, VarType type) {
        this.index = index;
        this.name = name;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.type = type;
    }

    /**
     * 工厂方法：创建变量。只应由模型实现调用。
     * @param index 变量在模型中的序号。
     * @param name 变量名，在模型内唯一。
     * @param lowerBound 下界，可为 {@link Double#NEGATIVE_INFINITY}。
     * @param upperBound 上界，可为 {@link Double#POSITIVE_INFINITY}。
     * @param type 变量类型。
     * @return 新的 MilpVar。
     * @throws IllegalArgumentException 如果上下界非法。
     */
    public static MilpVar create(int index, String name, double lowerBound, double upperBound, VarType type) {
        Objects.requireNonNull(name, "Variable name cannot be null");
        Objects.requireNonNull(type, "Variable type cannot be null");
        if (name.isBlank()) {
            logger.error("MilpVar.create: 变量名为空");
            throw new IllegalArgumentException("变量名不能为空");
        }
        if (Double.isNaN(lowerBound) || Double.isNaN(upperBound) || lowerBound > upperBound) {
            logger.error("MilpVar.create: 变量 {} 的上下界非法: [{}, {}]", name, lowerBound, upperBound);
            throw new IllegalArgumentException("变量 " + name + " 的上下界非法: [" + lowerBound + ", " + upperBound + "]");
        }
        if (type == VarType.BINARY && (lowerBound < 0 || upperBound > 1)) {
            logger.error("MilpVar.create: 二元变量 {} 的上下界超出 [0, 1]: [{}, {}]", name, lowerBound, upperBound);
            throw new IllegalArgumentException("二元变量 " + name + " 的上下界必须在 [0, 1] 之内");
        }
        return new MilpVar(index, name, lowerBound, upperBound, type);
    }

    public boolean isBinary() {
        return type == VarType.BINARY;
    }

    /**
     * 设置求解器初始值提示。
     */
    public void setStart(double start) {
        if (Double.isNaN(start)) {
            logger.error("MilpVar.setStart: 变量 {} 的初始值为 NaN", name);
            throw new IllegalArgumentException("变量 " + name + " 的初始值不能为 NaN");
        }
        logger.debug("设置变量 {} 的初始值提示为 {}", name, start);
        this.start = start;
    }

    public void clearStart() {
        this.start = null;
    }

    public OptionalDouble getStart() {
        return start == null ? OptionalDouble.empty() : OptionalDouble.of(start);
    }

    public boolean hasValue() {
        return value != null;
    }

    /**
     * 获取最近一次最优求解中该变量的取值。
     * @throws IllegalStateException 如果模型尚未得到最优解。
     */
    public double getValue() {
        if (value == null) {
            logger.error("MilpVar.getValue: 变量 {} 尚无求解结果", name);
            throw new IllegalStateException("变量 " + name + " 尚无求解结果");
        }
        return value;
    }

    /**
     * 由模型实现在求解后回填结果，传入 null 表示清除。
     */
    public void setValue(Double value) {
        this.value = value;
    }

    @Override
    public int compareTo(MilpVar other) {
        int cmp = Integer.compare(this.index, other.index);
        if (cmp != 0) {
            return cmp;
        }
        return this.name.compareTo(other.name);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name);
        sb.append(" (").append(type.getCode()).append(") [")
                .append(lowerBound).append(", ").append(upperBound).append(']');
        if (start != null) {
            sb.append(" start=").append(start);
        }
        if (value != null) {
            sb.append(" value=").append(value);
        }
        return sb.toString();
    }
}
