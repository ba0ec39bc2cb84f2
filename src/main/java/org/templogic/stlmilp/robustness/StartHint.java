package org.templogic.stlmilp.robustness;

import lombok.Getter;

import java.util.Objects;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * 求解器初始解提示。三种状态：
 * 无提示；只有鲁棒度值；鲁棒度值加上 min/max 编码中被选中分支的序号。
 * 此类是不可变的。
 */
public final class StartHint {

    public enum Kind {
        NONE,
        VALUE,
        VALUE_WITH_INDEX
    }

    private static final StartHint NONE = new StartHint(Kind.NONE, Double.NaN, -1);

    @Getter
    private final Kind kind;
    private final double value;
    private final int index;

    private StartHint(Kind kind, double value, int index) {
        this.kind = kind;
        this.value = value;
        this.index = index;
    }

    public static StartHint none() {
        return NONE;
    }

    public static StartHint of(double value) {
        checkValue(value);
        return new StartHint(Kind.VALUE, value, -1);
    }

    public static StartHint of(double value, int index) {
        checkValue(value);
        if (index < 0) {
            throw new IllegalArgumentException("分支序号不能为负: " + index);
        }
        return new StartHint(Kind.VALUE_WITH_INDEX, value, index);
    }

    private static void checkValue(double value) {
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException("初始值提示不能为 NaN");
        }
    }

    public boolean isPresent() {
        return kind != Kind.NONE;
    }

    public OptionalDouble getValue() {
        return kind == Kind.NONE ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public OptionalInt getIndex() {
        return kind == Kind.VALUE_WITH_INDEX ? OptionalInt.of(index) : OptionalInt.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        StartHint that = (StartHint) o;
        return kind == that.kind && Double.compare(value, that.value) == 0 && index == that.index;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value, index);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case NONE -> "StartHint{none}";
            case VALUE -> "StartHint{" + value + "}";
            case VALUE_WITH_INDEX -> "StartHint{" + value + ", index=" + index + "}";
        };
    }
}
