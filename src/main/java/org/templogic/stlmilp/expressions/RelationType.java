package org.templogic.stlmilp.expressions; // 放在 expressions 包下

public enum RelationType {

    /**
     * 线性约束的关系运算符
     */
    LE("<="),   // Less Equal
    GE(">="),   // Greater Equal
    EQ("=");    // Equal

    private final String symbol;

    RelationType(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * 交换两侧操作数后的等价关系。
     * 例如：(A <= B) -> (B >= A)。
     */
    public RelationType flip() {
        return switch (this) {
            case LE -> GE;
            case GE -> LE;
            case EQ -> EQ;
        };
    }

    /**
     * 判断规范化形式 value ~ 0 在容差 tolerance 内是否成立。
     * @param value 左侧减右侧的数值。
     * @param tolerance 非负容差。
     */
    public boolean holds(double value, double tolerance) {
        return switch (this) {
            case LE -> value <= tolerance;
            case GE -> value >= -tolerance;
            case EQ -> Math.abs(value) <= tolerance;
        };
    }
}
