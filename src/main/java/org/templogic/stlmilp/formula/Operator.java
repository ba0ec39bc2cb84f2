package org.templogic.stlmilp.formula;

/**
 * STL 运算符。
 */
public enum Operator {
    EXPR("expr"),
    NOT("not"),
    AND("and"),
    OR("or"),
    ALWAYS("alw"),
    EVENTUALLY("eve"),
    NEXT("next");

    // 用于生成子节点变量名的后缀
    private final String label;

    Operator(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * @return 是否带有时间窗口 [a, b]。
     */
    public boolean isTemporal() {
        return this == ALWAYS || this == EVENTUALLY;
    }
}
