package org.templogic.stlmilp.core;

/**
 * MILP 决策变量的类型。
 */
public enum VarType {
    CONTINUOUS("C"),
    BINARY("B");

    private final String code;

    VarType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
