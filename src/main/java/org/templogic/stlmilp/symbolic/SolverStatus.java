package org.templogic.stlmilp.symbolic;

/**
 * MILP 求解状态。
 */
public enum SolverStatus {
    /** 模型已构建，尚未求解 */
    LOADED,
    OPTIMAL,
    INFEASIBLE,
    UNBOUNDED,
    /** 超时、中断或求解器无法判定 */
    UNKNOWN;

    public boolean isOptimal() {
        return this == OPTIMAL;
    }
}
