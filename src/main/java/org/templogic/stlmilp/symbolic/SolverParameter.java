package org.templogic.stlmilp.symbolic;

/**
 * 透传给求解器的调优参数。
 */
public enum SolverParameter {
    /** 是否输出求解器日志，0 为关闭 */
    OUTPUT_FLAG,
    /** 数值稳定性等级 */
    NUMERIC_FOCUS,
    /** 线程数 */
    THREADS,
    /** 求解时间上限，单位秒 */
    TIME_LIMIT
}
