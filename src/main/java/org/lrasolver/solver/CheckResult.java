package org.lrasolver.solver;

/**
 * 可满足性检查的结果。
 */
public enum CheckResult {
    SATISFIABLE,
    UNSATISFIABLE,
    // 超出主元或分支预算，或遇到不支持的公式
    UNKNOWN
}
