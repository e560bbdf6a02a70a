package org.lrasolver.simplex;

public enum FeasibilityResult {
    FEASIBLE,
    INFEASIBLE,
    PIVOT_LIMIT     // 超出主元次数上限，结论未知
}
