package org.lrasolver.simplex;

public enum OptimizationResult {
    OPTIMAL,
    UNBOUNDED,      // 目标无界，停在当前可行顶点
    PIVOT_LIMIT
}
