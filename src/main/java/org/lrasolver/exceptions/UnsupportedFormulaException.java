package org.lrasolver.exceptions;

/**
 * 构造超出线性算术 + 布尔片段的表达式，例如非线性项、在算术原子中使用布尔变量、
 * 或使用不属于当前求解器的变量。
 */
public class UnsupportedFormulaException extends SolverException {

    public UnsupportedFormulaException(String message) {
        super(message);
    }
}
