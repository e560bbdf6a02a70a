package org.lrasolver.exceptions;

/**
 * 表格内部状态不一致。属于实现缺陷，调用方不应捕获。
 */
public class InvariantViolationException extends SolverException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
