package org.lrasolver.exceptions;

/**
 * 求解器所有结构化错误的基类。均为非受检异常，由构造出错表达式或断言的调用直接抛出。
 */
public class SolverException extends RuntimeException {

    public SolverException(String message) {
        super(message);
    }

    public SolverException(String message, Throwable cause) {
        super(message, cause);
    }
}
