package org.lrasolver.exceptions;

/**
 * 只剩基础作用域时调用 pop。
 */
public class EmptyScopeStackException extends SolverException {

    public EmptyScopeStackException() {
        super("作用域栈中只剩基础作用域，无法 pop");
    }
}
