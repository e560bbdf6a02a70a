package org.lrasolver.exceptions;

import lombok.Getter;
import org.lrasolver.core.Sort;

/**
 * 同名变量以不兼容的 sort 再次声明。
 */
@Getter
public class DuplicateVariableException extends SolverException {

    private final String variableName;
    private final Sort existingSort;
    private final Sort requestedSort;

    public DuplicateVariableException(String variableName, Sort existingSort, Sort requestedSort) {
        super("变量 '" + variableName + "' 已以 " + existingSort + " 声明，不能再声明为 " + requestedSort);
        this.variableName = variableName;
        this.existingSort = existingSort;
        this.requestedSort = requestedSort;
    }
}
