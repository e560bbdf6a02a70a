package org.lrasolver.core;

import org.lrasolver.exceptions.DuplicateVariableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 为一个求解器实例分配稳定的变量 id。变量只增不删。
 * @author Ayalyt
 */
public final class VariableRegistry {

    private static final Logger logger = LoggerFactory.getLogger(VariableRegistry.class);

    private final Map<String, Variable> variablesByName = new HashMap<>();
    // 下标即 id
    private final List<Variable> variablesById = new ArrayList<>();

    /**
     * 注册一个变量。同名同 sort 时返回已有变量。
     * @throws DuplicateVariableException 同名但 sort 不同
     */
    public Variable newVariable(String name, Sort sort) {
        Objects.requireNonNull(name, "Variable name cannot be null");
        Objects.requireNonNull(sort, "Variable sort cannot be null");

        Variable existing = variablesByName.get(name);
        if (existing != null) {
            if (existing.getSort() != sort) {
                logger.error("变量 '{}' 已以 {} 声明，拒绝重新声明为 {}", name, existing.getSort(), sort);
                throw new DuplicateVariableException(name, existing.getSort(), sort);
            }
            logger.info("变量 '{}' 已存在，返回已有变量 (id {})", name, existing.getId());
            return existing;
        }

        Variable variable = new Variable(variablesById.size(), name, sort);
        variablesById.add(variable);
        variablesByName.put(name, variable);
        return variable;
    }

    /**
     * 判断变量是否是由本注册表创建的。
     */
    public boolean contains(Variable variable) {
        int id = variable.getId();
        return id >= 0 && id < variablesById.size() && variablesById.get(id) == variable;
    }

    public Variable getVariable(String name) {
        return variablesByName.get(name);
    }

    public List<Variable> getVariables() {
        return Collections.unmodifiableList(variablesById);
    }

    public int size() {
        return variablesById.size();
    }
}
