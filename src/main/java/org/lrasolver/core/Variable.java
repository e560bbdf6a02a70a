package org.lrasolver.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 求解器变量。id 由所属的 {@link VariableRegistry} 分配，在求解器生命周期内不变、不复用。
 * 只能通过 {@link VariableRegistry#newVariable(String, Sort)} 创建。
 * @author Ayalyt
 */
@Getter
public final class Variable implements Comparable<Variable> {

    private static final Logger logger = LoggerFactory.getLogger(Variable.class);

    private final int id;
    private final String name;
    private final Sort sort;

    private final int hashCode;

    Variable(int id, String name, Sort sort) {
        this.id = id;
        this.name = Objects.requireNonNull(name, "Variable name cannot be null");
        this.sort = Objects.requireNonNull(sort, "Variable sort cannot be null");
        this.hashCode = Objects.hash(id, name);
        logger.debug("创建了一个Variable: {} ({}) with id {}", name, sort.getSymbol(), id);
    }

    public boolean isBoolean() {
        return sort == Sort.BOOLEAN;
    }

    @Override
    public int compareTo(Variable other) {
        return Integer.compare(this.id, other.id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Variable variable = (Variable) o;
        return id == variable.id && name.equals(variable.name) && sort == variable.sort;
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return name;
    }
}
