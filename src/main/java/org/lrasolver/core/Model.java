package org.lrasolver.core;

import lombok.Getter;
import org.lrasolver.utils.Rational;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 一次 SATISFIABLE 检查得到的变量赋值。布尔变量取 0 或 1。
 * 仅对产生它时的作用域栈状态有效。
 * @author Ayalyt
 */
@Getter
public final class Model {

    private static final Logger logger = LoggerFactory.getLogger(Model.class);

    private final SortedMap<Variable, Rational> values;

    private Model(Map<Variable, Rational> values) {
        this.values = Collections.unmodifiableSortedMap(new TreeMap<>(values));
        logger.debug("创建 Model: {}", this);
    }

    public static Model of(Map<Variable, Rational> values) {
        return new Model(Objects.requireNonNull(values, "Model values cannot be null"));
    }

    /**
     * 获取变量的值。
     * @throws IllegalArgumentException 变量不在模型中
     */
    public Rational getValue(Variable variable) {
        Rational value = values.get(variable);
        if (value == null) {
            logger.error("尝试获取不存在的变量值：变量 '{}' 不存在于当前模型 {} 中。", variable.getName(), this);
            throw new IllegalArgumentException("变量 '" + variable.getName() + "' 不存在于当前模型中。");
        }
        return value;
    }

    /**
     * 布尔变量的真值，非零即真。
     */
    public boolean isTrue(Variable variable) {
        return !getValue(variable).isZero();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Model that = (Model) o;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "{" +
                values.entrySet().stream()
                        .map(entry -> entry.getKey().getName() + "=" + entry.getValue())
                        .collect(Collectors.joining(", ")) +
                "}";
    }
}
