package org.lrasolver.simplex;

import lombok.Getter;
import org.lrasolver.core.Variable;
import org.lrasolver.expressions.linear.LinearExpression;
import org.lrasolver.utils.Rational;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 求解器变量到表格列的映射，列在变量第一次被引用时创建：
 * <ul>
 *     <li>SIGNED: 两列 (pos, neg)，均 &gt;= 0，取值 pos - neg</li>
 *     <li>UNSIGNED: 一列，&gt;= 0</li>
 *     <li>BOOLEAN: 一列，取值范围 [0, 1]</li>
 * </ul>
 * @author Ayalyt
 */
public final class VariableSplitter {

    private static final Logger logger = LoggerFactory.getLogger(VariableSplitter.class);

    private final Tableau tableau;
    private final SortedMap<Variable, Columns> columns = new TreeMap<>();

    public VariableSplitter(Tableau tableau) {
        this.tableau = tableau;
    }

    /**
     * 变量对应的列，不存在时在表格中创建。
     */
    public Columns columnsOf(Variable variable) {
        Columns existing = columns.get(variable);
        if (existing != null) {
            return existing;
        }
        Bound zero = Bound.inclusive(Rational.ZERO);
        Columns created = switch (variable.getSort()) {
            case SIGNED -> new Columns(
                    tableau.addColumn(variable.getName() + "+", zero, null),
                    tableau.addColumn(variable.getName() + "-", zero, null));
            case UNSIGNED -> new Columns(tableau.addColumn(variable.getName(), zero, null), -1);
            case BOOLEAN -> new Columns(
                    tableau.addColumn(variable.getName(), zero, Bound.inclusive(Rational.ONE)), -1);
        };
        columns.put(variable, created);
        logger.debug("变量 {} ({}) 映射到列 {}", variable.getName(), variable.getSort().getSymbol(), created);
        return created;
    }

    /**
     * 把线性表达式的变量部分改写为列上的系数，常数项不在其中。
     */
    public Map<Integer, Rational> substitute(LinearExpression expression) {
        SortedMap<Integer, Rational> result = new TreeMap<>();
        for (Map.Entry<Variable, Rational> term : expression.getCoefficients().entrySet()) {
            Columns target = columnsOf(term.getKey());
            result.merge(target.getPositive(), term.getValue(), Rational::add);
            if (target.isSplit()) {
                result.merge(target.getNegative(), term.getValue().negate(), Rational::add);
            }
        }
        return result;
    }

    /**
     * 所有算术变量之和对应的目标函数，布尔列不参与。
     */
    public Map<Integer, Rational> sumOfArithmeticVariables() {
        SortedMap<Integer, Rational> objective = new TreeMap<>();
        for (Map.Entry<Variable, Columns> entry : columns.entrySet()) {
            if (!entry.getKey().getSort().isArithmetic()) {
                continue;
            }
            Columns target = entry.getValue();
            objective.put(target.getPositive(), Rational.ONE);
            if (target.isSplit()) {
                objective.put(target.getNegative(), Rational.MINUS_ONE);
            }
        }
        return objective;
    }

    /**
     * 在给定 δ 下变量的具体取值。从未被引用的变量取 0。
     */
    public Rational valueOf(Variable variable, Rational delta) {
        Columns target = columns.get(variable);
        if (target == null) {
            return Rational.ZERO;
        }
        Rational value = tableau.getValue(target.getPositive()).concretize(delta);
        if (target.isSplit()) {
            value = value.subtract(tableau.getValue(target.getNegative()).concretize(delta));
        }
        return value;
    }

    SortedMap<Variable, Columns> copyColumns() {
        return new TreeMap<>(columns);
    }

    void restoreColumns(SortedMap<Variable, Columns> saved) {
        columns.clear();
        columns.putAll(saved);
    }

    /**
     * 一个变量占用的列。negative 为 -1 表示没有拆分。
     */
    @Getter
    public static final class Columns {
        private final int positive;
        private final int negative;

        Columns(int positive, int negative) {
            this.positive = positive;
            this.negative = negative;
        }

        public boolean isSplit() {
            return negative >= 0;
        }

        @Override
        public String toString() {
            return isSplit() ? "(" + positive + ", " + negative + ")" : String.valueOf(positive);
        }
    }
}
