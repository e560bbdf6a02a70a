package org.lrasolver.simplex;

import lombok.Getter;
import org.lrasolver.core.Model;
import org.lrasolver.core.Variable;
import org.lrasolver.expressions.RelationType;
import org.lrasolver.expressions.linear.Atom;
import org.lrasolver.utils.Rational;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.SortedMap;

/**
 * 表格与变量拆分的组合入口：把原子和布尔取值翻译成表格行，做可行性检查、顶点选择与模型抽取。
 * 每一次改变表格的调用结束后，按配置校验表格不变量。
 */
public final class SimplexEngine {

    private static final Logger logger = LoggerFactory.getLogger(SimplexEngine.class);

    @Getter
    private final Tableau tableau;
    @Getter
    private final VariableSplitter splitter;
    private final int maxPivots;
    private final boolean verifyInvariants;

    public SimplexEngine(int maxPivots, boolean verifyInvariants) {
        if (maxPivots < 0) {
            throw new IllegalArgumentException("maxPivots 不能为负数: " + maxPivots);
        }
        this.tableau = new Tableau();
        this.splitter = new VariableSplitter(tableau);
        this.maxPivots = maxPivots;
        this.verifyInvariants = verifyInvariants;
    }

    /**
     * 把原子 Σ c_i x_i + c ~ 0 加为一行 Σ c_i x_i ~ -c。
     * @return 松弛列号
     */
    public int addAtom(Atom atom) {
        Map<Integer, Rational> coefficients = splitter.substitute(atom.getExpression());
        int slack = tableau.addRow(coefficients, atom.getRelation(), atom.getRightHandSide(), atom.toString());
        verify(false);
        return slack;
    }

    /**
     * 把布尔变量的 0/1 列固定为给定真值。
     */
    public int pinBoolean(Variable variable, boolean value) {
        int column = splitter.columnsOf(variable).getPositive();
        Rational target = value ? Rational.ONE : Rational.ZERO;
        int slack = tableau.addRow(Map.of(column, Rational.ONE), RelationType.EQ, target,
                variable.getName() + " = " + target);
        verify(false);
        return slack;
    }

    public FeasibilityResult checkFeasibility() {
        FeasibilityResult result = tableau.checkFeasibility(maxPivots);
        verify(result == FeasibilityResult.FEASIBLE);
        return result;
    }

    /**
     * 在可行状态下最大化所有算术变量之和，得到一个确定的顶点。
     */
    public OptimizationResult selectVertex() {
        OptimizationResult result = tableau.maximize(splitter.sumOfArithmeticVariables(), maxPivots);
        if (result == OptimizationResult.PIVOT_LIMIT) {
            logger.warn("顶点选择在 {} 次主元内未结束，使用当前可行顶点", maxPivots);
        }
        verify(true);
        return result;
    }

    /**
     * 为给定变量构造模型。算术变量取表格中的值 (δ 已代入)，布尔变量取 booleans 中的真值，未赋值的取 0。
     * 调用前表格必须可行。
     */
    public Model extractModel(Collection<Variable> variables, Map<Variable, Boolean> booleans) {
        Rational delta = tableau.concreteDelta();
        Map<Variable, Rational> values = new HashMap<>();
        for (Variable variable : variables) {
            if (variable.isBoolean()) {
                values.put(variable, Boolean.TRUE.equals(booleans.get(variable)) ? Rational.ONE : Rational.ZERO);
            } else {
                values.put(variable, splitter.valueOf(variable, delta));
            }
        }
        logger.debug("δ = {}, 模型 {}", delta, values);
        return Model.of(values);
    }

    public Checkpoint snapshot() {
        return new Checkpoint(tableau.snapshot(), splitter.copyColumns());
    }

    public void restore(Checkpoint checkpoint) {
        tableau.restore(checkpoint.tableau);
        splitter.restoreColumns(checkpoint.columns);
        verify(false);
    }

    private void verify(boolean requireFeasible) {
        if (verifyInvariants) {
            tableau.verifyInvariants(requireFeasible);
        }
    }

    /**
     * 表格与列映射的联合检查点。
     */
    public static final class Checkpoint {
        private final Tableau.Checkpoint tableau;
        private final SortedMap<Variable, VariableSplitter.Columns> columns;

        private Checkpoint(Tableau.Checkpoint tableau, SortedMap<Variable, VariableSplitter.Columns> columns) {
            this.tableau = tableau;
            this.columns = columns;
        }
    }
}
