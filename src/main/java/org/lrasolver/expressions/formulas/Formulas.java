package org.lrasolver.expressions.formulas;

import org.lrasolver.core.Variable;
import org.lrasolver.expressions.RelationType;
import org.lrasolver.expressions.linear.Atom;
import org.lrasolver.expressions.linear.LinearExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

/**
 * 公式的显式构造函数。只负责表示，不触发任何求解。
 */
public final class Formulas {

    private static final Logger logger = LoggerFactory.getLogger(Formulas.class);

    public static final Formula TRUE = new And(List.of());
    public static final Formula FALSE = new Or(List.of());

    private Formulas() {
    }

    // ========== 布尔结构 ==========

    public static Formula and(Formula... operands) {
        return and(Arrays.asList(operands));
    }

    public static Formula and(List<? extends Formula> operands) {
        if (operands.size() == 1) {
            return operands.get(0);
        }
        return new And(List.copyOf(operands));
    }

    public static Formula or(Formula... operands) {
        return or(Arrays.asList(operands));
    }

    public static Formula or(List<? extends Formula> operands) {
        if (operands.size() == 1) {
            return operands.get(0);
        }
        return new Or(List.copyOf(operands));
    }

    public static Formula not(Formula operand) {
        return new Not(operand);
    }

    /**
     * 布尔变量作为公式。
     * @throws org.lrasolver.exceptions.UnsupportedFormulaException 变量不是布尔 sort
     */
    public static BooleanVar var(Variable variable) {
        return new BooleanVar(variable);
    }

    /**
     * a == b。一侧是布尔变量时生成 {@link Equivalence}，否则展开为 (a ∧ b) ∨ (¬a ∧ ¬b)。
     */
    public static Formula iff(Formula left, Formula right) {
        if (left instanceof BooleanVar w) {
            return new Equivalence(w, right);
        }
        if (right instanceof BooleanVar w) {
            return new Equivalence(w, left);
        }
        logger.debug("iff 两侧都不是布尔变量，展开为析取: {} == {}", left, right);
        return or(and(left, right), and(not(left), not(right)));
    }

    // ========== 算术原子 ==========

    public static Atom compare(LinearExpression left, RelationType relation, LinearExpression right) {
        return Atom.of(left, relation, right);
    }

    public static Atom lt(LinearExpression left, LinearExpression right) {
        return Atom.of(left, RelationType.LT, right);
    }

    public static Atom le(LinearExpression left, LinearExpression right) {
        return Atom.of(left, RelationType.LE, right);
    }

    public static Atom eq(LinearExpression left, LinearExpression right) {
        return Atom.of(left, RelationType.EQ, right);
    }

    public static Atom ge(LinearExpression left, LinearExpression right) {
        return Atom.of(left, RelationType.GE, right);
    }

    public static Atom gt(LinearExpression left, LinearExpression right) {
        return Atom.of(left, RelationType.GT, right);
    }

    public static Atom lt(LinearExpression left, long right) {
        return lt(left, LinearExpression.of(right));
    }

    public static Atom le(LinearExpression left, long right) {
        return le(left, LinearExpression.of(right));
    }

    public static Atom eq(LinearExpression left, long right) {
        return eq(left, LinearExpression.of(right));
    }

    public static Atom ge(LinearExpression left, long right) {
        return ge(left, LinearExpression.of(right));
    }

    public static Atom gt(LinearExpression left, long right) {
        return gt(left, LinearExpression.of(right));
    }
}
