package org.lrasolver.expressions.linear;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import org.lrasolver.core.Model;
import org.lrasolver.core.Variable;
import org.lrasolver.exceptions.UnsupportedFormulaException;
import org.lrasolver.expressions.RelationType;
import org.lrasolver.expressions.formulas.Formula;
import org.lrasolver.expressions.formulas.FormulaKind;
import org.lrasolver.symbolic.Z3VariableManager;
import org.lrasolver.utils.Rational;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;

/**
 * 线性比较原子，形式为 E1 ~ E2。
 * 内部规范化为 E_normalized ~ 0 的形式。
 * 此类是不可变的。
 */
@Getter
public final class Atom implements Formula {

    private static final Logger logger = LoggerFactory.getLogger(Atom.class);

    // 规范化后的形式：expression ~ 0
    private final LinearExpression expression; // 规范化后的左侧表达式 (E1 - E2)
    private final RelationType relation;

    private final int hashCode;

    /**
     * 私有构造函数。E1 ~ E2 => (E1 - E2) ~ 0。
     *
     * @throws UnsupportedFormulaException 表达式中含布尔变量
     */
    private Atom(LinearExpression left, LinearExpression right, RelationType relation) {
        Objects.requireNonNull(left, "Atom-构造函数: left 表达式不能为 null");
        Objects.requireNonNull(right, "Atom-构造函数: right 表达式不能为 null");
        Objects.requireNonNull(relation, "Atom-构造函数: relation 不能为 null");

        this.expression = left.subtract(right);
        this.relation = relation;

        for (Variable variable : this.expression.getVariables()) {
            if (!variable.getSort().isArithmetic()) {
                logger.error("Atom-构造函数: 布尔变量 {} 出现在算术原子中", variable);
                throw new UnsupportedFormulaException("布尔变量 '" + variable.getName() + "' 不能出现在算术比较中");
            }
        }

        // 常数原子只做提示，真假交给表格判断
        if (this.expression.isConstant()) {
            if (relation.holds(this.expression.getConstant())) {
                logger.debug("Atom-构造函数: 创建了一个恒真原子: {}", this);
            } else {
                logger.warn("Atom-构造函数: 创建了一个恒假原子: {}", this);
            }
        }
        this.hashCode = Objects.hash(this.expression, this.relation);
    }

    /**
     * 工厂方法：创建 left ~ right 原子。
     */
    public static Atom of(LinearExpression left, RelationType relation, LinearExpression right) {
        return new Atom(left, right, relation);
    }

    /**
     * 工厂方法：创建 expression ~ 0 原子。
     */
    public static Atom of(LinearExpression expression, RelationType relation) {
        return new Atom(expression, LinearExpression.ZERO, relation);
    }

    /**
     * 取反当前原子。等式的否定不是单个原子，由 NegationNormalizer 拆成两个严格不等式。
     * @throws UnsupportedOperationException 对等式取反
     */
    public Atom negate() {
        // ¬(E ~ 0) => E ~' 0
        return new Atom(this.expression, LinearExpression.ZERO, this.relation.negate());
    }

    /**
     * 同一表达式换一个关系。
     */
    public Atom withRelation(RelationType newRelation) {
        return new Atom(this.expression, LinearExpression.ZERO, newRelation);
    }

    /**
     * 右侧常数，即 Σ c_i v_i ~ rhs 中的 rhs。
     */
    public Rational getRightHandSide() {
        return expression.getConstant().negate();
    }

    @Override
    public FormulaKind getKind() {
        return FormulaKind.ATOM;
    }

    @Override
    public boolean evaluate(Model model) {
        return relation.holds(expression.evaluate(model));
    }

    @Override
    public void collectVariables(Set<Variable> into) {
        into.addAll(expression.getVariables());
    }

    @Override
    public BoolExpr toZ3BoolExpr(Context ctx, Z3VariableManager varManager) {
        ArithExpr z3LeftExpr = expression.toZ3ArithExpr(ctx, varManager);
        ArithExpr z3Zero = ctx.mkReal(0);

        return switch (relation) {
            case LT -> ctx.mkLt(z3LeftExpr, z3Zero);
            case LE -> ctx.mkLe(z3LeftExpr, z3Zero);
            case EQ -> ctx.mkEq(z3LeftExpr, z3Zero);
            case GE -> ctx.mkGe(z3LeftExpr, z3Zero);
            case GT -> ctx.mkGt(z3LeftExpr, z3Zero);
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Atom that = (Atom) o;
        // 由于构造函数已规范化，直接比较字段即可
        return relation == that.relation && expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return expression.toString() + " " + relation.getSymbol() + " 0";
    }
}
