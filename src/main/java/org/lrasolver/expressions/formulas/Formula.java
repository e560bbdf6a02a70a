package org.lrasolver.expressions.formulas;

import org.lrasolver.core.Model;
import org.lrasolver.core.Variable;
import org.lrasolver.expressions.ToZ3BoolExpr;

import java.util.Set;
import java.util.TreeSet;

/**
 * 布尔-线性算术公式。具体节点见 {@link FormulaKind}，统一通过 {@link Formulas} 中的构造函数创建。
 * 所有实现都是不可变的。
 */
public interface Formula extends ToZ3BoolExpr {

    FormulaKind getKind();

    /**
     * 用精确有理数在模型下求值。
     */
    boolean evaluate(Model model);

    /**
     * 把公式中出现的变量加入 into。
     */
    void collectVariables(Set<Variable> into);

    default Set<Variable> getVariables() {
        Set<Variable> variables = new TreeSet<>();
        collectVariables(variables);
        return variables;
    }
}
