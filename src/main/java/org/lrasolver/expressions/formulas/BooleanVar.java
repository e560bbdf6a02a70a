package org.lrasolver.expressions.formulas;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import org.lrasolver.core.Model;
import org.lrasolver.core.Sort;
import org.lrasolver.core.Variable;
import org.lrasolver.exceptions.UnsupportedFormulaException;
import org.lrasolver.symbolic.Z3VariableManager;

import java.util.Objects;
import java.util.Set;

/**
 * 布尔变量叶子节点。
 */
@Getter
public final class BooleanVar implements Formula {

    private final Variable variable;

    BooleanVar(Variable variable) {
        Objects.requireNonNull(variable, "BooleanVar: variable 不能为 null");
        if (variable.getSort() != Sort.BOOLEAN) {
            throw new UnsupportedFormulaException("变量 '" + variable.getName() + "' 的 sort 是 "
                    + variable.getSort() + "，不能作为布尔公式使用");
        }
        this.variable = variable;
    }

    @Override
    public FormulaKind getKind() {
        return FormulaKind.BOOLEAN_VAR;
    }

    @Override
    public boolean evaluate(Model model) {
        return model.isTrue(variable);
    }

    @Override
    public void collectVariables(Set<Variable> into) {
        into.add(variable);
    }

    @Override
    public BoolExpr toZ3BoolExpr(Context ctx, Z3VariableManager varManager) {
        return varManager.getZ3BoolVar(variable);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return variable.equals(((BooleanVar) o).variable);
    }

    @Override
    public int hashCode() {
        return variable.hashCode();
    }

    @Override
    public String toString() {
        return variable.getName();
    }
}
