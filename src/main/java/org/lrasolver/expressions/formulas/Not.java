package org.lrasolver.expressions.formulas;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import org.lrasolver.core.Model;
import org.lrasolver.core.Variable;
import org.lrasolver.symbolic.Z3VariableManager;

import java.util.Objects;
import java.util.Set;

@Getter
public final class Not implements Formula {

    private final Formula operand;

    Not(Formula operand) {
        this.operand = Objects.requireNonNull(operand, "Not: operand 不能为 null");
    }

    @Override
    public FormulaKind getKind() {
        return FormulaKind.NOT;
    }

    @Override
    public boolean evaluate(Model model) {
        return !operand.evaluate(model);
    }

    @Override
    public void collectVariables(Set<Variable> into) {
        operand.collectVariables(into);
    }

    @Override
    public BoolExpr toZ3BoolExpr(Context ctx, Z3VariableManager varManager) {
        return ctx.mkNot(operand.toZ3BoolExpr(ctx, varManager));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return operand.equals(((Not) o).operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(FormulaKind.NOT, operand);
    }

    @Override
    public String toString() {
        return "!" + operand;
    }
}
