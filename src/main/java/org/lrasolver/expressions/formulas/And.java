package org.lrasolver.expressions.formulas;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import org.lrasolver.core.Model;
import org.lrasolver.core.Variable;
import org.lrasolver.symbolic.Z3VariableManager;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 合取。空合取表示恒真。
 */
@Getter
public final class And implements Formula {

    private final List<Formula> operands;

    And(List<Formula> operands) {
        this.operands = List.copyOf(operands);
    }

    @Override
    public FormulaKind getKind() {
        return FormulaKind.AND;
    }

    @Override
    public boolean evaluate(Model model) {
        return operands.stream().allMatch(f -> f.evaluate(model));
    }

    @Override
    public void collectVariables(Set<Variable> into) {
        operands.forEach(f -> f.collectVariables(into));
    }

    @Override
    public BoolExpr toZ3BoolExpr(Context ctx, Z3VariableManager varManager) {
        if (operands.isEmpty()) {
            return ctx.mkTrue();
        }
        BoolExpr[] z3Operands = operands.stream()
                .map(f -> f.toZ3BoolExpr(ctx, varManager))
                .toArray(BoolExpr[]::new);
        return ctx.mkAnd(z3Operands);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return operands.equals(((And) o).operands);
    }

    @Override
    public int hashCode() {
        return Objects.hash(FormulaKind.AND, operands);
    }

    @Override
    public String toString() {
        if (operands.isEmpty()) {
            return "TRUE";
        }
        return "(" + operands.stream().map(Formula::toString).collect(Collectors.joining(" /\\ ")) + ")";
    }
}
