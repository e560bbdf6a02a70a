package org.lrasolver.expressions.formulas;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import org.lrasolver.core.Model;
import org.lrasolver.core.Variable;
import org.lrasolver.symbolic.Z3VariableManager;

import java.util.Objects;
import java.util.Set;

/**
 * 布尔变量与公式的等价 w == φ。
 * 求解时 w 作为 0/1 列出现在表格中，一旦 w 取值就断言 φ 或 ¬φ。
 */
@Getter
public final class Equivalence implements Formula {

    private final BooleanVar booleanVar;
    private final Formula body;

    Equivalence(BooleanVar booleanVar, Formula body) {
        this.booleanVar = Objects.requireNonNull(booleanVar, "Equivalence: booleanVar 不能为 null");
        this.body = Objects.requireNonNull(body, "Equivalence: body 不能为 null");
    }

    public Variable getVariable() {
        return booleanVar.getVariable();
    }

    @Override
    public FormulaKind getKind() {
        return FormulaKind.EQUIVALENCE;
    }

    @Override
    public boolean evaluate(Model model) {
        return booleanVar.evaluate(model) == body.evaluate(model);
    }

    @Override
    public void collectVariables(Set<Variable> into) {
        booleanVar.collectVariables(into);
        body.collectVariables(into);
    }

    @Override
    public BoolExpr toZ3BoolExpr(Context ctx, Z3VariableManager varManager) {
        return ctx.mkIff(booleanVar.toZ3BoolExpr(ctx, varManager), body.toZ3BoolExpr(ctx, varManager));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Equivalence that = (Equivalence) o;
        return booleanVar.equals(that.booleanVar) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(FormulaKind.EQUIVALENCE, booleanVar, body);
    }

    @Override
    public String toString() {
        return "(" + booleanVar + " == " + body + ")";
    }
}
