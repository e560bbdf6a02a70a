package org.lrasolver.symbolic;

import com.microsoft.z3.Context;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import org.lrasolver.core.Variable;
import org.lrasolver.expressions.formulas.Formula;
import org.lrasolver.solver.CheckResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

/**
 * 把公式导出到 Z3 并判定其合取，用于对照求解器的结果。
 * 持有一个 Z3 Context，使用完毕需要 close。
 */
public final class Z3Oracle implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Z3Oracle.class);

    private final Context ctx;
    private final Z3VariableManager varManager;

    public Z3Oracle() {
        this.ctx = new Context();
        this.varManager = new Z3VariableManager(ctx);
    }

    public CheckResult check(Collection<? extends Formula> formulas) {
        Solver solver = ctx.mkSolver();
        Set<Variable> variables = new TreeSet<>();
        for (Formula formula : formulas) {
            formula.collectVariables(variables);
        }
        varManager.assertGlobalConstraints(solver, variables);
        for (Formula formula : formulas) {
            solver.add(formula.toZ3BoolExpr(ctx, varManager));
        }
        Status status = solver.check();
        logger.debug("Z3 判定 {} 条公式: {}", formulas.size(), status);
        return switch (status) {
            case SATISFIABLE -> CheckResult.SATISFIABLE;
            case UNSATISFIABLE -> CheckResult.UNSATISFIABLE;
            case UNKNOWN -> CheckResult.UNKNOWN;
        };
    }

    @Override
    public void close() {
        ctx.close();
    }
}
