package org.lrasolver.symbolic;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Solver;
import lombok.Getter;
import org.lrasolver.core.Sort;
import org.lrasolver.core.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 负责管理求解器 Variable 到 Z3 常量的映射。
 * 确保每个变量在 Z3 Context 中有唯一的对应常量：算术变量为实数常量，布尔变量为布尔常量。
 * @author Ayalyt
 */
@Getter
public class Z3VariableManager {

    private static final Logger logger = LoggerFactory.getLogger(Z3VariableManager.class);

    private final Context ctx;
    // 非线程安全，一个 Context 对应一个实例
    private final Map<Variable, ArithExpr> arithZ3Vars;
    private final Map<Variable, BoolExpr> boolZ3Vars;

    public Z3VariableManager(Context ctx) {
        this.ctx = Objects.requireNonNull(ctx, "Z3 Context cannot be null.");
        this.arithZ3Vars = new HashMap<>();
        this.boolZ3Vars = new HashMap<>();
    }

    /**
     * 获取变量对应的 Z3 算术表达式。布尔变量映射为 ite(w, 1, 0)。
     */
    public ArithExpr getZ3ArithVar(Variable variable) {
        if (variable.isBoolean()) {
            return (ArithExpr) ctx.mkITE(getZ3BoolVar(variable), ctx.mkReal(1), ctx.mkReal(0));
        }
        return arithZ3Vars.computeIfAbsent(variable, v -> {
            logger.debug("创建 Z3 实数变量: {}", v.getName());
            return ctx.mkRealConst(v.getName());
        });
    }

    /**
     * 获取布尔变量对应的 Z3 布尔常量。
     * @throws IllegalArgumentException 变量不是布尔 sort
     */
    public BoolExpr getZ3BoolVar(Variable variable) {
        if (!variable.isBoolean()) {
            throw new IllegalArgumentException("变量 '" + variable.getName() + "' 不是布尔变量");
        }
        return boolZ3Vars.computeIfAbsent(variable, v -> {
            logger.debug("创建 Z3 布尔变量: {}", v.getName());
            return ctx.mkBoolConst(v.getName());
        });
    }

    /**
     * 向 Solver 断言变量 sort 带来的全局约束：所有 UNSIGNED 变量 &gt;= 0。
     */
    public void assertGlobalConstraints(Solver solver, Collection<Variable> variables) {
        for (Variable variable : variables) {
            if (variable.getSort() == Sort.UNSIGNED) {
                solver.add(ctx.mkGe(getZ3ArithVar(variable), ctx.mkReal(0)));
                logger.debug("断言 Z3 约束: {} >= 0", variable.getName());
            }
        }
    }
}
