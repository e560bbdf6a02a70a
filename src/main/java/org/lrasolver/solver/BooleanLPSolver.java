package org.lrasolver.solver;

import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.lrasolver.core.Model;
import org.lrasolver.core.Sort;
import org.lrasolver.core.Variable;
import org.lrasolver.core.VariableRegistry;
import org.lrasolver.exceptions.EmptyScopeStackException;
import org.lrasolver.exceptions.UnsupportedFormulaException;
import org.lrasolver.expressions.formulas.And;
import org.lrasolver.expressions.formulas.Formula;
import org.lrasolver.expressions.formulas.FormulaKind;
import org.lrasolver.expressions.formulas.NegationNormalizer;
import org.lrasolver.expressions.linear.Atom;
import org.lrasolver.expressions.linear.LinearExpression;
import org.lrasolver.simplex.FeasibilityResult;
import org.lrasolver.simplex.SimplexEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 增量式线性有理数算术 + 布尔求解器，带作用域栈。
 * <p>
 * 断言时只做构建：无条件的原子立刻成为表格行，其余部分 (析取、文字、等价式) 留给 check 时的分支搜索。
 * push 记录表格检查点，pop 恢复它，因此 pop 之后的 check 与 push 之前的 check 结果一致。
 * check 不改变作用域栈，重复调用结果相同。
 * <p>
 * 单线程使用。
 * @author Ayalyt
 */
public class BooleanLPSolver {

    private static final Logger logger = LoggerFactory.getLogger(BooleanLPSolver.class);

    @Getter
    private final SolverConfig config;
    private final VariableRegistry registry;
    private final SimplexEngine engine;
    // 下标 0 为基础作用域
    private final List<Scope> scopes;

    private Model model;

    public BooleanLPSolver() {
        this(SolverConfig.load());
    }

    public BooleanLPSolver(SolverConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.registry = new VariableRegistry();
        this.engine = new SimplexEngine(config.getMaxPivots(), config.isVerifyInvariants());
        this.scopes = new ArrayList<>();
        this.scopes.add(new Scope(null));
        logger.info("创建 BooleanLPSolver: {}", config);
    }

    // ========== 变量 ==========

    /**
     * 声明一个变量。同名同 sort 时返回已有变量。
     * @throws org.lrasolver.exceptions.DuplicateVariableException 同名但 sort 不同
     */
    public Variable newVariable(String name, Sort sort) {
        model = null;
        return registry.newVariable(name, sort);
    }

    public List<Variable> getVariables() {
        return registry.getVariables();
    }

    // ========== 断言与作用域 ==========

    /**
     * 把公式加入当前作用域。不做求解。
     * @throws UnsupportedFormulaException 公式使用了不属于本求解器的变量
     */
    public void addAssertion(Formula formula) {
        Objects.requireNonNull(formula, "formula cannot be null");
        requireOwnVariables(formula.getVariables(), formula);
        model = null;

        Scope top = currentScope();
        top.getAssertions().add(formula);

        Deque<Formula> parts = new ArrayDeque<>();
        parts.add(NegationNormalizer.normalize(formula));
        int rows = 0;
        while (!parts.isEmpty()) {
            Formula part = parts.poll();
            if (part.getKind() == FormulaKind.AND) {
                parts.addAll(((And) part).getOperands());
            } else if (part.getKind() == FormulaKind.ATOM) {
                engine.addAtom((Atom) part);
                rows++;
            } else {
                top.getDeferred().add(part);
            }
        }
        logger.info("作用域 {} 加入断言 {}: {} 行进入表格", getScopeDepth(), formula, rows);
    }

    public void push() {
        model = null;
        scopes.add(new Scope(engine.snapshot()));
        logger.info("push: 作用域深度 {}", getScopeDepth());
    }

    /**
     * 丢弃当前作用域的所有断言。
     * @throws EmptyScopeStackException 只剩基础作用域
     */
    public void pop() {
        if (scopes.size() == 1) {
            logger.error("pop: 作用域栈中只剩基础作用域");
            throw new EmptyScopeStackException();
        }
        model = null;
        Scope popped = scopes.remove(scopes.size() - 1);
        engine.restore(popped.getCheckpoint());
        logger.info("pop: 丢弃 {} 条断言，作用域深度 {}", popped.getAssertions().size(), getScopeDepth());
    }

    /**
     * push 的层数，基础作用域为 0。
     */
    public int getScopeDepth() {
        return scopes.size() - 1;
    }

    /**
     * 当前生效的断言，从基础作用域到栈顶。
     */
    public List<Formula> getActiveAssertions() {
        List<Formula> active = new ArrayList<>();
        for (Scope scope : scopes) {
            active.addAll(scope.getAssertions());
        }
        return Collections.unmodifiableList(active);
    }

    // ========== 求解 ==========

    public Pair<CheckResult, List<String>> check() {
        return check(List.of());
    }

    public Pair<CheckResult, List<String>> check(Variable... variables) {
        List<LinearExpression> queries = new ArrayList<>(variables.length);
        for (Variable variable : variables) {
            queries.add(LinearExpression.of(variable));
        }
        return check(queries);
    }

    /**
     * 判定当前所有断言的合取。
     *
     * @param queries 需要取值的表达式
     * @return 结果和各查询在模型下的值 (规范有理数字符串，顺序与 queries 相同)；不可满足或未知时为空列表
     * @throws UnsupportedFormulaException 查询使用了不属于本求解器的变量
     */
    public Pair<CheckResult, List<String>> check(List<LinearExpression> queries) {
        for (LinearExpression query : queries) {
            requireOwnVariables(query.getVariables(), query);
        }
        model = null;

        CheckResult result = decide();
        if (result != CheckResult.SATISFIABLE) {
            logger.info("check: {}", result);
            return Pair.of(result, List.of());
        }
        List<String> values = queries.stream()
                .map(query -> query.evaluate(model).toString())
                .toList();
        logger.info("check: {} {}", result, model);
        return Pair.of(result, values);
    }

    /**
     * 最近一次可满足的 check 得到的完整模型；之后任何修改都会清除它。
     */
    public Optional<Model> getModel() {
        return Optional.ofNullable(model);
    }

    private CheckResult decide() {
        FeasibilityResult feasibility = engine.checkFeasibility();
        if (feasibility == FeasibilityResult.INFEASIBLE) {
            return CheckResult.UNSATISFIABLE;
        }
        if (feasibility == FeasibilityResult.PIVOT_LIMIT) {
            logger.warn("无条件约束的可行性检查超出主元上限 {}", config.getMaxPivots());
            return CheckResult.UNKNOWN;
        }

        List<Formula> deferred = new ArrayList<>();
        for (Scope scope : scopes) {
            deferred.addAll(scope.getDeferred());
        }
        CaseSplitter splitter = new CaseSplitter(engine, config.getMaxCaseSplits(), registry.getVariables());
        try {
            CheckResult result = splitter.solve(deferred);
            if (result == CheckResult.SATISFIABLE) {
                model = splitter.getModel();
            }
            return result;
        } catch (UnsupportedFormulaException e) {
            logger.warn("求解过程中遇到不支持的公式，返回 UNKNOWN: {}", e.getMessage());
            return CheckResult.UNKNOWN;
        }
    }

    private Scope currentScope() {
        return scopes.get(scopes.size() - 1);
    }

    private void requireOwnVariables(Collection<Variable> variables, Object source) {
        for (Variable variable : variables) {
            if (!registry.contains(variable)) {
                logger.error("{} 中的变量 '{}' 不属于本求解器", source, variable.getName());
                throw new UnsupportedFormulaException("变量 '" + variable.getName() + "' 不属于本求解器");
            }
        }
    }
}
