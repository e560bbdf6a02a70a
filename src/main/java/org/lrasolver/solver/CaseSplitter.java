package org.lrasolver.solver;

import lombok.Getter;
import org.lrasolver.core.Model;
import org.lrasolver.core.Variable;
import org.lrasolver.exceptions.UnsupportedFormulaException;
import org.lrasolver.expressions.formulas.And;
import org.lrasolver.expressions.formulas.BooleanVar;
import org.lrasolver.expressions.formulas.Equivalence;
import org.lrasolver.expressions.formulas.Formula;
import org.lrasolver.expressions.formulas.FormulaKind;
import org.lrasolver.expressions.formulas.Formulas;
import org.lrasolver.expressions.formulas.NegationNormalizer;
import org.lrasolver.expressions.formulas.Not;
import org.lrasolver.expressions.formulas.Or;
import org.lrasolver.expressions.linear.Atom;
import org.lrasolver.simplex.FeasibilityResult;
import org.lrasolver.simplex.OptimizationResult;
import org.lrasolver.simplex.SimplexEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 在表格之上对析取和布尔变量做深度优先的分支搜索。
 * <p>
 * 每个分支先传播：原子加为表格行，合取拆开，文字给布尔变量赋值并固定其 0/1 列，
 * 已赋值变量上的等价式释放 φ 或 ¬φ，其余等价式等待变量取值，析取排队。
 * 传播后检查表格可行性；然后对第一个尚未满足的析取逐项分支，
 * 没有析取时对 id 最小的待定布尔变量先试真后试假。都没有时即为可满足的叶子。
 * 每个分支在表格检查点上进行，返回前恢复。
 * <p>
 * 一个实例只用于一次搜索。
 * @author Ayalyt
 */
final class CaseSplitter {

    private static final Logger logger = LoggerFactory.getLogger(CaseSplitter.class);

    private final SimplexEngine engine;
    private final int maxCaseSplits;
    private final Collection<Variable> modelVariables;

    @Getter
    private int caseSplits;

    /** 可满足时的模型，否则为 null。 */
    @Getter
    private Model model;

    CaseSplitter(SimplexEngine engine, int maxCaseSplits, Collection<Variable> modelVariables) {
        this.engine = Objects.requireNonNull(engine, "engine cannot be null");
        this.maxCaseSplits = maxCaseSplits;
        this.modelVariables = Objects.requireNonNull(modelVariables, "modelVariables cannot be null");
    }

    /**
     * 判定表格当前行与 formulas 的合取是否可满足。表格在返回时恢复到调用前的状态。
     * @throws UnsupportedFormulaException 公式规范化后仍含无法处理的结构
     */
    CheckResult solve(List<Formula> formulas) {
        Branch root = new Branch();
        for (Formula formula : formulas) {
            root.pending.add(NegationNormalizer.normalize(formula));
        }
        SimplexEngine.Checkpoint checkpoint = engine.snapshot();
        try {
            CheckResult result = search(root);
            logger.debug("分支搜索结束: {}，共分支 {} 次", result, caseSplits);
            return result;
        } finally {
            engine.restore(checkpoint);
        }
    }

    private CheckResult search(Branch branch) {
        if (!propagate(branch)) {
            return CheckResult.UNSATISFIABLE;
        }
        FeasibilityResult feasibility = engine.checkFeasibility();
        if (feasibility == FeasibilityResult.INFEASIBLE) {
            return CheckResult.UNSATISFIABLE;
        }
        if (feasibility == FeasibilityResult.PIVOT_LIMIT) {
            return CheckResult.UNKNOWN;
        }

        for (Or disjunction : branch.disjunctions) {
            List<Formula> remaining = new ArrayList<>();
            boolean satisfied = false;
            for (Formula operand : disjunction.getOperands()) {
                Boolean value = literalValue(operand, branch.assignment);
                if (value == null) {
                    remaining.add(operand);
                } else if (value) {
                    satisfied = true;
                    break;
                }
            }
            if (!satisfied) {
                return branchOn(branch, disjunction, remaining);
            }
        }

        if (!branch.waiting.isEmpty()) {
            Variable decision = branch.waiting.firstKey();
            BooleanVar literal = Formulas.var(decision);
            return branchOn(branch, null, List.of(literal, Formulas.not(literal)));
        }

        OptimizationResult vertex = engine.selectVertex();
        logger.debug("可满足的叶子，顶点选择结果 {}", vertex);
        model = engine.extractModel(modelVariables, branch.assignment);
        return CheckResult.SATISFIABLE;
    }

    /**
     * 依次在每个候选上分支，遇到可满足立即返回。resolved 为被这次分支消解的析取，可为 null。
     */
    private CheckResult branchOn(Branch branch, Or resolved, List<Formula> alternatives) {
        if (alternatives.isEmpty()) {
            return CheckResult.UNSATISFIABLE;
        }
        boolean unknown = false;
        SimplexEngine.Checkpoint checkpoint = engine.snapshot();
        for (Formula alternative : alternatives) {
            if (caseSplits >= maxCaseSplits) {
                logger.warn("分支次数超出上限 {}", maxCaseSplits);
                return CheckResult.UNKNOWN;
            }
            caseSplits++;
            Branch child = branch.copy();
            if (resolved != null) {
                child.disjunctions.remove(resolved);
            }
            child.pending.add(alternative);
            logger.debug("分支 #{}: {}", caseSplits, alternative);

            CheckResult result;
            try {
                result = search(child);
            } finally {
                engine.restore(checkpoint);
            }
            if (result == CheckResult.SATISFIABLE) {
                return result;
            }
            if (result == CheckResult.UNKNOWN) {
                unknown = true;
            }
        }
        return unknown ? CheckResult.UNKNOWN : CheckResult.UNSATISFIABLE;
    }

    /**
     * @return 发现冲突时返回 false
     */
    private boolean propagate(Branch branch) {
        while (!branch.pending.isEmpty()) {
            Formula formula = branch.pending.poll();
            switch (formula.getKind()) {
                case ATOM -> engine.addAtom((Atom) formula);
                case AND -> branch.pending.addAll(((And) formula).getOperands());
                case OR -> {
                    List<Formula> operands = ((Or) formula).getOperands();
                    if (operands.isEmpty()) {
                        return false;
                    }
                    if (operands.size() == 1) {
                        branch.pending.add(operands.get(0));
                    } else {
                        branch.disjunctions.add((Or) formula);
                    }
                }
                case BOOLEAN_VAR -> {
                    if (!assign(branch, ((BooleanVar) formula).getVariable(), true)) {
                        return false;
                    }
                }
                case NOT -> {
                    if (!(((Not) formula).getOperand() instanceof BooleanVar literal)) {
                        throw new UnsupportedFormulaException("规范化后的公式中出现了非文字的否定: " + formula);
                    }
                    if (!assign(branch, literal.getVariable(), false)) {
                        return false;
                    }
                }
                case EQUIVALENCE -> {
                    Equivalence equivalence = (Equivalence) formula;
                    Boolean value = branch.assignment.get(equivalence.getVariable());
                    if (value != null) {
                        branch.pending.add(NegationNormalizer.normalize(equivalence.getBody(), value));
                    } else {
                        branch.waiting.computeIfAbsent(equivalence.getVariable(), k -> new ArrayList<>()).add(equivalence);
                    }
                }
            }
        }
        return true;
    }

    private boolean assign(Branch branch, Variable variable, boolean value) {
        Boolean existing = branch.assignment.get(variable);
        if (existing != null) {
            if (existing != value) {
                logger.debug("布尔变量 {} 的取值冲突", variable.getName());
                return false;
            }
            return true;
        }
        branch.assignment.put(variable, value);
        engine.pinBoolean(variable, value);
        List<Equivalence> released = branch.waiting.remove(variable);
        if (released != null) {
            for (Equivalence equivalence : released) {
                branch.pending.add(NegationNormalizer.normalize(equivalence.getBody(), value));
            }
        }
        return true;
    }

    /**
     * 文字在当前赋值下的真值；不是文字或变量未赋值时返回 null。
     */
    private static Boolean literalValue(Formula formula, Map<Variable, Boolean> assignment) {
        if (formula.getKind() == FormulaKind.BOOLEAN_VAR) {
            return assignment.get(((BooleanVar) formula).getVariable());
        }
        if (formula.getKind() == FormulaKind.NOT && ((Not) formula).getOperand() instanceof BooleanVar literal) {
            Boolean value = assignment.get(literal.getVariable());
            return value == null ? null : !value;
        }
        return null;
    }

    /**
     * 一个搜索分支的布尔状态。表格状态不在其中，由检查点管理。
     */
    private static final class Branch {
        private final Deque<Formula> pending = new ArrayDeque<>();
        private final SortedMap<Variable, Boolean> assignment = new TreeMap<>();
        private final List<Or> disjunctions = new ArrayList<>();
        private final SortedMap<Variable, List<Equivalence>> waiting = new TreeMap<>();

        Branch copy() {
            Branch copy = new Branch();
            copy.pending.addAll(pending);
            copy.assignment.putAll(assignment);
            copy.disjunctions.addAll(disjunctions);
            for (Map.Entry<Variable, List<Equivalence>> entry : waiting.entrySet()) {
                copy.waiting.put(entry.getKey(), new ArrayList<>(entry.getValue()));
            }
            return copy;
        }
    }
}
