package org.lrasolver.solver;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.lrasolver.core.Sort;
import org.lrasolver.core.Variable;
import org.lrasolver.core.VariableRegistry;
import org.lrasolver.expressions.formulas.Formula;
import org.lrasolver.expressions.linear.LinearExpression;
import org.lrasolver.simplex.SimplexEngine;
import org.lrasolver.utils.Rational;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.lrasolver.expressions.formulas.Formulas.*;

class CaseSplitterTest {

    private VariableRegistry registry;
    private SimplexEngine engine;
    private Variable x;
    private LinearExpression ex;

    @BeforeEach
    void setUp() {
        registry = new VariableRegistry();
        engine = new SimplexEngine(10000, true);
        x = registry.newVariable("x", Sort.SIGNED);
        ex = LinearExpression.of(x);
    }

    @Test
    @DisplayName("第一个析取项冲突后尝试第二个，结束后表格恢复")
    void testSecondDisjunct_AndTableauRestored() {
        CaseSplitter splitter = new CaseSplitter(engine, 100, registry.getVariables());
        List<Formula> formulas = List.of(or(le(ex, 1), ge(ex, 3)), ge(ex, 2));

        assertEquals(CheckResult.SATISFIABLE, splitter.solve(formulas));
        assertAll("Search result",
                () -> assertEquals(Rational.valueOf(3), splitter.getModel().getValue(x)),
                () -> assertEquals(2, splitter.getCaseSplits()),
                () -> assertEquals(0, engine.getTableau().getRowCount()),
                () -> assertEquals(0, engine.getTableau().getColumnCount())
        );
    }

    @Test
    @DisplayName("分支预算用尽时返回 UNKNOWN")
    void testBudgetExhausted() {
        CaseSplitter splitter = new CaseSplitter(engine, 1, registry.getVariables());

        assertEquals(CheckResult.UNKNOWN, splitter.solve(List.of(or(le(ex, 1), ge(ex, 3)), ge(ex, 2))));
        assertNull(splitter.getModel());
    }

    @Test
    @DisplayName("所有分支都冲突时不可满足")
    void testAllBranchesFail() {
        CaseSplitter splitter = new CaseSplitter(engine, 100, registry.getVariables());

        assertEquals(CheckResult.UNSATISFIABLE, splitter.solve(List.of(or(le(ex, 1), ge(ex, 3)), eq(ex, 2))));
        assertEquals(2, splitter.getCaseSplits());
    }

    @Test
    @DisplayName("空的析取不可满足，空的公式列表可满足")
    void testTrivialInputs() {
        assertEquals(CheckResult.UNSATISFIABLE,
                new CaseSplitter(engine, 100, registry.getVariables()).solve(List.of(FALSE)));

        CaseSplitter splitter = new CaseSplitter(engine, 100, registry.getVariables());
        assertEquals(CheckResult.SATISFIABLE, splitter.solve(List.of(TRUE)));
        assertEquals(Rational.ZERO, splitter.getModel().getValue(x));
    }
}
