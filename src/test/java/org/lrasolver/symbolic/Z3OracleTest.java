package org.lrasolver.symbolic;

import com.microsoft.z3.Context;
import org.apache.commons.lang3.tuple.Pair;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.lrasolver.core.Model;
import org.lrasolver.core.Sort;
import org.lrasolver.core.Variable;
import org.lrasolver.expressions.formulas.BooleanVar;
import org.lrasolver.expressions.formulas.Formula;
import org.lrasolver.expressions.linear.LinearExpression;
import org.lrasolver.solver.BooleanLPSolver;
import org.lrasolver.solver.CheckResult;
import org.lrasolver.solver.SolverConfig;
import org.lrasolver.utils.Rational;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;
import static org.lrasolver.expressions.formulas.Formulas.*;

/**
 * 与 Z3 对照判定结果。本机无法加载 Z3 时跳过。
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class Z3OracleTest {

    private Z3Oracle oracle;

    @BeforeAll
    void setUp() {
        boolean available;
        try (Context probe = new Context()) {
            available = probe.mkTrue() != null;
        } catch (LinkageError | RuntimeException e) {
            available = false;
        }
        assumeTrue(available, "Z3 native library is not available");
        oracle = new Z3Oracle();
    }

    @AfterAll
    void tearDown() {
        if (oracle != null) {
            oracle.close();
        }
    }

    private CheckResult decideWithSolver(BooleanLPSolver solver, List<Formula> formulas) {
        formulas.forEach(solver::addAssertion);
        return solver.check().getLeft();
    }

    @Test
    @DisplayName("固定样例与 Z3 一致")
    void testFixedCases() {
        BooleanLPSolver solver = new BooleanLPSolver();
        Variable x = solver.newVariable("x", Sort.SIGNED);
        Variable y = solver.newVariable("y", Sort.SIGNED);
        Variable u = solver.newVariable("u", Sort.UNSIGNED);
        Variable w = solver.newVariable("w", Sort.BOOLEAN);
        LinearExpression ex = LinearExpression.of(x);
        LinearExpression ey = LinearExpression.of(y);
        LinearExpression eu = LinearExpression.of(u);
        BooleanVar bw = var(w);

        List<List<Formula>> cases = List.of(
                List.of(le(ex.multiply(Rational.valueOf(2)), 10)),
                List.of(le(ex, 3), ge(ex, 5)),
                List.of(iff(bw, lt(ex, ey)), or(bw, gt(ex, ey))),
                List.of(iff(bw, lt(ex, ey)), bw, gt(ex, ey)),
                List.of(le(eu, -1)),
                List.of(not(eq(ex, ey)), le(ex, ey), ge(ex, ey)),
                List.of(or(lt(eu, 1), gt(ex.add(eu), 4)), le(ex, 2), ge(eu, 1))
        );

        for (List<Formula> formulas : cases) {
            solver.push();
            CheckResult ours = decideWithSolver(solver, formulas);
            solver.pop();
            assertEquals(oracle.check(formulas), ours, "formulas: " + formulas);
        }
    }

    @Test
    @DisplayName("随机生成的公式与 Z3 一致，可满足时模型满足所有断言")
    void testRandomFormulas() {
        Random random = new Random(20240611L);
        for (int round = 0; round < 60; round++) {
            BooleanLPSolver solver = new BooleanLPSolver(SolverConfig.builder().verifyInvariants(true).build());
            List<LinearExpression> terms = new ArrayList<>();
            terms.add(LinearExpression.of(solver.newVariable("a", Sort.SIGNED)));
            terms.add(LinearExpression.of(solver.newVariable("b", Sort.SIGNED)));
            terms.add(LinearExpression.of(solver.newVariable("c", Sort.UNSIGNED)));
            BooleanVar flag = var(solver.newVariable("f", Sort.BOOLEAN));

            List<Formula> formulas = new ArrayList<>();
            int count = 2 + random.nextInt(4);
            for (int i = 0; i < count; i++) {
                Formula atom = randomAtom(random, terms);
                formulas.add(switch (random.nextInt(4)) {
                    case 0 -> atom;
                    case 1 -> or(atom, randomAtom(random, terms));
                    case 2 -> iff(flag, atom);
                    default -> not(and(atom, randomAtom(random, terms)));
                });
            }

            CheckResult ours = decideWithSolver(solver, formulas);
            assertEquals(oracle.check(formulas), ours, "round " + round + ": " + formulas);
            if (ours == CheckResult.SATISFIABLE) {
                Model model = solver.getModel().orElseThrow();
                for (Formula formula : formulas) {
                    assertTrue(formula.evaluate(model), "round " + round + ": " + formula + " under " + model);
                }
            }
        }
    }

    @Test
    @DisplayName("随机交替 push/断言/pop，每一步都与 Z3 一致，pop 后回到 push 前的结果")
    void testRandomScopeOperations() {
        Random random = new Random(20240612L);
        for (int round = 0; round < 40; round++) {
            BooleanLPSolver solver = new BooleanLPSolver(SolverConfig.builder().verifyInvariants(true).build());
            Variable a = solver.newVariable("a", Sort.SIGNED);
            Variable b = solver.newVariable("b", Sort.SIGNED);
            Variable c = solver.newVariable("c", Sort.UNSIGNED);
            Variable f = solver.newVariable("f", Sort.BOOLEAN);
            List<LinearExpression> terms = List.of(LinearExpression.of(a), LinearExpression.of(b), LinearExpression.of(c));
            BooleanVar flag = var(f);
            Deque<Pair<CheckResult, List<String>>> beforePush = new ArrayDeque<>();

            for (int step = 0; step < 10; step++) {
                int op = random.nextInt(4);
                if (op == 0 && solver.getScopeDepth() < 3) {
                    beforePush.push(solver.check(a, b, c, f));
                    solver.push();
                } else if (op == 1 && solver.getScopeDepth() > 0) {
                    solver.pop();
                    assertEquals(beforePush.pop(), solver.check(a, b, c, f), "round " + round + " step " + step);
                } else {
                    Formula atom = randomAtom(random, terms);
                    solver.addAssertion(switch (random.nextInt(4)) {
                        case 0 -> atom;
                        case 1 -> or(atom, randomAtom(random, terms));
                        case 2 -> iff(flag, atom);
                        default -> not(and(atom, randomAtom(random, terms)));
                    });
                }

                List<Formula> active = solver.getActiveAssertions();
                Pair<CheckResult, List<String>> first = solver.check(a, b, c, f);
                assertEquals(oracle.check(active), first.getLeft(), "round " + round + " step " + step + ": " + active);
                assertEquals(first, solver.check(a, b, c, f), "round " + round + " step " + step);
                if (first.getLeft() == CheckResult.SATISFIABLE) {
                    Model model = solver.getModel().orElseThrow();
                    for (Formula formula : active) {
                        assertTrue(formula.evaluate(model), "round " + round + ": " + formula + " under " + model);
                    }
                }
            }
        }
    }

    private static Formula randomAtom(Random random, List<LinearExpression> terms) {
        LinearExpression left = LinearExpression.of(random.nextInt(7) - 3);
        for (LinearExpression term : terms) {
            left = left.add(term.multiply(Rational.valueOf(random.nextInt(5) - 2)));
        }
        LinearExpression right = LinearExpression.of(random.nextInt(11) - 5);
        return switch (random.nextInt(5)) {
            case 0 -> lt(left, right);
            case 1 -> le(left, right);
            case 2 -> eq(left, right);
            case 3 -> ge(left, right);
            default -> gt(left, right);
        };
    }
}
