package org.lrasolver.expressions.formulas;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.lrasolver.core.Model;
import org.lrasolver.core.Sort;
import org.lrasolver.core.Variable;
import org.lrasolver.core.VariableRegistry;
import org.lrasolver.expressions.linear.Atom;
import org.lrasolver.expressions.linear.LinearExpression;
import org.lrasolver.utils.Rational;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.lrasolver.expressions.formulas.Formulas.*;

class NegationNormalizerTest {

    private static Variable x, y, w;
    private static LinearExpression ex, ey;
    private static BooleanVar bw;

    @BeforeAll
    static void setUp() {
        VariableRegistry registry = new VariableRegistry();
        x = registry.newVariable("x", Sort.SIGNED);
        y = registry.newVariable("y", Sort.SIGNED);
        w = registry.newVariable("w", Sort.BOOLEAN);
        ex = LinearExpression.of(x);
        ey = LinearExpression.of(y);
        bw = var(w);
    }

    @Nested
    @DisplayName("原子")
    class AtomTests {

        @Test
        @DisplayName("¬(x <= 3) => x > 3")
        void testNegatedInequality() {
            assertEquals(gt(ex, 3), NegationNormalizer.normalize(not(le(ex, 3))));
        }

        @Test
        @DisplayName("¬(x = 3) => (x < 3) ∨ (x > 3)")
        void testNegatedEquality_BecomesDisjunction() {
            Formula normalized = NegationNormalizer.normalize(not(eq(ex, 3)));

            assertEquals(FormulaKind.OR, normalized.getKind());
            assertEquals(List.of(lt(ex, 3), gt(ex, 3)), ((Or) normalized).getOperands());
        }

        @Test
        @DisplayName("双重否定消去")
        void testDoubleNegation() {
            Atom atom = lt(ex, ey);

            assertEquals(atom, NegationNormalizer.normalize(not(not(atom))));
            assertEquals(bw, NegationNormalizer.normalize(not(not(bw))));
        }
    }

    @Nested
    @DisplayName("布尔结构")
    class StructureTests {

        @Test
        @DisplayName("De Morgan: ¬(a ∧ b) => ¬a ∨ ¬b")
        void testDeMorgan_And() {
            Formula normalized = NegationNormalizer.normalize(not(and(le(ex, 1), bw)));

            assertEquals(or(gt(ex, 1), not(bw)), normalized);
        }

        @Test
        @DisplayName("De Morgan: ¬(a ∨ b) => ¬a ∧ ¬b")
        void testDeMorgan_Or() {
            Formula normalized = NegationNormalizer.normalize(not(or(ge(ex, ey), bw)));

            assertEquals(and(lt(ex, ey), not(bw)), normalized);
        }

        @Test
        @DisplayName("否定只留在布尔变量之上")
        void testNotOnlyAboveBooleanVariables() {
            Formula normalized = NegationNormalizer.normalize(not(and(or(bw, eq(ex, ey)), not(le(ey, 0)))));

            assertTrue(onlyLiteralNegations(normalized), "normalized: " + normalized);
        }

        @Test
        @DisplayName("¬(w == φ) => w == ¬φ")
        void testNegatedEquivalence() {
            Formula normalized = NegationNormalizer.normalize(not(iff(bw, lt(ex, ey))));

            assertEquals(FormulaKind.EQUIVALENCE, normalized.getKind());
            Equivalence equivalence = (Equivalence) normalized;
            assertEquals(w, equivalence.getVariable());
            assertEquals(ge(ex, ey), NegationNormalizer.normalize(equivalence.getBody()));
        }

        @Test
        @DisplayName("规范化前后在任意模型下真值相同")
        void testNormalizationPreservesTruth() {
            Formula f = not(or(and(bw, eq(ex, ey)), not(iff(bw, lt(ex, 2)))));
            Formula normalized = NegationNormalizer.normalize(f);

            for (long xv = 0; xv <= 3; xv++) {
                for (long yv = 0; yv <= 3; yv++) {
                    for (long wv = 0; wv <= 1; wv++) {
                        Model model = Model.of(Map.of(x, Rational.valueOf(xv), y, Rational.valueOf(yv), w, Rational.valueOf(wv)));
                        assertEquals(f.evaluate(model), normalized.evaluate(model), "model " + model);
                    }
                }
            }
        }
    }

    @Test
    @DisplayName("两侧都不是布尔变量的 iff 展开为析取")
    void testIff_WithoutBooleanVariable() {
        Formula f = iff(le(ex, 1), ge(ey, 2));

        assertEquals(FormulaKind.OR, f.getKind());
    }

    @Test
    @DisplayName("TRUE 与 FALSE")
    void testConstants() {
        Model empty = Model.of(Map.of());

        assertTrue(TRUE.evaluate(empty));
        assertFalse(FALSE.evaluate(empty));
        assertEquals(TRUE, NegationNormalizer.normalize(not(FALSE)));
    }

    private static boolean onlyLiteralNegations(Formula formula) {
        return switch (formula.getKind()) {
            case ATOM, BOOLEAN_VAR -> true;
            case NOT -> ((Not) formula).getOperand().getKind() == FormulaKind.BOOLEAN_VAR;
            case AND -> ((And) formula).getOperands().stream().allMatch(NegationNormalizerTest::onlyLiteralNegations);
            case OR -> ((Or) formula).getOperands().stream().allMatch(NegationNormalizerTest::onlyLiteralNegations);
            case EQUIVALENCE -> true;
        };
    }
}
