package org.lrasolver.expressions.linear;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.lrasolver.core.Model;
import org.lrasolver.core.Sort;
import org.lrasolver.core.Variable;
import org.lrasolver.core.VariableRegistry;
import org.lrasolver.exceptions.UnsupportedFormulaException;
import org.lrasolver.expressions.RelationType;
import org.lrasolver.expressions.formulas.FormulaKind;
import org.lrasolver.utils.Rational;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AtomTest {

    private static Variable x, y, w;
    private static LinearExpression ex, ey;

    @BeforeAll
    static void setUp() {
        VariableRegistry registry = new VariableRegistry();
        x = registry.newVariable("x", Sort.SIGNED);
        y = registry.newVariable("y", Sort.SIGNED);
        w = registry.newVariable("w", Sort.BOOLEAN);
        ex = LinearExpression.of(x);
        ey = LinearExpression.of(y);
    }

    @Nested
    @DisplayName("构造与规范化")
    class ConstructionTests {

        @Test
        @DisplayName("所有项移到左侧 (2x <= 10 => 2x - 10 <= 0)")
        void testOf_MovesEverythingLeft() {
            Atom atom = Atom.of(ex.multiply(Rational.valueOf(2)), RelationType.LE, LinearExpression.of(10));

            assertAll("Normalized form",
                    () -> assertEquals(Rational.valueOf(2), atom.getExpression().getCoefficient(x)),
                    () -> assertEquals(Rational.valueOf(-10), atom.getExpression().getConstant()),
                    () -> assertEquals(Rational.valueOf(10), atom.getRightHandSide()),
                    () -> assertEquals(RelationType.LE, atom.getRelation()),
                    () -> assertEquals(FormulaKind.ATOM, atom.getKind())
            );
        }

        @Test
        @DisplayName("两侧写法不同但差相同的原子相等 (x < y 与 x - y < 0)")
        void testEquals_SameDifference() {
            Atom a = Atom.of(ex, RelationType.LT, ey);
            Atom b = Atom.of(ex.subtract(ey), RelationType.LT);

            assertEquals(a, b);
            assertEquals(a.hashCode(), b.hashCode());
        }

        @Test
        @DisplayName("布尔变量不能出现在算术原子中")
        void testOf_BooleanVariable_Throws() {
            assertThrows(UnsupportedFormulaException.class,
                    () -> Atom.of(LinearExpression.of(w), RelationType.LE, LinearExpression.of(1)));
        }

        @Test
        @DisplayName("常数原子是合法的")
        void testOf_ConstantAtom() {
            Atom contradiction = Atom.of(LinearExpression.of(1), RelationType.LE, LinearExpression.ZERO);

            assertTrue(contradiction.getExpression().isConstant());
            assertFalse(contradiction.evaluate(Model.of(Map.of())));
        }
    }

    @Nested
    @DisplayName("取反")
    class NegationTests {

        @Test
        @DisplayName("LT <-> GE，LE <-> GT")
        void testNegate_FlipsRelation() {
            Atom le = Atom.of(ex, RelationType.LE, LinearExpression.of(3));
            Atom lt = Atom.of(ex, RelationType.LT, LinearExpression.of(3));

            assertAll("Negation",
                    () -> assertEquals(Atom.of(ex, RelationType.GT, LinearExpression.of(3)), le.negate()),
                    () -> assertEquals(Atom.of(ex, RelationType.GE, LinearExpression.of(3)), lt.negate()),
                    () -> assertEquals(le, le.negate().negate())
            );
        }

        @Test
        @DisplayName("等式不能取反为单个原子")
        void testNegate_Equality_Throws() {
            Atom eq = Atom.of(ex, RelationType.EQ, ey);

            assertThrows(UnsupportedOperationException.class, eq::negate);
        }
    }

    @Test
    @DisplayName("在模型下求值，严格与非严格边界")
    void testEvaluate() {
        Model model = Model.of(Map.of(x, Rational.valueOf(3), y, Rational.valueOf(3), w, Rational.ZERO));

        assertAll("Boundary evaluation",
                () -> assertTrue(Atom.of(ex, RelationType.LE, ey).evaluate(model)),
                () -> assertFalse(Atom.of(ex, RelationType.LT, ey).evaluate(model)),
                () -> assertTrue(Atom.of(ex, RelationType.EQ, ey).evaluate(model)),
                () -> assertTrue(Atom.of(ex, RelationType.GE, ey).evaluate(model)),
                () -> assertFalse(Atom.of(ex, RelationType.GT, ey).evaluate(model))
        );
    }
}
