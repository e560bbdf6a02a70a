package org.lrasolver.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.lrasolver.exceptions.DuplicateVariableException;
import org.lrasolver.utils.Rational;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VariableRegistryTest {

    private VariableRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new VariableRegistry();
    }

    @Nested
    @DisplayName("变量声明")
    class DeclarationTests {

        @Test
        @DisplayName("id 按声明顺序分配")
        void testNewVariable_AssignsSequentialIds() {
            Variable x = registry.newVariable("x", Sort.SIGNED);
            Variable y = registry.newVariable("y", Sort.UNSIGNED);
            Variable w = registry.newVariable("w", Sort.BOOLEAN);

            assertAll("Ids follow declaration order",
                    () -> assertEquals(0, x.getId()),
                    () -> assertEquals(1, y.getId()),
                    () -> assertEquals(2, w.getId()),
                    () -> assertTrue(w.isBoolean()),
                    () -> assertEquals(3, registry.size()),
                    () -> assertEquals(y, registry.getVariable("y"))
            );
        }

        @Test
        @DisplayName("同名同 sort 返回已有变量")
        void testNewVariable_SameNameSameSort_ReturnsExisting() {
            Variable first = registry.newVariable("x", Sort.SIGNED);
            Variable second = registry.newVariable("x", Sort.SIGNED);

            assertSame(first, second);
            assertEquals(1, registry.size());
        }

        @Test
        @DisplayName("同名不同 sort 抛出 DuplicateVariableException")
        void testNewVariable_SameNameOtherSort_Throws() {
            registry.newVariable("x", Sort.SIGNED);

            DuplicateVariableException e = assertThrows(DuplicateVariableException.class,
                    () -> registry.newVariable("x", Sort.BOOLEAN));
            assertAll("Exception carries both sorts",
                    () -> assertEquals("x", e.getVariableName()),
                    () -> assertEquals(Sort.SIGNED, e.getExistingSort()),
                    () -> assertEquals(Sort.BOOLEAN, e.getRequestedSort())
            );
        }

        @Test
        @DisplayName("contains 只认本注册表创建的变量")
        void testContains_RejectsForeignVariable() {
            Variable own = registry.newVariable("x", Sort.SIGNED);
            Variable foreign = new VariableRegistry().newVariable("x", Sort.SIGNED);

            assertTrue(registry.contains(own));
            assertFalse(registry.contains(foreign));
        }
    }

    @Nested
    @DisplayName("模型")
    class ModelTests {

        @Test
        @DisplayName("按变量 id 排序输出并支持查询")
        void testModel_ValuesAndOrdering() {
            Variable x = registry.newVariable("x", Sort.SIGNED);
            Variable y = registry.newVariable("y", Sort.SIGNED);
            Variable w = registry.newVariable("w", Sort.BOOLEAN);

            Model model = Model.of(Map.of(w, Rational.ONE, y, Rational.valueOf(1, 2), x, Rational.valueOf(-5)));

            assertAll("Model queries",
                    () -> assertEquals(Rational.valueOf(-5), model.getValue(x)),
                    () -> assertTrue(model.isTrue(w)),
                    () -> assertEquals("{x=-5, y=1/2, w=1}", model.toString())
            );
        }

        @Test
        @DisplayName("查询不在模型中的变量抛出 IllegalArgumentException")
        void testModel_MissingVariable_Throws() {
            Variable x = registry.newVariable("x", Sort.SIGNED);
            Variable y = registry.newVariable("y", Sort.SIGNED);
            Model model = Model.of(Map.of(x, Rational.ZERO));

            assertThrows(IllegalArgumentException.class, () -> model.getValue(y));
        }
    }
}
