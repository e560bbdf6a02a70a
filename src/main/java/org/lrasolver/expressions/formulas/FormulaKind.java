package org.lrasolver.expressions.formulas;

/**
 * 公式树的节点标签。
 */
public enum FormulaKind {
    ATOM,           // 线性比较原子
    BOOLEAN_VAR,    // 布尔变量
    AND,
    OR,
    NOT,
    EQUIVALENCE     // w == φ
}
