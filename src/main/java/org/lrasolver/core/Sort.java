package org.lrasolver.core;

/**
 * 变量的 sort 描述符。
 */
public enum Sort {

    SIGNED("sint"),     // 任意有理数
    UNSIGNED("uint"),   // 非负有理数
    BOOLEAN("bool");    // 0/1

    private final String symbol;

    Sort(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * 是否可以出现在线性表达式的算术原子中。
     */
    public boolean isArithmetic() {
        return this != BOOLEAN;
    }

    /**
     * 是否允许负值。允许负值的变量在表格中会被拆成 (pos, neg) 两列。
     */
    public boolean allowsNegative() {
        return this == SIGNED;
    }
}
