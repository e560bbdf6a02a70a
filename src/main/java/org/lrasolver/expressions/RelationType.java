package org.lrasolver.expressions;

import org.lrasolver.utils.Rational;

public enum RelationType {

    /**
     * 运算符枚举
     */
    LT("<"),    // Less Than
    LE("<="),   // Less Equal
    EQ("="),    // Equal
    GE(">="),   // Greater Equal
    GT(">");    // Greater Than

    private final String symbol;

    RelationType(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * 返回此关系类型的否定关系。
     * 例如：LT 的否定是 GE。EQ 的否定不是单个关系，需要拆成 LT 或 GT，由调用方处理。
     */
    public RelationType negate() {
        return switch (this) {
            case LT -> GE;
            case LE -> GT;
            case GT -> LE;
            case GE -> LT;
            case EQ -> throw new UnsupportedOperationException("EQ 的否定是析取 (< 或 >)，不能表示为单个关系");
        };
    }

    public boolean isStrict() {
        return this == LT || this == GT;
    }

    /**
     * 是否给出上界 (e ~ 0 中 e 的上界)。EQ 同时给出上下界。
     */
    public boolean hasUpperBound() {
        return this == LT || this == LE || this == EQ;
    }

    public boolean hasLowerBound() {
        return this == GT || this == GE || this == EQ;
    }

    /**
     * 判断 value ~ 0 是否成立。
     */
    public boolean holds(Rational value) {
        int sign = value.signum();
        return switch (this) {
            case LT -> sign < 0;
            case LE -> sign <= 0;
            case EQ -> sign == 0;
            case GE -> sign >= 0;
            case GT -> sign > 0;
        };
    }
}
