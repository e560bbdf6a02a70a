package org.lrasolver.simplex;

import lombok.Getter;
import org.lrasolver.utils.Rational;

import java.util.Objects;

/**
 * 表格变量的一个界：数值加上严格标记。严格上界 c 等价于 c - δ，严格下界 c 等价于 c + δ。
 */
@Getter
public final class Bound {

    private final Rational value;
    private final boolean strict;

    private Bound(Rational value, boolean strict) {
        this.value = Objects.requireNonNull(value, "Bound value cannot be null");
        this.strict = strict;
    }

    public static Bound of(Rational value, boolean strict) {
        return new Bound(value, strict);
    }

    public static Bound inclusive(Rational value) {
        return new Bound(value, false);
    }

    public static Bound strict(Rational value) {
        return new Bound(value, true);
    }

    /**
     * 作为下界时对应的 δ 值。
     */
    public DeltaRational asLower() {
        return strict ? DeltaRational.of(value, Rational.ONE) : DeltaRational.of(value);
    }

    /**
     * 作为上界时对应的 δ 值。
     */
    public DeltaRational asUpper() {
        return strict ? DeltaRational.of(value, Rational.MINUS_ONE) : DeltaRational.of(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Bound bound = (Bound) o;
        return strict == bound.strict && value.equals(bound.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, strict);
    }

    @Override
    public String toString() {
        return (strict ? "strict " : "") + value;
    }
}
