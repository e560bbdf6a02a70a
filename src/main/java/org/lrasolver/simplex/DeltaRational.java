package org.lrasolver.simplex;

import lombok.Getter;
import org.lrasolver.utils.Rational;

import java.util.Objects;

/**
 * 形如 c + kδ 的值，δ 是一个符号化的正无穷小量。
 * 严格不等式 x &lt; c 被表示为 x &lt;= c - δ，比较按 (c, k) 字典序进行，
 * 直到抽取模型时才为 δ 选一个具体的有理数。此类是不可变的。
 */
@Getter
public final class DeltaRational implements Comparable<DeltaRational> {

    public static final DeltaRational ZERO = new DeltaRational(Rational.ZERO, Rational.ZERO);

    private final Rational real;
    private final Rational delta;

    private DeltaRational(Rational real, Rational delta) {
        this.real = Objects.requireNonNull(real, "real part cannot be null");
        this.delta = Objects.requireNonNull(delta, "delta part cannot be null");
    }

    public static DeltaRational of(Rational real) {
        return real.isZero() ? ZERO : new DeltaRational(real, Rational.ZERO);
    }

    public static DeltaRational of(Rational real, Rational delta) {
        if (real.isZero() && delta.isZero()) {
            return ZERO;
        }
        return new DeltaRational(real, delta);
    }

    public DeltaRational add(DeltaRational other) {
        return of(real.add(other.real), delta.add(other.delta));
    }

    public DeltaRational subtract(DeltaRational other) {
        return of(real.subtract(other.real), delta.subtract(other.delta));
    }

    public DeltaRational multiply(Rational factor) {
        return of(real.multiply(factor), delta.multiply(factor));
    }

    /**
     * @throws ArithmeticException 除数为 0
     */
    public DeltaRational divide(Rational divisor) {
        return of(real.divide(divisor), delta.divide(divisor));
    }

    public DeltaRational negate() {
        return of(real.negate(), delta.negate());
    }

    public int signum() {
        int sign = real.signum();
        return sign != 0 ? sign : delta.signum();
    }

    /**
     * 代入具体的 δ。
     */
    public Rational concretize(Rational deltaValue) {
        return real.add(delta.multiply(deltaValue));
    }

    @Override
    public int compareTo(DeltaRational other) {
        int cmp = real.compareTo(other.real);
        if (cmp != 0) {
            return cmp;
        }
        return delta.compareTo(other.delta);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DeltaRational that)) {
            return false;
        }
        return real.equals(that.real) && delta.equals(that.delta);
    }

    @Override
    public int hashCode() {
        return Objects.hash(real, delta);
    }

    @Override
    public String toString() {
        if (delta.isZero()) {
            return real.toString();
        }
        return real + (delta.isNegative() ? " - " + delta.negate() : " + " + delta) + "δ";
    }
}
