package org.lrasolver.utils;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 精确有理数。分子分母均为 BigInteger，始终约分，分母恒为正。
 * 表格中的系数、变量取值以及模型输出都只使用此类型，求解路径上没有浮点数。
 * 此类是不可变的。
 */
public final class Rational implements Comparable<Rational> {
    private static final Logger logger = LoggerFactory.getLogger(Rational.class);
    private static final int MAX_CACHE_MAGNITUDE = 1024;
    private static final int MAX_CACHE_SIZE = 8192;
    private static final ConcurrentHashMap<List<BigInteger>, Rational> CACHE = new ConcurrentHashMap<>(2048);

    // BigInteger 常量
    private static final BigInteger BIG_INT_ZERO = BigInteger.ZERO;
    private static final BigInteger BIG_INT_ONE = BigInteger.ONE;
    private static final BigInteger BIG_INT_TEN = BigInteger.TEN;

    @Getter
    private final BigInteger numerator;
    @Getter
    private final BigInteger denominator;

    private volatile int hash;

    // 常用常量
    public static final Rational ZERO = new Rational(BIG_INT_ZERO, BIG_INT_ONE); // 0/1
    public static final Rational ONE = new Rational(BIG_INT_ONE, BIG_INT_ONE);   // 1/1
    public static final Rational MINUS_ONE = new Rational(BIG_INT_ONE.negate(), BIG_INT_ONE); // -1/1

    static {
        CACHE.put(ZERO.getCacheKey(), ZERO);
        CACHE.put(ONE.getCacheKey(), ONE);
        CACHE.put(MINUS_ONE.getCacheKey(), MINUS_ONE);

        for (int i = -16; i <= 16; i++) {
            if (i != 0 && i != 1 && i != -1) {
                Rational r = new Rational(BigInteger.valueOf(i), BIG_INT_ONE);
                CACHE.put(r.getCacheKey(), r);
            }
        }
        for (int den = 2; den <= 16; den++) {
            for (int num = -den; num <= den; num++) {
                if (num != 0) {
                    valueOf(num, den);
                }
            }
        }
    }

    /**
     * 私有构造函数，调用方保证已经约分且分母为正。
     */
    private Rational(BigInteger numerator, BigInteger denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    // ========== 工厂方法 ==========

    public static Rational valueOf(BigInteger numerator) {
        return valueOf(numerator, BIG_INT_ONE);
    }

    public static Rational valueOf(long numerator) {
        if (numerator == 0L) {
            return ZERO;
        }
        if (numerator == 1L) {
            return ONE;
        }
        return valueOf(BigInteger.valueOf(numerator), BIG_INT_ONE);
    }

    public static Rational valueOf(long numerator, long denominator) {
        return valueOf(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    /**
     * 创建一个约分后的有理数。
     * @throws ArithmeticException 分母为 0
     */
    public static Rational valueOf(BigInteger numerator, BigInteger denominator) {
        Objects.requireNonNull(numerator, "numerator cannot be null");
        Objects.requireNonNull(denominator, "denominator cannot be null");

        // 1. 分母为0直接报错，不再表示无穷
        if (denominator.signum() == 0) {
            logger.error("尝试创建分母为 0 的 Rational: {} / 0", numerator);
            throw new ArithmeticException("Rational 分母为 0: " + numerator + "/0");
        }

        // 2. 分子为0的情况
        if (numerator.signum() == 0) {
            return ZERO;
        }

        // 3. 分母总是正数
        if (denominator.signum() < 0) {
            numerator = numerator.negate();
            denominator = denominator.negate();
        }

        // 4. 提前处理结果为1的情况，避免GCD
        if (numerator.equals(denominator)) {
            return ONE;
        }

        // 5. 约分
        BigInteger commonDivisor = numerator.gcd(denominator);
        if (!commonDivisor.equals(BIG_INT_ONE)) {
            numerator = numerator.divide(commonDivisor);
            denominator = denominator.divide(commonDivisor);
        }

        // 6. 统一处理缓存
        List<BigInteger> key = List.of(numerator, denominator);
        Rational cached = CACHE.get(key);
        if (cached != null) {
            return cached;
        }

        Rational result = new Rational(numerator, denominator);
        if (CACHE.size() < MAX_CACHE_SIZE && isCacheable(result)) {
            CACHE.put(key, result);
        }
        return result;
    }

    /**
     * 解析 "a/b"、整数或十进制小数形式的字符串。
     * @throws NumberFormatException 格式非法
     * @throws ArithmeticException 分母为 0
     */
    public static Rational valueOf(String s) {
        if (s == null || s.trim().isEmpty()) {
            throw new NumberFormatException("输入非法: 空字符串");
        }
        s = s.trim();

        // 处理分数形式
        if (s.contains("/")) {
            String[] parts = s.split("/", 2);
            if (parts.length != 2 || parts[0].trim().isEmpty() || parts[1].trim().isEmpty()) {
                throw new NumberFormatException("无效分数格式: " + s);
            }
            BigInteger num;
            BigInteger den;
            try {
                num = new BigInteger(parts[0].trim());
                den = new BigInteger(parts[1].trim());
            } catch (NumberFormatException e) {
                throw new NumberFormatException("分数" + s + "的数字无效: " + e.getMessage());
            }
            return valueOf(num, den);
        }

        // 处理整数和小数
        try {
            BigDecimal bd = new BigDecimal(s);
            int scale = bd.scale();
            BigInteger num;
            BigInteger den;
            if (scale <= 0) {
                num = bd.unscaledValue().multiply(BIG_INT_TEN.pow(-scale));
                den = BIG_INT_ONE;
            } else {
                num = bd.unscaledValue();
                den = BIG_INT_TEN.pow(scale);
            }
            return valueOf(num, den);
        } catch (NumberFormatException e) {
            throw new NumberFormatException("无效数字格式: " + s);
        }
    }

    // ========== 基础运算 ==========

    public Rational add(Rational other) {
        if (this.isZero()) {
            return other;
        }
        if (other.isZero()) {
            return this;
        }
        BigInteger newNum = this.numerator.multiply(other.denominator).add(other.numerator.multiply(this.denominator));
        BigInteger newDen = this.denominator.multiply(other.denominator);
        return valueOf(newNum, newDen);
    }

    public Rational subtract(Rational other) {
        if (other.isZero()) {
            return this;
        }
        return this.add(other.negate());
    }

    public Rational multiply(Rational other) {
        if (this.isZero() || other.isZero()) {
            return ZERO;
        }
        if (this == ONE) {
            return other;
        }
        if (other == ONE) {
            return this;
        }
        return valueOf(this.numerator.multiply(other.numerator), this.denominator.multiply(other.denominator));
    }

    /**
     * @throws ArithmeticException 除数为 0
     */
    public Rational divide(Rational other) {
        if (other.isZero()) {
            logger.error("除以零: {} / 0", this);
            throw new ArithmeticException("除以零: " + this + " / 0");
        }
        if (other == ONE) {
            return this;
        }
        return valueOf(this.numerator.multiply(other.denominator), this.denominator.multiply(other.numerator));
    }

    /**
     * @throws ArithmeticException 对 0 求倒数
     */
    public Rational reciprocal() {
        if (isZero()) {
            logger.error("尝试对 0 求倒数");
            throw new ArithmeticException("0 没有倒数");
        }
        return valueOf(this.denominator, this.numerator);
    }

    public Rational negate() {
        if (this.isZero()) {
            return ZERO;
        }
        return valueOf(this.numerator.negate(), this.denominator);
    }

    public Rational abs() {
        if (this.numerator.signum() >= 0) {
            return this;
        }
        return this.negate();
    }

    public static Rational max(Rational a, Rational b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public static Rational min(Rational a, Rational b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    // ========== 工具方法 ==========

    public boolean isZero() {
        return this.numerator.signum() == 0;
    }

    public boolean isPositive() {
        return this.numerator.signum() > 0;
    }

    public boolean isNegative() {
        return this.numerator.signum() < 0;
    }

    /**
     * 获取符号: 1 (正数), -1 (负数), 0 (零)。
     */
    public int signum() {
        return this.numerator.signum();
    }

    /**
     *  判断该rational是否是整数
     */
    public boolean isInteger() {
        return this.denominator.equals(BIG_INT_ONE);
    }

    public ArithExpr toZ3Real(Context ctx) {
        return ctx.mkReal(this.toString());
    }

    // ========== 对象基础方法 ==========

    @Override
    public int compareTo(Rational other) {
        if (this == other) {
            return 0;
        }
        BigInteger ad = this.numerator.multiply(other.denominator);
        BigInteger cb = other.numerator.multiply(this.denominator);
        return ad.compareTo(cb);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Rational that)) {
            return false;
        }
        return this.numerator.equals(that.numerator) && this.denominator.equals(that.denominator);
    }

    @Override
    public int hashCode() {
        int h = hash;
        if (h == 0) {
            h = Objects.hash(numerator, denominator);
            if (h == 0) {
                h = 1;
            }
            hash = h;
        }
        return h;
    }

    private List<BigInteger> getCacheKey() {
        return List.of(this.numerator, this.denominator);
    }

    /**
     * 只缓存位数较小的值，避免大分数撑爆缓存。
     */
    /**
     * 只缓存分子分母绝对值都不超过 MAX_CACHE_MAGNITUDE 的值，缓存总量另有上限。
     */
    static boolean isCacheable(Rational r) {
        BigInteger limit = BigInteger.valueOf(MAX_CACHE_MAGNITUDE);
        return r.numerator.abs().compareTo(limit) <= 0 && r.denominator.compareTo(limit) <= 0;
    }

    /**
     * 规范字符串: 整数输出 "n"，否则输出 "num/den"。
     */
    @Override
    public String toString() {
        if (this.denominator.equals(BIG_INT_ONE)) {
            return this.numerator.toString();
        }
        return this.numerator.toString() + "/" + this.denominator.toString();
    }
}
