package org.lrasolver.expressions.linear;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import org.lrasolver.core.Model;
import org.lrasolver.core.Variable;
import org.lrasolver.exceptions.UnsupportedFormulaException;
import org.lrasolver.expressions.ToZ3ArithExpr;
import org.lrasolver.symbolic.Z3VariableManager;
import org.lrasolver.utils.Rational;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 线性表达式，形式为 c1*v1 + c2*v2 + ... + const。
 * 系数表按变量 id 有序，且不含零系数。此类是不可变的。
 */
@Getter
public final class LinearExpression implements ToZ3ArithExpr {

    private static final Logger logger = LoggerFactory.getLogger(LinearExpression.class);

    public static final LinearExpression ZERO = new LinearExpression(Collections.emptyMap(), Rational.ZERO);

    private final SortedMap<Variable, Rational> coefficients;

    private final Rational constant;

    private final int hashCode;

    /**
     * 私有构造函数。
     * @param coefficients 变量到其系数的映射。
     * @param constant 常数项。
     */
    private LinearExpression(Map<Variable, Rational> coefficients, Rational constant) {
        // 拷贝并确保有序性，同时过滤掉系数为零的变量
        SortedMap<Variable, Rational> tempCoefficients = new TreeMap<>();
        for (Map.Entry<Variable, Rational> entry : Objects.requireNonNull(coefficients, "Coefficients map cannot be null").entrySet()) {
            Variable variable = Objects.requireNonNull(entry.getKey(), "Variable in coefficients map cannot be null");
            Rational coeff = Objects.requireNonNull(entry.getValue(), "Coefficient cannot be null");
            if (!coeff.isZero()) {
                tempCoefficients.put(variable, coeff);
            }
        }
        this.coefficients = Collections.unmodifiableSortedMap(tempCoefficients);
        this.constant = Objects.requireNonNull(constant, "Constant term cannot be null");
        this.hashCode = Objects.hash(this.coefficients, this.constant);
    }

    /**
     * 工厂方法：创建 LinearExpression 实例。
     * @param coefficients 变量到其系数的映射。
     * @param constant 常数项。
     * @return LinearExpression 实例。
     */
    public static LinearExpression of(Map<Variable, Rational> coefficients, Rational constant) {
        return new LinearExpression(coefficients, constant);
    }

    /**
     * 工厂方法：创建只包含常数项的 LinearExpression 实例。
     */
    public static LinearExpression of(Rational constant) {
        return new LinearExpression(Collections.emptyMap(), constant);
    }

    public static LinearExpression of(long constant) {
        return of(Rational.valueOf(constant));
    }

    /**
     * 工厂方法：创建只包含一个变量的 LinearExpression 实例 (例如 x)。
     */
    public static LinearExpression of(Variable variable) {
        return new LinearExpression(Map.of(variable, Rational.ONE), Rational.ZERO);
    }

    /**
     * 工厂方法：创建只包含一个变量和系数的 LinearExpression 实例 (例如 2*x)。
     */
    public static LinearExpression of(Variable variable, Rational coefficient) {
        return new LinearExpression(Map.of(variable, coefficient), Rational.ZERO);
    }

    /**
     * 将此表达式与另一个表达式相加。
     */
    public LinearExpression add(LinearExpression other) {
        Map<Variable, Rational> newCoefficients = new HashMap<>(this.coefficients);
        other.coefficients.forEach((variable, value) -> newCoefficients.merge(variable, value, Rational::add));
        return new LinearExpression(newCoefficients, this.constant.add(other.constant));
    }

    public LinearExpression add(Rational value) {
        return new LinearExpression(this.coefficients, this.constant.add(value));
    }

    /**
     * 将此表达式减去另一个表达式。
     */
    public LinearExpression subtract(LinearExpression other) {
        Map<Variable, Rational> newCoefficients = new HashMap<>(this.coefficients);
        // 减去相当于加上负数
        other.coefficients.forEach((variable, value) -> newCoefficients.merge(variable, value.negate(), Rational::add));
        return new LinearExpression(newCoefficients, this.constant.subtract(other.constant));
    }

    public LinearExpression subtract(Rational value) {
        return new LinearExpression(this.coefficients, this.constant.subtract(value));
    }

    /**
     * 对此表达式取反 (乘以 -1)。
     */
    public LinearExpression negate() {
        return multiply(Rational.MINUS_ONE);
    }

    /**
     * 数乘。
     */
    public LinearExpression multiply(Rational factor) {
        if (factor.isZero()) {
            return ZERO;
        }
        Map<Variable, Rational> scaled = this.coefficients.entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, entry -> entry.getValue().multiply(factor)));
        return new LinearExpression(scaled, this.constant.multiply(factor));
    }

    /**
     * 两个表达式相乘，要求至少一边是常数。
     * @throws UnsupportedFormulaException 两边都含变量 (非线性)
     */
    public LinearExpression multiply(LinearExpression other) {
        if (other.isConstant()) {
            return this.multiply(other.constant);
        }
        if (this.isConstant()) {
            return other.multiply(this.constant);
        }
        logger.error("非线性乘积: ({}) * ({})", this, other);
        throw new UnsupportedFormulaException("不支持非线性项: (" + this + ") * (" + other + ")");
    }

    /**
     * 除以一个非零常数。
     * @throws ArithmeticException 除数为 0
     */
    public LinearExpression divide(Rational divisor) {
        return multiply(Rational.ONE.divide(divisor));
    }

    public boolean isConstant() {
        return coefficients.isEmpty();
    }

    public Rational getCoefficient(Variable variable) {
        return coefficients.getOrDefault(variable, Rational.ZERO);
    }

    public Set<Variable> getVariables() {
        return coefficients.keySet();
    }

    /**
     * 根据给定的模型，计算表达式的具体数值。
     */
    public Rational evaluate(Model model) {
        Rational result = this.constant;
        for (Map.Entry<Variable, Rational> entry : coefficients.entrySet()) {
            result = result.add(entry.getValue().multiply(model.getValue(entry.getKey())));
        }
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        boolean firstTerm = true;

        // 遍历有序的系数，确保输出顺序稳定
        for (Map.Entry<Variable, Rational> entry : coefficients.entrySet()) {
            Rational coeff = entry.getValue();
            if (!firstTerm) {
                sb.append(" + ");
            }
            if (!coeff.equals(Rational.ONE)) {
                sb.append(coeff).append("*");
            }
            sb.append(entry.getKey().getName());
            firstTerm = false;
        }

        if (!constant.isZero()) {
            if (!firstTerm) {
                sb.append(" + ");
            }
            sb.append(constant);
        } else if (firstTerm) {
            return "0";
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LinearExpression that = (LinearExpression) o;
        return coefficients.equals(that.coefficients) && constant.equals(that.constant);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public ArithExpr toZ3ArithExpr(Context ctx, Z3VariableManager varManager) {
        ArithExpr result = constant.toZ3Real(ctx);
        for (Map.Entry<Variable, Rational> entry : coefficients.entrySet()) {
            ArithExpr variableExpr = varManager.getZ3ArithVar(entry.getKey());
            ArithExpr z3Coeff = entry.getValue().toZ3Real(ctx);
            result = ctx.mkAdd(result, ctx.mkMul(z3Coeff, variableExpr));
        }
        return result;
    }
}
