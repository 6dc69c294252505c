package org.mathpy.expressions;

import lombok.Getter;
import org.mathpy.utils.Rational;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * 数字字面量。精确值 (整数、有理数) 与近似实数 (宿主的机器实数) 都用 Rational 存储，
 * exact 标志决定输出时写成 5/2 还是 2.5。
 */
@Getter
public final class NumberLiteral implements Expression {

    public static final NumberLiteral ZERO = new NumberLiteral(Rational.ZERO, true);
    public static final NumberLiteral ONE = new NumberLiteral(Rational.ONE, true);
    public static final NumberLiteral MINUS_ONE = new NumberLiteral(Rational.MINUS_ONE, true);
    public static final NumberLiteral HALF = new NumberLiteral(Rational.HALF, true);

    private final Rational value;
    private final boolean exact;

    private NumberLiteral(Rational value, boolean exact) {
        this.value = Objects.requireNonNull(value, "Number value cannot be null");
        this.exact = exact;
    }

    public static NumberLiteral of(Rational value) {
        return new NumberLiteral(value, true);
    }

    public static NumberLiteral of(long value) {
        return new NumberLiteral(Rational.valueOf(value), true);
    }

    public static NumberLiteral of(long numerator, long denominator) {
        return new NumberLiteral(Rational.valueOf(numerator, denominator), true);
    }

    /**
     * 近似实数，例如 2.5。
     */
    public static NumberLiteral real(String decimal) {
        return new NumberLiteral(Rational.valueOf(new BigDecimal(decimal)), false);
    }

    public static NumberLiteral real(double value) {
        return real(Double.toString(value));
    }

    public boolean isNegative() {
        return value.signum() < 0;
    }

    public boolean isInteger() {
        return exact && value.isInteger();
    }

    public NumberLiteral negate() {
        return new NumberLiteral(value.negate(), exact);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitNumber(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        NumberLiteral that = (NumberLiteral) o;
        return exact == that.exact && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, exact);
    }

    @Override
    public String toString() {
        return InputFormPrinter.print(this);
    }
}
