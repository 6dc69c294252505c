package org.mathpy.expressions;

import lombok.Getter;
import org.mathpy.utils.Rational;

import java.util.Objects;
import java.util.Optional;

/**
 * 幂 base ^ exponent。指数可以是整数、半整数 n/2 或任意表达式。
 */
@Getter
public final class Pow implements Expression {

    private final Expression base;
    private final Expression exponent;
    private final int hashCode;

    private Pow(Expression base, Expression exponent) {
        this.base = Objects.requireNonNull(base, "Pow base cannot be null");
        this.exponent = Objects.requireNonNull(exponent, "Pow exponent cannot be null");
        this.hashCode = Objects.hash("Pow", base, exponent);
    }

    public static Pow of(Expression base, Expression exponent) {
        return new Pow(base, exponent);
    }

    public static Pow of(Expression base, Rational exponent) {
        return new Pow(base, NumberLiteral.of(exponent));
    }

    public static Pow of(Expression base, long exponent) {
        return new Pow(base, NumberLiteral.of(exponent));
    }

    public static Pow sqrt(Expression base) {
        return new Pow(base, NumberLiteral.HALF);
    }

    /**
     * 若指数是精确的 n/2 (n 为奇数)，返回 n；否则为空。
     * 这是根式合并所识别的模式。n 超出 int 范围时不视为根式。
     */
    public Optional<Integer> halfIntegerNumerator() {
        if (exponent instanceof NumberLiteral number && number.isExact() && number.getValue().isHalfInteger()
                && number.getValue().hasIntHalfNumerator()) {
            return Optional.of(number.getValue().halfNumerator());
        }
        return Optional.empty();
    }

    public boolean isRadical() {
        return halfIntegerNumerator().isPresent();
    }

    /**
     * 指数是否为精确的负数 (渲染为分母)。
     */
    public boolean hasNegativeExponent() {
        return exponent instanceof NumberLiteral number && number.isExact() && number.isNegative();
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitPow(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Pow that = (Pow) o;
        return base.equals(that.base) && exponent.equals(that.exponent);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return InputFormPrinter.print(this);
    }
}
