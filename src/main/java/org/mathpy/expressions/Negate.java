package org.mathpy.expressions;

import lombok.Getter;

import java.util.Objects;

@Getter
public final class Negate implements Expression {

    private final Expression inner;
    private final int hashCode;

    private Negate(Expression inner) {
        this.inner = Objects.requireNonNull(inner, "Negated expression cannot be null");
        this.hashCode = Objects.hash("Negate", inner);
    }

    public static Negate of(Expression inner) {
        return new Negate(inner);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitNegate(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return inner.equals(((Negate) o).inner);
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
