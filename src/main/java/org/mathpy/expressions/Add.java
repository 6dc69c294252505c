package org.mathpy.expressions;

import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * 和式 t1 + t2 + ...。
 * 项的顺序沿用宿主给出的规范顺序，输出时不再重排。
 */
@Getter
public final class Add implements Expression {

    private final List<Expression> terms;
    private final int hashCode;

    private Add(List<Expression> terms) {
        Objects.requireNonNull(terms, "Add terms cannot be null");
        if (terms.size() < 2) {
            throw new IllegalArgumentException("Add 至少需要两项，实际为 " + terms.size());
        }
        terms.forEach(t -> Objects.requireNonNull(t, "Add term cannot be null"));
        this.terms = List.copyOf(terms);
        this.hashCode = Objects.hash("Add", this.terms);
    }

    public static Add of(List<Expression> terms) {
        return new Add(terms);
    }

    public static Add of(Expression... terms) {
        return new Add(Arrays.asList(terms));
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitAdd(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return terms.equals(((Add) o).terms);
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
