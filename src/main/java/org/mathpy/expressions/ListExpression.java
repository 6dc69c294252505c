package org.mathpy.expressions;

import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * 列表字面量 {e1, e2, ...}，输出为目标语言的数组构造调用。
 */
@Getter
public final class ListExpression implements Expression {

    private final List<Expression> elements;
    private final int hashCode;

    private ListExpression(List<Expression> elements) {
        Objects.requireNonNull(elements, "List elements cannot be null");
        elements.forEach(e -> Objects.requireNonNull(e, "List element cannot be null"));
        this.elements = List.copyOf(elements);
        this.hashCode = Objects.hash("List", this.elements);
    }

    public static ListExpression of(List<Expression> elements) {
        return new ListExpression(elements);
    }

    public static ListExpression of(Expression... elements) {
        return new ListExpression(Arrays.asList(elements));
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitList(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return elements.equals(((ListExpression) o).elements);
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
