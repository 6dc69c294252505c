package org.mathpy.expressions;

import lombok.Getter;

import java.util.Objects;

/**
 * 定义左侧的模式变量，例如 x_ 或带头部限制的 x_Real。
 * headConstraint 为 null 表示无限制的空白模式。
 */
@Getter
public final class PatternVariable implements Expression {

    private final String name;
    private final String headConstraint;
    private final int hashCode;

    private PatternVariable(String name, String headConstraint) {
        this.name = Objects.requireNonNull(name, "Pattern name cannot be null");
        this.headConstraint = headConstraint;
        this.hashCode = Objects.hash("Pattern", name, headConstraint);
    }

    public static PatternVariable of(String name) {
        return new PatternVariable(name, null);
    }

    public static PatternVariable of(String name, String headConstraint) {
        return new PatternVariable(name, headConstraint);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitPattern(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PatternVariable that = (PatternVariable) o;
        return name.equals(that.name) && Objects.equals(headConstraint, that.headConstraint);
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
