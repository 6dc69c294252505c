package org.mathpy.expressions;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * 乘积 f1 * f2 * ...。
 * 分母用负指数的 Pow 表示 (a/b 即 Mul(a, Pow(b, -1)))，与宿主的内部形式一致。
 */
@Getter
public final class Mul implements Expression {

    private final List<Expression> factors;
    private final int hashCode;

    private Mul(List<Expression> factors) {
        Objects.requireNonNull(factors, "Mul factors cannot be null");
        if (factors.size() < 2) {
            throw new IllegalArgumentException("Mul 至少需要两个因子，实际为 " + factors.size());
        }
        factors.forEach(f -> Objects.requireNonNull(f, "Mul factor cannot be null"));
        this.factors = List.copyOf(factors);
        this.hashCode = Objects.hash("Mul", this.factors);
    }

    public static Mul of(List<Expression> factors) {
        return new Mul(factors);
    }

    public static Mul of(Expression... factors) {
        return new Mul(Arrays.asList(factors));
    }

    /**
     * 构造乘积并做最基本的整理：展开嵌套的 Mul，去掉精确的因子 1。
     * 没有因子时返回 1，只有一个因子时直接返回该因子。
     */
    public static Expression product(List<Expression> factors) {
        List<Expression> flat = new ArrayList<>();
        for (Expression factor : factors) {
            if (factor instanceof Mul nested) {
                flat.addAll(nested.factors);
            } else if (!NumberLiteral.ONE.equals(factor)) {
                flat.add(factor);
            }
        }
        if (flat.isEmpty()) {
            return NumberLiteral.ONE;
        }
        if (flat.size() == 1) {
            return flat.get(0);
        }
        return new Mul(flat);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitMul(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return factors.equals(((Mul) o).factors);
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
