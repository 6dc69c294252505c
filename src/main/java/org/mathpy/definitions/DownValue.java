package org.mathpy.definitions;

import lombok.Getter;
import org.mathpy.expressions.Expression;

import java.util.Objects;

/**
 * 一条已存储的定义 lhs := rhs，例如 f[x_, y_] := x + y。
 * lhs 中的模式变量即函数参数，rhs 原样作为函数体。
 */
@Getter
public final class DownValue {

    private final Expression lhs;
    private final Expression rhs;

    private DownValue(Expression lhs, Expression rhs) {
        this.lhs = Objects.requireNonNull(lhs, "DownValue lhs cannot be null");
        this.rhs = Objects.requireNonNull(rhs, "DownValue rhs cannot be null");
    }

    public static DownValue of(Expression lhs, Expression rhs) {
        return new DownValue(lhs, rhs);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DownValue that = (DownValue) o;
        return lhs.equals(that.lhs) && rhs.equals(that.rhs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lhs, rhs);
    }

    @Override
    public String toString() {
        return lhs + " :> " + rhs;
    }
}
