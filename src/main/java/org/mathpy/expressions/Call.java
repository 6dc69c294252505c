package org.mathpy.expressions;

import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * 函数调用，例如 Sin[x]、Log[x]、以及用户自定义函数 f[x, y]。
 * 也用来表示定义左侧的模式，例如 f[x_, y_]。
 */
@Getter
public final class Call implements Expression {

    private final String functionName;
    private final List<Expression> arguments;
    private final int hashCode;

    private Call(String functionName, List<Expression> arguments) {
        this.functionName = Objects.requireNonNull(functionName, "Function name cannot be null");
        Objects.requireNonNull(arguments, "Call arguments cannot be null");
        arguments.forEach(a -> Objects.requireNonNull(a, "Call argument cannot be null"));
        this.arguments = List.copyOf(arguments);
        this.hashCode = Objects.hash("Call", functionName, this.arguments);
    }

    public static Call of(String functionName, List<Expression> arguments) {
        return new Call(functionName, arguments);
    }

    public static Call of(String functionName, Expression... arguments) {
        return new Call(functionName, Arrays.asList(arguments));
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitCall(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Call that = (Call) o;
        return functionName.equals(that.functionName) && arguments.equals(that.arguments);
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
