package org.mathpy.definitions;

import lombok.Getter;
import org.mathpy.expressions.Expression;

import java.util.List;
import java.util.Objects;

/**
 * 抽取出的函数签名：规范化后的函数名与参数名，以及未经改动的函数体。
 * rawParameters 与 parameters 一一对应，保留宿主中的原始名字。
 */
@Getter
public final class FunctionSignature {

    private final String name;
    private final String rawName;
    private final List<String> parameters;
    private final List<String> rawParameters;
    private final Expression body;

    private FunctionSignature(String name, String rawName, List<String> parameters,
                              List<String> rawParameters, Expression body) {
        this.name = Objects.requireNonNull(name, "Function name cannot be null");
        this.rawName = Objects.requireNonNull(rawName, "Raw function name cannot be null");
        this.parameters = List.copyOf(parameters);
        this.rawParameters = List.copyOf(rawParameters);
        if (this.parameters.size() != this.rawParameters.size()) {
            throw new IllegalArgumentException("参数个数不一致: " + parameters + " vs " + rawParameters);
        }
        this.body = Objects.requireNonNull(body, "Function body cannot be null");
    }

    public static FunctionSignature of(String name, String rawName, List<String> parameters,
                                       List<String> rawParameters, Expression body) {
        return new FunctionSignature(name, rawName, parameters, rawParameters, body);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        FunctionSignature that = (FunctionSignature) o;
        return name.equals(that.name) && rawName.equals(that.rawName) && parameters.equals(that.parameters)
                && rawParameters.equals(that.rawParameters) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, rawName, parameters, rawParameters, body);
    }

    @Override
    public String toString() {
        return name + "(" + String.join(", ", parameters) + ") = " + body;
    }
}
