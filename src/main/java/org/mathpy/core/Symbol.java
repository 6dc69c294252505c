package org.mathpy.core;

import lombok.Getter;
import org.mathpy.expressions.Expression;
import org.mathpy.expressions.ExpressionVisitor;
import org.mathpy.expressions.InputFormPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 宿主语言中的符号 (标识符叶子节点)。
 * 名字保持宿主的原始写法，可能含有 \[Alpha] 这种字形名编码，规范化由 codegen 负责。
 * @author Ayalyt
 */
@Getter
public final class Symbol implements Expression, Comparable<Symbol> {

    private static final Logger logger = LoggerFactory.getLogger(Symbol.class);

    private final String name;
    private final int hashCode;

    private Symbol(String name) {
        this.name = name;
        this.hashCode = Objects.hash(name);
        logger.debug("创建了一个Symbol: {}", name);
    }

    public static Symbol of(String rawName) {
        Objects.requireNonNull(rawName, "Symbol name cannot be null");
        if (rawName.isBlank()) {
            throw new IllegalArgumentException("Symbol name cannot be blank");
        }
        return new Symbol(rawName);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitSymbol(this);
    }

    @Override
    public int compareTo(Symbol o) {
        return this.name.compareTo(o.name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Symbol symbol = (Symbol) o;
        return name.equals(symbol.name);
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
