package org.mathpy.expressions;

import org.mathpy.core.Symbol;

public interface ExpressionVisitor<R> {

    R visitNumber(NumberLiteral number);

    R visitSymbol(Symbol symbol);

    R visitAdd(Add add);

    R visitMul(Mul mul);

    R visitPow(Pow pow);

    R visitCall(Call call);

    R visitNegate(Negate negate);

    R visitList(ListExpression list);

    R visitPattern(PatternVariable pattern);
}
