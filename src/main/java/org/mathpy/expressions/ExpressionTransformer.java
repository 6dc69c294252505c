package org.mathpy.expressions;

import org.mathpy.core.Symbol;

import java.util.ArrayList;
import java.util.List;

/**
 * 自底向上重建表达式树的访问者基类。
 * 子节点都没有变化时返回原节点本身，调用方可以用引用比较判断本轮是否有改写。
 */
public abstract class ExpressionTransformer implements ExpressionVisitor<Expression> {

    public Expression transform(Expression expression) {
        return expression.accept(this);
    }

    @Override
    public Expression visitNumber(NumberLiteral number) {
        return number;
    }

    @Override
    public Expression visitSymbol(Symbol symbol) {
        return symbol;
    }

    @Override
    public Expression visitPattern(PatternVariable pattern) {
        return pattern;
    }

    @Override
    public Expression visitAdd(Add add) {
        List<Expression> terms = transformAll(add.getTerms());
        return terms == add.getTerms() ? add : Add.of(terms);
    }

    @Override
    public Expression visitMul(Mul mul) {
        List<Expression> factors = transformAll(mul.getFactors());
        return factors == mul.getFactors() ? mul : Mul.of(factors);
    }

    @Override
    public Expression visitPow(Pow pow) {
        Expression base = transform(pow.getBase());
        Expression exponent = transform(pow.getExponent());
        if (base == pow.getBase() && exponent == pow.getExponent()) {
            return pow;
        }
        return Pow.of(base, exponent);
    }

    @Override
    public Expression visitCall(Call call) {
        List<Expression> arguments = transformAll(call.getArguments());
        return arguments == call.getArguments() ? call : Call.of(call.getFunctionName(), arguments);
    }

    @Override
    public Expression visitNegate(Negate negate) {
        Expression inner = transform(negate.getInner());
        return inner == negate.getInner() ? negate : Negate.of(inner);
    }

    @Override
    public Expression visitList(ListExpression list) {
        List<Expression> elements = transformAll(list.getElements());
        return elements == list.getElements() ? list : ListExpression.of(elements);
    }

    /**
     * 逐个变换；没有任何元素变化时返回原列表。
     */
    protected List<Expression> transformAll(List<Expression> expressions) {
        List<Expression> result = null;
        for (int i = 0; i < expressions.size(); i++) {
            Expression original = expressions.get(i);
            Expression transformed = transform(original);
            if (transformed != original && result == null) {
                result = new ArrayList<>(expressions.subList(0, i));
            }
            if (result != null) {
                result.add(transformed);
            }
        }
        return result == null ? expressions : result;
    }
}
