package org.mathpy.expressions;

import org.mathpy.core.Symbol;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 以宿主语言的 InputForm 风格打印表达式，例如 a^(3/2)*Sin[x]。
 * 用于 toString、日志以及诊断中的建议假设 ("y > 0")。
 */
public final class InputFormPrinter implements ExpressionVisitor<String> {

    private static final InputFormPrinter INSTANCE = new InputFormPrinter();

    private static final int ADD = 1;
    private static final int TIMES = 2;
    private static final int POWER = 3;
    private static final int ATOM = 4;

    private InputFormPrinter() {
    }

    public static String print(Expression expression) {
        return expression.accept(INSTANCE);
    }

    @Override
    public String visitNumber(NumberLiteral number) {
        return number.isExact() ? number.getValue().toString() : number.getValue().toDecimalString();
    }

    @Override
    public String visitSymbol(Symbol symbol) {
        return symbol.getName();
    }

    @Override
    public String visitAdd(Add add) {
        List<Expression> terms = add.getTerms();
        StringBuilder sb = new StringBuilder(wrap(terms.get(0), ADD));
        for (Expression term : terms.subList(1, terms.size())) {
            if (term instanceof Negate negate) {
                sb.append(" - ").append(wrap(negate.getInner(), ADD));
            } else {
                sb.append(" + ").append(wrap(term, ADD));
            }
        }
        return sb.toString();
    }

    @Override
    public String visitMul(Mul mul) {
        List<Expression> factors = mul.getFactors();
        StringBuilder sb = new StringBuilder(wrap(factors.get(0), ADD));
        for (Expression factor : factors.subList(1, factors.size())) {
            sb.append('*').append(wrap(factor, TIMES));
        }
        return sb.toString();
    }

    @Override
    public String visitPow(Pow pow) {
        return wrap(pow.getBase(), POWER) + "^" + wrap(pow.getExponent(), POWER);
    }

    @Override
    public String visitCall(Call call) {
        return call.getFunctionName() + call.getArguments().stream()
                .map(InputFormPrinter::print)
                .collect(Collectors.joining(", ", "[", "]"));
    }

    @Override
    public String visitNegate(Negate negate) {
        return "-" + wrap(negate.getInner(), TIMES);
    }

    @Override
    public String visitList(ListExpression list) {
        return list.getElements().stream()
                .map(InputFormPrinter::print)
                .collect(Collectors.joining(", ", "{", "}"));
    }

    @Override
    public String visitPattern(PatternVariable pattern) {
        return pattern.getName() + "_" + (pattern.getHeadConstraint() == null ? "" : pattern.getHeadConstraint());
    }

    // 子表达式的优先级不高于 threshold 时加括号
    private String wrap(Expression child, int threshold) {
        String text = print(child);
        return precedenceOf(child) <= threshold ? "(" + text + ")" : text;
    }

    private static int precedenceOf(Expression expression) {
        if (expression instanceof Add) {
            return ADD;
        }
        if (expression instanceof Mul || expression instanceof Negate) {
            return TIMES;
        }
        if (expression instanceof Pow) {
            return POWER;
        }
        if (expression instanceof NumberLiteral number
                && (number.isNegative() || (number.isExact() && !number.getValue().isInteger()))) {
            return TIMES;
        }
        return ATOM;
    }
}
