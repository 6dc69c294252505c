package org.mathpy.symbolic;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.FuncDecl;
import org.mathpy.core.Symbol;
import org.mathpy.expressions.*;
import org.mathpy.utils.Rational;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

/**
 * 把表达式树翻译成 Z3 实数算术表达式。
 * 整数次幂展开为乘法；其余幂和函数调用变成未解释函数，并附带已知的符号事实。
 */
final class Z3ExpressionTranslator implements ExpressionVisitor<ArithExpr> {

    private static final Logger logger = LoggerFactory.getLogger(Z3ExpressionTranslator.class);

    // 展开整数次幂的上限，更高的次幂当作未解释函数
    private static final int MAX_EXPANDED_POWER = 16;

    private final Context ctx;
    private final Z3VariableManager varManager;

    Z3ExpressionTranslator(Context ctx, Z3VariableManager varManager) {
        this.ctx = ctx;
        this.varManager = varManager;
    }

    ArithExpr translate(Expression expression) {
        return expression.accept(this);
    }

    @Override
    public ArithExpr visitNumber(NumberLiteral number) {
        return number.getValue().toZ3Real(ctx);
    }

    @Override
    public ArithExpr visitSymbol(Symbol symbol) {
        ArithExpr var = varManager.getZ3Var(symbol);
        // 宿主的内建常量
        switch (symbol.getName()) {
            case "Pi" -> bound(var, "157/50", "63/20");
            case "E" -> bound(var, "271/100", "68/25");
            case "Degree" -> bound(var, "1/58", "1/57");
            default -> {
            }
        }
        return var;
    }

    @Override
    public ArithExpr visitAdd(Add add) {
        return ctx.mkAdd(translateAll(add.getTerms()));
    }

    @Override
    public ArithExpr visitMul(Mul mul) {
        return ctx.mkMul(translateAll(mul.getFactors()));
    }

    @Override
    public ArithExpr visitPow(Pow pow) {
        ArithExpr base = translate(pow.getBase());
        if (pow.getExponent() instanceof NumberLiteral number && number.isExact()) {
            Rational exponent = number.getValue();
            if (exponent.isInteger() && exponent.abs().compareTo(Rational.valueOf(MAX_EXPANDED_POWER)) <= 0) {
                return integerPower(base, exponent.intValueExact());
            }
        }
        ArithExpr exponent = translate(pow.getExponent());
        ArithExpr result = (ArithExpr) ctx.mkApp(varManager.getFunction("Power", 2), base, exponent);
        ArithExpr zero = ctx.mkReal(0);
        // 正数的实数次幂为正；半整数次幂 (主平方根) 对非负底数非负
        varManager.addSideCondition(ctx.mkImplies(ctx.mkGt(base, zero), ctx.mkGt(result, zero)));
        if (pow.isRadical() && pow.halfIntegerNumerator().orElse(0) > 0) {
            varManager.addSideCondition(ctx.mkImplies(ctx.mkGe(base, zero), ctx.mkGe(result, zero)));
        }
        return result;
    }

    @Override
    public ArithExpr visitCall(Call call) {
        ArithExpr[] args = translateAll(call.getArguments());
        FuncDecl function = varManager.getFunction(call.getFunctionName(), args.length);
        ArithExpr result = (ArithExpr) ctx.mkApp(function, args);
        ArithExpr zero = ctx.mkReal(0);
        if (args.length == 1) {
            switch (call.getFunctionName()) {
                case "Exp", "Cosh" -> varManager.addSideCondition(ctx.mkGt(result, zero));
                case "Abs" -> {
                    varManager.addSideCondition(ctx.mkGe(result, zero));
                    varManager.addSideCondition(ctx.mkImplies(ctx.mkNot(ctx.mkEq(args[0], zero)), ctx.mkGt(result, zero)));
                }
                case "Sqrt" -> {
                    varManager.addSideCondition(ctx.mkImplies(ctx.mkGe(args[0], zero), ctx.mkGe(result, zero)));
                    varManager.addSideCondition(ctx.mkImplies(ctx.mkGt(args[0], zero), ctx.mkGt(result, zero)));
                }
                default -> logger.debug("函数 {} 没有已知的符号事实", call.getFunctionName());
            }
        }
        return result;
    }

    @Override
    public ArithExpr visitNegate(Negate negate) {
        return ctx.mkUnaryMinus(translate(negate.getInner()));
    }

    @Override
    public ArithExpr visitList(ListExpression list) {
        throw new IllegalArgumentException("列表不是实数表达式，无法翻译为 Z3: " + list);
    }

    @Override
    public ArithExpr visitPattern(PatternVariable pattern) {
        return varManager.getZ3Var(pattern.getName());
    }

    private ArithExpr integerPower(ArithExpr base, int exponent) {
        if (exponent == 0) {
            return ctx.mkReal(1);
        }
        ArithExpr[] copies = new ArithExpr[Math.abs(exponent)];
        Arrays.fill(copies, base);
        ArithExpr positive = copies.length == 1 ? base : ctx.mkMul(copies);
        return exponent > 0 ? positive : ctx.mkDiv(ctx.mkReal(1), positive);
    }

    private void bound(ArithExpr var, String lower, String upper) {
        varManager.addSideCondition(ctx.mkGt(var, ctx.mkReal(lower)));
        varManager.addSideCondition(ctx.mkLt(var, ctx.mkReal(upper)));
    }

    private ArithExpr[] translateAll(List<Expression> expressions) {
        return expressions.stream().map(this::translate).toArray(ArithExpr[]::new);
    }
}
