package org.mathpy.symbolic;

import org.mathpy.expressions.Expression;
import org.mathpy.expressions.assumptions.AssumptionSet;

/**
 * 在给定假设下判断子表达式的符号。
 * 实现必须是确定性的，并且从不抛出异常：无法判断时返回 {@link Sign#UNKNOWN}。
 */
@FunctionalInterface
public interface SignOracle {

    Sign signOf(Expression expression, AssumptionSet assumptions);
}
