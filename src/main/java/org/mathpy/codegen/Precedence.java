package org.mathpy.codegen;

/**
 * 目标语言中的运算符类别。具体的绑定强度由 {@link EmitterConfig#level(Precedence)} 给出。
 */
public enum Precedence {
    /** a + b, a - b */
    ADDITIVE,
    /** a * b, a / b */
    MULTIPLICATIVE,
    /** -a */
    UNARY,
    /** a ** b (右结合) */
    POWER,
    /** 标识符、字面量、函数调用、括号表达式 */
    ATOM
}
