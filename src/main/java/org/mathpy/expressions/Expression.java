package org.mathpy.expressions;

/**
 * 代数表达式树的节点。
 * 所有实现都是不可变的；改写总是产生新树。
 */
public interface Expression {

    <R> R accept(ExpressionVisitor<R> visitor);
}
