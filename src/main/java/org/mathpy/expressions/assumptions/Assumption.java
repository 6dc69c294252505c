package org.mathpy.expressions.assumptions;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import org.mathpy.expressions.Add;
import org.mathpy.expressions.Expression;
import org.mathpy.expressions.InputFormPrinter;
import org.mathpy.expressions.Negate;
import org.mathpy.expressions.NumberLiteral;
import org.mathpy.expressions.RelationType;
import org.mathpy.expressions.ToZ3BoolExpr;
import org.mathpy.symbolic.Z3VariableManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 代表一条关于符号的假设，形式为 E1 ~ E2。
 * 内部规范化为 E ~ 0 的形式 (E = E1 - E2)。
 * 此类是不可变的。
 */
@Getter
public final class Assumption implements Comparable<Assumption>, ToZ3BoolExpr {

    private static final Logger logger = LoggerFactory.getLogger(Assumption.class);

    // 规范化后的形式：expression ~ 0
    private final Expression expression;
    private final RelationType relation;

    private final int hashCode;

    private Assumption(Expression left, Expression right, RelationType relation) {
        Objects.requireNonNull(left, "Assumption-构造函数: left 表达式不能为 null");
        Objects.requireNonNull(right, "Assumption-构造函数: right 表达式不能为 null");
        Objects.requireNonNull(relation, "Assumption-构造函数: relation 不能为 null");

        // E1 ~ E2  =>  (E1 - E2) ~ 0
        this.expression = NumberLiteral.ZERO.equals(right) ? left : Add.of(left, Negate.of(right));
        this.relation = relation;
        this.hashCode = Objects.hash(this.expression, this.relation);
        logger.debug("创建 Assumption: {}", this);
    }

    public static Assumption of(Expression left, RelationType relation, Expression right) {
        return new Assumption(left, right, relation);
    }

    /** expr > 0 */
    public static Assumption positive(Expression expression) {
        return new Assumption(expression, NumberLiteral.ZERO, RelationType.GT);
    }

    /** expr < 0 */
    public static Assumption negative(Expression expression) {
        return new Assumption(expression, NumberLiteral.ZERO, RelationType.LT);
    }

    /** expr >= 0 */
    public static Assumption nonNegative(Expression expression) {
        return new Assumption(expression, NumberLiteral.ZERO, RelationType.GE);
    }

    /** expr <= 0 */
    public static Assumption nonPositive(Expression expression) {
        return new Assumption(expression, NumberLiteral.ZERO, RelationType.LE);
    }

    /** expr != 0 */
    public static Assumption nonZero(Expression expression) {
        return new Assumption(expression, NumberLiteral.ZERO, RelationType.NE);
    }

    public Assumption negate() {
        return new Assumption(this.expression, NumberLiteral.ZERO, this.relation.negate());
    }

    @Override
    public BoolExpr toZ3BoolExpr(Context ctx, Z3VariableManager varManager) {
        ArithExpr z3Expr = varManager.toZ3(expression);
        ArithExpr z3Zero = ctx.mkReal(0);

        return switch (relation) {
            case LT -> ctx.mkLt(z3Expr, z3Zero);
            case LE -> ctx.mkLe(z3Expr, z3Zero);
            case GT -> ctx.mkGt(z3Expr, z3Zero);
            case GE -> ctx.mkGe(z3Expr, z3Zero);
            case EQ -> ctx.mkEq(z3Expr, z3Zero);
            case NE -> ctx.mkNot(ctx.mkEq(z3Expr, z3Zero));
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Assumption that = (Assumption) o;
        return relation == that.relation && expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return InputFormPrinter.print(expression) + " " + relation.getSymbol() + " 0";
    }

    @Override
    public int compareTo(Assumption other) {
        int cmp = toString().compareTo(other.toString());
        if (cmp != 0) {
            return cmp;
        }
        return relation.compareTo(other.relation);
    }
}
