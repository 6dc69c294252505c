package org.mathpy.symbolic;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;
import lombok.Getter;
import org.mathpy.expressions.Expression;
import org.mathpy.expressions.NumberLiteral;
import org.mathpy.expressions.assumptions.AssumptionSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 基于 Z3 的符号判定器。
 * 判定方法：在假设 A 下，若 A ∧ e <= 0 不可满足则 e 为正；若 A ∧ e >= 0 不可满足则 e 为负；
 * 若 A ∧ e != 0 不可满足则 e 为零；其余情况 (包括 Z3 返回 UNKNOWN、超时) 均为 UNKNOWN。
 * Z3 Context 不是线程安全的，因此所有查询串行执行。
 * @author Ayalyt
 */
public class Z3SignOracle implements SignOracle, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Z3SignOracle.class);

    public static final int DEFAULT_TIMEOUT_MILLIS = 2000;

    @Getter
    private final Context context;
    @Getter
    private final Z3VariableManager varManager;
    private final int timeoutMillis;

    public Z3SignOracle() {
        this(DEFAULT_TIMEOUT_MILLIS);
    }

    public Z3SignOracle(int timeoutMillis) {
        if (timeoutMillis <= 0) {
            throw new IllegalArgumentException("timeoutMillis 必须为正数: " + timeoutMillis);
        }
        this.context = new Context();
        this.varManager = new Z3VariableManager(context);
        this.timeoutMillis = timeoutMillis;
        logger.info("Z3SignOracle 初始化完成，超时 {} ms", timeoutMillis);
    }

    @Override
    public synchronized Sign signOf(Expression expression, AssumptionSet assumptions) {
        if (expression instanceof NumberLiteral number) {
            return Sign.ofSignum(number.getValue().signum());
        }
        try {
            varManager.clearSideConditions();
            BoolExpr assumed = assumptions.toZ3BoolExpr(context, varManager);
            ArithExpr z3Expr = varManager.toZ3(expression);
            ArithExpr zero = context.mkReal(0);

            Solver solver = context.mkSolver();
            Params params = context.mkParams();
            params.add("timeout", timeoutMillis);
            solver.setParameters(params);
            solver.add(assumed);
            varManager.assertSideConditions(solver);

            Status consistent = solver.check();
            if (consistent == Status.UNSATISFIABLE) {
                logger.warn("假设 {} 自相矛盾，无法判断 {} 的符号", assumptions, expression);
                return Sign.UNKNOWN;
            }

            Sign result;
            if (isUnsatisfiable(solver, context.mkLe(z3Expr, zero))) {
                result = Sign.POSITIVE;
            } else if (isUnsatisfiable(solver, context.mkGe(z3Expr, zero))) {
                result = Sign.NEGATIVE;
            } else if (isUnsatisfiable(solver, context.mkNot(context.mkEq(z3Expr, zero)))) {
                result = Sign.ZERO;
            } else {
                result = Sign.UNKNOWN;
            }
            logger.debug("Z3SignOracle: 在假设 {} 下 {} 的符号为 {}", assumptions, expression, result);
            return result;
        } catch (Z3Exception | IllegalArgumentException | ArithmeticException e) {
            logger.warn("Z3SignOracle: 判断 {} 的符号失败，视为 UNKNOWN: {}", expression, e.getMessage());
            return Sign.UNKNOWN;
        }
    }

    private boolean isUnsatisfiable(Solver solver, BoolExpr query) {
        solver.push();
        try {
            solver.add(query);
            Status status = solver.check();
            if (status == Status.UNKNOWN) {
                logger.debug("Z3 返回 UNKNOWN: {}", solver.getReasonUnknown());
            }
            return status == Status.UNSATISFIABLE;
        } finally {
            solver.pop();
        }
    }

    @Override
    public synchronized void close() {
        context.close();
        logger.info("Z3SignOracle 已关闭");
    }
}
