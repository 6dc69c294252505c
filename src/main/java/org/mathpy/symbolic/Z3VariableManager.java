package org.mathpy.symbolic;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.RealExpr;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Sort;
import lombok.Getter;
import org.mathpy.core.Symbol;
import org.mathpy.expressions.Expression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 负责管理宿主符号到 Z3 实数常量、宿主函数到 Z3 未解释函数的映射。
 * 翻译表达式时产生的附加事实 (例如 Exp[x] > 0) 先缓存在这里，查询时再断言到 Solver。
 * 非线程安全，由 {@link Z3SignOracle} 串行使用。
 * @author Ayalyt
 */
@Getter
public class Z3VariableManager {

    private static final Logger logger = LoggerFactory.getLogger(Z3VariableManager.class);

    private final Context ctx;
    private final Map<String, RealExpr> symbolZ3Vars;
    private final Map<String, FuncDecl> functionDecls;

    // 当前查询中翻译产生的附加事实，保持插入顺序以便结果可复现
    private final Set<BoolExpr> sideConditions;

    private final Z3ExpressionTranslator translator;

    public Z3VariableManager(Context ctx) {
        this.ctx = Objects.requireNonNull(ctx, "Z3 Context cannot be null.");
        this.symbolZ3Vars = new HashMap<>();
        this.functionDecls = new HashMap<>();
        this.sideConditions = new LinkedHashSet<>();
        this.translator = new Z3ExpressionTranslator(ctx, this);
        logger.debug("Z3VariableManager 初始化完成");
    }

    /**
     * 获取指定符号对应的 Z3 实数常量，不存在时创建并缓存。
     */
    public RealExpr getZ3Var(Symbol symbol) {
        return getZ3Var(symbol.getName());
    }

    public RealExpr getZ3Var(String name) {
        return symbolZ3Vars.computeIfAbsent(name, n -> {
            logger.debug("创建 Z3 实数变量: {}", n);
            return ctx.mkRealConst(n);
        });
    }

    /**
     * 获取宿主函数对应的未解释函数 (按名字和元数区分)。
     */
    public FuncDecl getFunction(String name, int arity) {
        String key = name + "/" + arity;
        return functionDecls.computeIfAbsent(key, k -> {
            Sort[] domain = new Sort[arity];
            Arrays.fill(domain, ctx.mkRealSort());
            logger.debug("创建 Z3 未解释函数: {}", k);
            return ctx.mkFuncDecl(k, domain, ctx.mkRealSort());
        });
    }

    public ArithExpr toZ3(Expression expression) {
        return translator.translate(expression);
    }

    public void addSideCondition(BoolExpr condition) {
        sideConditions.add(condition);
    }

    public void clearSideConditions() {
        sideConditions.clear();
    }

    /**
     * 把翻译过程中收集到的附加事实断言到 Solver。
     * @param solver Z3 Solver 实例。
     */
    public void assertSideConditions(Solver solver) {
        for (BoolExpr condition : sideConditions) {
            solver.add(condition);
            logger.debug("断言 Z3 附加事实: {}", condition);
        }
    }
}
