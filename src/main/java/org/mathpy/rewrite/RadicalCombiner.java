package org.mathpy.rewrite;

import org.apache.commons.lang3.tuple.Pair;
import org.mathpy.diagnostics.Diagnostic;
import org.mathpy.diagnostics.DiagnosticKind;
import org.mathpy.diagnostics.Result;
import org.mathpy.expressions.Call;
import org.mathpy.expressions.Expression;
import org.mathpy.expressions.ExpressionTransformer;
import org.mathpy.expressions.Mul;
import org.mathpy.expressions.Negate;
import org.mathpy.expressions.Pow;
import org.mathpy.expressions.assumptions.Assumption;
import org.mathpy.expressions.assumptions.AssumptionSet;
import org.mathpy.symbolic.Sign;
import org.mathpy.symbolic.SignOracle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 根式合并：把乘积中两个以上的 base^(n/2) 因子合并为一个 Sqrt[Π base^n]。
 * <p>
 * 没有假设 ({@link AssumptionSet#NONE}) 时为语法模式，无条件合并，不查询符号；
 * 有假设时逐个查询底数的符号，任何一个未知则保留原节点并返回 UNKNOWN_SIGNS 与 SUGGESTED_ASSUMPTIONS 诊断，
 * 符号全部已知时按 {@link SignPolicy} 计算符号因子。
 * <p>
 * 改写只发生在 Mul 节点内部，不做分配律。整棵树反复改写直到某一轮没有变化；
 * 每次成功的合并都严格减少该 Mul 中根式因子的个数，因此一定终止。
 * 返回的诊断描述的是最终的树 (最后一轮)。
 */
public final class RadicalCombiner {

    private static final Logger logger = LoggerFactory.getLogger(RadicalCombiner.class);

    /** 日志中最多逐条列出的未知符号数 */
    private static final int MAX_REPORTED_UNKNOWNS = 5;
    private static final int MAX_PASSES = 1000;

    private final SignOracle oracle;
    private final SignPolicy policy;

    public RadicalCombiner(SignOracle oracle) {
        this(oracle, SignPolicy.STRICT);
    }

    public RadicalCombiner(SignOracle oracle, SignPolicy policy) {
        this.oracle = Objects.requireNonNull(oracle, "SignOracle cannot be null");
        this.policy = Objects.requireNonNull(policy, "SignPolicy cannot be null");
    }

    public SignPolicy getPolicy() {
        return policy;
    }

    /**
     * 语法模式合并。
     */
    public Result<Expression> combine(Expression expression) {
        return combine(expression, AssumptionSet.NONE);
    }

    public Result<Expression> combine(Expression expression, AssumptionSet assumptions) {
        Objects.requireNonNull(expression, "Expression cannot be null");
        Objects.requireNonNull(assumptions, "AssumptionSet cannot be null");

        Map<Expression, Sign> signCache = new HashMap<>();
        Expression current = expression;
        Pass pass;
        int passes = 0;
        while (true) {
            pass = new Pass(assumptions, signCache);
            Expression next = pass.transform(current);
            passes++;
            if (next == current) {
                break;
            }
            if (passes >= MAX_PASSES) {
                logger.error("根式合并在 {} 轮后仍未稳定，停止于当前结果", passes);
                current = next;
                break;
            }
            current = next;
        }

        reportUnknowns(pass.unknowns);
        List<Diagnostic> diagnostics = List.copyOf(pass.diagnostics);
        if (current == expression) {
            logger.debug("根式合并没有改写 {} (假设: {})", expression, assumptions);
        } else {
            logger.info("根式合并完成，{} 轮: {} -> {}", passes, expression, current);
        }
        return Result.success(current, diagnostics);
    }

    private void reportUnknowns(Map<Expression, Sign> unknowns) {
        if (unknowns.isEmpty()) {
            return;
        }
        logger.warn("以下 {} 个底数的符号无法确定，相关根式未合并", unknowns.size());
        unknowns.entrySet().stream()
                .limit(MAX_REPORTED_UNKNOWNS)
                .forEach(e -> logger.warn("  {} : {}", e.getKey(), e.getValue()));
        if (unknowns.size() > MAX_REPORTED_UNKNOWNS) {
            logger.warn("  ... and {} more", unknowns.size() - MAX_REPORTED_UNKNOWNS);
        }
    }

    /**
     * 若 factor 是 base^(n/2) 形式，返回 (base, n)。Sqrt[x] 视为 n = 1。
     */
    static Optional<Pair<Expression, Integer>> asRadical(Expression factor) {
        if (factor instanceof Pow pow) {
            return pow.halfIntegerNumerator().map(n -> Pair.of(pow.getBase(), n));
        }
        if (factor instanceof Call call && "Sqrt".equals(call.getFunctionName()) && call.getArguments().size() == 1) {
            return Optional.of(Pair.of(call.getArguments().get(0), 1));
        }
        return Optional.empty();
    }

    /**
     * Π base^n，n = 1 时直接用 base。
     */
    static Expression radicand(List<Pair<Expression, Integer>> radicals) {
        List<Expression> factors = new ArrayList<>();
        for (Pair<Expression, Integer> radical : radicals) {
            int n = radical.getRight();
            factors.add(n == 1 ? radical.getLeft() : Pow.of(radical.getLeft(), n));
        }
        return Mul.product(factors);
    }

    /**
     * 自底向上的一轮改写。
     */
    private final class Pass extends ExpressionTransformer {

        private final AssumptionSet assumptions;
        private final Map<Expression, Sign> signCache;
        private final Set<Diagnostic> diagnostics = new LinkedHashSet<>();
        private final Map<Expression, Sign> unknowns = new LinkedHashMap<>();

        private Pass(AssumptionSet assumptions, Map<Expression, Sign> signCache) {
            this.assumptions = assumptions;
            this.signCache = signCache;
        }

        @Override
        public Expression visitMul(Mul mul) {
            Expression rebuilt = super.visitMul(mul);
            return rebuilt instanceof Mul product ? combineFactors(product) : rebuilt;
        }

        private Expression combineFactors(Mul mul) {
            List<Pair<Expression, Integer>> radicals = new ArrayList<>();
            List<Expression> others = new ArrayList<>();
            int negations = 0;
            for (Expression factor : mul.getFactors()) {
                // 上一次合并产生的 -Sqrt[...] 仍是根式，负号并入符号因子
                if (factor instanceof Negate negate && asRadical(negate.getInner()).isPresent()) {
                    radicals.add(asRadical(negate.getInner()).get());
                    negations++;
                } else {
                    asRadical(factor).ifPresentOrElse(radicals::add, () -> others.add(factor));
                }
            }
            if (radicals.size() < 2) {
                return mul;
            }

            int signFactor = negations % 2 == 0 ? 1 : -1;
            if (!assumptions.isNone()) {
                Optional<Integer> resolved = resolveSignFactor(mul, radicals);
                if (resolved.isEmpty()) {
                    return mul;
                }
                signFactor *= resolved.get();
            }

            List<Expression> factors = new ArrayList<>(others);
            factors.add(Pow.sqrt(radicand(radicals)));
            Expression combined = Mul.product(factors);
            Expression result = signFactor < 0 ? Negate.of(combined) : combined;
            logger.debug("合并根式: {} -> {}", mul, result);
            return result;
        }

        private Optional<Integer> resolveSignFactor(Mul mul, List<Pair<Expression, Integer>> radicals) {
            List<Expression> unknownBases = new ArrayList<>();
            List<Integer> negativeNumerators = new ArrayList<>();
            for (Pair<Expression, Integer> radical : radicals) {
                Expression base = radical.getLeft();
                Sign sign = signCache.computeIfAbsent(base, b -> oracle.signOf(b, assumptions));
                if (!sign.isKnown()) {
                    if (!unknownBases.contains(base)) {
                        unknownBases.add(base);
                    }
                    unknowns.putIfAbsent(base, sign);
                } else if (sign == Sign.NEGATIVE) {
                    negativeNumerators.add(radical.getRight());
                }
            }

            if (!unknownBases.isEmpty()) {
                List<String> names = unknownBases.stream().map(Expression::toString).toList();
                List<String> suggestions = unknownBases.stream()
                        .map(b -> Assumption.positive(b).toString())
                        .toList();
                diagnostics.add(Diagnostic.of(DiagnosticKind.UNKNOWN_SIGNS,
                        "Cannot combine radicals in " + mul + ": unknown sign of " + String.join(", ", names),
                        names));
                diagnostics.add(Diagnostic.of(DiagnosticKind.SUGGESTED_ASSUMPTIONS,
                        "Consider assuming " + String.join(" && ", suggestions),
                        suggestions));
                return Optional.empty();
            }

            Optional<Integer> signFactor = policy.signFactor(negativeNumerators);
            if (signFactor.isEmpty()) {
                String numerators = negativeNumerators.stream().map(String::valueOf).collect(Collectors.joining(", "));
                diagnostics.add(Diagnostic.of(DiagnosticKind.IMAGINARY_RESIDUAL,
                        "Cannot combine radicals in " + mul + ": negative bases leave an odd power of I",
                        mul.toString()));
                logger.debug("{} 中负底数的指数分子 [{}] 之和为奇数，不合并", mul, numerators);
            }
            return signFactor;
        }
    }
}
