package org.mathpy.codegen;

import lombok.Getter;
import org.mathpy.core.Symbol;
import org.mathpy.diagnostics.Diagnostic;
import org.mathpy.diagnostics.DiagnosticKind;
import org.mathpy.diagnostics.Result;
import org.mathpy.expressions.*;
import org.mathpy.utils.Rational;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 把表达式树递归地渲染为 Python 源码。
 * 渲染是结构化的：每个子节点带着自己的优先级返回，父节点只在优先级或结合性需要时加括号。
 * 未映射的函数名原样输出并产生 UNMAPPED_FUNCTION 诊断，不会中止。
 * 此类是不可变的，可以跨线程共享；每次调用使用独立的 {@link IdentifierScope}。
 */
public final class PythonEmitter {

    private static final Logger logger = LoggerFactory.getLogger(PythonEmitter.class);

    @Getter
    private final EmitterConfig config;
    @Getter
    private final IdentifierNormalizer normalizer;

    public PythonEmitter(EmitterConfig config) {
        this.config = Objects.requireNonNull(config, "EmitterConfig cannot be null");
        this.normalizer = new IdentifierNormalizer(config.getReservedWords());
    }

    public IdentifierScope newScope() {
        return new IdentifierScope(normalizer);
    }

    /**
     * 渲染一条独立的表达式 (一个翻译单元)。
     */
    public Result<String> emit(Expression expression) {
        IdentifierScope scope = newScope();
        Result<String> rendered = emit(expression, scope);
        return rendered.withDiagnostics(scope.getCollisions());
    }

    /**
     * 在给定的标识符表中渲染，调用方负责收集 scope 的冲突诊断。
     */
    public Result<String> emit(Expression expression, IdentifierScope scope) {
        Objects.requireNonNull(expression, "Expression cannot be null");
        Session session = new Session(scope);
        String text = expression.accept(session).text;
        logger.debug("PythonEmitter: {} -> {}", expression, text);
        return Result.success(text, session.diagnostics);
    }

    /**
     * 渲染结果及其在目标语言中的优先级。
     */
    private record Rendered(String text, Precedence precedence) {
    }

    private final class Session implements ExpressionVisitor<Rendered> {

        private final IdentifierScope scope;
        private final List<Diagnostic> diagnostics = new ArrayList<>();

        private Session(IdentifierScope scope) {
            this.scope = scope;
        }

        @Override
        public Rendered visitNumber(NumberLiteral number) {
            Rational value = number.getValue();
            if (!number.isExact()) {
                return new Rendered(value.toDecimalString(), number.isNegative() ? Precedence.UNARY : Precedence.ATOM);
            }
            if (value.isInteger()) {
                return new Rendered(value.toString(), number.isNegative() ? Precedence.UNARY : Precedence.ATOM);
            }
            // p/q 在 Python 3 中是真除法
            return new Rendered(value.toString(), Precedence.MULTIPLICATIVE);
        }

        @Override
        public Rendered visitSymbol(Symbol symbol) {
            return config.targetConstant(symbol.getName())
                    .map(constant -> new Rendered(constant, Precedence.ATOM))
                    .orElseGet(() -> new Rendered(scope.resolve(symbol.getName()), Precedence.ATOM));
        }

        @Override
        public Rendered visitPattern(PatternVariable pattern) {
            return new Rendered(scope.resolve(pattern.getName()), Precedence.ATOM);
        }

        @Override
        public Rendered visitAdd(Add add) {
            List<Expression> terms = add.getTerms();
            StringBuilder sb = new StringBuilder(wrapLoose(terms.get(0), Precedence.ADDITIVE));
            for (Expression term : terms.subList(1, terms.size())) {
                Expression subtracted = subtrahend(term);
                if (subtracted != null) {
                    sb.append(" - ").append(wrapStrict(subtracted, Precedence.ADDITIVE));
                } else {
                    sb.append(" + ").append(wrapStrict(term, Precedence.ADDITIVE));
                }
            }
            return new Rendered(sb.toString(), Precedence.ADDITIVE);
        }

        @Override
        public Rendered visitMul(Mul mul) {
            List<Expression> factors = mul.getFactors();
            if (NumberLiteral.MINUS_ONE.equals(factors.get(0))) {
                Expression rest = Mul.product(factors.subList(1, factors.size()));
                return new Rendered("-" + wrapStrict(rest, Precedence.MULTIPLICATIVE), Precedence.UNARY);
            }
            return renderQuotient(factors);
        }

        @Override
        public Rendered visitPow(Pow pow) {
            if (pow.hasNegativeExponent()) {
                return renderQuotient(List.of(pow));
            }
            if (NumberLiteral.HALF.equals(pow.getExponent()) && config.getSqrtFunction() != null) {
                return new Rendered(config.getSqrtFunction() + "(" + render(pow.getBase()) + ")", Precedence.ATOM);
            }
            if (pow.getBase() instanceof Symbol base && "E".equals(base.getName())
                    && config.targetConstant("E").isPresent() && config.targetFunction("Exp").isPresent()) {
                return new Rendered(config.targetFunction("Exp").get() + "(" + render(pow.getExponent()) + ")", Precedence.ATOM);
            }
            // ** 右结合：底数与 ** 同级也要加括号，指数同级则不必
            String base = wrapStrict(pow.getBase(), Precedence.POWER);
            String exponent = wrapLoose(pow.getExponent(), Precedence.POWER);
            return new Rendered(base + "**" + exponent, Precedence.POWER);
        }

        @Override
        public Rendered visitCall(Call call) {
            String name = call.getFunctionName();
            List<Expression> args = call.getArguments();
            if ("Sqrt".equals(name) && args.size() == 1) {
                return visitPow(Pow.sqrt(args.get(0)));
            }
            if ("ArcTan".equals(name) && args.size() == 2 && config.targetFunction(EmitterConfig.TWO_ARGUMENT_ARCTAN).isPresent()) {
                // ArcTan[x, y] 是 (x, y) 的辐角，对应 arctan2(y, x)
                return new Rendered(config.targetFunction(EmitterConfig.TWO_ARGUMENT_ARCTAN).get()
                        + "(" + render(args.get(1)) + ", " + render(args.get(0)) + ")", Precedence.ATOM);
            }
            if ("Log".equals(name) && args.size() == 2 && config.targetFunction("Log").isPresent()) {
                // Log[b, z] = log(z)/log(b)
                String log = config.targetFunction("Log").get();
                return new Rendered(log + "(" + render(args.get(1)) + ")/" + log + "(" + render(args.get(0)) + ")",
                        Precedence.MULTIPLICATIVE);
            }
            String target = config.targetFunction(name).orElseGet(() -> {
                reportUnmapped(name);
                return name;
            });
            return new Rendered(target + "(" + renderAll(args) + ")", Precedence.ATOM);
        }

        @Override
        public Rendered visitNegate(Negate negate) {
            return new Rendered("-" + wrapStrict(negate.getInner(), Precedence.UNARY), Precedence.UNARY);
        }

        @Override
        public Rendered visitList(ListExpression list) {
            String elements = "[" + renderAll(list.getElements()) + "]";
            String constructor = config.getArrayConstructor();
            return new Rendered(constructor == null ? elements : constructor + "(" + elements + ")", Precedence.ATOM);
        }

        /**
         * 负指数的幂放进分母：a*b^-1*c^-2 -> a/(b*c**2)。
         */
        private Rendered renderQuotient(List<Expression> factors) {
            List<Expression> numerator = new ArrayList<>();
            List<Expression> denominator = new ArrayList<>();
            for (Expression factor : factors) {
                if (factor instanceof Pow pow && pow.hasNegativeExponent()) {
                    Rational positive = ((NumberLiteral) pow.getExponent()).getValue().negate();
                    denominator.add(positive.isOne() ? pow.getBase() : Pow.of(pow.getBase(), positive));
                } else {
                    numerator.add(factor);
                }
            }
            if (denominator.isEmpty()) {
                return numerator.size() == 1
                        ? numerator.get(0).accept(this)
                        : new Rendered(renderProduct(numerator), Precedence.MULTIPLICATIVE);
            }
            String top;
            if (numerator.isEmpty()) {
                top = "1";
            } else if (numerator.size() == 1) {
                top = wrapLoose(numerator.get(0), Precedence.MULTIPLICATIVE);
            } else {
                top = renderProduct(numerator);
            }
            String bottom = denominator.size() == 1
                    ? wrapStrict(denominator.get(0), Precedence.MULTIPLICATIVE)
                    : "(" + renderProduct(denominator) + ")";
            return new Rendered(top + "/" + bottom, Precedence.MULTIPLICATIVE);
        }

        private String renderProduct(List<Expression> factors) {
            if (factors.size() == 1) {
                return factors.get(0).accept(this).text;
            }
            StringBuilder sb = new StringBuilder(wrapLoose(factors.get(0), Precedence.MULTIPLICATIVE));
            for (Expression factor : factors.subList(1, factors.size())) {
                Rendered rendered = factor.accept(this);
                // x*-y 合法但难读，非首位的一元负号也加括号
                boolean parens = level(rendered.precedence) <= level(Precedence.MULTIPLICATIVE)
                        || rendered.precedence == Precedence.UNARY;
                sb.append('*').append(parens ? "(" + rendered.text + ")" : rendered.text);
            }
            return sb.toString();
        }

        /**
         * 若 term 应渲染为减法，返回被减去的部分；否则返回 null。
         */
        private Expression subtrahend(Expression term) {
            if (term instanceof Negate negate) {
                return negate.getInner();
            }
            if (term instanceof NumberLiteral number && number.isNegative()) {
                return number.negate();
            }
            if (term instanceof Mul mul && mul.getFactors().get(0) instanceof NumberLiteral coefficient
                    && coefficient.isNegative()) {
                List<Expression> factors = new ArrayList<>(mul.getFactors());
                factors.set(0, coefficient.negate());
                return Mul.product(factors);
            }
            return null;
        }

        private void reportUnmapped(String name) {
            Diagnostic diagnostic = Diagnostic.of(DiagnosticKind.UNMAPPED_FUNCTION,
                    "No target mapping for function '" + name + "', emitted verbatim", name);
            if (!diagnostics.contains(diagnostic)) {
                logger.warn("函数 {} 没有目标语言映射，原样输出", name);
                diagnostics.add(diagnostic);
            }
        }

        private String render(Expression expression) {
            return expression.accept(this).text;
        }

        private String renderAll(List<Expression> expressions) {
            return expressions.stream().map(this::render).collect(Collectors.joining(", "));
        }

        // 子节点优先级低于 context 时加括号 (左结合位置)
        private String wrapLoose(Expression child, Precedence context) {
            Rendered rendered = child.accept(this);
            return level(rendered.precedence) < level(context) ? "(" + rendered.text + ")" : rendered.text;
        }

        // 子节点优先级不高于 context 时加括号 (右操作数位置)
        private String wrapStrict(Expression child, Precedence context) {
            Rendered rendered = child.accept(this);
            return level(rendered.precedence) <= level(context) ? "(" + rendered.text + ")" : rendered.text;
        }

        private int level(Precedence precedence) {
            return config.level(precedence);
        }
    }
}
