package org.mathpy.definitions;

import org.mathpy.codegen.IdentifierNormalizer;
import org.mathpy.core.Symbol;
import org.mathpy.diagnostics.Diagnostic;
import org.mathpy.diagnostics.DiagnosticKind;
import org.mathpy.diagnostics.Result;
import org.mathpy.expressions.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 从符号的已存储定义中抽取函数签名。
 * 只使用第一条定义；左侧按从左到右的出现顺序收集所有模式变量 (任意深度) 作为参数。
 * 没有定义时返回 NO_DEFINITION_FOUND，规范化后参数重名时返回 AMBIGUOUS_SIGNATURE。
 */
public final class FunctionSignatureExtractor {

    private static final Logger logger = LoggerFactory.getLogger(FunctionSignatureExtractor.class);

    private final IdentifierNormalizer normalizer;

    public FunctionSignatureExtractor(IdentifierNormalizer normalizer) {
        this.normalizer = Objects.requireNonNull(normalizer, "IdentifierNormalizer cannot be null");
    }

    public Result<FunctionSignature> extract(SymbolDefinitions definitions) {
        Objects.requireNonNull(definitions, "SymbolDefinitions cannot be null");
        if (definitions.isEmpty()) {
            logger.warn("符号 {} 没有任何定义", definitions.getName());
            return Result.failure(Diagnostic.of(DiagnosticKind.NO_DEFINITION_FOUND,
                    "No definition found for the symbol " + definitions.getName(), definitions.getName()));
        }
        if (definitions.getDownValues().size() > 1) {
            logger.info("符号 {} 有 {} 条定义，只使用第一条", definitions.getName(), definitions.getDownValues().size());
        }
        DownValue first = definitions.getDownValues().get(0);

        List<String> rawParameters = new ArrayList<>();
        first.getLhs().accept(new PatternCollector(rawParameters));

        List<String> parameters = new ArrayList<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (String raw : rawParameters) {
            String normalized = normalizer.normalize(raw);
            if (parameters.contains(normalized)) {
                duplicates.add(normalized);
            }
            parameters.add(normalized);
        }
        if (!duplicates.isEmpty()) {
            logger.warn("{} 的参数 {} 规范化后重名: {}", definitions.getName(), rawParameters, duplicates);
            return Result.failure(Diagnostic.of(DiagnosticKind.AMBIGUOUS_SIGNATURE,
                    "Ambiguous signature for " + definitions.getName() + ": duplicate parameters " + duplicates,
                    List.copyOf(duplicates)));
        }

        FunctionSignature signature = FunctionSignature.of(normalizer.normalize(definitions.getName()),
                definitions.getName(), parameters, rawParameters, first.getRhs());
        logger.debug("抽取签名: {}", signature);
        return Result.success(signature);
    }

    /**
     * 先序遍历，按出现顺序记录模式变量名。
     */
    private static final class PatternCollector implements ExpressionVisitor<Void> {

        private final List<String> names;

        private PatternCollector(List<String> names) {
            this.names = names;
        }

        @Override
        public Void visitNumber(NumberLiteral number) {
            return null;
        }

        @Override
        public Void visitSymbol(Symbol symbol) {
            return null;
        }

        @Override
        public Void visitPattern(PatternVariable pattern) {
            names.add(pattern.getName());
            return null;
        }

        @Override
        public Void visitAdd(Add add) {
            return visitAll(add.getTerms());
        }

        @Override
        public Void visitMul(Mul mul) {
            return visitAll(mul.getFactors());
        }

        @Override
        public Void visitPow(Pow pow) {
            pow.getBase().accept(this);
            pow.getExponent().accept(this);
            return null;
        }

        @Override
        public Void visitCall(Call call) {
            return visitAll(call.getArguments());
        }

        @Override
        public Void visitNegate(Negate negate) {
            return negate.getInner().accept(this);
        }

        @Override
        public Void visitList(ListExpression list) {
            return visitAll(list.getElements());
        }

        private Void visitAll(List<Expression> expressions) {
            expressions.forEach(e -> e.accept(this));
            return null;
        }
    }
}
