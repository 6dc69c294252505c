package org.mathpy.translator;

import lombok.Getter;
import org.mathpy.codegen.EmitterConfig;
import org.mathpy.codegen.IdentifierScope;
import org.mathpy.codegen.PythonEmitter;
import org.mathpy.definitions.FunctionSignature;
import org.mathpy.definitions.FunctionSignatureExtractor;
import org.mathpy.definitions.SymbolDefinitions;
import org.mathpy.diagnostics.Diagnostic;
import org.mathpy.diagnostics.DiagnosticKind;
import org.mathpy.diagnostics.Result;
import org.mathpy.expressions.Expression;
import org.mathpy.expressions.assumptions.Assumption;
import org.mathpy.expressions.assumptions.AssumptionSet;
import org.mathpy.output.ConsoleSink;
import org.mathpy.output.FileSink;
import org.mathpy.output.OutputSink;
import org.mathpy.rewrite.RadicalCombiner;
import org.mathpy.rewrite.SignPolicy;
import org.mathpy.symbolic.SignOracle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 对外入口：表达式与函数定义到 Python 的翻译，以及根式合并。
 * <ul>
 *     <li>file 为空串时结果交给控制台输出，否则写入文件；</li>
 *     <li>追加模式下表达式后跟一个换行，函数后跟一个空行；</li>
 *     <li>所有问题都以诊断返回，批量翻译中一个失败不影响其他。</li>
 * </ul>
 * 本类不持有 SignOracle 的所有权，调用方负责关闭。
 */
public final class PythonTranslator {

    private static final Logger logger = LoggerFactory.getLogger(PythonTranslator.class);

    private static final String EXPRESSION_SEPARATOR = "\n";
    private static final String FUNCTION_SEPARATOR = "\n\n";

    @Getter
    private final PythonEmitter emitter;
    @Getter
    private final RadicalCombiner combiner;
    private final FunctionSignatureExtractor extractor;
    private final OutputSink console;

    public PythonTranslator(SignOracle oracle) {
        this(EmitterConfig.numpy(), oracle, SignPolicy.STRICT, new ConsoleSink());
    }

    public PythonTranslator(EmitterConfig config, SignOracle oracle, SignPolicy policy, OutputSink console) {
        Objects.requireNonNull(config, "EmitterConfig cannot be null");
        this.emitter = new PythonEmitter(config);
        this.combiner = new RadicalCombiner(oracle, policy);
        this.extractor = new FunctionSignatureExtractor(emitter.getNormalizer());
        this.console = Objects.requireNonNull(console, "Console sink cannot be null");
    }

    // --- 表达式 ---

    /**
     * 只翻译，不输出。
     */
    public Result<String> toPythonString(Expression expression) {
        Result<String> result = emitter.emit(expression);
        logger.info("翻译表达式: {} -> {}", expression, result.getValue());
        return result;
    }

    public Result<String> toPythonString(Expression expression, String file, boolean append) {
        return deliver(toPythonString(expression), file, append, EXPRESSION_SEPARATOR);
    }

    // --- 函数定义 ---

    /**
     * 把符号的第一条定义翻译为 def name(params):\n    return body，只翻译，不输出。
     */
    public Result<String> toPython(SymbolDefinitions definitions) {
        Result<FunctionSignature> extracted = extractor.extract(definitions);
        if (!extracted.isSuccess()) {
            return extracted.map(FunctionSignature::getName);
        }
        FunctionSignature signature = extracted.getValue();

        IdentifierScope scope = emitter.newScope();
        String name = scope.resolve(signature.getRawName());
        List<String> parameters = signature.getRawParameters().stream().map(scope::resolve).toList();
        Result<String> body = emitter.emit(signature.getBody(), scope);

        String text = "def " + name + "(" + String.join(", ", parameters) + "):\n"
                + emitter.getConfig().getIndent() + "return " + body.getValue();
        logger.info("翻译函数 {}", definitions.getName());
        return Result.success(text, body.getDiagnostics()).withDiagnostics(scope.getCollisions());
    }

    public Result<String> toPython(SymbolDefinitions definitions, String file, boolean append) {
        return deliver(toPython(definitions), file, append, FUNCTION_SEPARATOR);
    }

    /**
     * 逐个翻译，结果与输入一一对应。
     */
    public List<Result<String>> toPythonAll(List<SymbolDefinitions> definitions) {
        List<Result<String>> results = new ArrayList<>();
        int failures = 0;
        for (SymbolDefinitions definition : definitions) {
            Result<String> result = toPython(definition);
            if (!result.isSuccess()) {
                failures++;
            }
            results.add(result);
        }
        logger.info("批量翻译 {} 个定义，失败 {} 个", definitions.size(), failures);
        return results;
    }

    // --- 根式合并 ---

    public Result<Expression> combineSqrt(Expression expression) {
        return combiner.combine(expression);
    }

    public Result<Expression> combineSqrt(Expression expression, AssumptionSet assumptions) {
        return combiner.combine(expression, assumptions);
    }

    /**
     * 列表形式的假设按合取处理，空列表即没有假设。
     */
    public Result<Expression> combineSqrt(Expression expression, List<Assumption> assumptions) {
        return combiner.combine(expression, AssumptionSet.of(assumptions));
    }

    /**
     * 先合并根式再翻译，两步的诊断都保留。
     */
    public Result<String> combineSqrtToPython(Expression expression, AssumptionSet assumptions) {
        Result<Expression> combined = combiner.combine(expression, assumptions);
        Result<String> emitted = emitter.emit(combined.getValue());
        return Result.success(emitted.getValue(), combined.getDiagnostics()).withDiagnostics(emitted.getDiagnostics());
    }

    private Result<String> deliver(Result<String> result, String file, boolean append, String separator) {
        Objects.requireNonNull(file, "File cannot be null, use \"\" for console output");
        if (!result.isSuccess()) {
            return result;
        }
        OutputSink sink;
        if (file.isEmpty()) {
            sink = console;
        } else {
            try {
                sink = new FileSink(Path.of(file), append);
            } catch (InvalidPathException e) {
                logger.error("非法的文件路径 {}", file, e);
                return result.withDiagnostics(List.of(Diagnostic.of(DiagnosticKind.WRITE_FAILURE,
                        "Invalid file path " + file + ": " + e.getMessage(), file)));
            }
        }
        return result.withDiagnostics(sink.write(result.getValue(), separator));
    }
}
