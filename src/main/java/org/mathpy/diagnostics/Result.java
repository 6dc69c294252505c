package org.mathpy.diagnostics;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * 一次转换的结果：要么是一个值加上若干非致命诊断，要么没有值而带有至少一条致命诊断。
 * @param <T> 值的类型
 */
public final class Result<T> {

    private final T value;
    private final List<Diagnostic> diagnostics;

    private Result(T value, List<Diagnostic> diagnostics) {
        this.value = value;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public static <T> Result<T> success(T value) {
        return new Result<>(Objects.requireNonNull(value, "Result value cannot be null"), List.of());
    }

    public static <T> Result<T> success(T value, List<Diagnostic> diagnostics) {
        return new Result<>(Objects.requireNonNull(value, "Result value cannot be null"), diagnostics);
    }

    public static <T> Result<T> failure(Diagnostic diagnostic) {
        if (!diagnostic.isFatal()) {
            throw new IllegalArgumentException("failure 需要致命诊断，实际为 " + diagnostic.getKind());
        }
        return new Result<>(null, List.of(diagnostic));
    }

    public boolean isSuccess() {
        return value != null;
    }

    /**
     * @throws NoSuchElementException 如果这是一个失败结果
     */
    public T getValue() {
        if (value == null) {
            throw new NoSuchElementException("失败的结果没有值: " + diagnostics);
        }
        return value;
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public List<Diagnostic> getDiagnostics(DiagnosticKind kind) {
        return diagnostics.stream().filter(d -> d.getKind() == kind).toList();
    }

    public boolean hasDiagnostic(DiagnosticKind kind) {
        return diagnostics.stream().anyMatch(d -> d.getKind() == kind);
    }

    /**
     * 对值做变换，诊断原样保留。失败结果直接透传。
     */
    public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        if (value == null) {
            return new Result<>(null, diagnostics);
        }
        return new Result<>(mapper.apply(value), diagnostics);
    }

    /**
     * 追加诊断，返回新结果。
     */
    public Result<T> withDiagnostics(List<Diagnostic> more) {
        if (more.isEmpty()) {
            return this;
        }
        List<Diagnostic> merged = new ArrayList<>(diagnostics);
        merged.addAll(more);
        return new Result<>(value, merged);
    }

    @Override
    public String toString() {
        return isSuccess() ? "Success[" + value + ", " + diagnostics + "]" : "Failure" + diagnostics;
    }
}
