package org.mathpy.diagnostics;

import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * 一条结构化的诊断：种类、可读消息、以及机器可读的载荷 (例如未知符号的表达式列表)。
 * 诊断总是作为结果返回，不会作为异常抛出。
 */
@Getter
public final class Diagnostic {

    private final DiagnosticKind kind;
    private final String message;
    private final List<String> payload;

    private Diagnostic(DiagnosticKind kind, String message, List<String> payload) {
        this.kind = Objects.requireNonNull(kind, "Diagnostic kind cannot be null");
        this.message = Objects.requireNonNull(message, "Diagnostic message cannot be null");
        this.payload = List.copyOf(payload);
    }

    public static Diagnostic of(DiagnosticKind kind, String message, List<String> payload) {
        return new Diagnostic(kind, message, payload);
    }

    public static Diagnostic of(DiagnosticKind kind, String message, String... payload) {
        return new Diagnostic(kind, message, Arrays.asList(payload));
    }

    public boolean isFatal() {
        return kind.isFatal();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Diagnostic that = (Diagnostic) o;
        return kind == that.kind && message.equals(that.message) && payload.equals(that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, message, payload);
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
