package org.mathpy.output;

import org.mathpy.diagnostics.Diagnostic;

import java.io.PrintStream;
import java.util.List;
import java.util.Objects;

/**
 * 打印到控制台 (默认 System.out)。不需要分隔符。
 */
public final class ConsoleSink implements OutputSink {

    private final PrintStream out;

    public ConsoleSink() {
        this(System.out);
    }

    public ConsoleSink(PrintStream out) {
        this.out = Objects.requireNonNull(out, "PrintStream cannot be null");
    }

    @Override
    public List<Diagnostic> write(String text, String separator) {
        out.println(text);
        return List.of();
    }
}
