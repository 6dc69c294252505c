package org.mathpy.output;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mathpy.diagnostics.Diagnostic;
import org.mathpy.diagnostics.DiagnosticKind;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileSinkTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("覆盖模式只写入内容本身")
    void testOverwrite() throws IOException {
        Path file = tempDir.resolve("out.py");
        Files.writeString(file, "old content");

        List<Diagnostic> diagnostics = new FileSink(file, false).write("np.sin(x)", "\n");

        assertTrue(diagnostics.isEmpty());
        assertEquals("np.sin(x)", Files.readString(file));
    }

    @Test
    @DisplayName("追加模式在内容后写分隔符")
    void testAppend() throws IOException {
        Path file = tempDir.resolve("out.py");
        FileSink sink = new FileSink(file, true);

        sink.write("a + b", "\n");
        sink.write("a*b", "\n");

        assertEquals("a + b\na*b\n", Files.readString(file));
    }

    @Test
    @DisplayName("不存在的中间目录会被创建")
    void testCreatesIntermediateDirectories() throws IOException {
        Path file = tempDir.resolve("generated").resolve("nested").resolve("f.py");

        List<Diagnostic> diagnostics = new FileSink(file, false).write("x", "");

        assertTrue(diagnostics.isEmpty());
        assertTrue(Files.isDirectory(file.getParent()));
        assertEquals("x", Files.readString(file));
    }

    @Test
    @DisplayName("写入失败返回 WRITE_FAILURE 诊断而不是抛异常")
    void testWriteFailure() throws IOException {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "a regular file");
        Path file = blocker.resolve("f.py");

        List<Diagnostic> diagnostics = assertDoesNotThrow(() -> new FileSink(file, false).write("x", ""));

        assertEquals(1, diagnostics.size());
        assertEquals(DiagnosticKind.WRITE_FAILURE, diagnostics.get(0).getKind());
        assertFalse(diagnostics.get(0).isFatal());
    }

    @Test
    @DisplayName("控制台输出打印到注入的流")
    void testConsoleSink() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

        List<Diagnostic> diagnostics = new ConsoleSink(out).write("np.sqrt(x)", "\n");

        assertTrue(diagnostics.isEmpty());
        assertEquals("np.sqrt(x)" + System.lineSeparator(), buffer.toString(StandardCharsets.UTF_8));
    }
}
