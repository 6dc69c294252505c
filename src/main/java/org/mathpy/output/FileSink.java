package org.mathpy.output;

import lombok.Getter;
import org.mathpy.diagnostics.Diagnostic;
import org.mathpy.diagnostics.DiagnosticKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;

/**
 * 写入文件。目录不存在时先创建 (包括中间目录)。
 * 覆盖模式只写 text；追加模式写 text 加分隔符。
 */
@Getter
public final class FileSink implements OutputSink {

    private static final Logger logger = LoggerFactory.getLogger(FileSink.class);

    private final Path file;
    private final boolean append;

    public FileSink(Path file, boolean append) {
        this.file = Objects.requireNonNull(file, "File path cannot be null");
        this.append = append;
    }

    @Override
    public List<Diagnostic> write(String text, String separator) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null && !Files.isDirectory(parent)) {
                Files.createDirectories(parent);
                logger.info("创建目录 {}", parent);
            }
            if (append) {
                Files.writeString(file, text + separator, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } else {
                Files.writeString(file, text, StandardCharsets.UTF_8);
            }
            logger.info("已{}写入 {}", append ? "追加" : "", file);
            return List.of();
        } catch (IOException e) {
            logger.error("无法写入文件 {}", file, e);
            return List.of(Diagnostic.of(DiagnosticKind.WRITE_FAILURE,
                    "Could not write to file " + file + ": " + e.getMessage(), file.toString()));
        }
    }
}
