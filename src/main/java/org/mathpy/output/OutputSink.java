package org.mathpy.output;

import org.mathpy.diagnostics.Diagnostic;

import java.util.List;

/**
 * 生成代码的去处。写入失败不抛异常，而是以 WRITE_FAILURE 诊断返回。
 */
public interface OutputSink {

    /**
     * @param text 生成的代码
     * @param separator 追加模式下写在 text 之后的分隔符
     * @return 写入过程中产生的诊断，成功时为空
     */
    List<Diagnostic> write(String text, String separator);
}
