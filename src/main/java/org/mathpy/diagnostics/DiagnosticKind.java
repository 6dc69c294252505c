package org.mathpy.diagnostics;

/**
 * 诊断的种类。fatal 的诊断意味着没有产出结果。
 */
public enum DiagnosticKind {
    /** 符号没有任何已存储的定义 */
    NO_DEFINITION_FOUND(true),
    /** 根式合并因底数符号未知而放弃 */
    UNKNOWN_SIGNS(false),
    /** 与 UNKNOWN_SIGNS 配套：建议追加的假设 */
    SUGGESTED_ASSUMPTIONS(false),
    /** 负底数留下奇数个虚数单位，严格模式下放弃合并 */
    IMAGINARY_RESIDUAL(false),
    /** 函数名没有目标语言映射，原样输出 */
    UNMAPPED_FUNCTION(false),
    /** 规范化后参数名重复 */
    AMBIGUOUS_SIGNATURE(true),
    /** 两个不同的原始名规范化成同一个标识符 */
    IDENTIFIER_COLLISION(false),
    /** 输出文件写入失败 */
    WRITE_FAILURE(false);

    private final boolean fatal;

    DiagnosticKind(boolean fatal) {
        this.fatal = fatal;
    }

    public boolean isFatal() {
        return fatal;
    }
}
