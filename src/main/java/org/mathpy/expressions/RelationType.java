package org.mathpy.expressions;

import java.util.Arrays;

public enum RelationType {

    /**
     * 运算符枚举
     */
    LT("<"),    // Less Than
    LE("<="),   // Less Equal
    GT(">"),    // Greater Than
    GE(">="),   // Greater Equal
    EQ("=="),   // Equal
    NE("!=");   // Not Equal

    private final String symbol;

    RelationType(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * 返回此关系类型的否定关系。
     * 例如：LT 的否定是 GE。
     */
    public RelationType negate() {
        return switch (this) {
            case LT -> GE;
            case LE -> GT;
            case GT -> LE;
            case GE -> LT;
            case EQ -> NE;
            case NE -> EQ;
        };
    }

    /**
     * 返回交换两侧操作数后的等价关系。
     * 例如：(A < B) -> (B > A)。
     */
    public RelationType flip() {
        return switch (this) {
            case LT -> GT;
            case LE -> GE;
            case GT -> LT;
            case GE -> LE;
            case EQ -> EQ;
            case NE -> NE;
        };
    }

    /**
     * 按符号查找，例如 ">=" -> GE。
     * @throws IllegalArgumentException 如果符号未知
     */
    public static RelationType fromSymbol(String symbol) {
        return Arrays.stream(values())
                .filter(r -> r.symbol.equals(symbol))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("未知的关系符号: " + symbol));
    }
}
