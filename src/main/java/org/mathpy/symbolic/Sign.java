package org.mathpy.symbolic;

/**
 * 符号判定的结果。
 */
public enum Sign {
    POSITIVE,
    NEGATIVE,
    ZERO,
    UNKNOWN;

    public boolean isKnown() {
        return this != UNKNOWN;
    }

    public static Sign ofSignum(int signum) {
        if (signum > 0) {
            return POSITIVE;
        }
        return signum < 0 ? NEGATIVE : ZERO;
    }
}
