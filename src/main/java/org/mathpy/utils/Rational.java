package org.mathpy.utils;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 精确有理数，只表示有限值。
 * 表达式树中的数字字面量与指数 (例如 n/2) 都用它表示。
 * 此类是不可变的。
 */
public final class Rational implements Comparable<Rational> {
    private static final Logger logger = LoggerFactory.getLogger(Rational.class);
    private static final ConcurrentHashMap<List<BigInteger>, Rational> CACHE = new ConcurrentHashMap<>(256);

    private static final BigInteger BIG_INT_ONE = BigInteger.ONE;
    private static final BigInteger BIG_INT_TWO = BigInteger.valueOf(2);
    private static final BigInteger BIG_INT_TEN = BigInteger.TEN;

    @Getter
    private final BigInteger numerator;
    @Getter
    private final BigInteger denominator;

    private volatile int hash;

    // 常用常量
    public static final Rational ZERO = new Rational(BigInteger.ZERO, BIG_INT_ONE);
    public static final Rational ONE = new Rational(BIG_INT_ONE, BIG_INT_ONE);
    public static final Rational MINUS_ONE = new Rational(BIG_INT_ONE.negate(), BIG_INT_ONE);
    public static final Rational HALF = new Rational(BIG_INT_ONE, BIG_INT_TWO);
    public static final Rational MINUS_HALF = new Rational(BIG_INT_ONE.negate(), BIG_INT_TWO);

    static {
        CACHE.put(ZERO.getCacheKey(), ZERO);
        CACHE.put(ONE.getCacheKey(), ONE);
        CACHE.put(MINUS_ONE.getCacheKey(), MINUS_ONE);
        CACHE.put(HALF.getCacheKey(), HALF);
        CACHE.put(MINUS_HALF.getCacheKey(), MINUS_HALF);
    }

    private Rational(BigInteger numerator, BigInteger denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    // ========== 工厂方法 ==========

    public static Rational valueOf(BigInteger numerator) {
        return valueOf(numerator, BIG_INT_ONE);
    }

    public static Rational valueOf(long numerator) {
        return valueOf(BigInteger.valueOf(numerator), BIG_INT_ONE);
    }

    public static Rational valueOf(long numerator, long denominator) {
        return valueOf(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    public static Rational valueOf(BigInteger numerator, BigInteger denominator) {
        Objects.requireNonNull(numerator, "Numerator cannot be null");
        Objects.requireNonNull(denominator, "Denominator cannot be null");
        if (denominator.signum() == 0) {
            logger.error("尝试创建分母为0的Rational: {} / 0", numerator);
            throw new ArithmeticException("分母不能为0: " + numerator + "/0");
        }
        if (numerator.signum() == 0) {
            return ZERO;
        }
        // 分母总是正数
        if (denominator.signum() < 0) {
            numerator = numerator.negate();
            denominator = denominator.negate();
        }
        BigInteger commonDivisor = numerator.gcd(denominator);
        if (!commonDivisor.equals(BIG_INT_ONE)) {
            numerator = numerator.divide(commonDivisor);
            denominator = denominator.divide(commonDivisor);
        }

        List<BigInteger> key = List.of(numerator, denominator);
        Rational cached = CACHE.get(key);
        if (cached != null) {
            return cached;
        }
        Rational result = new Rational(numerator, denominator);
        if (shouldCache(result)) {
            CACHE.put(key, result);
        }
        return result;
    }

    /**
     * 解析 "3", "-5/2", "2.75" 之类的文本。
     */
    public static Rational valueOf(String s) {
        if (s == null || s.trim().isEmpty()) {
            throw new NumberFormatException("输入非法: 空字符串");
        }
        s = s.trim();
        if (s.contains("/")) {
            String[] parts = s.split("/", 2);
            if (parts[0].isEmpty() || parts[1].isEmpty()) {
                throw new NumberFormatException("无效分数格式: " + s);
            }
            try {
                return valueOf(new BigInteger(parts[0].trim()), new BigInteger(parts[1].trim()));
            } catch (NumberFormatException e) {
                throw new NumberFormatException("分数" + s + "的数字无效: " + e.getMessage());
            }
        }
        try {
            return valueOf(new BigDecimal(s));
        } catch (NumberFormatException e) {
            throw new NumberFormatException("无效数字格式: " + s);
        }
    }

    public static Rational valueOf(BigDecimal bd) {
        int scale = bd.scale();
        if (scale <= 0) {
            return valueOf(bd.unscaledValue().multiply(BIG_INT_TEN.pow(-scale)), BIG_INT_ONE);
        }
        return valueOf(bd.unscaledValue(), BIG_INT_TEN.pow(scale));
    }

    // ========== 基础运算 ==========

    public Rational add(Rational other) {
        if (this.isZero()) {
            return other;
        }
        if (other.isZero()) {
            return this;
        }
        BigInteger newNum = numerator.multiply(other.denominator).add(other.numerator.multiply(denominator));
        return valueOf(newNum, denominator.multiply(other.denominator));
    }

    public Rational subtract(Rational other) {
        return add(other.negate());
    }

    public Rational multiply(Rational other) {
        if (this.isZero() || other.isZero()) {
            return ZERO;
        }
        return valueOf(numerator.multiply(other.numerator), denominator.multiply(other.denominator));
    }

    public Rational divide(Rational other) {
        if (other.isZero()) {
            logger.error("Rational 除以零: {} / 0", this);
            throw new ArithmeticException("除以零: " + this + " / 0");
        }
        return multiply(other.reciprocal());
    }

    public Rational reciprocal() {
        if (isZero()) {
            throw new ArithmeticException("0 没有倒数");
        }
        return valueOf(denominator, numerator);
    }

    public Rational negate() {
        if (isZero()) {
            return ZERO;
        }
        return valueOf(numerator.negate(), denominator);
    }

    public Rational abs() {
        return signum() >= 0 ? this : negate();
    }

    /**
     * 整数次幂，负指数取倒数。
     */
    public Rational pow(int exponent) {
        if (exponent == 0) {
            return ONE;
        }
        if (exponent < 0) {
            return reciprocal().pow(-exponent);
        }
        return valueOf(numerator.pow(exponent), denominator.pow(exponent));
    }

    // ========== 工具方法 ==========

    public boolean isZero() {
        return numerator.signum() == 0;
    }

    public boolean isOne() {
        return numerator.equals(BIG_INT_ONE) && denominator.equals(BIG_INT_ONE);
    }

    public int signum() {
        return numerator.signum();
    }

    /**
     * 判断该rational是否是整数
     */
    public boolean isInteger() {
        return denominator.equals(BIG_INT_ONE);
    }

    /**
     * 是否形如 n/2 且 n 为奇数，即"半整数"。
     * 整数 n/2 (n 为偶数) 会被约分成整数，因此不算。
     */
    public boolean isHalfInteger() {
        return denominator.equals(BIG_INT_TWO);
    }

    /**
     * 对于 n/2 形式的有理数 (包括约分后的整数) 返回 n。
     * @throws ArithmeticException 如果分母既不是 1 也不是 2
     */
    public int halfNumerator() {
        if (isInteger()) {
            return numerator.multiply(BIG_INT_TWO).intValueExact();
        }
        if (isHalfInteger()) {
            return numerator.intValueExact();
        }
        throw new ArithmeticException(this + " 不是 n/2 的形式");
    }

    /**
     * 是否为 n/2 的形式且 n 在 int 范围内。
     */
    public boolean hasIntHalfNumerator() {
        BigInteger n;
        if (isInteger()) {
            n = numerator.multiply(BIG_INT_TWO);
        } else if (isHalfInteger()) {
            n = numerator;
        } else {
            return false;
        }
        return n.bitLength() < Integer.SIZE;
    }

    public int intValueExact() {
        if (!isInteger()) {
            throw new ArithmeticException(this + " 不是整数");
        }
        return numerator.intValueExact();
    }

    public double doubleValue() {
        if (isZero()) {
            return 0.0;
        }
        return new BigDecimal(numerator).divide(new BigDecimal(denominator), MathContext.DECIMAL64).doubleValue();
    }

    /**
     * 十进制文本 (用于非精确字面量)。除不尽时保留 16 位有效数字。
     */
    public String toDecimalString() {
        BigDecimal value = new BigDecimal(numerator).divide(new BigDecimal(denominator), MathContext.DECIMAL64);
        String plain = value.stripTrailingZeros().toPlainString();
        return plain.contains(".") ? plain : plain + ".0";
    }

    public ArithExpr toZ3Real(Context ctx) {
        return ctx.mkReal(this.toString());
    }

    // ========== 对象基础方法 ==========

    @Override
    public int compareTo(Rational other) {
        BigInteger ad = this.numerator.multiply(other.denominator);
        BigInteger cb = other.numerator.multiply(this.denominator);
        return ad.compareTo(cb);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Rational that)) {
            return false;
        }
        return this.numerator.equals(that.numerator) && this.denominator.equals(that.denominator);
    }

    @Override
    public int hashCode() {
        int h = hash;
        if (h == 0) {
            h = Objects.hash(numerator, denominator);
            if (h == 0) {
                h = 1;
            }
            hash = h;
        }
        return h;
    }

    private List<BigInteger> getCacheKey() {
        return List.of(this.numerator, this.denominator);
    }

    private static boolean shouldCache(Rational r) {
        return (r.numerator.abs().bitLength() + r.denominator.bitLength()) < 32;
    }

    @Override
    public String toString() {
        if (isInteger()) {
            return numerator.toString();
        }
        return numerator + "/" + denominator;
    }
}
