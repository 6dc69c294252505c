package org.mathpy.rewrite;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mathpy.core.Symbol;
import org.mathpy.core.SymbolValuation;
import org.mathpy.diagnostics.Diagnostic;
import org.mathpy.diagnostics.DiagnosticKind;
import org.mathpy.diagnostics.Result;
import org.mathpy.expressions.*;
import org.mathpy.expressions.assumptions.Assumption;
import org.mathpy.expressions.assumptions.AssumptionSet;
import org.mathpy.symbolic.Sign;
import org.mathpy.symbolic.SignOracle;
import org.mathpy.utils.Rational;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RadicalCombinerTest {

    private static final Symbol a = Symbol.of("a");
    private static final Symbol b = Symbol.of("b");
    private static final Symbol c = Symbol.of("c");
    private static final Symbol d = Symbol.of("d");
    private static final Symbol x = Symbol.of("x");
    private static final Symbol y = Symbol.of("y");

    private static final SignOracle NEVER_CALLED = (expression, assumptions) -> {
        throw new AssertionError("syntactic mode must not query signs: " + expression);
    };

    /**
     * 按固定表回答符号，表中没有的为 UNKNOWN。
     */
    private static SignOracle fixedSigns(Map<Expression, Sign> signs) {
        return (expression, assumptions) -> signs.getOrDefault(expression, Sign.UNKNOWN);
    }

    // 非空即可，桩判定器不读取假设内容
    private static final AssumptionSet SOME_ASSUMPTIONS = AssumptionSet.of(Assumption.positive(x));

    private static Pow radical(Expression base, long numerator) {
        return Pow.of(base, Rational.valueOf(numerator, 2));
    }

    @Nested
    @DisplayName("语法模式 (Syntactic Mode)")
    class SyntacticModeTests {

        private final RadicalCombiner combiner = new RadicalCombiner(NEVER_CALLED);

        @Test
        @DisplayName("Sqrt[a]*Sqrt[b] => Sqrt[a*b]，不查询符号")
        void testTwoSquareRoots() {
            Result<Expression> result = combiner.combine(Mul.of(Pow.sqrt(a), Pow.sqrt(b)));

            assertAll(
                    () -> assertEquals(Pow.sqrt(Mul.of(a, b)), result.getValue()),
                    () -> assertTrue(result.getDiagnostics().isEmpty())
            );
        }

        @Test
        @DisplayName("其他因子保留在根号外: c*Sqrt[a]*Sqrt[b] => c*Sqrt[a*b]")
        void testOtherFactorsStayOutside() {
            Expression result = combiner.combine(Mul.of(c, Pow.sqrt(a), Pow.sqrt(b))).getValue();
            assertEquals(Mul.of(c, Pow.sqrt(Mul.of(a, b))), result);
        }

        @Test
        @DisplayName("负半整数次幂贡献倒数: a^(-1/2)*b^(3/2) => Sqrt[a^-1*b^3]")
        void testNegativeHalfPower() {
            Expression result = combiner.combine(Mul.of(radical(a, -1), radical(b, 3))).getValue();
            assertEquals(Pow.sqrt(Mul.of(Pow.of(a, -1), Pow.of(b, 3))), result);
        }

        @Test
        @DisplayName("Sqrt[x] 形式的调用也参与合并")
        void testSqrtCall() {
            Expression result = combiner.combine(Mul.of(Call.of("Sqrt", a), Pow.sqrt(b))).getValue();
            assertEquals(Pow.sqrt(Mul.of(a, b)), result);
        }

        @Test
        @DisplayName("只有一个根式因子时不改写，返回同一实例")
        void testSingleRadicalIsUntouched() {
            Expression input = Mul.of(c, Pow.sqrt(a), Pow.of(b, 2));
            assertSame(input, combiner.combine(input).getValue());
        }

        @Test
        @DisplayName("不做分配律：Add 的每一项独立改写")
        void testAddTermsRewrittenIndependently() {
            Expression input = Add.of(Mul.of(Pow.sqrt(a), Pow.sqrt(b)), Mul.of(Pow.sqrt(c), Pow.sqrt(d)), x);
            Expression expected = Add.of(Pow.sqrt(Mul.of(a, b)), Pow.sqrt(Mul.of(c, d)), x);
            assertEquals(expected, combiner.combine(input).getValue());
        }

        @Test
        @DisplayName("不动点：改写暴露出的新组合在下一轮被合并")
        void testFixedPointExposesNewGroup() {
            // Sqrt[a]*Sqrt[b]*(Sqrt[c]*d)，第一轮展平后 Sqrt[c] 与 Sqrt[a*b] 同处一个乘积
            Expression input = Mul.of(Pow.sqrt(a), Pow.sqrt(b), Mul.of(Pow.sqrt(c), d));
            Expression result = combiner.combine(input).getValue();
            assertEquals(Mul.of(d, Pow.sqrt(Mul.of(c, a, b))), result);
        }

        @Test
        @DisplayName("根式嵌在函数参数和幂中也会被改写")
        void testNestedInsideCallAndPower() {
            Expression input = Call.of("Sin", Pow.of(Mul.of(Pow.sqrt(a), Pow.sqrt(b)), 2));
            Expression expected = Call.of("Sin", Pow.of(Pow.sqrt(Mul.of(a, b)), 2));
            assertEquals(expected, combiner.combine(input).getValue());
        }

        @Test
        @DisplayName("带负号的根式因子也参与合并: Sqrt[c]*(-Sqrt[a]) => -Sqrt[c*a]")
        void testNegatedRadicalFactor() {
            Expression result = combiner.combine(Mul.of(Pow.sqrt(c), Negate.of(Pow.sqrt(a)))).getValue();
            assertEquals(Negate.of(Pow.sqrt(Mul.of(c, a))), result);
        }

        @Test
        @DisplayName("分子超出 int 范围的半整数次幂不视为根式，原样保留")
        void testHugeHalfPowerIsLeftAlone() {
            Rational huge = Rational.valueOf(BigInteger.TWO.pow(40).add(BigInteger.ONE), BigInteger.TWO);
            Expression input = Mul.of(Pow.of(x, huge), Pow.sqrt(y));

            Result<Expression> result = assertDoesNotThrow(() -> combiner.combine(input));

            assertSame(input, result.getValue());
            assertFalse(Pow.of(x, huge).isRadical());
        }

        @Test
        @DisplayName("幂等: 对结果再次合并不再变化")
        void testIdempotence() {
            Expression input = Add.of(Mul.of(radical(a, 3), Pow.sqrt(b), c), Mul.of(Pow.sqrt(a), Pow.sqrt(b), Mul.of(Pow.sqrt(c), d)));
            Expression once = combiner.combine(input).getValue();
            assertSame(once, combiner.combine(once).getValue());
        }
    }

    @Nested
    @DisplayName("严格模式 (Rigorous Mode)")
    class RigorousModeTests {

        @Test
        @DisplayName("a < 0 且 b < 0: Sqrt[a]*Sqrt[b] => -Sqrt[a*b]")
        void testTwoNegativeBases() {
            RadicalCombiner combiner = new RadicalCombiner(fixedSigns(Map.of(a, Sign.NEGATIVE, b, Sign.NEGATIVE)));
            AssumptionSet assumptions = AssumptionSet.of(Assumption.negative(a), Assumption.negative(b));

            Result<Expression> result = combiner.combine(Mul.of(Pow.sqrt(a), Pow.sqrt(b)), assumptions);

            assertAll(
                    () -> assertEquals(Negate.of(Pow.sqrt(Mul.of(a, b))), result.getValue()),
                    () -> assertTrue(result.getDiagnostics().isEmpty())
            );
        }

        @Test
        @DisplayName("a > 0 且 b > 0: a^(3/2)*Sqrt[b] => Sqrt[a^3*b]")
        void testPositiveBasesWithHigherPower() {
            RadicalCombiner combiner = new RadicalCombiner(fixedSigns(Map.of(a, Sign.POSITIVE, b, Sign.POSITIVE)));

            Expression result = combiner.combine(Mul.of(radical(a, 3), Pow.sqrt(b)), SOME_ASSUMPTIONS).getValue();

            assertEquals(Pow.sqrt(Mul.of(Pow.of(a, 3), b)), result);
        }

        @Test
        @DisplayName("只假设 x > 0: 不改写，报告 y 并建议 y > 0")
        void testUnknownSignDeclines() {
            RadicalCombiner combiner = new RadicalCombiner(fixedSigns(Map.of(x, Sign.POSITIVE)));
            Expression input = Mul.of(Pow.sqrt(x), Pow.sqrt(y));

            Result<Expression> result = combiner.combine(input, AssumptionSet.of(Assumption.positive(x)));

            List<Diagnostic> unknown = result.getDiagnostics(DiagnosticKind.UNKNOWN_SIGNS);
            List<Diagnostic> suggested = result.getDiagnostics(DiagnosticKind.SUGGESTED_ASSUMPTIONS);
            assertAll(
                    () -> assertSame(input, result.getValue(), "node must be left untouched"),
                    () -> assertEquals(1, unknown.size()),
                    () -> assertEquals(List.of("y"), unknown.get(0).getPayload()),
                    () -> assertEquals(1, suggested.size()),
                    () -> assertEquals(List.of("y > 0"), suggested.get(0).getPayload()),
                    () -> assertFalse(result.getDiagnostics().stream().anyMatch(Diagnostic::isFatal))
            );
        }

        @Test
        @DisplayName("部分未知: 只有未知的节点保持原样，诊断只出现一次")
        void testSafetyUnderPartialAssumptions() {
            RadicalCombiner combiner = new RadicalCombiner(fixedSigns(
                    Map.of(x, Sign.POSITIVE, a, Sign.POSITIVE, b, Sign.POSITIVE)));
            Mul unknownNode = Mul.of(Pow.sqrt(x), Pow.sqrt(y));
            Expression input = Add.of(unknownNode, Mul.of(Pow.sqrt(a), Pow.sqrt(b)));

            Result<Expression> result = combiner.combine(input, SOME_ASSUMPTIONS);

            Add output = (Add) result.getValue();
            assertAll(
                    () -> assertEquals(unknownNode, output.getTerms().get(0)),
                    () -> assertEquals(Pow.sqrt(Mul.of(a, b)), output.getTerms().get(1)),
                    () -> assertEquals(1, result.getDiagnostics(DiagnosticKind.UNKNOWN_SIGNS).size()),
                    () -> assertEquals(List.of("y"), result.getDiagnostics(DiagnosticKind.UNKNOWN_SIGNS).get(0).getPayload())
            );
        }

        @Test
        @DisplayName("多于五个未知底数时全部列在诊断中")
        void testManyUnknowns() {
            RadicalCombiner combiner = new RadicalCombiner(fixedSigns(Map.of()));
            List<Expression> factors = new ArrayList<>();
            List<String> names = new ArrayList<>();
            for (int i = 1; i <= 7; i++) {
                factors.add(Pow.sqrt(Symbol.of("u" + i)));
                names.add("u" + i);
            }

            Result<Expression> result = combiner.combine(Mul.of(factors), SOME_ASSUMPTIONS);

            assertEquals(names, result.getDiagnostics(DiagnosticKind.UNKNOWN_SIGNS).get(0).getPayload());
        }

        @Test
        @DisplayName("嵌套乘积: 内层合并出的 -Sqrt[a*b] 继续与外层的 Sqrt[c] 合并")
        void testNestedNegatedResultCombinesWithSibling() {
            Expression ab = Mul.of(a, b);
            RadicalCombiner combiner = new RadicalCombiner(fixedSigns(Map.of(
                    a, Sign.NEGATIVE, b, Sign.NEGATIVE, c, Sign.POSITIVE, ab, Sign.POSITIVE)));
            Expression input = Mul.of(Pow.sqrt(c), Mul.of(Pow.sqrt(a), Pow.sqrt(b)));

            Result<Expression> result = combiner.combine(input, SOME_ASSUMPTIONS);

            Expression expected = Negate.of(Pow.sqrt(Mul.product(List.of(c, ab))));
            SymbolValuation point = SymbolValuation.of(Map.of(
                    a, Rational.valueOf("-1.5"), b, Rational.valueOf("-2.5"), c, Rational.valueOf("0.5")));
            assertAll(
                    () -> assertEquals(expected, result.getValue()),
                    () -> assertTrue(result.getDiagnostics().isEmpty()),
                    () -> assertTrue(ComplexEvaluator.evaluate(input, point)
                            .isCloseTo(ComplexEvaluator.evaluate(result.getValue(), point), 1e-9))
            );
        }

        @Test
        @DisplayName("底数为零视为非负")
        void testZeroBase() {
            RadicalCombiner combiner = new RadicalCombiner(fixedSigns(Map.of(a, Sign.ZERO, b, Sign.NEGATIVE, c, Sign.NEGATIVE)));
            Expression result = combiner.combine(Mul.of(Pow.sqrt(a), Pow.sqrt(b), Pow.sqrt(c)), SOME_ASSUMPTIONS).getValue();
            assertEquals(Negate.of(Pow.sqrt(Mul.of(a, b, c))), result);
        }

        @Test
        @DisplayName("符号查询按底数缓存")
        void testSignQueriesAreCached() {
            Map<Expression, Integer> calls = new HashMap<>();
            SignOracle counting = (expression, assumptions) -> {
                calls.merge(expression, 1, Integer::sum);
                return Sign.UNKNOWN;
            };
            new RadicalCombiner(counting).combine(
                    Add.of(Mul.of(Pow.sqrt(x), Pow.sqrt(y)), Mul.of(Pow.sqrt(x), Pow.sqrt(y), c)), SOME_ASSUMPTIONS);
            assertEquals(Map.of(x, 1, y, 1), calls);
        }
    }

    @Nested
    @DisplayName("符号规则 (Sign Policies)")
    class SignPolicyTests {

        private final Map<Expression, Sign> aNegativeBPositive = Map.of(a, Sign.NEGATIVE, b, Sign.POSITIVE);

        @Test
        @DisplayName("STRICT: 一个负底数留下虚数单位，放弃合并")
        void testStrictDeclinesOddResidual() {
            RadicalCombiner combiner = new RadicalCombiner(fixedSigns(aNegativeBPositive), SignPolicy.STRICT);
            Expression input = Mul.of(Pow.sqrt(a), Pow.sqrt(b));

            Result<Expression> result = combiner.combine(input, SOME_ASSUMPTIONS);

            assertAll(
                    () -> assertSame(input, result.getValue()),
                    () -> assertTrue(result.hasDiagnostic(DiagnosticKind.IMAGINARY_RESIDUAL)),
                    () -> assertFalse(result.hasDiagnostic(DiagnosticKind.UNKNOWN_SIGNS))
            );
        }

        @Test
        @DisplayName("PAIRED_BASES: 复现按个数配对的规则，奇数个负底数时丢弃虚数单位")
        void testPairedBasesDropsResidual() {
            RadicalCombiner combiner = new RadicalCombiner(fixedSigns(aNegativeBPositive), SignPolicy.PAIRED_BASES);
            Result<Expression> result = combiner.combine(Mul.of(Pow.sqrt(a), Pow.sqrt(b)), SOME_ASSUMPTIONS);

            assertEquals(Pow.sqrt(Mul.of(a, b)), result.getValue());
            assertTrue(result.getDiagnostics().isEmpty());
        }

        @Test
        @DisplayName("a < 0, b < 0: a^(3/2)*Sqrt[b]，两种规则给出不同符号")
        void testPoliciesDifferOnHigherPowers() {
            SignOracle oracle = fixedSigns(Map.of(a, Sign.NEGATIVE, b, Sign.NEGATIVE));
            Expression input = Mul.of(radical(a, 3), Pow.sqrt(b));
            Expression combined = Pow.sqrt(Mul.of(Pow.of(a, 3), b));

            assertEquals(combined, new RadicalCombiner(oracle, SignPolicy.STRICT).combine(input, SOME_ASSUMPTIONS).getValue());
            assertEquals(Negate.of(combined),
                    new RadicalCombiner(oracle, SignPolicy.PAIRED_BASES).combine(input, SOME_ASSUMPTIONS).getValue());
        }
    }

    @Nested
    @DisplayName("数值正确性 (Soundness)")
    class SoundnessTests {

        @Test
        @DisplayName("STRICT 的改写在满足假设的点上与原式数值相等 (复数主值)")
        void testStrictRewritesAreNumericallyEqual() {
            List<Map<Expression, Sign>> signCases = List.of(
                    Map.of(a, Sign.POSITIVE, b, Sign.POSITIVE, c, Sign.POSITIVE),
                    Map.of(a, Sign.NEGATIVE, b, Sign.NEGATIVE, c, Sign.POSITIVE),
                    Map.of(a, Sign.NEGATIVE, b, Sign.POSITIVE, c, Sign.NEGATIVE),
                    Map.of(a, Sign.NEGATIVE, b, Sign.NEGATIVE, c, Sign.NEGATIVE));
            List<Expression> inputs = List.of(
                    Mul.of(Pow.sqrt(a), Pow.sqrt(b)),
                    Mul.of(radical(a, 3), Pow.sqrt(b)),
                    Mul.of(radical(a, -1), radical(b, 3), c),
                    Mul.of(Pow.sqrt(a), Pow.sqrt(b), Pow.sqrt(c)),
                    Mul.of(radical(a, 5), radical(b, -3), radical(c, 1)),
                    Add.of(Mul.of(Pow.sqrt(a), Pow.sqrt(c)), Mul.of(radical(b, 3), radical(c, 3))));

            for (Map<Expression, Sign> signs : signCases) {
                RadicalCombiner combiner = new RadicalCombiner(fixedSigns(signs), SignPolicy.STRICT);
                for (Expression input : inputs) {
                    Expression output = combiner.combine(input, SOME_ASSUMPTIONS).getValue();
                    for (double magnitude : new double[]{0.5, 1.7, 3.25}) {
                        SymbolValuation point = pointFor(signs, magnitude);
                        ComplexEvaluator.Complex expected = ComplexEvaluator.evaluate(input, point);
                        ComplexEvaluator.Complex actual = ComplexEvaluator.evaluate(output, point);
                        assertTrue(expected.isCloseTo(actual, 1e-9),
                                () -> input + " -> " + output + " at " + point + ": " + expected + " vs " + actual);
                    }
                }
            }
        }

        private SymbolValuation pointFor(Map<Expression, Sign> signs, double magnitude) {
            Map<Symbol, Rational> values = new HashMap<>();
            int offset = 0;
            for (Symbol s : List.of(a, b, c)) {
                Rational value = Rational.valueOf(String.valueOf(magnitude + offset++));
                values.put(s, signs.get(s) == Sign.NEGATIVE ? value.negate() : value);
            }
            return SymbolValuation.of(values);
        }
    }
}
