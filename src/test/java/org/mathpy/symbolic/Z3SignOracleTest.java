package org.mathpy.symbolic;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.mathpy.core.Symbol;
import org.mathpy.diagnostics.DiagnosticKind;
import org.mathpy.diagnostics.Result;
import org.mathpy.expressions.*;
import org.mathpy.expressions.assumptions.Assumption;
import org.mathpy.expressions.assumptions.AssumptionSet;
import org.mathpy.rewrite.RadicalCombiner;
import org.mathpy.utils.Rational;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class Z3SignOracleTest {

    private Z3SignOracle oracle;

    private final Symbol a = Symbol.of("a");
    private final Symbol b = Symbol.of("b");
    private final Symbol x = Symbol.of("x");
    private final Symbol y = Symbol.of("y");

    @BeforeAll
    void setUp() {
        oracle = new Z3SignOracle();
    }

    @AfterAll
    void tearDown() {
        oracle.close();
    }

    @Nested
    @DisplayName("符号判定 (Sign Queries)")
    class SignQueryTests {

        @Test
        @DisplayName("直接由假设得出的符号")
        void testSignFromAssumptions() {
            AssumptionSet assumptions = AssumptionSet.of(Assumption.positive(x), Assumption.negative(a));
            assertAll(
                    () -> assertEquals(Sign.POSITIVE, oracle.signOf(x, assumptions)),
                    () -> assertEquals(Sign.NEGATIVE, oracle.signOf(a, assumptions)),
                    () -> assertEquals(Sign.UNKNOWN, oracle.signOf(y, assumptions))
            );
        }

        @Test
        @DisplayName("由假设推出复合表达式的符号")
        void testDerivedSigns() {
            AssumptionSet assumptions = AssumptionSet.of(Assumption.positive(x), Assumption.positive(y), Assumption.negative(a));
            assertAll(
                    () -> assertEquals(Sign.POSITIVE, oracle.signOf(Mul.of(x, y), assumptions)),
                    () -> assertEquals(Sign.NEGATIVE, oracle.signOf(Mul.of(a, x), assumptions)),
                    () -> assertEquals(Sign.POSITIVE, oracle.signOf(Add.of(x, Negate.of(a)), assumptions)),
                    () -> assertEquals(Sign.POSITIVE, oracle.signOf(Pow.of(a, 2), assumptions)),
                    () -> assertEquals(Sign.UNKNOWN, oracle.signOf(Add.of(x, a), assumptions))
            );
        }

        @Test
        @DisplayName("关系假设: x > y 且 y > 0 推出 x - y > 0")
        void testRelationalAssumption() {
            AssumptionSet assumptions = AssumptionSet.of(
                    Assumption.of(x, RelationType.GT, y), Assumption.positive(y));
            assertEquals(Sign.POSITIVE, oracle.signOf(Add.of(x, Negate.of(y)), assumptions));
            assertEquals(Sign.POSITIVE, oracle.signOf(x, assumptions));
        }

        @Test
        @DisplayName("无需假设即可确定的符号: 常量、Exp、平方和")
        void testKnownFacts() {
            assertAll(
                    () -> assertEquals(Sign.POSITIVE, oracle.signOf(Symbol.of("Pi"), AssumptionSet.NONE)),
                    () -> assertEquals(Sign.POSITIVE, oracle.signOf(Symbol.of("E"), AssumptionSet.NONE)),
                    () -> assertEquals(Sign.POSITIVE, oracle.signOf(Call.of("Exp", y), AssumptionSet.NONE)),
                    () -> assertEquals(Sign.POSITIVE, oracle.signOf(Add.of(Pow.of(y, 2), NumberLiteral.ONE), AssumptionSet.NONE)),
                    () -> assertEquals(Sign.NEGATIVE, oracle.signOf(NumberLiteral.of(-3), AssumptionSet.NONE)),
                    () -> assertEquals(Sign.ZERO, oracle.signOf(Add.of(y, Negate.of(y)), AssumptionSet.NONE))
            );
        }

        @Test
        @DisplayName("根式与绝对值的已知事实")
        void testRadicalFacts() {
            AssumptionSet assumptions = AssumptionSet.of(Assumption.positive(x));
            assertAll(
                    () -> assertEquals(Sign.POSITIVE, oracle.signOf(Pow.sqrt(x), assumptions)),
                    () -> assertEquals(Sign.POSITIVE, oracle.signOf(Call.of("Sqrt", x), assumptions)),
                    () -> assertEquals(Sign.POSITIVE, oracle.signOf(Call.of("Abs", x), assumptions)),
                    () -> assertEquals(Sign.UNKNOWN, oracle.signOf(Call.of("Sin", x), assumptions))
            );
        }

        @Test
        @DisplayName("矛盾的假设返回 UNKNOWN 而不是抛异常")
        void testContradictoryAssumptions() {
            AssumptionSet contradictory = AssumptionSet.of(Assumption.positive(x), Assumption.negative(x));
            assertEquals(Sign.UNKNOWN, oracle.signOf(x, contradictory));
        }

        @Test
        @DisplayName("无法翻译的表达式返回 UNKNOWN")
        void testUntranslatableExpression() {
            assertEquals(Sign.UNKNOWN, oracle.signOf(ListExpression.of(x, y), AssumptionSet.NONE));
        }

        @Test
        @DisplayName("分子超出 int 范围的半整数次幂: 正底数的幂仍为正，不抛异常")
        void testHugeHalfPower() {
            Rational huge = Rational.valueOf(BigInteger.TWO.pow(40).add(BigInteger.ONE), BigInteger.TWO);
            AssumptionSet assumptions = AssumptionSet.of(Assumption.positive(x));
            assertEquals(Sign.POSITIVE, assertDoesNotThrow(() -> oracle.signOf(Pow.of(x, huge), assumptions)));
        }

        @Test
        @DisplayName("相同输入的判定结果相同")
        void testDeterminism() {
            AssumptionSet assumptions = AssumptionSet.of(Assumption.positive(x));
            Expression expression = Mul.of(x, Call.of("Exp", y));
            assertEquals(oracle.signOf(expression, assumptions), oracle.signOf(expression, assumptions));
        }
    }

    @Nested
    @DisplayName("与根式合并集成 (Radical Combination with Z3)")
    class CombinerIntegrationTests {

        @Test
        @DisplayName("a < 0 且 b < 0: Sqrt[a]*Sqrt[b] => -Sqrt[a*b]")
        void testNegativePair() {
            RadicalCombiner combiner = new RadicalCombiner(oracle);
            AssumptionSet assumptions = AssumptionSet.of(Assumption.negative(a), Assumption.negative(b));

            Result<Expression> result = combiner.combine(Mul.of(Pow.sqrt(a), Pow.sqrt(b)), assumptions);

            assertEquals(Negate.of(Pow.sqrt(Mul.of(a, b))), result.getValue());
        }

        @Test
        @DisplayName("只假设 x > 0: 保留原式并建议 y > 0")
        void testPartialAssumptions() {
            RadicalCombiner combiner = new RadicalCombiner(oracle);
            Expression input = Mul.of(Pow.sqrt(x), Pow.sqrt(y));

            Result<Expression> result = combiner.combine(input, AssumptionSet.of(Assumption.positive(x)));

            assertAll(
                    () -> assertEquals(input, result.getValue()),
                    () -> assertEquals(List.of("y"), result.getDiagnostics(DiagnosticKind.UNKNOWN_SIGNS).get(0).getPayload()),
                    () -> assertEquals(List.of("y > 0"), result.getDiagnostics(DiagnosticKind.SUGGESTED_ASSUMPTIONS).get(0).getPayload())
            );
        }

        @Test
        @DisplayName("底数是复合表达式: Sqrt[x + 1]*Sqrt[Exp[y]] 在 x > 0 下合并")
        void testCompoundBases() {
            RadicalCombiner combiner = new RadicalCombiner(oracle);
            Expression shifted = Add.of(x, NumberLiteral.ONE);
            Expression exp = Call.of("Exp", y);

            Result<Expression> result = combiner.combine(Mul.of(Pow.sqrt(shifted), Pow.sqrt(exp)),
                    AssumptionSet.of(Assumption.positive(x)));

            assertEquals(Pow.sqrt(Mul.of(shifted, exp)), result.getValue());
        }
    }
}
