package org.mathpy.codegen;

import lombok.Builder;
import lombok.Getter;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 代码生成的配置：函数名映射、常量映射、根式写法、数组构造、优先级表、保留字。
 * 不可变，显式注入 {@link PythonEmitter}，不存在进程级的全局替换表。
 */
@Getter
public final class EmitterConfig {

    /** 二元 ArcTan[x, y] 在函数表中使用的键 */
    public static final String TWO_ARGUMENT_ARCTAN = "ArcTan2";

    private static final Set<String> PYTHON_KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
            "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
            "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
            "return", "try", "while", "with", "yield");

    private final Map<String, String> functionNames;
    private final Map<String, String> constants;
    /** 为 null 时 x^(1/2) 输出为 x**(1/2) */
    private final String sqrtFunction;
    /** 为 null 时列表输出为裸的 [a, b] */
    private final String arrayConstructor;
    private final Map<Precedence, Integer> precedence;
    private final Set<String> reservedWords;
    private final String indent;

    @Builder(toBuilder = true)
    private EmitterConfig(Map<String, String> functionNames,
                          Map<String, String> constants,
                          String sqrtFunction,
                          String arrayConstructor,
                          Map<Precedence, Integer> precedence,
                          Set<String> reservedWords,
                          String indent) {
        this.functionNames = Map.copyOf(Objects.requireNonNull(functionNames, "functionNames cannot be null"));
        this.constants = Map.copyOf(Objects.requireNonNull(constants, "constants cannot be null"));
        this.sqrtFunction = sqrtFunction;
        this.arrayConstructor = arrayConstructor;
        Map<Precedence, Integer> levels = new EnumMap<>(Precedence.class);
        levels.putAll(pythonPrecedence());
        if (precedence != null) {
            levels.putAll(precedence);
        }
        this.precedence = Map.copyOf(levels);
        this.reservedWords = reservedWords == null ? PYTHON_KEYWORDS : Set.copyOf(reservedWords);
        this.indent = indent == null ? "    " : indent;
    }

    public int level(Precedence p) {
        return precedence.get(p);
    }

    public Optional<String> targetFunction(String hostName) {
        return Optional.ofNullable(functionNames.get(hostName));
    }

    public Optional<String> targetConstant(String hostName) {
        return Optional.ofNullable(constants.get(hostName));
    }

    /**
     * NumPy 目标，np. 前缀，平方根用 np.sqrt。
     */
    public static EmitterConfig numpy() {
        return EmitterConfig.builder()
                .functionNames(Map.ofEntries(
                        Map.entry("Sin", "np.sin"),
                        Map.entry("Cos", "np.cos"),
                        Map.entry("Tan", "np.tan"),
                        Map.entry("ArcSin", "np.arcsin"),
                        Map.entry("ArcCos", "np.arccos"),
                        Map.entry("ArcTan", "np.arctan"),
                        Map.entry(TWO_ARGUMENT_ARCTAN, "np.arctan2"),
                        Map.entry("Sinh", "np.sinh"),
                        Map.entry("Cosh", "np.cosh"),
                        Map.entry("Tanh", "np.tanh"),
                        Map.entry("ArcSinh", "np.arcsinh"),
                        Map.entry("ArcCosh", "np.arccosh"),
                        Map.entry("ArcTanh", "np.arctanh"),
                        Map.entry("Log", "np.log"),
                        Map.entry("Exp", "np.exp"),
                        Map.entry("Abs", "np.abs"),
                        Map.entry("Sign", "np.sign"),
                        Map.entry("Floor", "np.floor"),
                        Map.entry("Ceiling", "np.ceil"),
                        Map.entry("Round", "np.round"),
                        Map.entry("Sqrt", "np.sqrt")))
                .constants(Map.of(
                        "Pi", "np.pi",
                        "E", "np.e",
                        "I", "1j",
                        "Infinity", "np.inf"))
                .sqrtFunction("np.sqrt")
                .arrayConstructor("np.array")
                .reservedWords(withReserved("np"))
                .build();
    }

    /**
     * 只依赖标准库 math 模块的目标，平方根写成分数次幂。
     */
    public static EmitterConfig plainPython() {
        return EmitterConfig.builder()
                .functionNames(Map.ofEntries(
                        Map.entry("Sin", "math.sin"),
                        Map.entry("Cos", "math.cos"),
                        Map.entry("Tan", "math.tan"),
                        Map.entry("ArcSin", "math.asin"),
                        Map.entry("ArcCos", "math.acos"),
                        Map.entry("ArcTan", "math.atan"),
                        Map.entry(TWO_ARGUMENT_ARCTAN, "math.atan2"),
                        Map.entry("Sinh", "math.sinh"),
                        Map.entry("Cosh", "math.cosh"),
                        Map.entry("Tanh", "math.tanh"),
                        Map.entry("Log", "math.log"),
                        Map.entry("Exp", "math.exp"),
                        Map.entry("Abs", "abs"),
                        Map.entry("Floor", "math.floor"),
                        Map.entry("Ceiling", "math.ceil"),
                        Map.entry("Round", "round")))
                .constants(Map.of(
                        "Pi", "math.pi",
                        "E", "math.e",
                        "I", "1j",
                        "Infinity", "math.inf"))
                .reservedWords(withReserved("math"))
                .build();
    }

    private static Set<String> withReserved(String moduleAlias) {
        Set<String> words = new HashSet<>(PYTHON_KEYWORDS);
        words.add(moduleAlias);
        return words;
    }

    // Python: ** 高于一元负号，一元负号高于乘除，乘除高于加减
    private static Map<Precedence, Integer> pythonPrecedence() {
        return Map.of(
                Precedence.ADDITIVE, 10,
                Precedence.MULTIPLICATIVE, 20,
                Precedence.UNARY, 30,
                Precedence.POWER, 40,
                Precedence.ATOM, 100);
    }
}
