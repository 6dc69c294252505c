package org.mathpy.codegen;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 把宿主符号名规范化为目标语言的小写 ASCII 标识符。
 * <ul>
 *     <li>字形名编码 \[Name] 一律变为 name 的小写形式，对任意名字成立，不依赖希腊字母表；</li>
 *     <li>直接出现的非 ASCII 字母按 Unicode 名称命名，例如 α -> alpha，Α -> capitalalpha；</li>
 *     <li>去掉上下文前缀 (Global`x -> x) 与其他非法字符；</li>
 *     <li>与目标语言关键字重名时追加下划线 (lambda -> lambda_)。</li>
 * </ul>
 * 此类是不可变的，可以跨线程共享。
 */
public final class IdentifierNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(IdentifierNormalizer.class);

    private static final Pattern GLYPH_NAME = Pattern.compile("\\\\\\[([^\\]]+)]");
    private static final Pattern ILLEGAL = Pattern.compile("[^A-Za-z0-9_]");

    private final Set<String> reservedWords;

    public IdentifierNormalizer(Set<String> reservedWords) {
        this.reservedWords = Set.copyOf(Objects.requireNonNull(reservedWords, "Reserved words cannot be null"));
    }

    public String normalize(String rawName) {
        Objects.requireNonNull(rawName, "Raw name cannot be null");
        String name = rawName.contains("`") ? StringUtils.substringAfterLast(rawName, "`") : rawName;

        Matcher matcher = GLYPH_NAME.matcher(name);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(sb, Matcher.quoteReplacement(matcher.group(1).toLowerCase(Locale.ROOT)));
        }
        matcher.appendTail(sb);

        String result = ILLEGAL.matcher(nameNonAsciiLetters(sb.toString())).replaceAll("");
        if (result.isEmpty()) {
            logger.warn("符号名 '{}' 规范化后为空，使用 '_'", rawName);
            result = "_";
        }
        if (Character.isDigit(result.charAt(0))) {
            result = "_" + result;
        }
        if (reservedWords.contains(result)) {
            result = result + "_";
        }
        logger.debug("规范化标识符: {} -> {}", rawName, result);
        return result;
    }

    public Set<String> getReservedWords() {
        return reservedWords;
    }

    // α -> alpha；不是字母的非 ASCII 字符原样留给 ILLEGAL 去掉
    private static String nameNonAsciiLetters(String name) {
        if (StringUtils.isAsciiPrintable(name)) {
            return name;
        }
        StringBuilder sb = new StringBuilder();
        name.codePoints().forEach(cp -> {
            if (cp < 128 || !Character.isLetter(cp)) {
                sb.appendCodePoint(cp);
                return;
            }
            String unicodeName = Character.getName(cp);
            if (unicodeName == null || !unicodeName.contains("LETTER ")) {
                sb.appendCodePoint(cp);
                return;
            }
            String letter = StringUtils.substringAfter(unicodeName, "LETTER ").replace(" ", "").toLowerCase(Locale.ROOT);
            sb.append(unicodeName.contains("CAPITAL") ? "capital" + letter : letter);
        });
        return sb.toString();
    }
}
