package org.mathpy.codegen;

import org.mathpy.diagnostics.Diagnostic;
import org.mathpy.diagnostics.DiagnosticKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 一个翻译单元 (一条表达式或一个函数定义) 内的标识符表。
 * 记录 "规范化名 -> 原始名"，发现两个不同原始名撞到同一个规范化名时产生 IDENTIFIER_COLLISION 诊断。
 * 非线程安全，每次翻译新建一个。
 */
public final class IdentifierScope {

    private static final Logger logger = LoggerFactory.getLogger(IdentifierScope.class);

    private final IdentifierNormalizer normalizer;
    private final Map<String, String> rawByNormalized = new HashMap<>();
    private final List<Diagnostic> collisions = new ArrayList<>();

    public IdentifierScope(IdentifierNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public String resolve(String rawName) {
        String normalized = normalizer.normalize(rawName);
        String previous = rawByNormalized.putIfAbsent(normalized, rawName);
        if (previous != null && !previous.equals(rawName)) {
            logger.warn("标识符冲突: '{}' 与 '{}' 都规范化为 '{}'", previous, rawName, normalized);
            Diagnostic collision = Diagnostic.of(DiagnosticKind.IDENTIFIER_COLLISION,
                    "'" + previous + "' and '" + rawName + "' both normalize to '" + normalized + "'",
                    previous, rawName, normalized);
            if (!collisions.contains(collision)) {
                collisions.add(collision);
            }
        }
        return normalized;
    }

    public List<Diagnostic> getCollisions() {
        return List.copyOf(collisions);
    }
}
