package org.mathpy.definitions;

import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * 宿主中一个符号的全部已存储定义，按宿主给出的顺序。可以为空。
 */
@Getter
public final class SymbolDefinitions {

    private final String name;
    private final List<DownValue> downValues;

    private SymbolDefinitions(String name, List<DownValue> downValues) {
        this.name = Objects.requireNonNull(name, "Symbol name cannot be null");
        Objects.requireNonNull(downValues, "DownValues cannot be null");
        this.downValues = List.copyOf(downValues);
    }

    public static SymbolDefinitions of(String name, List<DownValue> downValues) {
        return new SymbolDefinitions(name, downValues);
    }

    public static SymbolDefinitions of(String name, DownValue... downValues) {
        return new SymbolDefinitions(name, Arrays.asList(downValues));
    }

    public boolean isEmpty() {
        return downValues.isEmpty();
    }

    @Override
    public String toString() {
        return name + downValues;
    }
}
