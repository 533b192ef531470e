package com.whiteboard.ot.resolve;

import java.util.Arrays;
import java.util.Optional;

/**
 * 内置解决策略
 */
public enum ResolutionStrategy {
    MERGE("merge"),
    LAST_WRITER_WINS("last-writer-wins"),
    PRIORITY_USER("priority-user"),
    MANUAL("manual");

    private final String value;

    ResolutionStrategy(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<ResolutionStrategy> fromValue(String value) {
        return Arrays.stream(values())
            .filter(s -> s.value.equals(value))
            .findFirst();
    }
}
