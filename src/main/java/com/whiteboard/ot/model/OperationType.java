package com.whiteboard.ot.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 白板操作类型
 *
 * 线上值为小写字符串（create / update / ...），未知值不会映射到枚举，
 * 由调用方按前向兼容策略原样透传。
 */
public enum OperationType {

    CREATE("create", Category.LIFECYCLE),
    UPDATE("update", Category.CONTENT),
    DELETE("delete", Category.LIFECYCLE),
    MOVE("move", Category.GEOMETRY),
    RESIZE("resize", Category.GEOMETRY),
    ROTATE("rotate", Category.GEOMETRY),
    STYLE("style", Category.APPEARANCE),
    REORDER("reorder", Category.APPEARANCE),
    GROUP("group", Category.STRUCTURE),
    UNGROUP("ungroup", Category.STRUCTURE),
    COMPOUND("compound", Category.COMPOSITE),
    BATCH("batch", Category.COMPOSITE);

    private static final Map<String, OperationType> BY_VALUE = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(OperationType::value, Function.identity()));

    private final String value;
    private final Category category;

    OperationType(String value, Category category) {
        this.value = value;
        this.category = category;
    }

    public String value() {
        return value;
    }

    public Category category() {
        return category;
    }

    public boolean isComposite() {
        return category == Category.COMPOSITE;
    }

    public static Optional<OperationType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_VALUE.get(value));
    }

    /**
     * 操作的结构类别，用于语义冲突判定
     */
    public enum Category {
        LIFECYCLE,
        CONTENT,
        GEOMETRY,
        APPEARANCE,
        STRUCTURE,
        COMPOSITE
    }
}
