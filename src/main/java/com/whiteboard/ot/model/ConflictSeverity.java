package com.whiteboard.ot.model;

/**
 * 冲突严重程度，按声明顺序递增
 */
public enum ConflictSeverity {
    LOW,
    MEDIUM,
    HIGH;

    /**
     * 升一级，HIGH 保持不变
     */
    public ConflictSeverity escalate() {
        return this == LOW ? MEDIUM : HIGH;
    }

    public String value() {
        return name().toLowerCase();
    }
}
