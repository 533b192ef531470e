package com.whiteboard.ot.model;

/**
 * 冲突类型
 */
public enum ConflictType {
    SPATIAL("spatial"),
    TEMPORAL("temporal"),
    SEMANTIC("semantic"),
    CONCURRENT_MODIFICATION("concurrent_modification");

    private final String value;

    ConflictType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
