package com.whiteboard.ot.model;

import java.util.List;

/**
 * 语义冲突明细
 *
 * @param incompatibleChanges 不兼容的变更描述，例如 "delete vs move"
 * @param dataConflicts       双方都写入且取值不同的字段
 */
public record SemanticConflict(List<String> incompatibleChanges, List<String> dataConflicts) {

    public SemanticConflict {
        incompatibleChanges = List.copyOf(incompatibleChanges);
        dataConflicts = List.copyOf(dataConflicts);
    }
}
