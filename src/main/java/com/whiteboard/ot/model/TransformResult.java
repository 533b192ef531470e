package com.whiteboard.ot.model;

import java.util.List;

/**
 * transform 结果
 *
 * @param transformedOperation 转换后的操作，id 与输入一致
 * @param conflicts            检测到的冲突
 * @param performance          性能快照
 * @param passThrough          未知类型原样透传
 */
public record TransformResult(
    Operation transformedOperation,
    List<ConflictInfo> conflicts,
    PerformanceSnapshot performance,
    boolean passThrough
) {

    public TransformResult {
        conflicts = List.copyOf(conflicts);
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }
}
