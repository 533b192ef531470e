package com.whiteboard.ot.model;

import com.whiteboard.ot.clock.VectorClock;

import java.util.List;
import java.util.Map;

/**
 * 创建转换上下文所需的最小画布状态（通常来自持久化层的检查点）
 */
public record CanvasSnapshot(
    String canvasId,
    long canvasVersion,
    List<Operation> pendingOperations,
    Map<String, ElementState> elementStates,
    VectorClock currentVectorClock,
    long lamportClock
) {

    public CanvasSnapshot {
        pendingOperations = pendingOperations != null ? List.copyOf(pendingOperations) : List.of();
        elementStates = elementStates != null ? Map.copyOf(elementStates) : Map.of();
        currentVectorClock = currentVectorClock != null ? currentVectorClock : VectorClock.empty();
    }

    public static CanvasSnapshot empty(String canvasId) {
        return new CanvasSnapshot(canvasId, 0, List.of(), Map.of(), VectorClock.empty(), 0);
    }
}
