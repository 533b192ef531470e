package com.whiteboard.ot.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * 冲突描述
 *
 * operations[0] 为触发检测的新操作，其余为与之并发的已有操作。
 * 构造时不校验非空，由解决策略在聚合前显式检查。
 */
@Value
@Builder(toBuilder = true)
public class ConflictInfo {

    String id;
    ConflictType type;
    ConflictSeverity severity;

    @Builder.Default
    List<Operation> operations = List.of();

    Instant detectedAt;

    @Builder.Default
    Set<String> affectedElements = Set.of();

    /** 计数不同的时钟条目数 */
    int vectorClockDivergence;

    /** 检测时同一元素上的并发操作数 */
    int concurrentOperationCount;

    SpatialOverlap spatialOverlap;
    TemporalProximity temporalProximity;
    SemanticConflict semanticConflict;

    public static String conflictId(ConflictType type, Operation incoming, Operation other) {
        return type.value() + "_" + incoming.getId() + "_" + other.getId();
    }

    public boolean involves(String operationId) {
        return operations.stream().anyMatch(op -> op.getId().equals(operationId));
    }
}
