package com.whiteboard.ot.model;

import com.whiteboard.ot.clock.VectorClock;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 白板编辑操作（不可变）
 *
 * type 保留原始字符串：未知类型需要原样透传，不能在反序列化阶段丢失。
 * timestamp 只作参考（时间冲突判定），因果顺序以 vectorClock / lamportTimestamp 为准。
 */
@Value
@Builder(toBuilder = true)
public class Operation {

    /** data 中嵌套操作的键（batch） */
    public static final String NESTED_OPERATIONS_KEY = "operations";

    String id;
    String type;
    String elementId;
    String elementType;

    @Builder.Default
    Map<String, Object> data = Map.of();

    Position position;
    Bounds bounds;

    @Builder.Default
    Map<String, Object> style = Map.of();

    Double rotation;
    Integer zIndex;

    /** compound 操作引用的已有操作 id */
    @Builder.Default
    List<String> parentOperations = List.of();

    Instant timestamp;
    long version;
    String userId;
    VectorClock vectorClock;
    long lamportTimestamp;

    @Builder.Default
    OperationMetadata metadata = OperationMetadata.empty();

    public Optional<OperationType> operationType() {
        return OperationType.fromValue(type);
    }

    public boolean isOfType(OperationType operationType) {
        return operationType.value().equals(type);
    }

    public boolean isComposite() {
        return operationType().map(OperationType::isComposite).orElse(false);
    }

    public boolean hasGeometry() {
        return position != null || bounds != null;
    }

    /**
     * 操作覆盖的画布区域；只有 position 时退化为点，没有几何信息时返回 null
     */
    public Bounds region() {
        if (bounds != null) {
            return bounds;
        }
        return position != null ? Bounds.point(position) : null;
    }

    public Map<String, Object> dataOrEmpty() {
        return data != null ? data : Map.of();
    }

    public Map<String, Object> styleOrEmpty() {
        return style != null ? style : Map.of();
    }

    /**
     * batch 的嵌套操作（data.operations 中的 Operation 实例）
     */
    public List<Operation> nestedOperations() {
        Object nested = dataOrEmpty().get(NESTED_OPERATIONS_KEY);
        if (!(nested instanceof List<?> list)) {
            return List.of();
        }
        return list.stream()
            .filter(Operation.class::isInstance)
            .map(Operation.class::cast)
            .toList();
    }
}
