package com.whiteboard.ot.model;

import com.whiteboard.ot.clock.VectorClock;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * 元素最新快照，只反映已完成转换与冲突解决的操作
 */
@Value
@Builder(toBuilder = true)
public class ElementState {

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

    /** 删除后保留墓碑 */
    boolean deleted;

    long version;
    String lastOperationId;
    String lastUserId;
    Instant lastTimestamp;

    @Builder.Default
    VectorClock vectorClock = VectorClock.empty();
}
