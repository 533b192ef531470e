package com.whiteboard.ot.resolve;

import com.whiteboard.ot.model.ConflictInfo;
import com.whiteboard.ot.model.Operation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 字段级合并
 *
 * 按 (Lamport, userId) 升序依次覆盖 data / style 的键，
 * 几何字段取最后一个写入者的值。结果沿用第一个操作（触发检测的新操作）的身份，
 * 时钟为所有操作的合并，Lamport 取最大值。
 */
public class MergeStrategy extends AbstractResolutionStrategy {

    @Override
    public String name() {
        return ResolutionStrategy.MERGE.value();
    }

    @Override
    protected Optional<Operation> doResolve(ConflictInfo conflict, List<Operation> operations,
                                            Map<String, Integer> userPriorities) {
        Operation identity = operations.get(0);
        List<Operation> ordered = new ArrayList<>(operations);
        ordered.sort(CAUSAL_ORDER);

        Map<String, Object> data = new LinkedHashMap<>();
        Map<String, Object> style = new LinkedHashMap<>();
        Operation.OperationBuilder merged = identity.toBuilder();
        var clock = identity.getVectorClock();
        long lamport = identity.getLamportTimestamp();

        for (Operation op : ordered) {
            data.putAll(op.dataOrEmpty());
            style.putAll(op.styleOrEmpty());
            if (op.getPosition() != null) merged.position(op.getPosition());
            if (op.getBounds() != null) merged.bounds(op.getBounds());
            if (op.getRotation() != null) merged.rotation(op.getRotation());
            if (op.getZIndex() != null) merged.zIndex(op.getZIndex());
            clock = clock.merge(op.getVectorClock());
            lamport = Math.max(lamport, op.getLamportTimestamp());
        }

        return Optional.of(merged
            .data(Collections.unmodifiableMap(data))
            .style(Collections.unmodifiableMap(style))
            .vectorClock(clock)
            .lamportTimestamp(lamport)
            .build());
    }
}
