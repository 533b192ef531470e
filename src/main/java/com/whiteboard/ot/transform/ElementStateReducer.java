package com.whiteboard.ot.transform;

import com.whiteboard.ot.clock.VectorClock;
import com.whiteboard.ot.model.ElementState;
import com.whiteboard.ot.model.Operation;
import com.whiteboard.ot.model.OperationType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * 把操作应用到元素快照
 *
 * create 重置元素；delete 合并字段并打墓碑；其余已知类型合并字段
 * （data / style 逐键覆盖，几何字段非空即覆盖），元素不存在时视为首次写入；
 * 未知类型不改变状态；compound / batch 依次应用展开后的组成部分。
 */
public final class ElementStateReducer {

    private ElementStateReducer() {
    }

    public static void apply(Map<String, ElementState> states, Operation op, Function<String, Operation> lookup) {
        if (op.isComposite()) {
            for (Operation part : OperationExpander.expand(op, lookup)) {
                apply(states, part, lookup);
            }
            return;
        }
        Optional<OperationType> type = op.operationType();
        if (type.isEmpty()) {
            return;
        }
        states.put(op.getElementId(), reduce(states.get(op.getElementId()), op, type.get()));
    }

    /**
     * 依次应用一组操作，返回新的状态表（不修改入参）
     */
    public static Map<String, ElementState> replay(Map<String, ElementState> initial, List<Operation> ops) {
        Map<String, ElementState> states = new LinkedHashMap<>(initial);
        for (Operation op : ops) {
            apply(states, op, id -> null);
        }
        return states;
    }

    static ElementState reduce(ElementState current, Operation op, OperationType type) {
        if (type == OperationType.CREATE || current == null) {
            ElementState fresh = ElementState.builder()
                .elementId(op.getElementId())
                .elementType(op.getElementType())
                .data(copy(op.dataOrEmpty()))
                .position(op.getPosition())
                .bounds(op.getBounds())
                .style(copy(op.styleOrEmpty()))
                .rotation(op.getRotation())
                .zIndex(op.getZIndex())
                .deleted(type == OperationType.DELETE)
                .version(op.getVersion())
                .lastOperationId(op.getId())
                .lastUserId(op.getUserId())
                .lastTimestamp(op.getTimestamp())
                .vectorClock(op.getVectorClock() != null ? op.getVectorClock() : VectorClock.empty())
                .build();
            return fresh;
        }

        Map<String, Object> data = new LinkedHashMap<>(current.getData());
        data.putAll(op.dataOrEmpty());
        Map<String, Object> style = new LinkedHashMap<>(current.getStyle());
        style.putAll(op.styleOrEmpty());

        return current.toBuilder()
            .elementType(op.getElementType() != null ? op.getElementType() : current.getElementType())
            .data(Collections.unmodifiableMap(data))
            .style(Collections.unmodifiableMap(style))
            .position(op.getPosition() != null ? op.getPosition() : current.getPosition())
            .bounds(op.getBounds() != null ? op.getBounds() : current.getBounds())
            .rotation(op.getRotation() != null ? op.getRotation() : current.getRotation())
            .zIndex(op.getZIndex() != null ? op.getZIndex() : current.getZIndex())
            .deleted(current.isDeleted() || type == OperationType.DELETE)
            .version(Math.max(current.getVersion(), op.getVersion()))
            .lastOperationId(op.getId())
            .lastUserId(op.getUserId())
            .lastTimestamp(op.getTimestamp() != null ? op.getTimestamp() : current.getLastTimestamp())
            .vectorClock(current.getVectorClock().merge(op.getVectorClock()))
            .build();
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
