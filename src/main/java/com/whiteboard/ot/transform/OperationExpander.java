package com.whiteboard.ot.transform;

import com.whiteboard.ot.model.Operation;
import com.whiteboard.ot.model.OperationType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 复合操作展开
 *
 * compound: data 中的 moves / resize / rotation 拆成 move / resize / rotate，
 *           parentOperations 引用的已知操作作为组成部分（沿用 compound 的时钟与用户）；
 *           都没有时整体视为一次 update。
 * batch:    data.operations 中的嵌套操作逐个展开，缺失的时钟、用户、时间戳取自 batch。
 * 其他类型: 返回自身。
 *
 * 拆出的部分 id 为 "父id#后缀"，仅用于冲突检测与元素状态应用。
 */
public final class OperationExpander {

    static final String MOVES_KEY = "moves";
    static final String RESIZE_KEY = "resize";
    static final String ROTATION_KEY = "rotation";

    private OperationExpander() {
    }

    public static List<Operation> expand(Operation op, Function<String, Operation> lookup) {
        if (op.isOfType(OperationType.COMPOUND)) {
            return decomposeCompound(op, lookup);
        }
        if (op.isOfType(OperationType.BATCH)) {
            List<Operation> leaves = new ArrayList<>();
            for (Operation nested : op.nestedOperations()) {
                leaves.addAll(expand(inheritFrom(op, nested), lookup));
            }
            return leaves;
        }
        return List.of(op);
    }

    private static List<Operation> decomposeCompound(Operation op, Function<String, Operation> lookup) {
        Map<String, Object> data = op.dataOrEmpty();
        List<Operation> parts = new ArrayList<>();

        if (data.containsKey(MOVES_KEY)) {
            parts.add(part(op, OperationType.MOVE)
                .data(payload(MOVES_KEY, data.get(MOVES_KEY)))
                .position(op.getPosition())
                .build());
        }
        if (data.containsKey(RESIZE_KEY)) {
            parts.add(part(op, OperationType.RESIZE)
                .data(payload(RESIZE_KEY, data.get(RESIZE_KEY)))
                .bounds(op.getBounds())
                .build());
        }
        if (data.containsKey(ROTATION_KEY)) {
            parts.add(part(op, OperationType.ROTATE)
                .data(payload(ROTATION_KEY, data.get(ROTATION_KEY)))
                .rotation(op.getRotation())
                .build());
        }

        for (String parentId : op.getParentOperations()) {
            Operation parent = lookup.apply(parentId);
            if (parent == null || parent.isComposite()) {
                continue;
            }
            parts.add(parent.toBuilder()
                .id(op.getId() + "#" + parentId)
                .userId(op.getUserId())
                .vectorClock(op.getVectorClock())
                .lamportTimestamp(op.getLamportTimestamp())
                .timestamp(op.getTimestamp())
                .build());
        }

        if (parts.isEmpty()) {
            parts.add(op.toBuilder()
                .id(op.getId() + "#" + OperationType.UPDATE.value())
                .type(OperationType.UPDATE.value())
                .build());
        }
        return parts;
    }

    private static Operation.OperationBuilder part(Operation op, OperationType type) {
        return Operation.builder()
            .id(op.getId() + "#" + type.value())
            .type(type.value())
            .elementId(op.getElementId())
            .elementType(op.getElementType())
            .timestamp(op.getTimestamp())
            .version(op.getVersion())
            .userId(op.getUserId())
            .vectorClock(op.getVectorClock())
            .lamportTimestamp(op.getLamportTimestamp())
            .metadata(op.getMetadata());
    }

    private static Map<String, Object> payload(String key, Object value) {
        return value != null ? Map.of(key, value) : Map.of();
    }

    private static Operation inheritFrom(Operation batch, Operation nested) {
        Operation.OperationBuilder builder = nested.toBuilder();
        if (nested.getVectorClock() == null || nested.getVectorClock().isEmpty()) {
            builder.vectorClock(batch.getVectorClock());
        }
        if (nested.getUserId() == null) {
            builder.userId(batch.getUserId());
        }
        if (nested.getTimestamp() == null) {
            builder.timestamp(batch.getTimestamp());
        }
        builder.lamportTimestamp(Math.max(batch.getLamportTimestamp(), nested.getLamportTimestamp()));
        return builder.build();
    }
}
