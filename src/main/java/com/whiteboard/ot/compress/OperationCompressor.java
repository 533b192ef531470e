package com.whiteboard.ot.compress;

import com.whiteboard.ot.clock.VectorClock;
import com.whiteboard.ot.model.Bounds;
import com.whiteboard.ot.model.Operation;
import com.whiteboard.ot.model.OperationType;
import com.whiteboard.ot.model.Position;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 操作压缩器
 *
 * 按元素分组，把连续写同一元素的操作合并为一个（字段级后写覆盖先写），
 * 合并结果放在该段第一个操作的位置并沿用其 id。规则:
 * - create 会重置元素，之前累积的内容直接丢弃，类型变为 create
 * - delete 并入非 create 段时类型变为 delete；紧跟在 create 段之后则另起一段
 * - 未知类型原样保留，并结束同元素的当前段
 * - compound / batch 原样保留，并结束所有元素的当前段
 *
 * 输出按元素状态回放与原序列等价，且 compress(compress(x)) == compress(x)。
 * 等价不含 lastOperationId / lastUserId：合并段沿用第一个操作的 id 与 userId，
 * 回放后这两个字段指向段首操作。
 */
@Slf4j
@Component
public class OperationCompressor {

    public List<Operation> compress(List<Operation> operations) {
        if (operations == null || operations.isEmpty()) {
            return List.of();
        }

        List<Segment> slots = new ArrayList<>();
        Map<String, Segment> open = new HashMap<>();

        for (Operation op : operations) {
            Optional<OperationType> type = op.operationType();

            if (type.isEmpty()) {
                open.remove(op.getElementId());
                slots.add(Segment.passThrough(op));
                continue;
            }
            if (type.get().isComposite()) {
                open.clear();
                slots.add(Segment.passThrough(op));
                continue;
            }

            Segment segment = open.get(op.getElementId());
            if (segment != null && segment.accepts(type.get())) {
                segment.absorb(op, type.get());
            } else {
                segment = Segment.start(op, type.get());
                slots.add(segment);
                open.put(op.getElementId(), segment);
            }
        }

        List<Operation> compressed = new ArrayList<>(slots.size());
        for (Segment segment : slots) {
            compressed.add(segment.result());
        }
        if (log.isDebugEnabled() && compressed.size() < operations.size()) {
            log.debug("Compressed operations: {} -> {}", operations.size(), compressed.size());
        }
        return compressed;
    }

    /**
     * 同一元素上的一段连续操作
     */
    private static final class Segment {

        private final Operation first;
        private final boolean passThrough;
        private int count = 1;

        private String id;
        private OperationType type;
        private String elementType;
        private Map<String, Object> data;
        private Map<String, Object> style;
        private Position position;
        private Bounds bounds;
        private Double rotation;
        private Integer zIndex;
        private Instant timestamp;
        private long version;
        private VectorClock clock;
        private long lamport;

        private Segment(Operation first, boolean passThrough) {
            this.first = first;
            this.passThrough = passThrough;
        }

        static Segment passThrough(Operation op) {
            return new Segment(op, true);
        }

        static Segment start(Operation op, OperationType type) {
            Segment segment = new Segment(op, false);
            segment.id = op.getId();
            segment.reset(op, type);
            return segment;
        }

        /**
         * create 段之后的 delete 无法用单个操作表达，需要另起一段
         */
        boolean accepts(OperationType next) {
            return !(type == OperationType.CREATE && next == OperationType.DELETE);
        }

        void absorb(Operation op, OperationType opType) {
            count++;
            if (opType == OperationType.CREATE) {
                reset(op, opType);
                return;
            }
            if (opType == OperationType.DELETE) {
                type = OperationType.DELETE;
            }
            merge(op);
        }

        private void reset(Operation op, OperationType opType) {
            type = opType;
            elementType = null;
            data = new LinkedHashMap<>();
            style = new LinkedHashMap<>();
            position = null;
            bounds = null;
            rotation = null;
            zIndex = null;
            timestamp = null;
            version = Long.MIN_VALUE;
            clock = VectorClock.empty();
            lamport = Long.MIN_VALUE;
            merge(op);
        }

        private void merge(Operation op) {
            if (op.getElementType() != null) elementType = op.getElementType();
            data.putAll(op.dataOrEmpty());
            style.putAll(op.styleOrEmpty());
            if (op.getPosition() != null) position = op.getPosition();
            if (op.getBounds() != null) bounds = op.getBounds();
            if (op.getRotation() != null) rotation = op.getRotation();
            if (op.getZIndex() != null) zIndex = op.getZIndex();
            if (op.getTimestamp() != null) timestamp = op.getTimestamp();
            version = Math.max(version, op.getVersion());
            clock = clock.merge(op.getVectorClock());
            lamport = Math.max(lamport, op.getLamportTimestamp());
        }

        Operation result() {
            if (passThrough || count == 1) {
                return first;
            }
            return first.toBuilder()
                .id(id)
                .type(type.value())
                .elementType(elementType)
                .data(Collections.unmodifiableMap(data))
                .style(Collections.unmodifiableMap(style))
                .position(position)
                .bounds(bounds)
                .rotation(rotation)
                .zIndex(zIndex)
                .timestamp(timestamp)
                .version(version)
                .vectorClock(clock)
                .lamportTimestamp(lamport)
                .build();
        }
    }
}
