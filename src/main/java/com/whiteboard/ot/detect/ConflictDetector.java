package com.whiteboard.ot.detect;

import com.whiteboard.ot.clock.ClockManager;
import com.whiteboard.ot.config.OtEngineProperties;
import com.whiteboard.ot.model.Bounds;
import com.whiteboard.ot.model.ConflictInfo;
import com.whiteboard.ot.model.ConflictSeverity;
import com.whiteboard.ot.model.ConflictType;
import com.whiteboard.ot.model.Operation;
import com.whiteboard.ot.model.OperationType;
import com.whiteboard.ot.model.SemanticConflict;
import com.whiteboard.ot.model.SpatialOverlap;
import com.whiteboard.ot.model.TemporalProximity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 冲突检测器
 *
 * 只与新操作并发（向量时钟互不支配）的候选比较:
 * - 空间: 不同元素，区域相交或边缘距离小于阈值
 * - 时间: 同一元素，时间戳差小于窗口
 * - 语义: 同一元素，操作类型不兼容（delete 与其他类型为 HIGH）
 * - 并发修改: 同一元素，既非时间也非语义冲突，但同一字段写入了不同的值
 *
 * 同一元素上的并发操作数达到阈值时，同元素冲突的严重度升一级。
 */
@Slf4j
@Component
public class ConflictDetector {

    private final ClockManager clockManager;
    private final OtEngineProperties.DetectionConfig config;

    public ConflictDetector(ClockManager clockManager, OtEngineProperties properties) {
        this.clockManager = clockManager;
        this.config = properties.getDetection();
    }

    /**
     * 在索引中查找候选后检测
     */
    public List<ConflictInfo> detectIndexed(Operation op, List<OperationIndex> indexes) {
        Map<String, Operation> candidates = new LinkedHashMap<>();
        for (OperationIndex index : indexes) {
            for (Operation candidate : index.candidates(op, config.getSpatialProximity())) {
                candidates.putIfAbsent(candidate.getId(), candidate);
            }
        }
        return detect(op, candidates.values());
    }

    /**
     * 对给定队列逐个检测（队列较小或已经过索引筛选时使用）
     */
    public List<ConflictInfo> detect(Operation op, Collection<Operation> queue) {
        List<Operation> concurrent = new ArrayList<>();
        int sameElementConcurrent = 0;
        for (Operation other : queue) {
            if (!isRelated(op, other) || !clockManager.isConcurrent(op, other)) {
                continue;
            }
            concurrent.add(other);
            if (op.getElementId().equals(other.getElementId())) {
                sameElementConcurrent++;
            }
        }
        if (concurrent.isEmpty()) {
            return List.of();
        }

        int concurrentOnElement = sameElementConcurrent + 1;
        boolean escalate = concurrentOnElement >= config.getEscalationThreshold();
        Instant detectedAt = Instant.now();
        List<ConflictInfo> conflicts = new ArrayList<>();

        for (Operation other : concurrent) {
            if (!op.getElementId().equals(other.getElementId())) {
                detectSpatial(op, other, detectedAt).ifPresent(conflicts::add);
                continue;
            }
            ConflictInfo temporal = detectTemporal(op, other, detectedAt, concurrentOnElement);
            ConflictInfo semantic = detectSemantic(op, other, detectedAt, concurrentOnElement);
            if (temporal != null) {
                conflicts.add(escalate ? escalated(temporal) : temporal);
            }
            if (semantic != null) {
                conflicts.add(escalate ? escalated(semantic) : semantic);
            }
            if (temporal == null && semantic == null) {
                ConflictInfo modification = detectConcurrentModification(op, other, detectedAt, concurrentOnElement);
                if (modification != null) {
                    conflicts.add(escalate ? escalated(modification) : modification);
                }
            }
        }

        conflicts.sort(Comparator.comparing(ConflictInfo::getSeverity).reversed());
        if (log.isDebugEnabled()) {
            conflicts.forEach(c -> log.debug("Conflict detected: id={}, severity={}, divergence={}",
                c.getId(), c.getSeverity(), c.getVectorClockDivergence()));
        }
        return conflicts;
    }

    // ========== 空间 ==========

    private Optional<ConflictInfo> detectSpatial(Operation op, Operation other, Instant detectedAt) {
        Bounds a = op.region();
        Bounds b = other.region();
        if (a == null || b == null) {
            return Optional.empty();
        }
        double intersection = a.intersectionArea(b);
        double distance = a.gapDistance(b);
        if (intersection <= 0 && distance >= config.getSpatialProximity()) {
            return Optional.empty();
        }
        double union = a.area() + b.area() - intersection;
        double percentage = union > 0 ? intersection / union : 0;

        ConflictSeverity severity;
        if (percentage > 0.5) {
            severity = ConflictSeverity.HIGH;
        } else if (intersection > 0) {
            severity = ConflictSeverity.MEDIUM;
        } else {
            severity = ConflictSeverity.LOW;
        }

        return Optional.of(base(ConflictType.SPATIAL, op, other, detectedAt, 2)
            .severity(severity)
            .spatialOverlap(new SpatialOverlap(intersection, percentage, distance))
            .build());
    }

    // ========== 时间 ==========

    private ConflictInfo detectTemporal(Operation op, Operation other, Instant detectedAt, int concurrentOnElement) {
        if (op.getTimestamp() == null || other.getTimestamp() == null) {
            return null;
        }
        long diff = Math.abs(Duration.between(op.getTimestamp(), other.getTimestamp()).toMillis());
        if (diff >= config.getTemporalWindowMs()) {
            return null;
        }
        boolean simultaneous = diff < config.getSimultaneousThresholdMs();
        return base(ConflictType.TEMPORAL, op, other, detectedAt, concurrentOnElement)
            .severity(simultaneous ? ConflictSeverity.MEDIUM : ConflictSeverity.LOW)
            .temporalProximity(new TemporalProximity(diff, simultaneous))
            .build();
    }

    // ========== 语义 ==========

    private ConflictInfo detectSemantic(Operation op, Operation other, Instant detectedAt, int concurrentOnElement) {
        OperationType a = op.operationType().orElse(null);
        OperationType b = other.operationType().orElse(null);
        if (a == null || b == null) {
            return null;
        }

        ConflictSeverity severity = null;
        if ((a == OperationType.DELETE) != (b == OperationType.DELETE)) {
            severity = ConflictSeverity.HIGH;
        } else if (a == OperationType.CREATE && b == OperationType.CREATE) {
            severity = ConflictSeverity.MEDIUM;
        } else if ((a == OperationType.CREATE) != (b == OperationType.CREATE)) {
            severity = ConflictSeverity.MEDIUM;
        } else if (a != b && (a.category() == OperationType.Category.STRUCTURE
            || b.category() == OperationType.Category.STRUCTURE)) {
            severity = ConflictSeverity.MEDIUM;
        }
        if (severity == null) {
            return null;
        }

        SemanticConflict detail = new SemanticConflict(
            List.of(a.value() + " vs " + b.value()),
            conflictingFields(op, other));
        return base(ConflictType.SEMANTIC, op, other, detectedAt, concurrentOnElement)
            .severity(severity)
            .semanticConflict(detail)
            .build();
    }

    // ========== 并发修改 ==========

    private ConflictInfo detectConcurrentModification(Operation op, Operation other, Instant detectedAt,
                                                      int concurrentOnElement) {
        List<String> fields = conflictingFields(op, other);
        if (fields.isEmpty()) {
            return null;
        }
        return base(ConflictType.CONCURRENT_MODIFICATION, op, other, detectedAt, concurrentOnElement)
            .severity(ConflictSeverity.LOW)
            .semanticConflict(new SemanticConflict(List.of(), fields))
            .build();
    }

    /**
     * 双方都写入且取值不同的字段，data / style 子键记为 data.key / style.key
     */
    public static List<String> conflictingFields(Operation a, Operation b) {
        List<String> fields = new ArrayList<>();
        if (differs(a.getPosition(), b.getPosition())) fields.add("position");
        if (differs(a.getBounds(), b.getBounds())) fields.add("bounds");
        if (differs(a.getRotation(), b.getRotation())) fields.add("rotation");
        if (differs(a.getZIndex(), b.getZIndex())) fields.add("zIndex");
        collectMapConflicts("data", a.dataOrEmpty(), b.dataOrEmpty(), fields);
        collectMapConflicts("style", a.styleOrEmpty(), b.styleOrEmpty(), fields);
        return fields;
    }

    private static boolean differs(Object a, Object b) {
        return a != null && b != null && !a.equals(b);
    }

    private static void collectMapConflicts(String prefix, Map<String, Object> a, Map<String, Object> b,
                                            List<String> fields) {
        for (var entry : a.entrySet()) {
            if (b.containsKey(entry.getKey()) && !Objects.equals(entry.getValue(), b.get(entry.getKey()))) {
                fields.add(prefix + "." + entry.getKey());
            }
        }
    }

    // ========== 工具 ==========

    private boolean isRelated(Operation op, Operation other) {
        if (op.getId().equals(other.getId())) {
            return false;
        }
        return op.getElementId().equals(other.getElementId()) || (op.hasGeometry() && other.hasGeometry());
    }

    private ConflictInfo.ConflictInfoBuilder base(ConflictType type, Operation op, Operation other,
                                                  Instant detectedAt, int concurrentCount) {
        return ConflictInfo.builder()
            .id(ConflictInfo.conflictId(type, op, other))
            .type(type)
            .operations(List.of(op, other))
            .detectedAt(detectedAt)
            .affectedElements(Set.copyOf(List.of(op.getElementId(), other.getElementId())))
            .vectorClockDivergence(clockManager.divergence(op.getVectorClock(), other.getVectorClock()))
            .concurrentOperationCount(concurrentCount);
    }

    private static ConflictInfo escalated(ConflictInfo conflict) {
        return conflict.toBuilder().severity(conflict.getSeverity().escalate()).build();
    }
}
