package com.whiteboard.ot.transform;

import com.github.benmanes.caffeine.cache.Cache;
import com.whiteboard.ot.clock.ClockManager;
import com.whiteboard.ot.clock.VectorClock;
import com.whiteboard.ot.compress.OperationCompressor;
import com.whiteboard.ot.config.MetricsConfig;
import com.whiteboard.ot.config.OtEngineProperties;
import com.whiteboard.ot.detect.ConflictDetector;
import com.whiteboard.ot.exception.ConflictResolutionException;
import com.whiteboard.ot.exception.OperationValidationException;
import com.whiteboard.ot.model.Bounds;
import com.whiteboard.ot.model.CanvasSnapshot;
import com.whiteboard.ot.model.ConflictInfo;
import com.whiteboard.ot.model.ConflictRecord;
import com.whiteboard.ot.model.ConflictType;
import com.whiteboard.ot.model.ElementState;
import com.whiteboard.ot.model.Operation;
import com.whiteboard.ot.model.OperationType;
import com.whiteboard.ot.model.PerformanceMetrics;
import com.whiteboard.ot.model.PerformanceSnapshot;
import com.whiteboard.ot.model.ResolutionStatus;
import com.whiteboard.ot.model.TransformResult;
import com.whiteboard.ot.monitor.OtMetricsCollector;
import com.whiteboard.ot.monitor.PerformanceMonitor;
import com.whiteboard.ot.resolve.ConflictResolver;
import com.whiteboard.ot.resolve.Resolution;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.function.UnaryOperator;

/**
 * 操作转换器（引擎入口）
 *
 * 处理流程:
 * 1. 校验（缺失向量时钟等为致命错误）
 * 2. 重复投递去重（Caffeine）
 * 3. 未知类型: 告警后原样透传
 * 4. 写锁内: 展开复合操作 → 冲突检测 → 逐个解决并折叠结果 → 推进时钟 → 更新元素状态 → 追加待处理队列
 * 5. 锁外: 性能统计、Micrometer、SLO、自适应节流
 */
@Slf4j
@Service
public class OperationTransformer {

    private final ClockManager clockManager;
    private final ConflictDetector conflictDetector;
    private final ConflictResolver conflictResolver;
    private final OperationCompressor operationCompressor;
    private final OtMetricsCollector metricsCollector;
    private final MetricsConfig metricsConfig;
    private final OtEngineProperties properties;
    private final Cache<String, TransformResult> resultCache;

    private final Map<String, TransformContext> contexts = new ConcurrentHashMap<>();

    public OperationTransformer(ClockManager clockManager,
                                ConflictDetector conflictDetector,
                                ConflictResolver conflictResolver,
                                OperationCompressor operationCompressor,
                                OtMetricsCollector metricsCollector,
                                MetricsConfig metricsConfig,
                                OtEngineProperties properties,
                                @Qualifier("transformResultCache") Cache<String, TransformResult> resultCache) {
        this.clockManager = clockManager;
        this.conflictDetector = conflictDetector;
        this.conflictResolver = conflictResolver;
        this.operationCompressor = operationCompressor;
        this.metricsCollector = metricsCollector;
        this.metricsConfig = metricsConfig;
        this.properties = properties;
        this.resultCache = resultCache;
    }

    // ========== 上下文 ==========

    /**
     * 从画布检查点创建上下文，其余字段取默认值
     */
    public TransformContext createContext(CanvasSnapshot snapshot) {
        TransformContext context = new TransformContext(
            snapshot.canvasId(),
            snapshot.canvasVersion(),
            snapshot.elementStates(),
            snapshot.currentVectorClock(),
            snapshot.lamportClock(),
            properties);

        Lock lock = context.writeLock();
        lock.lock();
        try {
            for (Operation op : snapshot.pendingOperations()) {
                context.appendPending(op, OperationExpander.expand(op, context::findOperationUnlocked));
            }
        } finally {
            lock.unlock();
        }

        contexts.put(snapshot.canvasId(), context);
        log.info("Transform context created: canvasId={}, version={}, pending={}, elements={}",
            snapshot.canvasId(), snapshot.canvasVersion(), snapshot.pendingOperations().size(),
            snapshot.elementStates().size());
        return context;
    }

    public TransformContext createContext(String canvasId) {
        return createContext(CanvasSnapshot.empty(canvasId));
    }

    public void releaseContext(String canvasId) {
        if (contexts.remove(canvasId) != null) {
            log.info("Transform context released: canvasId={}", canvasId);
        }
    }

    // ========== 核心API ==========

    public TransformResult transform(Operation operation, TransformContext context) {
        long start = System.nanoTime();
        validate(operation);

        String cacheKey = context.getCanvasId() + ":" + operation.getId();
        TransformResult cached = cachedResult(cacheKey);
        if (cached != null) {
            log.debug("Duplicate operation delivery ignored: canvasId={}, operationId={}",
                context.getCanvasId(), operation.getId());
            return cached;
        }

        context.markActive(operation.getUserId());
        if (operation.operationType().isEmpty()) {
            return passThrough(operation, context, cacheKey, start);
        }

        List<ConflictInfo> conflicts = new ArrayList<>();
        List<ConflictRecord> records = new ArrayList<>();
        Operation transformed;
        int attempted = 0;
        int resolved = 0;
        int pending;

        Lock lock = context.writeLock();
        lock.lock();
        try {
            cached = cachedResult(cacheKey);
            if (cached != null) {
                return cached;
            }

            List<Operation> parts = OperationExpander.expand(operation, context::findOperationUnlocked);
            Map<String, Operation> folded = new LinkedHashMap<>();
            parts.forEach(part -> folded.put(part.getId(), part));
            Set<String> held = new HashSet<>();
            Set<String> nudged = new HashSet<>();

            Map<String, ConflictInfo> detected = new LinkedHashMap<>();
            for (Operation part : parts) {
                for (ConflictInfo conflict : conflictDetector.detectIndexed(part, context.detectionIndexes())) {
                    detected.putIfAbsent(conflict.getId(), conflict);
                }
            }
            conflicts.addAll(detected.values());

            for (ConflictInfo conflict : conflicts) {
                Operation part = conflict.getOperations().get(0);
                ConflictRecord record;
                try {
                    Resolution resolution = resolve(conflict, context);
                    if (resolution.isResolved()) {
                        attempted++;
                        resolved++;
                        Operation outcome = resolution.outcome();
                        if (isSuppressedDelete(part, outcome, conflict)) {
                            folded.put(part.getId(), supersede(folded.get(part.getId()), outcome));
                        } else {
                            folded.put(part.getId(), fold(folded.get(part.getId()), part, outcome, conflict, nudged));
                        }
                    } else {
                        context.openConflict(conflict);
                        held.add(part.getId());
                    }
                    record = new ConflictRecord(conflict, resolution.strategy(), resolution.resolver(),
                        resolution.status(), resolution.outcome() != null ? resolution.outcome().getId() : null,
                        resolution.confidence(), resolution.resolutionTimeNanos(), Instant.now(), null);
                } catch (RuntimeException e) {
                    attempted++;
                    log.warn("Conflict resolution failed, conflict left open: conflictId={}, error={}",
                        conflict.getId(), e.getMessage());
                    context.openConflict(conflict);
                    held.add(part.getId());
                    record = new ConflictRecord(conflict, strategyLabel(context), null, ResolutionStatus.FAILED,
                        null, 0, 0, Instant.now(), e.getMessage());
                }
                records.add(record);
            }

            long lamport = clockManager.nextLamport(context.lamportClockUnlocked(), operation.getLamportTimestamp());
            context.lamportClock(lamport);

            VectorClock clock = operation.getVectorClock();
            for (Operation part : folded.values()) {
                clock = clockManager.merge(clock, part.getVectorClock());
            }
            context.currentVectorClock(clockManager.merge(context.currentVectorClockUnlocked(), clock));

            // 索引中的组成部分保留客户端 Lamport，后续冲突解决与新操作在同一时钟域比较
            List<Operation> indexed = new ArrayList<>(folded.values());
            if (operation.isComposite()) {
                transformed = operation.toBuilder().vectorClock(clock).lamportTimestamp(lamport).build();
            } else {
                Operation merged = indexed.get(0).toBuilder().vectorClock(clock).build();
                indexed.set(0, merged);
                transformed = merged.toBuilder().lamportTimestamp(lamport).build();
            }

            Map<String, ElementState> states = context.elementStatesUnlocked();
            for (Operation part : indexed) {
                if (!held.contains(part.getId())) {
                    ElementStateReducer.apply(states, part, context::findOperationUnlocked);
                }
            }
            context.nextCanvasVersion();
            if (!operation.isComposite() && held.contains(operation.getId())) {
                // 挂起的操作不进入待处理队列，人工解决后再追加
                context.indexOnly(indexed);
            } else {
                context.appendPending(transformed, indexed);
            }
            records.forEach(context::addConflictRecord);
            pending = context.pendingSizeUnlocked();
        } finally {
            lock.unlock();
        }

        return complete(transformed, conflicts, records, context, cacheKey, start, attempted, resolved, pending);
    }

    public List<Operation> compress(List<Operation> operations) {
        return operationCompressor.compress(operations);
    }

    /**
     * 全部画布的汇总指标
     */
    public PerformanceMetrics getMetrics() {
        int activeUsers = 0;
        int queueSize = 0;
        for (TransformContext context : contexts.values()) {
            activeUsers += context.getActiveUsers().size();
            queueSize += context.getPendingSize();
        }
        return metricsCollector.getMetrics(activeUsers, queueSize);
    }

    /**
     * 创建本地操作：推进画布向量时钟中发起用户的计数，并分配下一个 Lamport 时间戳
     */
    public Operation createOperation(TransformContext context, OperationType type, String elementId,
                                     String userId, UnaryOperator<Operation.OperationBuilder> fields) {
        Lock lock = context.writeLock();
        lock.lock();
        try {
            VectorClock clock = clockManager.advance(context.currentVectorClockUnlocked(), userId);
            context.currentVectorClock(clock);
            long lamport = context.lamportClockUnlocked() + 1;
            context.lamportClock(lamport);
            ElementState state = context.elementStatesUnlocked().get(elementId);

            Operation.OperationBuilder builder = Operation.builder()
                .id(UUID.randomUUID().toString())
                .type(type.value())
                .elementId(elementId)
                .elementType(state != null ? state.getElementType() : null)
                .timestamp(Instant.now())
                .version(state != null ? state.getVersion() + 1 : 1)
                .userId(userId)
                .vectorClock(clock)
                .lamportTimestamp(lamport);
            return fields.apply(builder).build();
        } finally {
            lock.unlock();
        }
    }

    public Operation createOperation(TransformContext context, OperationType type, String elementId, String userId) {
        return createOperation(context, type, elementId, userId, UnaryOperator.identity());
    }

    /**
     * 人工解决：应用选定的操作并关闭冲突
     */
    public Operation resolveManually(TransformContext context, String conflictId, Operation chosen) {
        validate(chosen);
        Lock lock = context.writeLock();
        lock.lock();
        try {
            ConflictInfo conflict = context.closeConflict(conflictId);
            if (conflict == null) {
                throw new ConflictResolutionException("Unknown or already closed conflict: " + conflictId);
            }
            long lamport = clockManager.nextLamport(context.lamportClockUnlocked(), chosen.getLamportTimestamp());
            context.lamportClock(lamport);
            context.currentVectorClock(clockManager.merge(context.currentVectorClockUnlocked(), chosen.getVectorClock()));

            Operation applied = chosen.toBuilder().lamportTimestamp(lamport).build();
            ElementStateReducer.apply(context.elementStatesUnlocked(), applied, context::findOperationUnlocked);
            context.nextCanvasVersion();
            if (!context.isPendingUnlocked(applied.getId())) {
                context.appendPending(applied, OperationExpander.expand(chosen, context::findOperationUnlocked));
            }
            context.addConflictRecord(new ConflictRecord(conflict, "manual", "human", ResolutionStatus.RESOLVED,
                applied.getId(), 1.0, 0, Instant.now(), null));
            metricsCollector.recordResolution("manual", ResolutionStatus.RESOLVED);

            log.info("Conflict resolved manually: canvasId={}, conflictId={}, chosen={}",
                context.getCanvasId(), conflictId, applied.getId());
            return applied;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 放弃冲突：关闭但不改变元素状态
     */
    public void abandonConflict(TransformContext context, String conflictId) {
        Lock lock = context.writeLock();
        lock.lock();
        try {
            ConflictInfo conflict = context.closeConflict(conflictId);
            if (conflict == null) {
                throw new ConflictResolutionException("Unknown or already closed conflict: " + conflictId);
            }
            context.addConflictRecord(new ConflictRecord(conflict, "manual", "human", ResolutionStatus.ABANDONED,
                null, 0, 0, Instant.now(), null));
            metricsCollector.recordResolution("manual", ResolutionStatus.ABANDONED);
            log.info("Conflict abandoned: canvasId={}, conflictId={}", context.getCanvasId(), conflictId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 取出待处理操作供持久化或广播，开启压缩时返回压缩结果
     */
    public List<Operation> drainPendingOperations(TransformContext context) {
        List<Operation> drained;
        Lock lock = context.writeLock();
        lock.lock();
        try {
            drained = context.drainPendingUnlocked();
        } finally {
            lock.unlock();
        }
        return context.isCompressionEnabled() ? operationCompressor.compress(drained) : drained;
    }

    /**
     * 校验操作，失败时抛出 {@link OperationValidationException}
     */
    public void validate(Operation op) {
        if (op == null) {
            reject(null, List.of("operation must not be null"));
            return;
        }
        List<String> violations = new ArrayList<>();
        if (isBlank(op.getId())) violations.add("id is required");
        if (isBlank(op.getType())) violations.add("type is required");
        if (isBlank(op.getElementId())) violations.add("elementId is required");
        if (isBlank(op.getUserId())) violations.add("userId is required");
        if (op.getVectorClock() == null) {
            violations.add("vectorClock is required");
        } else if (op.getVectorClock().isEmpty()) {
            violations.add("vectorClock must not be empty");
        }
        if (op.getLamportTimestamp() < 0) violations.add("lamportTimestamp must be >= 0");
        if (op.isOfType(OperationType.BATCH)) {
            for (Operation nested : op.nestedOperations()) {
                if (isBlank(nested.getId()) || isBlank(nested.getElementId()) || isBlank(nested.getType())) {
                    violations.add("nested operation requires id, elementId and type");
                    break;
                }
            }
        }
        if (!violations.isEmpty()) {
            reject(op.getId(), violations);
        }
    }

    // ========== 内部 ==========

    private void reject(String operationId, List<String> violations) {
        metricsCollector.recordRejected();
        log.error("Operation rejected: id={}, violations={}", operationId, violations);
        throw new OperationValidationException(operationId, violations);
    }

    private TransformResult passThrough(Operation operation, TransformContext context, String cacheKey, long start) {
        log.warn("Unknown operation type passed through unchanged: canvasId={}, operationId={}, type={}",
            context.getCanvasId(), operation.getId(), operation.getType());

        int pending;
        Lock lock = context.writeLock();
        lock.lock();
        try {
            context.currentVectorClock(clockManager.merge(context.currentVectorClockUnlocked(),
                operation.getVectorClock()));
            context.lamportClock(clockManager.nextLamport(context.lamportClockUnlocked(),
                operation.getLamportTimestamp()));
            context.nextCanvasVersion();
            context.appendPending(operation, List.of());
            pending = context.pendingSizeUnlocked();
        } finally {
            lock.unlock();
        }

        long elapsed = System.nanoTime() - start;
        metricsCollector.recordPassThrough(operation.getType(), elapsed);
        PerformanceMonitor monitor = context.performanceMonitor();
        monitor.recordNanos(elapsed);
        TransformResult result = new TransformResult(operation, List.of(),
            snapshot(elapsed, pending, context.getAdaptiveThrottling().adjust(toMillis(elapsed))), true);
        cache(cacheKey, result);
        return result;
    }

    private Resolution resolve(ConflictInfo conflict, TransformContext context) {
        String preferred = context.getPreferredStrategy();
        Map<String, Integer> priorities = context.getUserPriorities();
        if (preferred != null) {
            return conflictResolver.resolve(conflict, preferred, priorities);
        }
        return conflictResolver.resolve(conflict, priorities);
    }

    /**
     * 并发的非删除操作胜出时，删除不生效，见 {@link #supersede}
     */
    private static boolean isSuppressedDelete(Operation part, Operation outcome, ConflictInfo conflict) {
        return conflict.getType() == ConflictType.SEMANTIC
            && part.isOfType(OperationType.DELETE)
            && !outcome.getId().equals(part.getId())
            && !outcome.isOfType(OperationType.DELETE);
    }

    private String strategyLabel(TransformContext context) {
        String preferred = context.getPreferredStrategy();
        return preferred != null ? preferred : "default";
    }

    /**
     * 把一个冲突的解决结果折叠进当前组成部分
     *
     * @param current  已折叠过的组成部分
     * @param original 检测时的组成部分
     */
    private Operation fold(Operation current, Operation original, Operation outcome, ConflictInfo conflict,
                           Set<String> nudged) {
        if (outcome == original) {
            return current;
        }
        if (!outcome.getId().equals(original.getId()) && conflict.getType() == ConflictType.SPATIAL) {
            if (!nudged.add(original.getId())) {
                return current;
            }
            double offset = properties.getResolution().getSpatialOffset();
            Bounds bounds = current.getBounds();
            return current.toBuilder()
                .position(current.getPosition() != null ? current.getPosition().offset(offset, offset) : null)
                .bounds(bounds != null ? new Bounds(bounds.x() + offset, bounds.y() + offset,
                    bounds.width(), bounds.height()) : null)
                .build();
        }
        return overlay(current, outcome);
    }

    /**
     * 落败的删除改写为胜出操作的回显：类型取胜出方，字段按胜出方覆盖，
     * 返回、待处理队列与元素状态三者一致
     */
    private Operation supersede(Operation current, Operation outcome) {
        return overlay(current.toBuilder().type(outcome.getType()).build(), outcome);
    }

    /**
     * 结果操作的字段覆盖到当前组成部分上，保留其 id / 类型 / 用户
     */
    private Operation overlay(Operation current, Operation outcome) {
        Map<String, Object> data = new LinkedHashMap<>(current.dataOrEmpty());
        data.putAll(outcome.dataOrEmpty());
        Map<String, Object> style = new LinkedHashMap<>(current.styleOrEmpty());
        style.putAll(outcome.styleOrEmpty());
        return current.toBuilder()
            .data(Collections.unmodifiableMap(data))
            .style(Collections.unmodifiableMap(style))
            .position(outcome.getPosition() != null ? outcome.getPosition() : current.getPosition())
            .bounds(outcome.getBounds() != null ? outcome.getBounds() : current.getBounds())
            .rotation(outcome.getRotation() != null ? outcome.getRotation() : current.getRotation())
            .zIndex(outcome.getZIndex() != null ? outcome.getZIndex() : current.getZIndex())
            .vectorClock(current.getVectorClock().merge(outcome.getVectorClock()))
            .build();
    }

    private TransformResult complete(Operation transformed, List<ConflictInfo> conflicts, List<ConflictRecord> records,
                                     TransformContext context, String cacheKey, long start,
                                     int attempted, int resolved, int pending) {
        long elapsed = System.nanoTime() - start;
        double elapsedMs = toMillis(elapsed);

        context.performanceMonitor().recordNanos(elapsed);
        context.performanceMonitor().recordConflicts(conflicts.size(), attempted, resolved);
        metricsCollector.recordTransform(transformed.getType(), elapsed, conflicts, attempted, resolved);
        records.forEach(r -> metricsCollector.recordResolution(
            r.strategy() != null ? r.strategy() : "unknown", r.status()));

        if (elapsedMs > properties.getLatencyBudgetMs()) {
            metricsConfig.recordSloViolation("transform_latency");
            log.warn("Transform exceeded latency budget: canvasId={}, operationId={}, latency={}ms, budget={}ms",
                context.getCanvasId(), transformed.getId(), String.format("%.2f", elapsedMs),
                properties.getLatencyBudgetMs());
        }

        long suggestedDelay = context.getAdaptiveThrottling().adjust(elapsedMs);
        TransformResult result = new TransformResult(transformed, conflicts, snapshot(elapsed, pending, suggestedDelay),
            false);
        cache(cacheKey, result);
        return result;
    }

    private PerformanceSnapshot snapshot(long elapsedNanos, int pending, long suggestedDelay) {
        return new PerformanceSnapshot(toMillis(elapsedNanos), PerformanceMonitor.currentMemoryUsageMB(),
            pending, suggestedDelay);
    }

    private TransformResult cachedResult(String cacheKey) {
        return properties.getCache().isDedupeEnabled() ? resultCache.getIfPresent(cacheKey) : null;
    }

    private void cache(String cacheKey, TransformResult result) {
        if (properties.getCache().isDedupeEnabled()) {
            resultCache.put(cacheKey, result);
        }
    }

    private static double toMillis(long nanos) {
        return nanos / 1_000_000.0;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
