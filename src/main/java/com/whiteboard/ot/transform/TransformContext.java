package com.whiteboard.ot.transform;

import com.whiteboard.ot.clock.VectorClock;
import com.whiteboard.ot.config.OtEngineProperties;
import com.whiteboard.ot.detect.OperationIndex;
import com.whiteboard.ot.model.ConflictInfo;
import com.whiteboard.ot.model.ConflictRecord;
import com.whiteboard.ot.model.ElementState;
import com.whiteboard.ot.model.Operation;
import com.whiteboard.ot.model.PerformanceMetrics;
import com.whiteboard.ot.monitor.AdaptiveThrottling;
import com.whiteboard.ot.monitor.PerformanceMonitor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * 单个画布的转换上下文
 *
 * 每次 transform 在写锁内完成读-改-写，公开的读取方法在读锁内返回副本，
 * 不会观察到半更新的 elementStates。
 */
public class TransformContext {

    private final String canvasId;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private long canvasVersion;
    private VectorClock currentVectorClock;
    private long lamportClock;

    private final List<Operation> pendingOperations = new ArrayList<>();
    private final OperationIndex pendingIndex;
    private final List<Operation> operationQueue = new ArrayList<>();
    private final OperationIndex queueIndex;
    /** 已知操作（含展开后的组成部分），用于解析 parentOperations */
    private final Map<String, Operation> operationsById = new HashMap<>();

    private final Map<String, ElementState> elementStates = new HashMap<>();
    private final List<ConflictRecord> conflictHistory = new ArrayList<>();
    private final Map<String, ConflictInfo> activeConflicts = new LinkedHashMap<>();

    private final Map<String, Integer> userPriorities = new ConcurrentHashMap<>();
    /** userId -> 最近一次提交操作的时间 */
    private final Map<String, Instant> lastSeen = new ConcurrentHashMap<>();
    private final Duration activeUserWindow;

    private volatile boolean compressionEnabled = true;
    private volatile boolean batchingEnabled = true;
    /** 调用方指定的解决策略名，null 表示按冲突类型自动选择 */
    private volatile String preferredStrategy;

    private final AdaptiveThrottling adaptiveThrottling;
    private final PerformanceMonitor performanceMonitor = new PerformanceMonitor();

    TransformContext(String canvasId, long canvasVersion, Map<String, ElementState> elementStates,
                     VectorClock currentVectorClock, long lamportClock, OtEngineProperties properties) {
        this.canvasId = canvasId;
        this.canvasVersion = canvasVersion;
        this.currentVectorClock = currentVectorClock;
        this.lamportClock = lamportClock;
        this.elementStates.putAll(elementStates);
        OtEngineProperties.DetectionConfig detection = properties.getDetection();
        this.pendingIndex = new OperationIndex(detection.getGridCellSize(), detection.getMaxCandidatesPerBucket());
        this.queueIndex = new OperationIndex(detection.getGridCellSize(), detection.getMaxCandidatesPerBucket());
        this.adaptiveThrottling = new AdaptiveThrottling(properties.getThrottling());
        this.activeUserWindow = Duration.ofSeconds(properties.getActiveUserWindowSeconds());
    }

    public String getCanvasId() {
        return canvasId;
    }

    // ========== 读取（读锁，返回副本） ==========

    public long getCanvasVersion() {
        return read(() -> canvasVersion);
    }

    public VectorClock getCurrentVectorClock() {
        return read(() -> currentVectorClock);
    }

    public long getLamportClock() {
        return read(() -> lamportClock);
    }

    public List<Operation> getPendingOperations() {
        return read(() -> List.copyOf(pendingOperations));
    }

    public int getPendingSize() {
        return read(pendingOperations::size);
    }

    public List<Operation> getOperationQueue() {
        return read(() -> List.copyOf(operationQueue));
    }

    public Map<String, ElementState> getElementStates() {
        return read(() -> Map.copyOf(elementStates));
    }

    public Optional<ElementState> getElementState(String elementId) {
        return read(() -> Optional.ofNullable(elementStates.get(elementId)));
    }

    public List<ConflictRecord> getConflictHistory() {
        return read(() -> List.copyOf(conflictHistory));
    }

    public Map<String, ConflictInfo> getActiveConflicts() {
        return read(() -> Map.copyOf(activeConflicts));
    }

    public PerformanceMetrics getPerformanceMetrics() {
        return performanceMonitor.snapshot(getActiveUsers().size(), getPendingSize());
    }

    // ========== 调用方可调整的字段 ==========

    /**
     * 替换并发候选队列（例如传输层给出的尚未确认的远程操作）
     */
    public void replaceOperationQueue(Collection<Operation> operations) {
        write(() -> {
            operationQueue.clear();
            queueIndex.clear();
            operations.forEach(this::enqueueUnlocked);
            return null;
        });
    }

    public void enqueue(Operation operation) {
        write(() -> {
            enqueueUnlocked(operation);
            return null;
        });
    }

    public void setUserPriority(String userId, int priority) {
        userPriorities.put(userId, priority);
    }

    public Map<String, Integer> getUserPriorities() {
        return Map.copyOf(userPriorities);
    }

    /**
     * 最近 active-user-window-seconds 内提交过操作的用户
     */
    public Set<String> getActiveUsers() {
        return activeUsersAt(Instant.now());
    }

    Set<String> activeUsersAt(Instant now) {
        Instant cutoff = now.minus(activeUserWindow);
        lastSeen.entrySet().removeIf(e -> e.getValue().isBefore(cutoff));
        return Set.copyOf(lastSeen.keySet());
    }

    public boolean isCompressionEnabled() {
        return compressionEnabled;
    }

    public void setCompressionEnabled(boolean compressionEnabled) {
        this.compressionEnabled = compressionEnabled;
    }

    public boolean isBatchingEnabled() {
        return batchingEnabled;
    }

    public void setBatchingEnabled(boolean batchingEnabled) {
        this.batchingEnabled = batchingEnabled;
    }

    public String getPreferredStrategy() {
        return preferredStrategy;
    }

    public void setPreferredStrategy(String preferredStrategy) {
        this.preferredStrategy = preferredStrategy;
    }

    public AdaptiveThrottling getAdaptiveThrottling() {
        return adaptiveThrottling;
    }

    // ========== 转换器使用（调用方需持有写锁） ==========

    Lock writeLock() {
        return lock.writeLock();
    }

    PerformanceMonitor performanceMonitor() {
        return performanceMonitor;
    }

    void markActive(String userId) {
        lastSeen.put(userId, Instant.now());
    }

    List<OperationIndex> detectionIndexes() {
        return List.of(pendingIndex, queueIndex);
    }

    Operation findOperationUnlocked(String operationId) {
        return operationsById.get(operationId);
    }

    Map<String, ElementState> elementStatesUnlocked() {
        return elementStates;
    }

    VectorClock currentVectorClockUnlocked() {
        return currentVectorClock;
    }

    void currentVectorClock(VectorClock clock) {
        this.currentVectorClock = clock;
    }

    long lamportClockUnlocked() {
        return lamportClock;
    }

    void lamportClock(long lamport) {
        this.lamportClock = lamport;
    }

    long nextCanvasVersion() {
        return ++canvasVersion;
    }

    int pendingSizeUnlocked() {
        return pendingOperations.size();
    }

    /**
     * 追加到待处理队列，组成部分进入检测索引
     */
    void appendPending(Operation operation, List<Operation> parts) {
        pendingOperations.add(operation);
        operationsById.put(operation.getId(), operation);
        indexOnly(parts);
    }

    /**
     * 只进入检测索引，不进入待处理队列（挂起等待人工处理的操作）
     */
    void indexOnly(List<Operation> parts) {
        for (Operation part : parts) {
            pendingIndex.add(part);
            operationsById.put(part.getId(), part);
        }
    }

    boolean isPendingUnlocked(String operationId) {
        return pendingOperations.stream().anyMatch(op -> op.getId().equals(operationId));
    }

    /**
     * 取出全部待处理操作，同时移出检测索引
     */
    List<Operation> drainPendingUnlocked() {
        List<Operation> drained = new ArrayList<>(pendingOperations);
        pendingOperations.clear();
        pendingIndex.clear();
        operationsById.clear();
        // 候选队列中的操作仍需可被引用
        operationQueue.forEach(op -> operationsById.put(op.getId(), op));
        return drained;
    }

    void addConflictRecord(ConflictRecord record) {
        conflictHistory.add(record);
    }

    void openConflict(ConflictInfo conflict) {
        activeConflicts.put(conflict.getId(), conflict);
    }

    ConflictInfo closeConflict(String conflictId) {
        return activeConflicts.remove(conflictId);
    }

    private void enqueueUnlocked(Operation operation) {
        operationQueue.add(operation);
        operationsById.put(operation.getId(), operation);
        for (Operation part : OperationExpander.expand(operation, operationsById::get)) {
            queueIndex.add(part);
        }
    }

    private <T> T read(Supplier<T> reader) {
        lock.readLock().lock();
        try {
            return reader.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T write(Supplier<T> writer) {
        lock.writeLock().lock();
        try {
            return writer.get();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
