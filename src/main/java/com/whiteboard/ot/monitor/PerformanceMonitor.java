package com.whiteboard.ot.monitor;

import com.whiteboard.ot.model.PerformanceMetrics;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * 滚动性能统计
 *
 * 无锁累加，多个 transform 调用可以并发记录。
 */
public class PerformanceMonitor {

    private static final double NANOS_PER_MS = 1_000_000.0;
    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final LongAdder operationCount = new LongAdder();
    private final LongAdder totalLatencyNanos = new LongAdder();
    private final AtomicLong maxLatencyNanos = new AtomicLong(0);
    private final LongAdder conflictCount = new LongAdder();
    private final LongAdder resolutionAttempts = new LongAdder();
    private final LongAdder resolutionSuccesses = new LongAdder();

    private final AtomicLong firstRecordedNanos = new AtomicLong(0);
    private volatile Instant lastUpdated = Instant.now();

    /**
     * 记录一次操作的处理延迟
     */
    public void record(double latencyMs) {
        recordNanos((long) (latencyMs * NANOS_PER_MS));
    }

    public void recordNanos(long latencyNanos) {
        long now = System.nanoTime();
        firstRecordedNanos.compareAndSet(0, now - Math.max(latencyNanos, 1));
        operationCount.increment();
        totalLatencyNanos.add(latencyNanos);
        maxLatencyNanos.accumulateAndGet(latencyNanos, Math::max);
        lastUpdated = Instant.now();
    }

    /**
     * 记录冲突检测与解决结果
     *
     * @param detected 检测到的冲突数
     * @param attempted 尝试自动解决的冲突数
     * @param resolved 成功解决的冲突数
     */
    public void recordConflicts(int detected, int attempted, int resolved) {
        conflictCount.add(detected);
        resolutionAttempts.add(attempted);
        resolutionSuccesses.add(resolved);
    }

    public PerformanceMetrics snapshot() {
        return snapshot(0, 0);
    }

    public PerformanceMetrics snapshot(int activeUsers, int queueSize) {
        long count = operationCount.sum();
        long attempts = resolutionAttempts.sum();
        long first = firstRecordedNanos.get();
        double elapsedSeconds = first == 0 ? 0 : (System.nanoTime() - first) / 1_000_000_000.0;

        return new PerformanceMetrics(
            count,
            count > 0 ? totalLatencyNanos.sum() / NANOS_PER_MS / count : 0,
            maxLatencyNanos.get() / NANOS_PER_MS,
            count > 0 ? (double) conflictCount.sum() / count : 0,
            attempts > 0 ? (double) resolutionSuccesses.sum() / attempts : 1.0,
            elapsedSeconds > 0 ? count / elapsedSeconds : 0,
            currentMemoryUsageMB(),
            activeUsers,
            queueSize,
            lastUpdated
        );
    }

    public long getOperationCount() {
        return operationCount.sum();
    }

    public long getConflictCount() {
        return conflictCount.sum();
    }

    public static double currentMemoryUsageMB() {
        Runtime runtime = Runtime.getRuntime();
        return (runtime.totalMemory() - runtime.freeMemory()) / BYTES_PER_MB;
    }
}
