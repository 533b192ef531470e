package com.whiteboard.ot.monitor;

import com.whiteboard.ot.model.ConflictInfo;
import com.whiteboard.ot.model.PerformanceMetrics;
import com.whiteboard.ot.model.ResolutionStatus;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * OT 引擎监控指标收集器
 * 汇总全部画布的转换延迟、冲突、解决结果，暴露给 Micrometer
 */
@Component
public class OtMetricsCollector {

    private static final Logger log = LoggerFactory.getLogger(OtMetricsCollector.class);

    private final MeterRegistry meterRegistry;
    private final PerformanceMonitor engineMonitor = new PerformanceMonitor();
    private final Timer transformTimer;

    private final AtomicLong passThroughCount = new AtomicLong(0);
    private final AtomicLong manualCount = new AtomicLong(0);
    private final AtomicLong failedCount = new AtomicLong(0);
    private final AtomicLong rejectedCount = new AtomicLong(0);

    public OtMetricsCollector(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.transformTimer = Timer.builder("whiteboard.ot.transform.latency")
            .description("Operation transform latency")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(meterRegistry);

        registerMetrics();
    }

    private void registerMetrics() {
        meterRegistry.gauge("whiteboard.ot.throughput", engineMonitor,
            m -> m.snapshot().operationThroughput());
        meterRegistry.gauge("whiteboard.ot.conflict_rate", engineMonitor,
            m -> m.snapshot().conflictRate());
        meterRegistry.counter("whiteboard.ot.pass_through");
    }

    /**
     * 记录一次完成的 transform
     */
    public void recordTransform(String type, long latencyNanos, List<ConflictInfo> conflicts,
                                int attempted, int resolved) {
        engineMonitor.recordNanos(latencyNanos);
        engineMonitor.recordConflicts(conflicts.size(), attempted, resolved);
        transformTimer.record(latencyNanos, TimeUnit.NANOSECONDS);
        meterRegistry.counter("whiteboard.ot.operations", Tags.of("type", type)).increment();
        for (ConflictInfo conflict : conflicts) {
            meterRegistry.counter("whiteboard.ot.conflicts",
                Tags.of("type", conflict.getType().value(), "severity", conflict.getSeverity().value())).increment();
        }
    }

    public void recordResolution(String strategy, ResolutionStatus status) {
        if (status == ResolutionStatus.PENDING_MANUAL) {
            manualCount.incrementAndGet();
        } else if (status == ResolutionStatus.FAILED) {
            failedCount.incrementAndGet();
        }
        meterRegistry.counter("whiteboard.ot.resolutions",
            Tags.of("strategy", strategy, "status", status.name().toLowerCase())).increment();
    }

    /**
     * 未知类型透传
     */
    public void recordPassThrough(String type, long latencyNanos) {
        passThroughCount.incrementAndGet();
        engineMonitor.recordNanos(latencyNanos);
        transformTimer.record(latencyNanos, TimeUnit.NANOSECONDS);
        meterRegistry.counter("whiteboard.ot.pass_through").increment();
        meterRegistry.counter("whiteboard.ot.operations", Tags.of("type", String.valueOf(type))).increment();
    }

    /**
     * 校验失败被拒绝的操作
     */
    public void recordRejected() {
        rejectedCount.incrementAndGet();
        meterRegistry.counter("whiteboard.ot.rejected").increment();
    }

    public long getRejectedCount() {
        return rejectedCount.get();
    }

    public PerformanceMetrics getMetrics(int activeUsers, int queueSize) {
        return engineMonitor.snapshot(activeUsers, queueSize);
    }

    public long getPassThroughCount() {
        return passThroughCount.get();
    }

    /**
     * 定时打印引擎统计（每分钟）
     */
    @Scheduled(fixedRate = 60000)
    public void logEngineStats() {
        PerformanceMetrics metrics = engineMonitor.snapshot();
        if (metrics.operationCount() == 0) {
            return;
        }
        log.info("OT Stats: operations={}, avg latency={}ms, max latency={}ms, conflict rate={}%, "
                + "resolution success={}%, pass-through={}, manual={}, failed={}, rejected={}",
            metrics.operationCount(),
            String.format("%.2f", metrics.averageLatency()),
            String.format("%.2f", metrics.maxLatency()),
            String.format("%.2f", metrics.conflictRate() * 100),
            String.format("%.2f", metrics.resolutionSuccessRate() * 100),
            passThroughCount.get(), manualCount.get(), failedCount.get(), rejectedCount.get());
    }
}
