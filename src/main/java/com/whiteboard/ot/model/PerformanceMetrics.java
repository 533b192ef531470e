package com.whiteboard.ot.model;

import java.time.Instant;

/**
 * 滚动性能统计
 *
 * @param operationCount        已处理操作数
 * @param averageLatency        平均延迟（毫秒）
 * @param maxLatency            最大延迟（毫秒）
 * @param conflictRate          冲突数 / 操作数
 * @param resolutionSuccessRate 成功解决数 / 已尝试解决数，无冲突时为 1
 * @param operationThroughput   操作/秒（自首次记录起）
 * @param memoryUsage           堆已用内存（MB）
 * @param activeUsers           活跃用户数
 * @param queueSize             待处理队列长度
 * @param lastUpdated           最近一次记录时间
 */
public record PerformanceMetrics(
    long operationCount,
    double averageLatency,
    double maxLatency,
    double conflictRate,
    double resolutionSuccessRate,
    double operationThroughput,
    double memoryUsage,
    int activeUsers,
    int queueSize,
    Instant lastUpdated
) {}
