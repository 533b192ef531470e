package com.whiteboard.ot.model;

/**
 * 单次 transform 的性能快照
 *
 * @param processingTimeMs 处理耗时
 * @param memoryUsageMB    堆已用内存
 * @param queueSize        处理后待处理队列长度
 * @param suggestedDelayMs 建议的操作间隔（背压由调用方执行）
 */
public record PerformanceSnapshot(
    double processingTimeMs,
    double memoryUsageMB,
    int queueSize,
    long suggestedDelayMs
) {}
