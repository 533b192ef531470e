package com.whiteboard.ot.model;

import java.time.Instant;

/**
 * 冲突历史条目（审计用，只追加）
 *
 * @param conflict            冲突
 * @param strategy            选用的策略名
 * @param resolver            实际执行的解决器
 * @param status              结果状态
 * @param outcomeOperationId  胜出操作 id，未解决时为 null
 * @param confidence          解决置信度 0..1
 * @param resolutionTimeNanos 解决耗时
 * @param recordedAt          记录时间
 * @param note                附加说明（失败原因等）
 */
public record ConflictRecord(
    ConflictInfo conflict,
    String strategy,
    String resolver,
    ResolutionStatus status,
    String outcomeOperationId,
    double confidence,
    long resolutionTimeNanos,
    Instant recordedAt,
    String note
) {}
