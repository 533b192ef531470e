package com.whiteboard.ot.resolve;

import com.whiteboard.ot.model.Operation;
import com.whiteboard.ot.model.ResolutionStatus;

/**
 * 单个冲突的解决结果
 *
 * @param strategy            策略名
 * @param resolver            解决器实现类
 * @param outcome             结果操作，人工处理时为 null
 * @param status              RESOLVED 或 PENDING_MANUAL
 * @param confidence          置信度 0..1
 * @param resolutionTimeNanos 耗时
 */
public record Resolution(
    String strategy,
    String resolver,
    Operation outcome,
    ResolutionStatus status,
    double confidence,
    long resolutionTimeNanos
) {

    public boolean isResolved() {
        return status == ResolutionStatus.RESOLVED;
    }
}
