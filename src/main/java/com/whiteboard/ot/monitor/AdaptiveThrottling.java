package com.whiteboard.ot.monitor;

import com.whiteboard.ot.config.OtEngineProperties;
import lombok.extern.slf4j.Slf4j;

/**
 * 自适应节流
 *
 * currentRate 表示建议的操作间隔（毫秒），不是每秒操作数:
 * 延迟超过 targetLatency 时按 increaseFactor 增大（加强背压），
 * 否则按 decayFactor 逐步回落，始终限制在 [floor, ceiling]。
 * 引擎只给出建议，由调用方执行。
 */
@Slf4j
public class AdaptiveThrottling {

    private final long floor;
    private final long ceiling;
    private final double increaseFactor;
    private final double decayFactor;

    private volatile boolean enabled;
    private volatile long targetLatencyMs;
    private double currentRate;

    public AdaptiveThrottling(OtEngineProperties.ThrottlingConfig config) {
        this.enabled = config.isEnabled();
        this.floor = config.getFloor();
        this.ceiling = Math.max(config.getFloor(), config.getCeiling());
        this.increaseFactor = config.getIncreaseFactor();
        this.decayFactor = config.getDecayFactor();
        this.targetLatencyMs = config.getTargetLatencyMs();
        this.currentRate = clamp(config.getInitialRate());
    }

    /**
     * 根据一次观测延迟调整建议间隔
     *
     * @return 调整后的 currentRate
     */
    public synchronized long adjust(double observedLatencyMs) {
        if (!enabled) {
            return getCurrentRate();
        }
        double previous = currentRate;
        if (observedLatencyMs > targetLatencyMs) {
            currentRate = clamp(currentRate * increaseFactor);
            if (previous < currentRate) {
                log.debug("Throttle increased: {} -> {} ms (latency={}ms, target={}ms)",
                    Math.round(previous), Math.round(currentRate), observedLatencyMs, targetLatencyMs);
            }
        } else {
            currentRate = clamp(currentRate * decayFactor);
        }
        return getCurrentRate();
    }

    public synchronized long getCurrentRate() {
        return Math.round(currentRate);
    }

    public long getTargetLatencyMs() {
        return targetLatencyMs;
    }

    public void setTargetLatencyMs(long targetLatencyMs) {
        this.targetLatencyMs = targetLatencyMs;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getFloor() {
        return floor;
    }

    public long getCeiling() {
        return ceiling;
    }

    private double clamp(double rate) {
        return Math.max(floor, Math.min(ceiling, rate));
    }
}
