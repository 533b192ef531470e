package com.whiteboard.ot.clock;

import com.whiteboard.ot.model.Operation;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 时钟管理器
 *
 * 核心职责:
 * 1. 因果判定: 向量时钟支配关系 (before / after / concurrent)
 * 2. 本地推进: 每个本地操作递增发起用户的计数
 * 3. 远程合并: 逐分量取最大值
 * 4. Lamport: max(local, received) + 1，并发时用于确定性排序
 */
@Slf4j
@Component
public class ClockManager {

    private final AtomicLong advanceCount = new AtomicLong(0);
    private final AtomicLong mergeCount = new AtomicLong(0);
    private final AtomicLong concurrentCount = new AtomicLong(0);

    private final Counter advanceCounter;
    private final Counter mergeCounter;
    private final Counter concurrentCounter;

    public ClockManager(MeterRegistry meterRegistry) {
        this.advanceCounter = Counter.builder("whiteboard.ot.clock.advance").register(meterRegistry);
        this.mergeCounter = Counter.builder("whiteboard.ot.clock.merge").register(meterRegistry);
        this.concurrentCounter = Counter.builder("whiteboard.ot.clock.concurrent").register(meterRegistry);
    }

    // ========== 核心API ==========

    public CausalOrder compare(VectorClock a, VectorClock b) {
        requireClock(a);
        requireClock(b);
        return a.compare(b);
    }

    /**
     * 两个操作的因果关系；同一操作（相同 id）视为相互包含，不算并发
     */
    public CausalOrder compareOperations(Operation a, Operation b) {
        CausalOrder order = compare(a.getVectorClock(), b.getVectorClock());
        if (order == CausalOrder.CONCURRENT) {
            concurrentCount.incrementAndGet();
            concurrentCounter.increment();
        }
        return order;
    }

    public boolean isConcurrent(Operation a, Operation b) {
        if (a.getId().equals(b.getId())) {
            return false;
        }
        return compareOperations(a, b) == CausalOrder.CONCURRENT;
    }

    /**
     * 本地事件：递增 userId 自己的计数
     */
    public VectorClock advance(VectorClock clock, String userId) {
        requireClock(clock);
        advanceCount.incrementAndGet();
        advanceCounter.increment();
        return clock.increment(userId);
    }

    /**
     * 应用远程操作：逐分量取最大值
     */
    public VectorClock merge(VectorClock a, VectorClock b) {
        requireClock(a);
        requireClock(b);
        mergeCount.incrementAndGet();
        mergeCounter.increment();
        return a.merge(b);
    }

    public long nextLamport(long local, long received) {
        return Math.max(local, received) + 1;
    }

    public int divergence(VectorClock a, VectorClock b) {
        requireClock(a);
        requireClock(b);
        return a.divergence(b);
    }

    public ClockStats getStats() {
        return new ClockStats(advanceCount.get(), mergeCount.get(), concurrentCount.get());
    }

    private static void requireClock(VectorClock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("Vector clock must not be null");
        }
    }

    public record ClockStats(long advances, long merges, long concurrentComparisons) {}
}
