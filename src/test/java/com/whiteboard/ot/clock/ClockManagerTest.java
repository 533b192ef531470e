package com.whiteboard.ot.clock;

import com.whiteboard.ot.model.Operation;
import com.whiteboard.ot.model.OperationType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.whiteboard.ot.OperationFixtures.op;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 时钟管理器测试
 */
class ClockManagerTest {

    private SimpleMeterRegistry meterRegistry;
    private ClockManager clockManager;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        clockManager = new ClockManager(meterRegistry);
    }

    @Test
    @DisplayName("Lamport 取 max(local, received) + 1")
    void testNextLamport() {
        assertEquals(6, clockManager.nextLamport(5, 3));
        assertEquals(11, clockManager.nextLamport(2, 10));
        assertEquals(1, clockManager.nextLamport(0, 0));
    }

    @Test
    @DisplayName("推进只递增发起用户的计数")
    void testAdvance() {
        VectorClock clock = VectorClock.of(Map.of("user1", 1L, "user2", 4L));

        VectorClock advanced = clockManager.advance(clock, "user1");

        assertEquals(2, advanced.get("user1"));
        assertEquals(4, advanced.get("user2"));
        assertEquals(1, meterRegistry.counter("whiteboard.ot.clock.advance").count());
    }

    @Test
    @DisplayName("null 时钟直接报错，不当作空时钟")
    void testCompare_nullClock() {
        assertThrows(IllegalArgumentException.class,
            () -> clockManager.compare(null, VectorClock.of("user1", 1L)));
        assertThrows(IllegalArgumentException.class,
            () -> clockManager.merge(VectorClock.of("user1", 1L), null));
    }

    @Test
    @DisplayName("不同用户的独立操作并发，同一操作不与自身并发")
    void testIsConcurrent() {
        Operation a = op("a", OperationType.MOVE, "e1", "user1", 1).build();
        Operation b = op("b", OperationType.MOVE, "e1", "user2", 1).build();

        assertTrue(clockManager.isConcurrent(a, b));
        assertFalse(clockManager.isConcurrent(a, a));
        assertEquals(1, clockManager.getStats().concurrentComparisons());
    }

    @Test
    @DisplayName("因果后继的操作不并发")
    void testIsConcurrent_causal() {
        Operation first = op("a", OperationType.MOVE, "e1", "user1", 1).build();
        Operation second = op("b", OperationType.MOVE, "e1", "user2", 1)
            .vectorClock(VectorClock.of(Map.of("user1", 1L, "user2", 1L)))
            .build();

        assertFalse(clockManager.isConcurrent(first, second));
        assertEquals(CausalOrder.AFTER, clockManager.compareOperations(second, first));
    }
}
