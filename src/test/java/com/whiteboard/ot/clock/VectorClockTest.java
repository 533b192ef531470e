package com.whiteboard.ot.clock;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 向量时钟测试
 */
class VectorClockTest {

    @Test
    @DisplayName("逐分量 >= 且至少一个 > 时判定为 after")
    void testCompare_after() {
        VectorClock op1 = VectorClock.of(Map.of("user1", 1L, "user2", 1L));
        VectorClock op2 = VectorClock.of(Map.of("user1", 2L, "user2", 1L));

        assertEquals(CausalOrder.AFTER, op2.compare(op1));
        assertEquals(CausalOrder.BEFORE, op1.compare(op2));
    }

    @Test
    @DisplayName("互不支配时判定为并发")
    void testCompare_concurrent() {
        VectorClock a = VectorClock.of(Map.of("user1", 2L, "user2", 1L));
        VectorClock b = VectorClock.of(Map.of("user1", 1L, "user2", 2L));

        assertEquals(CausalOrder.CONCURRENT, a.compare(b));
        assertEquals(CausalOrder.CONCURRENT, b.compare(a));
    }

    @Test
    @DisplayName("缺失条目按 0 处理")
    void testCompare_missingEntries() {
        VectorClock a = VectorClock.of("user1", 1L);
        VectorClock b = VectorClock.of(Map.of("user1", 1L, "user2", 3L));

        assertEquals(CausalOrder.BEFORE, a.compare(b));
        assertEquals(0, a.get("user2"));
    }

    @Test
    @DisplayName("相同时钟视为并发")
    void testCompare_equalClocks() {
        VectorClock a = VectorClock.of("user1", 4L);
        VectorClock b = VectorClock.of("user1", 4L);

        assertEquals(CausalOrder.CONCURRENT, a.compare(b));
        assertEquals(a, b);
    }

    @Test
    @DisplayName("合并结果逐分量 >= 两个输入")
    void testMerge() {
        VectorClock a = VectorClock.of(Map.of("user1", 3L, "user2", 1L));
        VectorClock b = VectorClock.of(Map.of("user2", 5L, "user3", 2L));

        VectorClock merged = a.merge(b);

        assertEquals(3, merged.get("user1"));
        assertEquals(5, merged.get("user2"));
        assertEquals(2, merged.get("user3"));
        assertTrue(merged.covers(a));
        assertTrue(merged.covers(b));
    }

    @Test
    @DisplayName("递增返回新实例，原时钟不变")
    void testIncrement_immutable() {
        VectorClock clock = VectorClock.of("user1", 1L);

        VectorClock next = clock.increment("user1").increment("user2");

        assertEquals(1, clock.get("user1"));
        assertEquals(2, next.get("user1"));
        assertEquals(1, next.get("user2"));
        assertEquals(CausalOrder.AFTER, next.compare(clock));
    }

    @Test
    @DisplayName("分歧度统计计数不同的条目")
    void testDivergence() {
        VectorClock a = VectorClock.of(Map.of("user1", 2L, "user2", 1L, "user3", 4L));
        VectorClock b = VectorClock.of(Map.of("user1", 1L, "user2", 1L));

        assertEquals(2, a.divergence(b));
        assertEquals(0, a.divergence(a));
    }

    @Test
    @DisplayName("负数计数被拒绝")
    void testOf_negativeCounter() {
        assertThrows(IllegalArgumentException.class, () -> VectorClock.of("user1", -1L));
    }

    @Test
    @DisplayName("空时钟")
    void testEmpty() {
        assertTrue(VectorClock.empty().isEmpty());
        assertEquals(VectorClock.of("user1", 1L), VectorClock.empty().merge(VectorClock.of("user1", 1L)));
    }
}
