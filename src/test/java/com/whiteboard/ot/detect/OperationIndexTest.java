package com.whiteboard.ot.detect;

import com.whiteboard.ot.model.Operation;
import com.whiteboard.ot.model.OperationType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collection;

import static com.whiteboard.ot.OperationFixtures.box;
import static com.whiteboard.ot.OperationFixtures.op;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 冲突候选索引测试
 */
class OperationIndexTest {

    private OperationIndex index;

    @BeforeEach
    void setUp() {
        index = new OperationIndex(100, 4);
    }

    @Test
    @DisplayName("同元素与邻近格子的操作都是候选，远处的不是")
    void testCandidates() {
        index.add(op("same", OperationType.UPDATE, "e1", "user1", 1).build());
        index.add(op("near", OperationType.MOVE, "e2", "user2", 1).bounds(box(130, 0, 20)).build());
        index.add(op("far", OperationType.MOVE, "e3", "user3", 1).bounds(box(900, 900, 20)).build());

        Operation query = op("query", OperationType.MOVE, "e1", "user4", 1).bounds(box(0, 0, 90)).build();
        Collection<Operation> candidates = index.candidates(query, 50);

        assertTrue(candidates.stream().anyMatch(o -> o.getId().equals("same")));
        assertTrue(candidates.stream().anyMatch(o -> o.getId().equals("near")));
        assertFalse(candidates.stream().anyMatch(o -> o.getId().equals("far")));
    }

    @Test
    @DisplayName("网格桶只返回最近的若干个操作")
    void testCandidates_gridTailLimited() {
        for (int i = 0; i < 10; i++) {
            index.add(op("op" + i, OperationType.MOVE, "e" + i, "user" + i, 1).bounds(box(10 + i, 10, 5)).build());
        }

        Collection<Operation> candidates = index.candidates(
            op("query", OperationType.MOVE, "other", "userX", 1).bounds(box(0, 0, 5)).build(), 50);

        assertEquals(4, candidates.size());
        assertTrue(candidates.stream().anyMatch(o -> o.getId().equals("op9")));
        assertTrue(candidates.stream().anyMatch(o -> o.getId().equals("op6")));
        assertFalse(candidates.stream().anyMatch(o -> o.getId().equals("op5")));
    }

    @Test
    @DisplayName("同元素的操作不受桶上限截断，全部返回")
    void testCandidates_sameElementComplete() {
        for (int i = 0; i < 10; i++) {
            index.add(op("op" + i, OperationType.UPDATE, "e1", "user" + i, 1).bounds(box(10, 10, 5)).build());
        }

        Collection<Operation> candidates = index.candidates(
            op("query", OperationType.UPDATE, "e1", "userX", 1).bounds(box(10, 10, 5)).build(), 50);

        assertEquals(10, candidates.size());
        assertTrue(candidates.stream().anyMatch(o -> o.getId().equals("op0")));
    }

    @Test
    @DisplayName("移除后不再作为候选")
    void testRemove() {
        index.add(op("a", OperationType.MOVE, "e1", "user1", 1).bounds(box(0, 0, 10)).build());

        assertTrue(index.remove("a"));
        assertFalse(index.remove("a"));
        assertEquals(0, index.size());
        assertTrue(index.candidates(op("query", OperationType.MOVE, "e1", "user2", 1)
            .bounds(box(0, 0, 10)).build(), 50).isEmpty());
    }

    @Test
    @DisplayName("覆盖大量格子的区域仍能被查到")
    void testOversizedRegion() {
        index.add(op("huge", OperationType.RESIZE, "bg", "user1", 1).bounds(box(0, 0, 5000)).build());

        Collection<Operation> candidates = index.candidates(
            op("query", OperationType.MOVE, "e1", "user2", 1).bounds(box(2500, 2500, 10)).build(), 50);

        assertEquals(1, candidates.size());
    }
}
