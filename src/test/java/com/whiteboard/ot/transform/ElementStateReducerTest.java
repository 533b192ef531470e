package com.whiteboard.ot.transform;

import com.whiteboard.ot.model.ElementState;
import com.whiteboard.ot.model.Operation;
import com.whiteboard.ot.model.OperationType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.whiteboard.ot.OperationFixtures.at;
import static com.whiteboard.ot.OperationFixtures.box;
import static com.whiteboard.ot.OperationFixtures.op;
import static org.junit.jupiter.api.Assertions.*;

class ElementStateReducerTest {

    @Test
    @DisplayName("create 之后的修改逐字段合并")
    void testReplay_fieldMerge() {
        Map<String, ElementState> states = ElementStateReducer.replay(Map.of(), List.of(
            op("op1", OperationType.CREATE, "e1", "user1", 1)
                .data(Map.of("width", 100)).style(Map.of("color", "blue")).bounds(box(0, 0, 100)).build(),
            op("op2", OperationType.UPDATE, "e1", "user2", 2).data(Map.of("height", 40)).build(),
            op("op3", OperationType.STYLE, "e1", "user1", 3).style(Map.of("color", "red")).build(),
            op("op4", OperationType.MOVE, "e1", "user2", 4).position(at(30, 30)).build()));

        ElementState state = states.get("e1");
        assertEquals(Map.of("width", 100, "height", 40), state.getData());
        assertEquals("red", state.getStyle().get("color"));
        assertEquals(box(0, 0, 100), state.getBounds());
        assertEquals(at(30, 30), state.getPosition());
        assertEquals(4, state.getVersion());
        assertEquals("op4", state.getLastOperationId());
        assertEquals(3, state.getVectorClock().get("user1"));
        assertEquals(4, state.getVectorClock().get("user2"));
    }

    @Test
    @DisplayName("delete 留下墓碑，之后的修改不会复活元素")
    void testReplay_deleteIsSticky() {
        Map<String, ElementState> states = ElementStateReducer.replay(Map.of(), List.of(
            op("op1", OperationType.CREATE, "e1", "user1", 1).build(),
            op("op2", OperationType.DELETE, "e1", "user1", 2).build(),
            op("op3", OperationType.UPDATE, "e1", "user2", 1).data(Map.of("text", "late")).build()));

        assertTrue(states.get("e1").isDeleted());
        assertEquals("late", states.get("e1").getData().get("text"));
    }

    @Test
    @DisplayName("create 重置已删除的元素")
    void testReplay_createResets() {
        Map<String, ElementState> states = ElementStateReducer.replay(Map.of(), List.of(
            op("op1", OperationType.CREATE, "e1", "user1", 1).data(Map.of("old", true)).build(),
            op("op2", OperationType.DELETE, "e1", "user1", 2).build(),
            op("op3", OperationType.CREATE, "e1", "user1", 3).data(Map.of("fresh", true)).build()));

        ElementState state = states.get("e1");
        assertFalse(state.isDeleted());
        assertEquals(Map.of("fresh", true), state.getData());
    }

    @Test
    @DisplayName("未知类型不改变状态，不修改入参")
    void testApply_unknownTypeIgnored() {
        Map<String, ElementState> initial = new HashMap<>();
        ElementStateReducer.apply(initial,
            op("op1", OperationType.CREATE, "e1", "user1", 1).type("sticker").build(), id -> null);

        assertTrue(initial.isEmpty());

        Map<String, ElementState> replayed = ElementStateReducer.replay(initial, List.of(
            op("op2", OperationType.CREATE, "e1", "user1", 1).build()));
        assertTrue(initial.isEmpty());
        assertEquals(1, replayed.size());
    }

    @Test
    @DisplayName("compound 通过 parentOperations 引用的操作一并应用")
    void testApply_compoundWithParents() {
        Operation parent = op("p1", OperationType.STYLE, "e1", "user2", 1).style(Map.of("stroke", 2)).build();
        Operation compound = op("c1", OperationType.COMPOUND, "e1", "user1", 5)
            .data(Map.of("rotation", 45))
            .rotation(45.0)
            .parentOperations(List.of("p1", "unknown"))
            .build();
        Map<String, ElementState> states = new HashMap<>();

        ElementStateReducer.apply(states, compound, id -> "p1".equals(id) ? parent : null);

        ElementState state = states.get("e1");
        assertEquals(45.0, state.getRotation());
        assertEquals(2, state.getStyle().get("stroke"));
        assertEquals("user1", state.getLastUserId());
        assertEquals("c1#p1", state.getLastOperationId());
    }
}
