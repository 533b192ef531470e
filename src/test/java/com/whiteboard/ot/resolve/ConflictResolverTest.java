package com.whiteboard.ot.resolve;

import com.whiteboard.ot.config.OtEngineProperties;
import com.whiteboard.ot.exception.ConflictResolutionException;
import com.whiteboard.ot.model.ConflictInfo;
import com.whiteboard.ot.model.ConflictSeverity;
import com.whiteboard.ot.model.ConflictType;
import com.whiteboard.ot.model.Operation;
import com.whiteboard.ot.model.OperationType;
import com.whiteboard.ot.model.ResolutionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.whiteboard.ot.OperationFixtures.at;
import static com.whiteboard.ot.OperationFixtures.op;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 冲突解决器测试
 */
class ConflictResolverTest {

    private ConflictResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new ConflictResolver(new OtEngineProperties());
    }

    private static ConflictInfo conflict(ConflictType type, ConflictSeverity severity, List<Operation> operations) {
        return ConflictInfo.builder()
            .id(type.value() + "_test")
            .type(type)
            .severity(severity)
            .operations(operations)
            .concurrentOperationCount(operations.size())
            .build();
    }

    @Test
    @DisplayName("priority-user - 空操作集显式报错")
    void testPriorityUser_emptyOperations() {
        ConflictInfo empty = conflict(ConflictType.TEMPORAL, ConflictSeverity.LOW, List.of());

        ConflictResolutionException ex = assertThrows(ConflictResolutionException.class,
            () -> resolver.resolve(empty, ResolutionStrategy.PRIORITY_USER, Map.of("user1", 5)));

        assertTrue(ex.getMessage().contains("No operations to resolve"));
    }

    @Test
    @DisplayName("所有内置策略都拒绝空操作集")
    void testAllStrategies_emptyOperations() {
        ConflictInfo empty = conflict(ConflictType.SEMANTIC, ConflictSeverity.HIGH, List.of());

        for (ResolutionStrategy strategy : ResolutionStrategy.values()) {
            assertThrows(ConflictResolutionException.class, () -> resolver.resolve(empty, strategy, Map.of()),
                strategy.value());
        }
    }

    @Test
    @DisplayName("priority-user - 单个操作原样返回")
    void testPriorityUser_singleOperation() {
        Operation only = op("op1", OperationType.MOVE, "e1", "alice", 3).position(at(1, 2)).build();

        Resolution resolution = resolver.resolve(conflict(ConflictType.TEMPORAL, ConflictSeverity.LOW, List.of(only)),
            ResolutionStrategy.PRIORITY_USER, Map.of());

        assertSame(only, resolution.outcome());
        assertEquals("alice", resolution.outcome().getUserId());
        assertEquals(ResolutionStatus.RESOLVED, resolution.status());
    }

    @Test
    @DisplayName("priority-user - 优先级高的用户胜出")
    void testPriorityUser_highestPriority() {
        Operation alice = op("op1", OperationType.MOVE, "e1", "alice", 9).build();
        Operation bob = op("op2", OperationType.MOVE, "e1", "bob", 1).build();

        Resolution resolution = resolver.resolve(
            conflict(ConflictType.TEMPORAL, ConflictSeverity.LOW, List.of(alice, bob)),
            ResolutionStrategy.PRIORITY_USER, Map.of("bob", 10, "alice", 1));

        assertEquals("op2", resolution.outcome().getId());
    }

    @Test
    @DisplayName("last-writer-wins - Lamport 最大者胜出，相同时比较 userId")
    void testLastWriterWins() {
        Operation early = op("op1", OperationType.MOVE, "e1", "zed", 2).build();
        Operation late = op("op2", OperationType.MOVE, "e1", "amy", 7).build();
        Operation tie = op("op3", OperationType.MOVE, "e1", "bob", 7).build();

        Resolution resolution = resolver.resolve(
            conflict(ConflictType.SPATIAL, ConflictSeverity.LOW, List.of(early, late, tie)),
            ResolutionStrategy.LAST_WRITER_WINS, Map.of());

        assertEquals("op3", resolution.outcome().getId());
    }

    @Test
    @DisplayName("merge - 合并 data 字段，后写覆盖先写，保留第一个操作的身份")
    void testMerge() {
        Operation incoming = op("op1", OperationType.UPDATE, "e1", "user1", 5)
            .data(Map.of("width", 100, "text", "hello")).build();
        Operation other = op("op2", OperationType.UPDATE, "e1", "user2", 3)
            .data(Map.of("width", 80, "height", 40)).position(at(10, 10)).build();

        Resolution resolution = resolver.resolve(
            conflict(ConflictType.CONCURRENT_MODIFICATION, ConflictSeverity.LOW, List.of(incoming, other)),
            ResolutionStrategy.MERGE, Map.of());

        Operation merged = resolution.outcome();
        assertEquals("op1", merged.getId());
        assertEquals(100, merged.getData().get("width"));
        assertEquals(40, merged.getData().get("height"));
        assertEquals("hello", merged.getData().get("text"));
        assertEquals(at(10, 10), merged.getPosition());
        assertEquals(5, merged.getLamportTimestamp());
        assertEquals(5, merged.getVectorClock().get("user1"));
        assertEquals(3, merged.getVectorClock().get("user2"));
        assertEquals(0.7, resolution.confidence(), 1e-9);
    }

    @Test
    @DisplayName("manual - 返回待人工处理")
    void testManual() {
        Operation a = op("op1", OperationType.DELETE, "e1", "user1", 1).build();
        Operation b = op("op2", OperationType.MOVE, "e1", "user2", 1).build();

        Resolution resolution = resolver.resolve(
            conflict(ConflictType.SEMANTIC, ConflictSeverity.HIGH, List.of(a, b)),
            ResolutionStrategy.MANUAL, Map.of());

        assertNull(resolution.outcome());
        assertEquals(ResolutionStatus.PENDING_MANUAL, resolution.status());
        assertFalse(resolution.isResolved());
    }

    @Test
    @DisplayName("默认策略选择")
    void testSelectStrategy() {
        Operation delete = op("op1", OperationType.DELETE, "e1", "user1", 1).build();
        Operation move = op("op2", OperationType.MOVE, "e1", "user2", 1).build();
        Operation update = op("op3", OperationType.UPDATE, "e1", "user3", 1).build();

        assertEquals(ResolutionStrategy.LAST_WRITER_WINS, resolver.selectStrategy(
            conflict(ConflictType.SPATIAL, ConflictSeverity.MEDIUM, List.of(move, update)), Map.of()));
        assertEquals(ResolutionStrategy.LAST_WRITER_WINS, resolver.selectStrategy(
            conflict(ConflictType.TEMPORAL, ConflictSeverity.LOW, List.of(move, update)), Map.of()));
        assertEquals(ResolutionStrategy.LAST_WRITER_WINS, resolver.selectStrategy(
            conflict(ConflictType.SEMANTIC, ConflictSeverity.HIGH, List.of(delete, move)), Map.of()));
        assertEquals(ResolutionStrategy.PRIORITY_USER, resolver.selectStrategy(
            conflict(ConflictType.SEMANTIC, ConflictSeverity.HIGH, List.of(delete, move)), Map.of("user1", 1)));
        assertEquals(ResolutionStrategy.MERGE, resolver.selectStrategy(
            conflict(ConflictType.CONCURRENT_MODIFICATION, ConflictSeverity.LOW, List.of(move, update)), Map.of()));

        ConflictInfo crowded = conflict(ConflictType.TEMPORAL, ConflictSeverity.HIGH, List.of(move, update))
            .toBuilder().concurrentOperationCount(8).build();
        assertEquals(ResolutionStrategy.MANUAL, resolver.selectStrategy(crowded, Map.of()));
    }

    @Test
    @DisplayName("默认解决记录所选策略与解决器")
    void testResolve_defaultStrategyRecorded() {
        Operation a = op("op1", OperationType.MOVE, "e1", "user1", 4).build();
        Operation b = op("op2", OperationType.MOVE, "e1", "user2", 2).build();

        Resolution resolution = resolver.resolve(conflict(ConflictType.TEMPORAL, ConflictSeverity.LOW, List.of(a, b)),
            Map.of());

        assertEquals("last-writer-wins", resolution.strategy());
        assertEquals("LastWriterWinsStrategy", resolution.resolver());
        assertEquals("op1", resolution.outcome().getId());
        assertEquals(0.8, resolution.confidence(), 1e-9);
    }

    @Test
    @DisplayName("自定义策略注册与按名称调用")
    void testCustomStrategy() {
        resolver.registerCustom(new ConflictResolutionStrategy() {
            @Override
            public String name() {
                return "oldest-wins";
            }

            @Override
            public Optional<Operation> resolve(ConflictInfo conflict, Map<String, Integer> userPriorities) {
                return conflict.getOperations().stream()
                    .min((x, y) -> Long.compare(x.getLamportTimestamp(), y.getLamportTimestamp()));
            }
        });
        Operation a = op("op1", OperationType.MOVE, "e1", "user1", 4).build();
        Operation b = op("op2", OperationType.MOVE, "e1", "user2", 2).build();

        Resolution resolution = resolver.resolve(conflict(ConflictType.TEMPORAL, ConflictSeverity.LOW, List.of(a, b)),
            "oldest-wins", Map.of());

        assertEquals("op2", resolution.outcome().getId());
        assertEquals("oldest-wins", resolution.strategy());

        ConflictInfo again = conflict(ConflictType.TEMPORAL, ConflictSeverity.LOW, List.of(a, b));
        assertTrue(resolver.unregisterCustom("oldest-wins"));
        assertThrows(ConflictResolutionException.class, () -> resolver.resolve(again, "oldest-wins", Map.of()));
        assertFalse(resolver.unregisterCustom("oldest-wins"));
    }

    @Test
    @DisplayName("内置策略名不能被自定义策略占用，未知策略名报错")
    void testCustomStrategy_invalidNames() {
        ConflictResolutionStrategy impostor = new ConflictResolutionStrategy() {
            @Override
            public String name() {
                return "merge";
            }

            @Override
            public Optional<Operation> resolve(ConflictInfo conflict, Map<String, Integer> userPriorities) {
                return Optional.empty();
            }
        };

        assertThrows(IllegalArgumentException.class, () -> resolver.registerCustom(impostor));
        assertThrows(ConflictResolutionException.class, () -> resolver.resolve(
            conflict(ConflictType.TEMPORAL, ConflictSeverity.LOW,
                List.of(op("op1", OperationType.MOVE, "e1", "user1", 1).build())),
            "no-such-strategy", Map.of()));
    }
}
