package com.whiteboard.ot.transaction;

import com.whiteboard.ot.config.OtEngineProperties;
import com.whiteboard.ot.exception.TransactionException;
import com.whiteboard.ot.model.OperationType;
import com.whiteboard.ot.model.TransformResult;
import com.whiteboard.ot.transform.OperationTransformer;
import com.whiteboard.ot.transform.TransformContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.whiteboard.ot.OperationFixtures.at;
import static com.whiteboard.ot.OperationFixtures.box;
import static com.whiteboard.ot.OperationFixtures.newTransformer;
import static com.whiteboard.ot.OperationFixtures.op;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 操作事务测试
 */
class OperationTransactionManagerTest {

    private OperationTransformer transformer;
    private OperationTransactionManager transactionManager;
    private TransformContext context;

    @BeforeEach
    void setUp() {
        OtEngineProperties properties = new OtEngineProperties();
        transformer = newTransformer(properties);
        transactionManager = new OperationTransactionManager(transformer, properties);
        context = transformer.createContext("canvas-tx");
    }

    private String beginWithThreeOperations() {
        String txId = transactionManager.begin(context, "user1");
        transactionManager.add(txId, op("op1", OperationType.CREATE, "e1", "user1", 1).bounds(box(0, 0, 10)).build());
        transactionManager.add(txId, op("op2", OperationType.UPDATE, "e1", "user1", 2)
            .data(Map.of("text", "hello")).build());
        transactionManager.add(txId, op("op3", OperationType.MOVE, "e2", "user1", 3).position(at(40, 40)).build());
        return txId;
    }

    @Test
    @DisplayName("批处理开启时合成一个 batch 操作提交")
    void testCommit_batched() {
        String txId = beginWithThreeOperations();
        assertEquals(TransactionStatus.PENDING, transactionManager.status(txId).orElseThrow());

        List<TransformResult> results = transactionManager.commit(txId);

        assertEquals(1, results.size());
        assertEquals("batch", results.get(0).transformedOperation().getType());
        assertEquals(txId, results.get(0).transformedOperation().getId());
        assertEquals(3, results.get(0).transformedOperation().nestedOperations().size());
        assertEquals("hello", context.getElementState("e1").orElseThrow().getData().get("text"));
        assertEquals(at(40, 40), context.getElementState("e2").orElseThrow().getPosition());
        assertEquals(1, context.getCanvasVersion());
        assertTrue(transactionManager.status(txId).isEmpty());
        assertEquals(0, transactionManager.activeTransactionCount());
    }

    @Test
    @DisplayName("批处理关闭时逐个转换")
    void testCommit_sequential() {
        context.setBatchingEnabled(false);
        String txId = beginWithThreeOperations();

        List<TransformResult> results = transactionManager.commit(txId);

        assertEquals(3, results.size());
        assertEquals(List.of("op1", "op2", "op3"),
            results.stream().map(r -> r.transformedOperation().getId()).toList());
        assertEquals(3, context.getCanvasVersion());
    }

    @Test
    @DisplayName("包含非法操作时整体回滚，画布不变")
    void testCommit_invalidOperationRollsBack() {
        String txId = beginWithThreeOperations();
        transactionManager.add(txId, op("bad", OperationType.MOVE, "e1", "user1", 4).vectorClock(null).build());

        TransactionException ex = assertThrows(TransactionException.class, () -> transactionManager.commit(txId));

        assertTrue(ex.getMessage().contains("rolled back"));
        assertTrue(transactionManager.status(txId).isEmpty());
        assertEquals(0, context.getPendingSize());
        assertTrue(context.getElementStates().isEmpty());
    }

    @Test
    @DisplayName("回滚后事务不可再使用，未知事务报错")
    void testRollback() {
        String txId = beginWithThreeOperations();

        transactionManager.rollback(txId);

        assertTrue(transactionManager.status(txId).isEmpty());
        assertThrows(TransactionException.class, () -> transactionManager.rollback(txId));
        assertThrows(TransactionException.class, () -> transactionManager.commit(txId));
        assertThrows(TransactionException.class,
            () -> transactionManager.add(txId, op("op9", OperationType.MOVE, "e1", "user1", 9).build()));
        assertEquals(0, context.getPendingSize());
    }

    @Test
    @DisplayName("超时未提交的事务被清理")
    void testSweepStaleTransactions() {
        String stale = transactionManager.begin(context, "user1");

        assertEquals(0, transactionManager.sweepStaleTransactions(Instant.now()));
        assertEquals(1, transactionManager.sweepStaleTransactions(Instant.now().plusSeconds(600)));
        assertTrue(transactionManager.status(stale).isEmpty());
    }
}
