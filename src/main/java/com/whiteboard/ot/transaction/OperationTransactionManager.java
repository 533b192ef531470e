package com.whiteboard.ot.transaction;

import com.whiteboard.ot.clock.VectorClock;
import com.whiteboard.ot.config.OtEngineProperties;
import com.whiteboard.ot.exception.OperationValidationException;
import com.whiteboard.ot.exception.TransactionException;
import com.whiteboard.ot.model.Operation;
import com.whiteboard.ot.model.OperationType;
import com.whiteboard.ot.model.TransformResult;
import com.whiteboard.ot.transform.OperationTransformer;
import com.whiteboard.ot.transform.TransformContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 操作事务管理
 *
 * begin / add / commit / rollback。提交时先校验全部操作，
 * 开启批处理时合成一个 batch 操作一次转换（单次加锁），否则逐个转换。
 * 超过 stale-after-seconds 未提交的事务由定时任务回滚。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OperationTransactionManager {

    private final OperationTransformer transformer;
    private final OtEngineProperties properties;

    private final Map<String, OperationTransaction> transactions = new ConcurrentHashMap<>();

    public String begin(TransformContext context, String userId) {
        String id = "txn_" + UUID.randomUUID();
        transactions.put(id, new OperationTransaction(id, context, userId, Instant.now()));
        log.info("Transaction started: id={}, canvasId={}, userId={}", id, context.getCanvasId(), userId);
        return id;
    }

    public void add(String transactionId, Operation operation) {
        OperationTransaction transaction = requirePending(transactionId);
        transaction.add(operation);
    }

    public List<TransformResult> commit(String transactionId) {
        OperationTransaction transaction = requirePending(transactionId);
        synchronized (transaction) {
            if (transaction.getStatus() != TransactionStatus.PENDING) {
                throw new TransactionException("Transaction is not pending: " + transactionId);
            }
            List<Operation> operations = transaction.snapshotOperations();
            try {
                operations.forEach(transformer::validate);
            } catch (OperationValidationException e) {
                rollback(transactionId);
                throw new TransactionException("Transaction " + transactionId + " rolled back: " + e.getMessage(), e);
            }

            TransformContext context = transaction.getContext();
            List<TransformResult> results = new ArrayList<>();
            try {
                if (context.isBatchingEnabled() && operations.size() > 1) {
                    results.add(transformer.transform(toBatch(transaction, operations), context));
                } else {
                    for (Operation operation : operations) {
                        results.add(transformer.transform(operation, context));
                    }
                }
            } catch (RuntimeException e) {
                rollback(transactionId);
                throw new TransactionException("Transaction " + transactionId + " failed: " + e.getMessage(), e);
            }

            transaction.status(TransactionStatus.COMMITTED);
            transactions.remove(transactionId);
            log.info("Transaction committed: id={}, operations={}, batched={}",
                transactionId, operations.size(), results.size() == 1 && operations.size() > 1);
            return results;
        }
    }

    public void rollback(String transactionId) {
        OperationTransaction transaction = transactions.remove(transactionId);
        if (transaction == null) {
            throw new TransactionException("Unknown transaction: " + transactionId);
        }
        transaction.status(TransactionStatus.ROLLED_BACK);
        log.info("Transaction rolled back: id={}, operations={}", transactionId, transaction.snapshotOperations().size());
    }

    public Optional<TransactionStatus> status(String transactionId) {
        return Optional.ofNullable(transactions.get(transactionId)).map(OperationTransaction::getStatus);
    }

    public int activeTransactionCount() {
        return transactions.size();
    }

    /**
     * 定时回滚长时间未提交的事务
     */
    @Scheduled(fixedDelay = 60000)
    public void sweepStaleTransactions() {
        sweepStaleTransactions(Instant.now());
    }

    int sweepStaleTransactions(Instant now) {
        Duration staleAfter = Duration.ofSeconds(properties.getTransaction().getStaleAfterSeconds());
        int swept = 0;
        for (OperationTransaction transaction : List.copyOf(transactions.values())) {
            if (transaction.getCreatedAt().plus(staleAfter).isBefore(now)
                && transactions.remove(transaction.getId(), transaction)) {
                transaction.status(TransactionStatus.ROLLED_BACK);
                swept++;
                log.warn("Stale transaction rolled back: id={}, age={}s",
                    transaction.getId(), Duration.between(transaction.getCreatedAt(), now).getSeconds());
            }
        }
        return swept;
    }

    private OperationTransaction requirePending(String transactionId) {
        OperationTransaction transaction = transactions.get(transactionId);
        if (transaction == null) {
            throw new TransactionException("Unknown transaction: " + transactionId);
        }
        if (transaction.getStatus() != TransactionStatus.PENDING) {
            throw new TransactionException("Transaction is not pending: " + transactionId);
        }
        return transaction;
    }

    private static Operation toBatch(OperationTransaction transaction, List<Operation> operations) {
        VectorClock clock = VectorClock.empty();
        long lamport = 0;
        for (Operation op : operations) {
            clock = clock.merge(op.getVectorClock());
            lamport = Math.max(lamport, op.getLamportTimestamp());
        }
        return Operation.builder()
            .id(transaction.getId())
            .type(OperationType.BATCH.value())
            .elementId(operations.get(0).getElementId())
            .userId(transaction.getUserId())
            .timestamp(Instant.now())
            .vectorClock(clock)
            .lamportTimestamp(lamport)
            .data(Map.of(Operation.NESTED_OPERATIONS_KEY, List.copyOf(operations)))
            .build();
    }
}
