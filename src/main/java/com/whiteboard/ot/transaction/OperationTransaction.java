package com.whiteboard.ot.transaction;

import com.whiteboard.ot.model.Operation;
import com.whiteboard.ot.transform.TransformContext;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 一组需要原子提交的操作
 */
@Getter
public class OperationTransaction {

    private final String id;
    private final TransformContext context;
    private final String userId;
    private final Instant createdAt;
    private final List<Operation> operations = new ArrayList<>();
    private TransactionStatus status = TransactionStatus.PENDING;

    OperationTransaction(String id, TransformContext context, String userId, Instant createdAt) {
        this.id = id;
        this.context = context;
        this.userId = userId;
        this.createdAt = createdAt;
    }

    synchronized List<Operation> snapshotOperations() {
        return List.copyOf(operations);
    }

    synchronized void add(Operation operation) {
        operations.add(operation);
    }

    synchronized void status(TransactionStatus status) {
        this.status = status;
    }

    public synchronized TransactionStatus getStatus() {
        return status;
    }
}
