package com.whiteboard.ot.transaction;

public enum TransactionStatus {
    PENDING,
    COMMITTED,
    ROLLED_BACK
}
