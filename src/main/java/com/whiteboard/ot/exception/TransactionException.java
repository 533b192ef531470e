package com.whiteboard.ot.exception;

public class TransactionException extends OtEngineException {

    public TransactionException(String message) {
        super(message);
    }

    public TransactionException(String message, Throwable cause) {
        super(message, cause);
    }
}
