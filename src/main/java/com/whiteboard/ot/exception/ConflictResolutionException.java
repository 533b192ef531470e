package com.whiteboard.ot.exception;

/**
 * 冲突解决失败
 */
public class ConflictResolutionException extends OtEngineException {

    public ConflictResolutionException(String message) {
        super(message);
    }

    public ConflictResolutionException(String message, Throwable cause) {
        super(message, cause);
    }

    public static ConflictResolutionException noOperations(String conflictId) {
        return new ConflictResolutionException("No operations to resolve for conflict " + conflictId);
    }
}
