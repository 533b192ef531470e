package com.whiteboard.ot.exception;

import java.util.List;

/**
 * 操作校验失败（致命，调用方不应原样重试）
 */
public class OperationValidationException extends OtEngineException {

    private final String operationId;
    private final List<String> violations;

    public OperationValidationException(String operationId, List<String> violations) {
        super("Invalid operation " + operationId + ": " + String.join("; ", violations));
        this.operationId = operationId;
        this.violations = List.copyOf(violations);
    }

    public String getOperationId() {
        return operationId;
    }

    public List<String> getViolations() {
        return violations;
    }
}
