package com.whiteboard.ot.exception;

/**
 * 引擎异常基类
 */
public class OtEngineException extends RuntimeException {

    public OtEngineException(String message) {
        super(message);
    }

    public OtEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
