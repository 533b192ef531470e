package com.whiteboard.ot.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * 操作来源元数据（客户端、会话及自由扩展字段）
 */
@Value
@Builder(toBuilder = true)
public class OperationMetadata {

    String clientId;
    String sessionId;

    @Builder.Default
    Map<String, Object> attributes = Map.of();

    public static OperationMetadata empty() {
        return OperationMetadata.builder().build();
    }
}
