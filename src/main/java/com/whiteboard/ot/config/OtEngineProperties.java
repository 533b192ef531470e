package com.whiteboard.ot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 白板 OT 引擎配置属性
 *
 * 距离、尺寸均为画布单位，时间均为毫秒（特别注明除外）。
 */
@Data
@Component
@ConfigurationProperties(prefix = "whiteboard.ot")
public class OtEngineProperties {

    /** 单次 transform 的延迟预算（SLO） */
    private long latencyBudgetMs = 500;

    /** 该时间（秒）内提交过操作的用户计为活跃用户 */
    private long activeUserWindowSeconds = 300;

    private DetectionConfig detection = new DetectionConfig();
    private ResolutionConfig resolution = new ResolutionConfig();
    private ThrottlingConfig throttling = new ThrottlingConfig();
    private CacheConfig cache = new CacheConfig();
    private TransactionConfig transaction = new TransactionConfig();

    @Data
    public static class DetectionConfig {
        private long temporalWindowMs = 1000;
        private long simultaneousThresholdMs = 100;
        private double spatialProximity = 50;
        private double gridCellSize = 100;
        /** 每个网格桶最多参与空间比对的最近操作数（同元素桶不截断） */
        private int maxCandidatesPerBucket = 256;
        /** 同一元素并发操作数达到该值时严重度升一级 */
        private int escalationThreshold = 3;
        /** HIGH 冲突且并发数达到该值时交由人工处理 */
        private int manualEscalationThreshold = 8;
    }

    @Data
    public static class ResolutionConfig {
        /** 空间冲突落败时的位置偏移 */
        private double spatialOffset = 10;
    }

    @Data
    public static class ThrottlingConfig {
        private boolean enabled = true;
        /** 建议操作间隔（毫秒），数值越大背压越强 */
        private long initialRate = 100;
        private long floor = 10;
        private long ceiling = 10000;
        private long targetLatencyMs = 500;
        private double increaseFactor = 1.2;
        private double decayFactor = 0.9;
    }

    @Data
    public static class CacheConfig {
        /** 重复投递去重 */
        private boolean dedupeEnabled = true;
        private long maximumSize = 5000;
        private long expireAfterWriteSeconds = 300;
    }

    @Data
    public static class TransactionConfig {
        private long staleAfterSeconds = 300;
    }
}
