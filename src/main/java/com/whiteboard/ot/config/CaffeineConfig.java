package com.whiteboard.ot.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.whiteboard.ot.model.TransformResult;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine 本地缓存配置
 */
@Configuration
public class CaffeineConfig {

    private static final Logger log = LoggerFactory.getLogger(CaffeineConfig.class);

    /**
     * transform 结果缓存，key 为 canvasId:operationId
     * 传输层重复投递同一操作时直接返回首次结果
     */
    @Bean("transformResultCache")
    public Cache<String, TransformResult> transformResultCache(MeterRegistry meterRegistry,
                                                               OtEngineProperties properties) {
        OtEngineProperties.CacheConfig config = properties.getCache();
        Cache<String, TransformResult> cache = Caffeine.newBuilder()
            .maximumSize(config.getMaximumSize())
            .expireAfterWrite(config.getExpireAfterWriteSeconds(), TimeUnit.SECONDS)
            .recordStats()
            .removalListener((key, value, cause) -> {
                if (cause == RemovalCause.SIZE) {
                    log.debug("Transform result evicted due to size: key={}", key);
                }
            })
            .build();

        CaffeineCacheMetrics.monitor(meterRegistry, cache, "transform_result_cache");

        log.info("Transform result cache initialized: maximumSize={}, expireAfterWrite={}s",
            config.getMaximumSize(), config.getExpireAfterWriteSeconds());

        return cache;
    }
}
