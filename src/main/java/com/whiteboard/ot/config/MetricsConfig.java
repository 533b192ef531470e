package com.whiteboard.ot.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.atomic.AtomicLong;

/**
 * SLO 指标配置
 * 单次 transform 超出延迟预算即记一次违规
 */
@Configuration
public class MetricsConfig {

    private static final Logger log = LoggerFactory.getLogger(MetricsConfig.class);

    private final MeterRegistry meterRegistry;
    private final OtEngineProperties properties;

    private final AtomicLong sloViolationCount = new AtomicLong(0);

    public MetricsConfig(MeterRegistry meterRegistry, OtEngineProperties properties) {
        this.meterRegistry = meterRegistry;
        this.properties = properties;
    }

    @PostConstruct
    public void initMetrics() {
        registerSloMetrics();
        log.info("OT engine SLO metrics initialized: latencyBudget={}ms", properties.getLatencyBudgetMs());
    }

    private void registerSloMetrics() {
        Gauge.builder("whiteboard.ot.slo.latency_budget_ms", properties, OtEngineProperties::getLatencyBudgetMs)
            .description("Latency budget for a single transform in milliseconds")
            .register(meterRegistry);

        Gauge.builder("whiteboard.ot.slo.violation.count", sloViolationCount, AtomicLong::get)
            .description("SLO violation count")
            .register(meterRegistry);
    }

    /**
     * 记录 SLO 违规
     */
    public void recordSloViolation(String type) {
        sloViolationCount.incrementAndGet();
        meterRegistry.counter("whiteboard.ot.slo.violation", "type", type).increment();
    }

    public long getSloViolationCount() {
        return sloViolationCount.get();
    }
}
