package com.flagship.bill_settlement.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for settlement runs.
 *
 * Metrics exposed:
 * - settlements.completed: runs that produced a settlement, tagged by currency and verdict
 * - settlements.rejected: runs that failed, tagged by error type
 * - settlements.residual_adjusted: runs where a participant absorbed a residual
 * - settlements.latency: run duration, tagged by entry point
 */
@Component
public class SettlementMetrics {

    private final MeterRegistry registry;

    public SettlementMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSettlementCompleted(String currency, boolean valid) {
        registry.counter("settlements.completed",
                "currency", sanitizeTag(currency),
                "verdict", valid ? "valid" : "invalid"
        ).increment();
    }

    public void recordSettlementRejected(String errorType) {
        registry.counter("settlements.rejected",
                "error", sanitizeTag(errorType)
        ).increment();
    }

    public void recordResidualAdjusted(String currency) {
        registry.counter("settlements.residual_adjusted",
                "currency", sanitizeTag(currency)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("settlements.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
