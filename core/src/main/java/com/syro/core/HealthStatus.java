package com.syro.core;

import java.time.Instant;
import java.util.Map;

/**
 * @param status     {@code healthy}, {@code degraded} or {@code stopped}
 * @param components component name → {@code operational}, {@code degraded} or {@code stopped}
 */
public record HealthStatus(String status,
                           Map<String, String> components,
                           long uptimeMs,
                           long heapUsedBytes,
                           long heapMaxBytes,
                           Instant timestamp) {

    public boolean isHealthy() {
        return "healthy".equals(status);
    }
}
