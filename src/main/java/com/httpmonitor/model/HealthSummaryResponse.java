package com.httpmonitor.model;

import java.time.Instant;
import java.util.Map;

public class HealthSummaryResponse {
    private final Map<HealthStatus, Long> statusCounts;
    private final int targetCount;
    private final Instant lastUpdated;

    public HealthSummaryResponse(Map<HealthStatus, Long> statusCounts, int targetCount, Instant lastUpdated) {
        this.statusCounts = statusCounts;
        this.targetCount = targetCount;
        this.lastUpdated = lastUpdated;
    }

    public Map<HealthStatus, Long> getStatusCounts() {
        return statusCounts;
    }

    public int getTargetCount() {
        return targetCount;
    }

    public Instant getLastUpdated() {
        return lastUpdated;
    }
}
