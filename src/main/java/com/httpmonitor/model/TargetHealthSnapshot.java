package com.httpmonitor.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

public class TargetHealthSnapshot {
    private final String name;
    private final String url;
    private final HealthStatus status;
    private final int consecutiveFailures;
    private final long totalChecks;
    private final long successfulChecks;
    private final double uptimePercentage;
    private final Duration averageResponseTime;
    private final Duration minResponseTime;
    private final Duration maxResponseTime;
    private final Instant lastCheck;
    private final double healthScore;
    private final List<HealthCheck> recentChecks;

    public TargetHealthSnapshot(String name, String url, HealthStatus status, int consecutiveFailures,
                                long totalChecks, long successfulChecks, double uptimePercentage,
                                Duration averageResponseTime, Duration minResponseTime,
                                Duration maxResponseTime, Instant lastCheck, double healthScore,
                                List<HealthCheck> recentChecks) {
        this.name = name;
        this.url = url;
        this.status = status;
        this.consecutiveFailures = consecutiveFailures;
        this.totalChecks = totalChecks;
        this.successfulChecks = successfulChecks;
        this.uptimePercentage = uptimePercentage;
        this.averageResponseTime = averageResponseTime;
        this.minResponseTime = minResponseTime;
        this.maxResponseTime = maxResponseTime;
        this.lastCheck = lastCheck;
        this.healthScore = healthScore;
        this.recentChecks = List.copyOf(recentChecks);
    }

    public String getName() {
        return name;
    }

    public String getUrl() {
        return url;
    }

    public HealthStatus getStatus() {
        return status;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public long getTotalChecks() {
        return totalChecks;
    }

    public long getSuccessfulChecks() {
        return successfulChecks;
    }

    public double getUptimePercentage() {
        return uptimePercentage;
    }

    @JsonIgnore
    public Duration getAverageResponseTime() {
        return averageResponseTime;
    }

    public long getAverageResponseTimeMs() {
        return averageResponseTime.toMillis();
    }

    @JsonIgnore
    public Duration getMinResponseTime() {
        return minResponseTime;
    }

    public Long getMinResponseTimeMs() {
        return minResponseTime == null ? null : minResponseTime.toMillis();
    }

    @JsonIgnore
    public Duration getMaxResponseTime() {
        return maxResponseTime;
    }

    public long getMaxResponseTimeMs() {
        return maxResponseTime.toMillis();
    }

    public Instant getLastCheck() {
        return lastCheck;
    }

    public double getHealthScore() {
        return healthScore;
    }

    @JsonIgnore
    public List<HealthCheck> getRecentChecks() {
        return recentChecks;
    }
}
