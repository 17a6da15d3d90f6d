package com.httpmonitor.service;

import com.httpmonitor.model.HealthCheck;
import com.httpmonitor.model.HealthStatus;
import com.httpmonitor.model.TargetHealthSnapshot;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;

public class TargetHealth {
    public static final int HISTORY_CAPACITY = 100;

    private final String name;
    private final String url;
    private final Deque<HealthCheck> recentChecks = new ArrayDeque<>(HISTORY_CAPACITY);

    private HealthStatus status = HealthStatus.UNKNOWN;
    private int consecutiveFailures;
    private long totalChecks;
    private long successfulChecks;
    private double uptimePercentage;
    private long totalResponseNanos;
    private Duration minResponseTime;
    private Duration maxResponseTime = Duration.ZERO;
    private Instant lastCheck;
    private double healthScore = 1.0;

    public TargetHealth(String name, String url) {
        this.name = name;
        this.url = url;
    }

    public synchronized TargetHealthSnapshot update(HealthCheck check) {
        totalChecks++;
        lastCheck = check.getTimestamp();

        if (check.isSuccess()) {
            successfulChecks++;
            consecutiveFailures = 0;
        } else {
            consecutiveFailures++;
        }

        Duration responseTime = check.getResponseTime();
        if (minResponseTime == null || responseTime.compareTo(minResponseTime) < 0) {
            minResponseTime = responseTime;
        }
        if (responseTime.compareTo(maxResponseTime) > 0) {
            maxResponseTime = responseTime;
        }
        totalResponseNanos += responseTime.toNanos();

        uptimePercentage = 100.0 * successfulChecks / totalChecks;
        status = classify(consecutiveFailures, uptimePercentage);
        healthScore = score(uptimePercentage, averageResponseTime());

        recentChecks.addLast(check);
        while (recentChecks.size() > HISTORY_CAPACITY) {
            recentChecks.removeFirst();
        }
        return snapshotLocked();
    }

    public synchronized TargetHealthSnapshot snapshot() {
        return snapshotLocked();
    }

    public String getName() {
        return name;
    }

    private TargetHealthSnapshot snapshotLocked() {
        return new TargetHealthSnapshot(name, url, status, consecutiveFailures, totalChecks, successfulChecks,
            uptimePercentage, averageResponseTime(), minResponseTime, maxResponseTime, lastCheck, healthScore,
            new ArrayList<>(recentChecks));
    }

    private Duration averageResponseTime() {
        if (totalChecks == 0) {
            return Duration.ZERO;
        }
        return Duration.ofNanos(totalResponseNanos / totalChecks);
    }

    static HealthStatus classify(int consecutiveFailures, double uptimePercentage) {
        if (consecutiveFailures >= 3) {
            return HealthStatus.UNHEALTHY;
        }
        if (consecutiveFailures > 0) {
            return HealthStatus.DEGRADED;
        }
        if (uptimePercentage >= 99.0) {
            return HealthStatus.HEALTHY;
        }
        if (uptimePercentage >= 95.0) {
            return HealthStatus.DEGRADED;
        }
        return HealthStatus.UNHEALTHY;
    }

    static double responseTimeScore(Duration averageResponseTime) {
        long millis = averageResponseTime.toMillis();
        if (millis <= 500) {
            return 1.0;
        }
        if (millis <= 2000) {
            return 0.8;
        }
        if (millis <= 5000) {
            return 0.5;
        }
        return 0.2;
    }

    static double score(double uptimePercentage, Duration averageResponseTime) {
        double value = 0.7 * (uptimePercentage / 100.0) + 0.3 * responseTimeScore(averageResponseTime);
        return Math.max(0.0, Math.min(1.0, value));
    }
}
