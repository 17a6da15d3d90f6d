package com.httpmonitor.model;

import java.util.Objects;

public class AlertTrigger {
    private final TriggerType type;
    private final double threshold;

    public AlertTrigger(TriggerType type, double threshold) {
        this.type = Objects.requireNonNull(type, "type");
        this.threshold = threshold;
    }

    public static AlertTrigger consecutiveFailures(int count) {
        return new AlertTrigger(TriggerType.CONSECUTIVE_FAILURES, count);
    }

    public static AlertTrigger responseTimeMs(long thresholdMs) {
        return new AlertTrigger(TriggerType.RESPONSE_TIME_MS, thresholdMs);
    }

    public static AlertTrigger healthScoreBelow(double score) {
        return new AlertTrigger(TriggerType.HEALTH_SCORE_BELOW, score);
    }

    public static AlertTrigger certExpiringDays(int days) {
        return new AlertTrigger(TriggerType.CERT_EXPIRING_DAYS, days);
    }

    public TriggerType getType() {
        return type;
    }

    public double getThreshold() {
        return threshold;
    }

    public boolean matches(HealthCheck check, TargetHealthSnapshot health) {
        switch (type) {
            case RESPONSE_TIME_MS:
                return check.getResponseTimeMs() > threshold;
            case CERT_EXPIRING_DAYS:
                return check.getCertExpiresDays() != null && check.getCertExpiresDays() <= threshold;
            case CONSECUTIVE_FAILURES:
                return health != null && health.getConsecutiveFailures() >= threshold;
            case HEALTH_SCORE_BELOW:
                return health != null && health.getHealthScore() < threshold;
            default:
                return false;
        }
    }

    @Override
    public String toString() {
        return type + "(" + threshold + ")";
    }
}
