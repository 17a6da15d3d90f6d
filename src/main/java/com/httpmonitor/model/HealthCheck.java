package com.httpmonitor.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Duration;
import java.time.Instant;

public class HealthCheck {
    private final String target;
    private final Instant timestamp;
    private final boolean success;
    private final Integer statusCode;
    private final Duration responseTime;
    private final ErrorCategory errorCategory;
    private final String error;
    private final Integer certExpiresDays;

    public HealthCheck(String target, Instant timestamp, boolean success, Integer statusCode,
                       Duration responseTime, ErrorCategory errorCategory, String error,
                       Integer certExpiresDays) {
        this.target = target;
        this.timestamp = timestamp;
        this.success = success;
        this.statusCode = statusCode;
        this.responseTime = responseTime;
        this.errorCategory = errorCategory;
        this.error = error;
        this.certExpiresDays = certExpiresDays;
    }

    public String getTarget() {
        return target;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public boolean isSuccess() {
        return success;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    @JsonIgnore
    public Duration getResponseTime() {
        return responseTime;
    }

    public long getResponseTimeMs() {
        return responseTime.toMillis();
    }

    public ErrorCategory getErrorCategory() {
        return errorCategory;
    }

    public String getError() {
        return error;
    }

    public Integer getCertExpiresDays() {
        return certExpiresDays;
    }

    @Override
    public String toString() {
        return "HealthCheck{target=" + target + ", success=" + success + ", statusCode=" + statusCode
            + ", responseTimeMs=" + getResponseTimeMs() + ", error=" + error + "}";
    }
}
