package com.httpmonitor.model;

public enum TriggerType {
    CONSECUTIVE_FAILURES,
    RESPONSE_TIME_MS,
    HEALTH_SCORE_BELOW,
    CERT_EXPIRING_DAYS
}
