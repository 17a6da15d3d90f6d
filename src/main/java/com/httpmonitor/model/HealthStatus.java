package com.httpmonitor.model;

public enum HealthStatus {
    HEALTHY("Healthy"),
    DEGRADED("Degraded"),
    UNHEALTHY("Unhealthy"),
    UNKNOWN("Unknown");

    private final String label;

    HealthStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
