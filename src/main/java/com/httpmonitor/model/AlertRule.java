package com.httpmonitor.model;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

public class AlertRule {
    private final String name;
    private final String webhookUrl;
    private final List<AlertTrigger> triggers;
    private final Duration cooldown;

    public AlertRule(String name, String webhookUrl, List<AlertTrigger> triggers, Duration cooldown) {
        this.name = Objects.requireNonNull(name, "name");
        this.webhookUrl = Objects.requireNonNull(webhookUrl, "webhookUrl");
        this.triggers = triggers == null ? List.of() : List.copyOf(triggers);
        this.cooldown = cooldown == null ? Duration.ZERO : cooldown;
    }

    public String getName() {
        return name;
    }

    public String getWebhookUrl() {
        return webhookUrl;
    }

    public List<AlertTrigger> getTriggers() {
        return triggers;
    }

    public Duration getCooldown() {
        return cooldown;
    }

    public boolean isTriggeredBy(HealthCheck check, TargetHealthSnapshot health) {
        for (AlertTrigger trigger : triggers) {
            if (trigger.matches(check, health)) {
                return true;
            }
        }
        return false;
    }
}
