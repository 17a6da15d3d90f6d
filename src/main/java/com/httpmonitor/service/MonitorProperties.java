package com.httpmonitor.service;

import com.httpmonitor.model.AlertRule;
import com.httpmonitor.model.AlertTrigger;
import com.httpmonitor.model.HttpMethod;
import com.httpmonitor.model.TriggerType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@Validated
@ConfigurationProperties(prefix = "monitor")
public class MonitorProperties {
    private Duration defaultTimeout = Duration.ofSeconds(10);
    private Duration defaultInterval = Duration.ofSeconds(60);
    private boolean followRedirects = true;

    @Valid
    private List<TargetProperties> targets = new ArrayList<>();

    @Valid
    private List<AlertProperties> alerts = new ArrayList<>();

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public void setDefaultTimeout(Duration defaultTimeout) {
        this.defaultTimeout = defaultTimeout;
    }

    public Duration getDefaultInterval() {
        return defaultInterval;
    }

    public void setDefaultInterval(Duration defaultInterval) {
        this.defaultInterval = defaultInterval;
    }

    public boolean isFollowRedirects() {
        return followRedirects;
    }

    public void setFollowRedirects(boolean followRedirects) {
        this.followRedirects = followRedirects;
    }

    public List<TargetProperties> getTargets() {
        return targets;
    }

    public void setTargets(List<TargetProperties> targets) {
        this.targets = targets;
    }

    public List<AlertProperties> getAlerts() {
        return alerts;
    }

    public void setAlerts(List<AlertProperties> alerts) {
        this.alerts = alerts;
    }

    public List<AlertRule> toAlertRules() {
        List<AlertRule> rules = new ArrayList<>();
        for (AlertProperties alert : alerts) {
            rules.add(alert.toRule());
        }
        return rules;
    }

    public static class TargetProperties {
        @NotBlank
        private String name;

        @NotBlank
        @Pattern(regexp = "https?://.+", message = "url must start with http:// or https://")
        private String url;

        private HttpMethod method = HttpMethod.GET;

        private Map<String, String> headers = new LinkedHashMap<>();

        private List<Integer> expectedStatus = new ArrayList<>();

        private String expectedContent;

        private Duration timeout;

        private Duration interval;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public HttpMethod getMethod() {
            return method;
        }

        public void setMethod(HttpMethod method) {
            this.method = method;
        }

        public Map<String, String> getHeaders() {
            return headers;
        }

        public void setHeaders(Map<String, String> headers) {
            this.headers = headers;
        }

        public List<Integer> getExpectedStatus() {
            return expectedStatus;
        }

        public void setExpectedStatus(List<Integer> expectedStatus) {
            this.expectedStatus = expectedStatus;
        }

        public String getExpectedContent() {
            return expectedContent;
        }

        public void setExpectedContent(String expectedContent) {
            this.expectedContent = expectedContent;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }
    }

    public static class AlertProperties {
        @NotBlank
        private String name;

        @NotBlank
        @Pattern(regexp = "https?://.+", message = "webhook-url must start with http:// or https://")
        private String webhookUrl;

        @NotEmpty
        @Valid
        private List<TriggerProperties> triggerOn = new ArrayList<>();

        private Duration cooldown = Duration.ofMinutes(30);

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getWebhookUrl() {
            return webhookUrl;
        }

        public void setWebhookUrl(String webhookUrl) {
            this.webhookUrl = webhookUrl;
        }

        public List<TriggerProperties> getTriggerOn() {
            return triggerOn;
        }

        public void setTriggerOn(List<TriggerProperties> triggerOn) {
            this.triggerOn = triggerOn;
        }

        public Duration getCooldown() {
            return cooldown;
        }

        public void setCooldown(Duration cooldown) {
            this.cooldown = cooldown;
        }

        AlertRule toRule() {
            List<AlertTrigger> triggers = new ArrayList<>();
            for (TriggerProperties trigger : triggerOn) {
                triggers.add(new AlertTrigger(trigger.getType(), trigger.getThreshold()));
            }
            return new AlertRule(name, webhookUrl, triggers, cooldown);
        }
    }

    public static class TriggerProperties {
        @NotNull
        private TriggerType type;

        private double threshold;

        public TriggerType getType() {
            return type;
        }

        public void setType(TriggerType type) {
            this.type = type;
        }

        public double getThreshold() {
            return threshold;
        }

        public void setThreshold(double threshold) {
            this.threshold = threshold;
        }
    }
}
