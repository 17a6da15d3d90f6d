package com.httpmonitor.service;

import com.httpmonitor.model.AlertRule;
import com.httpmonitor.model.HealthCheck;
import com.httpmonitor.model.Target;
import com.httpmonitor.model.TargetHealthSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public class AlertEvaluator {
    private static final Logger logger = LoggerFactory.getLogger(AlertEvaluator.class);

    private final List<AlertRule> rules;
    private final CooldownLedger cooldowns;
    private final AlertNotifier notifier;
    private final Clock clock;

    public AlertEvaluator(List<AlertRule> rules, CooldownLedger cooldowns, AlertNotifier notifier, Clock clock) {
        this.rules = List.copyOf(rules);
        this.cooldowns = cooldowns;
        this.notifier = notifier;
        this.clock = clock;
    }

    public List<AlertRule> evaluate(Target target, HealthCheck check, TargetHealthSnapshot health) {
        List<AlertRule> dispatched = new ArrayList<>();
        for (AlertRule rule : rules) {
            if (!rule.isTriggeredBy(check, health)) {
                continue;
            }
            Instant now = clock.instant();
            if (!cooldowns.tryAcquire(rule.getName(), target.getName(), rule.getCooldown(), now)) {
                logger.debug("Alert {} for {} suppressed by cooldown", rule.getName(), target.getName());
                continue;
            }
            logger.info("Alert {} fired for {}", rule.getName(), target.getName());
            notifier.dispatch(rule, target, check);
            dispatched.add(rule);
        }
        return dispatched;
    }
}
