package com.httpmonitor.service;

import com.httpmonitor.model.AlertRule;
import com.httpmonitor.model.HealthCheck;
import com.httpmonitor.model.Target;

public interface AlertNotifier {
    /**
     * Dispatches a notification without blocking on delivery. Must not throw.
     */
    void dispatch(AlertRule rule, Target target, HealthCheck check);
}
