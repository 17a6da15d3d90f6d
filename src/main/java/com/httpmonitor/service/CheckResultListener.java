package com.httpmonitor.service;

import com.httpmonitor.model.HealthCheck;
import com.httpmonitor.model.Target;

public interface CheckResultListener {
    void onCheck(Target target, HealthCheck check);
}
