package com.httpmonitor.service;

import com.httpmonitor.model.HealthCheck;
import com.httpmonitor.model.Target;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingCheckResultListener implements CheckResultListener {
    private static final Logger logger = LoggerFactory.getLogger(LoggingCheckResultListener.class);

    @Override
    public void onCheck(Target target, HealthCheck check) {
        String statusCode = check.getStatusCode() == null ? "ERROR" : String.valueOf(check.getStatusCode());
        logger.info("{} {} | {} | {}ms", check.isSuccess() ? "✓" : "✗", target.getName(), statusCode,
            check.getResponseTimeMs());
        if (check.getError() != null) {
            logger.info("    Error: {}", check.getError());
        }
    }
}
