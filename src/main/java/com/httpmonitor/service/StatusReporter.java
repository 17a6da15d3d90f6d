package com.httpmonitor.service;

import com.httpmonitor.model.TargetHealthSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

public class StatusReporter {
    private static final Logger logger = LoggerFactory.getLogger(StatusReporter.class);
    private static final String ROW_FORMAT = "%-20s %-10s %-10s %-15s %-10s";

    public void logSummary(List<TargetHealthSnapshot> snapshots) {
        logger.info("Status Summary:\n{}", render(snapshots));
    }

    public void logFinalSummary(List<TargetHealthSnapshot> snapshots) {
        logger.info("Final Summary:\n{}", render(snapshots));
    }

    public String render(List<TargetHealthSnapshot> snapshots) {
        StringBuilder table = new StringBuilder();
        table.append(String.format(Locale.ROOT, ROW_FORMAT, "Target", "Status", "Uptime", "Avg Response", "Health"))
            .append('\n')
            .append("─".repeat(75))
            .append('\n');
        for (TargetHealthSnapshot snapshot : snapshots) {
            table.append(String.format(Locale.ROOT, ROW_FORMAT,
                    snapshot.getName(),
                    snapshot.getStatus().getLabel(),
                    String.format(Locale.ROOT, "%.1f%%", snapshot.getUptimePercentage()),
                    snapshot.getAverageResponseTimeMs() + "ms",
                    String.format(Locale.ROOT, "%.1f", snapshot.getHealthScore() * 100.0)))
                .append('\n');
        }
        return table.toString();
    }
}
