package com.httpmonitor.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.httpmonitor.model.HealthCheck;
import com.httpmonitor.model.HealthStatus;
import com.httpmonitor.model.HealthSummaryResponse;
import com.httpmonitor.model.Target;
import com.httpmonitor.model.TargetHealthSnapshot;
import com.httpmonitor.transport.JavaHttpTransport;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

@Service
public class MonitorService {
    private static final Logger logger = LoggerFactory.getLogger(MonitorService.class);
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);

    private final List<Target> targets;
    private final Map<String, TargetHealth> healthByTarget;
    private final Prober prober;
    private final AlertEvaluator alertEvaluator;
    private final CheckResultListener listener;
    private final StatusReporter reporter;
    private final Clock clock;
    private final CancellationToken cancellation = new CancellationToken();
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean stopped = new AtomicBoolean();
    private ExecutorService pollExecutor;

    @Autowired
    public MonitorService(MonitorProperties properties, Clock clock) {
        this(TargetRegistry.from(properties),
            new Prober(new JavaHttpTransport(properties.isFollowRedirects()), new UserAgentProvider(),
                new UnknownCertificateExpiryInspector(), clock),
            new AlertEvaluator(properties.toAlertRules(), new CooldownLedger(),
                new WebhookAlertNotifier(new ObjectMapper()), clock),
            new LoggingCheckResultListener(),
            new StatusReporter(),
            clock);
    }

    public MonitorService(TargetRegistry registry, Prober prober, AlertEvaluator alertEvaluator,
                          CheckResultListener listener, StatusReporter reporter, Clock clock) {
        this.targets = registry.getTargets();
        this.prober = prober;
        this.alertEvaluator = alertEvaluator;
        this.listener = listener;
        this.reporter = reporter;
        this.clock = clock;

        Map<String, TargetHealth> health = new LinkedHashMap<>();
        for (Target target : targets) {
            health.put(target.getName(), new TargetHealth(target.getName(), target.getUrl()));
        }
        this.healthByTarget = Collections.unmodifiableMap(health);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        start();
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        logger.info("Starting HTTP monitor for {} targets", targets.size());
        if (targets.isEmpty()) {
            logger.warn("No targets configured, nothing to monitor");
            return;
        }

        pollExecutor = Executors.newFixedThreadPool(targets.size());
        for (Target target : targets) {
            pollExecutor.execute(new PollLoop(target, healthByTarget.get(target.getName()), prober,
                alertEvaluator, listener, cancellation));
        }
        pollExecutor.shutdown();
    }

    @Scheduled(fixedRateString = "${monitor.summary-interval-ms:30000}",
               initialDelayString = "${monitor.summary-interval-ms:30000}")
    public void reportStatus() {
        if (isRunning()) {
            reporter.logSummary(snapshots());
        }
    }

    @PreDestroy
    public void stop() {
        if (!started.get() || !stopped.compareAndSet(false, true)) {
            return;
        }
        logger.info("Stopping HTTP monitor");
        cancellation.cancel();

        if (pollExecutor != null) {
            try {
                if (!pollExecutor.awaitTermination(shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    logger.warn("Poll loops did not stop within {}, interrupting", shutdownTimeout());
                    pollExecutor.shutdownNow();
                    if (!pollExecutor.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                        logger.error("Poll loops still running after interrupt");
                    }
                }
            } catch (InterruptedException ex) {
                pollExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        reporter.logFinalSummary(snapshots());
    }

    public boolean isRunning() {
        return started.get() && !cancellation.isCancelled();
    }

    public boolean isTerminated() {
        return pollExecutor == null ? stopped.get() : pollExecutor.isTerminated();
    }

    public List<Target> listTargets() {
        return targets;
    }

    public List<TargetHealthSnapshot> snapshots() {
        List<TargetHealthSnapshot> snapshots = new ArrayList<>();
        for (TargetHealth health : healthByTarget.values()) {
            snapshots.add(health.snapshot());
        }
        return snapshots;
    }

    public TargetHealthSnapshot snapshot(String targetName) {
        TargetHealth health = healthByTarget.get(targetName);
        return health == null ? null : health.snapshot();
    }

    public List<HealthCheck> recentChecks(String targetName) {
        TargetHealthSnapshot snapshot = snapshot(targetName);
        return snapshot == null ? null : snapshot.getRecentChecks();
    }

    public HealthSummaryResponse getSummary() {
        Map<HealthStatus, Long> counts = new EnumMap<>(HealthStatus.class);
        for (TargetHealthSnapshot snapshot : snapshots()) {
            counts.merge(snapshot.getStatus(), 1L, Long::sum);
        }
        return new HealthSummaryResponse(counts, targets.size(), Instant.now(clock));
    }

    private Duration shutdownTimeout() {
        Duration longest = Duration.ZERO;
        for (Target target : targets) {
            if (target.getTimeout().compareTo(longest) > 0) {
                longest = target.getTimeout();
            }
        }
        return longest.plus(SHUTDOWN_GRACE);
    }
}
