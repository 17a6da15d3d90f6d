package com.httpmonitor.service;

import com.httpmonitor.model.HealthCheck;
import com.httpmonitor.model.Target;
import com.httpmonitor.model.TargetHealthSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

public class PollLoop implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(PollLoop.class);

    private final Target target;
    private final TargetHealth health;
    private final Prober prober;
    private final AlertEvaluator alertEvaluator;
    private final CheckResultListener listener;
    private final CancellationToken cancellation;

    public PollLoop(Target target, TargetHealth health, Prober prober, AlertEvaluator alertEvaluator,
                    CheckResultListener listener, CancellationToken cancellation) {
        this.target = target;
        this.health = health;
        this.prober = prober;
        this.alertEvaluator = alertEvaluator;
        this.listener = listener;
        this.cancellation = cancellation;
    }

    @Override
    public void run() {
        Thread.currentThread().setName("poll-" + target.getName());
        logger.debug("Polling {} every {}", target.getName(), target.getInterval());

        while (!cancellation.isCancelled()) {
            long start = System.nanoTime();
            try {
                runIteration();
            } catch (RuntimeException ex) {
                logger.error("Check of {} failed unexpectedly, continuing with next iteration", target.getName(), ex);
            }

            Duration remaining = target.getInterval().minusNanos(System.nanoTime() - start);
            if (cancellation.isCancelled()) {
                break;
            }
            if (!remaining.isNegative() && !remaining.isZero()) {
                try {
                    if (cancellation.await(remaining)) {
                        break;
                    }
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        logger.debug("Stopped polling {}", target.getName());
    }

    HealthCheck runIteration() {
        HealthCheck check = prober.probe(target);
        if (cancellation.isCancelled() || Thread.currentThread().isInterrupted()) {
            // shutdown began mid-probe; the final summary must not change after it is printed
            logger.debug("Discarding check of {} finished during shutdown", target.getName());
            return check;
        }
        TargetHealthSnapshot snapshot = health.update(check);
        alertEvaluator.evaluate(target, check, snapshot);
        listener.onCheck(target, check);
        return check;
    }
}
