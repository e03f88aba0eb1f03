package com.neowatch.alert.scheduler;

import com.neowatch.alert.evaluator.AlertCycleReport;
import com.neowatch.alert.evaluator.AlertEvaluator;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;

/**
 * Fixed-interval driver for {@link AlertEvaluator#runAlertCycle()}.
 *
 * <p>At most one cycle runs at a time: a tick that fires while a cycle is still
 * executing is skipped, not queued. {@link #stop()} halts the ticks and completes once
 * the cycle in progress, if any, has finished. Cycle errors are logged and the loop
 * keeps going.
 */
@Component
public class AlertScheduler {

    private static final Logger log = LoggerFactory.getLogger(AlertScheduler.class);

    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    private final AlertEvaluator evaluator;
    private final boolean enabled;
    private final Duration initialDelay;
    private final Duration interval;

    // running, stopping and cycleDone change together under this lock
    private final Object lifecycle = new Object();
    private boolean running;
    private boolean stopping;
    private Sinks.Empty<Void> cycleDone;
    private volatile Disposable ticks;

    public AlertScheduler(AlertEvaluator evaluator,
                          @Value("${neo.alerts.enabled:true}") boolean enabled,
                          @Value("${neo.alerts.initial-delay-seconds:10}") long initialDelaySeconds,
                          @Value("${neo.alerts.interval-seconds:60}") long intervalSeconds) {
        if (intervalSeconds <= 0) {
            throw new IllegalArgumentException("interval-seconds must be > 0, got " + intervalSeconds);
        }
        this.evaluator    = evaluator;
        this.enabled      = enabled;
        this.initialDelay = Duration.ofSeconds(Math.max(0, initialDelaySeconds));
        this.interval     = Duration.ofSeconds(intervalSeconds);
    }

    @PostConstruct
    public synchronized void start() {
        if (!enabled) {
            log.info("ALERT_SCHEDULER_DISABLED");
            return;
        }
        if (ticks != null) {
            return;
        }
        synchronized (lifecycle) {
            stopping = false;
        }
        log.info("ALERT_SCHEDULER_STARTED initialDelaySeconds={} intervalSeconds={}",
                 initialDelay.toSeconds(), interval.toSeconds());

        ticks = Flux.interval(initialDelay, interval)
            .subscribe(
                tick -> tick().subscribe(),
                err  -> log.error("ALERT_SCHEDULER_TICK_ERROR", err)
            );
    }

    /**
     * Runs one cycle unless one is already in progress or the scheduler is stopping, in
     * which case it completes empty.
     */
    Mono<AlertCycleReport> tick() {
        return Mono.defer(() -> {
            Sinks.Empty<Void> done;
            synchronized (lifecycle) {
                if (stopping) {
                    return Mono.empty();
                }
                if (running) {
                    log.warn("ALERT_TICK_SKIPPED reason=cycle_in_progress");
                    return Mono.empty();
                }
                running = true;
                done = Sinks.empty();
                cycleDone = done;
            }

            long startedAt = System.currentTimeMillis();
            return evaluator.runAlertCycle()
                .doOnNext(report -> log.info(
                    "ALERT_CYCLE rules={} triggered={} suppressed={} unmatched={} belowThreshold={} failed={} skippedNoRealData={} feedStatus={} latencyMs={}",
                    report.rulesChecked(), report.triggered(), report.suppressedByCooldown(),
                    report.unmatched(), report.belowThreshold(), report.failed(),
                    report.skippedNoRealData(), report.feedStatus(),
                    System.currentTimeMillis() - startedAt))
                .onErrorResume(e -> {
                    log.error("ALERT_CYCLE_FAILED", e);
                    return Mono.empty();
                })
                .doFinally(signal -> {
                    synchronized (lifecycle) {
                        cycleDone = null;
                        running = false;
                    }
                    done.tryEmitEmpty();
                });
        });
    }

    /**
     * Stops further ticks. The returned Mono completes when the cycle in progress has
     * finished, or immediately when none is running.
     */
    public Mono<Void> stop() {
        Sinks.Empty<Void> done;
        synchronized (lifecycle) {
            stopping = true;
            done = cycleDone;
        }
        synchronized (this) {
            if (ticks != null) {
                ticks.dispose();
                ticks = null;
            }
        }
        if (done == null) {
            return Mono.empty();
        }
        log.info("ALERT_SCHEDULER_STOPPING waiting for cycle in progress");
        return done.asMono();
    }

    @PreDestroy
    public void shutdown() {
        stop()
            .timeout(SHUTDOWN_TIMEOUT, Mono.fromRunnable(() ->
                log.warn("ALERT_SCHEDULER_STOP_TIMEOUT timeoutSeconds={}", SHUTDOWN_TIMEOUT.toSeconds())))
            .block();
        log.info("ALERT_SCHEDULER_STOPPED");
    }

    boolean isRunning() {
        synchronized (lifecycle) {
            return running;
        }
    }
}
