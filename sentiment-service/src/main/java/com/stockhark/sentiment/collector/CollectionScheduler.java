package com.stockhark.sentiment.collector;

import com.stockhark.sentiment.collector.CollectionCycle.CycleResult;
import com.stockhark.sentiment.config.CollectionProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs {@link CollectionCycle} periodically as a cancellable task.
 *
 * <pre>
 *   start() → interval(initialDelay, period) → cycle → cycle → ...   stop() → dispose
 * </pre>
 *
 * <p>The loop is one {@link Flux#interval} subscription held in a {@link Disposable}.
 * Ticks that arrive while a cycle is still running are dropped, never queued, and at
 * most one cycle runs at a time across scheduled and on-demand triggers. A failed cycle
 * is logged and counted; the loop keeps going. {@link #stop()} cancels the subscription,
 * which also cancels an in-flight cycle between its reactive steps.
 */
@Component
public class CollectionScheduler {

    private static final Logger log = LoggerFactory.getLogger(CollectionScheduler.class);

    private final CollectionCycle cycle;
    private final CollectionProperties properties;
    private final Clock clock;
    private final Scheduler timer;

    private final AtomicReference<Disposable> subscription = new AtomicReference<>();
    private final AtomicBoolean cycleInProgress   = new AtomicBoolean(false);
    private final AtomicLong    totalCollections  = new AtomicLong();
    private final AtomicLong    totalObservations = new AtomicLong();
    private final AtomicLong    failedCollections = new AtomicLong();
    private volatile LocalDateTime lastCollection;

    @Autowired
    public CollectionScheduler(CollectionCycle cycle, CollectionProperties properties, Clock clock) {
        this(cycle, properties, clock, Schedulers.parallel());
    }

    CollectionScheduler(CollectionCycle cycle, CollectionProperties properties, Clock clock, Scheduler timer) {
        this.cycle      = cycle;
        this.properties = properties;
        this.clock      = clock;
        this.timer      = timer;
    }

    @PostConstruct
    public void autoStart() {
        if (properties.enabled()) {
            start();
        } else {
            log.info("Periodic collection disabled. Use POST /api/v1/sentiment/collect to collect on demand");
        }
    }

    /** @return {@code false} if the loop was already running */
    public boolean start() {
        if (subscription.get() != null) {
            log.info("Collection scheduler already running");
            return false;
        }
        Duration initialDelay = Duration.ofSeconds(properties.initialDelaySeconds());
        Duration period       = Duration.ofMinutes(properties.intervalMinutes());

        Disposable loop = Flux.interval(initialDelay, period, timer)
            .onBackpressureDrop(tick -> log.warn("Collection tick dropped, previous cycle still running. tick={}", tick))
            .concatMap(tick -> runGuarded()
                .onErrorResume(e -> {
                    log.error("Scheduled collection cycle failed, loop continues. tick={}", tick, e);
                    return Mono.empty();
                }), 0)
            .subscribe();

        if (!subscription.compareAndSet(null, loop)) {
            loop.dispose();
            return false;
        }
        log.info("Collection scheduler started. intervalMinutes={} initialDelaySeconds={} communities={}",
                 properties.intervalMinutes(), properties.initialDelaySeconds(), properties.communities());
        return true;
    }

    /** @return {@code false} if the loop was not running */
    @PreDestroy
    public boolean stop() {
        Disposable loop = subscription.getAndSet(null);
        if (loop == null) return false;
        loop.dispose();
        log.info("Collection scheduler stopped. totalCollections={}", totalCollections.get());
        return true;
    }

    public boolean isRunning() {
        return subscription.get() != null;
    }

    /**
     * Runs one cycle immediately. Completes empty when a cycle is already in progress;
     * errors propagate to the caller but are still counted.
     */
    public Mono<CycleResult> triggerNow() {
        log.info("On-demand collection requested");
        return runGuarded();
    }

    public CollectionStatus status() {
        return new CollectionStatus(
            isRunning(),
            cycleInProgress.get(),
            lastCollection,
            totalCollections.get(),
            totalObservations.get(),
            failedCollections.get(),
            properties.intervalMinutes());
    }

    // ── cycle execution ──────────────────────────────────────────────────

    private Mono<CycleResult> runGuarded() {
        return Mono.defer(() -> {
            if (!cycleInProgress.compareAndSet(false, true)) {
                log.info("Collection cycle skipped, another cycle is in progress");
                return Mono.empty();
            }
            return cycle.run()
                .doOnSuccess(this::record)
                .doOnError(e -> failedCollections.incrementAndGet())
                .doFinally(signal -> cycleInProgress.set(false));
        });
    }

    private void record(CycleResult result) {
        if (result == null) return;
        totalCollections.incrementAndGet();
        totalObservations.addAndGet(result.observationsStored());
        lastCollection = LocalDateTime.now(clock);
    }
}
