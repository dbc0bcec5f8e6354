package com.drawpool.worker.loop;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Background pass run on a shared scheduler with a fixed delay between the end of one pass and
 * the start of the next. Each loop owns its {@link ScheduledFuture}; {@link #stop()} cancels only
 * this loop. A pass that throws is logged and the next one still runs.
 */
public abstract class PeriodicLoop implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PeriodicLoop.class);

    private final String name;
    private final ScheduledExecutorService scheduler;
    private final Duration interval;
    private ScheduledFuture<?> scheduled;

    protected PeriodicLoop(String name, ScheduledExecutorService scheduler, Duration interval) {
        this.name = Objects.requireNonNull(name, "name");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.interval = Objects.requireNonNull(interval, "interval");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
    }

    public String getName() {
        return name;
    }

    public Duration getInterval() {
        return interval;
    }

    public synchronized void start() {
        if (scheduled != null && !scheduled.isDone()) {
            return;
        }
        scheduled = scheduler.scheduleWithFixedDelay(this::runOnce, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Loop started | loop={} interval={}", name, interval);
    }

    /** Cancels future passes; a pass already running is allowed to finish. */
    public synchronized void stop() {
        if (scheduled != null && !scheduled.isDone()) {
            scheduled.cancel(false);
            log.info("Loop stopped | loop={}", name);
        }
        scheduled = null;
    }

    public synchronized boolean isRunning() {
        return scheduled != null && !scheduled.isDone();
    }

    @Override
    public void close() {
        stop();
    }

    /** Runs one pass now, on the calling thread. */
    public final void runOnce() {
        try {
            tick();
        } catch (RuntimeException e) {
            log.error("Loop pass failed | loop={} error={}", name, e.getMessage(), e);
        }
    }

    protected abstract void tick();
}
