package com.drawpool.worker.metrics;

import com.drawpool.storage.AssetAccess;
import com.drawpool.store.ExpiryResult;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Locale;
import java.util.Objects;

/**
 * Counters for the dispatch pool. Tags are low-cardinality: channel names come from
 * configuration, outcomes and access modes are enums.
 */
public final class DispatchMetrics {

    private final MeterRegistry registry;

    public DispatchMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /** Metrics backed by an in-process {@link SimpleMeterRegistry}. */
    public static DispatchMetrics simple() {
        return new DispatchMetrics(new SimpleMeterRegistry());
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    public void taskPushed() {
        registry.counter("drawpool.tasks.pushed").increment();
    }

    public void taskSubmitted(String channel) {
        registry.counter("drawpool.tasks.submitted", "channel", channel).increment();
    }

    public void taskFailed(String channel) {
        registry.counter("drawpool.tasks.failed", "channel", channel).increment();
    }

    public void jobExpired(ExpiryResult outcome) {
        registry.counter("drawpool.jobs.expired", "outcome", tag(outcome.name())).increment();
    }

    public void jobArchived(AssetAccess access) {
        registry.counter("drawpool.jobs.archived", "access", access.segment()).increment();
    }

    public void notificationDelivered() {
        registry.counter("drawpool.notifications", "result", "delivered").increment();
    }

    public void notificationDropped() {
        registry.counter("drawpool.notifications", "result", "dropped").increment();
    }

    private static String tag(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
