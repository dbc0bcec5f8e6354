package com.drawpool.worker.dispatch;

import com.drawpool.config.ChannelConfig;
import com.drawpool.config.ChannelsConfiguration;
import com.drawpool.connector.ConnectorKind;
import com.drawpool.connector.DrawTask;
import com.drawpool.connector.ProviderConnector;
import com.drawpool.queue.TaskQueue;
import com.drawpool.store.JobStore;
import com.drawpool.worker.NotifyMessage;
import com.drawpool.worker.metrics.DispatchMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Registry of dispatch workers (channel name to worker) plus the entry point for new work.
 * The set of workers is fixed at construction; {@link #start()} runs each on its own thread.
 */
public final class DispatchPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DispatchPool.class);
    private static final Duration DEFAULT_REQUEUE_BACKOFF = Duration.ofSeconds(1);

    private final Map<String, DispatchWorker> workers;
    private final TaskQueue<DrawTask> taskQueue;
    private final DispatchMetrics metrics;
    private final Duration pollTimeout;
    private ExecutorService executor;

    private DispatchPool(Builder b) {
        this.taskQueue = Objects.requireNonNull(b.taskQueue, "taskQueue");
        this.metrics = Objects.requireNonNull(b.metrics, "metrics");
        this.pollTimeout = b.pollTimeout;
        Objects.requireNonNull(b.notifyQueue, "notifyQueue");
        Objects.requireNonNull(b.jobStore, "jobStore");
        Map<String, DispatchWorker> built = new LinkedHashMap<>();
        for (Map.Entry<String, ProviderConnector> e : b.connectors.entrySet()) {
            built.put(e.getKey(), new DispatchWorker(e.getKey(), e.getValue(), taskQueue, b.notifyQueue, b.jobStore,
                    metrics, b.pollTimeout, b.requeueBackoff, this::isRegistered));
        }
        this.workers = Collections.unmodifiableMap(built);
        log.info("Dispatch pool created | workers={} channels={}", workers.size(), workers.keySet());
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Enqueues a task for whichever worker pops it first. Never refuses. */
    public void push(DrawTask task) {
        taskQueue.push(Objects.requireNonNull(task, "task"));
        metrics.taskPushed();
        log.debug("Task pushed | jobId={} type={} channel={}", task.getJobId(), task.getType(), task.getChannelId());
    }

    /** True if at least one backend channel is usable. */
    public boolean hasAvailableWorker() {
        return !workers.isEmpty();
    }

    /** Worker registered under {@code channelId}; empty for unknown or blank ids. */
    public Optional<DispatchWorker> lookup(String channelId) {
        if (channelId == null || channelId.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(workers.get(channelId));
    }

    public Collection<DispatchWorker> getWorkers() {
        return workers.values();
    }

    private boolean isRegistered(String channelId) {
        return workers.containsKey(channelId);
    }

    public synchronized void start() {
        if (executor != null) {
            return;
        }
        if (workers.isEmpty()) {
            log.warn("Dispatch pool has no workers; tasks will wait in the queue until a channel is configured");
            return;
        }
        AtomicInteger counter = new AtomicInteger();
        executor = Executors.newFixedThreadPool(workers.size(), r -> {
            Thread t = new Thread(r, "drawpool-dispatch-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        for (DispatchWorker worker : workers.values()) {
            executor.submit(worker);
        }
        log.info("Dispatch pool started | workers={}", workers.size());
    }

    @Override
    public synchronized void close() {
        workers.values().forEach(DispatchWorker::stop);
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(pollTimeout.toMillis() + 5_000, TimeUnit.MILLISECONDS)) {
                log.warn("Dispatch workers did not stop in time; interrupting");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        executor = null;
        log.info("Dispatch pool stopped");
    }

    public static final class Builder {
        private TaskQueue<DrawTask> taskQueue;
        private TaskQueue<NotifyMessage> notifyQueue;
        private JobStore jobStore;
        private DispatchMetrics metrics = DispatchMetrics.simple();
        private Duration pollTimeout = Duration.ofSeconds(1);
        private Duration requeueBackoff = DEFAULT_REQUEUE_BACKOFF;
        private final Map<String, ProviderConnector> connectors = new LinkedHashMap<>();

        public Builder taskQueue(TaskQueue<DrawTask> taskQueue) {
            this.taskQueue = taskQueue;
            return this;
        }

        public Builder notifyQueue(TaskQueue<NotifyMessage> notifyQueue) {
            this.notifyQueue = notifyQueue;
            return this;
        }

        public Builder jobStore(JobStore jobStore) {
            this.jobStore = jobStore;
            return this;
        }

        public Builder metrics(DispatchMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder pollTimeout(Duration pollTimeout) {
            this.pollTimeout = Objects.requireNonNull(pollTimeout, "pollTimeout");
            return this;
        }

        public Builder requeueBackoff(Duration requeueBackoff) {
            this.requeueBackoff = Objects.requireNonNull(requeueBackoff, "requeueBackoff");
            return this;
        }

        /** Registers one worker under {@code channelName}. */
        public Builder connector(String channelName, ProviderConnector connector) {
            connectors.put(Objects.requireNonNull(channelName, "channelName"), Objects.requireNonNull(connector, "connector"));
            return this;
        }

        /**
         * Registers a worker for every enabled channel entry. Plus entries must pass the validator;
         * rejected ones are logged and skipped. Proxy entries are taken as configured.
         */
        public Builder fromChannels(ChannelsConfiguration channels, ConnectorFactory factory, EndpointValidator validator) {
            addEntries(ConnectorKind.PLUS, channels.getPlus(), factory, validator);
            addEntries(ConnectorKind.PROXY, channels.getProxy(), factory, null);
            return this;
        }

        private void addEntries(ConnectorKind kind, List<ChannelConfig> entries, ConnectorFactory factory, EndpointValidator validator) {
            for (int i = 0; i < entries.size(); i++) {
                ChannelConfig entry = entries.get(i);
                String channelName = kind.channelName(i);
                if (!entry.isEnabled()) {
                    log.debug("Channel disabled, skipped | channel={}", channelName);
                    continue;
                }
                try {
                    if (validator != null) {
                        validator.validate(entry.getApiUrl());
                    }
                    connector(channelName, factory.create(kind, entry));
                    log.info("Channel registered | channel={} apiUrl={} mode={}", channelName, entry.getApiUrl(), entry.getMode());
                } catch (IllegalArgumentException e) {
                    log.error("Channel rejected, skipped | channel={} apiUrl={} reason={}", channelName, entry.getApiUrl(), e.getMessage());
                }
            }
        }

        public DispatchPool build() {
            return new DispatchPool(this);
        }
    }
}
