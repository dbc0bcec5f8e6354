package com.drawpool.worker;

import com.drawpool.config.ChannelConfigLoader;
import com.drawpool.config.ChannelsConfiguration;
import com.drawpool.config.DrawPoolConfig;
import com.drawpool.connector.DrawTask;
import com.drawpool.queue.InMemoryTaskQueue;
import com.drawpool.queue.JsonCodec;
import com.drawpool.queue.RedisTaskQueue;
import com.drawpool.queue.TaskQueue;
import com.drawpool.storage.AssetArchiver;
import com.drawpool.storage.LocalAssetArchiver;
import com.drawpool.store.JdbcConnectionProvider;
import com.drawpool.store.JdbcJobStore;
import com.drawpool.store.JobStore;
import com.drawpool.worker.connection.ConnectionRegistry;
import com.drawpool.worker.dispatch.ConnectorFactory;
import com.drawpool.worker.dispatch.DispatchPool;
import com.drawpool.worker.dispatch.HostAllowListValidator;
import com.drawpool.worker.loop.ArchivalLoop;
import com.drawpool.worker.loop.NotificationFanout;
import com.drawpool.worker.loop.PeriodicLoop;
import com.drawpool.worker.loop.ReconciliationLoop;
import com.drawpool.worker.metrics.DispatchMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Everything the dispatch service runs: the pool with its workers, the three background loops and
 * the connection registry. Owns the scheduler (and the Redis pool when queues live in Redis) and
 * releases them on {@link #close()}.
 */
public final class DrawPoolRuntime implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DrawPoolRuntime.class);
    private static final Duration FANOUT_INTERVAL = Duration.ofMillis(100);

    private final DispatchPool pool;
    private final ConnectionRegistry connections;
    private final DispatchMetrics metrics;
    private final ScheduledExecutorService scheduler;
    private final List<PeriodicLoop> loops;
    private final AutoCloseable resources;

    DrawPoolRuntime(DrawPoolConfig config, DispatchPool.Builder poolBuilder, TaskQueue<DrawTask> taskQueue,
                    TaskQueue<NotifyMessage> notifyQueue, JobStore jobStore, AssetArchiver archiver,
                    DispatchMetrics metrics, Clock clock, AutoCloseable resources) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.resources = resources;
        this.connections = new ConnectionRegistry();
        this.pool = poolBuilder
                .taskQueue(taskQueue)
                .notifyQueue(notifyQueue)
                .jobStore(jobStore)
                .metrics(metrics)
                .pollTimeout(config.getQueuePollTimeout())
                .build();
        AtomicInteger counter = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(3, r -> {
            Thread t = new Thread(r, "drawpool-loop-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        this.loops = List.of(
                new ReconciliationLoop(scheduler, config.getReconcileInterval(), jobStore, pool, metrics, config.getJobTimeout(), clock),
                new ArchivalLoop(scheduler, config.getArchiveInterval(), jobStore, pool, archiver, notifyQueue, metrics),
                new NotificationFanout(scheduler, FANOUT_INTERVAL, notifyQueue, connections, metrics, config.getQueuePollTimeout()));
    }

    /**
     * Wires the production stack from configuration: channel file, Redis or in-memory queues,
     * PostgreSQL job store (schema ensured) and local asset archiving.
     */
    public static DrawPoolRuntime fromConfig(DrawPoolConfig config) {
        ChannelsConfiguration channels = ChannelConfigLoader.load(Path.of(config.getChannelsFile()));
        DispatchMetrics metrics = DispatchMetrics.simple();

        JedisPool jedisPool = null;
        TaskQueue<DrawTask> taskQueue;
        TaskQueue<NotifyMessage> notifyQueue;
        if (config.getQueueMode() == DrawPoolConfig.QueueMode.REDIS) {
            jedisPool = new JedisPool(new JedisPoolConfig(), config.getCacheHost(), config.getCachePort());
            taskQueue = new RedisTaskQueue<>(jedisPool, config.getTaskQueueName(), new JsonCodec<>(DrawTask.class));
            notifyQueue = new RedisTaskQueue<>(jedisPool, config.getNotifyQueueName(), new JsonCodec<>(NotifyMessage.class));
            log.info("Queues on Redis {}:{} | task={} notify={}", config.getCacheHost(), config.getCachePort(),
                    config.getTaskQueueName(), config.getNotifyQueueName());
        } else {
            taskQueue = new InMemoryTaskQueue<>();
            notifyQueue = new InMemoryTaskQueue<>();
            log.info("Queues in memory (single process)");
        }

        JdbcJobStore jobStore = new JdbcJobStore(new JdbcConnectionProvider(config));
        jobStore.ensureSchema();

        AssetArchiver archiver = new LocalAssetArchiver(Path.of(config.getUploadDir()), config.getUploadBaseUrl());
        DispatchPool.Builder poolBuilder = DispatchPool.builder()
                .fromChannels(channels, ConnectorFactory.http(), new HostAllowListValidator(config.getAllowedApiHosts()));
        return new DrawPoolRuntime(config, poolBuilder, taskQueue, notifyQueue, jobStore, archiver, metrics,
                Clock.systemUTC(), jedisPool);
    }

    public DispatchPool getPool() {
        return pool;
    }

    /** Registry the HTTP layer feeds with client sessions. */
    public ConnectionRegistry getConnections() {
        return connections;
    }

    public DispatchMetrics getMetrics() {
        return metrics;
    }

    public void start() {
        pool.start();
        loops.forEach(PeriodicLoop::start);
        log.info("Drawpool runtime started | workers={} loops={}", pool.getWorkers().size(), loops.size());
    }

    @Override
    public void close() {
        loops.forEach(PeriodicLoop::stop);
        pool.close();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        if (resources != null) {
            try {
                resources.close();
            } catch (Exception e) {
                log.warn("Error releasing runtime resources: {}", e.getMessage());
            }
        }
        log.info("Drawpool runtime stopped");
    }
}
