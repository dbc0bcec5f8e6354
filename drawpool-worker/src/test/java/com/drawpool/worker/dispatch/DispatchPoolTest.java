package com.drawpool.worker.dispatch;

import com.drawpool.config.ChannelConfig;
import com.drawpool.config.ChannelsConfiguration;
import com.drawpool.connector.ConnectorKind;
import com.drawpool.connector.DrawTask;
import com.drawpool.queue.InMemoryTaskQueue;
import com.drawpool.queue.TaskQueue;
import com.drawpool.store.DrawJob;
import com.drawpool.worker.FakeConnector;
import com.drawpool.worker.InMemoryJobStore;
import com.drawpool.worker.NotifyMessage;
import com.drawpool.worker.metrics.DispatchMetrics;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DispatchPoolTest {

    private final TaskQueue<DrawTask> taskQueue = new InMemoryTaskQueue<>();
    private final TaskQueue<NotifyMessage> notifyQueue = new InMemoryTaskQueue<>();
    private final InMemoryJobStore store = new InMemoryJobStore();
    private final DispatchMetrics metrics = DispatchMetrics.simple();

    private DispatchPool.Builder builder() {
        return DispatchPool.builder()
                .taskQueue(taskQueue)
                .notifyQueue(notifyQueue)
                .jobStore(store)
                .metrics(metrics)
                .pollTimeout(Duration.ofMillis(20));
    }

    @Test
    void fromChannelsRegistersEnabledEntriesByKindAndIndex() {
        List<ConnectorKind> created = new ArrayList<>();
        ChannelsConfiguration channels = new ChannelsConfiguration(
                List.of(new ChannelConfig(true, "https://good.example.com", "k", "fast"),
                        new ChannelConfig(false, "https://good.example.com", "k", "fast"),
                        new ChannelConfig(true, "https://evil.example.org", "k", "fast")),
                List.of(new ChannelConfig(true, "http://evil.example.org", "k", null)));

        DispatchPool pool = builder()
                .fromChannels(channels, (kind, entry) -> {
                    created.add(kind);
                    return new FakeConnector(kind);
                }, new HostAllowListValidator(List.of("good.example.com")))
                .build();

        assertTrue(pool.lookup("mj-plus-service-0").isPresent());
        assertFalse(pool.lookup("mj-plus-service-1").isPresent());
        assertFalse(pool.lookup("mj-plus-service-2").isPresent());
        assertTrue(pool.lookup("mj-proxy-service-0").isPresent());
        assertEquals(List.of(ConnectorKind.PLUS, ConnectorKind.PROXY), created);
        assertEquals(2, pool.getWorkers().size());
        assertTrue(pool.hasAvailableWorker());
    }

    @Test
    void allEntriesFilteredLeavesNoAvailableWorker() {
        ChannelsConfiguration channels = new ChannelsConfiguration(
                List.of(new ChannelConfig(true, "ftp://bad", "k", "fast")),
                List.of(new ChannelConfig(false, "http://p", "k", null)));

        DispatchPool pool = builder().fromChannels(channels, (kind, entry) -> new FakeConnector(kind), new HostAllowListValidator(List.of())).build();

        assertFalse(pool.hasAvailableWorker());
    }

    @Test
    void pushEnqueuesEvenWithoutWorkers() {
        DispatchPool pool = builder().build();

        pool.push(DrawTask.builder().jobId(1).prompt("x").build());

        assertFalse(pool.hasAvailableWorker());
        assertEquals(1, taskQueue.size());
        assertEquals(1.0, metrics.getRegistry().counter("drawpool.tasks.pushed").count());
    }

    @Test
    void lookupOfUnknownOrBlankChannelIsEmpty() {
        DispatchPool pool = builder().connector("mj-plus-service-0", new FakeConnector()).build();

        assertFalse(pool.lookup("mj-plus-service-7").isPresent());
        assertFalse(pool.lookup("").isPresent());
        assertFalse(pool.lookup(null).isPresent());
    }

    @Test
    void startedPoolConsumesPushedTasksAndCloseStopsWorkers() throws Exception {
        FakeConnector connector = new FakeConnector();
        DispatchPool pool = builder().connector("mj-plus-service-0", connector).build();
        long jobId = store.create(DrawJob.builder().userId(5).power(3).build());

        pool.start();
        try {
            pool.push(DrawTask.builder().jobId(jobId).userId(5).prompt("hills").build());
            long deadline = System.currentTimeMillis() + 5_000;
            while (store.findById(jobId).orElseThrow().getTaskId().isEmpty() && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
        } finally {
            pool.close();
        }

        assertEquals("task-1", store.findById(jobId).orElseThrow().getTaskId());
        assertFalse(pool.lookup("mj-plus-service-0").orElseThrow().isRunning());
    }
}
