package com.drawpool.worker.loop;

import com.drawpool.connector.DrawTask;
import com.drawpool.queue.InMemoryTaskQueue;
import com.drawpool.queue.TaskQueue;
import com.drawpool.storage.ArchiveException;
import com.drawpool.storage.AssetAccess;
import com.drawpool.storage.AssetArchiver;
import com.drawpool.store.DrawJob;
import com.drawpool.worker.FakeConnector;
import com.drawpool.worker.InMemoryJobStore;
import com.drawpool.worker.JobEvent;
import com.drawpool.worker.NotifyMessage;
import com.drawpool.worker.dispatch.DispatchPool;
import com.drawpool.worker.metrics.DispatchMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArchivalLoopTest {

    private static final String CHANNEL = "mj-plus-service-0";

    private final InMemoryJobStore store = new InMemoryJobStore();
    private final TaskQueue<NotifyMessage> notifyQueue = new InMemoryTaskQueue<>();
    private final FakeConnector connector = new FakeConnector();
    private final List<String> archivedCalls = new ArrayList<>();
    private boolean archiveFails;
    private ScheduledExecutorService scheduler;
    private ArchivalLoop loop;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        AssetArchiver archiver = new AssetArchiver() {
            @Override
            public String archive(String sourceUrl, AssetAccess access) throws ArchiveException {
                archivedCalls.add(access + " " + sourceUrl);
                if (archiveFails) {
                    throw new ArchiveException("bucket unavailable");
                }
                return "https://files.local/" + access.segment() + "/copy.png";
            }
        };
        DispatchPool pool = DispatchPool.builder()
                .taskQueue(new InMemoryTaskQueue<DrawTask>())
                .notifyQueue(notifyQueue)
                .jobStore(store)
                .connector(CHANNEL, connector)
                .build();
        loop = new ArchivalLoop(scheduler, Duration.ofSeconds(5), store, pool, archiver, notifyQueue, DispatchMetrics.simple());
    }

    @AfterEach
    void tearDown() {
        loop.close();
        scheduler.shutdownNow();
    }

    private long finishedJob(String channel) {
        return store.create(DrawJob.builder().userId(3).power(10).progress(100).taskId("t-9").channelId(channel)
                .hash("old").orgUrl("https://cdn.example.com/t-9.png").createdAt(Instant.now()).build());
    }

    private List<NotifyMessage> notifications() {
        List<NotifyMessage> out = new ArrayList<>();
        while (notifyQueue.size() > 0) {
            notifyQueue.pop(Duration.ZERO).ifPresent(out::add);
        }
        return out;
    }

    @Test
    void ownedJobIsArchivedPrivatelyWithFreshHash() {
        long id = finishedJob(CHANNEL);
        connector.reporting(FakeConnector.status("100%", "https://cdn.example.com/t-9.png", "", "MJ::JOB::upsample::1::new"));

        loop.runOnce();

        DrawJob job = store.findById(id).orElseThrow();
        assertEquals("https://files.local/private/copy.png", job.getImgUrl());
        assertEquals("new", job.getHash());
        assertFalse(job.isPendingArchival());
        assertEquals(List.of("PRIVATE https://cdn.example.com/t-9.png"), archivedCalls);
        assertEquals(List.of(new NotifyMessage(3, id, JobEvent.FINISH)), notifications());
    }

    @Test
    void orphanedJobIsArchivedPublicly() {
        long id = finishedJob("mj-proxy-service-4");

        loop.runOnce();

        DrawJob job = store.findById(id).orElseThrow();
        assertEquals("https://files.local/public/copy.png", job.getImgUrl());
        assertEquals("old", job.getHash());
        assertTrue(connector.getQueried().isEmpty());
        assertEquals(1, notifications().size());
    }

    @Test
    void hashQueryFailureStillArchives() {
        long id = finishedJob(CHANNEL);
        connector.failingQuery("down");

        loop.runOnce();

        assertEquals("old", store.findById(id).orElseThrow().getHash());
        assertFalse(store.findById(id).orElseThrow().getImgUrl().isEmpty());
    }

    @Test
    void archiveFailureLeavesJobForNextPass() {
        long id = finishedJob(CHANNEL);
        archiveFails = true;

        loop.runOnce();

        assertTrue(store.findById(id).orElseThrow().isPendingArchival());
        assertTrue(notifications().isEmpty());

        archiveFails = false;
        loop.runOnce();

        assertFalse(store.findById(id).orElseThrow().isPendingArchival());
        assertEquals(1, notifications().size());
    }

    @Test
    void archivedJobIsNotArchivedAgain() {
        finishedJob(CHANNEL);

        loop.runOnce();
        loop.runOnce();

        assertEquals(1, archivedCalls.size());
        assertEquals(1, notifications().size());
    }
}
