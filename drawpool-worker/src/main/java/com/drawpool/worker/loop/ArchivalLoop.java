package com.drawpool.worker.loop;

import com.drawpool.connector.ConnectorException;
import com.drawpool.queue.TaskQueue;
import com.drawpool.storage.ArchiveException;
import com.drawpool.storage.AssetAccess;
import com.drawpool.storage.AssetArchiver;
import com.drawpool.store.DrawJob;
import com.drawpool.store.JobStore;
import com.drawpool.worker.JobEvent;
import com.drawpool.worker.NotifyMessage;
import com.drawpool.worker.dispatch.DispatchPool;
import com.drawpool.worker.dispatch.DispatchWorker;
import com.drawpool.worker.metrics.DispatchMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Copies finished images from the backend into our storage. Jobs whose channel still has a
 * worker get a fresh hash from the backend and a private copy; orphaned jobs get a public copy.
 * A failed copy leaves the job pending for the next pass.
 */
public final class ArchivalLoop extends PeriodicLoop {

    private static final Logger log = LoggerFactory.getLogger(ArchivalLoop.class);

    private final JobStore jobStore;
    private final DispatchPool pool;
    private final AssetArchiver archiver;
    private final TaskQueue<NotifyMessage> notifyQueue;
    private final DispatchMetrics metrics;

    public ArchivalLoop(ScheduledExecutorService scheduler, Duration interval, JobStore jobStore, DispatchPool pool,
                        AssetArchiver archiver, TaskQueue<NotifyMessage> notifyQueue, DispatchMetrics metrics) {
        super("archival", scheduler, interval);
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore");
        this.pool = Objects.requireNonNull(pool, "pool");
        this.archiver = Objects.requireNonNull(archiver, "archiver");
        this.notifyQueue = Objects.requireNonNull(notifyQueue, "notifyQueue");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    protected void tick() {
        for (DrawJob job : jobStore.findPendingArchival()) {
            try {
                archive(job);
            } catch (RuntimeException e) {
                log.error("Archive failed | jobId={} error={}", job.getId(), e.getMessage(), e);
            }
        }
    }

    private void archive(DrawJob job) {
        Optional<DispatchWorker> owner = pool.lookup(job.getChannelId());
        String hash = job.getHash();
        AssetAccess access = owner.isPresent() ? AssetAccess.PRIVATE : AssetAccess.PUBLIC;
        if (owner.isPresent() && job.isSubmitted()) {
            try {
                hash = owner.get().query(job.getTaskId()).firstButtonHash().orElse(hash);
            } catch (ConnectorException e) {
                log.debug("Hash refresh skipped | jobId={} taskId={} error={}", job.getId(), job.getTaskId(), e.getMessage());
            }
        }

        String imgUrl;
        try {
            imgUrl = archiver.archive(job.getOrgUrl(), access);
        } catch (ArchiveException e) {
            log.warn("Archive failed, will retry | jobId={} orgUrl={} error={}", job.getId(), job.getOrgUrl(), e.getMessage());
            return;
        }

        jobStore.update(job.toBuilder().imgUrl(imgUrl).hash(hash).build());
        metrics.jobArchived(access);
        notifyQueue.push(new NotifyMessage(job.getUserId(), job.getId(), JobEvent.FINISH));
        log.info("Job archived | jobId={} access={} imgUrl={}", job.getId(), access, imgUrl);
    }
}
