package com.drawpool.worker.loop;

import com.drawpool.connector.ConnectorException;
import com.drawpool.store.DrawJob;
import com.drawpool.store.ExpiryResult;
import com.drawpool.store.JobStore;
import com.drawpool.worker.dispatch.DispatchPool;
import com.drawpool.worker.dispatch.DispatchWorker;
import com.drawpool.worker.metrics.DispatchMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Walks every unfinished job. Failed jobs and jobs older than the timeout are expired with a
 * power refund; the rest are refreshed from the backend of the channel that accepted them.
 */
public final class ReconciliationLoop extends PeriodicLoop {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationLoop.class);

    private final JobStore jobStore;
    private final DispatchPool pool;
    private final DispatchMetrics metrics;
    private final Duration jobTimeout;
    private final Clock clock;

    public ReconciliationLoop(ScheduledExecutorService scheduler, Duration interval, JobStore jobStore,
                              DispatchPool pool, DispatchMetrics metrics, Duration jobTimeout, Clock clock) {
        super("reconciliation", scheduler, interval);
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore");
        this.pool = Objects.requireNonNull(pool, "pool");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.jobTimeout = Objects.requireNonNull(jobTimeout, "jobTimeout");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    protected void tick() {
        List<DrawJob> jobs = jobStore.findUnfinished();
        Instant now = clock.instant();
        for (DrawJob job : jobs) {
            try {
                reconcile(job, now);
            } catch (RuntimeException e) {
                log.error("Reconcile failed | jobId={} channel={} error={}", job.getId(), job.getChannelId(), e.getMessage(), e);
            }
        }
    }

    private void reconcile(DrawJob job, Instant now) {
        if (job.isExpired(now, jobTimeout)) {
            String remark = "Drawing task failed, power refunded. Task ID: " + job.getTaskId();
            ExpiryResult result = jobStore.expire(job, remark);
            metrics.jobExpired(result);
            switch (result) {
                case REFUNDED:
                    log.info("Job expired and refunded | jobId={} userId={} power={} progress={}",
                            job.getId(), job.getUserId(), job.getPower(), job.getProgress());
                    break;
                case REMOVED_WITHOUT_REFUND:
                    log.warn("Job expired but user not found, no refund | jobId={} userId={} power={}",
                            job.getId(), job.getUserId(), job.getPower());
                    break;
                default:
                    log.debug("Job already removed | jobId={}", job.getId());
            }
            return;
        }
        Optional<DispatchWorker> worker = pool.lookup(job.getChannelId());
        if (worker.isEmpty()) {
            return;
        }
        try {
            worker.get().refresh(job);
        } catch (ConnectorException e) {
            log.warn("Progress query failed | jobId={} channel={} taskId={} error={}",
                    job.getId(), job.getChannelId(), job.getTaskId(), e.getMessage());
        }
    }
}
