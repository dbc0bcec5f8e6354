package com.drawpool.worker.dispatch;

import com.drawpool.connector.ConnectorException;
import com.drawpool.connector.DrawTask;
import com.drawpool.connector.ProviderConnector;
import com.drawpool.connector.SubmitResult;
import com.drawpool.connector.TaskStatus;
import com.drawpool.queue.TaskQueue;
import com.drawpool.store.DrawJob;
import com.drawpool.store.JobStore;
import com.drawpool.worker.JobEvent;
import com.drawpool.worker.NotifyMessage;
import com.drawpool.worker.metrics.DispatchMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Consumer bound to one backend channel. Pops tasks from the shared task queue, submits them
 * through its connector and records the outcome on the job row; every outcome is announced on
 * the notify queue.
 * <p>
 * Tasks pinned to another registered channel are put back on the queue for that channel's worker.
 * Tasks pinned to a channel that no longer exists fail their job.
 */
public final class DispatchWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(DispatchWorker.class);

    private final String name;
    private final ProviderConnector connector;
    private final TaskQueue<DrawTask> taskQueue;
    private final TaskQueue<NotifyMessage> notifyQueue;
    private final JobStore jobStore;
    private final DispatchMetrics metrics;
    private final Duration pollTimeout;
    private final Duration requeueBackoff;
    private final Predicate<String> channelRegistered;

    private volatile boolean running;

    public DispatchWorker(String name,
                          ProviderConnector connector,
                          TaskQueue<DrawTask> taskQueue,
                          TaskQueue<NotifyMessage> notifyQueue,
                          JobStore jobStore,
                          DispatchMetrics metrics,
                          Duration pollTimeout,
                          Duration requeueBackoff,
                          Predicate<String> channelRegistered) {
        this.name = Objects.requireNonNull(name, "name");
        this.connector = Objects.requireNonNull(connector, "connector");
        this.taskQueue = Objects.requireNonNull(taskQueue, "taskQueue");
        this.notifyQueue = Objects.requireNonNull(notifyQueue, "notifyQueue");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.pollTimeout = Objects.requireNonNull(pollTimeout, "pollTimeout");
        this.requeueBackoff = Objects.requireNonNull(requeueBackoff, "requeueBackoff");
        this.channelRegistered = Objects.requireNonNull(channelRegistered, "channelRegistered");
    }

    /** Channel name, e.g. {@code mj-plus-service-0}. */
    public String getName() {
        return name;
    }

    public ProviderConnector getConnector() {
        return connector;
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public void run() {
        running = true;
        log.info("Dispatch worker started | channel={} kind={}", name, connector.kind());
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                pollOnce();
            } catch (RuntimeException e) {
                log.error("Dispatch worker iteration failed | channel={} error={}", name, e.getMessage(), e);
            }
        }
        running = false;
        log.info("Dispatch worker stopped | channel={}", name);
    }

    /** Asks the loop to exit; it does so once the current pop returns. */
    public void stop() {
        running = false;
    }

    /**
     * Pops at most one task and handles it.
     *
     * @return true when a task was taken from the queue
     */
    boolean pollOnce() {
        Optional<DrawTask> next = taskQueue.pop(pollTimeout);
        if (next.isEmpty()) {
            return false;
        }
        handle(next.get());
        return true;
    }

    void handle(DrawTask task) {
        if (task.isPinned() && !task.getChannelId().equals(name)) {
            if (channelRegistered.test(task.getChannelId())) {
                log.debug("Task pinned elsewhere, requeued | channel={} target={} jobId={}", name, task.getChannelId(), task.getJobId());
                taskQueue.push(task);
                backOff();
                return;
            }
            log.warn("Task pinned to unknown channel | channel={} target={} jobId={}", name, task.getChannelId(), task.getJobId());
            jobStore.findById(task.getJobId()).ifPresent(job ->
                    fail(job, "channel " + task.getChannelId() + " is no longer available"));
            return;
        }

        Optional<DrawJob> found = jobStore.findById(task.getJobId());
        if (found.isEmpty()) {
            log.warn("Task skipped, job not found | channel={} jobId={}", name, task.getJobId());
            return;
        }
        DrawJob job = found.get();

        SubmitResult result;
        try {
            result = connector.submit(task);
        } catch (ConnectorException e) {
            log.error("Task submit failed | channel={} jobId={} type={} error={}", name, job.getId(), task.getType(), e.getMessage());
            fail(job, e.getMessage());
            return;
        } catch (RuntimeException e) {
            log.error("Task submit failed unexpectedly | channel={} jobId={} type={} error={}", name, job.getId(), task.getType(), e.toString(), e);
            fail(job, e.toString());
            return;
        }
        if (!result.isAccepted()) {
            log.warn("Task rejected | channel={} jobId={} code={} description={}", name, job.getId(), result.getCode(), result.getDescription());
            fail(job, result.getDescription());
            return;
        }

        jobStore.update(job.toBuilder()
                .taskId(result.getResult())
                .channelId(name)
                .errMsg("")
                .build());
        metrics.taskSubmitted(name);
        log.info("Task submitted | channel={} jobId={} taskId={} type={}", name, job.getId(), result.getResult(), task.getType());
        notifyQueue.push(new NotifyMessage(job.getUserId(), job.getId(), JobEvent.RUNNING));
    }

    /**
     * Pulls the backend's current state of a submitted job into the store. A failure reason marks
     * the job failed; otherwise progress, hash, prompt and result URL are copied over and a
     * RUNNING (or FINISH at 100) event is queued when progress moved. Completion without any image
     * URL is recorded as 99. Jobs without a task id are left alone.
     */
    public void refresh(DrawJob job) throws ConnectorException {
        if (!job.isSubmitted()) {
            return;
        }
        TaskStatus status = connector.query(job.getTaskId());
        if (status.isFailed()) {
            log.info("Backend reported failure | channel={} jobId={} taskId={} reason={}", name, job.getId(), job.getTaskId(), status.getFailReason());
            fail(job, status.getFailReason());
            return;
        }

        int progress = status.progressPercent();
        if (progress == DrawJob.PROGRESS_DONE && status.getImageUrl().isEmpty() && job.getOrgUrl().isEmpty()) {
            // held below 100 so the job stays under reconciliation and still expires with a refund
            log.warn("Backend reports completion without an image | channel={} jobId={} taskId={}", name, job.getId(), job.getTaskId());
            progress = DrawJob.PROGRESS_DONE - 1;
        }
        DrawJob.Builder builder = job.toBuilder().progress(progress);
        status.firstButtonHash().ifPresent(builder::hash);
        if (!status.getPromptEn().isEmpty()) {
            builder.prompt(status.getPromptEn());
        }
        if (!status.getImageUrl().isEmpty()) {
            builder.orgUrl(status.getImageUrl());
        }
        DrawJob updated = builder.build();
        if (!updated.equals(job)) {
            jobStore.update(updated);
        }
        if (progress != job.getProgress()) {
            JobEvent event = progress == DrawJob.PROGRESS_DONE ? JobEvent.FINISH : JobEvent.RUNNING;
            notifyQueue.push(new NotifyMessage(job.getUserId(), job.getId(), event));
            log.debug("Job progress | channel={} jobId={} progress={}", name, job.getId(), progress);
        }
    }

    /** Current backend state of a task, straight from the connector. */
    public TaskStatus query(String taskId) throws ConnectorException {
        return connector.query(taskId);
    }

    private void fail(DrawJob job, String reason) {
        jobStore.update(job.toBuilder()
                .progress(DrawJob.PROGRESS_FAILED)
                .errMsg(reason != null ? reason : "")
                .build());
        metrics.taskFailed(name);
        notifyQueue.push(new NotifyMessage(job.getUserId(), job.getId(), JobEvent.FAIL));
    }

    private void backOff() {
        try {
            Thread.sleep(requeueBackoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
