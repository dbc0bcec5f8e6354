package com.drawpool.store;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Persisted drawing job ({@code drawpool_mj_jobs}). Immutable; state changes produce a copy via
 * {@link #toBuilder()} which is then written with {@link JobStore#update(DrawJob)}.
 * <p>
 * Progress is 0-100 while running, 100 when the image is ready and -1 after a failure.
 */
public final class DrawJob {

    public static final int PROGRESS_DONE = 100;
    public static final int PROGRESS_FAILED = -1;

    private final long id;
    private final long userId;
    private final String taskId;
    private final String channelId;
    private final String type;
    private final String hash;
    private final String prompt;
    private final String errMsg;
    private final int progress;
    private final long power;
    private final String orgUrl;
    private final String imgUrl;
    private final Instant createdAt;

    private DrawJob(Builder b) {
        this.id = b.id;
        this.userId = b.userId;
        this.taskId = nullToEmpty(b.taskId);
        this.channelId = nullToEmpty(b.channelId);
        this.type = nullToEmpty(b.type);
        this.hash = nullToEmpty(b.hash);
        this.prompt = nullToEmpty(b.prompt);
        this.errMsg = nullToEmpty(b.errMsg);
        this.progress = b.progress;
        this.power = b.power;
        this.orgUrl = nullToEmpty(b.orgUrl);
        this.imgUrl = nullToEmpty(b.imgUrl);
        this.createdAt = b.createdAt != null ? b.createdAt : Instant.now();
    }

    public long getId() {
        return id;
    }

    public long getUserId() {
        return userId;
    }

    /** Backend task id; empty until the job has been submitted. */
    public String getTaskId() {
        return taskId;
    }

    /** Name of the channel that accepted the job; empty until submitted. */
    public String getChannelId() {
        return channelId;
    }

    public String getType() {
        return type;
    }

    public String getHash() {
        return hash;
    }

    public String getPrompt() {
        return prompt;
    }

    public String getErrMsg() {
        return errMsg;
    }

    public int getProgress() {
        return progress;
    }

    /** Credit reserved for this job when it was created. */
    public long getPower() {
        return power;
    }

    /** Backend-hosted result image. */
    public String getOrgUrl() {
        return orgUrl;
    }

    /** Archived result image; empty until archived. */
    public String getImgUrl() {
        return imgUrl;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public boolean isSubmitted() {
        return !taskId.isEmpty();
    }

    /** Finished at the backend but not yet copied into our own storage. */
    public boolean isPendingArchival() {
        return progress == PROGRESS_DONE && !orgUrl.isEmpty() && imgUrl.isEmpty();
    }

    /** Failed, or still unfinished after {@code timeout} has passed since creation. */
    public boolean isExpired(Instant now, Duration timeout) {
        if (progress == PROGRESS_FAILED) {
            return true;
        }
        return progress < PROGRESS_DONE && Duration.between(createdAt, now).compareTo(timeout) > 0;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .userId(userId)
                .taskId(taskId)
                .channelId(channelId)
                .type(type)
                .hash(hash)
                .prompt(prompt)
                .errMsg(errMsg)
                .progress(progress)
                .power(power)
                .orgUrl(orgUrl)
                .imgUrl(imgUrl)
                .createdAt(createdAt);
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DrawJob that = (DrawJob) o;
        return id == that.id
                && userId == that.userId
                && progress == that.progress
                && power == that.power
                && taskId.equals(that.taskId)
                && channelId.equals(that.channelId)
                && type.equals(that.type)
                && hash.equals(that.hash)
                && prompt.equals(that.prompt)
                && errMsg.equals(that.errMsg)
                && orgUrl.equals(that.orgUrl)
                && imgUrl.equals(that.imgUrl)
                && createdAt.equals(that.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, userId, taskId, channelId, type, hash, prompt, errMsg, progress, power, orgUrl, imgUrl, createdAt);
    }

    @Override
    public String toString() {
        return "DrawJob{id=" + id + ", userId=" + userId + ", taskId=" + taskId + ", channelId=" + channelId
                + ", progress=" + progress + ", power=" + power + "}";
    }

    public static final class Builder {
        private long id;
        private long userId;
        private String taskId;
        private String channelId;
        private String type;
        private String hash;
        private String prompt;
        private String errMsg;
        private int progress;
        private long power;
        private String orgUrl;
        private String imgUrl;
        private Instant createdAt;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder userId(long userId) {
            this.userId = userId;
            return this;
        }

        public Builder taskId(String taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder channelId(String channelId) {
            this.channelId = channelId;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder hash(String hash) {
            this.hash = hash;
            return this;
        }

        public Builder prompt(String prompt) {
            this.prompt = prompt;
            return this;
        }

        public Builder errMsg(String errMsg) {
            this.errMsg = errMsg;
            return this;
        }

        public Builder progress(int progress) {
            this.progress = progress;
            return this;
        }

        public Builder power(long power) {
            this.power = power;
            return this;
        }

        public Builder orgUrl(String orgUrl) {
            this.orgUrl = orgUrl;
            return this;
        }

        public Builder imgUrl(String imgUrl) {
            this.imgUrl = imgUrl;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public DrawJob build() {
            return new DrawJob(this);
        }
    }
}
