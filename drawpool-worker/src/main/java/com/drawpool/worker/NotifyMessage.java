package com.drawpool.worker;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Entry of the notify queue: tells {@code userId}'s live connection that job {@code jobId} changed.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class NotifyMessage {

    private final long userId;
    private final long jobId;
    private final JobEvent message;

    @JsonCreator
    public NotifyMessage(
            @JsonProperty("userId") long userId,
            @JsonProperty("jobId") long jobId,
            @JsonProperty("message") JobEvent message) {
        this.userId = userId;
        this.jobId = jobId;
        this.message = Objects.requireNonNull(message, "message");
    }

    public long getUserId() {
        return userId;
    }

    public long getJobId() {
        return jobId;
    }

    public JobEvent getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NotifyMessage that = (NotifyMessage) o;
        return userId == that.userId && jobId == that.jobId && message == that.message;
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, jobId, message);
    }

    @Override
    public String toString() {
        return "NotifyMessage{userId=" + userId + ", jobId=" + jobId + ", message=" + message + "}";
    }
}
