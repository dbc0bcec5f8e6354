package com.drawpool.connector;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A unit of generation work travelling through the task queue. Serialized as JSON.
 * <p>
 * {@code jobId} points at the persisted job row. {@code channelId} is empty for fresh work and
 * set for follow-up actions (upscale, variation) that must run on the channel which produced the
 * source image. {@code index}, {@code messageId} and {@code messageHash} address that source image.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class DrawTask {

    private final long jobId;
    private final long userId;
    private final TaskType type;
    private final String channelId;
    private final String prompt;
    private final String negPrompt;
    private final String params;
    private final int index;
    private final String messageId;
    private final String messageHash;
    private final List<String> imgArr;

    @JsonCreator
    public DrawTask(
            @JsonProperty("jobId") long jobId,
            @JsonProperty("userId") long userId,
            @JsonProperty("type") TaskType type,
            @JsonProperty("channelId") String channelId,
            @JsonProperty("prompt") String prompt,
            @JsonProperty("negPrompt") String negPrompt,
            @JsonProperty("params") String params,
            @JsonProperty("index") int index,
            @JsonProperty("messageId") String messageId,
            @JsonProperty("messageHash") String messageHash,
            @JsonProperty("imgArr") List<String> imgArr) {
        this.jobId = jobId;
        this.userId = userId;
        this.type = type != null ? type : TaskType.IMAGE;
        this.channelId = channelId != null ? channelId : "";
        this.prompt = prompt != null ? prompt : "";
        this.negPrompt = negPrompt != null ? negPrompt : "";
        this.params = params != null ? params : "";
        this.index = index;
        this.messageId = messageId != null ? messageId : "";
        this.messageHash = messageHash != null ? messageHash : "";
        this.imgArr = imgArr != null ? List.copyOf(imgArr) : List.of();
    }

    public long getJobId() {
        return jobId;
    }

    public long getUserId() {
        return userId;
    }

    public TaskType getType() {
        return type;
    }

    public String getChannelId() {
        return channelId;
    }

    public String getPrompt() {
        return prompt;
    }

    public String getNegPrompt() {
        return negPrompt;
    }

    public String getParams() {
        return params;
    }

    /** 1-based position of the source image in its grid, for upscale and variation. */
    public int getIndex() {
        return index;
    }

    public String getMessageId() {
        return messageId;
    }

    public String getMessageHash() {
        return messageHash;
    }

    /** Reference image URLs for blend and face swap. */
    public List<String> getImgArr() {
        return imgArr;
    }

    /** True when the task must run on one specific channel. */
    @JsonIgnore
    public boolean isPinned() {
        return !channelId.isEmpty();
    }

    /**
     * Prompt sent to the backend for an imagine task: the prompt, then any extra parameters,
     * then {@code --no <negPrompt>} when a negative prompt is present.
     */
    public String fullPrompt() {
        StringBuilder sb = new StringBuilder(prompt.trim());
        if (!params.isBlank()) {
            sb.append(' ').append(params.trim());
        }
        if (!negPrompt.isBlank()) {
            sb.append(" --no ").append(negPrompt.trim());
        }
        return sb.toString().trim();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .jobId(jobId)
                .userId(userId)
                .type(type)
                .channelId(channelId)
                .prompt(prompt)
                .negPrompt(negPrompt)
                .params(params)
                .index(index)
                .messageId(messageId)
                .messageHash(messageHash)
                .imgArr(imgArr);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DrawTask that = (DrawTask) o;
        return jobId == that.jobId
                && userId == that.userId
                && index == that.index
                && type == that.type
                && channelId.equals(that.channelId)
                && prompt.equals(that.prompt)
                && negPrompt.equals(that.negPrompt)
                && params.equals(that.params)
                && messageId.equals(that.messageId)
                && messageHash.equals(that.messageHash)
                && imgArr.equals(that.imgArr);
    }

    @Override
    public int hashCode() {
        return Objects.hash(jobId, userId, type, channelId, prompt, negPrompt, params, index, messageId, messageHash, imgArr);
    }

    @Override
    public String toString() {
        return "DrawTask{jobId=" + jobId + ", userId=" + userId + ", type=" + type + ", channelId=" + channelId + "}";
    }

    public static final class Builder {
        private long jobId;
        private long userId;
        private TaskType type = TaskType.IMAGE;
        private String channelId = "";
        private String prompt = "";
        private String negPrompt = "";
        private String params = "";
        private int index;
        private String messageId = "";
        private String messageHash = "";
        private List<String> imgArr = new ArrayList<>();

        public Builder jobId(long jobId) {
            this.jobId = jobId;
            return this;
        }

        public Builder userId(long userId) {
            this.userId = userId;
            return this;
        }

        public Builder type(TaskType type) {
            this.type = type;
            return this;
        }

        public Builder channelId(String channelId) {
            this.channelId = channelId;
            return this;
        }

        public Builder prompt(String prompt) {
            this.prompt = prompt;
            return this;
        }

        public Builder negPrompt(String negPrompt) {
            this.negPrompt = negPrompt;
            return this;
        }

        public Builder params(String params) {
            this.params = params;
            return this;
        }

        public Builder index(int index) {
            this.index = index;
            return this;
        }

        public Builder messageId(String messageId) {
            this.messageId = messageId;
            return this;
        }

        public Builder messageHash(String messageHash) {
            this.messageHash = messageHash;
            return this;
        }

        public Builder imgArr(List<String> imgArr) {
            this.imgArr = imgArr != null ? new ArrayList<>(imgArr) : new ArrayList<>();
            return this;
        }

        public Builder addImage(String url) {
            this.imgArr.add(url);
            return this;
        }

        public DrawTask build() {
            return new DrawTask(jobId, userId, type, channelId, prompt, negPrompt, params, index,
                    messageId, messageHash, imgArr);
        }
    }
}
