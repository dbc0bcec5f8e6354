package com.drawpool.connector;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Backend answer to a submission. {@link #getResult()} is the backend's task id.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SubmitResult {

    /** Task accepted and started. */
    public static final int CODE_SUBMITTED = 1;
    /** Task accepted and waiting in the backend's own queue. */
    public static final int CODE_QUEUED = 22;

    private final int code;
    private final String description;
    private final String result;

    @JsonCreator
    public SubmitResult(
            @JsonProperty("code") int code,
            @JsonProperty("description") String description,
            @JsonProperty("result") String result) {
        this.code = code;
        this.description = description != null ? description : "";
        this.result = result != null ? result : "";
    }

    public int getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    public String getResult() {
        return result;
    }

    public boolean isAccepted() {
        return code == CODE_SUBMITTED || code == CODE_QUEUED;
    }

    @Override
    public String toString() {
        return "SubmitResult{code=" + code + ", description=" + description + ", result=" + result + "}";
    }
}
