package com.drawpool.connector;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * Backend view of a submitted task, as returned by {@link ProviderConnector#query(String)}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TaskStatus {

    private final String id;
    private final String action;
    private final String status;
    private final String progress;
    private final String imageUrl;
    private final String prompt;
    private final String promptEn;
    private final String failReason;
    private final List<ActionButton> buttons;

    @JsonCreator
    public TaskStatus(
            @JsonProperty("id") String id,
            @JsonProperty("action") String action,
            @JsonProperty("status") String status,
            @JsonProperty("progress") String progress,
            @JsonProperty("imageUrl") String imageUrl,
            @JsonProperty("prompt") String prompt,
            @JsonProperty("promptEn") String promptEn,
            @JsonProperty("failReason") String failReason,
            @JsonProperty("buttons") List<ActionButton> buttons) {
        this.id = nullToEmpty(id);
        this.action = nullToEmpty(action);
        this.status = nullToEmpty(status);
        this.progress = nullToEmpty(progress);
        this.imageUrl = nullToEmpty(imageUrl);
        this.prompt = nullToEmpty(prompt);
        this.promptEn = nullToEmpty(promptEn);
        this.failReason = nullToEmpty(failReason);
        this.buttons = buttons != null ? List.copyOf(buttons) : List.of();
    }

    public String getId() {
        return id;
    }

    public String getAction() {
        return action;
    }

    public String getStatus() {
        return status;
    }

    /** Raw progress text, e.g. {@code "50%"}. */
    public String getProgress() {
        return progress;
    }

    public String getImageUrl() {
        return imageUrl;
    }

    public String getPrompt() {
        return prompt;
    }

    public String getPromptEn() {
        return promptEn;
    }

    public String getFailReason() {
        return failReason;
    }

    public List<ActionButton> getButtons() {
        return buttons;
    }

    public boolean isFailed() {
        return !failReason.isEmpty();
    }

    /** Progress as 0-100; missing or unparsable text counts as 0. */
    public int progressPercent() {
        String p = progress.trim();
        if (p.endsWith("%")) {
            p = p.substring(0, p.length() - 1).trim();
        }
        if (p.isEmpty()) {
            return 0;
        }
        try {
            int value = Integer.parseInt(p);
            return Math.max(0, Math.min(100, value));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /** Hash taken from the first follow-up button, if the backend offered any. */
    public Optional<String> firstButtonHash() {
        if (buttons.isEmpty()) {
            return Optional.empty();
        }
        String hash = buttons.get(0).imageHash();
        return hash.isEmpty() ? Optional.empty() : Optional.of(hash);
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }
}
