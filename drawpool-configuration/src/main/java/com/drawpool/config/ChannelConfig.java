package com.drawpool.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One backend entry from the channel file: endpoint, credential and generation mode.
 * Disabled entries are kept in the file but never get a worker.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ChannelConfig {

    public static final String DEFAULT_MODE = "fast";

    private final boolean enabled;
    private final String apiUrl;
    private final String apiKey;
    private final String mode;

    @JsonCreator
    public ChannelConfig(
            @JsonProperty("enabled") boolean enabled,
            @JsonProperty("apiUrl") String apiUrl,
            @JsonProperty("apiKey") String apiKey,
            @JsonProperty("mode") String mode) {
        this.enabled = enabled;
        this.apiUrl = trimTrailingSlash(apiUrl);
        this.apiKey = apiKey != null ? apiKey.trim() : "";
        this.mode = mode != null && !mode.isBlank() ? mode.trim() : DEFAULT_MODE;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /** Base URL without trailing slash, e.g. {@code https://api.example.com}. */
    public String getApiUrl() {
        return apiUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    /** Generation speed mode (fast, relax, turbo). Default {@value #DEFAULT_MODE}. */
    public String getMode() {
        return mode;
    }

    private static String trimTrailingSlash(String url) {
        if (url == null) return "";
        String t = url.trim();
        while (t.endsWith("/")) {
            t = t.substring(0, t.length() - 1);
        }
        return t;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ChannelConfig that = (ChannelConfig) o;
        return enabled == that.enabled
                && Objects.equals(apiUrl, that.apiUrl)
                && Objects.equals(apiKey, that.apiKey)
                && Objects.equals(mode, that.mode);
    }

    @Override
    public int hashCode() {
        return Objects.hash(enabled, apiUrl, apiKey, mode);
    }

    @Override
    public String toString() {
        return "ChannelConfig{enabled=" + enabled + ", apiUrl=" + apiUrl + ", mode=" + mode + "}";
    }
}
