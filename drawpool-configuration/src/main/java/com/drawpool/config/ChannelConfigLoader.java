package com.drawpool.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads {@link ChannelsConfiguration} from a JSON file. A missing file means "no backends
 * configured" (the pool starts with zero workers); an unreadable or malformed file fails startup.
 */
public final class ChannelConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ChannelConfigLoader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private ChannelConfigLoader() {
    }

    public static ChannelsConfiguration load(Path file) {
        Objects.requireNonNull(file, "file");
        if (!Files.isRegularFile(file)) {
            log.warn("Channel file not found: {}; no drawing backends will be available", file.toAbsolutePath());
            return ChannelsConfiguration.empty();
        }
        try {
            ChannelsConfiguration channels = fromJson(Files.readString(file));
            log.info("Loaded channel file {} | plus={} proxy={} enabled={}",
                    file.toAbsolutePath(), channels.getPlus().size(), channels.getProxy().size(), channels.enabledCount());
            return channels;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read channel file " + file.toAbsolutePath() + ": " + e.getMessage(), e);
        }
    }

    static ChannelsConfiguration fromJson(String json) throws IOException {
        if (json == null || json.isBlank()) {
            return ChannelsConfiguration.empty();
        }
        ChannelsConfiguration parsed = MAPPER.readValue(json, ChannelsConfiguration.class);
        return parsed != null ? parsed : ChannelsConfiguration.empty();
    }
}
