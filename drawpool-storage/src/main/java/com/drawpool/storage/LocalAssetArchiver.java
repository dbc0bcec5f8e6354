package com.drawpool.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * {@link AssetArchiver} writing to the local file system.
 * Files land in {@code <uploadDir>/<access>/<yyyy>/<MM>/<name>} and are served from
 * {@code <baseUrl>/<access>/<yyyy>/<MM>/<name>}.
 */
public final class LocalAssetArchiver implements AssetArchiver {

    private static final Logger log = LoggerFactory.getLogger(LocalAssetArchiver.class);
    private static final String DEFAULT_EXTENSION = ".png";

    private final Path uploadDir;
    private final String baseUrl;
    private final HttpClient httpClient;
    private final Clock clock;

    public LocalAssetArchiver(Path uploadDir, String baseUrl) {
        this(uploadDir, baseUrl, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(), Clock.systemUTC());
    }

    public LocalAssetArchiver(Path uploadDir, String baseUrl, HttpClient httpClient, Clock clock) {
        this.uploadDir = Objects.requireNonNull(uploadDir, "uploadDir");
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl").replaceAll("/+$", "");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public String archive(String sourceUrl, AssetAccess access) throws ArchiveException {
        if (sourceUrl == null || sourceUrl.isBlank()) {
            throw new ArchiveException("sourceUrl is required");
        }
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(ZoneOffset.UTC));
        String relative = access.segment() + "/" + String.format(Locale.ROOT, "%04d/%02d", now.getYear(), now.getMonthValue())
                + "/" + UUID.randomUUID().toString().replace("-", "") + extensionOf(sourceUrl);
        Path target = uploadDir.resolve(relative);

        HttpResponse<Path> response;
        Path temp = null;
        try {
            Files.createDirectories(target.getParent());
            temp = Files.createTempFile(target.getParent(), "download-", ".part");
            response = httpClient.send(HttpRequest.newBuilder(URI.create(sourceUrl)).timeout(Duration.ofSeconds(120)).GET().build(),
                    HttpResponse.BodyHandlers.ofFile(temp));
            if (response.statusCode() / 100 != 2) {
                throw new ArchiveException("Download failed with status " + response.statusCode() + ": " + sourceUrl);
            }
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException | IllegalArgumentException e) {
            throw new ArchiveException("Cannot archive " + sourceUrl + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ArchiveException("Interrupted while archiving " + sourceUrl, e);
        } finally {
            deleteQuietly(temp);
        }
        String url = baseUrl + "/" + relative;
        log.info("Asset archived | source={} access={} url={}", sourceUrl, access, url);
        return url;
    }

    static String extensionOf(String url) {
        String path;
        try {
            path = URI.create(url).getPath();
        } catch (IllegalArgumentException e) {
            return DEFAULT_EXTENSION;
        }
        if (path == null) {
            return DEFAULT_EXTENSION;
        }
        int slash = path.lastIndexOf('/');
        int dot = path.lastIndexOf('.');
        if (dot <= slash || dot == path.length() - 1) {
            return DEFAULT_EXTENSION;
        }
        String ext = path.substring(dot).toLowerCase(Locale.ROOT);
        return ext.matches("\\.[a-z0-9]{1,5}") ? ext : DEFAULT_EXTENSION;
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) return;
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove partial download {}: {}", temp, e.getMessage());
        }
    }
}
