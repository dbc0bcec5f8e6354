package com.drawpool.connector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * Shared HTTP plumbing for JSON backends: POST/GET with Jackson, reference image download as
 * base64 data URIs, and the task fetch endpoint both API flavours expose.
 * Subclasses supply the authentication header.
 */
public abstract class HttpConnectorSupport implements ProviderConnector {

    protected static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(60);

    protected final String apiUrl;
    protected final String apiKey;
    private final HttpClient httpClient;

    protected HttpConnectorSupport(String apiUrl, String apiKey, HttpClient httpClient) {
        if (apiUrl == null || apiUrl.isBlank()) {
            throw new IllegalArgumentException("apiUrl is required");
        }
        this.apiUrl = apiUrl.trim().replaceAll("/+$", "");
        this.apiKey = apiKey != null ? apiKey : "";
        this.httpClient = httpClient != null ? httpClient : defaultClient();
    }

    public static HttpClient defaultClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /** Header name and value that authenticate requests against this backend. */
    protected abstract String[] authHeader();

    @Override
    public TaskStatus query(String taskId) throws ConnectorException {
        if (taskId == null || taskId.isBlank()) {
            throw new ConnectorException("taskId is required");
        }
        String body = send(request(apiUrl + "/mj/task/" + taskId + "/fetch").GET());
        return parse(body, TaskStatus.class);
    }

    protected SubmitResult postSubmit(String url, Map<String, Object> payload) throws ConnectorException {
        String json;
        try {
            json = MAPPER.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new ConnectorException("Cannot encode request for " + url + ": " + e.getMessage(), e);
        }
        String body = send(request(url)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8)));
        return parse(body, SubmitResult.class);
    }

    /** Downloads each reference image and encodes it as {@code data:<mime>;base64,...}. */
    protected List<String> toDataUris(List<String> imageUrls) throws ConnectorException {
        List<String> out = new ArrayList<>(imageUrls.size());
        for (String url : imageUrls) {
            out.add(toDataUri(url));
        }
        return out;
    }

    protected String toDataUri(String imageUrl) throws ConnectorException {
        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(HttpRequest.newBuilder(URI.create(imageUrl)).timeout(REQUEST_TIMEOUT).GET().build(),
                    HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException | IllegalArgumentException e) {
            throw new ConnectorException("Cannot download reference image " + imageUrl + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectorException("Interrupted while downloading " + imageUrl, e);
        }
        if (response.statusCode() / 100 != 2) {
            throw new ConnectorException("Reference image download failed: " + response.statusCode() + " " + imageUrl);
        }
        String mime = response.headers().firstValue("Content-Type").orElse("image/png");
        int semi = mime.indexOf(';');
        if (semi >= 0) {
            mime = mime.substring(0, semi).trim();
        }
        return "data:" + mime + ";base64," + Base64.getEncoder().encodeToString(response.body());
    }

    /** Authenticated request builder; a malformed URL or header value surfaces as {@link ConnectorException}. */
    private HttpRequest.Builder request(String url) throws ConnectorException {
        try {
            return HttpRequest.newBuilder(URI.create(url))
                    .header(authHeader()[0], authHeader()[1])
                    .timeout(REQUEST_TIMEOUT);
        } catch (IllegalArgumentException e) {
            throw new ConnectorException("Invalid " + kind() + " request " + url + ": " + e.getMessage(), e);
        }
    }

    private String send(HttpRequest.Builder request) throws ConnectorException {
        HttpRequest built = request.build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(built, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ConnectorException(kind() + " API unreachable: " + built.uri() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectorException("Interrupted calling " + built.uri(), e);
        }
        if (response.statusCode() / 100 != 2) {
            throw new ConnectorException(kind() + " API error: " + response.statusCode() + " " + response.body());
        }
        return response.body();
    }

    private static <T> T parse(String body, Class<T> type) throws ConnectorException {
        try {
            T value = MAPPER.readValue(body, type);
            if (value == null) {
                throw new ConnectorException("Empty response body");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new ConnectorException("Malformed response: " + e.getOriginalMessage(), e);
        }
    }
}
