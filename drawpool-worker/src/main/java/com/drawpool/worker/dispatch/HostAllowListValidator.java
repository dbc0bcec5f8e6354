package com.drawpool.worker.dispatch;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Accepts absolute http(s) URLs whose host is on the allow list. An empty list allows any host.
 */
public final class HostAllowListValidator implements EndpointValidator {

    private final Set<String> allowedHosts;

    public HostAllowListValidator(List<String> allowedHosts) {
        this.allowedHosts = allowedHosts == null ? Set.of() : allowedHosts.stream()
                .map(h -> h.trim().toLowerCase(Locale.ROOT))
                .filter(h -> !h.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public void validate(String apiUrl) {
        if (apiUrl == null || apiUrl.isBlank()) {
            throw new IllegalArgumentException("API URL is empty");
        }
        URI uri;
        try {
            uri = URI.create(apiUrl.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("API URL is malformed: " + apiUrl, e);
        }
        String scheme = uri.getScheme() != null ? uri.getScheme().toLowerCase(Locale.ROOT) : "";
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new IllegalArgumentException("API URL must be http or https: " + apiUrl);
        }
        String host = uri.getHost();
        if (host == null || host.isEmpty()) {
            throw new IllegalArgumentException("API URL has no host: " + apiUrl);
        }
        if (!allowedHosts.isEmpty() && !allowedHosts.contains(host.toLowerCase(Locale.ROOT))) {
            throw new IllegalArgumentException("API host " + host + " is not in the allowed host list");
        }
    }
}
