package com.drawpool.worker.dispatch;

/**
 * Decides whether a configured backend endpoint may be used before a worker is created for it.
 */
public interface EndpointValidator {

    /**
     * @throws IllegalArgumentException with the rejection reason when the endpoint is not eligible
     */
    void validate(String apiUrl);
}
