package com.drawpool.connector;

/**
 * Client for one image-generation backend. Implementations are stateless apart from their
 * endpoint and credential and may be called from several threads.
 */
public interface ProviderConnector {

    ConnectorKind kind();

    /**
     * Sends the task to the backend. A returned result may still be a rejection; check
     * {@link SubmitResult#isAccepted()}.
     *
     * @throws ConnectorException on transport failure, non-2xx status, unparsable body or unsupported task type
     */
    SubmitResult submit(DrawTask task) throws ConnectorException;

    /** Fetches the backend's current view of a previously submitted task. */
    TaskStatus query(String taskId) throws ConnectorException;
}
