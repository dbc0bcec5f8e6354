package com.drawpool.connector;

/**
 * Raised by a {@link ProviderConnector} when the backend cannot be reached, answers with a
 * non-2xx status, returns a body that cannot be parsed, or does not support the requested task.
 */
public class ConnectorException extends Exception {

    public ConnectorException(String message) {
        super(message);
    }

    public ConnectorException(String message, Throwable cause) {
        super(message, cause);
    }
}
