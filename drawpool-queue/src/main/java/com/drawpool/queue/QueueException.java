package com.drawpool.queue;

/** Unchecked failure of the queue backend or of entry encoding. */
public class QueueException extends RuntimeException {

    public QueueException(String message) {
        super(message);
    }

    public QueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
