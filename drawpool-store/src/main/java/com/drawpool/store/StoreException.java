package com.drawpool.store;

/** Unchecked failure of the job store (wraps {@link java.sql.SQLException}). */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
