package com.drawpool.queue;

import java.time.Duration;
import java.util.Optional;

/**
 * FIFO work queue shared by producers and consumers. Consumers block on {@link #pop(Duration)};
 * each entry is handed to exactly one consumer.
 *
 * @param <T> entry type
 */
public interface TaskQueue<T> {

    /** Appends an entry; never blocks and never refuses. */
    void push(T item);

    /**
     * Removes and returns the head entry, waiting up to {@code timeout} for one to arrive.
     * Returns empty when the timeout expires or the calling thread is interrupted.
     *
     * @throws QueueException when the backing store fails or the entry cannot be decoded
     */
    Optional<T> pop(Duration timeout);

    /** Number of waiting entries. */
    long size();
}
