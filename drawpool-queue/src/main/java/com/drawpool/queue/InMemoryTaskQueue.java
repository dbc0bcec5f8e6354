package com.drawpool.queue;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Process-local {@link TaskQueue} over an unbounded {@link LinkedBlockingQueue}. Entries do not
 * survive a restart and are not visible to other processes.
 */
public final class InMemoryTaskQueue<T> implements TaskQueue<T> {

    private final BlockingQueue<T> queue = new LinkedBlockingQueue<>();

    @Override
    public void push(T item) {
        queue.offer(Objects.requireNonNull(item, "item"));
    }

    @Override
    public Optional<T> pop(Duration timeout) {
        try {
            return Optional.ofNullable(queue.poll(Math.max(0, timeout.toMillis()), TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    @Override
    public long size() {
        return queue.size();
    }
}
