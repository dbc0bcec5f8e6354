package com.drawpool.store;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for drawing jobs, user balances and power logs.
 * Implementations throw {@link StoreException} on backend failure.
 */
public interface JobStore {

    /** Inserts a new job and returns its assigned id. */
    long create(DrawJob job);

    Optional<DrawJob> findById(long id);

    /** Jobs with progress below 100, including failed ones (-1). */
    List<DrawJob> findUnfinished();

    /** Jobs for which {@link DrawJob#isPendingArchival()} holds. */
    List<DrawJob> findPendingArchival();

    /** Writes task id, channel, hash, prompt, error, progress and both URLs of an existing job. */
    void update(DrawJob job);

    Optional<UserAccount> findUser(long userId);

    /**
     * Removes an expired job and gives its power back, atomically: the row is deleted; only if the
     * delete removed a row is the user's balance incremented by {@code job.getPower()}; only if that
     * increment hit a user is a refund {@link PowerLog} appended. Either all of it happens or none.
     */
    ExpiryResult expire(DrawJob job, String remark);
}
