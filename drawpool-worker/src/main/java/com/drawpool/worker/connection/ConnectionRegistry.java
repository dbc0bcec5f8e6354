package com.drawpool.worker.connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live client connections keyed by user id, at most one per user. The HTTP layer registers
 * sessions here; the notification fan-out looks them up.
 */
public final class ConnectionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final Map<Long, LiveConnection> connections = new ConcurrentHashMap<>();

    /** Registers {@code connection} for the user, replacing any earlier one. */
    public void connect(long userId, LiveConnection connection) {
        LiveConnection previous = connections.put(userId, Objects.requireNonNull(connection, "connection"));
        log.debug("Client connected | userId={} replaced={}", userId, previous != null);
    }

    /**
     * Removes the user's entry only if it is still {@code connection}, so a late disconnect of a
     * replaced session does not drop the newer one.
     */
    public boolean disconnect(long userId, LiveConnection connection) {
        boolean removed = connections.remove(userId, connection);
        log.debug("Client disconnected | userId={} removed={}", userId, removed);
        return removed;
    }

    public Optional<LiveConnection> find(long userId) {
        return Optional.ofNullable(connections.get(userId));
    }

    public int size() {
        return connections.size();
    }
}
