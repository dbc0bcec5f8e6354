package com.drawpool.worker.loop;

import com.drawpool.queue.TaskQueue;
import com.drawpool.worker.NotifyMessage;
import com.drawpool.worker.connection.ConnectionRegistry;
import com.drawpool.worker.connection.LiveConnection;
import com.drawpool.worker.metrics.DispatchMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Drains the notify queue and forwards each event to the owner's live connection. Events for
 * users without a connection, or whose send fails, are dropped.
 */
public final class NotificationFanout extends PeriodicLoop {

    private static final Logger log = LoggerFactory.getLogger(NotificationFanout.class);

    private final TaskQueue<NotifyMessage> notifyQueue;
    private final ConnectionRegistry connections;
    private final DispatchMetrics metrics;
    private final Duration pollTimeout;

    public NotificationFanout(ScheduledExecutorService scheduler, Duration interval, TaskQueue<NotifyMessage> notifyQueue,
                              ConnectionRegistry connections, DispatchMetrics metrics, Duration pollTimeout) {
        super("notification-fanout", scheduler, interval);
        this.notifyQueue = Objects.requireNonNull(notifyQueue, "notifyQueue");
        this.connections = Objects.requireNonNull(connections, "connections");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.pollTimeout = Objects.requireNonNull(pollTimeout, "pollTimeout");
    }

    @Override
    protected void tick() {
        Optional<NotifyMessage> next;
        while ((next = notifyQueue.pop(pollTimeout)).isPresent()) {
            deliver(next.get());
        }
    }

    /** @return true when the event reached a live connection */
    boolean deliver(NotifyMessage message) {
        Optional<LiveConnection> connection = connections.find(message.getUserId());
        if (connection.isEmpty()) {
            log.debug("Notification dropped, no connection | userId={} jobId={} message={}",
                    message.getUserId(), message.getJobId(), message.getMessage());
            metrics.notificationDropped();
            return false;
        }
        try {
            connection.get().send(message.getMessage().name().getBytes(StandardCharsets.UTF_8));
            metrics.notificationDelivered();
            return true;
        } catch (IOException e) {
            log.warn("Notification dropped, send failed | userId={} jobId={} error={}",
                    message.getUserId(), message.getJobId(), e.getMessage());
            metrics.notificationDropped();
            return false;
        }
    }
}
