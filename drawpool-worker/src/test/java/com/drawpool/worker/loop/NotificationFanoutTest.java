package com.drawpool.worker.loop;

import com.drawpool.queue.InMemoryTaskQueue;
import com.drawpool.queue.TaskQueue;
import com.drawpool.worker.JobEvent;
import com.drawpool.worker.NotifyMessage;
import com.drawpool.worker.RecordingConnection;
import com.drawpool.worker.connection.ConnectionRegistry;
import com.drawpool.worker.metrics.DispatchMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NotificationFanoutTest {

    private final TaskQueue<NotifyMessage> notifyQueue = new InMemoryTaskQueue<>();
    private final ConnectionRegistry connections = new ConnectionRegistry();
    private final DispatchMetrics metrics = DispatchMetrics.simple();
    private ScheduledExecutorService scheduler;
    private NotificationFanout fanout;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        fanout = new NotificationFanout(scheduler, Duration.ofMillis(50), notifyQueue, connections, metrics, Duration.ofMillis(10));
    }

    @AfterEach
    void tearDown() {
        fanout.close();
        scheduler.shutdownNow();
    }

    @Test
    void deliversMessageTextToOwnerConnection() {
        RecordingConnection alice = new RecordingConnection();
        connections.connect(1, alice);
        notifyQueue.push(new NotifyMessage(1, 10, JobEvent.RUNNING));
        notifyQueue.push(new NotifyMessage(1, 10, JobEvent.FINISH));

        fanout.runOnce();

        assertEquals(List.of("RUNNING", "FINISH"), alice.getReceived());
        assertEquals(0, notifyQueue.size());
        assertEquals(2.0, metrics.getRegistry().counter("drawpool.notifications", "result", "delivered").count());
    }

    @Test
    void messageForUserWithoutConnectionIsDroppedAndLoopContinues() {
        RecordingConnection bob = new RecordingConnection();
        connections.connect(2, bob);
        notifyQueue.push(new NotifyMessage(99, 11, JobEvent.FAIL));
        notifyQueue.push(new NotifyMessage(2, 12, JobEvent.FINISH));

        fanout.runOnce();

        assertEquals(List.of("FINISH"), bob.getReceived());
        assertEquals(0, notifyQueue.size());
        assertEquals(1.0, metrics.getRegistry().counter("drawpool.notifications", "result", "dropped").count());
    }

    @Test
    void sendFailureIsDroppedAndLoopContinues() {
        connections.connect(3, new RecordingConnection(true));
        RecordingConnection carol = new RecordingConnection();
        connections.connect(4, carol);
        notifyQueue.push(new NotifyMessage(3, 13, JobEvent.RUNNING));
        notifyQueue.push(new NotifyMessage(4, 14, JobEvent.RUNNING));

        fanout.runOnce();

        assertEquals(List.of("RUNNING"), carol.getReceived());
    }

    @Test
    void scheduledFanoutDeliversWithoutManualPasses() throws Exception {
        RecordingConnection dave = new RecordingConnection();
        connections.connect(5, dave);
        fanout.start();
        notifyQueue.push(new NotifyMessage(5, 15, JobEvent.FINISH));

        long deadline = System.currentTimeMillis() + 5_000;
        while (dave.getReceived().isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }

        assertTrue(dave.getReceived().contains("FINISH"));
    }
}
