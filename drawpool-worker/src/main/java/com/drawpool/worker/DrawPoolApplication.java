package com.drawpool.worker;

import com.drawpool.config.DrawPoolConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drawpool dispatch service entry point. Configuration comes from DRAWPOOL_* environment
 * variables; channels from the file named by DRAWPOOL_CHANNELS_FILE.
 * <p>
 * The runtime's threads are daemons, so the main thread is blocked to keep the JVM alive.
 * A shutdown hook stops loops, workers and pools (e.g. on Ctrl+C).
 */
public final class DrawPoolApplication {

    private static final Logger log = LoggerFactory.getLogger(DrawPoolApplication.class);

    private DrawPoolApplication() {
    }

    public static void main(String[] args) {
        DrawPoolConfig config = DrawPoolConfig.fromEnvironment();
        DrawPoolRuntime runtime = DrawPoolRuntime.fromConfig(config);
        if (!runtime.getPool().hasAvailableWorker()) {
            log.warn("No drawing backend is available; queued tasks will not be processed");
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested; stopping drawpool runtime");
            runtime.close();
        }, "drawpool-shutdown"));

        runtime.start();
        log.info("Drawpool running | queueMode={} channelsFile={} jobTimeout={}",
                config.getQueueMode(), config.getChannelsFile(), config.getJobTimeout());
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Main thread interrupted; shutting down");
            runtime.close();
        }
    }
}
