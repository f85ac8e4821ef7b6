package org.crmjobs.config.database;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * Background database reconnection while running in degraded mode.
 * The attempt returns true once connected, which ends the retries.
 */
public class DBTaskScheduler {
    private static final Logger logger = LoggerFactory.getLogger(DBTaskScheduler.class);

    private static final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "crm-db-reconnect");
        thread.setDaemon(true);
        return thread;
    });

    private static ScheduledFuture<?> future;

    private DBTaskScheduler() {}

    public static synchronized void scheduleReconnect(BooleanSupplier attempt) {
        if (future != null && !future.isDone()) {
            return;
        }
        future = executor.scheduleAtFixedRate(() -> {
            if (attempt.getAsBoolean()) {
                synchronized (DBTaskScheduler.class) {
                    future.cancel(false);
                }
            }
        }, 10, 20, TimeUnit.SECONDS);
    }

    public static void shutdown() {
        executor.shutdownNow();
        logger.info("Database reconnection monitor stopped.");
    }
}
