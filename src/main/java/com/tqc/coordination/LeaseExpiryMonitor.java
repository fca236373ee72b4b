package com.tqc.coordination;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.tqc.cache.RemoteDataCache;
import com.tqc.config.TqcConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically reclaims partition leases whose holder never released them.
 */
@Singleton
public class LeaseExpiryMonitor {

    private static final Logger log = LoggerFactory.getLogger(LeaseExpiryMonitor.class);

    private final RemoteDataCache cache;
    private final TqcConfig config;
    private ScheduledExecutorService scheduler;

    @Inject
    public LeaseExpiryMonitor(RemoteDataCache cache, TqcConfig config) {
        this.cache = cache;
        this.config = config;
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newScheduledThreadPool(1, r -> {
            Thread t = new Thread(r, "tqc-lease-expiry");
            t.setDaemon(true);
            return t;
        });

        scheduler.scheduleAtFixedRate(this::sweep,
                config.getExpiryCheckIntervalMs(), config.getExpiryCheckIntervalMs(), TimeUnit.MILLISECONDS);
        log.info("Lease expiry monitor started, timeout={}ms, interval={}ms",
                config.getPartitionLeaseTimeoutMs(), config.getExpiryCheckIntervalMs());
    }

    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
        }
        scheduler = null;
        log.info("Lease expiry monitor stopped");
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    /**
     * Runs one expiry pass. A failing pass is logged and the next one still runs.
     */
    public void sweep() {
        try {
            cache.handleExpiredPartitions(config.getPartitionLeaseTimeoutMs());
        } catch (RuntimeException e) {
            log.error("Lease expiry sweep failed", e);
        }
    }
}
