package org.lsmkv.core.compaction;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Background driver for {@link CompactionEngine}. One cycle per interval on a
 * single daemon thread; a failed cycle is logged and the next tick retries.
 */
public class CompactionManager {
    private static final Logger logger = LoggerFactory.getLogger(CompactionManager.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 60;

    private final CompactionEngine engine;
    private final long intervalMs;
    private final ScheduledExecutorService compactionExecutor;
    private boolean started;

    public CompactionManager(CompactionEngine engine, long intervalMs) {
        this.engine = engine;
        this.intervalMs = intervalMs;
        this.compactionExecutor = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("lsmkv-compaction-%d")
                .setDaemon(true)
                .build());
    }

    /**
     * Schedules the periodic cycle. A non-positive interval disables it.
     */
    public synchronized void start() {
        if (started) {
            return;
        }
        started = true;
        if (intervalMs <= 0) {
            logger.info("background compaction disabled");
            return;
        }
        compactionExecutor.scheduleWithFixedDelay(this::runCycle, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        logger.info("background compaction every {} ms", intervalMs);
    }

    void runCycle() {
        try {
            Optional<CompactionResult> result = engine.compactIfNeeded();
            if (result.isPresent()) {
                logger.debug("background compaction cycle completed: {}", result.get());
            }
        } catch (IOException | RuntimeException e) {
            logger.error("compaction cycle failed, retrying on next tick", e);
        }
    }

    /**
     * Stops future cycles and waits for a running one to finish.
     */
    public void shutdown() {
        compactionExecutor.shutdown();
        try {
            if (!compactionExecutor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("compaction did not stop within {} s, interrupting", SHUTDOWN_TIMEOUT_SECONDS);
                compactionExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            compactionExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
