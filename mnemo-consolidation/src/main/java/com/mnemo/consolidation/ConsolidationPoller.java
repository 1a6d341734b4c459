package com.mnemo.consolidation;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.mnemo.core.utils.MnemoUtils;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs {@link ConsolidationWorker#processPendingJobs()} on a fixed delay from a single daemon thread.
 * A failed run is logged and the next one is scheduled as usual.
 */
@Slf4j
public class ConsolidationPoller implements AutoCloseable {
    private final ConsolidationWorker worker;
    private final Duration interval;
    private final ScheduledExecutorService executor;
    private final AtomicReference<ConsolidationRunSummary> lastRun = new AtomicReference<>();
    private ScheduledFuture<?> future;

    public ConsolidationPoller(@NonNull ConsolidationWorker worker, @NonNull Duration interval) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Poll interval must be positive");
        }
        this.worker = worker;
        this.interval = interval;
        this.executor = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                                                                           .setNameFormat("mnemo-consolidation-%d")
                                                                           .setDaemon(true)
                                                                           .build());
    }

    public synchronized void start() {
        if (future != null) {
            log.warn("Consolidation poller already started");
            return;
        }
        future = executor.scheduleWithFixedDelay(this::runOnce, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Polling for consolidation jobs every {} ms", interval.toMillis());
    }

    /**
     * @return Summary of the most recent successful run, null before the first one
     */
    public ConsolidationRunSummary lastRun() {
        return lastRun.get();
    }

    @Override
    public synchronized void close() {
        if (future != null) {
            future.cancel(false);
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private void runOnce() {
        try {
            lastRun.set(worker.processPendingJobs());
        }
        catch (Exception e) {
            log.error("Consolidation run failed: {}", MnemoUtils.errorMessage(e), e);
        }
    }
}
